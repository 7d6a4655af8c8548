package com.github.micycle1.gridspan;

import java.util.Objects;

/**
 * One raw constraint on a grid dimension, as supplied by the caller: a cell
 * width, a growth factor between two grid lines, or an absolute placement of one
 * grid line.
 */
public final class GridData<N> {

	public enum Kind {
		/** Minimum distance between start and end. */
		WIDTH,
		/** Elasticity of the gap between start and end. */
		GROWTH,
		/** Absolute position of the start node; end is unused. */
		PLACE
	}

	private final Kind kind;
	private final N start;
	private final N end;
	private final double value;

	private GridData(Kind kind, N start, N end, double value) {
		this.kind = kind;
		this.start = Objects.requireNonNull(start, "start must not be null");
		this.end = end;
		this.value = value;
	}

	public static <N> GridData<N> width(N start, N end, double size) {
		return new GridData<>(Kind.WIDTH, start, Objects.requireNonNull(end, "end must not be null"), size);
	}

	public static <N> GridData<N> growth(N start, N end, double factor) {
		return new GridData<>(Kind.GROWTH, start, Objects.requireNonNull(end, "end must not be null"), factor);
	}

	public static <N> GridData<N> place(N node, double position) {
		return new GridData<>(Kind.PLACE, node, null, position);
	}

	public Kind getKind() {
		return kind;
	}

	public N getStart() {
		return start;
	}

	/** The end node, or null for {@link Kind#PLACE}. */
	public N getEnd() {
		return end;
	}

	/** Size, growth factor or position, depending on the kind. */
	public double getValue() {
		return value;
	}

	@Override
	public String toString() {
		switch (kind) {
			case WIDTH:
				return "[" + start + "->" + end + ":" + value + "]";
			case GROWTH:
				return "[" + start + "->" + end + ":+" + value + "]";
			default:
				return "[" + start + "@" + value + "]";
		}
	}
}
