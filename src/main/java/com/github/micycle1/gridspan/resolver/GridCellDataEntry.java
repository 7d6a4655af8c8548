package com.github.micycle1.gridspan.resolver;

import java.util.Objects;

/**
 * A requested minimum distance between two grid nodes: the left-hand
 * {@code start} edge of a cell, its right-hand {@code end} edge and the size the
 * cell needs between them.
 */
public final class GridCellDataEntry<N> {

	private final N start;
	private final N end;
	private final double size;

	public GridCellDataEntry(N start, N end, double size) {
		this.start = Objects.requireNonNull(start, "start must not be null");
		this.end = Objects.requireNonNull(end, "end must not be null");
		this.size = size;
	}

	public N getStart() {
		return start;
	}

	public N getEnd() {
		return end;
	}

	public double getSize() {
		return size;
	}

	@Override
	public String toString() {
		return start + "->" + end + ":" + size;
	}
}
