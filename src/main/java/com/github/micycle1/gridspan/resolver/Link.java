package com.github.micycle1.gridspan.resolver;

/**
 * A link between two grid nodes with a minimum size and an optional growth
 * factor. The larger the growth, the more readily the link stretches; a growth
 * of zero makes it rigid. Without a growth factor the link only bounds the
 * minimum-size sweep.
 */
public final class Link<N> {

	private final N start;
	private final N end;
	private double minSize;
	private Double growth; // null: not set

	Link(N start, N end, double minSize) {
		this.start = start;
		this.end = end;
		this.minSize = minSize;
	}

	public N getStart() {
		return start;
	}

	public N getEnd() {
		return end;
	}

	public double getMinSize() {
		return minSize;
	}

	/** The growth factor, or null if none has been set. */
	public Double getGrowth() {
		return growth;
	}

	/** True if the link takes part in the spring system. */
	public boolean isElastic() {
		return growth != null && growth > 0.0;
	}

	/** True if the growth was set to zero (or below). */
	public boolean isRigid() {
		return growth != null && growth <= 0.0;
	}

	/** Make the link at least {@code size} long. */
	void union(double size) {
		if (size > minSize) {
			minSize = size;
		}
	}

	void setGrowth(double growth) {
		this.growth = growth;
	}

	@Override
	public String toString() {
		return start + "->" + end + ":" + minSize + (growth == null ? "" : " +" + growth);
	}
}
