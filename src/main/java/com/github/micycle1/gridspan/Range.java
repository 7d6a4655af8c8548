package com.github.micycle1.gridspan;

/**
 * An immutable closed interval {@code [min, max]} on one axis.
 * <p>
 * The empty range ({@link #none()}) has {@code min > max}; it is the identity of
 * {@link #union(Range)} and {@link #include(double)}.
 */
public final class Range {

	private static final Range NONE = new Range(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);

	private final double min;
	private final double max;

	public Range(double min, double max) {
		this.min = min;
		this.max = max;
	}

	public static Range none() {
		return NONE;
	}

	/** The range spanning two points in either order. */
	public static Range ofPoints(double a, double b) {
		return new Range(Math.min(a, b), Math.max(a, b));
	}

	public boolean isNone() {
		return min > max;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	/** Extent of the range; 0 when empty. */
	public double size() {
		return isNone() ? 0 : max - min;
	}

	/**
	 * @throws IllegalStateException if the range is empty
	 */
	public double center() {
		if (isNone()) {
			throw new IllegalStateException("Empty range has no center");
		}
		return (min + max) / 2;
	}

	public boolean contains(double x) {
		return x >= min && x <= max;
	}

	public Range include(double x) {
		if (isNone()) {
			return new Range(x, x);
		}
		if (contains(x)) {
			return this;
		}
		return new Range(Math.min(min, x), Math.max(max, x));
	}

	public Range union(Range other) {
		if (other.isNone()) {
			return this;
		}
		if (isNone()) {
			return other;
		}
		return new Range(Math.min(min, other.min), Math.max(max, other.max));
	}

	/** The overlap of the two ranges, or {@link #none()} if they are disjoint. */
	public Range intersect(Range other) {
		double lo = Math.max(min, other.min);
		double hi = Math.min(max, other.max);
		return lo > hi ? NONE : new Range(lo, hi);
	}

	/** Grow both ends outwards by {@code v}. */
	public Range enlarge(double v) {
		return isNone() ? this : new Range(min - v, max + v);
	}

	/** Shrink both ends inwards by {@code v}; may produce an empty range. */
	public Range reduce(double v) {
		if (isNone()) {
			return this;
		}
		double lo = min + v;
		double hi = max - v;
		return lo > hi ? NONE : new Range(lo, hi);
	}

	public Range plus(double delta) {
		return isNone() ? this : new Range(min + delta, max + delta);
	}

	public Range minus(double delta) {
		return plus(-delta);
	}

	/** Scale both ends about the origin; a negative factor flips the range. */
	public Range scale(double factor) {
		return isNone() ? this : ofPoints(min * factor, max * factor);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Range)) {
			return false;
		}
		Range r = (Range) o;
		if (isNone() || r.isNone()) {
			return isNone() && r.isNone();
		}
		return Double.compare(min, r.min) == 0 && Double.compare(max, r.max) == 0;
	}

	@Override
	public int hashCode() {
		if (isNone()) {
			return 0;
		}
		return 31 * Double.hashCode(min) + Double.hashCode(max);
	}

	@Override
	public String toString() {
		return isNone() ? "(none)" : "(" + min + " to " + max + ")";
	}
}
