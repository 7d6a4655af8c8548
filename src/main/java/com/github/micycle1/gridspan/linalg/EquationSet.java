package com.github.micycle1.gridspan.linalg;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * <p>
 * A dense set of linear equations describing the minimum-energy state of a
 * network of ideal springs along one axis.
 * </p>
 *
 * <p>
 * A spring with ends at positions {@code a} and {@code b}, natural length
 * {@code L} and elasticity {@code g} stores the Hooke's-law energy
 * {@code (b - a - L)^2 / g}. Its contribution to dE/da is proportional to
 * {@code (a - b + L) / g} and to dE/db to {@code (b - a - L) / g}. The energy of
 * the whole network is minimal where every derivative is zero, which is a linear
 * system in the positions: one row per position, built up by
 * {@link #addGrowthLink(int, int, double, double)}.
 * </p>
 *
 * <p>
 * Springs alone are translation invariant (moving every end by the same amount
 * costs nothing), so at least one position must be pinned with
 * {@link #forceValue(int, double)}; pinning a second one stretches the network
 * between the two. Rows can also be tied to another position by a fixed offset
 * ({@link #tieValue(int, int, double)}), which is how rigid groups of positions
 * are expressed.
 * </p>
 *
 * <p>
 * The system is solved by explicit inversion through {@link LupDecomposition};
 * sizes are expected to be diagram node counts (tens to low hundreds).
 * </p>
 */
public class EquationSet {

	private final int size;
	private DMatrixRMaj matrix; // coefficients; replaced by the inverse in invert()
	private DMatrixRMaj results; // right-hand side; replaced by the solution in solve()

	public EquationSet(int size) {
		if (size <= 0) {
			throw new IllegalArgumentException("Equation set size must be positive: " + size);
		}
		this.size = size;
		this.matrix = new DMatrixRMaj(size, size);
		this.results = new DMatrixRMaj(size, 1);
	}

	public int getSize() {
		return size;
	}

	/**
	 * Add a spring of natural {@code length} and elasticity {@code growth} between
	 * positions {@code start} and {@code end}. The larger the growth, the weaker
	 * the spring.
	 */
	public void addGrowthLink(int start, int end, double length, double growth) {
		checkIndex(start);
		checkIndex(end);
		if (!(growth > 0.0) || Double.isInfinite(growth)) {
			throw new IllegalArgumentException("Growth must be finite and positive: " + growth);
		}
		final double k = 1.0 / growth;

		matrix.add(start, start, k);
		matrix.add(start, end, -k);
		results.add(start, 0, -k * length);

		matrix.add(end, start, -k);
		matrix.add(end, end, k);
		results.add(end, 0, k * length);
	}

	/**
	 * Force position {@code n} to {@code value}: its row becomes 0 .. 1 .. 0 with
	 * the given result.
	 */
	public void forceValue(int n, double value) {
		checkIndex(n);
		clearRow(n);
		matrix.set(n, n, 1.0);
		results.set(n, 0, value);
	}

	/**
	 * Tie position {@code n} to position {@code anchor}: its row becomes
	 * {@code x[n] - x[anchor] = offset}.
	 */
	public void tieValue(int n, int anchor, double offset) {
		checkIndex(n);
		checkIndex(anchor);
		if (n == anchor) {
			throw new IllegalArgumentException("Cannot tie position " + n + " to itself");
		}
		clearRow(n);
		matrix.set(n, n, 1.0);
		matrix.set(n, anchor, -1.0);
		results.set(n, 0, offset);
	}

	/**
	 * Add row {@code from} (coefficients and result) into row {@code into}. Row
	 * {@code from} itself is left unchanged.
	 */
	public void mergeRow(int from, int into) {
		checkIndex(from);
		checkIndex(into);
		for (int c = 0; c < size; c++) {
			matrix.add(into, c, matrix.get(from, c));
		}
		results.add(into, 0, results.get(from, 0));
	}

	public boolean rowIsZero(int n) {
		checkIndex(n);
		for (int c = 0; c < size; c++) {
			if (matrix.get(n, c) != 0.0) {
				return false;
			}
		}
		return true;
	}

	public boolean columnIsZero(int n) {
		checkIndex(n);
		for (int r = 0; r < size; r++) {
			if (matrix.get(r, n) != 0.0) {
				return false;
			}
		}
		return true;
	}

	/** Coefficient at (row, col); after {@link #invert()} this reads the inverse. */
	public double get(int row, int col) {
		return matrix.get(row, col);
	}

	/** Right-hand side of a row; after {@link #solve()} this is the solved value. */
	public double getRhs(int row) {
		return results.get(row, 0);
	}

	/**
	 * Replace the coefficient matrix by its inverse.
	 *
	 * @throws UnsolvableSystemException if the matrix cannot be inverted; the
	 *                                   equations are then over- or
	 *                                   under-constrained and the set is left
	 *                                   unchanged
	 */
	public void invert() throws UnsolvableSystemException {
		LupDecomposition lup = LupDecomposition.decompose(matrix);
		if (lup == null) {
			throw new UnsolvableSystemException("Failed to decompose, matrix of size " + size + " is not invertible");
		}
		DMatrixRMaj inverse = new DMatrixRMaj(size, size);
		if (!lup.invert(inverse)) {
			throw new UnsolvableSystemException("Failed to invert after decomposition, matrix of size " + size + " is not invertible");
		}
		matrix = inverse;
	}

	/**
	 * Solve the equation set. On success the results hold the solved positions.
	 *
	 * @throws UnsolvableSystemException if the system has no unique solution
	 */
	public void solve() throws UnsolvableSystemException {
		invert();
		DMatrixRMaj solution = new DMatrixRMaj(size, 1);
		CommonOps_DDRM.mult(matrix, results, solution);
		for (int i = 0; i < size; i++) {
			if (!Double.isFinite(solution.get(i, 0))) {
				throw new UnsolvableSystemException("Solution for position " + i + " is not finite");
			}
		}
		results = solution;
	}

	/** Result for position {@code i}. Only meaningful after {@link #solve()}. */
	public double getResult(int i) {
		checkIndex(i);
		return results.get(i, 0);
	}

	/** Copy of the results; index i holds position i. */
	public double[] getResults() {
		double[] r = new double[size];
		for (int i = 0; i < size; i++) {
			r[i] = results.get(i, 0);
		}
		return r;
	}

	private void clearRow(int n) {
		for (int c = 0; c < size; c++) {
			matrix.set(n, c, 0.0);
		}
	}

	private void checkIndex(int n) {
		if (n < 0 || n >= size) {
			throw new IndexOutOfBoundsException("Position " + n + " outside equation set of size " + size);
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < size; i++) {
			sb.append('|');
			for (int j = 0; j < size; j++) {
				sb.append(String.format(" %8.4g", matrix.get(i, j)));
			}
			sb.append(String.format("|  (%8.4g)%n", results.get(i, 0)));
		}
		return sb.toString();
	}
}
