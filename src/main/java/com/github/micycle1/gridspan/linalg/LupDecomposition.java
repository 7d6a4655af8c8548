package com.github.micycle1.gridspan.linalg;

import java.util.Arrays;

import org.ejml.data.DMatrixRMaj;

/**
 * Dense LU decomposition with partial pivoting of a square row-major matrix.
 * <p>
 * L (unit diagonal, strictly lower part) and U (diagonal and upper part) are
 * held together in one buffer; {@code pivot[i]} is the row of the original
 * matrix that ended up in row {@code i}, so that {@code P.A = L.U}.
 * <p>
 * Unlike the guarded factorisations used as preconditioners, a zero pivot is
 * not patched with an epsilon: the matrix is reported as not decomposable
 * instead.
 */
public final class LupDecomposition {

	/**
	 * Pivots no larger than this fraction of the largest matrix entry are treated
	 * as zero (singular or ill-conditioned matrix).
	 */
	public static final double PIVOT_EPSILON = 1e-12;

	private final int n;
	private final double[] lu; // row-major n x n
	private final int[] pivot;

	private LupDecomposition(int n, double[] lu, int[] pivot) {
		this.n = n;
		this.lu = lu;
		this.pivot = pivot;
	}

	/**
	 * Decompose a square matrix. The input array is not modified.
	 *
	 * @param matrix row-major data of length {@code size * size}
	 * @param size   number of rows (and columns)
	 * @return the decomposition, or null if some pivot column is entirely zero
	 *         (within {@link #PIVOT_EPSILON} of the largest entry) after
	 *         elimination, i.e. the matrix is singular or ill-conditioned
	 */
	public static LupDecomposition decompose(double[] matrix, int size) {
		if (size <= 0) {
			throw new IllegalArgumentException("Matrix size must be positive: " + size);
		}
		if (matrix.length != size * size) {
			throw new IllegalArgumentException("Matrix data length " + matrix.length + " does not match size " + size);
		}
		double[] M = matrix.clone();
		double scale = 0.0;
		for (double v : M) {
			if (!Double.isFinite(v)) {
				return null;
			}
			scale = Math.max(scale, Math.abs(v));
		}
		final double eps = PIVOT_EPSILON * scale;
		int[] piv = new int[size];
		for (int i = 0; i < size; i++) {
			piv[i] = i;
		}

		for (int k = 0; k < size - 1; k++) {
			int pivRow = -1;
			double max = eps;
			for (int i = k; i < size; i++) {
				double v = Math.abs(M[i * size + k]);
				if (v > max) {
					max = v;
					pivRow = i;
				}
			}
			if (pivRow < 0) {
				return null;
			}
			if (pivRow != k) {
				for (int j = 0; j < size; j++) {
					double t = M[k * size + j];
					M[k * size + j] = M[pivRow * size + j];
					M[pivRow * size + j] = t;
				}
				int tp = piv[k];
				piv[k] = piv[pivRow];
				piv[pivRow] = tp;
			}
			double p = M[k * size + k];
			for (int i = k + 1; i < size; i++) {
				double lik = M[i * size + k] / p;
				M[i * size + k] = lik;
				for (int j = k + 1; j < size; j++) {
					M[i * size + j] -= lik * M[k * size + j];
				}
			}
		}
		// last column has a single candidate pivot
		if (!(Math.abs(M[size * size - 1]) > eps)) {
			return null;
		}
		return new LupDecomposition(size, M, piv);
	}

	/**
	 * Decompose a square EJML matrix. The input matrix is not modified.
	 */
	public static LupDecomposition decompose(DMatrixRMaj matrix) {
		if (matrix.numRows != matrix.numCols) {
			throw new IllegalArgumentException("Matrix must be square: " + matrix.numRows + "x" + matrix.numCols);
		}
		return decompose(Arrays.copyOf(matrix.data, matrix.numRows * matrix.numCols), matrix.numRows);
	}

	public int getSize() {
		return n;
	}

	/** Copy of the pivot permutation; entry i is the original row now at row i. */
	public int[] getPivot() {
		return pivot.clone();
	}

	/** Copy of the combined L\U buffer, row-major. */
	public double[] getData() {
		return lu.clone();
	}

	/** The lower factor, with ones on the diagonal and zeros above it. */
	public double[] getLower() {
		double[] L = new double[n * n];
		for (int r = 0; r < n; r++) {
			for (int c = 0; c < r; c++) {
				L[r * n + c] = lu[r * n + c];
			}
			L[r * n + r] = 1.0;
		}
		return L;
	}

	/** The upper factor, with zeros below the diagonal. */
	public double[] getUpper() {
		double[] U = new double[n * n];
		for (int r = 0; r < n; r++) {
			for (int c = r; c < n; c++) {
				U[r * n + c] = lu[r * n + c];
			}
		}
		return U;
	}

	/**
	 * Multiply the factors back together and undo the row permutation; the result
	 * equals the decomposed matrix up to rounding.
	 */
	public double[] reconstruct() {
		double[] A = new double[n * n];
		for (int r = 0; r < n; r++) {
			int dst = pivot[r];
			for (int c = 0; c < n; c++) {
				// (L.U)[r][c] with L unit lower and U upper
				double sum = 0.0;
				int kmax = Math.min(r, c);
				for (int k = 0; k < kmax; k++) {
					sum += lu[r * n + k] * lu[k * n + c];
				}
				if (r <= c) {
					sum += lu[r * n + c];
				} else {
					sum += lu[r * n + c] * lu[c * n + c];
				}
				A[dst * n + c] = sum;
			}
		}
		return A;
	}

	/**
	 * Solve {@code A.x = b} in place.
	 *
	 * @param x on entry the right-hand side b, on exit the solution
	 * @return false if U has a zero on its diagonal
	 */
	public boolean solve(double[] x) {
		if (x.length != n) {
			throw new IllegalArgumentException("Right-hand side length " + x.length + " does not match size " + n);
		}
		// apply pivots
		double[] rhs = x.clone();
		for (int i = 0; i < n; i++) {
			x[i] = rhs[pivot[i]];
		}
		return substitute(x);
	}

	/**
	 * Write the inverse of the decomposed matrix into {@code result} (row-major,
	 * length {@code n * n}).
	 *
	 * @return false if the inverse cannot be formed; result is then undefined
	 */
	public boolean invert(double[] result) {
		if (result.length != n * n) {
			throw new IllegalArgumentException("Result length " + result.length + " does not match size " + n);
		}
		return invertInto(result);
	}

	/**
	 * Write the inverse into an EJML matrix, reshaping it to n x n.
	 */
	public boolean invert(DMatrixRMaj result) {
		result.reshape(n, n);
		return invertInto(result.data);
	}

	// dst may be longer than n * n (EJML keeps spare capacity after reshape)
	private boolean invertInto(double[] dst) {
		double[] col = new double[n];
		for (int j = 0; j < n; j++) {
			// column j of the inverse solves A.x = e_j, i.e. L.U.x = P.e_j
			for (int i = 0; i < n; i++) {
				col[i] = pivot[i] == j ? 1.0 : 0.0;
			}
			if (!substitute(col)) {
				return false;
			}
			for (int i = 0; i < n; i++) {
				dst[i * n + j] = col[i];
			}
		}
		return true;
	}

	// forward (unit L) then backward (U) substitution on an already permuted rhs
	private boolean substitute(double[] x) {
		for (int i = 0; i < n; i++) {
			double sum = x[i];
			for (int j = 0; j < i; j++) {
				sum -= lu[i * n + j] * x[j];
			}
			x[i] = sum;
		}
		for (int i = n - 1; i >= 0; i--) {
			double sum = x[i];
			for (int j = i + 1; j < n; j++) {
				sum -= lu[i * n + j] * x[j];
			}
			double d = lu[i * n + i];
			if (d == 0.0) {
				return false;
			}
			x[i] = sum / d;
		}
		return true;
	}
}
