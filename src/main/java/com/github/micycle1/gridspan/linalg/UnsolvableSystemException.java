package com.github.micycle1.gridspan.linalg;

/**
 * Signals that a linear system has no unique solution: its matrix is singular
 * or ill-conditioned, or its pinned values contradict each other.
 */
public class UnsolvableSystemException extends Exception {

	private static final long serialVersionUID = 1L;

	public UnsolvableSystemException(String message) {
		super(message);
	}
}
