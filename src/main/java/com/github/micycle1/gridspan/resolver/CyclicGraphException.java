package com.github.micycle1.gridspan.resolver;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when the links of a grid dimension form a cycle, so that no resolution
 * order covering every node exists.
 */
public class CyclicGraphException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final transient List<?> unresolved;

	public CyclicGraphException(List<?> unresolved, int nodeCount) {
		super("Cycle detected! Resolved " + (nodeCount - unresolved.size()) + " of " + nodeCount + " nodes; unresolved: " + unresolved);
		this.unresolved = Collections.unmodifiableList(unresolved);
	}

	/** Ids of the nodes that could not be placed in the resolution order. */
	public List<?> getUnresolved() {
		return unresolved;
	}
}
