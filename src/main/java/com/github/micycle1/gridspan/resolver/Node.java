package com.github.micycle1.gridspan.resolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of one grid dimension; in essence a border between cells.
 * <p>
 * Position precedence is forced, then placed, then derived. A forced position is
 * a hard pin supplied by the caller and survives
 * {@link Resolver#clearNodePlacements()}; a placed position is assigned during
 * boundary placement; the derived position comes from the minimum-size sweep or
 * from the energy solve.
 */
public final class Node<N> {

	private final int index;
	private Double forcedPosition;
	private Double placedPosition;
	private Double position;
	// ids of the starts of links for which this node is the end
	private final List<N> linkStarts = new ArrayList<>();
	// ids of the ends of links for which this node is the start
	private final List<N> linkEnds = new ArrayList<>();

	Node(int index) {
		this.index = index;
	}

	/** Index of this node in the resolver's node list (and equation set). */
	public int getIndex() {
		return index;
	}

	void addStartpoint(N start) {
		linkStarts.add(start);
	}

	void addEndpoint(N end) {
		linkEnds.add(end);
	}

	/** Predecessors: starts of links that end at this node. */
	public List<N> getLinkStarts() {
		return Collections.unmodifiableList(linkStarts);
	}

	/** Successors: ends of links that start at this node. */
	public List<N> getLinkEnds() {
		return Collections.unmodifiableList(linkEnds);
	}

	public Double getForcedPosition() {
		return forcedPosition;
	}

	void setForcedPosition(Double forcedPosition) {
		this.forcedPosition = forcedPosition;
	}

	public Double getPlacedPosition() {
		return placedPosition;
	}

	void setPlacedPosition(Double placedPosition) {
		this.placedPosition = placedPosition;
	}

	/** The derived position (sweep or solve), or null. */
	public Double getDerivedPosition() {
		return position;
	}

	void setDerivedPosition(Double position) {
		this.position = position;
	}

	/** True if the node is forced or placed. */
	public boolean isPlaced() {
		return forcedPosition != null || placedPosition != null;
	}

	public boolean hasPosition() {
		return isPlaced() || position != null;
	}

	/**
	 * The forced position if any, else the placed position, else the derived one.
	 *
	 * @throws IllegalStateException if the node has no position at all
	 */
	public double getPosition() {
		if (forcedPosition != null) {
			return forcedPosition;
		}
		if (placedPosition != null) {
			return placedPosition;
		}
		if (position == null) {
			throw new IllegalStateException("Node " + index + " has not been positioned");
		}
		return position;
	}

	@Override
	public String toString() {
		return "Node{" + "index=" + index + ", forced=" + forcedPosition + ", placed=" + placedPosition + ", position=" + position
				+ ", starts=" + linkStarts + ", ends=" + linkEnds + "}";
	}
}
