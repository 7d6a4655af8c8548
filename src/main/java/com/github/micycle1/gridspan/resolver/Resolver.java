package com.github.micycle1.gridspan.resolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.micycle1.gridspan.Range;
import com.github.micycle1.gridspan.linalg.EquationSet;
import com.github.micycle1.gridspan.linalg.UnsolvableSystemException;

/**
 * <p>
 * Resolves the node positions of one grid dimension from its link data.
 * </p>
 *
 * <p>
 * What:
 * </p>
 * <ul>
 * <li>Builds the node/link graph from cell-data entries: one {@link Link} per
 * distinct (start, end) pair, whose minimum size is the largest size declared
 * for that pair, and one {@link Node} per distinct id.</li>
 * <li>Computes a resolution order (Kahn's algorithm) in which every node comes
 * after all the starts of links ending at it; a cycle is an error.</li>
 * <li>Assigns minimum positions by a forward sweep along that order (longest
 * path from the roots).</li>
 * <li>Refines positions by minimising the energy of the elastic links, with the
 * edge nodes pinned to a requested boundary.</li>
 * </ul>
 *
 * <p>
 * Nodes and links are stored in maps keyed by node id, and adjacency is held as
 * lists of ids, so the whole graph is cheap to rebuild for every layout pass.
 * Iteration order is the order in which ids were first seen, which keeps every
 * result deterministic.
 * </p>
 *
 * <p>
 * In the energy system a link with a positive growth factor is a spring, and a
 * link whose growth was set to zero is rigid: nodes joined by rigid links move
 * as one block and keep the gaps of the minimum-size sweep. A link without any
 * growth takes no part, unless one of its ends would otherwise float free of
 * every pin; it then holds its ends at their swept gap.
 * </p>
 *
 * <p>
 * The class is not thread-safe.
 * </p>
 */
public class Resolver<N> {

	private static final Logger log = LogManager.getLogger(Resolver.class);

	/** Relative tolerance when checking that two pins of a rigid group agree. */
	public static final double PIN_TOLERANCE = 1e-7;

	// all node ids, in index order
	private final List<N> nodeIds = new ArrayList<>();
	private final Map<N, Node<N>> nodes = new LinkedHashMap<>();
	// start id -> end id -> link
	private final Map<N, Map<N, Link<N>>> links = new LinkedHashMap<>();
	// ids that are never the end of a link
	private final List<N> roots = new ArrayList<>();
	private final List<N> resolutionOrder;

	/**
	 * Build the graph for a set of cell-data entries and compute its resolution
	 * order.
	 *
	 * @throws IllegalArgumentException if an entry links a node to itself
	 * @throws CyclicGraphException     if the links form a cycle
	 */
	public Resolver(Iterable<GridCellDataEntry<N>> entries) {
		for (GridCellDataEntry<N> entry : entries) {
			N s = entry.getStart();
			N e = entry.getEnd();
			if (s.equals(e)) {
				throw new IllegalArgumentException("Link start and end must differ: " + entry);
			}
			Map<N, Link<N>> fromStart = links.computeIfAbsent(s, k -> new LinkedHashMap<>());
			Link<N> link = fromStart.get(e);
			if (link != null) {
				link.union(entry.getSize());
				continue;
			}
			fromStart.put(e, new Link<>(s, e, entry.getSize()));
			nodeFor(s).addEndpoint(e);
			nodeFor(e).addStartpoint(s);
		}
		for (N id : nodeIds) {
			if (nodes.get(id).getLinkStarts().isEmpty()) {
				roots.add(id);
			}
		}
		resolutionOrder = createResolutionOrder();
		log.debug("Resolver built with {} nodes, roots {}, resolution order {}", nodeIds.size(), roots, resolutionOrder);
	}

	private Node<N> nodeFor(N id) {
		Node<N> node = nodes.get(id);
		if (node == null) {
			node = new Node<>(nodeIds.size());
			nodes.put(id, node);
			nodeIds.add(id);
		}
		return node;
	}

	// Kahn's algorithm over the predecessor counts
	private List<N> createResolutionOrder() {
		Map<N, Integer> unresolved = new HashMap<>(nodeIds.size() * 2);
		Deque<N> queue = new ArrayDeque<>();
		for (N id : nodeIds) {
			int count = nodes.get(id).getLinkStarts().size();
			unresolved.put(id, count);
			if (count == 0) {
				queue.add(id);
			}
		}
		List<N> order = new ArrayList<>(nodeIds.size());
		while (!queue.isEmpty()) {
			N id = queue.poll();
			order.add(id);
			for (N e : nodes.get(id).getLinkEnds()) {
				int count = unresolved.merge(e, -1, Integer::sum);
				if (count == 0) {
					queue.add(e);
				}
			}
		}
		if (order.size() != nodeIds.size()) {
			List<N> residual = new ArrayList<>();
			for (N id : nodeIds) {
				if (unresolved.get(id) > 0) {
					residual.add(id);
				}
			}
			throw new CyclicGraphException(residual, nodeIds.size());
		}
		return Collections.unmodifiableList(order);
	}

	public boolean hasNode(N id) {
		return nodes.containsKey(id);
	}

	public int getNodeCount() {
		return nodeIds.size();
	}

	/** Node ids in index order. */
	public List<N> getNodeIds() {
		return Collections.unmodifiableList(nodeIds);
	}

	/**
	 * @throws IllegalArgumentException if the id is not a node of this graph
	 */
	public Node<N> getNode(N id) {
		Node<N> node = nodes.get(id);
		if (node == null) {
			throw new IllegalArgumentException("Unknown grid node: " + id);
		}
		return node;
	}

	public List<N> getRoots() {
		return Collections.unmodifiableList(roots);
	}

	public List<N> getResolutionOrder() {
		return resolutionOrder;
	}

	/** The link from start to end, or null if there is none. */
	public Link<N> getLink(N start, N end) {
		Map<N, Link<N>> fromStart = links.get(start);
		return fromStart == null ? null : fromStart.get(end);
	}

	public List<Link<N>> getLinks() {
		List<Link<N>> all = new ArrayList<>();
		for (Map<N, Link<N>> fromStart : links.values()) {
			all.addAll(fromStart.values());
		}
		return all;
	}

	public boolean hasElasticLinks() {
		for (Map<N, Link<N>> fromStart : links.values()) {
			for (Link<N> link : fromStart.values()) {
				if (link.isElastic()) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Set the growth of every link that lies on some path from {@code start} to
	 * {@code end}; for a pair joined by a single link this is just that link.
	 * Later calls override the growth set by earlier ones.
	 *
	 * @return the number of links updated; 0 (with a warning) if either node is
	 *         absent or no path joins them
	 */
	public int setGrowthData(N start, N end, double growth) {
		if (Objects.equals(start, end)) {
			throw new IllegalArgumentException("Growth start and end must differ: " + start);
		}
		if (!hasNode(start) || !hasNode(end)) {
			log.warn("Ignoring growth {} between {} and {}: node not in the grid", growth, start, end);
			return 0;
		}
		Set<N> between = reachableNodes(start);
		between.retainAll(predecessorNodes(end));
		int updated = 0;
		for (N id : between) {
			for (N e : nodes.get(id).getLinkEnds()) {
				if (between.contains(e)) {
					getLink(id, e).setGrowth(growth);
					updated++;
				}
			}
		}
		if (updated == 0) {
			log.warn("Ignoring growth {} between {} and {}: no link joins them", growth, start, end);
		} else {
			log.debug("Growth {} applied to {} links between {} and {}", growth, updated, start, end);
		}
		return updated;
	}

	// ids reachable from id by following links forwards (including id)
	private Set<N> reachableNodes(N id) {
		Set<N> result = new HashSet<>();
		Deque<N> toDo = new ArrayDeque<>();
		result.add(id);
		toDo.push(id);
		while (!toDo.isEmpty()) {
			for (N e : nodes.get(toDo.pop()).getLinkEnds()) {
				if (result.add(e)) {
					toDo.push(e);
				}
			}
		}
		return result;
	}

	// ids from which id can be reached (including id)
	private Set<N> predecessorNodes(N id) {
		Set<N> result = new HashSet<>();
		Deque<N> toDo = new ArrayDeque<>();
		result.add(id);
		toDo.push(id);
		while (!toDo.isEmpty()) {
			for (N s : nodes.get(toDo.pop()).getLinkStarts()) {
				if (result.add(s)) {
					toDo.push(s);
				}
			}
		}
		return result;
	}

	/** Force (pin) a node to a position; null releases the pin. */
	public void forceNode(N id, Double position) {
		getNode(id).setForcedPosition(position);
	}

	/** Place a node at a boundary position; null clears the placement. */
	public void placeNode(N id, Double position) {
		getNode(id).setPlacedPosition(position);
	}

	/** Reset placed and derived positions; forced positions are kept. */
	public void clearNodePlacements() {
		for (Node<N> node : nodes.values()) {
			node.setPlacedPosition(null);
			node.setDerivedPosition(null);
		}
	}

	/**
	 * Assign the minimum position of every node, walking the resolution order.
	 * Forced and placed nodes keep their position, roots are put at
	 * {@code anchor}, and any other node is put as far left as all the links
	 * ending at it allow.
	 */
	public void assignMinPositions(double anchor) {
		for (Node<N> node : nodes.values()) {
			node.setDerivedPosition(null);
		}
		for (N id : resolutionOrder) {
			Node<N> node = nodes.get(id);
			double p;
			if (node.isPlaced()) {
				p = node.getPosition();
			} else if (node.getLinkStarts().isEmpty()) {
				p = anchor;
			} else {
				p = Double.NEGATIVE_INFINITY;
				for (N s : node.getLinkStarts()) {
					p = Math.max(p, nodes.get(s).getPosition() + getLink(s, id).getMinSize());
				}
			}
			node.setDerivedPosition(p);
		}
	}

	/** Bounds of all positioned nodes, or {@link Range#none()} if there are none. */
	public Range findBounds() {
		Range bounds = Range.none();
		for (Node<N> node : nodes.values()) {
			if (node.hasPosition()) {
				bounds = bounds.include(node.getPosition());
			}
		}
		return bounds;
	}

	public double size() {
		return findBounds().size();
	}

	/**
	 * Find the nodes at the low and high extremes of the current positions.
	 * <p>
	 * A node within {@code tolerance} of both extremes (all positions coincide)
	 * is a low edge if it is a root, a high edge if no link starts at it, and
	 * neither otherwise.
	 */
	public EdgeNodes<N> getEdgeNodes(double tolerance) {
		List<N> low = new ArrayList<>();
		List<N> high = new ArrayList<>();
		Range bounds = findBounds();
		if (bounds.isNone()) {
			return new EdgeNodes<>(low, high);
		}
		for (N id : nodeIds) {
			Node<N> node = nodes.get(id);
			if (!node.hasPosition()) {
				continue;
			}
			double p = node.getPosition();
			boolean atMin = Math.abs(p - bounds.getMin()) <= tolerance;
			boolean atMax = Math.abs(p - bounds.getMax()) <= tolerance;
			if (atMin && atMax) {
				if (node.getLinkStarts().isEmpty()) {
					low.add(id);
				} else if (node.getLinkEnds().isEmpty()) {
					high.add(id);
				}
			} else if (atMin) {
				low.add(id);
			} else if (atMax) {
				high.add(id);
			}
		}
		return new EdgeNodes<>(low, high);
	}

	/**
	 * Place the low edge nodes at {@code min} and the high edge nodes at
	 * {@code max}; a null bound leaves that edge unplaced.
	 */
	public void placeEdgeNodes(EdgeNodes<N> edgeNodes, Double min, Double max) {
		if (min != null) {
			for (N id : edgeNodes.getLow()) {
				placeNode(id, min);
			}
		}
		if (max != null) {
			for (N id : edgeNodes.getHigh()) {
				placeNode(id, max);
			}
		}
		log.debug("Placed edge nodes {} at {} and {} at {}", edgeNodes.getLow(), min, edgeNodes.getHigh(), max);
	}

	/**
	 * Build the equation set whose solution minimises the energy of the elastic
	 * links, given the current (swept) positions and pins.
	 * <ul>
	 * <li>every elastic link joining two different rigid groups is a spring;</li>
	 * <li>the rows of each rigid group are summed into the row of its anchor, and
	 * every other member is tied to the anchor by its swept offset;</li>
	 * <li>a group containing a forced or placed node is pinned there;</li>
	 * <li>a set of groups joined by springs but holding no pin is held with its
	 * first group at its swept position.</li>
	 * </ul>
	 *
	 * @throws UnsolvableSystemException if two pins of one rigid group disagree
	 *                                   with the group's fixed offsets
	 */
	public EquationSet createEnergyMatrix() throws UnsolvableSystemException {
		final int n = nodeIds.size();
		EquationSet eqns = new EquationSet(n);

		int[] group = rigidGroups();
		// springs join groups into components; each component needs a pin
		int[] component = group.clone();
		for (Link<N> link : getLinks()) {
			if (!link.isElastic()) {
				continue;
			}
			int s = nodes.get(link.getStart()).getIndex();
			int e = nodes.get(link.getEnd()).getIndex();
			if (group[s] != group[e]) {
				eqns.addGrowthLink(s, e, link.getMinSize(), link.getGrowth());
				union(component, s, e);
			}
		}

		Map<Integer, List<Integer>> members = new LinkedHashMap<>();
		for (int i = 0; i < n; i++) {
			members.computeIfAbsent(group[i], k -> new ArrayList<>()).add(i);
		}
		Set<Integer> pinnedComponents = new HashSet<>();
		List<Integer> unpinnedAnchors = new ArrayList<>();
		for (List<Integer> g : members.values()) {
			int anchor = anchorOf(g);
			Node<N> anchorNode = nodes.get(nodeIds.get(anchor));
			double anchorSwept = sweptPosition(anchorNode);
			for (int m : g) {
				if (m != anchor) {
					eqns.mergeRow(m, anchor);
				}
			}
			for (int m : g) {
				if (m == anchor) {
					continue;
				}
				Node<N> node = nodes.get(nodeIds.get(m));
				double offset = sweptPosition(node) - anchorSwept;
				if (node.isPlaced()) {
					double expected = anchorNode.getPosition() + offset;
					double pin = node.getPosition();
					if (Math.abs(pin - expected) > PIN_TOLERANCE * Math.max(1.0, Math.max(Math.abs(pin), Math.abs(expected)))) {
						throw new UnsolvableSystemException("Nodes " + nodeIds.get(anchor) + " and " + nodeIds.get(m)
								+ " are rigidly linked but pinned " + (pin - anchorNode.getPosition()) + " apart instead of " + offset);
					}
				}
				eqns.tieValue(m, anchor, offset);
			}
			if (anchorNode.isPlaced()) {
				eqns.forceValue(anchor, anchorNode.getPosition());
				pinnedComponents.add(find(component, anchor));
			} else {
				unpinnedAnchors.add(anchor);
			}
		}
		for (int anchor : unpinnedAnchors) {
			if (pinnedComponents.add(find(component, anchor))) {
				double swept = sweptPosition(nodes.get(nodeIds.get(anchor)));
				log.debug("Node {} is not connected to any pin; held at {}", nodeIds.get(anchor), swept);
				eqns.forceValue(anchor, swept);
			}
		}
		return eqns;
	}

	/*
	 * Union-find over the links that hold their ends at the swept gap: links with
	 * a growth of zero, and links without growth that have an end whose spring
	 * component holds no pin. Returns the group id of every node index.
	 */
	private int[] rigidGroups() {
		final int n = nodeIds.size();
		int[] rigid = identity(n);
		int[] springs = identity(n);
		for (Link<N> link : getLinks()) {
			if (link.isRigid()) {
				union(rigid, indexOf(link.getStart()), indexOf(link.getEnd()));
			}
			if (link.isRigid() || link.isElastic()) {
				union(springs, indexOf(link.getStart()), indexOf(link.getEnd()));
			}
		}
		boolean[] pinned = new boolean[n];
		for (int i = 0; i < n; i++) {
			if (nodes.get(nodeIds.get(i)).isPlaced()) {
				pinned[find(springs, i)] = true;
			}
		}
		for (Link<N> link : getLinks()) {
			if (link.getGrowth() != null) {
				continue;
			}
			int s = indexOf(link.getStart());
			int e = indexOf(link.getEnd());
			if (!pinned[find(springs, s)] || !pinned[find(springs, e)]) {
				union(rigid, s, e);
			}
		}
		for (int i = 0; i < n; i++) {
			rigid[i] = find(rigid, i);
		}
		return rigid;
	}

	private int indexOf(N id) {
		return nodes.get(id).getIndex();
	}

	private static int[] identity(int n) {
		int[] parent = new int[n];
		for (int i = 0; i < n; i++) {
			parent[i] = i;
		}
		return parent;
	}

	private static void union(int[] parent, int i, int j) {
		int a = find(parent, i);
		int b = find(parent, j);
		if (a != b) {
			parent[Math.max(a, b)] = Math.min(a, b);
		}
	}

	private static int find(int[] parent, int i) {
		while (parent[i] != i) {
			parent[i] = parent[parent[i]];
			i = parent[i];
		}
		return i;
	}

	// first forced member, else first placed member, else first member
	private int anchorOf(List<Integer> group) {
		for (int m : group) {
			if (nodes.get(nodeIds.get(m)).getForcedPosition() != null) {
				return m;
			}
		}
		for (int m : group) {
			if (nodes.get(nodeIds.get(m)).isPlaced()) {
				return m;
			}
		}
		return group.get(0);
	}

	private static double sweptPosition(Node<?> node) {
		Double p = node.getDerivedPosition();
		return p != null ? p : node.getPosition();
	}

	/**
	 * Move every node to the position that minimises the energy of the elastic
	 * links, keeping pinned nodes where they are.
	 *
	 * @throws UnsolvableSystemException if the equations have no unique solution;
	 *                                   positions are then left unchanged
	 */
	public void minimizeEnergy() throws UnsolvableSystemException {
		if (nodeIds.isEmpty()) {
			return;
		}
		EquationSet eqns = createEnergyMatrix();
		if (log.isTraceEnabled()) {
			log.trace("Energy equations:\n{}", eqns);
		}
		eqns.solve();
		double[] results = eqns.getResults();
		for (int i = 0; i < results.length; i++) {
			nodes.get(nodeIds.get(i)).setDerivedPosition(results[i]);
		}
	}

	/**
	 * Position of a node: forced, else placed, else derived.
	 *
	 * @throws IllegalArgumentException if the id is not a node of this graph
	 * @throws IllegalStateException    if the node has not been positioned
	 */
	public double getNodePosition(N id) {
		return getNode(id).getPosition();
	}

	/**
	 * The nodes at the low and high extremes of a dimension.
	 */
	public static final class EdgeNodes<N> {
		private final List<N> low;
		private final List<N> high;

		public EdgeNodes(List<N> low, List<N> high) {
			this.low = Collections.unmodifiableList(new ArrayList<>(low));
			this.high = Collections.unmodifiableList(new ArrayList<>(high));
		}

		public List<N> getLow() {
			return low;
		}

		public List<N> getHigh() {
			return high;
		}

		@Override
		public String toString() {
			return "EdgeNodes{low=" + low + ", high=" + high + "}";
		}
	}
}
