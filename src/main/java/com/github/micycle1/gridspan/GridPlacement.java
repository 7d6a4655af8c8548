package com.github.micycle1.gridspan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.micycle1.gridspan.linalg.UnsolvableSystemException;
import com.github.micycle1.gridspan.resolver.GridCellDataEntry;
import com.github.micycle1.gridspan.resolver.Resolver;

/**
 * <p>
 * Places the grid lines of one dimension (the columns or the rows of a
 * diagram) from the cell sizes, growth factors and fixed positions collected
 * for it.
 * </p>
 *
 * <p>
 * Usage runs in two passes. First all constraints are added and
 * {@link #getDesiredGeometry()} reports the smallest extent the cells need. The
 * caller then decides how much room the dimension actually gets and calls
 * {@link #calculatePositions(double, double, double)}, after which
 * {@link #getSpan(Object, Object)} and {@link #getPosition(Object)} return final
 * coordinates.
 * </p>
 *
 * <p>
 * Minimum sizes are hard bounds: asking for less room than the minimum lays the
 * grid out at its minimum. Extra room is shared between the elastic gaps (those
 * with a positive growth factor) in proportion to their growth. A gap whose
 * growth is zero keeps its minimum size; a gap without a growth factor only
 * stretches as far as the elastic gaps around it pull it.
 * </p>
 *
 * <p>
 * When constructed with a {@link NodeOrdinal} (see {@link #forIntegers()}), a
 * growth or place entry naming a grid line that no cell starts or ends on, but
 * which lies inside some cell, splits that cell at the line. Each piece gets the
 * cell's size in proportion to the number of grid lines it spans.
 * </p>
 *
 * <p>
 * One instance handles one dimension and is not thread-safe; separate instances
 * share nothing.
 * </p>
 */
public class GridPlacement<N> {

	private static final Logger log = LogManager.getLogger(GridPlacement.class);

	/** Default distance within which a node counts as lying on an edge. */
	public static final double DEFAULT_EDGE_TOLERANCE = 1e-7;

	public enum State {
		/** No constraints. */
		EMPTY,
		/** Constraints added since the last computation. */
		ACCUMULATING,
		/** Minimum positions computed. */
		DESIRED_COMPUTED,
		/** Final positions computed. */
		FINAL_COMPUTED
	}

	private final NodeOrdinal<N> ordinal;
	private final List<GridData<N>> cells = new ArrayList<>();
	private final List<GridData<N>> growths = new ArrayList<>();
	private final List<GridData<N>> places = new ArrayList<>();

	private State state = State.EMPTY;
	private Resolver<N> resolver;
	private double edgeTolerance = DEFAULT_EDGE_TOLERANCE;
	private double minimumSize;
	// low end of the minimum layout, in the frame of the place entries
	private double desiredOrigin;
	private double size;
	private Range desiredRange = Range.none();

	public GridPlacement() {
		this(null);
	}

	/**
	 * @param ordinal grid line numbering used to split cells at interior lines;
	 *                may be null
	 */
	public GridPlacement(NodeOrdinal<N> ordinal) {
		this.ordinal = ordinal;
	}

	/** A placement whose grid lines are numbered by integers. */
	public static GridPlacement<Integer> forIntegers() {
		return new GridPlacement<>(Integer::doubleValue);
	}

	/**
	 * Require at least {@code size} between {@code start} and {@code end}. Negative
	 * sizes count as zero; repeated pairs keep the largest size.
	 */
	public void addCell(N start, N end, double size) {
		checkPair(start, end);
		checkFinite(size, "size");
		cells.add(GridData.width(start, end, Math.max(0, size)));
		invalidate();
	}

	/**
	 * Set the elasticity of the gap between {@code start} and {@code end}; zero
	 * makes it rigid. Negative factors count as zero.
	 */
	public void addGrowth(N start, N end, double factor) {
		checkPair(start, end);
		checkFinite(factor, "growth factor");
		growths.add(GridData.growth(start, end, Math.max(0, factor)));
		invalidate();
	}

	/**
	 * Pin {@code node} at {@code position}, measured in the frame of the minimum
	 * layout whose roots start at 0. The pin moves with the grid when the final
	 * layout is centred.
	 */
	public void addPlace(N node, double position) {
		Objects.requireNonNull(node, "node must not be null");
		checkFinite(position, "position");
		places.add(GridData.place(node, position));
		invalidate();
	}

	public void addCellData(Collection<GridData<N>> data) {
		for (GridData<N> d : data) {
			switch (d.getKind()) {
				case WIDTH:
					addCell(d.getStart(), d.getEnd(), d.getValue());
					break;
				case GROWTH:
					addGrowth(d.getStart(), d.getEnd(), d.getValue());
					break;
				case PLACE:
					addPlace(d.getStart(), d.getValue());
					break;
				default:
					throw new IllegalArgumentException("Unknown grid data kind: " + d.getKind());
			}
		}
	}

	private static void checkPair(Object start, Object end) {
		Objects.requireNonNull(start, "start must not be null");
		Objects.requireNonNull(end, "end must not be null");
		if (start.equals(end)) {
			throw new IllegalArgumentException("Start and end must differ: " + start);
		}
	}

	private static void checkFinite(double v, String what) {
		if (!Double.isFinite(v)) {
			throw new IllegalArgumentException("Non-finite " + what + ": " + v);
		}
	}

	private void invalidate() {
		resolver = null;
		state = State.ACCUMULATING;
	}

	/**
	 * Compute the minimum positions of every grid line and return the extent they
	 * occupy, centred on the origin ({@link Range#none()} without cells).
	 *
	 * @throws com.github.micycle1.gridspan.resolver.CyclicGraphException if the
	 *                                                                    cells
	 *                                                                    form a
	 *                                                                    cycle
	 */
	public Range getDesiredGeometry() {
		if (cells.isEmpty()) {
			resolver = null;
			minimumSize = 0;
			desiredOrigin = 0;
			size = 0;
			desiredRange = Range.none();
			state = State.DESIRED_COMPUTED;
			return desiredRange;
		}
		resolver = new Resolver<>(subdivide());
		for (GridData<N> g : growths) {
			resolver.setGrowthData(g.getStart(), g.getEnd(), g.getValue());
		}
		for (GridData<N> p : places) {
			if (!resolver.hasNode(p.getStart())) {
				log.warn("Ignoring placement of {} at {}: node not in the grid", p.getStart(), p.getValue());
			}
		}
		forcePlacedNodes(0);
		resolver.assignMinPositions(0);
		Range bounds = resolver.findBounds();
		desiredOrigin = bounds.getMin();
		minimumSize = bounds.size();
		size = minimumSize;
		desiredRange = bounds.minus(bounds.center());
		state = State.DESIRED_COMPUTED;
		log.debug("Desired geometry {} (minimum size {})", desiredRange, minimumSize);
		return desiredRange;
	}

	// place entries are relative to the frame in which roots start at 0
	private void forcePlacedNodes(double shift) {
		for (GridData<N> p : places) {
			if (resolver.hasNode(p.getStart())) {
				resolver.forceNode(p.getStart(), p.getValue() + shift);
			}
		}
	}

	// cell entries, with cells split at referenced interior grid lines
	private List<GridCellDataEntry<N>> subdivide() {
		List<GridCellDataEntry<N>> entries = new ArrayList<>(cells.size());
		Set<N> interior = ordinal == null ? Collections.emptySet() : interiorCandidates();
		for (GridData<N> c : cells) {
			N s = c.getStart();
			N e = c.getEnd();
			if (interior.isEmpty()) {
				entries.add(new GridCellDataEntry<>(s, e, c.getValue()));
				continue;
			}
			double os = ordinal.ordinal(s);
			double oe = ordinal.ordinal(e);
			double lo = Math.min(os, oe);
			double hi = Math.max(os, oe);
			List<N> inside = new ArrayList<>();
			for (N n : interior) {
				double o = ordinal.ordinal(n);
				if (o > lo && o < hi) {
					inside.add(n);
				}
			}
			if (inside.isEmpty()) {
				entries.add(new GridCellDataEntry<>(s, e, c.getValue()));
				continue;
			}
			Comparator<N> byOrdinal = Comparator.comparingDouble(ordinal::ordinal);
			inside.sort(os <= oe ? byOrdinal : byOrdinal.reversed());
			double span = hi - lo;
			N prev = s;
			double prevOrdinal = os;
			inside.add(e);
			for (N n : inside) {
				double o = ordinal.ordinal(n);
				entries.add(new GridCellDataEntry<>(prev, n, c.getValue() * Math.abs(o - prevOrdinal) / span));
				prev = n;
				prevOrdinal = o;
			}
			log.debug("Split cell {} at {}", c, inside.subList(0, inside.size() - 1));
		}
		return entries;
	}

	// growth and place nodes that no cell starts or ends on
	private Set<N> interiorCandidates() {
		Set<N> cellNodes = new HashSet<>();
		for (GridData<N> c : cells) {
			cellNodes.add(c.getStart());
			cellNodes.add(c.getEnd());
		}
		Set<N> result = new LinkedHashSet<>();
		for (GridData<N> g : growths) {
			result.add(g.getStart());
			result.add(g.getEnd());
		}
		for (GridData<N> p : places) {
			result.add(p.getStart());
		}
		result.removeAll(cellNodes);
		return result;
	}

	/**
	 * Compute final positions within {@code size} units centred on
	 * {@code center}.
	 * <p>
	 * The grid gets its minimum size plus {@code expansion} (clamped to [0, 1]) of
	 * the room beyond it. The edge grid lines are pinned to the ends of that
	 * extent and the interior lines follow the elastic gaps. If the resulting
	 * equations cannot be solved (for instance rigid gaps pinned at conflicting
	 * positions) the grid falls back to its minimum layout centred on
	 * {@code center}.
	 *
	 * @return true if the elastic layout succeeded, false if the fallback was used
	 */
	public boolean calculatePositions(double size, double center, double expansion) {
		checkFinite(size, "size");
		checkFinite(center, "center");
		checkFinite(expansion, "expansion");
		if (state == State.EMPTY || state == State.ACCUMULATING || resolver == null && !cells.isEmpty()) {
			getDesiredGeometry();
		}
		if (resolver == null) {
			this.size = 0;
			state = State.FINAL_COMPUTED;
			return true;
		}
		expansion = Math.max(0, Math.min(1, expansion));
		double extra = resolver.hasElasticLinks() ? Math.max(0, size - minimumSize) : 0;
		double finalSize = minimumSize + expansion * extra;

		boolean solved = true;
		double shift = center - finalSize / 2 - desiredOrigin;
		resolver.clearNodePlacements();
		forcePlacedNodes(shift);
		resolver.assignMinPositions(shift);
		resolver.placeEdgeNodes(resolver.getEdgeNodes(edgeTolerance), center - finalSize / 2, center + finalSize / 2);
		try {
			resolver.minimizeEnergy();
		} catch (UnsolvableSystemException e) {
			log.warn("Falling back to minimum layout of size {} around {}: {}", minimumSize, center, e.getMessage());
			shift = center - minimumSize / 2 - desiredOrigin;
			resolver.clearNodePlacements();
			forcePlacedNodes(shift);
			resolver.assignMinPositions(shift);
			solved = false;
		}
		this.size = resolver.findBounds().size();
		state = State.FINAL_COMPUTED;
		return solved;
	}

	/**
	 * The positions of two grid lines.
	 *
	 * @throws IllegalStateException    if no positions have been computed
	 * @throws IllegalArgumentException if either node is not in the grid
	 */
	public double[] getSpan(N start, N end) {
		checkComputed();
		return new double[] { positionOf(start), positionOf(end) };
	}

	private double positionOf(N node) {
		if (resolver == null || !resolver.hasNode(node)) {
			throw new IllegalArgumentException("Unknown grid node: " + node);
		}
		return resolver.getNodePosition(node);
	}

	/**
	 * The position of a grid line, or null if it is not in the grid.
	 *
	 * @throws IllegalStateException if no positions have been computed
	 */
	public Double getPosition(N node) {
		checkComputed();
		if (resolver == null || !resolver.hasNode(node)) {
			return null;
		}
		return resolver.getNodePosition(node);
	}

	private void checkComputed() {
		if (state != State.DESIRED_COMPUTED && state != State.FINAL_COMPUTED) {
			throw new IllegalStateException("Positions have not been computed (state " + state + ")");
		}
	}

	/** Extent of the last computed positions. */
	public double getSize() {
		return size;
	}

	public double getMinimumSize() {
		return minimumSize;
	}

	public Range getDesiredRange() {
		return desiredRange;
	}

	public State getState() {
		return state;
	}

	/** The resolver of the last computation, or null. */
	public Resolver<N> getResolver() {
		return resolver;
	}

	public double getEdgeTolerance() {
		return edgeTolerance;
	}

	public void setEdgeTolerance(double edgeTolerance) {
		if (!(edgeTolerance >= 0) || Double.isInfinite(edgeTolerance)) {
			throw new IllegalArgumentException("Edge tolerance must be a finite value >= 0: " + edgeTolerance);
		}
		this.edgeTolerance = edgeTolerance;
	}

	/** Remove every constraint and computed position. */
	public void clear() {
		cells.clear();
		growths.clear();
		places.clear();
		resolver = null;
		minimumSize = 0;
		desiredOrigin = 0;
		size = 0;
		desiredRange = Range.none();
		state = State.EMPTY;
	}

	@Override
	public String toString() {
		return "GridPlacement{state=" + state + ", cells=" + cells + ", growth=" + growths + ", place=" + places + "}";
	}
}
