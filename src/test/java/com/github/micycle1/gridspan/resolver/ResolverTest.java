package com.github.micycle1.gridspan.resolver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.gridspan.Range;
import com.github.micycle1.gridspan.linalg.UnsolvableSystemException;

public class ResolverTest {

	private static final double EPS = 1e-6;

	private static List<GridCellDataEntry<Integer>> cells(int... triples) {
		List<GridCellDataEntry<Integer>> entries = new ArrayList<>();
		for (int i = 0; i < triples.length; i += 3) {
			entries.add(new GridCellDataEntry<>(triples[i], triples[i + 1], triples[i + 2]));
		}
		return entries;
	}

	// 0 -10- 1 -10- 2 -10- 3, with a duplicate of the middle link
	private static Resolver<Integer> chain() {
		return new Resolver<>(cells(0, 1, 10, 1, 2, 10, 1, 2, 10, 2, 3, 10));
	}

	private static void stretch(Resolver<Integer> resolver, double min, double max) throws UnsolvableSystemException {
		resolver.assignMinPositions(min);
		resolver.placeEdgeNodes(resolver.getEdgeNodes(1e-7), min, max);
		resolver.minimizeEnergy();
	}

	@Test
	public void testResolutionOrder() {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 100, 10, 100, 50, 10));
		assertEquals(List.of(0, 100, 50), resolver.getResolutionOrder());
		assertEquals(List.of(0), resolver.getRoots());
		assertEquals(3, resolver.getNodeCount());

		resolver.assignMinPositions(0);
		assertEquals(0, resolver.getNodePosition(0), EPS);
		assertEquals(10, resolver.getNodePosition(100), EPS);
		assertEquals(20, resolver.getNodePosition(50), EPS);
	}

	@Test
	public void testLongestPath() {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 100, 10, 100, 50, 10, 100, 250, 5));
		resolver.assignMinPositions(0);
		assertEquals(15, resolver.getNodePosition(250), EPS);
		assertEquals(20, resolver.getNodePosition(50), EPS);
		assertEquals(new Range(0, 20), resolver.findBounds());

		Resolver.EdgeNodes<Integer> edges = resolver.getEdgeNodes(1e-7);
		assertEquals(List.of(0), edges.getLow());
		assertEquals(List.of(50), edges.getHigh());
	}

	@Test
	public void testMultipleRoots() {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 2, 5, 1, 2, 8));
		assertEquals(List.of(0, 1), resolver.getRoots());
		resolver.assignMinPositions(-4);
		assertEquals(-4, resolver.getNodePosition(0), EPS);
		assertEquals(-4, resolver.getNodePosition(1), EPS);
		assertEquals(4, resolver.getNodePosition(2), EPS);
	}

	@Test
	public void testDuplicateLinksKeepLargestSize() {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 4, 0, 1, 6, 0, 1, 5));
		assertEquals(6, resolver.getLink(0, 1).getMinSize(), EPS);
		assertEquals(1, resolver.getLinks().size());
		assertNull(resolver.getLink(1, 0));
	}

	@Test
	public void testEqualGrowthStretch() throws UnsolvableSystemException {
		Resolver<Integer> resolver = chain();
		assertEquals(3, resolver.setGrowthData(0, 3, 1));
		assertTrue(resolver.hasElasticLinks());
		stretch(resolver, 0, 40);
		assertEquals(0, resolver.getNodePosition(0), EPS);
		assertEquals(13.333333, resolver.getNodePosition(1), EPS);
		assertEquals(26.666667, resolver.getNodePosition(2), EPS);
		assertEquals(40, resolver.getNodePosition(3), EPS);
	}

	@Test
	public void testLaterGrowthOverrides() throws UnsolvableSystemException {
		Resolver<Integer> resolver = chain();
		resolver.setGrowthData(0, 3, 1);
		assertEquals(1, resolver.setGrowthData(1, 2, 2));
		assertEquals(2.0, resolver.getLink(1, 2).getGrowth());
		stretch(resolver, 0, 40);
		assertEquals(12.5, resolver.getNodePosition(1), EPS);
		assertEquals(27.5, resolver.getNodePosition(2), EPS);
	}

	@Test
	public void testGrowthOnBranchingPaths() {
		// 0 -> 1 -> 3 and 0 -> 2 -> 3, plus 3 -> 4 outside the span
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 1, 1, 3, 1, 0, 2, 1, 2, 3, 1, 3, 4, 1));
		assertEquals(4, resolver.setGrowthData(0, 3, 1));
		assertNull(resolver.getLink(3, 4).getGrowth());
	}

	@Test
	public void testGrowthIgnoredWithoutPath() {
		Resolver<Integer> resolver = chain();
		assertEquals(0, resolver.setGrowthData(3, 0, 1));
		assertEquals(0, resolver.setGrowthData(0, 99, 1));
		assertFalse(resolver.hasElasticLinks());
		assertThrows(IllegalArgumentException.class, () -> resolver.setGrowthData(1, 1, 1));
	}

	@Test
	public void testZeroGrowthKeepsMinimumGap() throws UnsolvableSystemException {
		Resolver<Integer> resolver = chain();
		resolver.setGrowthData(0, 1, 1);
		resolver.setGrowthData(1, 2, 0);
		resolver.setGrowthData(2, 3, 1);
		assertTrue(resolver.getLink(1, 2).isRigid());
		stretch(resolver, 0, 40);
		assertEquals(15, resolver.getNodePosition(1), EPS);
		assertEquals(25, resolver.getNodePosition(2), EPS);
	}

	@Test
	public void testUnsetGrowthTakesNoPart() throws UnsolvableSystemException {
		Resolver<Integer> resolver = chain();
		resolver.setGrowthData(0, 1, 1);
		resolver.setGrowthData(2, 3, 1);
		assertFalse(resolver.getLink(1, 2).isRigid());
		stretch(resolver, 0, 40);
		// both springs stay at their natural length; the free gap takes the slack
		assertEquals(10, resolver.getNodePosition(1), EPS);
		assertEquals(30, resolver.getNodePosition(2), EPS);
	}

	@Test
	public void testNearlyRigidGrowth() throws UnsolvableSystemException {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 10, 1, 2, 10));
		assertEquals(List.of(0), resolver.getRoots());
		assertEquals(List.of(0, 1, 2), resolver.getResolutionOrder());
		resolver.setGrowthData(0, 1, 1);
		resolver.setGrowthData(1, 2, 0.00001);
		resolver.assignMinPositions(0);
		assertEquals(10, resolver.getNodePosition(1), EPS);
		assertEquals(20, resolver.getNodePosition(2), EPS);
		stretch(resolver, 0, 30);
		assertEquals(0, resolver.getNodePosition(0), 1e-3);
		assertEquals(20, resolver.getNodePosition(1), 1e-3);
		assertEquals(30, resolver.getNodePosition(2), 1e-3);
	}

	@Test
	public void testSpanningLinkWithoutGrowth() throws UnsolvableSystemException {
		// the 0 -> 2 link has no growth, so it has no effect on the springs
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 0, 1, 2, 0, 2, 3, 0, 0, 2, 0));
		resolver.setGrowthData(0, 1, 1);
		resolver.setGrowthData(1, 2, 2);
		resolver.setGrowthData(2, 3, 1);
		stretch(resolver, 0, 40);
		assertEquals(0, resolver.getNodePosition(0), EPS);
		assertEquals(10, resolver.getNodePosition(1), EPS);
		assertEquals(30, resolver.getNodePosition(2), EPS);
		assertEquals(40, resolver.getNodePosition(3), EPS);
	}

	@Test
	public void testPlacedMiddleNode() throws UnsolvableSystemException {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 10, 1, 2, 10, 2, 3, 10, 1, 3, 0));
		resolver.placeNode(1, 20.0);
		resolver.setGrowthData(0, 1, 1);
		resolver.setGrowthData(1, 2, 2);
		resolver.setGrowthData(2, 3, 1);
		resolver.assignMinPositions(10);
		assertEquals(20, resolver.getNodePosition(1), EPS);
		assertEquals(40, resolver.getNodePosition(3), EPS);
		resolver.minimizeEnergy();
		assertEquals(10, resolver.getNodePosition(0), EPS);
		assertEquals(20, resolver.getNodePosition(1), EPS);
		assertEquals(30, resolver.getNodePosition(2), EPS);
		assertEquals(40, resolver.getNodePosition(3), EPS);
	}

	@Test
	public void testForcedNodeWins() throws UnsolvableSystemException {
		Resolver<Integer> resolver = chain();
		resolver.setGrowthData(0, 3, 1);
		resolver.forceNode(1, 20.0);
		stretch(resolver, 0, 40);
		assertEquals(20, resolver.getNodePosition(1), EPS);
		assertEquals(30, resolver.getNodePosition(2), EPS);

		resolver.clearNodePlacements();
		assertEquals(20, resolver.getNodePosition(1), EPS);
		assertThrows(IllegalStateException.class, () -> resolver.getNodePosition(2));
	}

	@Test
	public void testConflictingRigidPins() {
		Resolver<Integer> resolver = chain();
		resolver.setGrowthData(0, 3, 0);
		resolver.assignMinPositions(0);
		resolver.placeEdgeNodes(resolver.getEdgeNodes(1e-7), 0.0, 50.0);
		assertThrows(UnsolvableSystemException.class, resolver::minimizeEnergy);
		// positions unchanged
		assertEquals(10, resolver.getNodePosition(1), EPS);
		assertEquals(50, resolver.getNodePosition(3), EPS);
	}

	@Test
	public void testUnpinnedIslandHeldAtSweep() throws UnsolvableSystemException {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 10, 5, 6, 3));
		resolver.setGrowthData(0, 1, 1);
		resolver.assignMinPositions(0);
		resolver.placeNode(0, 0.0);
		resolver.placeNode(1, 20.0);
		resolver.minimizeEnergy();
		assertEquals(20, resolver.getNodePosition(1), EPS);
		assertEquals(0, resolver.getNodePosition(5), EPS);
		assertEquals(3, resolver.getNodePosition(6), EPS);
	}

	@Test
	public void testUnpinnedSpringsHeldAtSweep() throws UnsolvableSystemException {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 10, 5, 6, 3, 6, 7, 2));
		resolver.setGrowthData(0, 1, 1);
		resolver.setGrowthData(5, 7, 1);
		resolver.assignMinPositions(0);
		resolver.placeNode(0, 0.0);
		resolver.placeNode(1, 20.0);
		resolver.minimizeEnergy();
		assertEquals(0, resolver.getNodePosition(5), EPS);
		assertEquals(3, resolver.getNodePosition(6), EPS);
		assertEquals(5, resolver.getNodePosition(7), EPS);
	}

	@Test
	public void testEdgeNodesOfZeroExtent() {
		Resolver<Integer> resolver = new Resolver<>(cells(0, 1, 0));
		resolver.assignMinPositions(2);
		Resolver.EdgeNodes<Integer> edges = resolver.getEdgeNodes(1e-7);
		assertEquals(List.of(0), edges.getLow());
		assertEquals(List.of(1), edges.getHigh());
	}

	@Test
	public void testCycle() {
		CyclicGraphException e = assertThrows(CyclicGraphException.class, () -> new Resolver<>(cells(0, 1, 1, 1, 2, 1, 2, 1, 1)));
		assertEquals(List.of(1, 2), e.getUnresolved());
		assertNotNull(e.getMessage());
	}

	@Test
	public void testDegenerateLink() {
		assertThrows(IllegalArgumentException.class, () -> new Resolver<>(cells(3, 3, 1)));
	}

	@Test
	public void testUnknownNode() {
		Resolver<Integer> resolver = chain();
		assertFalse(resolver.hasNode(7));
		assertThrows(IllegalArgumentException.class, () -> resolver.forceNode(7, 1.0));
		assertThrows(IllegalArgumentException.class, () -> resolver.placeNode(7, 1.0));
		assertThrows(IllegalArgumentException.class, () -> resolver.getNodePosition(7));
	}
}
