package com.github.micycle1.gridspan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class RangeTest {

	@Test
	public void testNone() {
		Range none = Range.none();
		assertTrue(none.isNone());
		assertEquals(0, none.size());
		assertEquals(new Range(2, 2), none.include(2));
		assertEquals(new Range(1, 3), none.union(new Range(1, 3)));
		assertEquals(none, new Range(5, 1));
		assertEquals(none.hashCode(), new Range(5, 1).hashCode());
		assertThrows(IllegalStateException.class, none::center);
	}

	@Test
	public void testBasics() {
		Range r = Range.ofPoints(6, -2);
		assertEquals(-2, r.getMin());
		assertEquals(6, r.getMax());
		assertEquals(8, r.size());
		assertEquals(2, r.center());
		assertEquals("(-2.0 to 6.0)", r.toString());
		assertTrue(r.contains(0));
		assertFalse(r.contains(7));
	}

	@Test
	public void testCombination() {
		Range a = new Range(0, 4);
		Range b = new Range(2, 10);
		assertEquals(new Range(0, 10), a.union(b));
		assertEquals(new Range(2, 4), a.intersect(b));
		assertTrue(a.intersect(new Range(5, 6)).isNone());
		assertEquals(new Range(-1, 5), a.include(-1).include(5));
	}

	@Test
	public void testTransforms() {
		Range r = new Range(1, 3);
		assertEquals(new Range(0, 4), r.enlarge(1));
		assertEquals(new Range(1.5, 2.5), r.reduce(0.5));
		assertTrue(r.reduce(2).isNone());
		assertEquals(new Range(3, 5), r.plus(2));
		assertEquals(new Range(-1, 1), r.minus(2));
		assertEquals(new Range(-6, -2), r.scale(-2));
		assertNotEquals(r, r.plus(1));
	}
}
