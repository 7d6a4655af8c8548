package com.github.micycle1.gridspan;

/**
 * Maps a grid node id to its position along the numbered grid lines.
 * <p>
 * With an ordinal a {@link GridPlacement} can tell that grid line 2 lies inside
 * a cell running from line 0 to line 4, and split that cell when line 2 is
 * referenced on its own.
 */
@FunctionalInterface
public interface NodeOrdinal<N> {

	double ordinal(N node);
}
