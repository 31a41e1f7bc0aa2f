/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Affero General Public License as published by the Free
 * Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
 * FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.windmesh.mesh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Splits the quad cells of a two dimensional structured grid into triangles.
 *
 * @author hal.hildebrand
 */
public final class Triangulator {

    private static final Logger log = LoggerFactory.getLogger(Triangulator.class);

    private Triangulator() {
    }

    /**
     * Triangulates the grid's surface. Each cell (i, j), (i+1, j), (i+1, j+1), (i, j+1) yields two triangles wound
     * counter-clockwise in index space, i along the first surface dimension. When splitDim is the first surface
     * dimension the cell is cut along (i, j)-(i+1, j+1), otherwise along (i+1, j)-(i, j+1).
     *
     * @param grid     a grid with exactly two dimensions holding divisions
     * @param splitDim one of the two surface dimensions
     * @return a surface sharing the grid's nodes and node ordering
     * @throws IllegalArgumentException if the grid is not a surface or splitDim is not one of its dimensions
     */
    public static TriangleSurface triangulate(ParametricGrid grid, int splitDim) {
        Objects.requireNonNull(grid, "grid cannot be null");
        var divisions = grid.getDivisionCounts();
        var first = -1;
        var second = -1;
        for (int d = 0; d < divisions.length; d++) {
            if (divisions[d] > 0) {
                if (first < 0) {
                    first = d;
                } else if (second < 0) {
                    second = d;
                } else {
                    throw new IllegalArgumentException("cannot triangulate a volume grid");
                }
            }
        }
        if (second < 0) {
            throw new IllegalArgumentException("triangulation needs two dimensions with divisions, got "
                                               + Arrays.toString(divisions));
        }
        if (splitDim != first && splitDim != second) {
            throw new IllegalArgumentException(
            String.format("split dimension %d is not a surface dimension (%d, %d)", splitDim, first, second));
        }

        var a = divisions[first];
        var b = divisions[second];
        var mainDiagonal = splitDim == first;
        var triangles = new int[2 * a * b * 3];
        var index = new int[divisions.length];
        var t = 0;
        for (int j = 0; j < b; j++) {
            for (int i = 0; i < a; i++) {
                var n00 = node(grid, index, first, i, second, j);
                var n10 = node(grid, index, first, i + 1, second, j);
                var n11 = node(grid, index, first, i + 1, second, j + 1);
                var n01 = node(grid, index, first, i, second, j + 1);
                if (mainDiagonal) {
                    t = put(triangles, t, n00, n10, n11);
                    t = put(triangles, t, n00, n11, n01);
                } else {
                    t = put(triangles, t, n00, n10, n01);
                    t = put(triangles, t, n10, n11, n01);
                }
            }
        }

        var nodes = new double[grid.nodeCount() * 3];
        for (int n = 0; n < grid.nodeCount(); n++) {
            var p = grid.getNode(n);
            nodes[n * 3] = p.x;
            nodes[n * 3 + 1] = p.y;
            nodes[n * 3 + 2] = p.z;
        }
        log.debug("Triangulated {} x {} cells into {} triangles", a, b, 2 * a * b);
        return new TriangleSurface(nodes, triangles);
    }

    private static int node(ParametricGrid grid, int[] index, int first, int i, int second, int j) {
        index[first] = i;
        index[second] = j;
        return grid.nodeIndex(index);
    }

    private static int put(int[] triangles, int t, int n0, int n1, int n2) {
        triangles[t++] = n0;
        triangles[t++] = n1;
        triangles[t++] = n2;
        return t;
    }
}
