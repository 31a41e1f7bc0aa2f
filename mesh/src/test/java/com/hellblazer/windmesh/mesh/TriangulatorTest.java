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

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Triangulator Tests")
class TriangulatorTest {

    private static ParametricGrid plane(int a, int b) {
        return ParametricGrid.construct(new double[] { 0, 0, 0 }, new double[] { a, b, 0 }, new int[] { a, b, 0 });
    }

    @Property
    @Label("Divisions (a, b) yield 2ab triangles with the same winding")
    void triangleCountAndWinding(@ForAll @IntRange(min = 1, max = 12) int a,
                                 @ForAll @IntRange(min = 1, max = 12) int b,
                                 @ForAll @IntRange(min = 0, max = 1) int splitDim) {
        var surface = Triangulator.triangulate(plane(a, b), splitDim);

        assertEquals(2 * a * b, surface.triangleCount());
        assertEquals((a + 1) * (b + 1), surface.nodeCount());
        for (int t = 0; t < surface.triangleCount(); t++) {
            assertEquals(new Vector3d(0, 0, 1), surface.normal(t), "triangle " + t);
        }
        assertEquals(a * b, surface.area(), 1e-9);
    }

    @Test
    @DisplayName("Split dimension selects the cell diagonal")
    void diagonal() {
        var grid = plane(1, 1);
        var main = Triangulator.triangulate(grid, 0);
        assertArrayEquals(new int[] { 0, 1, 3 }, main.triangle(0));
        assertArrayEquals(new int[] { 0, 3, 2 }, main.triangle(1));

        var anti = Triangulator.triangulate(grid, 1);
        assertArrayEquals(new int[] { 0, 1, 2 }, anti.triangle(0));
        assertArrayEquals(new int[] { 1, 3, 2 }, anti.triangle(1));
    }

    @Test
    @DisplayName("Collapsed middle dimension is skipped")
    void collapsedMiddle() {
        var grid = ParametricGrid.construct(new double[] { 0, 0, 0 }, new double[] { 1, 0, 1 },
                                            new int[] { 3, 0, 2 });
        var surface = Triangulator.triangulate(grid, 2);
        assertEquals(12, surface.triangleCount());
        var used = new HashSet<Integer>();
        for (int t = 0; t < surface.triangleCount(); t++) {
            for (var n : surface.triangle(t)) {
                used.add(n);
            }
        }
        assertEquals(grid.nodeCount(), used.size());
    }

    @ParameterizedTest
    @ValueSource(ints = { -1, 2, 5 })
    @DisplayName("Split dimension must be a surface dimension")
    void invalidSplit(int splitDim) {
        assertThrows(IllegalArgumentException.class, () -> Triangulator.triangulate(plane(2, 2), splitDim));
    }

    @Test
    @DisplayName("Only surfaces are triangulated")
    void notASurface() {
        var line = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 }, new int[] { 4, 0 });
        var volume = ParametricGrid.construct(new double[] { 0, 0, 0 }, new double[] { 1, 1, 1 },
                                              new int[] { 2, 2, 2 });
        assertThrows(IllegalArgumentException.class, () -> Triangulator.triangulate(line, 0));
        assertThrows(IllegalArgumentException.class, () -> Triangulator.triangulate(volume, 0));
    }

    @Test
    @DisplayName("Surface owns its nodes")
    void independentNodes() {
        var grid = plane(2, 2);
        var surface = Triangulator.triangulate(grid, 0);
        grid.translate(1, 1, 1);
        assertEquals(new Point3d(0, 0, 0), surface.getNode(0));

        var copy = surface.copy();
        surface.scale(2, 2, 2);
        assertEquals(new Point3d(2, 0, 0), copy.getNode(2));
        assertEquals(new Point3d(4, 0, 0), surface.getNode(2));
    }

    @Test
    @DisplayName("Explicit surfaces validate connectivity")
    void explicitSurface() {
        var nodes = List.of(new Point3d(0, 0, 0), new Point3d(1, 0, 0), new Point3d(0, 1, 0));
        var surface = TriangleSurface.of(nodes, List.of(new int[] { 0, 1, 2 }));
        assertEquals(0.5, surface.area(), 1e-12);
        assertThrows(IndexOutOfBoundsException.class,
                     () -> TriangleSurface.of(nodes, List.<int[]>of(new int[] { 0, 1, 3 })));
    }
}
