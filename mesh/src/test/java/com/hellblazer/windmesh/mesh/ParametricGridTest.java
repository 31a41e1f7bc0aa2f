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

import com.hellblazer.windmesh.geometry.RigidTransform;
import com.hellblazer.windmesh.geometry.discretization.Discretization;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Parametric Grid Tests")
class ParametricGridTest {

    private static final double EPSILON = 1e-12;

    private static final SpaceTransform WAVE = (x, index) -> new double[] { Math.cos(x[0]) * (1 + x[1]),
                                                                             Math.sin(x[0]) * (1 + x[1]),
                                                                             x[1] * x[1] + index[0] };

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Nodes start at their parametric coordinates, first dimension fastest")
        void parametricNodes() {
            var grid = ParametricGrid.construct(new double[] { 0, 10 }, new double[] { 1, 20 }, new int[] { 2, 1 });

            assertEquals(2, grid.dimensions());
            assertEquals(6, grid.nodeCount());
            assertArrayEquals(new int[] { 3, 2 }, grid.getNodeCounts());
            assertArrayEquals(new int[] { 2, 1 }, grid.getDivisionCounts());
            assertEquals(new Point3d(0.5, 10, 0), grid.getNode(1));
            assertEquals(new Point3d(1, 20, 0), grid.getNode(5));
            assertEquals(new Point3d(0.5, 20, 0), grid.getNode(new int[] { 1, 1 }));
        }

        @Test
        @DisplayName("Zero divisions collapse a dimension onto its minimum")
        void collapsedDimension() {
            var grid = ParametricGrid.construct(new double[] { 0, 0, 3 }, new double[] { 1, 1, 7 },
                                                new int[] { 4, 2, 0 });
            assertEquals(15, grid.nodeCount());
            for (int n = 0; n < grid.nodeCount(); n++) {
                assertEquals(3.0, grid.getNode(n).z);
            }
        }

        @Test
        @DisplayName("Multi-section descriptors are accepted per dimension")
        void multiSection() {
            var sections = Discretization.sections(new Discretization.Section(0.5, 3, 1.0, false),
                                                   new Discretization.Section(0.5, 5, 2.0, true));
            var grid = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 },
                                                new Discretization[] { sections, Discretization.uniform(2) },
                                                OptionalInt.empty());
            assertArrayEquals(new int[] { 9, 3 }, grid.getNodeCounts());
            assertEquals(0.5, grid.getNode(new int[] { 3, 0 }).x, EPSILON);
            assertSame(sections, grid.getDiscretization(0));
            assertEquals(Discretization.uniform(2), grid.getDiscretization(1));
            assertArrayEquals(new int[] { 8, 2 }, grid.getDivisionCounts());
        }

        @Test
        @DisplayName("Invalid shapes are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class,
                         () -> ParametricGrid.construct(new double[0], new double[0], new int[0]));
            assertThrows(IllegalArgumentException.class,
                         () -> ParametricGrid.construct(new double[] { 0, 0, 0, 0 }, new double[] { 1, 1, 1, 1 },
                                                        new int[] { 1, 1, 1, 1 }));
            assertThrows(IllegalArgumentException.class,
                         () -> ParametricGrid.construct(new double[] { 0 }, new double[] { 1, 1 },
                                                        new int[] { 1 }));
            assertThrows(IllegalArgumentException.class,
                         () -> ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 },
                                                        new int[] { 2, 0 }, OptionalInt.of(1)));
            assertThrows(IllegalArgumentException.class,
                         () -> ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 },
                                                        new int[] { 2, 2 }, OptionalInt.of(2)));
        }
    }

    @Nested
    @DisplayName("Indexing")
    class Indexing {

        @Test
        @DisplayName("Loop dimension wraps indices")
        void loopWraps() {
            var grid = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 }, new int[] { 4, 2 },
                                                OptionalInt.of(0));
            assertEquals(grid.getNode(new int[] { 0, 1 }), grid.getNode(new int[] { 5, 1 }));
            assertEquals(grid.getNode(new int[] { 4, 2 }), grid.getNode(new int[] { -1, 2 }));
            assertThrows(IndexOutOfBoundsException.class, () -> grid.getNode(new int[] { 0, 3 }));
        }

        @Test
        @DisplayName("Without a loop dimension indices are bounds checked")
        void noLoop() {
            var grid = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 }, new int[] { 4, 2 });
            assertThrows(IndexOutOfBoundsException.class, () -> grid.getNode(new int[] { 5, 0 }));
            assertThrows(IndexOutOfBoundsException.class, () -> grid.getNode(15));
        }

        @Property
        @Label("Linear and multi-indices are inverse mappings")
        void indexRoundTrip(@ForAll @IntRange(min = 0, max = 5) int a, @ForAll @IntRange(min = 0, max = 5) int b,
                            @ForAll @IntRange(min = 0, max = 5) int c) {
            var grid = ParametricGrid.construct(new double[] { 0, 0, 0 }, new double[] { 1, 1, 1 },
                                                new int[] { a, b, c });
            for (int n = 0; n < grid.nodeCount(); n++) {
                assertEquals(n, grid.nodeIndex(grid.multiIndex(n)));
            }
        }
    }

    @Nested
    @DisplayName("Transforms")
    class Transforms {

        @Test
        @DisplayName("Space transform receives coordinates and multi-index")
        void spaceTransform() {
            var grid = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 1, 1 }, new int[] { 2, 2 });
            grid.applyTransform((x, index) -> new double[] { index[0], index[1], x[0] + x[1] });
            assertEquals(new Point3d(2, 1, 1.5), grid.getNode(new int[] { 2, 1 }));
        }

        @Test
        @DisplayName("Transforms are deterministic across runs")
        void deterministic() {
            var first = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 6, 1 }, new int[] { 40, 10 });
            var second = first.copy();
            first.applyTransform(WAVE);
            second.applyTransform(WAVE);
            for (int n = 0; n < first.nodeCount(); n++) {
                assertEquals(first.getNode(n), second.getNode(n));
            }
        }

        @Test
        @DisplayName("Parallel and sequential transforms agree exactly")
        void parallelMatchesSequential() {
            var sequential = ParametricGrid.construct(new double[] { 0, 0, 0 }, new double[] { 6, 1, 1 },
                                                      new int[] { 60, 20, 5 });
            var parallel = sequential.copy();
            sequential.applyTransform(WAVE);
            parallel.applyTransformParallel(WAVE);
            for (int n = 0; n < sequential.nodeCount(); n++) {
                assertEquals(sequential.getNode(n), parallel.getNode(n), "node " + n);
            }
        }

        @Test
        @DisplayName("Malformed transform results are rejected")
        void malformedResult() {
            var grid = ParametricGrid.construct(new double[] { 0 }, new double[] { 1 }, new int[] { 2 });
            assertThrows(IllegalStateException.class, () -> grid.applyTransform((x, index) -> new double[2]));
        }

        @Test
        @DisplayName("Rigid transform moves nodes and copies stay put")
        void rigidTransform() {
            var grid = ParametricGrid.construct(new double[] { 0 }, new double[] { 1 }, new int[] { 1 });
            var copy = grid.copy();
            grid.applyRigidTransform(RigidTransform.fromYawPitchRoll(90, 0, 0, new Vector3d(0, 0, 5)));

            assertTrue(grid.getNode(1).epsilonEquals(new Point3d(0, 1, 5), EPSILON), grid.getNode(1).toString());
            assertEquals(new Point3d(1, 0, 0), copy.getNode(1));
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("Fields are evaluated at current node positions")
        void calculateField() {
            var grid = ParametricGrid.construct(new double[] { 0, 0 }, new double[] { 2, 2 }, new int[] { 2, 2 });
            grid.translate(0, 0, 10);
            var field = grid.calculateField("height", FieldKind.SCALAR, p -> new double[] { p.z });
            var wake = grid.calculateField("wake", FieldKind.VECTOR, p -> new double[] { 1, p.x, 0 });

            assertEquals(9, field.nodeCount());
            assertEquals(10.0, field.value(4)[0]);
            assertArrayEquals(new double[] { 1, 2, 0 }, wake.value(2));
            assertEquals(Set.of("height", "wake"), grid.fieldNames());
        }

        @Test
        @DisplayName("Fields keep their values when the grid moves")
        void fieldsAreData() {
            var grid = ParametricGrid.construct(new double[] { 0 }, new double[] { 1 }, new int[] { 3 });
            grid.calculateField("x", FieldKind.SCALAR, p -> new double[] { p.x });
            grid.translate(5, 0, 0);
            var copy = grid.copy();

            assertEquals(1.0, grid.getField("x").orElseThrow().value(3)[0]);
            assertEquals(grid.getField("x"), copy.getField("x"));
            assertTrue(grid.getField("missing").isEmpty());
        }

        @Test
        @DisplayName("Component count must match the field kind")
        void componentMismatch() {
            var grid = ParametricGrid.construct(new double[] { 0 }, new double[] { 1 }, new int[] { 3 });
            assertThrows(IllegalStateException.class,
                         () -> grid.calculateField("bad", FieldKind.VECTOR, p -> new double[] { 1 }));
        }
    }
}
