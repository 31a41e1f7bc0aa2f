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
package com.hellblazer.windmesh.turbine;

import com.hellblazer.windmesh.geometry.Rotations;
import com.hellblazer.windmesh.mesh.Mesh;
import com.hellblazer.windmesh.mesh.MultiPartMesh;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.vecmath.Point3d;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Turbine Assembler Tests")
class TurbineAssemblerTest {

    private static final double DIAMETER = 126.0;
    private static final double HEIGHT   = 90.0;
    private static final double EPSILON  = 1e-6;

    private static ProceduralPartCatalog catalog;

    @BeforeAll
    static void createCatalog() {
        catalog = ProceduralPartCatalog.standard();
    }

    private static Mesh part(MultiPartMesh turbine, String path) {
        return turbine.getPart(path).orElseThrow();
    }

    private static double[] zRange(Mesh mesh) {
        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        for (int n = 0; n < mesh.nodeCount(); n++) {
            var z = mesh.getNode(n).z;
            min = Math.min(min, z);
            max = Math.max(max, z);
        }
        return new double[] { min, max };
    }

    @Test
    @DisplayName("Turbine holds a tower and a rotor of hub and blades")
    void partNames() {
        var turbine = new TurbineAssembler(catalog).assemble(TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0));

        assertEquals(List.of("tower", "rotor"), turbine.partNames());
        assertEquals(List.of("tower", "rotor/hub", "rotor/blade1", "rotor/blade2", "rotor/blade3"),
                     turbine.leafPaths());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 5 })
    @DisplayName("Rotor holds one blade per blade count")
    void bladeCount(int blades) {
        var turbine = new TurbineAssembler(catalog).assemble(TurbineSpec.of(DIAMETER, HEIGHT, blades, 0, 0, 0, 0));
        var rotor = (MultiPartMesh) part(turbine, "rotor");

        assertEquals(blades + 1, rotor.partCount());
        assertTrue(rotor.containsPart("blade" + blades));
        assertFalse(rotor.containsPart("blade" + (blades + 1)));
    }

    @Test
    @DisplayName("Three blades are spaced 120 degrees about the rotor axis")
    void azimuthSpacing() {
        var turbine = new TurbineAssembler(catalog).assemble(TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0));
        var hubHeight = TurbineAssembler.hubHeight(HEIGHT, catalog.hub("hub").radius() * DIAMETER / 2.0);
        var step = Rotations.rotationX(Math.toRadians(120.0));

        for (int k = 1; k <= 3; k++) {
            var blade = part(turbine, "rotor/blade" + k);
            var next = part(turbine, "rotor/blade" + (k % 3 + 1));
            assertEquals(blade.nodeCount(), next.nodeCount());
            for (int n = 0; n < blade.nodeCount(); n++) {
                var expected = blade.getNode(n);
                expected.z -= hubHeight;
                step.transform(expected);
                expected.z += hubHeight;
                assertTrue(expected.epsilonEquals(next.getNode(n), EPSILON),
                           "blade " + k + " node " + n + ": " + expected + " vs " + next.getNode(n));
            }
        }
    }

    @Test
    @DisplayName("Blade azimuths step by a full turn over the blade count")
    void bladeAzimuth() {
        var tip = new Point3d(0, 0, 1);
        var second = TurbineAssembler.bladeAzimuth(2, 3).transform(tip);
        assertEquals(Math.toRadians(120.0), Math.atan2(-second.y, second.z), 1e-12);
        assertEquals(tip, TurbineAssembler.bladeAzimuth(1, 3).transform(tip));
        assertTrue(TurbineAssembler.bladeAzimuth(4, 4).transform(tip).epsilonEquals(new Point3d(0, 1, 0), 1e-12));
    }

    @Test
    @DisplayName("Tower reaches the tower height and blades start at the hub surface")
    void heights() {
        var spec = TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0);
        var turbine = new TurbineAssembler(catalog).assemble(spec);
        var hub = catalog.hub("hub");
        var hubRadius = hub.radius() * spec.radius();
        var hubHeight = TurbineAssembler.hubHeight(HEIGHT, hubRadius);

        var tower = zRange(part(turbine, "tower"));
        assertEquals(0.0, tower[0], EPSILON);
        assertEquals(HEIGHT, tower[1], EPSILON);

        var blade = zRange(part(turbine, "rotor/blade1"));
        assertEquals(hubHeight + hubRadius, blade[0], EPSILON);
        assertEquals(hubHeight + spec.radius(), blade[1], EPSILON);
    }

    @Test
    @DisplayName("Hub sits on the rotor axis with its nose upwind")
    void hubPlacement() {
        var spec = TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0);
        var turbine = new TurbineAssembler(catalog).assemble(spec);
        var part = catalog.hub("hub");
        var hubRadius = part.radius() * spec.radius();
        var thickness = part.thickness() * spec.radius();
        var hubHeight = TurbineAssembler.hubHeight(HEIGHT, hubRadius);

        var hub = part(turbine, "rotor/hub");
        var minX = Double.POSITIVE_INFINITY;
        var maxX = Double.NEGATIVE_INFINITY;
        for (int n = 0; n < hub.nodeCount(); n++) {
            var node = hub.getNode(n);
            minX = Math.min(minX, node.x);
            maxX = Math.max(maxX, node.x);
            assertTrue(Math.hypot(node.y, node.z - hubHeight) <= hubRadius + EPSILON);
        }
        assertEquals(-4.0 / 6.0 * thickness, minX, EPSILON);
        assertEquals(2.0 / 6.0 * thickness, maxX, EPSILON);
    }

    @Test
    @DisplayName("Assembly is repeatable and leaves the catalog untouched")
    void repeatable() {
        var assembler = new TurbineAssembler(catalog);
        var first = assembler.assemble(TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0));
        var second = assembler.assemble(TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0));

        assertEquals(first.nodeCount(), second.nodeCount());
        for (int n = 0; n < first.nodeCount(); n++) {
            assertEquals(first.getNode(n), second.getNode(n));
        }
    }

    @Test
    @DisplayName("Unknown part names fail")
    void unknownParts() {
        var assembler = new TurbineAssembler(catalog);
        var spec = TurbineSpec.of(DIAMETER, HEIGHT, 3, 0, 0, 0, 0);
        assertThrows(NoSuchElementException.class, () -> assembler.assemble(spec.withParts("nope", "tower1",
                                                                                           "NREL5MW")));
        assertThrows(NoSuchElementException.class, () -> assembler.assemble(spec.withParts("hub", "tower1",
                                                                                           "nope")));
    }

    @Test
    @DisplayName("Turbine specs are validated")
    void specValidation() {
        assertThrows(IllegalArgumentException.class, () -> TurbineSpec.of(0, HEIGHT, 3, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> TurbineSpec.of(DIAMETER, HEIGHT, 0, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> TurbineSpec.fromArrays(new double[] { 1, 2 }, new double[] { 1 }, new int[] { 3, 3 },
                                                  new double[2], new double[2], new double[2], new double[2]));
        var specs = TurbineSpec.fromArrays(new double[] { 100, 120 }, new double[] { 80, 90 }, new int[] { 3, 2 },
                                           new double[] { 0, 500 }, new double[2], new double[2],
                                           new double[] { 0, 30 });
        assertEquals(2, specs.size());
        assertEquals(ProceduralPartCatalog.DEFAULT_BLADE, specs.get(1).bladeName());
        assertEquals(60.0, specs.get(1).radius());
    }
}
