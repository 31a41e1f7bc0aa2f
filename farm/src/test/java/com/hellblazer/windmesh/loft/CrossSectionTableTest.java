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
package com.hellblazer.windmesh.loft;

import com.hellblazer.windmesh.geometry.MeshGenerationException.SectionMismatchException;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Cross Section Table Tests")
class CrossSectionTableTest {

    private static CrossSection square(double position, double size) {
        return CrossSection.of(position, new double[][] { { size, 0 }, { 0, 0 }, { 0, size }, { size, size } });
    }

    private static CrossSectionTable table() {
        return CrossSectionTable.of(square(0.0, 1.0), square(0.5, 2.0), square(1.0, 4.0));
    }

    @Property
    @Label("Bracketing sections are adjacent with a weight in [0, 1]")
    void bracketWeight(@ForAll @DoubleRange(min = -0.5, max = 1.5) double span) {
        var table = table();
        var bracket = table.bracket(span);

        assertEquals(bracket.inIndex() + 1, bracket.outIndex());
        assertTrue(bracket.weight() >= 0.0 && bracket.weight() <= 1.0);
        if (span >= 0.0 && span <= 1.0) {
            assertTrue(table.section(bracket.inIndex()).position() <= span);
            assertTrue(table.section(bracket.outIndex()).position() >= span);
        }
    }

    @Test
    @DisplayName("Weights interpolate linearly between positions")
    void bracketValues() {
        var table = table();
        assertEquals(new SectionBlend(0, 1, 0.5), table.bracket(0.25));
        assertEquals(new SectionBlend(1, 2, 0.5), table.bracket(0.75));
        assertEquals(new SectionBlend(0, 1, 1.0), table.bracket(0.5));
        assertEquals(new SectionBlend(1, 2, 1.0), table.bracket(1.0));
        assertEquals(new SectionBlend(1, 2, 1.0), table.bracket(3.0));
        assertEquals(new SectionBlend(0, 1, 0.0), table.bracket(-1.0));
    }

    @Test
    @DisplayName("Blend mixes corresponding points")
    void blend() {
        var table = table();
        assertEquals(new Point2d(1.5, 1.5), table.blend(table.bracket(0.25), 3));
        assertEquals(new Point2d(0, 3), table.blend(table.bracket(0.75), 2));
    }

    @Test
    @DisplayName("A single section is used everywhere")
    void singleSection() {
        var table = CrossSectionTable.of(square(0.3, 1.0));
        assertEquals(new SectionBlend(0, 0, 0.0), table.bracket(0.9));
        assertEquals(new Point2d(1, 1), table.blend(table.bracket(0.0), 3));
    }

    @Test
    @DisplayName("Sections must share a point count")
    void mismatch() {
        var triangle = CrossSection.of(0.5, new double[][] { { 1, 0 }, { 0, 0 }, { 0, 1 } });
        var e = assertThrows(SectionMismatchException.class,
                             () -> CrossSectionTable.of(square(0.0, 1.0), triangle));
        assertEquals(4, e.getExpectedPoints());
        assertEquals(3, e.getActualPoints());
    }

    @Test
    @DisplayName("Positions must be strictly increasing")
    void unsorted() {
        assertThrows(IllegalArgumentException.class,
                     () -> CrossSectionTable.of(square(0.5, 1.0), square(0.0, 1.0)));
        assertThrows(IllegalArgumentException.class,
                     () -> CrossSectionTable.of(square(0.5, 1.0), square(0.5, 2.0)));
        assertThrows(IllegalArgumentException.class, () -> new CrossSectionTable(List.of()));
    }

    @Test
    @DisplayName("Sections are immutable")
    void immutable() {
        var section = square(0.0, 1.0);
        section.point(0).set(9, 9);
        assertEquals(new Point2d(1, 0), section.point(0));
        assertThrows(UnsupportedOperationException.class, () -> section.points().add(new Point2d()));
        assertThrows(IllegalArgumentException.class,
                     () -> CrossSection.of(0.0, new double[][] { { 0, 0 }, { 1, 1 } }));
    }
}
