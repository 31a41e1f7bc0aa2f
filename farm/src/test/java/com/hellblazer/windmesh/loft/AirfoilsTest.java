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

import com.hellblazer.windmesh.geometry.contour.Contour;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Airfoil Tests")
class AirfoilsTest {

    @Test
    @DisplayName("Symmetric section runs from the trailing edge around the leading edge and back")
    void symmetric() {
        var n = 40;
        var outline = Airfoils.naca4("0012", n);

        assertEquals(2 * n + 1, outline.size());
        assertEquals(outline.get(0), outline.get(2 * n));
        assertEquals(1.0, outline.get(0).x, 1e-12);
        assertEquals(0.0, outline.get(0).y, 1e-9);
        assertEquals(0.0, outline.get(n).x, 1e-12);
        assertEquals(0.0, outline.get(n).y, 1e-12);
        for (int k = 1; k < n; k++) {
            var lower = outline.get(k);
            var upper = outline.get(2 * n - k);
            assertEquals(lower.x, upper.x, 1e-12);
            assertEquals(-lower.y, upper.y, 1e-12);
            assertTrue(lower.y < 0.0);
        }
    }

    @Test
    @DisplayName("Maximum thickness matches the designation")
    void thickness() {
        var n = 60;
        var outline = Airfoils.naca4("0015", n);
        var max = 0.0;
        for (int k = 0; k <= n; k++) {
            max = Math.max(max, outline.get(2 * n - k).y - outline.get(k).y);
        }
        assertEquals(0.15, max, 0.002);
    }

    @Test
    @DisplayName("Outlines are clockwise")
    void clockwise() {
        assertTrue(new Contour(Airfoils.naca4("0012", 20)).signedArea() < 0.0);
        assertTrue(new Contour(Airfoils.naca4("4415", 20)).signedArea() < 0.0);
    }

    @Test
    @DisplayName("Camber lifts the mean line")
    void camber() {
        var n = 30;
        var outline = Airfoils.naca4("2412", n);
        var mean = 0.0;
        for (int k = 1; k < n; k++) {
            mean += outline.get(k).y + outline.get(2 * n - k).y;
        }
        assertTrue(mean > 0.0);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = { "", "12", "00120", "abcd", "0000" })
    @DisplayName("Invalid designations are rejected")
    void invalid(String designation) {
        assertThrows(IllegalArgumentException.class, () -> Airfoils.naca4(designation, 10));
    }
}
