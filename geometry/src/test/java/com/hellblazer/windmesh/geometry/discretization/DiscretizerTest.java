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
package com.hellblazer.windmesh.geometry.discretization;

import com.hellblazer.windmesh.geometry.MeshGenerationException.UnsupportedDiscretizationException;
import com.hellblazer.windmesh.geometry.discretization.Discretization.Section;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Discretizer Tests")
class DiscretizerTest {

    private static final double EPSILON = 1e-12;

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 7, 20 })
    @DisplayName("Uniform divisions are evenly spaced")
    void uniform(int divisions) {
        var params = Discretizer.parameters(2.0, 4.0, Discretization.uniform(divisions));
        assertEquals(divisions + 1, params.length);
        for (int i = 0; i <= divisions; i++) {
            assertEquals(2.0 + 2.0 * i / divisions, params[i], 1e-12);
        }
    }

    @Test
    @DisplayName("Zero divisions collapse to the start point")
    void collapsed() {
        var params = Discretizer.parameters(0.0, 1.0, Discretization.uniform(0));
        assertArrayEquals(new double[] { 0.0 }, params);
    }

    @Test
    @DisplayName("Expansion ratio is the last over first element length")
    void expansionRatio() {
        var params = Discretizer.parameters(0.0, 1.0, Discretization.stretched(10, 4.0));
        var first = params[1] - params[0];
        var last = params[10] - params[9];
        assertEquals(4.0, last / first, 1e-9);
        assertEquals(1.0, params[10]);
    }

    @Test
    @DisplayName("Sections concatenate without duplicating their shared points")
    void multiSection() {
        var descriptor = Discretization.sections(new Section(0.25, 4, 1.0, false), new Section(0.5, 10, 3.0, false),
                                                 new Section(0.25, 4, 3.0, true));
        assertEquals(18, descriptor.divisions());

        var params = Discretizer.parameters(0.0, 8.0, descriptor);
        assertEquals(19, params.length);
        assertEquals(0.0, params[0]);
        assertEquals(2.0, params[4], EPSILON);
        assertEquals(6.0, params[14], 1e-9);
        assertEquals(8.0, params[18]);
        for (int i = 1; i < params.length; i++) {
            assertTrue(params[i] > params[i - 1], "not increasing at " + i);
        }

        // reversed section clusters toward its end
        var firstOfLast = params[15] - params[14];
        var lastOfLast = params[18] - params[17];
        assertEquals(3.0, firstOfLast / lastOfLast, 1e-9);
    }

    @Test
    @DisplayName("Section fractions must sum to one")
    void fractionsValidated() {
        assertThrows(IllegalArgumentException.class,
                     () -> Discretization.sections(new Section(0.5, 4, 1.0, false), new Section(0.4, 4, 1.0, false)));
        assertThrows(IllegalArgumentException.class, () -> new Section(0.0, 4, 1.0, false));
        assertThrows(IllegalArgumentException.class, () -> new Section(1.0, 0, 1.0, false));
        assertThrows(IllegalArgumentException.class, () -> Discretization.uniform(-1));
        assertThrows(IllegalArgumentException.class, () -> Discretization.stretched(4, 0.0));
    }

    @Test
    @DisplayName("Unknown descriptors are rejected")
    void unsupported() {
        Discretization custom = () -> 3;
        assertThrows(UnsupportedDiscretizationException.class, () -> Discretizer.parameters(0.0, 1.0, custom));
        assertThrows(UnsupportedDiscretizationException.class, () -> Discretizer.parameters(0.0, 1.0, null));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 1.0000000000000002, 1.000000000001, 1.0000000001, 0.9999999999 })
    @DisplayName("Expansion ratios next to one give finite, nearly uniform spacing")
    void nearUnitRatio(double ratio) {
        var params = Discretizer.parameters(0.0, 1.0, Discretization.stretched(10, ratio));
        assertEquals(11, params.length);
        assertEquals(0.0, params[0]);
        assertEquals(1.0, params[10]);
        for (int i = 1; i < params.length; i++) {
            assertFalse(Double.isNaN(params[i]), "NaN at " + i);
            assertTrue(params[i] > params[i - 1], "not increasing at " + i);
            assertEquals(i / 10.0, params[i], 1e-9);
        }
    }

    @Test
    @DisplayName("The smallest ratio above one is not NaN")
    void smallestRatioAboveOne() {
        var params = Discretizer.parameters(0.0, 1.0, Discretization.stretched(10, Math.nextUp(1.0)));
        for (var p : params) {
            assertTrue(Double.isFinite(p));
        }
    }

    @Test
    @DisplayName("Function sampling follows the parameters")
    void discretize() {
        List<Double> squares = Discretizer.discretize(t -> t * t, 0.0, 1.0, Discretization.uniform(4));
        assertEquals(List.of(0.0, 0.0625, 0.25, 0.5625, 1.0), squares);
    }

    @Property
    @Label("Parameters are monotone with exact end points")
    void monotoneEnds(@ForAll @IntRange(min = 1, max = 60) int divisions,
                      @ForAll @DoubleRange(min = 0.05, max = 20.0) double ratio,
                      @ForAll @DoubleRange(min = -50, max = 50) double a,
                      @ForAll @DoubleRange(min = 0.1, max = 50) double length) {
        var b = a + length;
        var params = Discretizer.parameters(a, b, Discretization.stretched(divisions, ratio));
        assertEquals(divisions + 1, params.length);
        assertEquals(a, params[0]);
        assertEquals(b, params[divisions]);
        for (int i = 1; i < params.length; i++) {
            assertTrue(params[i] > params[i - 1], "not increasing at " + i);
        }
    }
}
