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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleFunction;

/**
 * Samples intervals and parametric curves according to a {@link Discretization}.
 *
 * @author hal.hildebrand
 */
public final class Discretizer {

    /** Log growth per element below which spacing is treated as uniform. */
    private static final double UNIFORM_THRESHOLD = 1e-12;

    private Discretizer() {
    }

    /**
     * Parameter values from a to b, inclusive, following the descriptor.
     *
     * @param a              the start of the interval
     * @param b              the end of the interval
     * @param discretization the descriptor
     * @return divisions + 1 monotone values, the first exactly a and the last exactly b
     * @throws UnsupportedDiscretizationException if the descriptor is neither uniform nor multi-section
     */
    public static double[] parameters(double a, double b, Discretization discretization) {
        if (discretization instanceof Discretization.Uniform uniform) {
            return geometric(a, b, uniform.divisions(), uniform.expansionRatio(), false);
        } else if (discretization instanceof Discretization.MultiSection multi) {
            return sectioned(a, b, multi);
        } else {
            throw new UnsupportedDiscretizationException(discretization);
        }
    }

    /**
     * Samples the function at the descriptor's parameter values between t0 and t1.
     *
     * @return divisions + 1 samples in order
     */
    public static <T> List<T> discretize(DoubleFunction<T> function, double t0, double t1,
                                         Discretization discretization) {
        var params = parameters(t0, t1, discretization);
        var result = new ArrayList<T>(params.length);
        for (var t : params) {
            result.add(function.apply(t));
        }
        return result;
    }

    private static double[] sectioned(double a, double b, Discretization.MultiSection multi) {
        var result = new double[multi.divisions() + 1];
        result[0] = a;
        var index = 1;
        var start = a;
        var consumed = 0.0;
        var sections = multi.sections();
        for (int s = 0; s < sections.size(); s++) {
            var section = sections.get(s);
            consumed += section.lengthFraction();
            var end = s == sections.size() - 1 ? b : a + consumed * (b - a);
            var local = geometric(start, end, section.divisions(), section.expansionRatio(), section.reversed());
            System.arraycopy(local, 1, result, index, local.length - 1);
            index += local.length - 1;
            start = end;
        }
        return result;
    }

    /**
     * Element lengths form a geometric progression whose last/first ratio is the expansion ratio.
     */
    static double[] geometric(double a, double b, int divisions, double expansionRatio, boolean reversed) {
        var result = new double[divisions + 1];
        result[0] = a;
        if (divisions == 0) {
            return result;
        }
        var length = b - a;
        var lengths = new double[divisions];
        var lr = divisions == 1 ? 0.0 : Math.log(expansionRatio) / (divisions - 1);
        if (Math.abs(lr) < UNIFORM_THRESHOLD) {
            Arrays.fill(lengths, length / divisions);
        } else {
            var first = length * Math.expm1(lr) / Math.expm1(lr * divisions);
            for (int i = 0; i < divisions; i++) {
                lengths[i] = first * Math.exp(lr * i);
            }
        }
        for (int i = 1; i <= divisions; i++) {
            result[i] = result[i - 1] + lengths[reversed ? divisions - i : i - 1];
        }
        result[divisions] = b;
        return result;
    }
}
