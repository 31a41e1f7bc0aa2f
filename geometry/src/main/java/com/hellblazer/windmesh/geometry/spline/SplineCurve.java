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
package com.hellblazer.windmesh.geometry.spline;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * A fitted 1D B-spline y(x) on a clamped knot vector.
 * <p>
 * Immutable and thread safe. Created by {@link SplineInterpolator}.
 *
 * @author hal.hildebrand
 */
public final class SplineCurve implements DoubleUnaryOperator {

    private final int            degree;
    private final double[]       knots;
    private final double[]       coefficients;
    private final double         lower;
    private final double         upper;
    private final BoundaryPolicy boundaryPolicy;

    SplineCurve(int degree, double[] knots, double[] coefficients, double lower, double upper,
                BoundaryPolicy boundaryPolicy) {
        this.degree = degree;
        this.knots = knots;
        this.coefficients = coefficients;
        this.lower = lower;
        this.upper = upper;
        this.boundaryPolicy = boundaryPolicy;
    }

    /**
     * Evaluates the curve.
     *
     * @param x the position
     * @return the value at x
     * @throws IllegalArgumentException if x is outside the fitted range under {@link BoundaryPolicy#ERROR}
     */
    public double evaluate(double x) {
        if (Double.isNaN(x)) {
            throw new IllegalArgumentException("Cannot evaluate spline at NaN");
        }
        if (x < lower || x > upper) {
            switch (boundaryPolicy) {
                case NEAREST:
                    return deBoor(x < lower ? lower : upper);
                case ZERO:
                    return 0.0;
                case ERROR:
                    throw new IllegalArgumentException(
                    String.format("Position %f outside spline range [%f, %f]", x, lower, upper));
                case EXTRAPOLATE:
                default:
                    break;
            }
        }
        return deBoor(x);
    }

    @Override
    public double applyAsDouble(double x) {
        return evaluate(x);
    }

    private double deBoor(double x) {
        if (degree == 0) {
            return coefficients[0];
        }
        var span = findSpan(x, degree, knots, coefficients.length);
        var d = new double[degree + 1];
        for (int j = 0; j <= degree; j++) {
            d[j] = coefficients[j + span - degree];
        }
        for (int r = 1; r <= degree; r++) {
            for (int j = degree; j >= r; j--) {
                var left = knots[j + span - degree];
                var alpha = (x - left) / (knots[j + 1 + span - r] - left);
                d[j] = (1.0 - alpha) * d[j - 1] + alpha * d[j];
            }
        }
        return d[degree];
    }

    /**
     * Index l of the knot interval [t_l, t_l+1) holding x, clamped to the first and last non-empty interval so that
     * positions outside the range continue the end polynomial pieces.
     */
    static int findSpan(double x, int degree, double[] knots, int n) {
        if (x >= knots[n]) {
            return n - 1;
        }
        if (x <= knots[degree]) {
            return degree;
        }
        var low = degree;
        var high = n;
        while (high - low > 1) {
            var mid = (low + high) >>> 1;
            if (x < knots[mid]) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return low;
    }

    /**
     * Values of the degree + 1 basis functions that are non-zero on the given span, N_(span-degree) .. N_span.
     */
    static double[] basisFunctions(int span, double x, int degree, double[] knots) {
        var basis = new double[degree + 1];
        var left = new double[degree + 1];
        var right = new double[degree + 1];
        basis[0] = 1.0;
        for (int j = 1; j <= degree; j++) {
            left[j] = x - knots[span + 1 - j];
            right[j] = knots[span + j] - x;
            var saved = 0.0;
            for (int r = 0; r < j; r++) {
                var temp = basis[r] / (right[r + 1] + left[j - r]);
                basis[r] = saved + right[r + 1] * temp;
                saved = left[j - r] * temp;
            }
            basis[j] = saved;
        }
        return basis;
    }

    public int degree() {
        return degree;
    }

    public double lowerBound() {
        return lower;
    }

    public double upperBound() {
        return upper;
    }

    public BoundaryPolicy boundaryPolicy() {
        return boundaryPolicy;
    }

    public double[] knots() {
        return knots.clone();
    }

    public double[] coefficients() {
        return coefficients.clone();
    }

    @Override
    public String toString() {
        return String.format("SplineCurve{degree=%d, range=[%f, %f], policy=%s, knots=%s}", degree, lower, upper,
                             boundaryPolicy, Arrays.toString(knots));
    }
}
