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

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fits smoothing B-splines through scattered 1D control points.
 * <p>
 * The spline has one coefficient per control point on a clamped knot vector whose interior knots are the running
 * averages of the control positions, which keeps the collocation system non-singular. With zero smoothing the
 * collocation system is solved directly and the curve interpolates every point. With smoothing s &gt; 0 a second
 * difference penalty on the coefficients is added and its weight is chosen by bisection as the largest weight
 * whose residual sum of squares stays within s.
 *
 * @author hal.hildebrand
 */
public final class SplineInterpolator {

    private static final Logger log = LoggerFactory.getLogger(SplineInterpolator.class);

    private static final double MIN_LOG_PENALTY     = -12.0;
    private static final double MAX_LOG_PENALTY     = 10.0;
    private static final int    PENALTY_BISECTIONS  = 48;

    private SplineInterpolator() {
    }

    public static SplineCurve fit(double[] positions, double[] values, SplineOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        return fit(positions, values, options.degree(), options.smoothing(), options.boundaryPolicy());
    }

    /**
     * Fits a spline through the points (positions[i], values[i]).
     *
     * @param positions      strictly increasing positions
     * @param values         values at the positions
     * @param degree         requested degree; the effective degree is min(degree, point count - 1)
     * @param smoothing      upper bound for the residual sum of squares, 0 to interpolate
     * @param boundaryPolicy behavior outside [positions[0], positions[n - 1]]
     * @return the fitted curve
     * @throws IllegalArgumentException if the points are empty, mismatched, non-finite or not strictly increasing
     */
    public static SplineCurve fit(double[] positions, double[] values, int degree, double smoothing,
                                  BoundaryPolicy boundaryPolicy) {
        Objects.requireNonNull(positions, "positions cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(boundaryPolicy, "boundaryPolicy cannot be null");
        validate(positions, values);
        if (degree < 1) {
            throw new IllegalArgumentException("degree must be positive: " + degree);
        }

        var n = positions.length;
        var k = Math.min(degree, n - 1);
        if (k < degree) {
            log.debug("Lowering spline degree from {} to {} for {} control points", degree, k, n);
        }
        if (k == 0) {
            return new SplineCurve(0, new double[] { positions[0], positions[0] }, new double[] { values[0] },
                                   positions[0], positions[0], boundaryPolicy);
        }

        var knots = knots(positions, k);
        var collocation = collocation(positions, k, knots);
        var rhs = new DMatrixRMaj(n, 1, true, values);

        double[] coefficients;
        if (smoothing <= 0.0 || n < 3) {
            coefficients = solve(collocation, rhs);
        } else {
            coefficients = smooth(collocation, rhs, smoothing);
        }
        return new SplineCurve(k, knots, coefficients, positions[0], positions[n - 1], boundaryPolicy);
    }

    private static void validate(double[] positions, double[] values) {
        if (positions.length != values.length) {
            throw new IllegalArgumentException(
            String.format("positions (%d) and values (%d) must have the same length", positions.length,
                          values.length));
        }
        if (positions.length == 0) {
            throw new IllegalArgumentException("At least one control point is required");
        }
        for (int i = 0; i < positions.length; i++) {
            if (!Double.isFinite(positions[i]) || !Double.isFinite(values[i])) {
                throw new IllegalArgumentException("Control point " + i + " is not finite");
            }
            if (i > 0 && positions[i] <= positions[i - 1]) {
                throw new IllegalArgumentException(
                String.format("positions must be strictly increasing: %f at %d follows %f", positions[i], i,
                              positions[i - 1]));
            }
        }
    }

    /**
     * Clamped knot vector of length n + k + 1 with averaged interior knots.
     */
    static double[] knots(double[] positions, int k) {
        var n = positions.length;
        var knots = new double[n + k + 1];
        for (int i = 0; i <= k; i++) {
            knots[i] = positions[0];
            knots[n + i] = positions[n - 1];
        }
        for (int j = 1; j < n - k; j++) {
            var sum = 0.0;
            for (int i = j; i < j + k; i++) {
                sum += positions[i];
            }
            knots[j + k] = sum / k;
        }
        return knots;
    }

    private static DMatrixRMaj collocation(double[] positions, int k, double[] knots) {
        var n = positions.length;
        var matrix = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) {
            var span = SplineCurve.findSpan(positions[i], k, knots, n);
            var basis = SplineCurve.basisFunctions(span, positions[i], k, knots);
            for (int r = 0; r <= k; r++) {
                matrix.set(i, span - k + r, basis[r]);
            }
        }
        return matrix;
    }

    private static double[] solve(DMatrixRMaj a, DMatrixRMaj b) {
        var x = new DMatrixRMaj(a.numCols, 1);
        if (!CommonOps_DDRM.solve(a.copy(), b, x)) {
            throw new IllegalArgumentException("Spline system is singular");
        }
        return x.getData().clone();
    }

    private static double[] smooth(DMatrixRMaj collocation, DMatrixRMaj rhs, double smoothing) {
        var n = collocation.numCols;
        var difference = new DMatrixRMaj(n - 2, n);
        for (int i = 0; i < n - 2; i++) {
            difference.set(i, i, 1.0);
            difference.set(i, i + 1, -2.0);
            difference.set(i, i + 2, 1.0);
        }
        var normal = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(collocation, collocation, normal);
        var penalty = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(difference, difference, penalty);
        var projected = new DMatrixRMaj(n, 1);
        CommonOps_DDRM.multTransA(collocation, rhs, projected);

        var strongest = penalized(normal, penalty, projected, Math.pow(10.0, MAX_LOG_PENALTY));
        if (residual(collocation, rhs, strongest) <= smoothing) {
            return strongest;
        }
        var weakest = penalized(normal, penalty, projected, Math.pow(10.0, MIN_LOG_PENALTY));
        if (residual(collocation, rhs, weakest) > smoothing) {
            return solve(collocation, rhs);
        }

        var low = MIN_LOG_PENALTY;
        var high = MAX_LOG_PENALTY;
        var best = weakest;
        for (int i = 0; i < PENALTY_BISECTIONS; i++) {
            var mid = 0.5 * (low + high);
            var candidate = penalized(normal, penalty, projected, Math.pow(10.0, mid));
            if (residual(collocation, rhs, candidate) <= smoothing) {
                low = mid;
                best = candidate;
            } else {
                high = mid;
            }
        }
        log.trace("Smoothing {} reached with penalty 1e{}", smoothing, low);
        return best;
    }

    private static double[] penalized(DMatrixRMaj normal, DMatrixRMaj penalty, DMatrixRMaj projected,
                                      double weight) {
        var system = new DMatrixRMaj(normal.numRows, normal.numCols);
        CommonOps_DDRM.add(normal, weight, penalty, system);
        return solve(system, projected);
    }

    private static double residual(DMatrixRMaj collocation, DMatrixRMaj rhs, double[] coefficients) {
        var fitted = new DMatrixRMaj(collocation.numRows, 1);
        CommonOps_DDRM.mult(collocation, new DMatrixRMaj(coefficients.length, 1, true, coefficients), fitted);
        var sum = 0.0;
        for (int i = 0; i < fitted.numRows; i++) {
            var d = fitted.get(i, 0) - rhs.get(i, 0);
            sum += d * d;
        }
        return sum;
    }
}
