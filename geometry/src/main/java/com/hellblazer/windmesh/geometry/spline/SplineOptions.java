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

import java.util.Objects;

/**
 * Fit parameters for {@link SplineInterpolator}.
 *
 * @param degree         requested polynomial degree, 1 to 5; lowered to point count - 1 when fewer points exist
 * @param smoothing      upper bound of the residual sum of squares, 0 for exact interpolation
 * @param boundaryPolicy behavior outside the fitted range
 * @author hal.hildebrand
 */
public record SplineOptions(int degree, double smoothing, BoundaryPolicy boundaryPolicy) {

    public static final int    MAX_DEGREE        = 5;
    public static final double DEFAULT_SMOOTHING = 0.001;

    public SplineOptions {
        Objects.requireNonNull(boundaryPolicy, "boundaryPolicy cannot be null");
        if (degree < 1 || degree > MAX_DEGREE) {
            throw new IllegalArgumentException("degree must be between 1 and " + MAX_DEGREE + ": " + degree);
        }
        if (smoothing < 0.0 || Double.isNaN(smoothing)) {
            throw new IllegalArgumentException("smoothing must be non-negative: " + smoothing);
        }
    }

    /**
     * Quintic, lightly smoothed, extrapolating. Used for span distributions.
     */
    public static SplineOptions loftDefaults() {
        return new SplineOptions(5, DEFAULT_SMOOTHING, BoundaryPolicy.EXTRAPOLATE);
    }

    /**
     * Cubic, lightly smoothed, extrapolating. Used for contour reparameterization.
     */
    public static SplineOptions contourDefaults() {
        return new SplineOptions(3, DEFAULT_SMOOTHING, BoundaryPolicy.EXTRAPOLATE);
    }

    /**
     * Exact interpolation of the given degree.
     */
    public static SplineOptions interpolating(int degree) {
        return new SplineOptions(degree, 0.0, BoundaryPolicy.EXTRAPOLATE);
    }

    public SplineOptions withDegree(int newDegree) {
        return new SplineOptions(newDegree, smoothing, boundaryPolicy);
    }

    public SplineOptions withSmoothing(double newSmoothing) {
        return new SplineOptions(degree, newSmoothing, boundaryPolicy);
    }

    public SplineOptions withBoundaryPolicy(BoundaryPolicy newPolicy) {
        return new SplineOptions(degree, smoothing, newPolicy);
    }
}
