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

import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.spline.SplineOptions;

import java.util.Objects;

/**
 * How a loft definition is turned into a grid.
 *
 * @param spanScale      span reference length; the finished loft is scaled by it
 * @param spanLow        lower span bound in reference units, negative for a symmetric wing
 * @param spanHigh       upper span bound in reference units
 * @param spanDivisions  discretization between the bounds
 * @param splineOptions  fit options for every distribution
 * @param verifySplines  whether spline residuals are logged
 * @author hal.hildebrand
 */
public record LoftConfiguration(double spanScale, double spanLow, double spanHigh, Discretization spanDivisions,
                                SplineOptions splineOptions, boolean verifySplines) {

    public static final int DEFAULT_SPAN_DIVISIONS = 20;

    public LoftConfiguration {
        Objects.requireNonNull(spanDivisions, "spanDivisions cannot be null");
        Objects.requireNonNull(splineOptions, "splineOptions cannot be null");
        if (!(spanScale > 0.0) || Double.isInfinite(spanScale)) {
            throw new IllegalArgumentException("spanScale must be positive: " + spanScale);
        }
        if (!(spanHigh > spanLow)) {
            throw new IllegalArgumentException(
            String.format("span bounds must increase: [%f, %f]", spanLow, spanHigh));
        }
        if (spanDivisions.divisions() < 1) {
            throw new IllegalArgumentException("a loft needs at least one span division");
        }
    }

    /**
     * Semi-span from 0 to 1 at unit scale.
     */
    public static LoftConfiguration defaultConfig() {
        return new LoftConfiguration(1.0, 0.0, 1.0, Discretization.uniform(DEFAULT_SPAN_DIVISIONS),
                                     SplineOptions.loftDefaults(), true);
    }

    public LoftConfiguration withSpanScale(double newSpanScale) {
        return new LoftConfiguration(newSpanScale, spanLow, spanHigh, spanDivisions, splineOptions, verifySplines);
    }

    public LoftConfiguration withSpan(double newSpanLow, double newSpanHigh) {
        return new LoftConfiguration(spanScale, newSpanLow, newSpanHigh, spanDivisions, splineOptions,
                                     verifySplines);
    }

    public LoftConfiguration withSpanDivisions(Discretization newSpanDivisions) {
        return new LoftConfiguration(spanScale, spanLow, spanHigh, newSpanDivisions, splineOptions, verifySplines);
    }

    public LoftConfiguration withSplineOptions(SplineOptions newSplineOptions) {
        return new LoftConfiguration(spanScale, spanLow, spanHigh, spanDivisions, newSplineOptions, verifySplines);
    }

    public LoftConfiguration withVerifySplines(boolean newVerifySplines) {
        return new LoftConfiguration(spanScale, spanLow, spanHigh, spanDivisions, splineOptions, newVerifySplines);
    }
}
