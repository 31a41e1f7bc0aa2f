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
import java.util.Objects;

/**
 * A tabulated distribution along the span (chord, twist, leading edge, tilt): ordered (position, value) pairs with
 * strictly increasing positions.
 *
 * @author hal.hildebrand
 */
public final class DistributionCurve {

    private final double[] positions;
    private final double[] values;

    public DistributionCurve(double[] positions, double[] values) {
        Objects.requireNonNull(positions, "positions cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (positions.length != values.length) {
            throw new IllegalArgumentException("positions and values must have the same length");
        }
        if (positions.length == 0) {
            throw new IllegalArgumentException("distribution cannot be empty");
        }
        for (int i = 1; i < positions.length; i++) {
            if (positions[i] <= positions[i - 1]) {
                throw new IllegalArgumentException("positions must be strictly increasing at index " + i);
            }
        }
        this.positions = positions.clone();
        this.values = values.clone();
    }

    /**
     * Creates a distribution from rows of (position, value).
     */
    public static DistributionCurve of(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        var positions = new double[rows.length];
        var values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != 2) {
                throw new IllegalArgumentException("row " + i + " must hold exactly (position, value)");
            }
            positions[i] = rows[i][0];
            values[i] = rows[i][1];
        }
        return new DistributionCurve(positions, values);
    }

    /**
     * A distribution holding the same value at both positions.
     */
    public static DistributionCurve constant(double from, double to, double value) {
        return new DistributionCurve(new double[] { from, to }, new double[] { value, value });
    }

    public SplineCurve fit(SplineOptions options) {
        return SplineInterpolator.fit(positions, values, options);
    }

    public int size() {
        return positions.length;
    }

    public double position(int i) {
        return positions[i];
    }

    public double value(int i) {
        return values[i];
    }

    public double[] positions() {
        return positions.clone();
    }

    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DistributionCurve other)) return false;
        return Arrays.equals(positions, other.positions) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(positions) * 31 + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DistributionCurve{points=" + positions.length + '}';
    }
}
