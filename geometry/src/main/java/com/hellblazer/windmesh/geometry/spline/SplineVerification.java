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
 * Residuals of a fitted spline at its own control points.
 *
 * @param name        label of the verified distribution
 * @param residuals   fitted minus tabulated value at each control point
 * @param maxResidual largest absolute residual
 * @author hal.hildebrand
 */
public record SplineVerification(String name, double[] residuals, double maxResidual) {

    public SplineVerification {
        Objects.requireNonNull(name, "name cannot be null");
        residuals = residuals.clone();
    }

    public static SplineVerification verify(String name, DistributionCurve table, SplineCurve curve) {
        var residuals = new double[table.size()];
        var max = 0.0;
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = curve.evaluate(table.position(i)) - table.value(i);
            max = Math.max(max, Math.abs(residuals[i]));
        }
        return new SplineVerification(name, residuals, max);
    }

    @Override
    public double[] residuals() {
        return residuals.clone();
    }

    /**
     * @return the residual sum of squares
     */
    public double sumOfSquares() {
        var sum = 0.0;
        for (var r : residuals) {
            sum += r * r;
        }
        return sum;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SplineVerification other)) return false;
        return name.equals(other.name) && Arrays.equals(residuals, other.residuals)
        && Double.compare(maxResidual, other.maxResidual) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, Arrays.hashCode(residuals), maxResidual);
    }

    @Override
    public String toString() {
        return String.format("SplineVerification[%s: points=%d, maxResidual=%.3e]", name, residuals.length,
                             maxResidual);
    }
}
