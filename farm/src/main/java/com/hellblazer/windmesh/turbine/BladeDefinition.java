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
package com.hellblazer.windmesh.turbine;

import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.spline.SplineOptions;
import com.hellblazer.windmesh.loft.LoftDefinition;

import java.util.Objects;

/**
 * A named blade: its loft with span positions as fractions of the tip radius, the hub radius it is designed for
 * (also as a fraction of the tip radius) and how it is meshed.
 *
 * @author hal.hildebrand
 */
public record BladeDefinition(String name, LoftDefinition loft, double hubRadiusRatio, Discretization spanDivisions,
                              SplineOptions splineOptions) {

    public BladeDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(loft, "loft cannot be null");
        Objects.requireNonNull(spanDivisions, "spanDivisions cannot be null");
        Objects.requireNonNull(splineOptions, "splineOptions cannot be null");
        if (!(hubRadiusRatio >= 0.0 && hubRadiusRatio < 1.0)) {
            throw new IllegalArgumentException("hubRadiusRatio must be in [0, 1): " + hubRadiusRatio);
        }
    }
}
