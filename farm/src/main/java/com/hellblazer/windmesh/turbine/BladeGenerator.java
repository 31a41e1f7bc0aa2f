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
import com.hellblazer.windmesh.loft.LoftConfiguration;
import com.hellblazer.windmesh.loft.LoftDefinition;
import com.hellblazer.windmesh.loft.LoftGenerator;
import com.hellblazer.windmesh.mesh.TriangleSurface;

import java.util.Objects;

/**
 * Blades are lofts spanning from the hub radius to the tip radius, scaled by the tip radius. The blade spans +y with
 * its chord along x.
 *
 * @author hal.hildebrand
 */
public final class BladeGenerator {

    private BladeGenerator() {
    }

    public static TriangleSurface generate(double tipRadius, double hubRadius, Discretization spanDivisions,
                                           LoftDefinition loft, SplineOptions splineOptions) {
        Objects.requireNonNull(loft, "loft cannot be null");
        if (!(tipRadius > hubRadius) || hubRadius < 0.0) {
            throw new IllegalArgumentException(
            String.format("tip radius %f must exceed hub radius %f", tipRadius, hubRadius));
        }
        var configuration = LoftConfiguration.defaultConfig()
                                             .withSpanScale(tipRadius)
                                             .withSpan(hubRadius / tipRadius, 1.0)
                                             .withSpanDivisions(spanDivisions)
                                             .withSplineOptions(splineOptions);
        return LoftGenerator.generate(loft, configuration);
    }

    /**
     * Generates the blade at the given tip radius using the definition's own hub radius and meshing.
     */
    public static TriangleSurface generate(double tipRadius, BladeDefinition definition) {
        Objects.requireNonNull(definition, "definition cannot be null");
        return generate(tipRadius, definition.hubRadiusRatio() * tipRadius, definition.spanDivisions(),
                        definition.loft(), definition.splineOptions());
    }
}
