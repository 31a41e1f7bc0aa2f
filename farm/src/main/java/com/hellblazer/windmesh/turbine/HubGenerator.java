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

import com.hellblazer.windmesh.mesh.ParametricGrid;
import com.hellblazer.windmesh.mesh.TriangleSurface;
import com.hellblazer.windmesh.mesh.Triangulator;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Revolves the hub profile about +z. The open base sits at z = 0 and the nose at z = thickness.
 *
 * @author hal.hildebrand
 */
public final class HubGenerator {

    private HubGenerator() {
    }

    public static TriangleSurface generate(HubGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry cannot be null");
        var grid = ParametricGrid.construct(new double[] { 0.0, 0.0, 0.0 },
                                            new double[] { 2.0 * Math.PI, geometry.thickness(), 0.0 },
                                            new int[] { geometry.azimuthDivisions(), geometry.axialDivisions(), 0 },
                                            OptionalInt.of(0));
        grid.applyTransform((x, index) -> {
            var r = profile(geometry, x[1]);
            return new double[] { r * Math.cos(x[0]), r * Math.sin(x[0]), x[1] };
        });
        return Triangulator.triangulate(grid, 1);
    }

    /**
     * @return the hub radius at the axial position
     */
    static double profile(HubGeometry geometry, double z) {
        var capStart = geometry.thickness() * (1.0 - geometry.noseFraction());
        if (z <= capStart) {
            return geometry.radius();
        }
        var u = (z - capStart) / (geometry.thickness() - capStart);
        return geometry.radius() * Math.sqrt(Math.max(0.0, 1.0 - u * u));
    }
}
