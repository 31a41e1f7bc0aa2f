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
package com.hellblazer.windmesh.farm;

import com.hellblazer.windmesh.geometry.MeshGenerationException.InvalidContourException;
import com.hellblazer.windmesh.geometry.contour.Contour;
import com.hellblazer.windmesh.geometry.contour.ContourParameterizer;
import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.spline.SplineVerification;
import com.hellblazer.windmesh.mesh.ParametricGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Grids the region enclosed by a perimeter, flat or as a stack of layers.
 * <p>
 * The perimeter is split into lower and upper chains that are resampled at the same parameters. Node (i, j, k) lies
 * on the segment from the i-th lower sample to the i-th upper sample at the blend fraction of j, at the height of
 * layer k.
 *
 * @author hal.hildebrand
 */
public final class PerimeterGridGenerator {

    private static final Logger log = LoggerFactory.getLogger(PerimeterGridGenerator.class);

    private PerimeterGridGenerator() {
    }

    /**
     * @throws InvalidContourException if the perimeter cannot be split into x-monotonic chains
     */
    public static ParametricGrid generate(Contour perimeter, PerimeterGridConfiguration configuration) {
        Objects.requireNonNull(perimeter, "perimeter cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
        var split = ContourParameterizer.split(perimeter);
        var options = configuration.splineOptions();
        var mode = configuration.parameterMode();
        var arclength = configuration.arclengthDivisions();
        var upperCurve = ContourParameterizer.parameterize(split.upper(), options, mode);
        var lowerCurve = ContourParameterizer.parameterize(split.lower(), options, mode);
        if (configuration.verifySplines() && log.isDebugEnabled()) {
            var verifications = new ArrayList<SplineVerification>();
            verifications.addAll(ContourParameterizer.verify("upper", split.upper(), upperCurve));
            verifications.addAll(ContourParameterizer.verify("lower", split.lower(), lowerCurve));
            for (var verification : verifications) {
                log.debug("Spline fit {}", verification);
            }
        }
        var upper = ContourParameterizer.discretize(upperCurve, 0.0, 1.0, arclength);
        var lower = ContourParameterizer.discretize(lowerCurve, 0.0, 1.0, arclength);

        var grid = ParametricGrid.construct(new double[] { 0.0, 0.0, 0.0 },
                                            new double[] { 1.0, 1.0, configuration.isFlat() ? 0.0 : 1.0 },
                                            new Discretization[] { arclength, configuration.blendDivisions(),
                                                                   configuration.layerDivisions() },
                                            OptionalInt.empty());
        var zMin = configuration.zMin();
        var zMax = configuration.zMax();
        grid.applyTransform((x, index) -> {
            var lo = lower.get(index[0]);
            var up = upper.get(index[0]);
            var w = x[1];
            return new double[] { lo.x + w * (up.x - lo.x), lo.y + w * (up.y - lo.y), zMin + x[2] * (zMax - zMin) };
        });
        log.debug("Gridded perimeter of {} points into {}", perimeter.size(), grid);
        return grid;
    }
}
