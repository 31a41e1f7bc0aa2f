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

import com.hellblazer.windmesh.geometry.contour.Contours;
import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.spline.DistributionCurve;
import com.hellblazer.windmesh.geometry.spline.SplineOptions;
import com.hellblazer.windmesh.loft.CrossSection;
import com.hellblazer.windmesh.loft.CrossSectionTable;
import com.hellblazer.windmesh.loft.LoftConfiguration;
import com.hellblazer.windmesh.loft.LoftDefinition;
import com.hellblazer.windmesh.loft.LoftGenerator;
import com.hellblazer.windmesh.mesh.TriangleSurface;

import java.util.Collections;
import java.util.Objects;

/**
 * Towers are lofts of unit circles whose chord is the local diameter. The tower rises along +y from the origin.
 *
 * @author hal.hildebrand
 */
public final class TowerGenerator {

    private TowerGenerator() {
    }

    public static TriangleSurface generate(TowerGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry cannot be null");
        // clockwise so the loft's normals face outward
        var circle = Contours.circle(geometry.circleDivisions(), 0.5);
        Collections.reverse(circle);
        var sections = CrossSectionTable.of(new CrossSection(0.0, circle), new CrossSection(1.0, circle));

        var h = geometry.height();
        var definition = LoftDefinition.of(new DistributionCurve(new double[] { 0.0, 1.0 },
                                                                 new double[] { geometry.baseDiameter() / h,
                                                                                geometry.topDiameter() / h }),
                                           DistributionCurve.constant(0.0, 1.0, 0.0),
                                           DistributionCurve.constant(0.0, 1.0, 0.0),
                                           DistributionCurve.constant(0.0, 1.0, 0.0), sections);
        var configuration = LoftConfiguration.defaultConfig()
                                             .withSpanScale(h)
                                             .withSpanDivisions(Discretization.uniform(geometry.heightDivisions()))
                                             .withSplineOptions(SplineOptions.interpolating(1))
                                             .withVerifySplines(false);
        return LoftGenerator.generate(definition, configuration);
    }
}
