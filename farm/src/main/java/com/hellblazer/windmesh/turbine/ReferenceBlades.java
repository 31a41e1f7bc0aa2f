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
import com.hellblazer.windmesh.geometry.spline.DistributionCurve;
import com.hellblazer.windmesh.geometry.spline.SplineOptions;
import com.hellblazer.windmesh.loft.Airfoils;
import com.hellblazer.windmesh.loft.CrossSection;
import com.hellblazer.windmesh.loft.CrossSectionTable;
import com.hellblazer.windmesh.loft.LoftDefinition;

/**
 * Built-in blade definitions.
 *
 * @author hal.hildebrand
 */
public final class ReferenceBlades {

    public static final String NREL_5MW = "NREL5MW";

    private static final double NREL_TIP_RADIUS = 63.0;
    private static final double NREL_HUB_RADIUS = 1.5;

    // radius (m), chord (m), twist (deg); NREL 5-MW reference turbine blade stations plus root and tip
    private static final double[][] NREL_STATIONS = { { 1.5, 3.542, 13.308 }, { 2.8667, 3.542, 13.308 },
                                                      { 5.6, 3.854, 13.308 }, { 8.3333, 4.167, 13.308 },
                                                      { 11.75, 4.557, 13.308 }, { 15.85, 4.652, 11.480 },
                                                      { 19.95, 4.458, 10.162 }, { 24.05, 4.249, 9.011 },
                                                      { 28.15, 4.007, 7.795 }, { 32.25, 3.748, 6.544 },
                                                      { 36.35, 3.502, 5.361 }, { 40.45, 3.256, 4.188 },
                                                      { 44.55, 3.010, 3.125 }, { 48.65, 2.764, 2.319 },
                                                      { 52.75, 2.518, 1.526 }, { 56.1667, 2.313, 0.863 },
                                                      { 58.9, 2.086, 0.370 }, { 61.6333, 1.419, 0.106 },
                                                      { 63.0, 1.0, 0.0 } };

    // span fraction, camber, thickness
    private static final double[][] NREL_SECTIONS = { { NREL_HUB_RADIUS / NREL_TIP_RADIUS, 0.0, 0.60 },
                                                      { 0.19, 0.02, 0.40 }, { 0.32, 0.02, 0.30 },
                                                      { 0.50, 0.02, 0.25 }, { 0.65, 0.02, 0.21 },
                                                      { 1.0, 0.02, 0.18 } };

    private static final int POINTS_PER_SIDE = 20;

    private ReferenceBlades() {
    }

    /**
     * A blade shaped after the NREL 5-MW reference turbine, normalized by its 63 m tip radius. Sections are NACA
     * four digit outlines thinning from root to tip, with the pitch axis at quarter chord.
     */
    public static BladeDefinition nrel5mw() {
        var n = NREL_STATIONS.length;
        var positions = new double[n];
        var chord = new double[n];
        var twist = new double[n];
        var leadingEdgeX = new double[n];
        for (int i = 0; i < n; i++) {
            positions[i] = NREL_STATIONS[i][0] / NREL_TIP_RADIUS;
            chord[i] = NREL_STATIONS[i][1] / NREL_TIP_RADIUS;
            twist[i] = NREL_STATIONS[i][2];
            leadingEdgeX[i] = -0.25 * chord[i];
        }

        var sections = new CrossSection[NREL_SECTIONS.length];
        for (int i = 0; i < sections.length; i++) {
            var s = NREL_SECTIONS[i];
            sections[i] = new CrossSection(s[0], Airfoils.naca4(s[1], 0.4, s[2], POINTS_PER_SIDE));
        }

        var loft = LoftDefinition.of(new DistributionCurve(positions, chord), new DistributionCurve(positions, twist),
                                     new DistributionCurve(positions, leadingEdgeX),
                                     DistributionCurve.constant(positions[0], 1.0, 0.0),
                                     CrossSectionTable.of(sections));
        return new BladeDefinition(NREL_5MW, loft, NREL_HUB_RADIUS / NREL_TIP_RADIUS, Discretization.uniform(40),
                                   SplineOptions.interpolating(3).withSmoothing(1e-6));
    }
}
