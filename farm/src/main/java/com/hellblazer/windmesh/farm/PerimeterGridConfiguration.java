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

import com.hellblazer.windmesh.geometry.contour.ParameterMode;
import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.spline.SplineOptions;

import java.util.Objects;

/**
 * How the region inside a perimeter is gridded.
 *
 * @param arclengthDivisions along both perimeter chains
 * @param blendDivisions     across the region, from the lower chain to the upper
 * @param layerDivisions     between zMin and zMax; zero divisions gives a flat grid at zMin
 * @param zMin               bottom of the grid
 * @param zMax               top of a layered grid
 * @param splineOptions      chain fit options
 * @param parameterMode      chain parameterization
 * @param verifySplines      log the chain fit residuals at DEBUG
 * @author hal.hildebrand
 */
public record PerimeterGridConfiguration(Discretization arclengthDivisions, Discretization blendDivisions,
                                         Discretization layerDivisions, double zMin, double zMax,
                                         SplineOptions splineOptions, ParameterMode parameterMode,
                                         boolean verifySplines) {

    public static final int DEFAULT_DIVISIONS = 50;

    public PerimeterGridConfiguration {
        Objects.requireNonNull(arclengthDivisions, "arclengthDivisions cannot be null");
        Objects.requireNonNull(blendDivisions, "blendDivisions cannot be null");
        Objects.requireNonNull(layerDivisions, "layerDivisions cannot be null");
        Objects.requireNonNull(splineOptions, "splineOptions cannot be null");
        Objects.requireNonNull(parameterMode, "parameterMode cannot be null");
        if (arclengthDivisions.divisions() < 1 || blendDivisions.divisions() < 1) {
            throw new IllegalArgumentException("arclength and blend dimensions need at least one division");
        }
        if (!Double.isFinite(zMin) || !Double.isFinite(zMax)) {
            throw new IllegalArgumentException("z bounds must be finite");
        }
        if (layerDivisions.divisions() > 0 && !(zMax > zMin)) {
            throw new IllegalArgumentException(String.format("layered grid needs zMax > zMin: [%f, %f]", zMin, zMax));
        }
    }

    /**
     * Flat 50 x 50 grid at z = 0.
     */
    public static PerimeterGridConfiguration defaultConfig() {
        return new PerimeterGridConfiguration(Discretization.uniform(DEFAULT_DIVISIONS),
                                              Discretization.uniform(DEFAULT_DIVISIONS), Discretization.uniform(0),
                                              0.0, 0.0, SplineOptions.contourDefaults(), ParameterMode.ARCLENGTH,
                                              true);
    }

    public boolean isFlat() {
        return layerDivisions.divisions() == 0;
    }

    public PerimeterGridConfiguration withDivisions(Discretization newArclength, Discretization newBlend) {
        return new PerimeterGridConfiguration(newArclength, newBlend, layerDivisions, zMin, zMax, splineOptions,
                                              parameterMode, verifySplines);
    }

    public PerimeterGridConfiguration withLayers(Discretization newLayers, double newZMin, double newZMax) {
        return new PerimeterGridConfiguration(arclengthDivisions, blendDivisions, newLayers, newZMin, newZMax,
                                              splineOptions, parameterMode, verifySplines);
    }

    public PerimeterGridConfiguration withSplineOptions(SplineOptions newSplineOptions) {
        return new PerimeterGridConfiguration(arclengthDivisions, blendDivisions, layerDivisions, zMin, zMax,
                                              newSplineOptions, parameterMode, verifySplines);
    }

    public PerimeterGridConfiguration withParameterMode(ParameterMode newParameterMode) {
        return new PerimeterGridConfiguration(arclengthDivisions, blendDivisions, layerDivisions, zMin, zMax,
                                              splineOptions, newParameterMode, verifySplines);
    }

    public PerimeterGridConfiguration withVerifySplines(boolean newVerifySplines) {
        return new PerimeterGridConfiguration(arclengthDivisions, blendDivisions, layerDivisions, zMin, zMax,
                                              splineOptions, parameterMode, newVerifySplines);
    }
}
