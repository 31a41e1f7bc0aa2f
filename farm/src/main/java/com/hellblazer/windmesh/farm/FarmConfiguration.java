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
import java.util.OptionalDouble;

/**
 * Grid settings for {@link WindFarmGenerator}. Unset z bounds are derived from the turbines.
 *
 * @author hal.hildebrand
 */
public final class FarmConfiguration {

    private final Discretization xDivisions;
    private final Discretization yDivisions;
    private final Discretization zDivisions;
    private final OptionalDouble zMin;
    private final OptionalDouble zMax;
    private final SplineOptions  splineOptions;
    private final ParameterMode  parameterMode;
    private final boolean        verifySplines;

    private FarmConfiguration(Builder builder) {
        this.xDivisions = builder.xDivisions;
        this.yDivisions = builder.yDivisions;
        this.zDivisions = builder.zDivisions;
        this.zMin = builder.zMin;
        this.zMax = builder.zMax;
        this.splineOptions = builder.splineOptions;
        this.parameterMode = builder.parameterMode;
        this.verifySplines = builder.verifySplines;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FarmConfiguration defaultConfig() {
        return builder().build();
    }

    public Discretization xDivisions() {
        return xDivisions;
    }

    public Discretization yDivisions() {
        return yDivisions;
    }

    public Discretization zDivisions() {
        return zDivisions;
    }

    public OptionalDouble zMin() {
        return zMin;
    }

    public OptionalDouble zMax() {
        return zMax;
    }

    public SplineOptions splineOptions() {
        return splineOptions;
    }

    public ParameterMode parameterMode() {
        return parameterMode;
    }

    public boolean verifySplines() {
        return verifySplines;
    }

    /**
     * Flat grid of the perimeter region at z = 0. Chain fits are verified when {@link #verifySplines()} is set.
     */
    public PerimeterGridConfiguration perimeterConfiguration() {
        return new PerimeterGridConfiguration(xDivisions, yDivisions, Discretization.uniform(0), 0.0, 0.0,
                                              splineOptions, parameterMode, verifySplines);
    }

    /**
     * Layered grid of the perimeter region between the resolved z bounds.
     */
    public PerimeterGridConfiguration fluidDomainConfiguration(double resolvedZMin, double resolvedZMax) {
        return new PerimeterGridConfiguration(xDivisions, yDivisions, zDivisions, resolvedZMin, resolvedZMax,
                                              splineOptions, parameterMode, false);
    }

    @Override
    public String toString() {
        return String.format("FarmConfiguration[x=%d, y=%d, z=%d, zMin=%s, zMax=%s, spline=%s, mode=%s, verify=%s]",
                             xDivisions.divisions(), yDivisions.divisions(), zDivisions.divisions(), zMin, zMax,
                             splineOptions, parameterMode, verifySplines);
    }

    public static final class Builder {
        private Discretization xDivisions = Discretization.uniform(PerimeterGridConfiguration.DEFAULT_DIVISIONS);
        private Discretization yDivisions = Discretization.uniform(PerimeterGridConfiguration.DEFAULT_DIVISIONS);
        private Discretization zDivisions = Discretization.uniform(PerimeterGridConfiguration.DEFAULT_DIVISIONS);
        private OptionalDouble zMin       = OptionalDouble.empty();
        private OptionalDouble zMax       = OptionalDouble.empty();
        private SplineOptions  splineOptions = SplineOptions.contourDefaults();
        private ParameterMode  parameterMode = ParameterMode.ARCLENGTH;
        private boolean        verifySplines = true;

        private Builder() {
        }

        public Builder xDivisions(Discretization divisions) {
            this.xDivisions = Objects.requireNonNull(divisions, "divisions cannot be null");
            return this;
        }

        public Builder yDivisions(Discretization divisions) {
            this.yDivisions = Objects.requireNonNull(divisions, "divisions cannot be null");
            return this;
        }

        public Builder zDivisions(Discretization divisions) {
            this.zDivisions = Objects.requireNonNull(divisions, "divisions cannot be null");
            return this;
        }

        public Builder divisions(int x, int y, int z) {
            return xDivisions(Discretization.uniform(x)).yDivisions(Discretization.uniform(y))
                                                        .zDivisions(Discretization.uniform(z));
        }

        public Builder zMin(double value) {
            this.zMin = OptionalDouble.of(value);
            return this;
        }

        public Builder zMax(double value) {
            this.zMax = OptionalDouble.of(value);
            return this;
        }

        public Builder splineOptions(SplineOptions options) {
            this.splineOptions = Objects.requireNonNull(options, "options cannot be null");
            return this;
        }

        public Builder parameterMode(ParameterMode mode) {
            this.parameterMode = Objects.requireNonNull(mode, "mode cannot be null");
            return this;
        }

        public Builder verifySplines(boolean verify) {
            this.verifySplines = verify;
            return this;
        }

        public FarmConfiguration build() {
            if (zDivisions.divisions() < 1) {
                throw new IllegalArgumentException("the fluid domain needs at least one z division");
            }
            if (zMin.isPresent() && zMax.isPresent() && !(zMax.getAsDouble() > zMin.getAsDouble())) {
                throw new IllegalArgumentException(
                String.format("zMax must exceed zMin: [%f, %f]", zMin.getAsDouble(), zMax.getAsDouble()));
            }
            return new FarmConfiguration(this);
        }
    }
}
