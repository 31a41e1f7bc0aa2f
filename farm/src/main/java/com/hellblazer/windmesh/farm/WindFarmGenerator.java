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

import com.hellblazer.windmesh.geometry.contour.Contour;
import com.hellblazer.windmesh.geometry.contour.ContourParameterizer;
import com.hellblazer.windmesh.mesh.FieldKind;
import com.hellblazer.windmesh.turbine.PartCatalog;
import com.hellblazer.windmesh.turbine.TurbineAssembler;
import com.hellblazer.windmesh.turbine.TurbineSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds a complete farm: the turbine layout, a flat grid of the perimeter region and a volumetric fluid domain
 * above it carrying the wake velocity.
 *
 * @author hal.hildebrand
 */
public final class WindFarmGenerator {

    public static final String WAKE_FIELD = "wake";

    /**
     * Headroom above the tallest tower, in maximum rotor radii, of the default fluid domain.
     */
    public static final double DEFAULT_HEADROOM = 1.25;

    private static final Logger log = LoggerFactory.getLogger(WindFarmGenerator.class);

    private final FarmAssembler farmAssembler;

    public WindFarmGenerator(PartCatalog catalog) {
        this(new FarmAssembler(new TurbineAssembler(catalog)));
    }

    public WindFarmGenerator(FarmAssembler farmAssembler) {
        this.farmAssembler = Objects.requireNonNull(farmAssembler, "farmAssembler cannot be null");
    }

    /**
     * max(height) + 1.25 * max(diameter) / 2
     */
    public static double defaultZMax(List<TurbineSpec> turbines) {
        var maxHeight = turbines.stream().mapToDouble(TurbineSpec::height).max().orElse(0.0);
        var maxDiameter = turbines.stream().mapToDouble(TurbineSpec::diameter).max().orElse(0.0);
        return maxHeight + DEFAULT_HEADROOM * maxDiameter / 2.0;
    }

    public WindFarm generate(List<TurbineSpec> turbines, Contour perimeter, WakeField wake,
                             FarmConfiguration configuration) {
        Objects.requireNonNull(turbines, "turbines cannot be null");
        Objects.requireNonNull(perimeter, "perimeter cannot be null");
        Objects.requireNonNull(wake, "wake cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
        if (turbines.isEmpty()) {
            throw new IllegalArgumentException("a farm needs at least one turbine");
        }
        // an unsplittable perimeter fails before any turbine is built
        ContourParameterizer.split(perimeter);

        var zMin = configuration.zMin().orElse(0.0);
        var zMax = configuration.zMax().orElse(defaultZMax(turbines));
        var fluidConfiguration = configuration.fluidDomainConfiguration(zMin, zMax);

        var layout = farmAssembler.layout(turbines);
        var perimeterGrid = PerimeterGridGenerator.generate(perimeter, configuration.perimeterConfiguration());
        var fluidDomain = PerimeterGridGenerator.generate(perimeter, fluidConfiguration);
        fluidDomain.calculateField(WAKE_FIELD, FieldKind.VECTOR, position -> {
            var v = Objects.requireNonNull(wake.velocity(position), "wake velocity cannot be null");
            return new double[] { v.x, v.y, v.z };
        });

        log.info("Generated farm of {} turbines, fluid domain z in [{}, {}] with {} nodes", turbines.size(), zMin,
                 zMax, fluidDomain.nodeCount());
        return new WindFarm(layout, perimeterGrid, fluidDomain);
    }

    public WindFarm generate(List<TurbineSpec> turbines, Contour perimeter, WakeField wake) {
        return generate(turbines, perimeter, wake, FarmConfiguration.defaultConfig());
    }
}
