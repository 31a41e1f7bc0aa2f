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

import com.hellblazer.windmesh.mesh.MultiPartMesh;
import com.hellblazer.windmesh.mesh.ParametricGrid;

import java.util.Objects;

/**
 * The generated farm.
 *
 * @param layout        every turbine under {@code turbine{i}}
 * @param perimeterGrid flat grid of the farm boundary region
 * @param fluidDomain   volumetric grid carrying the {@value WindFarmGenerator#WAKE_FIELD} vector field
 * @author hal.hildebrand
 */
public record WindFarm(MultiPartMesh layout, ParametricGrid perimeterGrid, ParametricGrid fluidDomain) {

    public WindFarm {
        Objects.requireNonNull(layout, "layout cannot be null");
        Objects.requireNonNull(perimeterGrid, "perimeterGrid cannot be null");
        Objects.requireNonNull(fluidDomain, "fluidDomain cannot be null");
    }
}
