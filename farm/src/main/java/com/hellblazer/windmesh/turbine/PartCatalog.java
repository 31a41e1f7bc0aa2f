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

import com.hellblazer.windmesh.mesh.Mesh;

import java.util.NoSuchElementException;

/**
 * Resolves turbine components by name. Geometry is normalized by the rotor tip radius and every call returns a
 * fresh copy the caller may transform.
 *
 * @author hal.hildebrand
 */
public interface PartCatalog {

    /**
     * @return the blade spanning +y from the hub radius to 1
     * @throws NoSuchElementException if no blade has the name
     */
    Mesh blade(String name);

    /**
     * @throws NoSuchElementException if no hub has the name
     */
    HubPart hub(String name);

    /**
     * @throws NoSuchElementException if no tower has the name
     */
    TowerPart tower(String name);
}
