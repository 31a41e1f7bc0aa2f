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
package com.hellblazer.windmesh.mesh;

/**
 * Maps a grid node to its new physical position.
 * <p>
 * Implementations must be pure: the result may depend only on the arguments, so nodes can be mapped in any order or
 * in parallel.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface SpaceTransform {

    /**
     * @param coordinates the node's current coordinates (x, y, z); parametric coordinates before the first transform
     * @param index       the node's multi-index, one entry per grid dimension
     * @return the new coordinates (x, y, z)
     */
    double[] apply(double[] coordinates, int[] index);
}
