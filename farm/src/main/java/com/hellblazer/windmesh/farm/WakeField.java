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

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Flow velocity sampled at the nodes of the fluid domain.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface WakeField {

    /**
     * A field with the same velocity everywhere.
     */
    static WakeField uniform(Vector3d velocity) {
        var v = new Vector3d(velocity);
        return position -> new Vector3d(v);
    }

    Vector3d velocity(Point3d position);
}
