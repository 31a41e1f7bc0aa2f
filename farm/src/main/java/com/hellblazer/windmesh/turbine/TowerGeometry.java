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

/**
 * A tapered circular tower.
 *
 * @author hal.hildebrand
 */
public record TowerGeometry(double height, double baseDiameter, double topDiameter, int circleDivisions,
                            int heightDivisions) {

    public TowerGeometry {
        if (!(height > 0.0) || !(baseDiameter > 0.0) || !(topDiameter > 0.0)) {
            throw new IllegalArgumentException(
            String.format("height (%f) and diameters (%f, %f) must be positive", height, baseDiameter,
                          topDiameter));
        }
        if (circleDivisions < 3 || heightDivisions < 1) {
            throw new IllegalArgumentException(
            String.format("need at least 3 circle and 1 height divisions, got %d and %d", circleDivisions,
                          heightDivisions));
        }
    }

    public static TowerGeometry of(double height, double baseDiameter, double topDiameter) {
        return new TowerGeometry(height, baseDiameter, topDiameter, 24, 10);
    }
}
