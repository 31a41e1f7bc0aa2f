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
 * A spinner: a cylinder of the hub radius closed by an elliptical nose cap.
 *
 * @param radius             hub radius
 * @param thickness          length along the rotor axis
 * @param noseFraction       share of the thickness taken by the nose cap
 * @param azimuthDivisions   divisions around the axis
 * @param axialDivisions     divisions along the axis
 * @author hal.hildebrand
 */
public record HubGeometry(double radius, double thickness, double noseFraction, int azimuthDivisions,
                          int axialDivisions) {

    /**
     * Blades are mounted where the cap meets the cylinder.
     */
    public static final double DEFAULT_NOSE_FRACTION = 1.0 / 6.0;

    public HubGeometry {
        if (!(radius > 0.0) || !(thickness > 0.0)) {
            throw new IllegalArgumentException(
            String.format("radius (%f) and thickness (%f) must be positive", radius, thickness));
        }
        if (!(noseFraction > 0.0 && noseFraction <= 1.0)) {
            throw new IllegalArgumentException("noseFraction must be in (0, 1]: " + noseFraction);
        }
        if (azimuthDivisions < 3 || axialDivisions < 1) {
            throw new IllegalArgumentException(
            String.format("need at least 3 azimuth and 1 axial divisions, got %d and %d", azimuthDivisions,
                          axialDivisions));
        }
    }

    public static HubGeometry of(double radius, double thickness) {
        return new HubGeometry(radius, thickness, DEFAULT_NOSE_FRACTION, 24, 12);
    }
}
