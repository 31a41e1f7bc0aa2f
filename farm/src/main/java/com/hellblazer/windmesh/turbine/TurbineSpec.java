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

import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One turbine of a farm: rotor diameter, tower height, blade count, base position, yaw in degrees about the
 * vertical and the catalog names of its parts.
 *
 * @author hal.hildebrand
 */
public record TurbineSpec(double diameter, double height, int bladeCount, double x, double y, double z, double yaw,
                          String hubName, String towerName, String bladeName) {

    public TurbineSpec {
        if (!(diameter > 0.0) || Double.isInfinite(diameter)) {
            throw new IllegalArgumentException("diameter must be positive: " + diameter);
        }
        if (!(height > 0.0) || Double.isInfinite(height)) {
            throw new IllegalArgumentException("height must be positive: " + height);
        }
        if (bladeCount < 1) {
            throw new IllegalArgumentException("bladeCount must be positive: " + bladeCount);
        }
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z) || !Double.isFinite(yaw)) {
            throw new IllegalArgumentException("position and yaw must be finite");
        }
        Objects.requireNonNull(hubName, "hubName cannot be null");
        Objects.requireNonNull(towerName, "towerName cannot be null");
        Objects.requireNonNull(bladeName, "bladeName cannot be null");
    }

    /**
     * A turbine built from the default catalog parts.
     */
    public static TurbineSpec of(double diameter, double height, int bladeCount, double x, double y, double z,
                                 double yaw) {
        return new TurbineSpec(diameter, height, bladeCount, x, y, z, yaw, ProceduralPartCatalog.DEFAULT_HUB,
                               ProceduralPartCatalog.DEFAULT_TOWER, ProceduralPartCatalog.DEFAULT_BLADE);
    }

    /**
     * Zips per-turbine arrays into specs with the default parts.
     *
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static List<TurbineSpec> fromArrays(double[] diameter, double[] height, int[] bladeCount, double[] x,
                                               double[] y, double[] z, double[] yaw) {
        var n = diameter.length;
        if (height.length != n || bladeCount.length != n || x.length != n || y.length != n || z.length != n
        || yaw.length != n) {
            throw new IllegalArgumentException("all turbine arrays must have " + n + " entries");
        }
        var result = new ArrayList<TurbineSpec>(n);
        for (int i = 0; i < n; i++) {
            result.add(of(diameter[i], height[i], bladeCount[i], x[i], y[i], z[i], yaw[i]));
        }
        return result;
    }

    public double radius() {
        return diameter / 2.0;
    }

    public Vector3d position() {
        return new Vector3d(x, y, z);
    }

    public TurbineSpec withParts(String newHubName, String newTowerName, String newBladeName) {
        return new TurbineSpec(diameter, height, bladeCount, x, y, z, yaw, newHubName, newTowerName, newBladeName);
    }
}
