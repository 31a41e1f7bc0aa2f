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

import com.hellblazer.windmesh.geometry.RigidTransform;
import com.hellblazer.windmesh.mesh.MultiPartMesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * Assembles a turbine from catalog parts.
 * <p>
 * The assembled turbine stands on the origin with z vertical and its rotor axis along x, the hub nose pointing
 * upwind toward -x. Parts are named {@code tower} and {@code rotor}; the rotor holds {@code hub} and
 * {@code blade1} .. {@code bladeN}.
 *
 * @author hal.hildebrand
 */
public final class TurbineAssembler {

    public static final String TOWER = "tower";
    public static final String ROTOR = "rotor";
    public static final String HUB   = "hub";
    public static final String BLADE = "blade";

    // hub axis +z onto -x
    static final RigidTransform HUB_ALIGNMENT   = RigidTransform.fromYawPitchRoll(0, -90, 0, new Vector3d());
    // span +y onto +z
    static final RigidTransform BLADE_ALIGNMENT = RigidTransform.fromYawPitchRoll(0, 0, 90, new Vector3d());
    static final RigidTransform TOWER_ALIGNMENT = RigidTransform.fromYawPitchRoll(0, 0, 90, new Vector3d());

    private static final Logger log = LoggerFactory.getLogger(TurbineAssembler.class);

    private final PartCatalog catalog;

    public TurbineAssembler(PartCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
    }

    /**
     * Height of the rotor axis above the tower base.
     */
    public static double hubHeight(double towerHeight, double hubRadius) {
        return towerHeight + hubRadius / 2.0;
    }

    /**
     * @return the rotation placing blade k (1 based) of a rotor with the given blade count
     */
    public static RigidTransform bladeAzimuth(int k, int bladeCount) {
        return RigidTransform.fromYawPitchRoll(0, 0, (k - 1) * 360.0 / bladeCount, new Vector3d());
    }

    public MultiPartMesh assemble(TurbineSpec spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        var r = spec.radius();
        var hubPart = catalog.hub(spec.hubName());
        var towerPart = catalog.tower(spec.towerName());
        var hubRadius = hubPart.radius() * r;
        var hubThickness = hubPart.thickness() * r;

        var rotor = new MultiPartMesh();
        var hub = hubPart.mesh();
        hub.scale(r, r, r);
        hub.applyRigidTransform(HUB_ALIGNMENT);
        rotor.addPart(HUB, hub);

        var template = catalog.blade(spec.bladeName());
        template.scale(r, r, r);
        template.applyRigidTransform(BLADE_ALIGNMENT);
        var mount = RigidTransform.translation(-hubThickness * 5.0 / 6.0, 0, 0);
        for (int k = 1; k <= spec.bladeCount(); k++) {
            var blade = template.copy();
            blade.applyRigidTransform(bladeAzimuth(k, spec.bladeCount()).andThen(mount));
            rotor.addPart(BLADE + k, blade);
        }

        var turbine = new MultiPartMesh();
        var tower = towerPart.mesh();
        tower.applyRigidTransform(TOWER_ALIGNMENT);
        tower.scale(r, r, spec.height() / towerPart.height());
        turbine.addPart(TOWER, tower);

        rotor.translate(hubThickness * 2.0 / 6.0, 0, hubHeight(spec.height(), hubRadius));
        turbine.addPart(ROTOR, rotor);

        log.info("Assembled turbine D={} H={} with {} blades ({} nodes)", spec.diameter(), spec.height(),
                 spec.bladeCount(), turbine.nodeCount());
        return turbine;
    }
}
