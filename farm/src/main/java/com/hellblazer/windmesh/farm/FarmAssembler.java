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

import com.hellblazer.windmesh.geometry.RigidTransform;
import com.hellblazer.windmesh.mesh.MultiPartMesh;
import com.hellblazer.windmesh.turbine.TurbineAssembler;
import com.hellblazer.windmesh.turbine.TurbineSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Places assembled turbines into a farm layout named {@code turbine1} .. {@code turbineN} in input order.
 *
 * @author hal.hildebrand
 */
public final class FarmAssembler {

    public static final String TURBINE = "turbine";

    private static final Logger log = LoggerFactory.getLogger(FarmAssembler.class);

    private final TurbineAssembler turbineAssembler;

    public FarmAssembler(TurbineAssembler turbineAssembler) {
        this.turbineAssembler = Objects.requireNonNull(turbineAssembler, "turbineAssembler cannot be null");
    }

    /**
     * Yaw about the vertical axis followed by translation to the turbine's base position.
     */
    public static RigidTransform placement(TurbineSpec spec) {
        return RigidTransform.fromYawPitchRoll(spec.yaw(), 0, 0, spec.position());
    }

    public MultiPartMesh layout(List<TurbineSpec> turbines) {
        Objects.requireNonNull(turbines, "turbines cannot be null");
        var farm = new MultiPartMesh();
        for (int i = 0; i < turbines.size(); i++) {
            var spec = turbines.get(i);
            var turbine = turbineAssembler.assemble(spec);
            turbine.applyRigidTransform(placement(spec));
            farm.addPart(TURBINE + (i + 1), turbine);
        }
        log.info("Laid out {} turbines ({} nodes)", turbines.size(), farm.nodeCount());
        return farm;
    }
}
