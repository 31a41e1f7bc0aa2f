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

import com.hellblazer.windmesh.geometry.RigidTransform;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * A collection of nodes in physical space that can be moved as a whole.
 * <p>
 * Meshes are mutable: transforms act in place. Use {@link #copy()} before transforming geometry that is shared.
 *
 * @author hal.hildebrand
 */
public interface Mesh {

    int nodeCount();

    /**
     * @param index the linear node index
     * @return a copy of the node coordinates
     */
    Point3d getNode(int index);

    /**
     * Applies p' = M p + t to every node in place. M need not be a rotation.
     *
     * @param matrix      the linear part
     * @param translation applied after the matrix
     */
    void transform(Matrix3d matrix, Vector3d translation);

    /**
     * @return a deep copy sharing no state with this mesh
     */
    Mesh copy();

    default void applyRigidTransform(RigidTransform transform) {
        transform(transform.getRotation(), transform.getTranslation());
    }

    /**
     * Scales every node component-wise about the origin.
     */
    default void scale(double sx, double sy, double sz) {
        transform(new Matrix3d(sx, 0, 0, 0, sy, 0, 0, 0, sz), new Vector3d());
    }

    default void translate(double x, double y, double z) {
        var identity = new Matrix3d();
        identity.setIdentity();
        transform(identity, new Vector3d(x, y, z));
    }
}
