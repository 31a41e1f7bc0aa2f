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
package com.hellblazer.windmesh.geometry;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

/**
 * Factory for 3D rotation matrices.
 * <p>
 * All matrices are active rotations (they rotate points, not frames) following the right hand rule. Angles taken
 * by {@link #fromYawPitchRoll(double, double, double)} are in degrees; the single-axis factories take radians.
 *
 * @author hal.hildebrand
 */
public final class Rotations {

    private static final double ORTHONORMAL_TOLERANCE = 1e-9;

    private Rotations() {
    }

    /**
     * Creates a rotation around the X-axis.
     *
     * @param angle the rotation angle in radians
     * @return the rotation matrix
     */
    public static Matrix3d rotationX(double angle) {
        var cos = Math.cos(angle);
        var sin = Math.sin(angle);
        return new Matrix3d(1, 0, 0,
                            0, cos, -sin,
                            0, sin, cos);
    }

    /**
     * Creates a rotation around the Y-axis.
     *
     * @param angle the rotation angle in radians
     * @return the rotation matrix
     */
    public static Matrix3d rotationY(double angle) {
        var cos = Math.cos(angle);
        var sin = Math.sin(angle);
        return new Matrix3d(cos, 0, sin,
                            0, 1, 0,
                            -sin, 0, cos);
    }

    /**
     * Creates a rotation around the Z-axis.
     *
     * @param angle the rotation angle in radians
     * @return the rotation matrix
     */
    public static Matrix3d rotationZ(double angle) {
        var cos = Math.cos(angle);
        var sin = Math.sin(angle);
        return new Matrix3d(cos, -sin, 0,
                            sin, cos, 0,
                            0, 0, 1);
    }

    /**
     * Creates the rotation R = Rz(yaw) * Ry(pitch) * Rx(roll), so roll is applied first and yaw last.
     *
     * @param yaw   rotation around Z in degrees
     * @param pitch rotation around Y in degrees
     * @param roll  rotation around X in degrees
     * @return the rotation matrix
     */
    public static Matrix3d fromYawPitchRoll(double yaw, double pitch, double roll) {
        var result = rotationZ(Math.toRadians(yaw));
        result.mul(rotationY(Math.toRadians(pitch)));
        result.mul(rotationX(Math.toRadians(roll)));
        return result;
    }

    /**
     * Creates a rotation around an arbitrary axis using Rodrigues' formula.
     *
     * @param axis  the rotation axis, need not be normalized
     * @param angle the rotation angle in radians
     * @return the rotation matrix
     */
    public static Matrix3d aboutAxis(Vector3d axis, double angle) {
        var length = axis.length();
        if (length < 1e-10) {
            throw new IllegalArgumentException("Cannot rotate around zero-length axis");
        }
        var nx = axis.x / length;
        var ny = axis.y / length;
        var nz = axis.z / length;

        var cos = Math.cos(angle);
        var sin = Math.sin(angle);
        var oneMCos = 1 - cos;

        return new Matrix3d(cos + nx * nx * oneMCos, nx * ny * oneMCos - nz * sin, nx * nz * oneMCos + ny * sin,
                            ny * nx * oneMCos + nz * sin, cos + ny * ny * oneMCos, ny * nz * oneMCos - nx * sin,
                            nz * nx * oneMCos - ny * sin, nz * ny * oneMCos + nx * sin, cos + nz * nz * oneMCos);
    }

    /**
     * @return true if the matrix is orthonormal with determinant +1
     */
    public static boolean isRotation(Matrix3d m) {
        var product = new Matrix3d();
        product.mulTransposeLeft(m, m);
        var identity = new Matrix3d();
        identity.setIdentity();
        return product.epsilonEquals(identity, ORTHONORMAL_TOLERANCE)
        && Math.abs(m.determinant() - 1.0) < ORTHONORMAL_TOLERANCE;
    }
}
