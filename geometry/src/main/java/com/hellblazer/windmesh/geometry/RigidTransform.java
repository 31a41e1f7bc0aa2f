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
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * A rotation followed by a translation: p' = R p + t.
 * <p>
 * Immutable; the matrix and vector handed out by the accessors are copies.
 *
 * @author hal.hildebrand
 */
public final class RigidTransform {

    private static final RigidTransform IDENTITY = new RigidTransform(identityMatrix(), new Vector3d());

    private final Matrix3d rotation;
    private final Vector3d translation;

    private RigidTransform(Matrix3d rotation, Vector3d translation) {
        this.rotation = rotation;
        this.translation = translation;
    }

    /**
     * Creates a rigid transform.
     *
     * @param rotation    an orthonormal matrix with determinant +1
     * @param translation the translation applied after the rotation
     * @throws IllegalArgumentException if the matrix is not a proper rotation
     */
    public static RigidTransform of(Matrix3d rotation, Vector3d translation) {
        Objects.requireNonNull(rotation, "rotation cannot be null");
        Objects.requireNonNull(translation, "translation cannot be null");
        if (!Rotations.isRotation(rotation)) {
            throw new IllegalArgumentException("Matrix is not a proper rotation: " + rotation);
        }
        return new RigidTransform(new Matrix3d(rotation), new Vector3d(translation));
    }

    public static RigidTransform identity() {
        return IDENTITY;
    }

    public static RigidTransform rotation(Matrix3d rotation) {
        return of(rotation, new Vector3d());
    }

    public static RigidTransform translation(double x, double y, double z) {
        return new RigidTransform(identityMatrix(), new Vector3d(x, y, z));
    }

    /**
     * Rotation given as yaw, pitch and roll in degrees, see {@link Rotations#fromYawPitchRoll}.
     */
    public static RigidTransform fromYawPitchRoll(double yaw, double pitch, double roll, Vector3d translation) {
        return of(Rotations.fromYawPitchRoll(yaw, pitch, roll), translation);
    }

    private static Matrix3d identityMatrix() {
        var m = new Matrix3d();
        m.setIdentity();
        return m;
    }

    /**
     * Applies this transform to the point in place.
     */
    public void apply(Point3d point) {
        rotation.transform(point);
        point.add(translation);
    }

    /**
     * @return the transformed copy of the point
     */
    public Point3d transform(Point3d point) {
        var result = new Point3d(point);
        apply(result);
        return result;
    }

    /**
     * Composes this transform with another. The result applies this transform first, then the other.
     *
     * @param then the transform to apply after this one
     * @return the composition
     */
    public RigidTransform andThen(RigidTransform then) {
        var r = new Matrix3d();
        r.mul(then.rotation, rotation);
        var t = new Vector3d(translation);
        then.rotation.transform(t);
        t.add(then.translation);
        return new RigidTransform(r, t);
    }

    /**
     * @return the transform undoing this one: p = R^T (p' - t)
     */
    public RigidTransform inverse() {
        var r = new Matrix3d();
        r.transpose(rotation);
        var t = new Vector3d(translation);
        r.transform(t);
        t.negate();
        return new RigidTransform(r, t);
    }

    public Matrix3d getRotation() {
        return new Matrix3d(rotation);
    }

    public Vector3d getTranslation() {
        return new Vector3d(translation);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RigidTransform other)) return false;
        return rotation.equals(other.rotation) && translation.equals(other.translation);
    }

    @Override
    public int hashCode() {
        return rotation.hashCode() * 31 + translation.hashCode();
    }

    @Override
    public String toString() {
        return "RigidTransform{rotation=" + rotation + ", translation=" + translation + '}';
    }
}
