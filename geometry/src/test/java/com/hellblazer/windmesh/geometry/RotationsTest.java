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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Rotation Matrix Tests")
class RotationsTest {

    private static final double EPSILON = 1e-12;

    private static Point3d rotate(Matrix3d m, double x, double y, double z) {
        var p = new Point3d(x, y, z);
        m.transform(p);
        return p;
    }

    @Test
    @DisplayName("Z rotation by 90 degrees maps x onto y")
    void zRotation() {
        var p = rotate(Rotations.rotationZ(Math.PI / 2), 1, 0, 0);
        assertTrue(p.epsilonEquals(new Point3d(0, 1, 0), EPSILON), p.toString());
    }

    @Test
    @DisplayName("X rotation by 90 degrees maps y onto z")
    void xRotation() {
        var p = rotate(Rotations.rotationX(Math.PI / 2), 0, 1, 0);
        assertTrue(p.epsilonEquals(new Point3d(0, 0, 1), EPSILON), p.toString());
    }

    @Test
    @DisplayName("Y rotation by -90 degrees maps z onto -x")
    void yRotation() {
        var p = rotate(Rotations.rotationY(-Math.PI / 2), 0, 0, 1);
        assertTrue(p.epsilonEquals(new Point3d(-1, 0, 0), EPSILON), p.toString());
    }

    @Test
    @DisplayName("Yaw, pitch and roll compose as Rz * Ry * Rx")
    void yawPitchRollOrder() {
        var expected = Rotations.rotationZ(Math.toRadians(30));
        expected.mul(Rotations.rotationY(Math.toRadians(-20)));
        expected.mul(Rotations.rotationX(Math.toRadians(45)));

        var actual = Rotations.fromYawPitchRoll(30, -20, 45);
        assertTrue(expected.epsilonEquals(actual, EPSILON));
    }

    @Test
    @DisplayName("Pure yaw equals rotation about Z")
    void pureYaw() {
        assertTrue(Rotations.rotationZ(Math.toRadians(45)).epsilonEquals(Rotations.fromYawPitchRoll(45, 0, 0),
                                                                          EPSILON));
    }

    @Test
    @DisplayName("Axis rotation agrees with principal axis rotation")
    void axisRotation() {
        var angle = 0.7;
        assertTrue(Rotations.rotationX(angle).epsilonEquals(Rotations.aboutAxis(new Vector3d(2, 0, 0), angle),
                                                             EPSILON));
        assertThrows(IllegalArgumentException.class, () -> Rotations.aboutAxis(new Vector3d(), angle));
    }

    @Test
    @DisplayName("Proper rotations are recognized")
    void rotationCheck() {
        assertTrue(Rotations.isRotation(Rotations.fromYawPitchRoll(12, 34, 56)));

        var scaled = Rotations.rotationZ(0.3);
        scaled.mul(2.0);
        assertFalse(Rotations.isRotation(scaled));

        var reflection = new Matrix3d(1, 0, 0, 0, 1, 0, 0, 0, -1);
        assertFalse(Rotations.isRotation(reflection));
    }
}
