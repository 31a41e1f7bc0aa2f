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
package com.hellblazer.windmesh.loft;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;

/**
 * NACA four digit section outlines in chord units, leading edge at the origin.
 * <p>
 * Outlines start at the trailing edge, run along the lower surface to the leading edge and return over the upper
 * surface, so the first and last points coincide. That clockwise order gives lofted surfaces outward normals. The
 * trailing edge is closed.
 *
 * @author hal.hildebrand
 */
public final class Airfoils {

    private Airfoils() {
    }

    /**
     * @param designation four digits, e.g. "2412"
     * @param pointsPerSide divisions along each surface; the outline holds 2 * pointsPerSide + 1 points
     */
    public static List<Point2d> naca4(String designation, int pointsPerSide) {
        if (designation == null || !designation.matches("\\d{4}")) {
            throw new IllegalArgumentException("expected four digits, got " + designation);
        }
        var camber = (designation.charAt(0) - '0') / 100.0;
        var camberPosition = (designation.charAt(1) - '0') / 10.0;
        var thickness = Integer.parseInt(designation.substring(2)) / 100.0;
        return naca4(camber, camberPosition, thickness, pointsPerSide);
    }

    /**
     * @param camber         maximum camber as a fraction of chord
     * @param camberPosition chordwise position of the maximum camber, ignored without camber
     * @param thickness      maximum thickness as a fraction of chord
     * @param pointsPerSide  divisions along each surface, cosine spaced
     */
    public static List<Point2d> naca4(double camber, double camberPosition, double thickness, int pointsPerSide) {
        if (pointsPerSide < 2) {
            throw new IllegalArgumentException("at least 2 points per side required: " + pointsPerSide);
        }
        if (!(thickness > 0.0 && thickness < 1.0)) {
            throw new IllegalArgumentException("thickness must be in (0, 1): " + thickness);
        }
        if (camber < 0.0 || (camber > 0.0 && !(camberPosition > 0.0 && camberPosition < 1.0))) {
            throw new IllegalArgumentException(
            String.format("invalid camber %f at %f", camber, camberPosition));
        }
        var upper = new ArrayList<Point2d>(pointsPerSide + 1);
        var lower = new ArrayList<Point2d>(pointsPerSide + 1);
        for (int k = 0; k <= pointsPerSide; k++) {
            var x = 0.5 * (1.0 - Math.cos(Math.PI * k / pointsPerSide));
            var yt = 5.0 * thickness * (0.2969 * Math.sqrt(x) - 0.1260 * x - 0.3516 * x * x + 0.2843 * x * x * x
                                        - 0.1036 * x * x * x * x);
            double yc;
            double slope;
            if (camber == 0.0) {
                yc = 0.0;
                slope = 0.0;
            } else if (x < camberPosition) {
                yc = camber / (camberPosition * camberPosition) * (2.0 * camberPosition * x - x * x);
                slope = 2.0 * camber / (camberPosition * camberPosition) * (camberPosition - x);
            } else {
                var q = 1.0 - camberPosition;
                yc = camber / (q * q) * (1.0 - 2.0 * camberPosition + 2.0 * camberPosition * x - x * x);
                slope = 2.0 * camber / (q * q) * (camberPosition - x);
            }
            var theta = Math.atan(slope);
            upper.add(new Point2d(x - yt * Math.sin(theta), yc + yt * Math.cos(theta)));
            lower.add(new Point2d(x + yt * Math.sin(theta), yc - yt * Math.cos(theta)));
        }

        var outline = new ArrayList<Point2d>(2 * pointsPerSide + 1);
        for (int k = pointsPerSide; k >= 0; k--) {
            outline.add(lower.get(k));
        }
        for (int k = 1; k <= pointsPerSide; k++) {
            outline.add(upper.get(k));
        }
        // closed trailing edge
        outline.set(outline.size() - 1, new Point2d(outline.get(0)));
        return outline;
    }
}
