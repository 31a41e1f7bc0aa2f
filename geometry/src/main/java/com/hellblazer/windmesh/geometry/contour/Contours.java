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
package com.hellblazer.windmesh.geometry.contour;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;

/**
 * Standard section shapes.
 *
 * @author hal.hildebrand
 */
public final class Contours {

    private Contours() {
    }

    /**
     * Circle centered at the origin starting at (radius, 0), counter-clockwise, with the closing point repeated so
     * the result holds divisions + 1 points.
     */
    public static List<Point2d> circle(int divisions, double radius) {
        if (divisions < 3) {
            throw new IllegalArgumentException("a circle needs at least 3 divisions: " + divisions);
        }
        var points = new ArrayList<Point2d>(divisions + 1);
        for (int i = 0; i < divisions; i++) {
            var theta = 2.0 * Math.PI * i / divisions;
            points.add(new Point2d(radius * Math.cos(theta), radius * Math.sin(theta)));
        }
        points.add(new Point2d(points.get(0)));
        return points;
    }
}
