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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A section outline at a normalized span position. Points are in chord units with the leading edge at the origin,
 * listed in the order the loft's arclength dimension visits them.
 *
 * @author hal.hildebrand
 */
public record CrossSection(double position, List<Point2d> points) {

    public CrossSection {
        Objects.requireNonNull(points, "points cannot be null");
        if (!Double.isFinite(position)) {
            throw new IllegalArgumentException("position must be finite: " + position);
        }
        if (points.size() < 3) {
            throw new IllegalArgumentException("a cross section needs at least 3 points, got " + points.size());
        }
        var copy = new ArrayList<Point2d>(points.size());
        for (var p : points) {
            copy.add(new Point2d(Objects.requireNonNull(p, "section points cannot be null")));
        }
        points = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a section from rows of (x, y).
     */
    public static CrossSection of(double position, double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        var points = new ArrayList<Point2d>(rows.length);
        for (var row : rows) {
            points.add(new Point2d(row[0], row[1]));
        }
        return new CrossSection(position, points);
    }

    public int size() {
        return points.size();
    }

    public Point2d point(int i) {
        return new Point2d(points.get(i));
    }
}
