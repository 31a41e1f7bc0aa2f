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

import com.hellblazer.windmesh.geometry.MeshGenerationException.InvalidContourException;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A closed 2D polygon. The last point connects back to the first; a repeated closing point is accepted and dropped.
 *
 * @author hal.hildebrand
 */
public final class Contour {

    private static final double AREA_TOLERANCE = 1e-12;

    private final List<Point2d> points;

    /**
     * @param points the vertices in order
     * @throws InvalidContourException if fewer than three distinct vertices remain or the polygon encloses no area
     */
    public Contour(List<Point2d> points) {
        Objects.requireNonNull(points, "points cannot be null");
        var copy = new ArrayList<Point2d>(points.size());
        for (var p : points) {
            copy.add(new Point2d(Objects.requireNonNull(p, "contour points cannot be null")));
        }
        if (copy.size() > 1 && copy.get(0).equals(copy.get(copy.size() - 1))) {
            copy.remove(copy.size() - 1);
        }
        if (copy.size() < 3) {
            throw new InvalidContourException("A closed contour needs at least 3 distinct points, got " + copy.size());
        }
        this.points = Collections.unmodifiableList(copy);
        if (Math.abs(signedArea()) < AREA_TOLERANCE) {
            throw new InvalidContourException("Contour does not enclose an area");
        }
    }

    /**
     * Creates a contour from rows of (x, y).
     */
    public static Contour of(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        var points = new ArrayList<Point2d>(rows.length);
        for (var row : rows) {
            if (row.length < 2) {
                throw new IllegalArgumentException("contour rows must hold (x, y)");
            }
            points.add(new Point2d(row[0], row[1]));
        }
        return new Contour(points);
    }

    /**
     * Shoelace area, positive for counter-clockwise contours.
     */
    public double signedArea() {
        var sum = 0.0;
        for (int i = 0; i < points.size(); i++) {
            var a = points.get(i);
            var b = points.get((i + 1) % points.size());
            sum += a.x * b.y - b.x * a.y;
        }
        return 0.5 * sum;
    }

    public int size() {
        return points.size();
    }

    public Point2d point(int i) {
        return new Point2d(points.get(i));
    }

    /**
     * @return the vertices, without a repeated closing point
     */
    public List<Point2d> points() {
        return points;
    }

    @Override
    public String toString() {
        return "Contour{points=" + points.size() + ", area=" + signedArea() + '}';
    }
}
