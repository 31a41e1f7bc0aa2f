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
import java.util.List;

/**
 * The two chains of a split contour. Both run from the minimum-x vertex to the maximum-x vertex with strictly
 * increasing x.
 *
 * @param upper the chain with the larger mean y
 * @param lower the other chain
 * @author hal.hildebrand
 */
public record ContourSplit(List<Point2d> upper, List<Point2d> lower) {

    public ContourSplit {
        upper = List.copyOf(upper);
        lower = List.copyOf(lower);
    }
}
