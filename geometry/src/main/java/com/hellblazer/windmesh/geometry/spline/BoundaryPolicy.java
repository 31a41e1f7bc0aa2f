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
package com.hellblazer.windmesh.geometry.spline;

/**
 * Behavior of a fitted spline outside the range of its control points.
 *
 * @author hal.hildebrand
 */
public enum BoundaryPolicy {
    /** Continue the first and last polynomial pieces */
    EXTRAPOLATE,
    /** Return the value at the nearest end of the range */
    NEAREST,
    /** Return zero */
    ZERO,
    /** Reject the evaluation */
    ERROR
}
