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

import com.hellblazer.windmesh.geometry.spline.SplineCurve;

import javax.vecmath.Point2d;
import java.util.Objects;

/**
 * A chain reparameterized as two splines x(t) and y(t) over a shared parameter.
 *
 * @author hal.hildebrand
 */
public record ChainCurve(SplineCurve x, SplineCurve y, ParameterMode mode) implements ParametricCurve {

    public ChainCurve {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
    }

    @Override
    public Point2d at(double t) {
        return new Point2d(x.evaluate(t), y.evaluate(t));
    }
}
