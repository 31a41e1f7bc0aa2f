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

import com.hellblazer.windmesh.geometry.spline.DistributionCurve;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything that shapes a loft, with span positions normalized by the span reference length.
 *
 * @param chord        chord length over span, in span reference units
 * @param twist        twist over span, degrees
 * @param leadingEdgeX chordwise leading edge position over span
 * @param leadingEdgeZ leading edge offset normal to the chord over span
 * @param tilt         rotation of each section about the chordwise axis in degrees, null when the loft has none
 * @param sections     the section outlines along the span
 * @author hal.hildebrand
 */
public record LoftDefinition(DistributionCurve chord, DistributionCurve twist, DistributionCurve leadingEdgeX,
                             DistributionCurve leadingEdgeZ, DistributionCurve tilt, CrossSectionTable sections) {

    public LoftDefinition {
        Objects.requireNonNull(chord, "chord cannot be null");
        Objects.requireNonNull(twist, "twist cannot be null");
        Objects.requireNonNull(leadingEdgeX, "leadingEdgeX cannot be null");
        Objects.requireNonNull(leadingEdgeZ, "leadingEdgeZ cannot be null");
        Objects.requireNonNull(sections, "sections cannot be null");
    }

    public static LoftDefinition of(DistributionCurve chord, DistributionCurve twist, DistributionCurve leadingEdgeX,
                                    DistributionCurve leadingEdgeZ, CrossSectionTable sections) {
        return new LoftDefinition(chord, twist, leadingEdgeX, leadingEdgeZ, null, sections);
    }

    public LoftDefinition withTilt(DistributionCurve newTilt) {
        return new LoftDefinition(chord, twist, leadingEdgeX, leadingEdgeZ, newTilt, sections);
    }

    public Optional<DistributionCurve> tiltCurve() {
        return Optional.ofNullable(tilt);
    }
}
