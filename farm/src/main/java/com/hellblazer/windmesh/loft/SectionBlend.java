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

/**
 * The two sections bracketing a span position and the weight of the outer one.
 *
 * @param inIndex  the inboard section
 * @param outIndex the outboard section
 * @param weight   in [0, 1]; 0 selects the inboard section, 1 the outboard
 * @author hal.hildebrand
 */
public record SectionBlend(int inIndex, int outIndex, double weight) {

    public SectionBlend {
        if (inIndex < 0 || outIndex < inIndex) {
            throw new IllegalArgumentException(
            String.format("invalid bracket [%d, %d]", inIndex, outIndex));
        }
        if (!(weight >= 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException("weight must be in [0, 1]: " + weight);
        }
    }
}
