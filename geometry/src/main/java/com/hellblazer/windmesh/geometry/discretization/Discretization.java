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
package com.hellblazer.windmesh.geometry.discretization;

import java.util.List;

/**
 * Describes how an interval is divided into elements.
 * <p>
 * Two descriptors are understood by {@link Discretizer}: {@link Uniform} (a plain division count with optional
 * geometric stretching) and {@link MultiSection} (piecewise density).
 *
 * @author hal.hildebrand
 */
public interface Discretization {

    /**
     * @return the total number of elements, one less than the number of points produced
     */
    int divisions();

    static Uniform uniform(int divisions) {
        return new Uniform(divisions, 1.0);
    }

    static Uniform stretched(int divisions, double expansionRatio) {
        return new Uniform(divisions, expansionRatio);
    }

    static MultiSection sections(Section... sections) {
        return new MultiSection(List.of(sections));
    }

    /**
     * A single section of the interval: a fraction of its length holding a number of elements whose lengths grow
     * geometrically by the expansion ratio (last element length over first). A reversed section mirrors the
     * clustering.
     */
    record Section(double lengthFraction, int divisions, double expansionRatio, boolean reversed) {

        public Section {
            if (!(lengthFraction > 0.0 && lengthFraction <= 1.0)) {
                throw new IllegalArgumentException("lengthFraction must be in (0, 1]: " + lengthFraction);
            }
            if (divisions <= 0) {
                throw new IllegalArgumentException("section divisions must be positive: " + divisions);
            }
            if (!(expansionRatio > 0.0) || Double.isInfinite(expansionRatio)) {
                throw new IllegalArgumentException("expansionRatio must be positive: " + expansionRatio);
            }
        }
    }

    /**
     * A plain division count. Zero divisions describes a collapsed dimension with a single point.
     */
    record Uniform(int divisions, double expansionRatio) implements Discretization {

        public Uniform {
            if (divisions < 0) {
                throw new IllegalArgumentException("divisions must be non-negative: " + divisions);
            }
            if (!(expansionRatio > 0.0) || Double.isInfinite(expansionRatio)) {
                throw new IllegalArgumentException("expansionRatio must be positive: " + expansionRatio);
            }
        }
    }

    /**
     * Piecewise density: sections laid end to end whose length fractions sum to one.
     */
    record MultiSection(List<Section> sections) implements Discretization {

        private static final double FRACTION_TOLERANCE = 1e-9;

        public MultiSection {
            if (sections == null || sections.isEmpty()) {
                throw new IllegalArgumentException("sections cannot be null or empty");
            }
            sections = List.copyOf(sections);
            var total = sections.stream().mapToDouble(Section::lengthFraction).sum();
            if (Math.abs(total - 1.0) > FRACTION_TOLERANCE) {
                throw new IllegalArgumentException("section length fractions must sum to 1: " + total);
            }
        }

        @Override
        public int divisions() {
            return sections.stream().mapToInt(Section::divisions).sum();
        }
    }
}
