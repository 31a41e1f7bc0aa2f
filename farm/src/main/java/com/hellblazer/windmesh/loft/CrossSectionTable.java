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

import com.hellblazer.windmesh.geometry.MeshGenerationException.SectionMismatchException;

import javax.vecmath.Point2d;
import java.util.List;
import java.util.Objects;

/**
 * Cross sections ordered by strictly increasing span position, all with the same point count.
 *
 * @author hal.hildebrand
 */
public final class CrossSectionTable {

    private final List<CrossSection> sections;

    /**
     * @throws SectionMismatchException if the sections differ in point count
     * @throws IllegalArgumentException if the table is empty or positions are not strictly increasing
     */
    public CrossSectionTable(List<CrossSection> sections) {
        Objects.requireNonNull(sections, "sections cannot be null");
        if (sections.isEmpty()) {
            throw new IllegalArgumentException("at least one cross section is required");
        }
        var expected = sections.get(0).size();
        for (int i = 0; i < sections.size(); i++) {
            var section = Objects.requireNonNull(sections.get(i), "sections cannot hold null");
            if (section.size() != expected) {
                throw new SectionMismatchException(expected, section.size(),
                                                   "section " + i + " (position " + section.position() + ")");
            }
            if (i > 0 && section.position() <= sections.get(i - 1).position()) {
                throw new IllegalArgumentException(
                String.format("section positions must be strictly increasing: %f at %d follows %f",
                              section.position(), i, sections.get(i - 1).position()));
            }
        }
        this.sections = List.copyOf(sections);
    }

    public static CrossSectionTable of(CrossSection... sections) {
        return new CrossSectionTable(List.of(sections));
    }

    public int size() {
        return sections.size();
    }

    public CrossSection section(int i) {
        return sections.get(i);
    }

    public List<CrossSection> sections() {
        return sections;
    }

    /**
     * @return the point count shared by every section
     */
    public int pointCount() {
        return sections.get(0).size();
    }

    /**
     * Finds the first adjacent pair whose outboard position reaches the span, scanning from the root. Spans before
     * the first section or past the last are clamped to it.
     *
     * @param span a non-negative span position
     * @return the bracketing sections and blend weight
     */
    public SectionBlend bracket(double span) {
        if (sections.size() == 1) {
            return new SectionBlend(0, 0, 0.0);
        }
        var out = 1;
        while (out < sections.size() - 1 && sections.get(out).position() < span) {
            out++;
        }
        var in = out - 1;
        var positionIn = sections.get(in).position();
        var positionOut = sections.get(out).position();
        var weight = (span - positionIn) / (positionOut - positionIn);
        return new SectionBlend(in, out, Math.max(0.0, Math.min(1.0, weight)));
    }

    /**
     * @return weight * out[i] + (1 - weight) * in[i]
     */
    public Point2d blend(SectionBlend blend, int i) {
        var pin = sections.get(blend.inIndex()).point(i);
        var pout = sections.get(blend.outIndex()).point(i);
        var w = blend.weight();
        return new Point2d(w * pout.x + (1.0 - w) * pin.x, w * pout.y + (1.0 - w) * pin.y);
    }

    @Override
    public String toString() {
        return "CrossSectionTable{sections=" + sections.size() + ", points=" + pointCount() + '}';
    }
}
