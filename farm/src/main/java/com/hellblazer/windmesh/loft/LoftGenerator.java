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
import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.mesh.ParametricGrid;
import com.hellblazer.windmesh.mesh.TriangleSurface;
import com.hellblazer.windmesh.mesh.Triangulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Lofts cross sections along a span into a grid or triangulated surface.
 * <p>
 * The grid's first dimension walks the section outline and loops; the second runs along the span; the third is a
 * collapsed dummy dimension.
 *
 * @author hal.hildebrand
 */
public final class LoftGenerator {

    public static final int ARCLENGTH_DIMENSION = 0;
    public static final int SPAN_DIMENSION      = 1;

    private static final Logger log = LoggerFactory.getLogger(LoftGenerator.class);

    private LoftGenerator() {
    }

    /**
     * @return the triangulated loft, cut along the span dimension
     */
    public static TriangleSurface generate(LoftDefinition definition, LoftConfiguration configuration) {
        var surface = Triangulator.triangulate(generateGrid(definition, configuration), SPAN_DIMENSION);
        log.info("Lofted {} sections into {}", definition.sections().size(), surface);
        return surface;
    }

    /**
     * @return the loft as a structured grid in physical coordinates
     */
    public static ParametricGrid generateGrid(LoftDefinition definition, LoftConfiguration configuration) {
        Objects.requireNonNull(definition, "definition cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
        var points = definition.sections().pointCount();
        var grid = ParametricGrid.construct(new double[] { 0.0, configuration.spanLow(), 0.0 },
                                            new double[] { 1.0, configuration.spanHigh(), 0.0 },
                                            new Discretization[] { Discretization.uniform(points - 1),
                                                                   configuration.spanDivisions(),
                                                                   Discretization.uniform(0) },
                                            OptionalInt.of(ARCLENGTH_DIMENSION));
        loft(grid, definition, configuration);
        return grid;
    }

    /**
     * Lofts onto an existing grid whose first dimension holds one node per section point and whose second
     * coordinate is the span.
     *
     * @throws SectionMismatchException if the grid's arclength node count differs from the section point count; no
     *                                  node is touched in that case
     */
    public static void loft(ParametricGrid grid, LoftDefinition definition, LoftConfiguration configuration) {
        Objects.requireNonNull(grid, "grid cannot be null");
        Objects.requireNonNull(definition, "definition cannot be null");
        var points = definition.sections().pointCount();
        var nodes = grid.getNodeCounts()[ARCLENGTH_DIMENSION];
        if (nodes != points) {
            throw new SectionMismatchException(nodes, points, "grid arclength dimension");
        }

        var transform = new LoftTransform(definition, configuration);
        if (configuration.verifySplines() && log.isDebugEnabled()) {
            for (var verification : transform.verify()) {
                log.debug("Spline fit {}", verification);
            }
        }
        grid.applyTransform(transform);
    }
}
