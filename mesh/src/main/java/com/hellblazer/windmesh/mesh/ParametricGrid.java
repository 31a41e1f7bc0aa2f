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
package com.hellblazer.windmesh.mesh;

import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.discretization.Discretizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * Structured grid of one to three dimensions.
 * <p>
 * Nodes start at their parametric coordinates: along dimension d they follow the discretization of [min[d], max[d]],
 * and coordinates past the grid's dimensionality are zero. A {@link SpaceTransform} then overwrites them with
 * physical coordinates. Nodes are stored densely with the first dimension varying fastest.
 * <p>
 * One dimension may be marked as a loop: {@link #getNode(int[])} wraps indices along it, so the node after the last
 * is the first.
 *
 * @author hal.hildebrand
 */
public final class ParametricGrid implements Mesh {

    private static final Logger log = LoggerFactory.getLogger(ParametricGrid.class);

    private final double[]               min;
    private final double[]               max;
    private final Discretization[]       discretizations;
    private final int[]                  nodeCounts;
    private final OptionalInt            loopDimension;
    private final double[]               nodes;
    private final Map<String, NodeField> fields;

    private ParametricGrid(double[] min, double[] max, Discretization[] discretizations, int[] nodeCounts,
                           OptionalInt loopDimension, double[] nodes, Map<String, NodeField> fields) {
        this.min = min;
        this.max = max;
        this.discretizations = discretizations;
        this.nodeCounts = nodeCounts;
        this.loopDimension = loopDimension;
        this.nodes = nodes;
        this.fields = fields;
    }

    /**
     * Constructs a grid at its parametric coordinates.
     *
     * @param min           lower bound per dimension
     * @param max           upper bound per dimension
     * @param divisions     discretization per dimension; zero divisions gives a single node at min
     * @param loopDimension the periodic dimension, if any
     * @return the grid
     * @throws IllegalArgumentException if the arrays disagree in length, hold more than three dimensions, or the
     *                                  loop dimension is out of range or collapsed
     */
    public static ParametricGrid construct(double[] min, double[] max, Discretization[] divisions,
                                           OptionalInt loopDimension) {
        Objects.requireNonNull(min, "min cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        Objects.requireNonNull(divisions, "divisions cannot be null");
        Objects.requireNonNull(loopDimension, "loopDimension cannot be null");
        var dims = min.length;
        if (dims < 1 || dims > 3) {
            throw new IllegalArgumentException("grid must have 1 to 3 dimensions, got " + dims);
        }
        if (max.length != dims || divisions.length != dims) {
            throw new IllegalArgumentException(
            String.format("min (%d), max (%d) and divisions (%d) must have the same length", dims, max.length,
                          divisions.length));
        }
        if (loopDimension.isPresent()) {
            var loop = loopDimension.getAsInt();
            if (loop < 0 || loop >= dims) {
                throw new IllegalArgumentException("loop dimension " + loop + " out of range [0, " + dims + ")");
            }
            if (divisions[loop].divisions() == 0) {
                throw new IllegalArgumentException("loop dimension " + loop + " has no divisions");
            }
        }

        var parameters = new double[dims][];
        var nodeCounts = new int[dims];
        long total = 1;
        for (int d = 0; d < dims; d++) {
            Objects.requireNonNull(divisions[d], "divisions cannot hold null");
            if (!Double.isFinite(min[d]) || !Double.isFinite(max[d])) {
                throw new IllegalArgumentException("bounds of dimension " + d + " must be finite");
            }
            parameters[d] = Discretizer.parameters(min[d], max[d], divisions[d]);
            nodeCounts[d] = parameters[d].length;
            total *= nodeCounts[d];
            if (total > Integer.MAX_VALUE / 3) {
                throw new IllegalArgumentException("total node count exceeds maximum supported size");
            }
        }

        var count = (int) total;
        var nodes = new double[count * 3];
        var index = new int[dims];
        for (int n = 0; n < count; n++) {
            for (int d = 0; d < dims; d++) {
                nodes[n * 3 + d] = parameters[d][index[d]];
            }
            increment(index, nodeCounts);
        }
        log.debug("Constructed {}D grid with node counts {} ({} nodes)", dims, Arrays.toString(nodeCounts), count);
        return new ParametricGrid(min.clone(), max.clone(), divisions.clone(), nodeCounts, loopDimension, nodes,
                                  new LinkedHashMap<>());
    }

    public static ParametricGrid construct(double[] min, double[] max, int[] divisions,
                                           OptionalInt loopDimension) {
        Objects.requireNonNull(divisions, "divisions cannot be null");
        var uniform = new Discretization[divisions.length];
        for (int d = 0; d < divisions.length; d++) {
            uniform[d] = Discretization.uniform(divisions[d]);
        }
        return construct(min, max, uniform, loopDimension);
    }

    public static ParametricGrid construct(double[] min, double[] max, int[] divisions) {
        return construct(min, max, divisions, OptionalInt.empty());
    }

    private static void increment(int[] index, int[] counts) {
        for (int d = 0; d < index.length; d++) {
            if (++index[d] < counts[d]) {
                return;
            }
            index[d] = 0;
        }
    }

    public int dimensions() {
        return nodeCounts.length;
    }

    @Override
    public int nodeCount() {
        return nodes.length / 3;
    }

    public int[] getNodeCounts() {
        return nodeCounts.clone();
    }

    public int[] getDivisionCounts() {
        var result = new int[nodeCounts.length];
        for (int d = 0; d < result.length; d++) {
            result[d] = nodeCounts[d] - 1;
        }
        return result;
    }

    public Discretization getDiscretization(int dimension) {
        return discretizations[dimension];
    }

    public double[] getMin() {
        return min.clone();
    }

    public double[] getMax() {
        return max.clone();
    }

    public OptionalInt getLoopDimension() {
        return loopDimension;
    }

    /**
     * Linear index of a multi-index, first dimension fastest.
     *
     * @throws IndexOutOfBoundsException if an index is out of range
     */
    public int nodeIndex(int[] index) {
        Objects.requireNonNull(index, "index cannot be null");
        if (index.length != dimensions()) {
            throw new IllegalArgumentException(
            String.format("index length (%d) must match dimensions (%d)", index.length, dimensions()));
        }
        var linear = 0;
        var stride = 1;
        for (int d = 0; d < index.length; d++) {
            if (index[d] < 0 || index[d] >= nodeCounts[d]) {
                throw new IndexOutOfBoundsException(
                String.format("index %d out of bounds [0, %d) in dimension %d", index[d], nodeCounts[d], d));
            }
            linear += index[d] * stride;
            stride *= nodeCounts[d];
        }
        return linear;
    }

    public int[] multiIndex(int linear) {
        if (linear < 0 || linear >= nodeCount()) {
            throw new IndexOutOfBoundsException(
            String.format("linear index %d out of bounds [0, %d)", linear, nodeCount()));
        }
        var index = new int[dimensions()];
        var remaining = linear;
        for (int d = 0; d < index.length; d++) {
            index[d] = remaining % nodeCounts[d];
            remaining /= nodeCounts[d];
        }
        return index;
    }

    @Override
    public Point3d getNode(int index) {
        if (index < 0 || index >= nodeCount()) {
            throw new IndexOutOfBoundsException(
            String.format("node %d out of bounds [0, %d)", index, nodeCount()));
        }
        return new Point3d(nodes[index * 3], nodes[index * 3 + 1], nodes[index * 3 + 2]);
    }

    /**
     * Node at a multi-index, wrapping the index along the loop dimension.
     */
    public Point3d getNode(int[] index) {
        Objects.requireNonNull(index, "index cannot be null");
        if (loopDimension.isPresent()) {
            var loop = loopDimension.getAsInt();
            var wrapped = index.clone();
            wrapped[loop] = Math.floorMod(index[loop], nodeCounts[loop]);
            return getNode(nodeIndex(wrapped));
        }
        return getNode(nodeIndex(index));
    }

    /**
     * Overwrites every node with the transform's result, one node at a time in index order.
     */
    public void applyTransform(SpaceTransform transform) {
        Objects.requireNonNull(transform, "transform cannot be null");
        for (int n = 0; n < nodeCount(); n++) {
            mapNode(transform, n);
        }
        log.debug("Applied space transform to {} nodes", nodeCount());
    }

    /**
     * Same result as {@link #applyTransform(SpaceTransform)}, with nodes mapped on a parallel stream.
     */
    public void applyTransformParallel(SpaceTransform transform) {
        Objects.requireNonNull(transform, "transform cannot be null");
        IntStream.range(0, nodeCount()).parallel().forEach(n -> mapNode(transform, n));
        log.debug("Applied space transform in parallel to {} nodes", nodeCount());
    }

    private void mapNode(SpaceTransform transform, int n) {
        var current = Arrays.copyOfRange(nodes, n * 3, n * 3 + 3);
        var mapped = transform.apply(current, multiIndex(n));
        if (mapped == null || mapped.length != 3) {
            throw new IllegalStateException("space transform must return 3 coordinates at node " + n);
        }
        System.arraycopy(mapped, 0, nodes, n * 3, 3);
    }

    @Override
    public void transform(Matrix3d matrix, Vector3d translation) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        Objects.requireNonNull(translation, "translation cannot be null");
        var p = new Point3d();
        for (int n = 0; n < nodeCount(); n++) {
            p.set(nodes[n * 3], nodes[n * 3 + 1], nodes[n * 3 + 2]);
            matrix.transform(p);
            p.add(translation);
            nodes[n * 3] = p.x;
            nodes[n * 3 + 1] = p.y;
            nodes[n * 3 + 2] = p.z;
        }
    }

    /**
     * Evaluates the function at every node's current position and attaches the results under the name, replacing a
     * field of the same name. Fields are data, not geometry: later transforms leave them untouched.
     *
     * @param name     the field name
     * @param kind     scalar or vector
     * @param function returns {@link FieldKind#components()} values for a node position
     * @return the attached field
     */
    public NodeField calculateField(String name, FieldKind kind, Function<Point3d, double[]> function) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        var c = kind.components();
        var values = new double[nodeCount() * c];
        for (int n = 0; n < nodeCount(); n++) {
            var value = function.apply(getNode(n));
            if (value == null || value.length != c) {
                throw new IllegalStateException(
                String.format("field %s expects %d components at node %d", name, c, n));
            }
            System.arraycopy(value, 0, values, n * c, c);
        }
        var field = new NodeField(name, kind, values);
        if (fields.put(name, field) != null) {
            log.debug("Replaced field {}", name);
        }
        return field;
    }

    public Optional<NodeField> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    @Override
    public ParametricGrid copy() {
        return new ParametricGrid(min.clone(), max.clone(), discretizations.clone(), nodeCounts.clone(),
                                  loopDimension, nodes.clone(), new LinkedHashMap<>(fields));
    }

    @Override
    public String toString() {
        return "ParametricGrid{nodeCounts=" + Arrays.toString(nodeCounts) + ", loop=" + loopDimension + ", fields="
        + fields.keySet() + '}';
    }
}
