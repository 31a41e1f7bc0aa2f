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

import java.util.Arrays;
import java.util.Objects;

/**
 * Named data attached to every node of a grid, stored node-major with {@link FieldKind#components()} values per
 * node.
 *
 * @author hal.hildebrand
 */
public record NodeField(String name, FieldKind kind, double[] values) {

    public NodeField {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length % kind.components() != 0) {
            throw new IllegalArgumentException(
            String.format("%d values do not divide into %s entries", values.length, kind));
        }
        values = values.clone();
    }

    public int nodeCount() {
        return values.length / kind.components();
    }

    /**
     * @return the components stored for the node
     */
    public double[] value(int node) {
        var c = kind.components();
        return Arrays.copyOfRange(values, node * c, node * c + c);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NodeField other)) return false;
        return name.equals(other.name) && kind == other.kind && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "NodeField{name=" + name + ", kind=" + kind + ", nodes=" + nodeCount() + '}';
    }
}
