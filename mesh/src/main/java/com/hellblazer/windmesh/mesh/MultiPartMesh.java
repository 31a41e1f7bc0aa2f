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

import com.hellblazer.windmesh.geometry.MeshGenerationException.DuplicatePartException;
import com.hellblazer.windmesh.geometry.RigidTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Named sub-meshes in insertion order. Parts may themselves be multi-part meshes, addressed with paths such as
 * {@code "turbine1/rotor/blade2"}.
 * <p>
 * Parts are owned: a mesh added here should not be transformed elsewhere. Transforming the multi-part mesh moves
 * every part.
 *
 * @author hal.hildebrand
 */
public final class MultiPartMesh implements Mesh {

    public static final String PATH_SEPARATOR = "/";

    private static final Logger log = LoggerFactory.getLogger(MultiPartMesh.class);

    private final Map<String, Mesh> parts = new LinkedHashMap<>();

    /**
     * @param name the unique part name, without path separators
     * @param part the mesh to own
     * @throws DuplicatePartException if the name is taken; the existing part is kept
     */
    public void addPart(String name, Mesh part) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("part name cannot be null or empty");
        }
        if (name.contains(PATH_SEPARATOR)) {
            throw new IllegalArgumentException("part name cannot contain '" + PATH_SEPARATOR + "': " + name);
        }
        Objects.requireNonNull(part, "part cannot be null");
        if (part == this) {
            throw new IllegalArgumentException("a mesh cannot contain itself");
        }
        if (parts.putIfAbsent(name, part) != null) {
            throw new DuplicatePartException(name);
        }
        log.debug("Added part {} with {} nodes", name, part.nodeCount());
    }

    /**
     * Resolves a part by name or by a path through nested multi-part meshes.
     */
    public Optional<Mesh> getPart(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Mesh current = this;
        for (var name : path.split(PATH_SEPARATOR)) {
            if (!(current instanceof MultiPartMesh multi)) {
                return Optional.empty();
            }
            current = multi.parts.get(name);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public boolean containsPart(String path) {
        return getPart(path).isPresent();
    }

    /**
     * @return part names in insertion order
     */
    public List<String> partNames() {
        return List.copyOf(parts.keySet());
    }

    public Map<String, Mesh> parts() {
        return Collections.unmodifiableMap(parts);
    }

    public int partCount() {
        return parts.size();
    }

    /**
     * Moves a single part, leaving its siblings in place.
     *
     * @throws NoSuchElementException if no part has the path
     */
    public void transformPart(String path, RigidTransform transform) {
        getPart(path).orElseThrow(() -> new NoSuchElementException("No such part: " + path))
                     .applyRigidTransform(transform);
    }

    /**
     * @return the paths of all leaf parts, depth first in insertion order
     */
    public List<String> leafPaths() {
        var result = new ArrayList<String>();
        collectLeaves("", result);
        return result;
    }

    private void collectLeaves(String prefix, List<String> result) {
        parts.forEach((name, part) -> {
            var path = prefix + name;
            if (part instanceof MultiPartMesh multi) {
                multi.collectLeaves(path + PATH_SEPARATOR, result);
            } else {
                result.add(path);
            }
        });
    }

    @Override
    public int nodeCount() {
        return parts.values().stream().mapToInt(Mesh::nodeCount).sum();
    }

    /**
     * Node by running index over all parts in insertion order.
     */
    @Override
    public Point3d getNode(int index) {
        var remaining = index;
        if (remaining >= 0) {
            for (var part : parts.values()) {
                if (remaining < part.nodeCount()) {
                    return part.getNode(remaining);
                }
                remaining -= part.nodeCount();
            }
        }
        throw new IndexOutOfBoundsException(String.format("node %d out of bounds [0, %d)", index, nodeCount()));
    }

    @Override
    public void transform(Matrix3d matrix, Vector3d translation) {
        for (var part : parts.values()) {
            part.transform(matrix, translation);
        }
    }

    @Override
    public MultiPartMesh copy() {
        var copy = new MultiPartMesh();
        parts.forEach((name, part) -> copy.parts.put(name, part.copy()));
        return copy;
    }

    @Override
    public String toString() {
        return "MultiPartMesh{parts=" + parts.keySet() + ", nodes=" + nodeCount() + '}';
    }
}
