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

import javax.vecmath.Matrix3d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Nodes plus triangle connectivity. Connectivity is fixed; only node positions change under transforms.
 *
 * @author hal.hildebrand
 */
public final class TriangleSurface implements Mesh {

    private final double[] nodes;
    private final int[]    triangles;

    TriangleSurface(double[] nodes, int[] triangles) {
        this.nodes = nodes;
        this.triangles = triangles;
    }

    /**
     * @param nodes     the vertices
     * @param triangles vertex index triples
     * @throws IndexOutOfBoundsException if a triangle references a missing node
     */
    public static TriangleSurface of(List<Point3d> nodes, List<int[]> triangles) {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        Objects.requireNonNull(triangles, "triangles cannot be null");
        var buffer = new double[nodes.size() * 3];
        for (int i = 0; i < nodes.size(); i++) {
            var p = nodes.get(i);
            buffer[i * 3] = p.x;
            buffer[i * 3 + 1] = p.y;
            buffer[i * 3 + 2] = p.z;
        }
        var connectivity = new int[triangles.size() * 3];
        for (int t = 0; t < triangles.size(); t++) {
            var tri = triangles.get(t);
            if (tri.length != 3) {
                throw new IllegalArgumentException("triangle " + t + " must have 3 vertices");
            }
            for (int k = 0; k < 3; k++) {
                if (tri[k] < 0 || tri[k] >= nodes.size()) {
                    throw new IndexOutOfBoundsException("triangle " + t + " references missing node " + tri[k]);
                }
                connectivity[t * 3 + k] = tri[k];
            }
        }
        return new TriangleSurface(buffer, connectivity);
    }

    @Override
    public int nodeCount() {
        return nodes.length / 3;
    }

    @Override
    public Point3d getNode(int index) {
        Objects.checkIndex(index, nodeCount());
        return new Point3d(nodes[index * 3], nodes[index * 3 + 1], nodes[index * 3 + 2]);
    }

    public int triangleCount() {
        return triangles.length / 3;
    }

    /**
     * @return the three node indices of the triangle
     */
    public int[] triangle(int t) {
        Objects.checkIndex(t, triangleCount());
        return Arrays.copyOfRange(triangles, t * 3, t * 3 + 3);
    }

    /**
     * Cross product of the triangle's first two edges, so its length is twice the area and its direction follows
     * the winding.
     */
    public Vector3d areaVector(int t) {
        var tri = triangle(t);
        var a = getNode(tri[0]);
        var e1 = new Vector3d(getNode(tri[1]));
        e1.sub(a);
        var e2 = new Vector3d(getNode(tri[2]));
        e2.sub(a);
        var cross = new Vector3d();
        cross.cross(e1, e2);
        return cross;
    }

    /**
     * @return the unit normal, or the zero vector for a degenerate triangle
     */
    public Vector3d normal(int t) {
        var n = areaVector(t);
        var length = n.length();
        if (length > 0.0) {
            n.scale(1.0 / length);
        }
        return n;
    }

    public double triangleArea(int t) {
        return 0.5 * areaVector(t).length();
    }

    public double area() {
        var sum = 0.0;
        for (int t = 0; t < triangleCount(); t++) {
            sum += triangleArea(t);
        }
        return sum;
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

    @Override
    public TriangleSurface copy() {
        return new TriangleSurface(nodes.clone(), triangles.clone());
    }

    @Override
    public String toString() {
        return "TriangleSurface{nodes=" + nodeCount() + ", triangles=" + triangleCount() + '}';
    }
}
