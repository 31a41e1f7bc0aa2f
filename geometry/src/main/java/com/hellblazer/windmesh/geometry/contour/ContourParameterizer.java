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

import com.hellblazer.windmesh.geometry.MeshGenerationException.InvalidContourException;
import com.hellblazer.windmesh.geometry.discretization.Discretization;
import com.hellblazer.windmesh.geometry.discretization.Discretizer;
import com.hellblazer.windmesh.geometry.spline.DistributionCurve;
import com.hellblazer.windmesh.geometry.spline.SplineInterpolator;
import com.hellblazer.windmesh.geometry.spline.SplineOptions;
import com.hellblazer.windmesh.geometry.spline.SplineVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits closed contours into x-monotonic chains and reparameterizes each chain with splines so it can be resampled
 * with uniform or clustered point density.
 *
 * @author hal.hildebrand
 */
public final class ContourParameterizer {

    private static final Logger log = LoggerFactory.getLogger(ContourParameterizer.class);

    private ContourParameterizer() {
    }

    /**
     * Splits the contour at its minimum-x and maximum-x vertices.
     *
     * @param contour the closed contour
     * @return both chains, each running from the minimum-x vertex to the maximum-x vertex
     * @throws InvalidContourException if either chain is not strictly increasing in x
     */
    public static ContourSplit split(Contour contour) {
        Objects.requireNonNull(contour, "contour cannot be null");
        var points = contour.points();
        var m = points.size();
        var iMin = 0;
        var iMax = 0;
        for (int i = 1; i < m; i++) {
            if (points.get(i).x < points.get(iMin).x) {
                iMin = i;
            }
            if (points.get(i).x > points.get(iMax).x) {
                iMax = i;
            }
        }

        var forward = walk(points, iMin, iMax, 1);
        var backward = walk(points, iMin, iMax, -1);
        requireMonotonic(forward, "forward");
        requireMonotonic(backward, "backward");

        var split = meanY(forward) >= meanY(backward) ? new ContourSplit(forward, backward)
                                                      : new ContourSplit(backward, forward);
        log.debug("Split contour of {} points into upper {} and lower {}", m, split.upper().size(),
                  split.lower().size());
        return split;
    }

    /**
     * Reparameterizes a chain as x(t), y(t) over a shared injective parameter t in [0, 1].
     *
     * @param chain   ordered points, at least two
     * @param options spline fit options for both coordinates
     * @param mode    how t is assigned to the chain points
     * @return the curve
     */
    public static ChainCurve parameterize(List<Point2d> chain, SplineOptions options, ParameterMode mode) {
        Objects.requireNonNull(chain, "chain cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        if (chain.size() < 2) {
            throw new IllegalArgumentException("a chain needs at least 2 points, got " + chain.size());
        }
        var t = parameters(chain, mode);
        var xs = new double[chain.size()];
        var ys = new double[chain.size()];
        for (int i = 0; i < chain.size(); i++) {
            xs[i] = chain.get(i).x;
            ys[i] = chain.get(i).y;
        }
        return new ChainCurve(SplineInterpolator.fit(t, xs, options), SplineInterpolator.fit(t, ys, options), mode);
    }

    public static ChainCurve parameterize(List<Point2d> chain, SplineOptions options) {
        return parameterize(chain, options, ParameterMode.ARCLENGTH);
    }

    /**
     * Samples the curve between t0 and t1.
     *
     * @return divisions + 1 points in order
     */
    public static List<Point2d> discretize(ParametricCurve curve, double t0, double t1,
                                           Discretization discretization) {
        Objects.requireNonNull(curve, "curve cannot be null");
        return Discretizer.discretize(curve::at, t0, t1, discretization);
    }

    /**
     * Residuals of the x(t) and y(t) fits at the chain's own parameters.
     *
     * @param name  label of the chain; the results are named name.x and name.y
     * @param chain the points the curve was fitted to
     * @param curve the fitted curve
     */
    public static List<SplineVerification> verify(String name, List<Point2d> chain, ChainCurve curve) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(chain, "chain cannot be null");
        Objects.requireNonNull(curve, "curve cannot be null");
        var t = parameters(chain, curve.mode());
        var xs = new double[chain.size()];
        var ys = new double[chain.size()];
        for (int i = 0; i < chain.size(); i++) {
            xs[i] = chain.get(i).x;
            ys[i] = chain.get(i).y;
        }
        return List.of(SplineVerification.verify(name + ".x", new DistributionCurve(t, xs), curve.x()),
                       SplineVerification.verify(name + ".y", new DistributionCurve(t, ys), curve.y()));
    }

    static double[] parameters(List<Point2d> chain, ParameterMode mode) {
        var n = chain.size();
        var t = new double[n];
        if (mode == ParameterMode.INJECTIVE_AXIS) {
            var x0 = chain.get(0).x;
            var span = chain.get(n - 1).x - x0;
            for (int i = 0; i < n; i++) {
                t[i] = (chain.get(i).x - x0) / span;
            }
        } else {
            for (int i = 1; i < n; i++) {
                t[i] = t[i - 1] + chain.get(i).distance(chain.get(i - 1));
            }
            var total = t[n - 1];
            for (int i = 1; i < n; i++) {
                t[i] /= total;
            }
        }
        t[n - 1] = 1.0;
        for (int i = 1; i < n; i++) {
            if (t[i] <= t[i - 1]) {
                throw new InvalidContourException("Chain parameter is not injective at point " + i);
            }
        }
        return t;
    }

    private static List<Point2d> walk(List<Point2d> points, int from, int to, int step) {
        var m = points.size();
        var chain = new ArrayList<Point2d>();
        var i = from;
        chain.add(new Point2d(points.get(i)));
        while (i != to) {
            i = Math.floorMod(i + step, m);
            chain.add(new Point2d(points.get(i)));
        }
        return chain;
    }

    private static void requireMonotonic(List<Point2d> chain, String direction) {
        for (int i = 1; i < chain.size(); i++) {
            if (chain.get(i).x <= chain.get(i - 1).x) {
                throw new InvalidContourException(
                String.format("Contour cannot be split into x-monotonic chains: %s chain reverses at (%f, %f)",
                              direction, chain.get(i).x, chain.get(i).y));
            }
        }
    }

    private static double meanY(List<Point2d> chain) {
        return chain.stream().mapToDouble(p -> p.y).average().orElse(0.0);
    }
}
