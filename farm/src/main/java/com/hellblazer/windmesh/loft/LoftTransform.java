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

import com.hellblazer.windmesh.geometry.Rotations;
import com.hellblazer.windmesh.geometry.spline.SplineCurve;
import com.hellblazer.windmesh.geometry.spline.SplineVerification;
import com.hellblazer.windmesh.mesh.SpaceTransform;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps (arclength index, span) grid nodes onto the lofted surface.
 * <p>
 * At a span position s the sections bracketing |s| are blended at the node's arclength index, the blended point is
 * scaled by chord(|s|), rotated by twist and tilt, offset by the leading edge and placed at span s, and the whole
 * point is scaled by the span reference length. Distributions are looked up at |s|, so a negative lower span bound
 * mirrors the loft into a symmetric wing.
 *
 * @author hal.hildebrand
 */
public final class LoftTransform implements SpaceTransform {

    private final LoftDefinition    definition;
    private final CrossSectionTable sections;
    private final SplineCurve       chord;
    private final SplineCurve       twist;
    private final SplineCurve       leadingEdgeX;
    private final SplineCurve       leadingEdgeZ;
    private final SplineCurve       tilt;
    private final double            spanScale;

    public LoftTransform(LoftDefinition definition, LoftConfiguration configuration) {
        this.definition = Objects.requireNonNull(definition, "definition cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
        var options = configuration.splineOptions();
        this.sections = definition.sections();
        this.chord = definition.chord().fit(options);
        this.twist = definition.twist().fit(options);
        this.leadingEdgeX = definition.leadingEdgeX().fit(options);
        this.leadingEdgeZ = definition.leadingEdgeZ().fit(options);
        this.tilt = definition.tiltCurve().map(c -> c.fit(options)).orElse(null);
        this.spanScale = configuration.spanScale();
    }

    /**
     * Evaluates every distribution at |span|.
     */
    public SpanProperties spanProperties(double span) {
        var s = Math.abs(span);
        return new SpanProperties(span, chord.evaluate(s), twist.evaluate(s), leadingEdgeX.evaluate(s),
                                  leadingEdgeZ.evaluate(s), tilt == null ? 0.0 : tilt.evaluate(s));
    }

    @Override
    public double[] apply(double[] coordinates, int[] index) {
        var span = coordinates[1];
        var properties = spanProperties(span);
        var blended = sections.blend(sections.bracket(Math.abs(span)), index[0]);

        var point = new Point3d(blended.x * properties.chord(), blended.y * properties.chord(), 0.0);
        Rotations.fromYawPitchRoll(-properties.twist(), -properties.tilt(), 0.0).transform(point);

        return new double[] { (point.x + properties.leadingEdgeX()) * spanScale, (span + point.z) * spanScale,
                              (point.y + properties.leadingEdgeZ()) * spanScale };
    }

    /**
     * Residuals of each fitted distribution at its table points.
     */
    public List<SplineVerification> verify() {
        var result = new ArrayList<SplineVerification>();
        result.add(SplineVerification.verify("chord", definition.chord(), chord));
        result.add(SplineVerification.verify("twist", definition.twist(), twist));
        result.add(SplineVerification.verify("leadingEdgeX", definition.leadingEdgeX(), leadingEdgeX));
        result.add(SplineVerification.verify("leadingEdgeZ", definition.leadingEdgeZ(), leadingEdgeZ));
        if (tilt != null) {
            result.add(SplineVerification.verify("tilt", definition.tilt(), tilt));
        }
        return result;
    }
}
