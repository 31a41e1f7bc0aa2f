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
package com.hellblazer.windmesh.geometry;

/**
 * Sealed exception hierarchy for fatal validation failures during mesh generation.
 * <p>
 * Every exception of this hierarchy is raised before any partial mesh is produced.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link SectionMismatchException} - cross sections with differing point counts</li>
 * <li>{@link UnsupportedDiscretizationException} - unknown discretization descriptor</li>
 * <li>{@link InvalidContourException} - open, degenerate or unsplittable contour</li>
 * <li>{@link DuplicatePartException} - part name already present in a multi-part mesh</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class MeshGenerationException extends RuntimeException
    permits MeshGenerationException.SectionMismatchException,
            MeshGenerationException.UnsupportedDiscretizationException,
            MeshGenerationException.InvalidContourException,
            MeshGenerationException.DuplicatePartException {

    /**
     * Constructs a new mesh generation exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MeshGenerationException(String message) {
        super(message);
    }

    /**
     * Constructs a new mesh generation exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public MeshGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the cross sections of a loft do not share a single point count, or when that count does not
     * match the arclength node count of the grid being lofted.
     */
    public static final class SectionMismatchException extends MeshGenerationException {
        private final int expectedPoints;
        private final int actualPoints;

        public SectionMismatchException(int expected, int actual, String where) {
            super(String.format("All cross sections must have the same number of points: expected %d, got %d at %s",
                                expected, actual, where));
            this.expectedPoints = expected;
            this.actualPoints = actual;
        }

        public int getExpectedPoints() {
            return expectedPoints;
        }

        public int getActualPoints() {
            return actualPoints;
        }
    }

    /**
     * Thrown when a discretization descriptor is neither a plain count nor a multi-section descriptor.
     */
    public static final class UnsupportedDiscretizationException extends MeshGenerationException {

        public UnsupportedDiscretizationException(Object descriptor) {
            super("Expected a uniform or multi-section discretization, got "
                  + (descriptor == null ? "null" : descriptor.getClass().getName()));
        }
    }

    /**
     * Thrown when a contour cannot be treated as a closed curve split into two injective chains.
     */
    public static final class InvalidContourException extends MeshGenerationException {

        public InvalidContourException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a part is inserted under a name that is already taken.
     */
    public static final class DuplicatePartException extends MeshGenerationException {
        private final String partName;

        public DuplicatePartException(String partName) {
            super("Part already exists: " + partName);
            this.partName = partName;
        }

        public String getPartName() {
            return partName;
        }
    }
}
