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
package com.hellblazer.windmesh.turbine;

import com.hellblazer.windmesh.mesh.Mesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Generates parts from registered definitions on first use and hands out copies of the cached templates.
 *
 * @author hal.hildebrand
 */
public final class ProceduralPartCatalog implements PartCatalog {

    public static final String DEFAULT_HUB   = "hub";
    public static final String DEFAULT_TOWER = "tower1";
    public static final String DEFAULT_BLADE = ReferenceBlades.NREL_5MW;

    private static final Logger log = LoggerFactory.getLogger(ProceduralPartCatalog.class);

    private final Map<String, BladeDefinition> blades;
    private final Map<String, HubGeometry>     hubs;
    private final Map<String, TowerGeometry>   towers;
    private final Map<String, Mesh>            templates = new ConcurrentHashMap<>();

    private ProceduralPartCatalog(Builder builder) {
        this.blades = Map.copyOf(builder.blades);
        this.hubs = Map.copyOf(builder.hubs);
        this.towers = Map.copyOf(builder.towers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A catalog holding the default hub, tower and blade, sized after the NREL 5-MW reference turbine.
     */
    public static ProceduralPartCatalog standard() {
        return builder().withStandardParts().build();
    }

    private static <T> T lookup(Map<String, T> definitions, String name, String kind) {
        Objects.requireNonNull(name, "name cannot be null");
        var definition = definitions.get(name);
        if (definition == null) {
            throw new NoSuchElementException("No " + kind + " named " + name);
        }
        return definition;
    }

    @Override
    public Mesh blade(String name) {
        var definition = lookup(blades, name, "blade");
        return template("blade/" + name, () -> BladeGenerator.generate(1.0, definition));
    }

    @Override
    public HubPart hub(String name) {
        var geometry = lookup(hubs, name, "hub");
        return new HubPart(template("hub/" + name, () -> HubGenerator.generate(geometry)), geometry.radius(),
                           geometry.thickness());
    }

    @Override
    public TowerPart tower(String name) {
        var geometry = lookup(towers, name, "tower");
        return new TowerPart(template("tower/" + name, () -> TowerGenerator.generate(geometry)),
                             geometry.height());
    }

    private Mesh template(String key, Supplier<Mesh> generator) {
        return templates.computeIfAbsent(key, k -> {
            log.debug("Generating part template {}", k);
            return generator.get();
        }).copy();
    }

    public static final class Builder {
        private final Map<String, BladeDefinition> blades = new HashMap<>();
        private final Map<String, HubGeometry>     hubs   = new HashMap<>();
        private final Map<String, TowerGeometry>   towers = new HashMap<>();

        private Builder() {
        }

        public Builder blade(BladeDefinition definition) {
            Objects.requireNonNull(definition, "definition cannot be null");
            blades.put(definition.name(), definition);
            return this;
        }

        public Builder hub(String name, HubGeometry geometry) {
            hubs.put(Objects.requireNonNull(name, "name cannot be null"),
                     Objects.requireNonNull(geometry, "geometry cannot be null"));
            return this;
        }

        public Builder tower(String name, TowerGeometry geometry) {
            towers.put(Objects.requireNonNull(name, "name cannot be null"),
                       Objects.requireNonNull(geometry, "geometry cannot be null"));
            return this;
        }

        /**
         * Registers the default parts, normalized by a 63 m tip radius: a 1.5 m hub 4 m long, an 87.6 m tower
         * tapering from 6 m to 3.87 m and the NREL 5-MW blade.
         */
        public Builder withStandardParts() {
            hub(DEFAULT_HUB, HubGeometry.of(1.5 / 63.0, 4.0 / 63.0));
            tower(DEFAULT_TOWER, TowerGeometry.of(87.6 / 63.0, 6.0 / 63.0, 3.87 / 63.0));
            return blade(ReferenceBlades.nrel5mw());
        }

        public ProceduralPartCatalog build() {
            return new ProceduralPartCatalog(this);
        }
    }
}
