/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Raylink.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.raylink.channel.config;

import com.hellblazer.raylink.channel.ChannelStateException.ConfigurationException;

import java.util.Objects;

/**
 * Everything the session start message carries besides the node roster.
 * <p>
 * Immutable; use the {@code withX} methods to derive variants.
 *
 * @author hal.hildebrand
 */
public final class SessionConfiguration {

    /** Default look-ahead depth. */
    public static final int DEFAULT_SUB_MODE = 1;

    /** Default time evolution model: the oracle re-traces on position change. */
    public static final String DEFAULT_TIME_EVOLUTION_MODEL = "position";

    private final String             scene;
    private final String             target;
    private final long               seed;
    private final OracleMode         mode;
    private final int                subMode;
    private final String             timeEvolutionModel;
    private final RadioConfiguration radio;

    /**
     * @param scene              scene identifier, relative to the oracle's model directory
     * @param target             oracle endpoint address, e.g. {@code localhost:5555}
     * @param seed               random seed shared with the oracle
     * @param mode               computation mode
     * @param subMode            look-ahead depth, used by {@link OracleMode#FULL_MESH_LOOKAHEAD}
     * @param timeEvolutionModel time evolution model name
     * @param radio              radio parameters
     */
    public SessionConfiguration(String scene, String target, long seed, OracleMode mode, int subMode,
                                String timeEvolutionModel, RadioConfiguration radio) {
        Objects.requireNonNull(scene, "scene cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        Objects.requireNonNull(timeEvolutionModel, "timeEvolutionModel cannot be null");
        Objects.requireNonNull(radio, "radio cannot be null");
        if (scene.isBlank()) {
            throw new ConfigurationException("Scene must be specified");
        }
        if (subMode < 0) {
            throw new ConfigurationException("Sub mode must be non-negative: " + subMode);
        }
        this.scene = scene;
        this.target = target;
        this.seed = seed;
        this.mode = mode;
        this.subMode = subMode;
        this.timeEvolutionModel = timeEvolutionModel;
        this.radio = radio;
    }

    /**
     * Look-ahead mode, depth 1, default radio.
     *
     * @param scene  scene identifier
     * @param target oracle endpoint address
     */
    public static SessionConfiguration of(String scene, String target) {
        return new SessionConfiguration(scene, target, 1L, OracleMode.FULL_MESH_LOOKAHEAD, DEFAULT_SUB_MODE,
                                        DEFAULT_TIME_EVOLUTION_MODEL, RadioConfiguration.defaultConfig());
    }

    public String scene() {
        return scene;
    }

    public String target() {
        return target;
    }

    public long seed() {
        return seed;
    }

    public OracleMode mode() {
        return mode;
    }

    public int subMode() {
        return subMode;
    }

    public String timeEvolutionModel() {
        return timeEvolutionModel;
    }

    public RadioConfiguration radio() {
        return radio;
    }

    public SessionConfiguration withSeed(long newSeed) {
        return new SessionConfiguration(scene, target, newSeed, mode, subMode, timeEvolutionModel, radio);
    }

    public SessionConfiguration withMode(OracleMode newMode) {
        return new SessionConfiguration(scene, target, seed, newMode, subMode, timeEvolutionModel, radio);
    }

    public SessionConfiguration withSubMode(int newSubMode) {
        return new SessionConfiguration(scene, target, seed, mode, newSubMode, timeEvolutionModel, radio);
    }

    public SessionConfiguration withTimeEvolutionModel(String newModel) {
        return new SessionConfiguration(scene, target, seed, mode, subMode, newModel, radio);
    }

    public SessionConfiguration withRadio(RadioConfiguration newRadio) {
        return new SessionConfiguration(scene, target, seed, mode, subMode, timeEvolutionModel, newRadio);
    }

    @Override
    public String toString() {
        return String.format("SessionConfiguration[scene=%s, target=%s, seed=%d, mode=%s, subMode=%d, evo=%s, %s]",
                             scene, target, seed, mode, subMode, timeEvolutionModel, radio);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (SessionConfiguration) obj;
        return seed == other.seed && subMode == other.subMode && mode == other.mode && scene.equals(other.scene)
        && target.equals(other.target) && timeEvolutionModel.equals(other.timeEvolutionModel) && radio.equals(
        other.radio);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scene, target, seed, mode, subMode, timeEvolutionModel, radio);
    }
}
