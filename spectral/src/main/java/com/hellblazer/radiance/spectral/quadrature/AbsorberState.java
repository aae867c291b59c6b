/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Radiance.
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
package com.hellblazer.radiance.spectral.quadrature;

import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable set of named thermophysical state variables (pressure, temperature, number density, ...) at which
 * absorption data is evaluated.
 *
 * @author hal.hildebrand
 */
public final class AbsorberState {
    private static final AbsorberState EMPTY = new AbsorberState(Map.of());

    private final Map<String, Double> variables;

    private AbsorberState(Map<String, Double> variables) {
        var sorted = new TreeMap<String, Double>();
        variables.forEach((name, value) -> {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("State variable names must not be blank");
            }
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("State variable '" + name + "' must be finite, got " + value);
            }
            sorted.put(name, value);
        });
        this.variables = Collections.unmodifiableMap(sorted);
    }

    public static AbsorberState empty() {
        return EMPTY;
    }

    public static AbsorberState of(Map<String, Double> variables) {
        return variables.isEmpty() ? EMPTY : new AbsorberState(variables);
    }

    /**
     * @return a copy of this state with {@code name} set to {@code value}
     */
    public AbsorberState with(String name, double value) {
        var copy = new TreeMap<>(variables);
        copy.put(name, value);
        return new AbsorberState(copy);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    /**
     * @throws DomainException if the variable is not part of this state
     */
    public double get(String name) {
        var value = variables.get(name);
        if (value == null) {
            throw new DomainException("Absorber state has no variable '" + name + "', available: " + variables.keySet());
        }
        return value;
    }

    public Set<String> names() {
        return variables.keySet();
    }

    public Map<String, Double> asMap() {
        return variables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof AbsorberState that && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "AbsorberState" + variables;
    }
}
