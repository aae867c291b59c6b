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
package com.hellblazer.radiance.spectral.grid;

import com.hellblazer.radiance.common.Interval;
import com.hellblazer.radiance.spectral.quadrature.QuadratureTable;

import java.util.Optional;

/**
 * Correlated-k spectral bin covering the half-open wavelength range {@code [lower, upper)}.
 *
 * @param id    unique bin identifier
 * @param lower lower wavelength bound (nm), inclusive
 * @param upper upper wavelength bound (nm), exclusive
 * @param table quadrature data supplied by the medium, null if none
 * @author hal.hildebrand
 */
public record Bin(String id, double lower, double upper, QuadratureTable table) {

    public Bin {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Bin id must not be blank");
        }
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Bin '" + id + "' bounds must be finite");
        }
        if (!(upper > lower)) {
            throw new IllegalArgumentException("Bin '" + id + "' upper bound " + upper + " must exceed lower " + lower);
        }
        if (table != null && !table.binId().equals(id)) {
            throw new IllegalArgumentException("Quadrature table for bin '" + table.binId() + "' attached to bin '" + id + "'");
        }
    }

    public Bin(String id, double lower, double upper) {
        this(id, lower, upper, null);
    }

    public Optional<QuadratureTable> quadratureTable() {
        return Optional.ofNullable(table);
    }

    public Bin withTable(QuadratureTable table) {
        return new Bin(id, lower, upper, table);
    }

    public double center() {
        return 0.5 * (lower + upper);
    }

    public double width() {
        return upper - lower;
    }

    public boolean contains(double wavelength) {
        return lower <= wavelength && wavelength < upper;
    }

    /**
     * @return true if the closed interval shares positive length with this bin, or is a point inside it
     */
    public boolean overlaps(Interval interval) {
        return interval.overlapsHalfOpen(lower, upper);
    }
}
