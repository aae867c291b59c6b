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

import com.hellblazer.radiance.spectral.quadrature.QuadratureTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Non-overlapping correlated-k bins sorted by lower bound.
 *
 * @author hal.hildebrand
 */
public final class BinnedGrid implements SpectralGrid {
    private static final Logger log = LoggerFactory.getLogger(BinnedGrid.class);

    private final List<Bin> bins;

    /**
     * @param bins bins in any order; sorted by lower bound, must not overlap and must carry unique ids
     */
    public BinnedGrid(Collection<Bin> bins) {
        var sorted = new ArrayList<>(bins);
        sorted.sort(Comparator.comparingDouble(Bin::lower));
        var ids = new HashSet<String>();
        for (int i = 0; i < sorted.size(); i++) {
            var bin = sorted.get(i);
            if (!ids.add(bin.id())) {
                throw new IllegalArgumentException("Duplicate bin id '" + bin.id() + "'");
            }
            if (i > 0 && sorted.get(i - 1).upper() > bin.lower()) {
                throw new IllegalArgumentException(
                "Bins '" + sorted.get(i - 1).id() + "' and '" + bin.id() + "' overlap");
            }
        }
        this.bins = List.copyOf(sorted);
    }

    /**
     * Contiguous bins of equal {@code width} from {@code start}, the last bin ending at {@code stop} (within a tenth of
     * a width).
     */
    public static BinnedGrid arange(double start, double stop, double width) {
        if (!(width > 0.0)) {
            throw new IllegalArgumentException("Bin width must be positive, got " + width);
        }
        if (!(stop > start)) {
            throw new IllegalArgumentException("Stop " + stop + " must exceed start " + start);
        }
        int n = (int) Math.floor((stop - start) / width + 0.1);
        var edges = new double[n + 1];
        for (int i = 0; i <= n; i++) {
            edges[i] = start + i * width;
        }
        return fromEdges(edges);
    }

    /**
     * Contiguous bins between consecutive strictly increasing edges, identified by their bounds.
     */
    public static BinnedGrid fromEdges(double... edges) {
        if (edges.length < 2) {
            throw new IllegalArgumentException("At least two bin edges are required");
        }
        var bins = new ArrayList<Bin>(edges.length - 1);
        for (int i = 0; i < edges.length - 1; i++) {
            bins.add(new Bin(binId(edges[i], edges[i + 1]), edges[i], edges[i + 1]));
        }
        return new BinnedGrid(bins);
    }

    /**
     * Identifier of a bin built from edges, e.g. {@code "535-545"}.
     */
    public static String binId(double lower, double upper) {
        return format(lower) + "-" + format(upper);
    }

    private static String format(double wavelength) {
        return wavelength == Math.rint(wavelength) && Math.abs(wavelength) < 1e15 ? Long.toString((long) wavelength)
                                                                                   : Double.toString(wavelength);
    }

    /**
     * Attach quadrature tables to the bins they name. Bins without a table keep their current one.
     *
     * @throws IllegalArgumentException if a table names a bin that is not part of this grid
     */
    public BinnedGrid withQuadratureTables(Collection<QuadratureTable> tables) {
        var byId = new HashMap<String, QuadratureTable>();
        for (var table : tables) {
            if (byId.put(table.binId(), table) != null) {
                throw new IllegalArgumentException("More than one quadrature table for bin '" + table.binId() + "'");
            }
        }
        var attached = new ArrayList<Bin>(bins.size());
        for (var bin : bins) {
            var table = byId.remove(bin.id());
            attached.add(table == null ? bin : bin.withTable(table));
        }
        if (!byId.isEmpty()) {
            throw new IllegalArgumentException("Quadrature tables name unknown bins: " + byId.keySet());
        }
        log.debug("Attached {} quadrature tables to {} bins", tables.size(), bins.size());
        return new BinnedGrid(attached);
    }

    public List<Bin> bins() {
        return bins;
    }

    public Bin bin(int i) {
        return bins.get(i);
    }

    public Optional<Bin> bin(String id) {
        return bins.stream().filter(b -> b.id().equals(id)).findFirst();
    }

    /**
     * @return true if every bin starts where the previous one ends
     */
    public boolean isContiguous() {
        for (int i = 1; i < bins.size(); i++) {
            if (bins.get(i - 1).upper() != bins.get(i).lower()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int size() {
        return bins.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof BinnedGrid that && bins.equals(that.bins);
    }

    @Override
    public int hashCode() {
        return bins.hashCode();
    }

    @Override
    public String toString() {
        return "BinnedGrid{" + bins.size() + " bins" + (bins.isEmpty() ? ""
                                                                     : ", [" + bins.get(0).lower() + ", " + bins.get(
                                                                     bins.size() - 1).upper() + ")") + "}";
    }
}
