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
package com.hellblazer.radiance.spectral.index;

import java.util.Comparator;

/**
 * Atomic addressable unit of spectral evaluation: one wavelength, or one node of a correlated-k bin.
 * <p>
 * Indices are immutable, equal by content and totally ordered by wavelength, then node index, then bin id. Reductions
 * over indices run in this order.
 *
 * @author hal.hildebrand
 */
public sealed interface SpectralIndex extends Comparable<SpectralIndex>
permits SpectralIndex.Monochromatic, SpectralIndex.CorrelatedK {

    Comparator<SpectralIndex> CANONICAL_ORDER = Comparator.comparingDouble(SpectralIndex::wavelength)
                                                          .thenComparingInt(SpectralIndex::nodeIndex)
                                                          .thenComparing(SpectralIndex::binId);

    /**
     * Representative wavelength (nm): the wavelength itself, or the bin centre.
     */
    double wavelength();

    /**
     * Node position in its bin, 0 for monochromatic indices.
     */
    int nodeIndex();

    /**
     * Bin identifier, empty for monochromatic indices.
     */
    String binId();

    @Override
    default int compareTo(SpectralIndex o) {
        return CANONICAL_ORDER.compare(this, o);
    }

    /**
     * A single wavelength with implicit weight 1.
     */
    record Monochromatic(double wavelength) implements SpectralIndex {
        public Monochromatic {
            if (!Double.isFinite(wavelength)) {
                throw new IllegalArgumentException("Wavelength must be finite, got " + wavelength);
            }
        }

        @Override
        public int nodeIndex() {
            return 0;
        }

        @Override
        public String binId() {
            return "";
        }

        @Override
        public String toString() {
            return wavelength + " nm";
        }
    }

    /**
     * One quadrature node of a correlated-k bin.
     *
     * @param binId     bin identifier
     * @param lower     bin lower bound (nm)
     * @param upper     bin upper bound (nm)
     * @param nodeIndex 0-based node position
     * @param g         cumulative probability coordinate in [0, 1]
     * @param weight    node weight; the weights of one bin sum to 1
     */
    record CorrelatedK(String binId, double lower, double upper, int nodeIndex, double g, double weight)
    implements SpectralIndex {
        public CorrelatedK {
            if (binId == null || binId.isBlank()) {
                throw new IllegalArgumentException("Bin id must not be blank");
            }
            if (!(upper > lower)) {
                throw new IllegalArgumentException("Bin upper bound " + upper + " must exceed lower " + lower);
            }
            if (nodeIndex < 0) {
                throw new IllegalArgumentException("Node index must not be negative, got " + nodeIndex);
            }
            if (!(g >= 0.0 && g <= 1.0)) {
                throw new IllegalArgumentException("g must lie in [0, 1], got " + g);
            }
            if (!(weight >= 0.0) || !Double.isFinite(weight)) {
                throw new IllegalArgumentException("Node weight must be non-negative and finite, got " + weight);
            }
        }

        @Override
        public double wavelength() {
            return 0.5 * (lower + upper);
        }

        @Override
        public String toString() {
            return binId + "[" + nodeIndex + "] g=" + g;
        }
    }
}
