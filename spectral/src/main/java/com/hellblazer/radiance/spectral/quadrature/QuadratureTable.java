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

import com.hellblazer.radiance.common.quadrature.QuadratureType;
import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Per-bin quadrature data supplied by the medium: the rule family, the node counts the absorption data was computed
 * for, and optionally a transmittance error curve and a k-distribution.
 *
 * @author hal.hildebrand
 */
public final class QuadratureTable {
    public static final int DEFAULT_MAX_NODES = 16;

    private final String                  binId;
    private final QuadratureType          type;
    private final int[]                   availableNodeCounts;
    private final TransmittanceErrorCurve errorCurve;
    private final KDistribution           kDistribution;

    private QuadratureTable(Builder builder, int[] availableNodeCounts) {
        this.binId = builder.binId;
        this.type = builder.type;
        this.availableNodeCounts = availableNodeCounts;
        this.errorCurve = builder.errorCurve;
        this.kDistribution = builder.kDistribution;
    }

    public static Builder builder(String binId) {
        return new Builder(binId);
    }

    public String binId() {
        return binId;
    }

    public QuadratureType type() {
        return type;
    }

    /**
     * @return sorted, distinct node counts
     */
    public int[] availableNodeCounts() {
        return availableNodeCounts.clone();
    }

    public int minNodes() {
        return availableNodeCounts[0];
    }

    public int maxNodes() {
        return availableNodeCounts[availableNodeCounts.length - 1];
    }

    /**
     * @return the smallest available node count not below {@code nodes}, or {@link #maxNodes()} if there is none
     */
    public int roundUpToAvailable(int nodes) {
        for (int available : availableNodeCounts) {
            if (available >= nodes) {
                return available;
            }
        }
        return maxNodes();
    }

    public Optional<TransmittanceErrorCurve> errorCurve() {
        return Optional.ofNullable(errorCurve);
    }

    public Optional<KDistribution> kDistribution() {
        return Optional.ofNullable(kDistribution);
    }

    /**
     * Absorption coefficient handed to the kernel for the node at {@code g}.
     *
     * @throws DomainException if the table carries no k-distribution, or {@code g} or the state is outside its domain
     */
    public double absorptionCoefficient(double g, AbsorberState state) {
        if (kDistribution == null) {
            throw new DomainException("Quadrature table for bin '" + binId + "' has no k-distribution");
        }
        return kDistribution.absorptionCoefficient(g, state);
    }

    @Override
    public String toString() {
        return "QuadratureTable{bin=" + binId + ", " + type.id() + ", nodes=" + Arrays.toString(availableNodeCounts)
        + ", error curve=" + (errorCurve != null) + ", k-distribution=" + (kDistribution != null) + "}";
    }

    public static class Builder {
        private final String                  binId;
        private       QuadratureType          type     = QuadratureType.GAUSS_LEGENDRE;
        private       int                     maxNodes = DEFAULT_MAX_NODES;
        private       int[]                   availableNodeCounts;
        private       TransmittanceErrorCurve errorCurve;
        private       KDistribution           kDistribution;

        private Builder(String binId) {
            if (binId == null || binId.isBlank()) {
                throw new IllegalArgumentException("Bin id must not be blank");
            }
            this.binId = binId;
        }

        public Builder withType(QuadratureType type) {
            if (type == null) {
                throw new IllegalArgumentException("Quadrature type cannot be null");
            }
            this.type = type;
            return this;
        }

        /**
         * Make every node count from the rule minimum to {@code maxNodes} available.
         */
        public Builder withMaxNodes(int maxNodes) {
            if (maxNodes < 1) {
                throw new IllegalArgumentException("Maximum node count must be positive, got " + maxNodes);
            }
            this.maxNodes = maxNodes;
            this.availableNodeCounts = null;
            return this;
        }

        public Builder withAvailableNodeCounts(int... counts) {
            if (counts.length == 0) {
                throw new IllegalArgumentException("At least one node count must be available");
            }
            this.availableNodeCounts = Arrays.stream(counts).sorted().distinct().toArray();
            return this;
        }

        /**
         * A {@link TabulatedErrorCurve} restricts the available node counts to those it tabulates when no counts
         * were listed explicitly, and must cover explicitly listed counts.
         */
        public Builder withErrorCurve(TransmittanceErrorCurve errorCurve) {
            this.errorCurve = errorCurve;
            return this;
        }

        public Builder withKDistribution(KDistribution kDistribution) {
            this.kDistribution = kDistribution;
            return this;
        }

        public QuadratureTable build() {
            var counts = availableNodeCounts;
            if (errorCurve instanceof TabulatedErrorCurve tabulated) {
                var tabulatedCounts = tabulated.nodeCounts();
                if (counts == null) {
                    counts = Arrays.stream(tabulatedCounts)
                                   .filter(n -> n >= type.minimumNodes() && n <= maxNodes)
                                   .toArray();
                    if (counts.length == 0) {
                        throw new IllegalArgumentException(
                        "Error curve of bin '" + binId + "' tabulates no node count between " + type.minimumNodes()
                        + " and " + maxNodes + ": " + Arrays.toString(tabulatedCounts));
                    }
                } else {
                    for (int n : counts) {
                        if (Arrays.binarySearch(tabulatedCounts, n) < 0) {
                            throw new IllegalArgumentException(
                            "Error curve of bin '" + binId + "' has no data for available node count " + n
                            + ", tabulated: " + Arrays.toString(tabulatedCounts));
                        }
                    }
                }
            }
            if (counts == null) {
                counts = IntStream.rangeClosed(type.minimumNodes(), Math.max(type.minimumNodes(), maxNodes)).toArray();
            } else if (counts[0] < type.minimumNodes()) {
                throw new IllegalArgumentException(
                type.id() + " needs at least " + type.minimumNodes() + " nodes, table lists " + counts[0]);
            }
            return new QuadratureTable(this, counts);
        }
    }
}
