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

/**
 * How many quadrature nodes a correlated-k bin is evaluated with.
 *
 * @author hal.hildebrand
 */
public sealed interface QuadraturePolicy
permits QuadraturePolicy.Fixed, QuadraturePolicy.MinError, QuadraturePolicy.ErrorThreshold {

    /**
     * Target transmittance error of {@link #minError()}.
     */
    double DEFAULT_MIN_ERROR_TARGET = 1e-3;

    static Fixed fixed(int nodes) {
        return new Fixed(QuadratureType.GAUSS_LEGENDRE, nodes);
    }

    static Fixed fixed(QuadratureType type, int nodes) {
        return new Fixed(type, nodes);
    }

    static MinError minError() {
        return new MinError(DEFAULT_MIN_ERROR_TARGET, 0);
    }

    static MinError minError(double target) {
        return new MinError(target, 0);
    }

    static ErrorThreshold threshold(double threshold) {
        return new ErrorThreshold(threshold, 0);
    }

    /**
     * Largest node count the policy may select, 0 when unbounded.
     */
    int maximum();

    /**
     * Fixed node count. Without a quadrature table the policy's own rule type is used.
     */
    record Fixed(QuadratureType type, int nodes) implements QuadraturePolicy {
        public Fixed {
            if (type == null) {
                throw new IllegalArgumentException("Quadrature type cannot be null");
            }
            if (nodes < 1) {
                throw new IllegalArgumentException("Node count must be positive, got " + nodes);
            }
        }

        @Override
        public int maximum() {
            return nodes;
        }
    }

    /**
     * Smallest node count whose error does not exceed {@code target}; the minimum-error candidate when none does.
     */
    record MinError(double target, int maximum) implements QuadraturePolicy {
        public MinError {
            checkErrorPolicy(target, maximum);
        }
    }

    /**
     * Smallest node count whose error does not exceed {@code threshold}; the largest candidate when none does.
     */
    record ErrorThreshold(double threshold, int maximum) implements QuadraturePolicy {
        public ErrorThreshold {
            checkErrorPolicy(threshold, maximum);
        }
    }

    private static void checkErrorPolicy(double target, int maximum) {
        if (!(target > 0.0) || !Double.isFinite(target)) {
            throw new IllegalArgumentException("Error target must be positive and finite, got " + target);
        }
        if (maximum < 0) {
            throw new IllegalArgumentException("Maximum node count must not be negative, got " + maximum);
        }
    }
}
