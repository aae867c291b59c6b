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
package com.hellblazer.radiance.spectral;

import com.hellblazer.radiance.spectral.index.SpectralIndex;

import java.util.Optional;

/**
 * Base exception for spectral discretization and aggregation failures.
 * <p>
 * Exception hierarchy:
 * <ul>
 * <li>{@link DomainException} - wavelength, state variable or g coordinate outside the tabulated domain</li>
 * <li>{@link EmptySpectralGridException} - the response function support does not meet the spectral grid</li>
 * <li>{@link IndexEvaluationException} - a spectral index failed under fail-fast, or no index survived</li>
 * </ul>
 * Argument validation failures are reported as {@link IllegalArgumentException} and are not part of this hierarchy.
 *
 * @author hal.hildebrand
 */
public sealed class SpectralEngineException extends RuntimeException
permits SpectralEngineException.DomainException, SpectralEngineException.EmptySpectralGridException,
        SpectralEngineException.IndexEvaluationException {

    public SpectralEngineException(String message) {
        super(message);
    }

    public SpectralEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a query falls outside the domain of a response function or a tabulated dataset. Values are never
     * clamped.
     */
    public static final class DomainException extends SpectralEngineException {

        public DomainException(String message) {
            super(message);
        }

        public DomainException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown at grid-build time when restricting a grid to a response function support leaves nothing to evaluate.
     */
    public static final class EmptySpectralGridException extends SpectralEngineException {

        public EmptySpectralGridException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when the kernel result for a spectral index is missing or failed and the failure policy does not allow
     * dropping it, or when every index failed.
     */
    public static final class IndexEvaluationException extends SpectralEngineException {
        private final SpectralIndex index;

        public IndexEvaluationException(String message) {
            super(message);
            this.index = null;
        }

        public IndexEvaluationException(SpectralIndex index, String message, Throwable cause) {
            super(message, cause);
            this.index = index;
        }

        /**
         * @return the offending index, empty when the failure is not attributable to a single index
         */
        public Optional<SpectralIndex> getIndex() {
            return Optional.ofNullable(index);
        }
    }
}
