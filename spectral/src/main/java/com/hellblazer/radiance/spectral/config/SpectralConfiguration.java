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
package com.hellblazer.radiance.spectral.config;

import com.hellblazer.radiance.spectral.index.FailurePolicy;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.response.BandResponse;

import java.time.Duration;

/**
 * Engine-wide settings: failure handling, response trimming, default error target and kernel dispatch.
 *
 * @author hal.hildebrand
 */
public class SpectralConfiguration {

    private final FailurePolicy failurePolicy;
    private final double        retention;
    private final double        minErrorTarget;
    private final int           parallelism;
    private final int           maxRetries;
    private final Duration      indexTimeout;

    private SpectralConfiguration(Builder builder) {
        this.failurePolicy = builder.failurePolicy;
        this.retention = builder.retention;
        this.minErrorTarget = builder.minErrorTarget;
        this.parallelism = builder.parallelism;
        this.maxRetries = builder.maxRetries;
        this.indexTimeout = builder.indexTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fail-fast aggregation, sequential dispatch without retries.
     */
    public static SpectralConfiguration defaultConfig() {
        return builder().build();
    }

    /**
     * Best-effort aggregation with two retries per index.
     */
    public static SpectralConfiguration bestEffortConfig() {
        return builder().withFailurePolicy(FailurePolicy.BEST_EFFORT).withMaxRetries(2).build();
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * @return fraction of a band response integral retained by trimming
     */
    public double getRetention() {
        return retention;
    }

    /**
     * @return error target of minimum-error quadrature policies that do not name one
     */
    public double getMinErrorTarget() {
        return minErrorTarget;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * @return time a pooled kernel evaluation may run, retries included, counted from the moment a worker starts it
     */
    public Duration getIndexTimeout() {
        return indexTimeout;
    }

    @Override
    public String toString() {
        return String.format("SpectralConfiguration[failure=%s, retention=%s, minErrorTarget=%s, parallelism=%d, "
                             + "retries=%d, timeout=%s]", failurePolicy, retention, minErrorTarget, parallelism,
                             maxRetries, indexTimeout);
    }

    public static class Builder {
        private FailurePolicy failurePolicy  = FailurePolicy.FAIL_FAST;
        private double        retention      = BandResponse.DEFAULT_RETENTION;
        private double        minErrorTarget = QuadraturePolicy.DEFAULT_MIN_ERROR_TARGET;
        private int           parallelism    = 1;
        private int           maxRetries     = 0;
        private Duration      indexTimeout   = Duration.ofMinutes(10);

        private Builder() {
        }

        public Builder withFailurePolicy(FailurePolicy failurePolicy) {
            if (failurePolicy == null) {
                throw new IllegalArgumentException("Failure policy cannot be null");
            }
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder withRetention(double retention) {
            if (!(retention > 0.0 && retention <= 1.0)) {
                throw new IllegalArgumentException("Retention must be in (0, 1], got " + retention);
            }
            this.retention = retention;
            return this;
        }

        public Builder withMinErrorTarget(double target) {
            if (!(target > 0.0) || !Double.isFinite(target)) {
                throw new IllegalArgumentException("Error target must be positive and finite, got " + target);
            }
            this.minErrorTarget = target;
            return this;
        }

        public Builder withParallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder withMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Retries must not be negative, got " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder withIndexTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Index timeout must be positive, got " + timeout);
            }
            this.indexTimeout = timeout;
            return this;
        }

        public SpectralConfiguration build() {
            return new SpectralConfiguration(this);
        }
    }
}
