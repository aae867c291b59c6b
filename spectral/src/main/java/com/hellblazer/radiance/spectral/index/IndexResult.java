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

import java.util.Arrays;

/**
 * Kernel outcome for one spectral index.
 *
 * @author hal.hildebrand
 */
public sealed interface IndexResult permits IndexResult.Value, IndexResult.Failed {

    static Value value(double... values) {
        return new Value(values);
    }

    static Failed failed(Throwable cause) {
        return new Failed(cause);
    }

    /**
     * Successful evaluation: a scalar or a small vector of radiometric quantities.
     */
    final class Value implements IndexResult {
        private final double[] values;

        public Value(double[] values) {
            if (values.length == 0) {
                throw new IllegalArgumentException("A result needs at least one component");
            }
            for (double v : values) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Result components must be finite: " + Arrays.toString(values));
                }
            }
            this.values = values.clone();
        }

        public double[] values() {
            return values.clone();
        }

        public int dimension() {
            return values.length;
        }

        double[] unsafeValues() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            return o instanceof Value that && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "Value" + Arrays.toString(values);
        }
    }

    /**
     * Failed evaluation.
     *
     * @param cause what went wrong
     */
    record Failed(Throwable cause) implements IndexResult {
        public Failed {
            if (cause == null) {
                throw new IllegalArgumentException("A failure needs a cause");
            }
        }
    }
}
