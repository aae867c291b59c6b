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
package com.hellblazer.radiance.common;

/**
 * Trapezoid rule over tabulated data.
 *
 * @author hal.hildebrand
 */
public final class Trapezoid {

    private Trapezoid() {
    }

    /**
     * Area of each segment {@code [x[i], x[i+1]]}.
     *
     * @return array of length {@code x.length - 1}
     */
    public static double[] segmentAreas(double[] x, double[] y) {
        checkShape(x, y);
        var areas = new double[Math.max(0, x.length - 1)];
        for (int i = 0; i < areas.length; i++) {
            areas[i] = 0.5 * (x[i + 1] - x[i]) * (y[i] + y[i + 1]);
        }
        return areas;
    }

    public static double integrate(double[] x, double[] y) {
        return DeterministicMath.stableSum(segmentAreas(x, y));
    }

    private static void checkShape(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length, got " + x.length + " and " + y.length);
        }
    }
}
