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
package com.hellblazer.radiance.common.quadrature;

import com.hellblazer.radiance.common.DeterministicMath;

import java.util.Arrays;

/**
 * Quadrature rule with nodes and weights on the reference interval [-1, 1], nodes in ascending order.
 * <p>
 * The reference interval can be changed with {@link #nodesOn(double, double)} and {@link #weightsOn(double, double)}.
 *
 * @author hal.hildebrand
 */
public final class QuadratureRule {
    private final QuadratureType type;
    private final double[]       nodes;
    private final double[]       weights;

    public QuadratureRule(QuadratureType type, double[] nodes, double[] weights) {
        if (nodes.length != weights.length) {
            throw new IllegalArgumentException(
            "nodes and weights must have the same length, got " + nodes.length + " and " + weights.length);
        }
        if (nodes.length == 0) {
            throw new IllegalArgumentException("A quadrature rule needs at least one node");
        }
        for (int i = 1; i < nodes.length; i++) {
            if (!(nodes[i] > nodes[i - 1])) {
                throw new IllegalArgumentException("Quadrature nodes must be strictly increasing");
            }
        }
        this.type = type;
        this.nodes = nodes.clone();
        this.weights = weights.clone();
    }

    public QuadratureType type() {
        return type;
    }

    public int size() {
        return nodes.length;
    }

    public double[] nodes() {
        return nodes.clone();
    }

    public double[] weights() {
        return weights.clone();
    }

    /**
     * Nodes mapped affinely from [-1, 1] to {@code [a, b]}.
     */
    public double[] nodesOn(double a, double b) {
        var scaled = new double[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            scaled[i] = 0.5 * (a + b + (b - a) * nodes[i]);
        }
        return scaled;
    }

    /**
     * Weights scaled by the Jacobian of the map to {@code [a, b]}.
     */
    public double[] weightsOn(double a, double b) {
        var scaled = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            scaled[i] = 0.5 * (b - a) * weights[i];
        }
        return scaled;
    }

    /**
     * Evaluate the rule on {@code [a, b]} given function values at {@link #nodesOn(double, double)}.
     */
    public double integrate(double[] values, double a, double b) {
        return DeterministicMath.stableDot(weightsOn(a, b), values);
    }

    public String prettyRepr() {
        return type.id() + ", " + nodes.length + " points";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuadratureRule that)) return false;
        return type == that.type && Arrays.equals(nodes, that.nodes) && Arrays.equals(weights, that.weights);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * type.hashCode() + Arrays.hashCode(nodes)) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "QuadratureRule{" + prettyRepr() + "}";
    }
}
