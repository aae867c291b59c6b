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

import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

/**
 * Cached factory for quadrature rules on [-1, 1].
 * <p>
 * Gauss-Legendre rules come from Commons Math. Gauss-Lobatto rules are computed by Newton iteration on the Legendre
 * recurrence, starting from the Chebyshev-Gauss-Lobatto points.
 *
 * @author hal.hildebrand
 */
public final class QuadratureRules {
    private static final Logger log = LoggerFactory.getLogger(QuadratureRules.class);

    private static final int    MAX_NEWTON_ITERATIONS = 100;
    private static final double NEWTON_TOLERANCE      = 1e-15;

    private static final GaussIntegratorFactory             GAUSS = new GaussIntegratorFactory();
    private static final Map<RuleKey, QuadratureRule>        CACHE = new ConcurrentHashMap<>();

    private QuadratureRules() {
    }

    /**
     * Obtain the rule of the given type with {@code nodes} points.
     *
     * @throws IllegalArgumentException if {@code nodes} is below {@link QuadratureType#minimumNodes()}
     */
    public static QuadratureRule of(QuadratureType type, int nodes) {
        if (nodes < type.minimumNodes()) {
            throw new IllegalArgumentException(
            type.id() + " requires at least " + type.minimumNodes() + " nodes, got " + nodes);
        }
        return CACHE.computeIfAbsent(new RuleKey(type, nodes), QuadratureRules::compute);
    }

    public static QuadratureRule gaussLegendre(int nodes) {
        return of(QuadratureType.GAUSS_LEGENDRE, nodes);
    }

    public static QuadratureRule gaussLobatto(int nodes) {
        return of(QuadratureType.GAUSS_LOBATTO, nodes);
    }

    private static QuadratureRule compute(RuleKey key) {
        log.debug("Computing {} rule with {} nodes", key.type.id(), key.nodes);
        return switch (key.type) {
            case GAUSS_LEGENDRE -> legendre(key.nodes);
            case GAUSS_LOBATTO -> lobatto(key.nodes);
        };
    }

    private static QuadratureRule legendre(int n) {
        var integrator = GAUSS.legendre(n);
        var order = IntStream.range(0, integrator.getNumberOfPoints())
                             .boxed()
                             .sorted(Comparator.comparingDouble(integrator::getPoint))
                             .mapToInt(Integer::intValue)
                             .toArray();
        var nodes = new double[order.length];
        var weights = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            nodes[i] = integrator.getPoint(order[i]);
            weights[i] = integrator.getWeight(order[i]);
        }
        return new QuadratureRule(QuadratureType.GAUSS_LEGENDRE, nodes, weights);
    }

    private static QuadratureRule lobatto(int n) {
        int degree = n - 1;
        var nodes = new double[n];
        var weights = new double[n];
        for (int i = 0; i < n; i++) {
            // initial guesses run from +1 down to -1; store ascending
            double x = Math.cos(Math.PI * i / degree);
            double pn = 0.0;
            for (int iteration = 0; iteration < MAX_NEWTON_ITERATIONS; iteration++) {
                var p = legendrePair(x, degree);
                pn = p[1];
                double dx = (x * p[1] - p[0]) / (n * p[1]);
                x -= dx;
                if (Math.abs(dx) < NEWTON_TOLERANCE) {
                    pn = legendrePair(x, degree)[1];
                    break;
                }
            }
            nodes[n - 1 - i] = x;
            weights[n - 1 - i] = 2.0 / (degree * n * pn * pn);
        }
        // pin the end points, which the iteration leaves exactly fixed anyway
        nodes[0] = -1.0;
        nodes[n - 1] = 1.0;
        if (log.isTraceEnabled()) {
            log.trace("Lobatto {} nodes: {}", n, Arrays.toString(nodes));
        }
        return new QuadratureRule(QuadratureType.GAUSS_LOBATTO, nodes, weights);
    }

    /**
     * @return {P_{degree-1}(x), P_degree(x)}
     */
    private static double[] legendrePair(double x, int degree) {
        double previous = 1.0;
        double current = x;
        for (int k = 2; k <= degree; k++) {
            double next = ((2 * k - 1) * x * current - (k - 1) * previous) / k;
            previous = current;
            current = next;
        }
        return new double[] { previous, current };
    }

    private record RuleKey(QuadratureType type, int nodes) {
    }
}
