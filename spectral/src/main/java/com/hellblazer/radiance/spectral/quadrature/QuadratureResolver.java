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

import com.hellblazer.radiance.common.DeterministicMath;
import com.hellblazer.radiance.common.quadrature.QuadratureRules;
import com.hellblazer.radiance.common.quadrature.QuadratureType;
import com.hellblazer.radiance.spectral.grid.Bin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Selects the quadrature of a correlated-k bin from a {@link QuadraturePolicy} and the bin's {@link QuadratureTable}.
 * <p>
 * Error-driven policies search the available node counts in ascending order and accept the first count whose error
 * does not exceed the target. When none does, the quadrature saturates: {@link QuadraturePolicy.ErrorThreshold} takes
 * the largest candidate, {@link QuadraturePolicy.MinError} the candidate with the smallest error, and a
 * {@link QuadratureSaturationWarning} is attached. Error-driven policies on a bin without error data fall back to a
 * fixed rule.
 * <p>
 * Rule abscissas are mapped from [-1, 1] to g in [0, 1] and the weights renormalized to sum to 1.
 *
 * @author hal.hildebrand
 */
public class QuadratureResolver {
    private static final Logger log = LoggerFactory.getLogger(QuadratureResolver.class);

    public ResolvedQuadrature resolve(Bin bin, QuadraturePolicy policy, AbsorberState state) {
        return resolve(bin.id(), bin.quadratureTable().orElse(null), policy, state);
    }

    /**
     * @param table quadrature table of the bin, or null when the medium supplies none
     */
    public ResolvedQuadrature resolve(String binId, QuadratureTable table, QuadraturePolicy policy,
                                      AbsorberState state) {
        if (policy instanceof QuadraturePolicy.Fixed fixed) {
            return resolveFixed(binId, table, fixed);
        }
        if (table == null || table.errorCurve().isEmpty()) {
            var type = table == null ? QuadratureType.GAUSS_LEGENDRE : table.type();
            int nodes = Math.max(type.minimumNodes(), policy.maximum() > 0 ? policy.maximum() : 1);
            if (table != null) {
                nodes = table.roundUpToAvailable(nodes);
            }
            log.warn("Bin '{}' has no transmittance error data, falling back to a fixed {} rule with {} nodes", binId,
                     type.id(), nodes);
            return build(binId, type, nodes, Double.NaN, null);
        }
        double target = policy instanceof QuadraturePolicy.MinError minError ? minError.target()
                                                                             : ((QuadraturePolicy.ErrorThreshold) policy).threshold();
        return search(binId, table, policy, target, state);
    }

    private ResolvedQuadrature resolveFixed(String binId, QuadratureTable table, QuadraturePolicy.Fixed fixed) {
        if (table == null) {
            return build(binId, fixed.type(), Math.max(fixed.nodes(), fixed.type().minimumNodes()), Double.NaN, null);
        }
        int requested = Math.max(fixed.nodes(), table.type().minimumNodes());
        int nodes = table.roundUpToAvailable(requested);
        if (nodes != fixed.nodes()) {
            log.debug("Bin '{}': fixed node count {} adjusted to available count {}", binId, fixed.nodes(), nodes);
        }
        return build(binId, table.type(), nodes, Double.NaN, null);
    }

    private ResolvedQuadrature search(String binId, QuadratureTable table, QuadraturePolicy policy, double target,
                                      AbsorberState state) {
        var curve = table.errorCurve().orElseThrow();
        int cap = policy.maximum() > 0 ? Math.min(policy.maximum(), table.maxNodes()) : table.maxNodes();
        var candidates = Arrays.stream(table.availableNodeCounts()).filter(n -> n <= cap).toArray();
        if (candidates.length == 0) {
            log.debug("Bin '{}': policy maximum {} below smallest available node count {}", binId, policy.maximum(),
                      table.minNodes());
            candidates = new int[] { table.minNodes() };
        }

        var errors = new double[candidates.length];
        for (int i = 0; i < candidates.length; i++) {
            errors[i] = curve.error(candidates[i], state);
            if (errors[i] <= target) {
                log.debug("Bin '{}': {} nodes reach error {} (target {})", binId, candidates[i], errors[i], target);
                return build(binId, table.type(), candidates[i], errors[i], null);
            }
        }

        int selected;
        if (policy instanceof QuadraturePolicy.MinError) {
            selected = 0;
            for (int i = 1; i < errors.length; i++) {
                if (errors[i] < errors[selected]) {
                    selected = i;
                }
            }
        } else {
            selected = candidates.length - 1;
        }
        var warning = new QuadratureSaturationWarning(binId, target, errors[selected], candidates[selected]);
        log.warn(warning.message());
        return build(binId, table.type(), candidates[selected], errors[selected], warning);
    }

    private ResolvedQuadrature build(String binId, QuadratureType type, int n, double achievedError,
                                     QuadratureSaturationWarning warning) {
        var rule = QuadratureRules.of(type, n);
        var g = rule.nodesOn(0.0, 1.0);
        var weights = rule.weightsOn(0.0, 1.0);
        double total = DeterministicMath.stableSum(weights);
        var nodes = new ArrayList<QuadratureNode>(n);
        for (int i = 0; i < n; i++) {
            nodes.add(new QuadratureNode(i, g[i], weights[i] / total));
        }
        return new ResolvedQuadrature(binId, type, nodes, achievedError, warning);
    }
}
