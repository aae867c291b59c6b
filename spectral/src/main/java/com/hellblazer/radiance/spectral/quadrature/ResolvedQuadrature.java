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
import com.hellblazer.radiance.common.quadrature.QuadratureType;

import java.util.List;
import java.util.Optional;

/**
 * Quadrature selected for one bin.
 *
 * @param binId         bin identifier
 * @param type          rule family
 * @param nodes         nodes in ascending g, weights summing to 1
 * @param achievedError error of the selected node count, NaN when no error curve was consulted
 * @param warning       saturation warning, or null when the target was met or no target applied
 * @author hal.hildebrand
 */
public record ResolvedQuadrature(String binId, QuadratureType type, List<QuadratureNode> nodes, double achievedError,
                                 QuadratureSaturationWarning warning) {

    public ResolvedQuadrature {
        nodes = List.copyOf(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public double[] g() {
        return nodes.stream().mapToDouble(QuadratureNode::g).toArray();
    }

    public double[] weights() {
        return nodes.stream().mapToDouble(QuadratureNode::weight).toArray();
    }

    public double weightSum() {
        return DeterministicMath.stableSum(weights());
    }

    public Optional<QuadratureSaturationWarning> saturation() {
        return Optional.ofNullable(warning);
    }
}
