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

/**
 * Raised, not thrown, when no available node count meets an error target. Attached to plans and estimates and logged
 * at WARN.
 *
 * @param binId         bin the quadrature was resolved for
 * @param target        requested error
 * @param achievedError error of the selected node count
 * @param nodes         selected node count
 * @author hal.hildebrand
 */
public record QuadratureSaturationWarning(String binId, double target, double achievedError, int nodes) {

    public String message() {
        return String.format("Bin '%s': no available node count reaches error target %.3e; using %d nodes with error %.3e",
                             binId, target, nodes, achievedError);
    }
}
