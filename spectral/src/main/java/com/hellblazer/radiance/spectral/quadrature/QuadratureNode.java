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
 * One node of a resolved quadrature.
 *
 * @param index  0-based position of the node in its bin, stable across calls
 * @param g      cumulative probability coordinate in [0, 1]
 * @param weight node weight; the weights of a bin sum to 1
 * @author hal.hildebrand
 */
public record QuadratureNode(int index, double g, double weight) {
}
