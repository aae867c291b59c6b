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

import java.util.Locale;

/**
 * Named quadrature rule families.
 *
 * @author hal.hildebrand
 */
public enum QuadratureType {
    GAUSS_LEGENDRE("gauss_legendre", 1),
    GAUSS_LOBATTO("gauss_lobatto", 2);

    private final String id;
    private final int    minimumNodes;

    QuadratureType(String id, int minimumNodes) {
        this.id = id;
        this.minimumNodes = minimumNodes;
    }

    /**
     * Resolve a type from its identifier ({@code "gauss_legendre"}, {@code "gauss_lobatto"}), case-insensitive.
     */
    public static QuadratureType fromId(String id) {
        var normalized = id.trim().toLowerCase(Locale.ROOT);
        for (var type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown quadrature type '" + id + "'");
    }

    public String id() {
        return id;
    }

    /**
     * Smallest node count for which the rule is defined (Lobatto rules always include both end points).
     */
    public int minimumNodes() {
        return minimumNodes;
    }

    public QuadratureRule rule(int nodes) {
        return QuadratureRules.of(this, nodes);
    }
}
