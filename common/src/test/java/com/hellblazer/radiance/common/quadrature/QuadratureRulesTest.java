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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Gauss-Legendre and Gauss-Lobatto rule generation.
 *
 * @author hal.hildebrand
 */
class QuadratureRulesTest {

    private static final double EPSILON = 1e-12;

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 8, 16 })
    void testLegendreWeightsSumToTwo(int n) {
        var rule = QuadratureRules.gaussLegendre(n);
        assertEquals(n, rule.size());
        assertEquals(2.0, Arrays.stream(rule.weights()).sum(), EPSILON);
    }

    @ParameterizedTest
    @ValueSource(ints = { 2, 3, 4, 5, 8, 16 })
    void testLobattoWeightsSumToTwoAndIncludesEndPoints(int n) {
        var rule = QuadratureRules.gaussLobatto(n);
        var nodes = rule.nodes();
        assertEquals(n, rule.size());
        assertEquals(-1.0, nodes[0]);
        assertEquals(1.0, nodes[n - 1]);
        assertEquals(2.0, Arrays.stream(rule.weights()).sum(), EPSILON);
    }

    @Test
    void testKnownLegendreTwoPoint() {
        var rule = QuadratureRules.gaussLegendre(2);
        double a = 1.0 / Math.sqrt(3.0);
        assertArrayEquals(new double[] { -a, a }, rule.nodes(), EPSILON);
        assertArrayEquals(new double[] { 1.0, 1.0 }, rule.weights(), EPSILON);
    }

    @Test
    void testKnownLobattoThreePoint() {
        var rule = QuadratureRules.gaussLobatto(3);
        assertArrayEquals(new double[] { -1.0, 0.0, 1.0 }, rule.nodes(), EPSILON);
        assertArrayEquals(new double[] { 1.0 / 3.0, 4.0 / 3.0, 1.0 / 3.0 }, rule.weights(), EPSILON);
    }

    @Test
    void testKnownLobattoFourPoint() {
        var rule = QuadratureRules.gaussLobatto(4);
        double a = Math.sqrt(1.0 / 5.0);
        assertArrayEquals(new double[] { -1.0, -a, a, 1.0 }, rule.nodes(), EPSILON);
        assertArrayEquals(new double[] { 1.0 / 6.0, 5.0 / 6.0, 5.0 / 6.0, 1.0 / 6.0 }, rule.weights(), EPSILON);
    }

    @ParameterizedTest
    @EnumSource(QuadratureType.class)
    @DisplayName("Nodes are strictly ascending")
    void testNodesAscending(QuadratureType type) {
        var nodes = type.rule(12).nodes();
        for (int i = 1; i < nodes.length; i++) {
            assertTrue(nodes[i] > nodes[i - 1]);
        }
    }

    @Test
    @DisplayName("An n-point Legendre rule integrates polynomials of degree 2n-1 exactly")
    void testLegendreExactness() {
        var rule = QuadratureRules.gaussLegendre(4);
        var nodes = rule.nodesOn(0.0, 2.0);
        var values = Arrays.stream(nodes).map(x -> Math.pow(x, 7)).toArray();
        assertEquals(256.0 / 8.0, rule.integrate(values, 0.0, 2.0), 1e-10);
    }

    @Test
    void testLobattoExactness() {
        var rule = QuadratureRules.gaussLobatto(5);
        var nodes = rule.nodesOn(-1.0, 1.0);
        var values = Arrays.stream(nodes).map(x -> Math.pow(x, 6)).toArray();
        assertEquals(2.0 / 7.0, rule.integrate(values, -1.0, 1.0), 1e-12);
    }

    @Test
    void testMappedRuleOnUnitInterval() {
        var rule = QuadratureRules.gaussLegendre(3);
        var g = rule.nodesOn(0.0, 1.0);
        var w = rule.weightsOn(0.0, 1.0);
        assertEquals(1.0, Arrays.stream(w).sum(), EPSILON);
        for (double node : g) {
            assertTrue(node > 0.0 && node < 1.0);
        }
    }

    @Test
    void testCachedInstances() {
        assertSame(QuadratureRules.gaussLegendre(7), QuadratureRules.gaussLegendre(7));
        assertEquals(QuadratureRules.gaussLobatto(6), QuadratureType.GAUSS_LOBATTO.rule(6));
    }

    @Test
    void testMinimumNodes() {
        assertThrows(IllegalArgumentException.class, () -> QuadratureRules.gaussLegendre(0));
        assertThrows(IllegalArgumentException.class, () -> QuadratureRules.gaussLobatto(1));
    }

    @Test
    void testTypeFromId() {
        assertEquals(QuadratureType.GAUSS_LEGENDRE, QuadratureType.fromId("gauss_legendre"));
        assertEquals(QuadratureType.GAUSS_LOBATTO, QuadratureType.fromId(" Gauss_Lobatto "));
        assertThrows(IllegalArgumentException.class, () -> QuadratureType.fromId("trapezoid"));
    }
}
