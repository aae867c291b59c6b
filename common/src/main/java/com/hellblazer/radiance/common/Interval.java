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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Closed interval {@code [lower, upper]} on the real line. A degenerate interval ({@code lower == upper}) represents a
 * single point.
 *
 * @param lower lower bound (inclusive)
 * @param upper upper bound (inclusive)
 * @author hal.hildebrand
 */
public record Interval(double lower, double upper) implements Comparable<Interval> {

    public Interval {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("Interval bounds must not be NaN");
        }
        if (lower > upper) {
            throw new IllegalArgumentException("Interval lower bound " + lower + " exceeds upper bound " + upper);
        }
    }

    public static Interval of(double lower, double upper) {
        return new Interval(lower, upper);
    }

    public static Interval point(double x) {
        return new Interval(x, x);
    }

    /**
     * Merge overlapping or touching intervals into a sorted list of disjoint intervals.
     *
     * @param intervals intervals in any order
     * @return sorted, non-overlapping union
     */
    public static List<Interval> union(Collection<Interval> intervals) {
        var sorted = new ArrayList<>(intervals);
        sorted.sort(null);
        var merged = new ArrayList<Interval>();
        for (var next : sorted) {
            if (!merged.isEmpty()) {
                var last = merged.get(merged.size() - 1);
                if (next.lower <= last.upper) {
                    merged.set(merged.size() - 1, new Interval(last.lower, Math.max(last.upper, next.upper)));
                    continue;
                }
            }
            merged.add(next);
        }
        return List.copyOf(merged);
    }

    public boolean isDegenerate() {
        return lower == upper;
    }

    public double length() {
        return upper - lower;
    }

    public double center() {
        return 0.5 * (lower + upper);
    }

    public boolean contains(double x) {
        return x >= lower && x <= upper;
    }

    /**
     * Answer true if this closed interval overlaps the half-open interval {@code [from, to)}.
     * <p>
     * A proper interval overlaps when {@code from < upper && to > lower}, so that merely touching end points do not
     * count. A point overlaps when {@code from <= point < to}.
     */
    public boolean overlapsHalfOpen(double from, double to) {
        if (isDegenerate()) {
            return from <= lower && lower < to;
        }
        return from < upper && to > lower;
    }

    @Override
    public int compareTo(Interval o) {
        int c = Double.compare(lower, o.lower);
        return c != 0 ? c : Double.compare(upper, o.upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
