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
package com.hellblazer.radiance.spectral.response;

import com.hellblazer.radiance.common.DeterministicMath;
import com.hellblazer.radiance.common.Trapezoid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trims the low-contribution tails of a band response.
 * <p>
 * Tail segments are cropped one at a time, always the end segment with the smaller trapezoid area and the left one on
 * ties, for as long as the retained integral stays at or above {@code retention} times the raw integral. The result is
 * then padded with one zero sample immediately outside each boundary whose value is non-zero: the original neighbouring
 * wavelength when the table has one, otherwise a wavelength mirrored by the boundary step.
 *
 * @author hal.hildebrand
 */
public final class BandTrimmer {
    private static final Logger log = LoggerFactory.getLogger(BandTrimmer.class);

    private BandTrimmer() {
    }

    /**
     * @param retention fraction of the raw integral to retain, in (0, 1]
     */
    public static Result trim(BandResponse band, double retention) {
        if (!(retention > 0.0 && retention <= 1.0)) {
            throw new IllegalArgumentException("Retention must be in (0, 1], got " + retention);
        }
        var wavelengths = band.wavelengths();
        var values = band.values();
        var areas = Trapezoid.segmentAreas(wavelengths, values);
        double raw = DeterministicMath.stableSum(areas);
        if (raw == 0.0) {
            log.debug("Band {} has a zero integral, nothing to trim", band);
            return new Result(band, 1.0, 0, 0);
        }

        double floor = retention * raw;
        int left = 0;
        int right = areas.length - 1;
        double cropped = 0.0;
        while (left < right) {
            boolean cropLeft = areas[left] <= areas[right];
            double candidate = cropLeft ? areas[left] : areas[right];
            if (raw - (cropped + candidate) < floor) {
                break;
            }
            cropped += candidate;
            if (cropLeft) {
                left++;
            } else {
                right--;
            }
        }

        int first = left;
        int last = right + 1;
        boolean padLeft = values[first] > 0.0;
        boolean padRight = values[last] > 0.0;
        int n = last - first + 1 + (padLeft ? 1 : 0) + (padRight ? 1 : 0);
        var trimmedWavelengths = new double[n];
        var trimmedValues = new double[n];
        int offset = 0;
        if (padLeft) {
            trimmedWavelengths[0] = first > 0 ? wavelengths[first - 1] : 2.0 * wavelengths[0] - wavelengths[1];
            offset = 1;
        }
        System.arraycopy(wavelengths, first, trimmedWavelengths, offset, last - first + 1);
        System.arraycopy(values, first, trimmedValues, offset, last - first + 1);
        if (padRight) {
            int end = wavelengths.length - 1;
            trimmedWavelengths[n - 1] = last < end ? wavelengths[last + 1] : 2.0 * wavelengths[end] - wavelengths[
            end - 1];
        }

        double retained = DeterministicMath.stableSum(areas, left, right + 1) / raw;
        int croppedLeft = left;
        int croppedRight = areas.length - 1 - right;
        log.debug("Trimmed band: cropped {} left and {} right segments, retained {} of the integral, padded {}",
                  croppedLeft, croppedRight, retained,
                  padLeft && padRight ? "both sides" : padLeft ? "left" : padRight ? "right" : "nothing");
        if (croppedLeft == 0 && croppedRight == 0 && !padLeft && !padRight) {
            return new Result(band, retained, 0, 0);
        }
        return new Result(new BandResponse(trimmedWavelengths, trimmedValues), retained, croppedLeft, croppedRight);
    }

    /**
     * Outcome of a trim.
     *
     * @param response         trimmed (and re-padded) band
     * @param retainedFraction fraction of the raw integral kept by the cropped table, before padding
     * @param croppedLeft      number of segments removed from the low-wavelength tail
     * @param croppedRight     number of segments removed from the high-wavelength tail
     */
    public record Result(BandResponse response, double retainedFraction, int croppedLeft, int croppedRight) {

        public boolean isTrimmed() {
            return croppedLeft > 0 || croppedRight > 0;
        }

        @Override
        public String toString() {
            return "Result{" + response + ", retained=" + retainedFraction + ", cropped=" + croppedLeft + "/"
            + croppedRight + "}";
        }
    }
}
