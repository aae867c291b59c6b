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

import com.hellblazer.radiance.common.Interval;
import com.hellblazer.radiance.common.Trapezoid;
import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tabulated band response with piecewise-linear interpolation between samples.
 * <p>
 * The support is the union of the table segments where at least one end point is non-zero, so a run of leading or
 * trailing zeros contributes only the zero adjacent to the non-zero data.
 *
 * @author hal.hildebrand
 */
public final class BandResponse implements SpectralResponseFunction {
    /**
     * Fraction of the raw integral retained when trimming without an explicit retention.
     */
    public static final double DEFAULT_RETENTION = 0.999;

    private final double[]                 wavelengths;
    private final double[]                 values;
    private final PolynomialSplineFunction interpolant;
    private final List<Interval>           support;

    /**
     * @param wavelengths strictly increasing wavelengths (nm), at least two
     * @param values      non-negative finite response values, one per wavelength
     */
    public BandResponse(double[] wavelengths, double[] values) {
        if (wavelengths.length != values.length) {
            throw new IllegalArgumentException(
            "Band wavelengths and values must have the same length, got " + wavelengths.length + " and "
            + values.length);
        }
        if (wavelengths.length < 2) {
            throw new IllegalArgumentException("A band response needs at least two samples");
        }
        for (int i = 0; i < wavelengths.length; i++) {
            if (!Double.isFinite(wavelengths[i])) {
                throw new IllegalArgumentException("Band wavelengths must be finite");
            }
            if (i > 0 && !(wavelengths[i] > wavelengths[i - 1])) {
                throw new IllegalArgumentException(
                "Band wavelengths must be strictly increasing: " + wavelengths[i - 1] + " >= " + wavelengths[i]);
            }
            if (!(values[i] >= 0.0) || !Double.isFinite(values[i])) {
                throw new IllegalArgumentException(
                "Band values must be non-negative and finite, got " + values[i] + " at " + wavelengths[i] + " nm");
            }
        }
        this.wavelengths = wavelengths.clone();
        this.values = values.clone();
        this.interpolant = new LinearInterpolator().interpolate(this.wavelengths, this.values);
        this.support = computeSupport(this.wavelengths, this.values);
    }

    /**
     * Gaussian band normalized to a unit maximum, sampled on the multiples of {@code resolution} that lie within
     * {@code cutoff} standard deviations of the centre.
     *
     * @param center     central wavelength (nm)
     * @param fwhm       full width at half maximum (nm)
     * @param cutoff     half-width of the sampled range, in standard deviations
     * @param resolution mesh step (nm)
     * @param pad        if true, add one zero sample on each side of the sampled range
     */
    public static BandResponse gaussian(double center, double fwhm, double cutoff, double resolution, boolean pad) {
        if (!(fwhm > 0.0) || !(cutoff > 0.0) || !(resolution > 0.0)) {
            throw new IllegalArgumentException(
            "Gaussian FWHM, cut-off and resolution must be positive, got " + fwhm + ", " + cutoff + ", "
            + resolution);
        }
        double sigma = 0.5 * fwhm / Math.sqrt(2.0 * Math.log(2.0));
        long first = (long) Math.ceil((center - cutoff * sigma) / resolution);
        long last = (long) Math.floor((center + cutoff * sigma) / resolution);
        if (last - first < 1) {
            throw new IllegalArgumentException(
            "Gaussian mesh resolution " + resolution + " nm is too coarse for FWHM " + fwhm + " nm");
        }
        if (pad) {
            first--;
            last++;
        }
        int n = (int) (last - first + 1);
        var wavelengths = new double[n];
        var values = new double[n];
        double max = 0.0;
        for (int i = 0; i < n; i++) {
            wavelengths[i] = (first + i) * resolution;
            double z = (wavelengths[i] - center) / sigma;
            values[i] = Math.exp(-0.5 * z * z);
            max = Math.max(max, values[i]);
        }
        for (int i = 0; i < n; i++) {
            values[i] /= max;
        }
        if (pad) {
            values[0] = 0.0;
            values[n - 1] = 0.0;
        }
        return new BandResponse(wavelengths, values);
    }

    public static BandResponse gaussian(double center, double fwhm) {
        return gaussian(center, fwhm, 3.0, 1.0, true);
    }

    private static List<Interval> computeSupport(double[] wavelengths, double[] values) {
        var segments = new ArrayList<Interval>();
        for (int i = 0; i < wavelengths.length - 1; i++) {
            if (values[i] > 0.0 || values[i + 1] > 0.0) {
                segments.add(Interval.of(wavelengths[i], wavelengths[i + 1]));
            }
        }
        return Interval.union(segments);
    }

    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public double[] values() {
        return values.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    @Override
    public List<Interval> support() {
        return support;
    }

    @Override
    public double evaluate(double wavelength) {
        if (!supports(wavelength)) {
            throw new DomainException("Wavelength " + wavelength + " nm outside band response support " + support);
        }
        return interpolant.value(wavelength);
    }

    /**
     * Response at the bin centre when it is non-zero there, otherwise the mean response over the bin.
     */
    @Override
    public double binWeight(double lower, double upper) {
        double center = 0.5 * (lower + upper);
        if (supports(center)) {
            double value = interpolant.value(center);
            if (value > 0.0) {
                return value;
            }
        }
        return meanOver(lower, upper);
    }

    /**
     * Trapezoid integral of the whole table.
     */
    public double integral() {
        return Trapezoid.integrate(wavelengths, values);
    }

    /**
     * Exact integral of the piecewise-linear response over {@code [lower, upper]}, the response being zero outside the
     * tabulated range.
     */
    public double integrate(double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("Integration bounds reversed: " + lower + " > " + upper);
        }
        double a = Math.max(lower, wavelengths[0]);
        double b = Math.min(upper, wavelengths[wavelengths.length - 1]);
        if (!(b > a)) {
            return 0.0;
        }
        int from = Arrays.binarySearch(wavelengths, a);
        from = from >= 0 ? from + 1 : -from - 1;
        int to = Arrays.binarySearch(wavelengths, b);
        to = to >= 0 ? to : -to - 1;
        int interior = Math.max(0, to - from);
        var x = new double[interior + 2];
        var y = new double[interior + 2];
        x[0] = a;
        y[0] = interpolant.value(a);
        for (int i = 0; i < interior; i++) {
            x[i + 1] = wavelengths[from + i];
            y[i + 1] = values[from + i];
        }
        x[interior + 1] = b;
        y[interior + 1] = interpolant.value(b);
        return Trapezoid.integrate(x, y);
    }

    /**
     * Mean response over {@code [lower, upper]}, with {@code upper > lower}.
     */
    public double meanOver(double lower, double upper) {
        if (!(upper > lower)) {
            throw new IllegalArgumentException("Empty averaging interval [" + lower + ", " + upper + "]");
        }
        return integrate(lower, upper) / (upper - lower);
    }

    /**
     * Trim the band keeping at least {@code retention} of its integral.
     *
     * @see BandTrimmer
     */
    public BandResponse trim(double retention) {
        return BandTrimmer.trim(this, retention).response();
    }

    public BandResponse trim() {
        return trim(DEFAULT_RETENTION);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof BandResponse that && Arrays.equals(wavelengths, that.wavelengths) && Arrays.equals(
        values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(wavelengths) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "BandResponse{" + wavelengths.length + " samples, [" + wavelengths[0] + ", "
        + wavelengths[wavelengths.length - 1] + "] nm}";
    }
}
