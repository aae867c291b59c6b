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
package com.hellblazer.radiance.spectral.index;

import com.hellblazer.radiance.common.DeterministicMath;
import com.hellblazer.radiance.spectral.SpectralEngineException.DomainException;
import com.hellblazer.radiance.spectral.SpectralEngineException.IndexEvaluationException;
import com.hellblazer.radiance.spectral.quadrature.QuadratureSaturationWarning;
import com.hellblazer.radiance.spectral.response.SpectralResponseFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-index kernel results into one spectral estimate.
 * <p>
 * Monochromatic indices combine as {@code sum(w * r) / sum(w)} with {@code w} the response at each wavelength.
 * Correlated-k indices are first reduced per bin with their node weights, then combined across bins with the response
 * weight of each bin ({@link SpectralResponseFunction#binWeight(double, double)}).
 * <p>
 * Indices are sorted into canonical order and every sum is a {@link DeterministicMath} reduction, so any permutation of
 * the input yields a bit-identical estimate.
 *
 * @author hal.hildebrand
 */
public class SpectralAggregator {
    private static final Logger log = LoggerFactory.getLogger(SpectralAggregator.class);

    private final FailurePolicy failurePolicy;

    public SpectralAggregator(FailurePolicy failurePolicy) {
        if (failurePolicy == null) {
            throw new IllegalArgumentException("Failure policy cannot be null");
        }
        this.failurePolicy = failurePolicy;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public SpectralEstimate aggregate(SpectralPlan plan, Map<SpectralIndex, IndexResult> results,
                                      SpectralResponseFunction srf) {
        return aggregate(plan.indices(), results, srf, plan.warnings());
    }

    public SpectralEstimate aggregate(Collection<? extends SpectralIndex> indices,
                                      Map<SpectralIndex, IndexResult> results, SpectralResponseFunction srf) {
        return aggregate(indices, results, srf, List.of());
    }

    private SpectralEstimate aggregate(Collection<? extends SpectralIndex> indices,
                                       Map<SpectralIndex, IndexResult> results, SpectralResponseFunction srf,
                                       List<QuadratureSaturationWarning> warnings) {
        var ordered = canonical(indices);

        var survivors = new ArrayList<SpectralIndex>(ordered.size());
        var values = new ArrayList<double[]>(ordered.size());
        int dimension = -1;
        for (var index : ordered) {
            var result = results.get(index);
            if (result instanceof IndexResult.Value value) {
                if (dimension < 0) {
                    dimension = value.dimension();
                } else if (value.dimension() != dimension) {
                    throw new IllegalArgumentException(
                    "Result for " + index + " has " + value.dimension() + " components, expected " + dimension);
                }
                survivors.add(index);
                values.add(value.unsafeValues());
            } else if (failurePolicy == FailurePolicy.FAIL_FAST) {
                var cause = result instanceof IndexResult.Failed failed ? failed.cause() : null;
                throw new IndexEvaluationException(index, (result == null ? "Missing result" : "Evaluation failed")
                                                          + " for spectral index " + index, cause);
            }
        }
        int dropped = ordered.size() - survivors.size();
        if (survivors.isEmpty()) {
            throw new IndexEvaluationException("All " + ordered.size() + " spectral indices failed");
        }
        if (dropped > 0) {
            log.warn("Dropped {} of {} spectral indices, renormalizing over {} survivors", dropped, ordered.size(),
                     survivors.size());
        }

        var estimate = survivors.get(0) instanceof SpectralIndex.Monochromatic ? discrete(survivors, values, srf,
                                                                                          dimension, dropped, warnings)
                                                                               : binned(survivors, values, srf,
                                                                                        dimension, dropped, warnings);
        log.debug("Aggregated {} spectral indices into {}", survivors.size(), estimate);
        return estimate;
    }

    private List<SpectralIndex> canonical(Collection<? extends SpectralIndex> indices) {
        if (indices.isEmpty()) {
            throw new IllegalArgumentException("No spectral indices to aggregate");
        }
        var ordered = new ArrayList<SpectralIndex>(indices);
        ordered.sort(null);
        boolean monochromatic = ordered.get(0) instanceof SpectralIndex.Monochromatic;
        for (int i = 0; i < ordered.size(); i++) {
            var index = ordered.get(i);
            if ((index instanceof SpectralIndex.Monochromatic) != monochromatic) {
                throw new IllegalArgumentException("Monochromatic and correlated-k indices cannot be aggregated together");
            }
            if (i > 0 && index.compareTo(ordered.get(i - 1)) == 0) {
                throw new IllegalArgumentException("Duplicate spectral index " + index);
            }
        }
        return ordered;
    }

    private SpectralEstimate discrete(List<SpectralIndex> survivors, List<double[]> values,
                                      SpectralResponseFunction srf, int dimension, int dropped,
                                      List<QuadratureSaturationWarning> warnings) {
        var weights = new double[survivors.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = srf.evaluate(survivors.get(i).wavelength());
        }
        double total = checkedTotal(weights, srf);

        var samples = new ArrayList<SpectralSample>(survivors.size());
        var realized = new LinkedHashMap<SpectralIndex, Double>();
        for (int i = 0; i < weights.length; i++) {
            double w = survivors.get(i).wavelength();
            samples.add(new SpectralSample(w, w, w, weights[i], values.get(i)));
            realized.put(survivors.get(i), weights[i] / total);
        }
        var value = scale(DeterministicMath.stableWeightedSum(weights, values, dimension), total);
        return new SpectralEstimate(value, samples, realized, dropped, warnings);
    }

    private SpectralEstimate binned(List<SpectralIndex> survivors, List<double[]> values,
                                    SpectralResponseFunction srf, int dimension, int dropped,
                                    List<QuadratureSaturationWarning> warnings) {
        // canonical order keeps the nodes of a bin contiguous
        var groups = new ArrayList<List<Integer>>();
        String current = null;
        SpectralIndex.CorrelatedK first = null;
        for (int i = 0; i < survivors.size(); i++) {
            var node = (SpectralIndex.CorrelatedK) survivors.get(i);
            if (!node.binId().equals(current)) {
                current = node.binId();
                first = node;
                groups.add(new ArrayList<>());
            } else if (node.lower() != first.lower() || node.upper() != first.upper()) {
                throw new IllegalArgumentException("Inconsistent bounds for the nodes of bin '" + current + "'");
            }
            groups.get(groups.size() - 1).add(i);
        }

        var binWeights = new double[groups.size()];
        var binValues = new ArrayList<double[]>(groups.size());
        var nodeFractions = new double[survivors.size()];
        var samples = new ArrayList<SpectralSample>(groups.size());
        for (int b = 0; b < groups.size(); b++) {
            var group = groups.get(b);
            var bin = (SpectralIndex.CorrelatedK) survivors.get(group.get(0));
            var nodeWeights = new double[group.size()];
            var nodeValues = new ArrayList<double[]>(group.size());
            for (int j = 0; j < group.size(); j++) {
                nodeWeights[j] = ((SpectralIndex.CorrelatedK) survivors.get(group.get(j))).weight();
                nodeValues.add(values.get(group.get(j)));
            }
            double nodeTotal = DeterministicMath.stableSum(nodeWeights);
            if (!(nodeTotal > 0.0)) {
                throw new IllegalArgumentException("Surviving nodes of bin '" + bin.binId() + "' have zero total weight");
            }
            for (int j = 0; j < group.size(); j++) {
                nodeFractions[group.get(j)] = nodeWeights[j] / nodeTotal;
            }
            var binValue = scale(DeterministicMath.stableWeightedSum(nodeWeights, nodeValues, dimension), nodeTotal);
            binWeights[b] = srf.binWeight(bin.lower(), bin.upper());
            binValues.add(binValue);
            samples.add(new SpectralSample(bin.wavelength(), bin.lower(), bin.upper(), binWeights[b], binValue));
        }
        double total = checkedTotal(binWeights, srf);

        var realized = new LinkedHashMap<SpectralIndex, Double>();
        for (int b = 0; b < groups.size(); b++) {
            for (int i : groups.get(b)) {
                realized.put(survivors.get(i), binWeights[b] / total * nodeFractions[i]);
            }
        }
        var value = scale(DeterministicMath.stableWeightedSum(binWeights, binValues, dimension), total);
        return new SpectralEstimate(value, samples, realized, dropped, warnings);
    }

    private static double checkedTotal(double[] weights, SpectralResponseFunction srf) {
        double total = DeterministicMath.stableSum(weights);
        if (!(total > 0.0)) {
            throw new DomainException("Spectral response " + srf + " has zero total weight over the evaluated positions");
        }
        return total;
    }

    private static double[] scale(double[] sum, double total) {
        for (int c = 0; c < sum.length; c++) {
            sum[c] /= total;
        }
        return sum;
    }
}
