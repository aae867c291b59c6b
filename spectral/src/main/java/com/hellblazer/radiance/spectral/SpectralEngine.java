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
package com.hellblazer.radiance.spectral;

import com.hellblazer.radiance.spectral.config.MeasurementSpec;
import com.hellblazer.radiance.spectral.config.SpectralConfiguration;
import com.hellblazer.radiance.spectral.dispatch.KernelDispatcher;
import com.hellblazer.radiance.spectral.dispatch.SpectralKernel;
import com.hellblazer.radiance.spectral.grid.GridBuilder;
import com.hellblazer.radiance.spectral.grid.SpectralGrid;
import com.hellblazer.radiance.spectral.index.IndexResult;
import com.hellblazer.radiance.spectral.index.SpectralAggregator;
import com.hellblazer.radiance.spectral.index.SpectralEstimate;
import com.hellblazer.radiance.spectral.index.SpectralIndex;
import com.hellblazer.radiance.spectral.index.SpectralIndexer;
import com.hellblazer.radiance.spectral.index.SpectralPlan;
import com.hellblazer.radiance.spectral.quadrature.AbsorberState;
import com.hellblazer.radiance.spectral.quadrature.QuadraturePolicy;
import com.hellblazer.radiance.spectral.response.SpectralResponseFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the spectral engine: plans the spectral indices of a measurement, runs a kernel over them and folds
 * the results into a {@link SpectralEstimate}.
 *
 * <pre>
 * try (var engine = new SpectralEngine(SpectralConfiguration.bestEffortConfig())) {
 *     var estimate = engine.evaluate(spec, index -&gt; renderer.radiance(index));
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SpectralEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SpectralEngine.class);

    private final SpectralConfiguration configuration;
    private final SpectralIndexer       indexer;
    private final SpectralAggregator    aggregator;
    private final KernelDispatcher      dispatcher;

    public SpectralEngine() {
        this(SpectralConfiguration.defaultConfig());
    }

    public SpectralEngine(SpectralConfiguration configuration) {
        this(configuration, new SpectralIndexer(),
             new KernelDispatcher(configuration.getParallelism(), configuration.getMaxRetries(),
                                  configuration.getIndexTimeout()));
    }

    SpectralEngine(SpectralConfiguration configuration, SpectralIndexer indexer, KernelDispatcher dispatcher) {
        this.configuration = configuration;
        this.indexer = indexer;
        this.aggregator = new SpectralAggregator(configuration.getFailurePolicy());
        this.dispatcher = dispatcher;
    }

    public SpectralConfiguration getConfiguration() {
        return configuration;
    }

    public SpectralGrid buildGrid(MeasurementSpec spec) {
        return GridBuilder.build(spec.defaultGrid(), spec.mediumGridOverride(), spec.srf());
    }

    public SpectralPlan plan(MeasurementSpec spec) {
        var plan = indexer.enumerate(buildGrid(spec), spec.policy(), spec.state());
        log.debug("Measurement '{}': {} spectral indices", spec.id(), plan.size());
        return plan;
    }

    public SpectralPlan plan(SpectralGrid defaultGrid, Optional<SpectralGrid> mediumOverride,
                             SpectralResponseFunction srf, QuadraturePolicy policy, AbsorberState state) {
        return indexer.enumerate(GridBuilder.build(defaultGrid, mediumOverride, srf), policy, state);
    }

    public Map<SpectralIndex, IndexResult> dispatch(SpectralPlan plan, SpectralKernel kernel) {
        return dispatcher.dispatch(plan, kernel);
    }

    public SpectralEstimate aggregate(SpectralPlan plan, Map<SpectralIndex, IndexResult> results,
                                      SpectralResponseFunction srf) {
        return aggregator.aggregate(plan, results, srf);
    }

    /**
     * Plan, dispatch and aggregate one measurement.
     */
    public SpectralEstimate evaluate(MeasurementSpec spec, SpectralKernel kernel) {
        var plan = plan(spec);
        var estimate = aggregate(plan, dispatch(plan, kernel), spec.srf());
        if (estimate.isDegraded()) {
            log.info("Measurement '{}' evaluated with {} dropped indices and {} saturated bins", spec.id(),
                     estimate.dropped(), estimate.warnings().size());
        }
        return estimate;
    }

    @Override
    public void close() {
        dispatcher.close();
    }
}
