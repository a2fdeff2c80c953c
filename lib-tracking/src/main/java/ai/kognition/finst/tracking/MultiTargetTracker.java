/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.finst.tracking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Point;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.kernel.KernelCache;
import ai.kognition.finst.tracking.kernel.KernelSetBuilder;
import ai.kognition.finst.tracking.match.CorrespondenceMatcher;
import ai.kognition.finst.tracking.suppression.EnhancedRegionExtractor;
import ai.kognition.finst.tracking.suppression.SuppressionBuffers;
import ai.kognition.finst.tracking.suppression.SuppressionCompositor;
import ai.kognition.finst.util.QuietCloseable;
import ai.kognition.finst.util.Timer;

/**
 * Tracks a set of slots from cycle to cycle.
 * <p>
 * Each call to {@link #update(CycleInput, Random)} takes where every slot was last seen plus this cycle's unlabeled
 * candidate regions and decides which candidate, if any, each slot now corresponds to. With the
 * {@link ai.kognition.finst.tracking.match.MatcherImpl#SUPPRESSION SUPPRESSION} matcher a cycle:
 * <ol>
 * <li>makes sure there are kernels for every tracked region and every untracked candidate from the previous cycle,</li>
 * <li>composes the suppression map into the back buffer,</li>
 * <li>finds each slot's enhanced region,</li>
 * <li>scores and matches the candidates,</li>
 * <li>swaps the buffers.</li>
 * </ol>
 * The nearest neighbor matchers skip straight to matching.
 * <p>
 * During a saccade the prior regions are passed through unchanged and neither suppression map is touched.
 * <p>
 * A tracker isn't thread safe. It owns native image memory and must be closed.
 */
public class MultiTargetTracker implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MultiTargetTracker.class);

    private final TrackerConfig config;
    private final KernelCache cache;
    private final boolean ownsCache;
    private final KernelSetBuilder kernelBuilder;
    private final CorrespondenceMatcher matcher;
    private final SuppressionCompositor compositor;
    private final EnhancedRegionExtractor extractor;
    private final SuppressionBuffers buffers;

    private List<Region> previousCandidates = Collections.emptyList();
    private long cycle = 0;
    private boolean closed = false;

    public MultiTargetTracker(final TrackerConfig config) {
        this(config, new KernelCache(), true);
    }

    /**
     * Use a {@link KernelCache} that may be shared with other trackers or reused from an earlier run. The cache remains
     * the caller's to close.
     */
    public MultiTargetTracker(final TrackerConfig config, final KernelCache cache) {
        this(config, cache, false);
    }

    private MultiTargetTracker(final TrackerConfig config, final KernelCache cache, final boolean ownsCache) {
        this.config = Validate.notNull(config, "config");
        this.cache = Validate.notNull(cache, "cache");
        this.ownsCache = ownsCache;
        this.kernelBuilder = new KernelSetBuilder(config);
        this.matcher = config.matcher.newMatcher(config);
        this.compositor = new SuppressionCompositor(cache, kernelBuilder);
        this.extractor = new EnhancedRegionExtractor();
        this.buffers = config.matcher.usesSuppression() ? new SuppressionBuffers(config.imageWidth, config.imageHeight) : null;
        LOGGER.debug("Created a tracker with {}", config);
    }

    public TrackerConfig config() {
        return config;
    }

    public KernelCache cache() {
        return cache;
    }

    /**
     * Run one cycle.
     *
     * @param random the source of the matching noise. The same input and the same seed always give the same result.
     * @throws IllegalStateException if the tracker has been closed.
     */
    public CycleResult update(final CycleInput input, final Random random) {
        Validate.validState(!closed, "This %s has been closed", MultiTargetTracker.class.getSimpleName());
        Validate.notNull(input, "input");
        Validate.notNull(random, "random");

        final Timer timer = LOGGER.isDebugEnabled() ? Timer.started() : null;
        cycle++;
        final Map<Slot, Location> priors = input.priors();
        final List<Region> candidates = input.candidates();

        final CycleResult ret;
        if(input.saccadeInProgress())
            ret = passThrough(priors);
        else if(buffers == null)
            ret = new CycleResult(matcher.match(priors.values(), candidates, Collections.emptyMap(), random), Collections.emptyMap(), null, false);
        else
            ret = suppressionCycle(input, random);

        previousCandidates = candidates;

        if(timer != null) {
            if(!priors.isEmpty() && candidates.isEmpty())
                LOGGER.debug("Cycle {} had {} slots but no candidates", cycle, priors.size());
            LOGGER.debug("Cycle {} ({} slots, {} candidates{}) took {} seconds", cycle, priors.size(), candidates.size(),
                input.saccadeInProgress() ? ", saccade" : "", timer.stop());
        }
        return ret;
    }

    private static CycleResult passThrough(final Map<Slot, Location> priors) {
        final Map<Slot, Optional<Region>> regions = new LinkedHashMap<>();
        priors.forEach((slot, loc) -> regions.put(slot, Optional.of(loc.region())));
        return new CycleResult(regions, Collections.emptyMap(), null, true);
    }

    private CycleResult suppressionCycle(final CycleInput input, final Random random) {
        final Map<Slot, Location> priors = input.priors();

        final Set<Region> tracked = new LinkedHashSet<>();
        priors.values().forEach(loc -> tracked.add(loc.region()));

        final List<Region> untracked = new ArrayList<>();
        for(final Region r: previousCandidates) {
            if(!tracked.contains(r))
                untracked.add(r);
        }

        final List<Region> needKernels = new ArrayList<>(tracked);
        needKernels.addAll(untracked);
        cache.ensureKernels(needKernels, kernelBuilder);

        final Point gaze = input.gaze().orElseGet(() -> Point.xy(config.imageWidth / 2.0, config.imageHeight / 2.0));
        final FloatImage map = buffers.back();
        compositor.compose(map, tracked, untracked, gaze);

        final Map<Slot, Region> enhanced = new LinkedHashMap<>();
        for(final Location prior: priors.values()) {
            final Optional<Region> eregion = extractor.extract(map, prior, cache.kernelsFor(prior.region(), kernelBuilder));
            if(eregion.isPresent())
                enhanced.put(prior.slot(), eregion.get());
            else
                LOGGER.debug("No enhanced region for {}. Scoring against its prior region.", prior.slot());
        }

        final Map<Slot, Optional<Region>> regions = matcher.match(priors.values(), input.candidates(), enhanced, random);
        buffers.swap();
        return new CycleResult(regions, enhanced, buffers.front(), false);
    }

    @Override
    public void close() {
        if(closed)
            return;
        closed = true;
        final List<AutoCloseable> toClose = new ArrayList<>(2);
        toClose.add(buffers);
        if(ownsCache)
            toClose.add(cache);
        QuietCloseable.closeAll(toClose);
    }
}
