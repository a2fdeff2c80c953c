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

package ai.kognition.finst.tracking.match;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;
import ai.kognition.finst.tracking.Slot;
import ai.kognition.finst.tracking.TrackerConfig;

/**
 * Matches candidates to slots by how well they overlap each slot's enhanced region.
 * <p>
 * Every candidate that intersects a slot's enhanced region (or its prior region, when the extractor found no
 * enhanced region) is scored. A candidate close enough to the slot's bias region to overlap it gets priority
 * {@link Score#BIAS}. Otherwise the overlap, converted to degrees of visual angle, is compared to a noisy cutoff
 * drawn from a Gaussian once per intersecting pair, in slot then candidate order. Pairs below the cutoff aren't
 * assigned. The rest are sorted best first and handed to {@link GreedyAssignment}.
 */
public class SuppressionScoredMatcher implements CorrespondenceMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionScoredMatcher.class);

    private static final Comparator<ScoredPair> BEST_FIRST = Comparator.comparing((final ScoredPair p) -> p.score).reversed();

    private final double noiseCenter;
    private final double noiseWidth;
    private final ViewingGeometry geometry;

    public SuppressionScoredMatcher(final double noiseCenter, final double noiseWidth, final ViewingGeometry geometry) {
        this.noiseCenter = noiseCenter;
        this.noiseWidth = noiseWidth;
        this.geometry = geometry;
    }

    public SuppressionScoredMatcher(final TrackerConfig config) {
        this(config.noiseCenter, config.noiseWidth, new ViewingGeometry(config.viewingWidthDegrees, config.imageWidth));
    }

    @Override
    public Map<Slot, Optional<Region>> match(final Collection<Location> priors, final List<Region> candidates, final Map<Slot, Region> enhancedRegions,
        final Random random) {
        final List<ScoredPair> pairs = new ArrayList<>();
        for(final Location prior: priors) {
            final Region eregion = enhancedRegions.getOrDefault(prior.slot(), prior.region());
            for(int i = 0; i < candidates.size(); i++) {
                final Optional<Score> score = score(candidates.get(i), eregion, prior.bias(), random);
                if(score.isPresent() && score.get().isAssignable())
                    pairs.add(new ScoredPair(prior.slot(), i, score.get()));
                else if(LOGGER.isTraceEnabled())
                    LOGGER.trace("Candidate {} isn't assignable to {}: {}", i, prior.slot(), score);
            }
        }

        // List.sort is stable so ties stay in slot then candidate order.
        pairs.sort(BEST_FIRST);
        LOGGER.trace("Assignable pairs: {}", pairs);
        return CorrespondenceMatcher.resolve(priors, candidates, GreedyAssignment.assign(pairs));
    }

    /**
     * Score one candidate against a slot's enhanced region.
     *
     * @return {@link Optional#empty()} when the candidate doesn't intersect the enhanced region at all. No noise is
     *     drawn in that case.
     */
    public Optional<Score> score(final Region candidate, final Region eregion, final Optional<Region> bias, final Random random) {
        if(!candidate.intersects(eregion))
            return Optional.empty();

        final double cutoff = noiseCenter + (random.nextGaussian() * noiseWidth);
        final double centerDistance = candidate.center().distance(eregion.center());
        final double overlap = geometry.toDegrees(candidate.radius() + eregion.radius() - centerDistance);

        if(bias.isPresent()) {
            final Region b = bias.get();
            final double biasDistance = candidate.center().distance(b.center());
            final double maxBiasDistance = candidate.radius() + b.radius();
            if(biasDistance < maxBiasDistance)
                return Optional.of(new Score(maxBiasDistance - biasDistance, Score.BIAS));
        }

        return Optional.of(new Score(overlap, overlap > cutoff ? Score.OVERLAP : Score.NONE));
    }
}
