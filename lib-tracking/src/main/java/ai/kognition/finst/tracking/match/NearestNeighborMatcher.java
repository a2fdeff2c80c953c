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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;
import ai.kognition.finst.tracking.Slot;
import ai.kognition.finst.tracking.TrackerConfig;

/**
 * Each slot independently takes its nearest eligible candidate. Several slots may take the same one. Ties go to the
 * earlier candidate.
 */
public class NearestNeighborMatcher extends AbstractNearestMatcher {

    public NearestNeighborMatcher(final Double maxDistance, final Double maxNormedDistance) {
        this(maxDistance, maxNormedDistance, NearestMetric.EUCLIDEAN);
    }

    public NearestNeighborMatcher(final Double maxDistance, final Double maxNormedDistance, final NearestMetric metric) {
        super(maxDistance, maxNormedDistance, metric);
    }

    public NearestNeighborMatcher(final TrackerConfig config) {
        this(config.maxDistance, config.maxNormedDistance);
    }

    @Override
    public Map<Slot, Optional<Region>> match(final Collection<Location> priors, final List<Region> candidates, final Map<Slot, Region> enhancedRegions,
        final Random random) {
        final Map<Slot, DistancePair> nearest = new LinkedHashMap<>();
        for(final DistancePair p: eligiblePairs(priors, candidates)) {
            final DistancePair cur = nearest.get(p.slot());
            if(cur == null || p.distanceSquared < cur.distanceSquared)
                nearest.put(p.slot(), p);
        }

        final Map<Slot, Integer> assigned = new LinkedHashMap<>();
        nearest.forEach((slot, p) -> assigned.put(slot, p.candidate()));
        return CorrespondenceMatcher.resolve(priors, candidates, assigned);
    }
}
