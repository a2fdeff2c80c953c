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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;
import ai.kognition.finst.tracking.Slot;

/**
 * Decides which of this cycle's candidates each tracked slot now corresponds to.
 *
 * @see MatcherImpl
 */
public interface CorrespondenceMatcher {

    /**
     * @param priors where each slot was last cycle.
     * @param candidates this cycle's candidate regions. A candidate is identified by its position in this list.
     * @param enhancedRegions the enhanced region of each slot that has one. Matchers that don't use the suppression
     *     map ignore this.
     * @param random the source of any noise the matcher adds.
     * @return every slot in {@code priors}, in the same order, mapped to its matched candidate or
     *     {@link Optional#empty()} if it wasn't matched.
     */
    Map<Slot, Optional<Region>> match(Collection<Location> priors, List<Region> candidates, Map<Slot, Region> enhancedRegions, Random random);

    /**
     * Turn an assignment of candidate indexes into the result of {@link #match}.
     */
    public static Map<Slot, Optional<Region>> resolve(final Collection<Location> priors, final List<Region> candidates,
        final Map<Slot, Integer> assigned) {
        final Map<Slot, Optional<Region>> ret = new LinkedHashMap<>();
        for(final Location prior: priors) {
            final Integer idx = assigned.get(prior.slot());
            ret.put(prior.slot(), idx == null ? Optional.empty() : Optional.of(candidates.get(idx)));
        }
        return Collections.unmodifiableMap(ret);
    }
}
