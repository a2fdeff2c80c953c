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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Region;

/**
 * The outcome of one tracker cycle.
 */
public final class CycleResult {
    private final Map<Slot, Optional<Region>> regions;
    private final Map<Slot, Region> enhancedRegions;
    private final FloatImage suppressionMap;
    private final boolean saccade;

    CycleResult(final Map<Slot, Optional<Region>> regions, final Map<Slot, Region> enhancedRegions, final FloatImage suppressionMap,
        final boolean saccade) {
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
        this.enhancedRegions = Collections.unmodifiableMap(new LinkedHashMap<>(enhancedRegions));
        this.suppressionMap = suppressionMap;
        this.saccade = saccade;
    }

    /**
     * Every slot from the cycle's priors, in the same order, mapped to where its target is now or to
     * {@link Optional#empty()} if it wasn't found this cycle.
     */
    public Map<Slot, Optional<Region>> regions() {
        return regions;
    }

    public Optional<Region> region(final Slot slot) {
        final Optional<Region> ret = regions.get(slot);
        return ret == null ? Optional.empty() : ret;
    }

    /**
     * The enhanced region of each slot that had one. Empty unless the suppression matcher ran.
     */
    public Map<Slot, Region> enhancedRegions() {
        return enhancedRegions;
    }

    /**
     * The suppression map composed this cycle. It belongs to the tracker and is only valid until the second update
     * after the one that returned it. Nothing is returned during a saccade or by the nearest neighbor matchers.
     */
    public Optional<FloatImage> suppressionMap() {
        return Optional.ofNullable(suppressionMap);
    }

    /**
     * True when this cycle happened during a saccade and so every region is just the prior region.
     */
    public boolean saccade() {
        return saccade;
    }

    @Override
    public String toString() {
        return "CycleResult [regions=" + regions + ", saccade=" + saccade + "]";
    }
}
