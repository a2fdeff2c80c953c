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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import org.junit.Test;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.image.geometry.SimplePoint;
import ai.kognition.finst.tracking.kernel.KernelCache;
import ai.kognition.finst.tracking.match.MatcherImpl;

public class MultiTargetTrackerTest {
    private static final Slot S0 = Slot.of(0);
    private static final Slot S1 = Slot.of(1);
    private static final Slot S2 = Slot.of(2);

    private static final List<Location> SPREAD_OUT = Arrays.asList(
        Location.of(S0, Region.of(30, 30, 20, 20)),
        Location.of(S1, Region.of(150, 30, 20, 20)),
        Location.of(S2, Region.of(90, 150, 20, 20)));

    private static TrackerConfig.Builder config() {
        return TrackerConfig.builder(200, 200);
    }

    private static CycleInput input(final List<Location> priors, final List<Region> candidates) {
        return CycleInput.builder().priors(priors).candidates(candidates).build();
    }

    @Test
    public void everySlotFindsItsOwnCandidate() {
        final List<Region> candidates = Arrays.asList(Region.of(93, 152, 20, 20), Region.of(33, 32, 20, 20), Region.of(152, 27, 20, 20));
        try(final MultiTargetTracker tracker = new MultiTargetTracker(config().noiseWidth(0).build())) {
            final CycleResult result = tracker.update(input(SPREAD_OUT, candidates), new Random(7));
            assertFalse(result.saccade());
            assertEquals(Optional.of(candidates.get(1)), result.region(S0));
            assertEquals(Optional.of(candidates.get(2)), result.region(S1));
            assertEquals(Optional.of(candidates.get(0)), result.region(S2));
            assertEquals(3, new HashSet<>(result.regions().values()).size());

            assertEquals(3, result.enhancedRegions().size());
            for(final Location prior: SPREAD_OUT)
                assertTrue(result.enhancedRegions().get(prior.slot()).contains(Region.of(prior.region().centerX(), prior.region().centerY(), 1, 1)));
            assertTrue(result.suppressionMap().isPresent());
        }
    }

    @Test
    public void occludingTargetsShareACandidate() {
        final List<Location> priors = Arrays.asList(Location.of(S0, Region.of(80, 90, 20, 20)), Location.of(S1, Region.of(100, 90, 20, 20)));
        final Region candidate = Region.of(95, 95, 10, 10);
        try(final MultiTargetTracker tracker = new MultiTargetTracker(config().noiseWidth(0).build())) {
            final CycleResult result = tracker.update(input(priors, Collections.singletonList(candidate)), new Random(7));
            assertEquals(Optional.of(candidate), result.region(S0));
            assertEquals(Optional.of(candidate), result.region(S1));
        }
    }

    @Test
    public void saccadePassesPriorsThroughWithoutTouchingTheMaps() {
        try(final MultiTargetTracker tracker = new MultiTargetTracker(config().build())) {
            final CycleResult first = tracker.update(input(SPREAD_OUT, Arrays.asList(Region.of(33, 32, 20, 20))), new Random(1));
            final FloatImage map = first.suppressionMap().get();
            final float[] before = map.pixels();

            final CycleInput saccade = CycleInput.builder()
                .priors(SPREAD_OUT)
                .candidates(Arrays.asList(Region.of(0, 0, 50, 50), Region.of(100, 100, 10, 10)))
                .saccadeInProgress(true)
                .build();
            final CycleResult result = tracker.update(saccade, new Random(1));

            assertTrue(result.saccade());
            assertFalse(result.suppressionMap().isPresent());
            assertTrue(result.enhancedRegions().isEmpty());
            for(final Location prior: SPREAD_OUT)
                assertEquals(Optional.of(prior.region()), result.region(prior.slot()));
            assertArrayEquals(before, map.pixels(), 0.0f);
        }
    }

    @Test
    public void noCandidatesMeansNoRegionsForAnyMatcher() {
        for(final MatcherImpl impl: MatcherImpl.values()) {
            try(final MultiTargetTracker tracker = new MultiTargetTracker(config().matcher(impl).build())) {
                final CycleResult result = tracker.update(input(SPREAD_OUT, Collections.emptyList()), new Random(1));
                assertEquals(impl.name(), 3, result.regions().size());
                result.regions().values().forEach(r -> assertFalse(impl.name(), r.isPresent()));
                assertEquals(impl.usesSuppression(), result.suppressionMap().isPresent());
            }
        }
    }

    @Test
    public void sameInputsAndSeedGiveIdenticalResults() {
        final List<Region> cycle1 = Arrays.asList(Region.of(33, 32, 20, 20), Region.of(60, 60, 15, 25), Region.of(152, 27, 20, 20));
        final List<Region> cycle2 = Arrays.asList(Region.of(35, 33, 20, 20), Region.of(92, 148, 20, 20), Region.of(100, 100, 30, 12));

        float[] expectedMap = null;
        Map<Slot, Optional<Region>> expected1 = null;
        Map<Slot, Optional<Region>> expected2 = null;
        for(int run = 0; run < 3; run++) {
            try(final MultiTargetTracker tracker = new MultiTargetTracker(config().smallHatK(0.4).targetCost(0.1).build())) {
                final Random random = new Random(42);
                final Map<Slot, Optional<Region>> r1 = tracker.update(input(SPREAD_OUT, cycle1), random).regions();
                final CycleResult second = tracker.update(input(SPREAD_OUT, cycle2), random);
                if(expectedMap == null) {
                    expectedMap = second.suppressionMap().get().pixels();
                    expected1 = r1;
                    expected2 = second.regions();
                } else {
                    assertArrayEquals(expectedMap, second.suppressionMap().get().pixels(), 0.0f);
                    assertEquals(expected1, r1);
                    assertEquals(expected2, second.regions());
                }
            }
        }
    }

    @Test
    public void previousCandidatesAreSuppressedAsUntracked() {
        final Region stray = Region.of(150, 150, 20, 20);
        final TrackerConfig cfg = config().smallHatK(0.5).build();
        final List<Location> priors = Collections.singletonList(Location.of(S0, Region.of(30, 30, 20, 20)));
        try(final MultiTargetTracker fresh = new MultiTargetTracker(cfg);
            final MultiTargetTracker seenStray = new MultiTargetTracker(cfg);) {
            final float[] without = fresh.update(input(priors, Collections.emptyList()), new Random(1)).suppressionMap().get().pixels();

            seenStray.update(input(priors, Collections.singletonList(stray)), new Random(1));
            final float[] with = seenStray.update(input(priors, Collections.emptyList()), new Random(1)).suppressionMap().get().pixels();

            // 25 pixels right of the stray's center is in its inhibitory surround
            final int idx = (stray.centerY() * 200) + stray.centerX() + 25;
            assertTrue(with[idx] < without[idx]);
            // the stray is the same shape as the tracked region
            assertEquals(1, seenStray.cache().size());
        }
    }

    @Test
    public void sharedCacheOutlivesTheTracker() {
        try(final KernelCache cache = new KernelCache()) {
            try(final MultiTargetTracker tracker = new MultiTargetTracker(config().build(), cache)) {
                tracker.update(input(SPREAD_OUT, Collections.emptyList()), new Random(1));
            }
            assertEquals(1, cache.size());
            try(final MultiTargetTracker tracker = new MultiTargetTracker(config().build(), cache)) {
                tracker.update(input(SPREAD_OUT, Collections.emptyList()), new Random(1));
            }
            assertEquals(1, cache.size());
        }
    }

    @Test
    public void sharedCacheKeepsDifferentlyConfiguredTrackersApart() {
        final List<Location> priors = Collections.singletonList(Location.of(S0, Region.of(180, 180, 20, 20)));
        final List<Region> candidates = Collections.singletonList(Region.of(181, 180, 20, 20));
        try(final KernelCache cache = new KernelCache()) {
            try(final MultiTargetTracker twoBuckets = new MultiTargetTracker(config().numHats(2).build(), cache)) {
                twoBuckets.update(input(priors, candidates), new Random(1));
            }
            try(final MultiTargetTracker fiveBuckets = new MultiTargetTracker(config().numHats(5).noiseWidth(0).build(), cache)) {
                final CycleInput farFromGaze = CycleInput.builder().priors(priors).candidates(candidates).gaze(new SimplePoint(0, 0)).build();
                final CycleResult result = fiveBuckets.update(farFromGaze, new Random(1));
                assertEquals(Optional.of(candidates.get(0)), result.region(S0));
            }
            assertEquals(2, cache.size());
        }
    }

    @Test
    public void nearestNeighborModesDontBuildKernels() {
        try(final KernelCache cache = new KernelCache();
            final MultiTargetTracker tracker = new MultiTargetTracker(config().matcher(MatcherImpl.ONE_TO_ONE).build(), cache);) {
            final List<Region> candidates = Arrays.asList(Region.of(93, 152, 20, 20), Region.of(33, 32, 20, 20), Region.of(152, 27, 20, 20));
            final CycleResult result = tracker.update(input(SPREAD_OUT, candidates), new Random(1));
            assertEquals(Optional.of(candidates.get(1)), result.region(S0));
            assertEquals(Optional.of(candidates.get(2)), result.region(S1));
            assertEquals(Optional.of(candidates.get(0)), result.region(S2));
            assertEquals(0, cache.size());
            assertFalse(result.suppressionMap().isPresent());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void closedTrackerCantBeUsed() {
        final MultiTargetTracker tracker = new MultiTargetTracker(config().matcher(MatcherImpl.NEAREST).build());
        tracker.close();
        tracker.update(input(SPREAD_OUT, Collections.emptyList()), new Random(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void priorUnderTheWrongSlotIsRejected() {
        CycleInput.builder().priors(Collections.singletonMap(S1, Location.of(S0, Region.of(0, 0, 5, 5))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullCandidateIsRejected() {
        CycleInput.builder().candidates(Arrays.asList(Region.of(0, 0, 5, 5), null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateSlotIsRejected() {
        CycleInput.builder().prior(Location.of(S0, Region.of(0, 0, 5, 5))).prior(Location.of(S0, Region.of(10, 10, 5, 5)));
    }
}
