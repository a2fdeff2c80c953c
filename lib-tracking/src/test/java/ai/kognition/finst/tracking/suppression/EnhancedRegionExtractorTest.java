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

package ai.kognition.finst.tracking.suppression;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Optional;

import org.junit.Test;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;
import ai.kognition.finst.tracking.Slot;
import ai.kognition.finst.tracking.TrackerConfig;
import ai.kognition.finst.tracking.kernel.KernelSet;
import ai.kognition.finst.tracking.kernel.KernelSetBuilder;

public class EnhancedRegionExtractorTest {
    private static final Region PRIOR = Region.of(40, 40, 20, 20);

    private final KernelSetBuilder builder = new KernelSetBuilder(TrackerConfig.builder(200, 200).build());
    private final EnhancedRegionExtractor extractor = new EnhancedRegionExtractor();

    @Test
    public void unsuppressedTargetGetsItsWholePositiveLobe() {
        try(final KernelSet ks = builder.build(PRIOR);
            final FloatImage map = FloatImage.zeros(200, 200);) {
            final Optional<Region> eregion = extractor.extract(map, Location.of(Slot.of(1), PRIOR), ks);
            assertTrue(eregion.isPresent());

            final Region footprint = Region.centeredAt(PRIOR.centerX(), PRIOR.centerY(), ks.positive().width(), ks.positive().height());
            assertTrue(footprint.contains(eregion.get()));
            assertTrue(eregion.get().width >= 25);
            assertTrue(eregion.get().contains(Region.of(PRIOR.centerX(), PRIOR.centerY(), 1, 1)));
        }
    }

    @Test
    public void biasStretchesTheRegionTowardTheExpectedPosition() {
        final Region bias = Region.of(70, 40, 20, 20);
        try(final KernelSet ks = builder.build(PRIOR);
            final FloatImage map = FloatImage.zeros(200, 200);) {
            final Region plain = extractor.extract(map, Location.of(Slot.of(1), PRIOR), ks).get();
            final Region biased = extractor.extract(map, Location.withBias(Slot.of(1), PRIOR, bias), ks).get();
            assertTrue(biased.maxX() > plain.maxX());
            assertTrue(biased.maxX() > bias.centerX());
            assertTrue(biased.x <= plain.x);
        }
    }

    @Test
    public void overwhelmingSuppressionLeavesNoRegion() {
        try(final KernelSet ks = builder.build(PRIOR);
            final FloatImage map = FloatImage.zeros(200, 200);) {
            map.setTo(-100.0);
            assertFalse(extractor.extract(map, Location.of(Slot.of(1), PRIOR), ks).isPresent());
        }
    }

    @Test
    public void priorOffTheMapLeavesNoRegion() {
        try(final KernelSet ks = builder.build(PRIOR);
            final FloatImage map = FloatImage.zeros(200, 200);) {
            assertFalse(extractor.extract(map, Location.of(Slot.of(1), Region.of(1000, 1000, 20, 20)), ks).isPresent());
        }
    }

    @Test
    public void mapIsNeverWritten() {
        try(final KernelSet ks = builder.build(PRIOR);
            final FloatImage map = FloatImage.zeros(200, 200);) {
            map.setTo(-0.01);
            final float[] before = map.pixels();
            extractor.extract(map, Location.withBias(Slot.of(1), PRIOR, Region.of(60, 45, 20, 20)), ks);
            assertArrayEquals(before, map.pixels(), 0.0f);
        }
    }

    @Test
    public void regionNearTheEdgeIsReportedInMapCoordinates() {
        final Region edge = Region.of(185, 185, 20, 20);
        try(final KernelSet ks = builder.build(edge);
            final FloatImage map = FloatImage.zeros(200, 200);) {
            final Region eregion = extractor.extract(map, Location.of(Slot.of(1), edge), ks).get();
            assertTrue(Region.of(0, 0, 200, 200).contains(eregion));
            assertTrue(eregion.maxX() == 199 && eregion.maxY() == 199);
            assertTrue(eregion.x > 150);
        }
    }
}
