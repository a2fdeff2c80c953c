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

package ai.kognition.finst.tracking.kernel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.TrackerConfig;
import ai.kognition.finst.tracking.kernel.ShapeIndex.Orientation;

public class KernelCacheTest {

    @Test
    public void orientation() {
        assertEquals(Orientation.ROUND, ShapeIndex.of(Region.of(0, 0, 100, 90), 0.2).orientation);
        assertEquals(Orientation.HORIZONTAL, ShapeIndex.of(Region.of(0, 0, 100, 50), 0.2).orientation);
        assertEquals(Orientation.VERTICAL, ShapeIndex.of(Region.of(0, 0, 50, 100), 0.2).orientation);
    }

    @Test
    public void nearlyEqualWidthsShareAnIndex() {
        final ShapeIndex a = ShapeIndex.of(Region.of(0, 0, 100, 100), 0.2);
        final ShapeIndex b = ShapeIndex.of(Region.of(0, 0, 101, 100), 0.2);
        assertTrue(a.matches(b, 0.01, 0.2));
        assertTrue(b.matches(a, 0.01, 0.2));
        assertFalse(a.matches(b, 0.005, 0.2));
    }

    @Test
    public void doubleWidthNeverSharesAnIndex() {
        final ShapeIndex a = ShapeIndex.of(Region.of(0, 0, 100, 50), 0.2);
        final ShapeIndex b = ShapeIndex.of(Region.of(0, 0, 200, 50), 0.2);
        assertEquals(a.orientation, b.orientation);
        assertFalse(a.matches(b, 0.3, 0.5));
    }

    @Test
    public void differentOrientationsDontShare() {
        final ShapeIndex a = ShapeIndex.of(Region.of(0, 0, 100, 60), 0.2);
        final ShapeIndex b = ShapeIndex.of(Region.of(0, 0, 60, 100), 0.2);
        assertFalse(a.matches(b, 1.0, 1.0));
    }

    @Test
    public void cacheReusesKernelsForSimilarShapes() {
        final KernelSetBuilder builder = new KernelSetBuilder(TrackerConfig.builder(400, 400).widthThresh(0.01).build());
        try(final KernelCache cache = new KernelCache()) {
            final KernelSet first = cache.kernelsFor(Region.of(10, 10, 100, 100), builder);
            final KernelSet second = cache.kernelsFor(Region.of(200, 150, 101, 100), builder);
            assertSame(first, second);
            assertEquals(1, cache.size());
        }
    }

    @Test
    public void cacheBuildsNewKernelsForDifferentShapes() {
        final KernelSetBuilder builder = new KernelSetBuilder(TrackerConfig.builder(400, 400).build());
        try(final KernelCache cache = new KernelCache()) {
            final KernelSet first = cache.kernelsFor(Region.of(10, 10, 100, 100), builder);
            final KernelSet second = cache.kernelsFor(Region.of(10, 10, 200, 100), builder);
            assertNotSame(first, second);
            assertEquals(2, cache.size());
        }
    }

    @Test
    public void existingEntriesAreNeverReplaced() {
        final KernelSetBuilder builder = new KernelSetBuilder(TrackerConfig.builder(200, 200).build());
        try(final KernelCache cache = new KernelCache()) {
            final KernelSet small = cache.kernelsFor(Region.of(0, 0, 20, 20), builder);
            cache.ensureKernels(Arrays.asList(Region.of(50, 50, 21, 20), Region.of(5, 5, 20, 21), Region.of(0, 0, 40, 40)), builder);
            assertEquals(2, cache.size());
            assertSame(small, cache.kernelsFor(Region.of(100, 100, 20, 20), builder));
            assertSame(small, cache.find(builder.shapeIndex(Region.of(0, 0, 20, 20)), builder.parameters(), 0.3, 0.2).get());
        }
    }

    @Test
    public void clearEmptiesTheCache() {
        final KernelSetBuilder builder = new KernelSetBuilder(TrackerConfig.builder(200, 200).build());
        final KernelCache cache = new KernelCache();
        cache.kernelsFor(Region.of(0, 0, 20, 20), builder);
        cache.clear();
        assertEquals(0, cache.size());
        assertFalse(cache.find(builder.shapeIndex(Region.of(0, 0, 20, 20)), builder.parameters(), 0.3, 0.2).isPresent());
    }

    @Test
    public void differentlyConfiguredBuildersDontShareKernels() {
        final KernelSetBuilder twoBuckets = new KernelSetBuilder(TrackerConfig.builder(200, 200).numHats(2).build());
        final KernelSetBuilder fiveBuckets = new KernelSetBuilder(TrackerConfig.builder(200, 200).numHats(5).build());
        try(final KernelCache cache = new KernelCache()) {
            final KernelSet two = cache.kernelsFor(Region.of(0, 0, 20, 20), twoBuckets);
            final KernelSet five = cache.kernelsFor(Region.of(0, 0, 20, 20), fiveBuckets);
            assertNotSame(two, five);
            assertEquals(2, two.bucketCount());
            assertEquals(5, five.bucketCount());
            assertEquals(2, cache.size());
            assertSame(two, cache.kernelsFor(Region.of(40, 40, 20, 20), twoBuckets));
            assertFalse(cache.find(twoBuckets.shapeIndex(Region.of(0, 0, 20, 20)),
                KernelParameters.of(TrackerConfig.builder(200, 200).numHats(2).hatK(4.0).build()), 0.3, 0.2).isPresent());
        }
    }
}
