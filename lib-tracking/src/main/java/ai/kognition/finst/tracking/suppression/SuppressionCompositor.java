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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Point;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.kernel.KernelCache;
import ai.kognition.finst.tracking.kernel.KernelSet;
import ai.kognition.finst.tracking.kernel.KernelSetBuilder;

/**
 * Composes the suppression map for one cycle. The map starts at {@code -targetCost} for every distinct tracked
 * region. Each tracked region then gets its big inhibitory kernel stamped at its center and each untracked candidate its
 * small one. The kernel for a region is chosen by the distance from the region's center to the gaze.
 * <p>
 * All stamping is additive so the order regions are stamped in doesn't change the result.
 */
public class SuppressionCompositor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionCompositor.class);

    private final KernelCache cache;
    private final KernelSetBuilder builder;
    private final double targetCost;

    public SuppressionCompositor(final KernelCache cache, final KernelSetBuilder builder) {
        this.cache = cache;
        this.builder = builder;
        this.targetCost = builder.config().targetCost;
    }

    /**
     * Overwrite {@code map} with the suppression field of the given regions.
     */
    public void compose(final FloatImage map, final Collection<Region> tracked, final Collection<Region> untracked, final Point gaze) {
        final Set<Region> distinctTracked = new LinkedHashSet<>(tracked);
        map.setTo(-targetCost * distinctTracked.size());

        stampAll(map, distinctTracked, gaze, KernelSet::big);
        stampAll(map, untracked, gaze, KernelSet::small);

        LOGGER.trace("Composed suppression map from {} tracked and {} untracked regions", distinctTracked.size(), untracked.size());
    }

    private void stampAll(final FloatImage map, final Collection<Region> regions, final Point gaze,
        final BiFunction<KernelSet, Integer, FloatImage> kernelForBucket) {
        for(final Region region: regions) {
            final KernelSet ks = cache.kernelsFor(region, builder);
            final int bucket = builder.buckets().bucketFor(region.center().distance(gaze));
            final Optional<Region> changed = map.stamp(kernelForBucket.apply(ks, bucket), region.centerX(), region.centerY());
            if(changed.isEmpty())
                LOGGER.trace("The kernel for {} doesn't overlap the map", region);
        }
    }
}
