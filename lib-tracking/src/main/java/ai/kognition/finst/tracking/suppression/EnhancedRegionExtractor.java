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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;
import ai.kognition.finst.tracking.kernel.KernelSet;

/**
 * Finds where a tracked target's own evidence beats the suppression from everything else.
 * <p>
 * The target's positive kernel (and its bias kernel, when the target has a bias region) is added to a copy of the
 * part of the map it covers. The enhanced region is the bounding box of the positive pixels within those kernels'
 * footprints. The map itself is never written.
 */
public class EnhancedRegionExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnhancedRegionExtractor.class);

    /**
     * @return the enhanced region or {@link Optional#empty()} if nothing in the kernel footprints came out positive.
     */
    public Optional<Region> extract(final FloatImage map, final Location prior, final KernelSet kernels) {
        final Region region = prior.region();
        final List<Stamp> stamps = new ArrayList<>(2);
        stamps.add(new Stamp(kernels.positive(), region.centerX(), region.centerY()));
        prior.bias().ifPresent(b -> stamps.add(new Stamp(kernels.bias(), b.centerX(), b.centerY())));

        Region cover = null;
        for(final Stamp s: stamps)
            cover = cover == null ? s.footprint() : cover.union(s.footprint());

        final Optional<Region> roi = cover.clip(map.width(), map.height());
        if(roi.isEmpty()) {
            LOGGER.trace("The kernels for {} are entirely off the map", prior);
            return Optional.empty();
        }

        final Region origin = roi.get();
        final List<Region> footprints = new ArrayList<>(stamps.size());
        try(final FloatImage local = map.copy(origin)) {
            for(final Stamp s: stamps) {
                local.stamp(s.kernel, s.centerX - origin.x, s.centerY - origin.y);
                footprints.add(s.footprint().translate(-origin.x, -origin.y));
            }
            final Optional<Region> ret = local.positiveBounds(footprints).map(r -> r.translate(origin.x, origin.y));
            LOGGER.trace("Enhanced region for {} is {}", prior, ret);
            return ret;
        }
    }

    private static class Stamp {
        final FloatImage kernel;
        final int centerX;
        final int centerY;

        Stamp(final FloatImage kernel, final int centerX, final int centerY) {
            this.kernel = kernel;
            this.centerX = centerX;
            this.centerY = centerY;
        }

        Region footprint() {
            return Region.centeredAt(centerX, centerY, kernel.width(), kernel.height());
        }
    }
}
