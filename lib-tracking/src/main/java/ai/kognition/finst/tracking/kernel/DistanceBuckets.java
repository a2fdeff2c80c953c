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

import java.util.Arrays;

import ai.kognition.finst.tracking.TrackerConfig;

/**
 * The distance-from-gaze buckets. Targets farther from the gaze get kernels with a wider inhibitory surround.
 */
public final class DistanceBuckets {
    private final int[] bounds;

    public DistanceBuckets(final int[] bounds) {
        this.bounds = bounds.clone();
    }

    public static DistanceBuckets of(final TrackerConfig config) {
        return new DistanceBuckets(config.distanceBounds());
    }

    public int count() {
        return bounds.length - 1;
    }

    public int lowerBound(final int bucket) {
        return bounds[bucket];
    }

    public int upperBound(final int bucket) {
        return bounds[bucket + 1];
    }

    /**
     * A quarter of the sum of the bucket's bounds, which is half of the bucket's average distance.
     */
    public double halfAverage(final int bucket) {
        return (bounds[bucket] + bounds[bucket + 1]) / 4.0;
    }

    /**
     * The bucket with the largest lower bound that's {@code <= distance}. Distances short of the first bound are put
     * in the first bucket and distances past the last bound in the last.
     */
    public int bucketFor(final double distance) {
        for(int i = count() - 1; i > 0; i--) {
            if(bounds[i] <= distance)
                return i;
        }
        return 0;
    }

    @Override
    public String toString() {
        return "DistanceBuckets " + Arrays.toString(bounds);
    }
}
