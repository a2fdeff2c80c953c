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
import java.util.Objects;

import ai.kognition.finst.tracking.TrackerConfig;

/**
 * Everything besides the target's shape that goes into building a {@link KernelSet}. Two sets built from different
 * parameters aren't interchangeable even when their shapes match, so a {@link KernelCache} shared by trackers with
 * different configurations keeps their kernels apart.
 */
public final class KernelParameters {
    private final int[] distanceBounds;
    private final double[] hat;
    private final int maxDivisor;
    private final double arThresh;

    private KernelParameters(final int[] distanceBounds, final double[] hat, final int maxDivisor, final double arThresh) {
        this.distanceBounds = distanceBounds;
        this.hat = hat;
        this.maxDivisor = maxDivisor;
        this.arThresh = arThresh;
    }

    public static KernelParameters of(final TrackerConfig config) {
        return new KernelParameters(config.distanceBounds(), new double[] {
            config.hatK, config.hatL, config.hatNegK, config.hatNegL, config.smallHatK,
            config.hatPosRadiusMulti, config.posBiasRadiusMulti, config.posBiasStrengthMulti, config.minW
        }, config.maxDivisor, config.arThresh);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null || getClass() != obj.getClass())
            return false;
        final KernelParameters other = (KernelParameters)obj;
        return maxDivisor == other.maxDivisor && Double.compare(arThresh, other.arThresh) == 0 && Arrays.equals(distanceBounds, other.distanceBounds)
            && Arrays.equals(hat, other.hat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(distanceBounds), Arrays.hashCode(hat), maxDivisor, arThresh);
    }

    @Override
    public String toString() {
        return "KernelParameters [buckets=" + Arrays.toString(distanceBounds) + ", hat=" + Arrays.toString(hat) + ", maxDivisor=" + maxDivisor
            + ", arThresh=" + arThresh + "]";
    }
}
