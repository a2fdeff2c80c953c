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

import ai.kognition.finst.image.geometry.Region;

/**
 * A coarse signature of a region's size and shape. Regions whose signatures {@link #matches match} share one
 * {@link KernelSet}.
 */
public final class ShapeIndex {

    public static enum Orientation {
        ROUND, HORIZONTAL, VERTICAL
    }

    public final int minExtent;
    public final int maxExtent;
    public final double aspectRatio;
    public final Orientation orientation;

    private ShapeIndex(final int minExtent, final int maxExtent, final double aspectRatio, final Orientation orientation) {
        this.minExtent = minExtent;
        this.maxExtent = maxExtent;
        this.aspectRatio = aspectRatio;
        this.orientation = orientation;
    }

    /**
     * @param arThresh a region whose aspect ratio is within this of 1 is {@link Orientation#ROUND}.
     */
    public static ShapeIndex of(final Region region, final double arThresh) {
        final int min = region.minExtent();
        final int max = region.maxExtent();
        final double ar = (double)min / max;
        final Orientation orientation;
        if(1.0 - ar <= arThresh)
            orientation = Orientation.ROUND;
        else
            orientation = region.width > region.height ? Orientation.HORIZONTAL : Orientation.VERTICAL;
        return new ShapeIndex(min, max, ar, orientation);
    }

    /**
     * Two indices match when both their min extents and their max extents are within {@code widthThresh} of each other
     * (measured as {@code 1 - smaller/larger}), their aspect ratios are within {@code arThresh}, and they have the
     * same orientation.
     */
    public boolean matches(final ShapeIndex other, final double widthThresh, final double arThresh) {
        return relativeDifference(minExtent, other.minExtent) <= widthThresh
            && relativeDifference(maxExtent, other.maxExtent) <= widthThresh
            && Math.abs(aspectRatio - other.aspectRatio) <= arThresh
            && orientation == other.orientation;
    }

    private static double relativeDifference(final int a, final int b) {
        return 1.0 - ((double)Math.min(a, b) / Math.max(a, b));
    }

    @Override
    public String toString() {
        return "ShapeIndex [min=" + minExtent + ", max=" + maxExtent + ", ar=" + aspectRatio + ", " + orientation + "]";
    }
}
