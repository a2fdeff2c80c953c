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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.TrackerConfig;
import ai.kognition.finst.util.QuietCloseable;
import ai.kognition.finst.util.Timer;

/**
 * Synthesizes the {@link KernelSet} for a region's shape.
 * <p>
 * Large kernels are evaluated at a reduced resolution and scaled back up. The divisor is the largest integer below
 * {@code max-divisor} that keeps the reduced excitatory radius above {@code min-w}. One evaluation pass per distance
 * bucket yields that bucket's big and small inhibitory kernels and, for the first bucket, the positive kernel.
 */
public class KernelSetBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(KernelSetBuilder.class);

    /**
     * How far past the excitatory radius, in multiples of a bucket's half average distance, the kernel image extends.
     */
    public static final double SURROUND_EXTENT = 1.75;

    private final TrackerConfig config;
    private final DistanceBuckets buckets;
    private final KernelParameters parameters;

    public KernelSetBuilder(final TrackerConfig config) {
        this.config = config;
        this.buckets = DistanceBuckets.of(config);
        this.parameters = KernelParameters.of(config);
    }

    public TrackerConfig config() {
        return config;
    }

    public DistanceBuckets buckets() {
        return buckets;
    }

    public KernelParameters parameters() {
        return parameters;
    }

    public ShapeIndex shapeIndex(final Region region) {
        return ShapeIndex.of(region, config.arThresh);
    }

    /**
     * <b>The caller owns the {@link KernelSet} returned.</b>
     */
    public KernelSet build(final Region region) {
        final Timer timer = LOGGER.isDebugEnabled() ? Timer.started() : null;
        final ShapeIndex shape = shapeIndex(region);
        final double halfWidth = shape.minExtent / 2.0;
        final double w = config.hatPosRadiusMulti * halfWidth;

        FloatImage positive = null;
        final List<FloatImage> big = new ArrayList<>(buckets.count());
        final List<FloatImage> small = new ArrayList<>(buckets.count());
        try {
            for(int i = 0; i < buckets.count(); i++) {
                final double halfAvg = buckets.halfAverage(i);
                final MexicanHat hat = MexicanHat.builder()
                    .w(w)
                    .wNeg(halfAvg / 2.0)
                    .k(config.hatK)
                    .l(config.hatL)
                    .kNeg(config.hatNegK)
                    .lNeg(config.hatNegL)
                    .radius((int)(w + (SURROUND_EXTENT * halfAvg)))
                    .build();
                final Pass pass = evaluate(hat, divisor(w, config.maxDivisor, config.minW), i == 0);
                if(pass.positive != null)
                    positive = pass.positive;
                big.add(pass.big);
                small.add(pass.small);
            }

            final int biasRadius = (int)(halfWidth * config.posBiasRadiusMulti);
            final FloatImage bias = MexicanHat.builder()
                .radius(biasRadius)
                .w(biasRadius)
                .k(config.posBiasStrengthMulti)
                .l(0)
                .kNeg(0)
                .wNeg(1)
                .lNeg(0)
                .build()
                .build();

            final KernelSet ret = new KernelSet(shape, parameters, w, positive, big, small, biasRadius, bias);
            if(timer != null)
                LOGGER.debug("Built {} for {} in {} seconds", ret, region, timer.stop());
            return ret;
        } catch(final RuntimeException rte) {
            final List<FloatImage> partial = new ArrayList<>(big);
            partial.addAll(small);
            partial.add(positive);
            QuietCloseable.closeAll(partial);
            throw rte;
        }
    }

    /**
     * The largest {@code d} in {@code [maxDivisor - 1 .. 1]} with {@code w / d > minW}, or 1 if there isn't one.
     */
    public static int divisor(final double w, final int maxDivisor, final double minW) {
        for(int d = maxDivisor - 1; d > 1; d--) {
            if(w / d > minW)
                return d;
        }
        return 1;
    }

    /**
     * The smallest odd number {@code >= n}.
     */
    public static int makeOdd(final int n) {
        return (n % 2 == 0) ? n + 1 : n;
    }

    private static class Pass {
        final FloatImage positive;
        final FloatImage big;
        final FloatImage small;

        Pass(final FloatImage positive, final FloatImage big, final FloatImage small) {
            this.positive = positive;
            this.big = big;
            this.small = small;
        }
    }

    private Pass evaluate(final MexicanHat hat, final int d, final boolean withPositive) {
        final double w = hat.w / d;
        final double wNeg = hat.wNeg / d;
        final int radius = hat.radius / d;
        final MexicanHat reduced = hat.toBuilder().w(w).wNeg(wNeg).radius(radius).build();

        final int side = reduced.side();
        final int posSide = Math.min(side, (2 * (int)w) + 1);
        final int posMin = (side - posSide) / 2;

        final float[] pos = withPositive ? new float[posSide * posSide] : null;
        final float[] big = new float[side * side];
        final float[] small = new float[side * side];
        for(int y = 0; y < side; y++) {
            for(int x = 0; x < side; x++) {
                final double value = reduced.profile(Math.hypot(x - radius, y - radius));
                final int idx = (y * side) + x;
                if(value > 0) {
                    final int px = x - posMin;
                    final int py = y - posMin;
                    if(pos != null && px >= 0 && py >= 0 && px < posSide && py < posSide)
                        pos[(py * posSide) + px] = (float)(hat.l + (hat.k * value));
                } else {
                    big[idx] = (float)(hat.lNeg + (hat.kNeg * value));
                    small[idx] = (float)(config.smallHatK * value);
                }
            }
        }

        final FloatImage bigImage = upscale(FloatImage.fromPixels(side, side, big), d);
        final FloatImage smallImage = upscale(FloatImage.fromPixels(side, side, small), d);
        final FloatImage posImage = pos == null ? null : upscale(FloatImage.fromPixels(posSide, posSide, pos), d);
        return new Pass(posImage, bigImage, smallImage);
    }

    private static FloatImage upscale(final FloatImage image, final int d) {
        if(d == 1)
            return image;
        try(final FloatImage reduced = image) {
            final int side = makeOdd((int)(reduced.width() * d));
            return reduced.resize(side, side);
        }
    }
}
