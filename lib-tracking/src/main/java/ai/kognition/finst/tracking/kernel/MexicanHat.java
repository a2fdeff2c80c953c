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

import org.apache.commons.lang3.Validate;

import ai.kognition.finst.image.FloatImage;

/**
 * A radially symmetric center-surround ("Mexican hat") profile and the square image it produces.
 * <p>
 * The profile is the Ricker wavelet evaluated over a warped distance so that the excitatory (positive) lobe ends
 * exactly at {@code w} and the inhibitory (negative) lobe is stretched by {@code wNeg}. Positive and negative values
 * each get their own amplitude and baseline:
 *
 * <pre>
 * u     = i / w                  when i &lt; w
 *       = 1 + (i - w) / wNeg     otherwise
 * value = ricker(u)
 * pixel = l + k * value          when value &gt; 0
 *       = lNeg + kNeg * value    otherwise
 * </pre>
 *
 * Instances are immutable. Use {@link #builder()}.
 */
public final class MexicanHat {
    private static final double NORM = 2.0 / (Math.sqrt(3.0) * Math.pow(Math.PI, 0.25));

    public final double w;
    public final double wNeg;
    public final double k;
    public final double l;
    public final double kNeg;
    public final double lNeg;
    public final int radius;

    private MexicanHat(final Builder b) {
        Validate.isTrue(b.w >= 0, "The excitatory radius can't be negative but was %f", b.w);
        Validate.isTrue(b.wNeg > 0, "The inhibitory half width must be positive but was %f", b.wNeg);
        Validate.isTrue(b.radius >= 0, "The image radius can't be negative but was %d", b.radius);
        w = b.w;
        wNeg = b.wNeg;
        k = b.k;
        l = b.l;
        kNeg = b.kNeg;
        lNeg = b.lNeg;
        radius = b.radius;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The normalized Ricker wavelet.
     */
    public static double wavelet(final double x) {
        final double x2 = x * x;
        return NORM * (1.0 - x2) * Math.exp(-x2 / 2.0);
    }

    /**
     * The unscaled profile value at distance {@code i} from the center. Positive inside {@code w}, zero at {@code w}
     * and negative past it.
     */
    public double profile(final double i) {
        final double u = i < w ? i / w : 1.0 + ((i - w) / wNeg);
        return wavelet(u);
    }

    /**
     * The output pixel value at distance {@code i} from the center.
     */
    public double pixel(final double i) {
        final double value = profile(i);
        return value > 0 ? l + (k * value) : lNeg + (kNeg * value);
    }

    public int side() {
        return (2 * radius) + 1;
    }

    /**
     * The full resolution kernel image, {@link #side()} pixels square. <b>The caller owns the image returned.</b>
     */
    public FloatImage build() {
        final int side = side();
        final float[] px = new float[side * side];
        for(int y = 0; y < side; y++) {
            for(int x = 0; x < side; x++)
                px[(y * side) + x] = (float)pixel(Math.hypot(x - radius, y - radius));
        }
        return FloatImage.fromPixels(side, side, px);
    }

    public Builder toBuilder() {
        return new Builder().w(w).wNeg(wNeg).k(k).l(l).kNeg(kNeg).lNeg(lNeg).radius(radius);
    }

    @Override
    public String toString() {
        return "MexicanHat [w=" + w + ", wNeg=" + wNeg + ", k=" + k + ", l=" + l + ", kNeg=" + kNeg + ", lNeg=" + lNeg + ", radius=" + radius + "]";
    }

    public static class Builder {
        private double w = 1.0;
        private double wNeg = 1.0;
        private double k = 1.0;
        private double l = 0.0;
        private double kNeg = 1.0;
        private double lNeg = 0.0;
        private int radius = 1;

        private Builder() {}

        public Builder w(final double w) {
            this.w = w;
            return this;
        }

        public Builder wNeg(final double wNeg) {
            this.wNeg = wNeg;
            return this;
        }

        public Builder k(final double k) {
            this.k = k;
            return this;
        }

        public Builder l(final double l) {
            this.l = l;
            return this;
        }

        public Builder kNeg(final double kNeg) {
            this.kNeg = kNeg;
            return this;
        }

        public Builder lNeg(final double lNeg) {
            this.lNeg = lNeg;
            return this;
        }

        public Builder radius(final int radius) {
            this.radius = radius;
            return this;
        }

        public MexicanHat build() {
            return new MexicanHat(this);
        }
    }
}
