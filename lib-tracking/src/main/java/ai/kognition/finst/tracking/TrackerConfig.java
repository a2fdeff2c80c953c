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

import static ai.kognition.finst.util.PropertiesUtils.getDouble;
import static ai.kognition.finst.util.PropertiesUtils.getDoubleList;
import static ai.kognition.finst.util.PropertiesUtils.getInt;
import static ai.kognition.finst.util.PropertiesUtils.getOptionalDouble;
import static ai.kognition.finst.util.PropertiesUtils.getString;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.tracking.match.MatcherImpl;
import ai.kognition.finst.util.PropertiesUtils;

/**
 * Every tunable of the tracker. Instances are immutable and are created either through {@link #builder(int, int)}
 * or from a {@link Properties} with {@link #fromProperties(Properties, String)}. The property names are:
 *
 * <pre>
 * <code>
 * prefix.image-width=640
 * prefix.image-height=480
 * prefix.matcher=SUPPRESSION
 * prefix.hat-k=1.0
 * prefix.hat-l=0
 * prefix.hat-neg-k=1.0
 * prefix.hat-neg-l=0
 * prefix.small-hat-k=0
 * prefix.hat-pos-radius-multi=1.5
 * prefix.pos-bias-radius-multi=1.0
 * prefix.pos-bias-strength-multi=2.5
 * prefix.num-hats=5
 * prefix.distance-buckets=0,80,160,240,320,400
 * prefix.width-thresh=0.3
 * prefix.ar-thresh=0.2
 * prefix.max-divisor=10
 * prefix.min-w=5
 * prefix.target-cost=0
 * prefix.noise-center=0.2
 * prefix.noise-width=0.15
 * prefix.viewing-width-degrees=15.375
 * prefix.max-distance=
 * prefix.max-normed-distance=
 * </code>
 * </pre>
 *
 * Only the image size is required.
 */
public final class TrackerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackerConfig.class);

    public final int imageWidth;
    public final int imageHeight;
    public final MatcherImpl matcher;

    public final double hatK;
    public final double hatL;
    public final double hatNegK;
    public final double hatNegL;
    public final double smallHatK;
    public final double hatPosRadiusMulti;
    public final double posBiasRadiusMulti;
    public final double posBiasStrengthMulti;

    public final int numHats;
    private final int[] distanceBounds;

    public final double widthThresh;
    public final double arThresh;
    public final int maxDivisor;
    public final double minW;

    public final double targetCost;
    public final double noiseCenter;
    public final double noiseWidth;
    public final double viewingWidthDegrees;

    public final Double maxDistance;
    public final Double maxNormedDistance;

    private TrackerConfig(final Builder b) {
        imageWidth = b.imageWidth;
        imageHeight = b.imageHeight;
        matcher = b.matcher;
        hatK = b.hatK;
        hatL = b.hatL;
        hatNegK = b.hatNegK;
        hatNegL = b.hatNegL;
        smallHatK = b.smallHatK;
        hatPosRadiusMulti = b.hatPosRadiusMulti;
        posBiasRadiusMulti = b.posBiasRadiusMulti;
        posBiasStrengthMulti = b.posBiasStrengthMulti;
        numHats = b.distanceBounds == null ? b.numHats : b.distanceBounds.length - 1;
        distanceBounds = b.distanceBounds == null ? defaultDistanceBounds(imageWidth, imageHeight, numHats) : b.distanceBounds;
        widthThresh = b.widthThresh;
        arThresh = b.arThresh;
        maxDivisor = b.maxDivisor;
        minW = b.minW;
        targetCost = b.targetCost;
        noiseCenter = b.noiseCenter;
        noiseWidth = b.noiseWidth;
        viewingWidthDegrees = b.viewingWidthDegrees;
        maxDistance = b.maxDistance;
        maxNormedDistance = b.maxNormedDistance;

        validateAscending(distanceBounds, "The distance buckets");
    }

    public static Builder builder(final int imageWidth, final int imageHeight) {
        return new Builder(imageWidth, imageHeight);
    }

    /**
     * The boundaries of the distance buckets, {@code numHats + 1} of them. Bucket {@code i} covers distances from the
     * gaze in {@code [bounds[i], bounds[i+1])}; anything past the last bound falls in the last bucket.
     */
    public int[] distanceBounds() {
        return distanceBounds.clone();
    }

    /**
     * Read a configuration out of the keys of {@code props} that start with {@code prefix + "."}.
     *
     * @throws IllegalArgumentException if a value can't be parsed, is out of range, or the image size is missing.
     */
    public static TrackerConfig fromProperties(final Properties props, final String prefix) {
        final Properties p = PropertiesUtils.getSection(props, prefix, true);

        final int width = getInt(p, "image-width", -1);
        final int height = getInt(p, "image-height", -1);
        Validate.isTrue(width > 0 && height > 0, "The properties \"%s.image-width\" and \"%s.image-height\" must both be set to positive values",
            prefix, prefix);

        final Builder b = builder(width, height)
            .matcher(parseMatcher(prefix, getString(p, "matcher", MatcherImpl.SUPPRESSION.name())))
            .hatK(getDouble(p, "hat-k", Builder.DEFAULT_HAT_K))
            .hatL(getDouble(p, "hat-l", Builder.DEFAULT_HAT_L))
            .hatNegK(getDouble(p, "hat-neg-k", Builder.DEFAULT_HAT_NEG_K))
            .hatNegL(getDouble(p, "hat-neg-l", Builder.DEFAULT_HAT_NEG_L))
            .smallHatK(getDouble(p, "small-hat-k", Builder.DEFAULT_SMALL_HAT_K))
            .hatPosRadiusMulti(getDouble(p, "hat-pos-radius-multi", Builder.DEFAULT_HAT_POS_RADIUS_MULTI))
            .posBiasRadiusMulti(getDouble(p, "pos-bias-radius-multi", Builder.DEFAULT_POS_BIAS_RADIUS_MULTI))
            .posBiasStrengthMulti(getDouble(p, "pos-bias-strength-multi", Builder.DEFAULT_POS_BIAS_STRENGTH_MULTI))
            .numHats(getInt(p, "num-hats", Builder.DEFAULT_NUM_HATS))
            .widthThresh(getDouble(p, "width-thresh", Builder.DEFAULT_WIDTH_THRESH))
            .arThresh(getDouble(p, "ar-thresh", Builder.DEFAULT_AR_THRESH))
            .maxDivisor(getInt(p, "max-divisor", Builder.DEFAULT_MAX_DIVISOR))
            .minW(getDouble(p, "min-w", Builder.DEFAULT_MIN_W))
            .targetCost(getDouble(p, "target-cost", Builder.DEFAULT_TARGET_COST))
            .noiseCenter(getDouble(p, "noise-center", Builder.DEFAULT_NOISE_CENTER))
            .noiseWidth(getDouble(p, "noise-width", Builder.DEFAULT_NOISE_WIDTH))
            .viewingWidthDegrees(getDouble(p, "viewing-width-degrees", Builder.DEFAULT_VIEWING_WIDTH_DEGREES))
            .maxDistance(getOptionalDouble(p, "max-distance"))
            .maxNormedDistance(getOptionalDouble(p, "max-normed-distance"));

        final List<Double> buckets = getDoubleList(p, "distance-buckets");
        if(buckets != null)
            b.distanceBuckets(buckets.stream().mapToInt(d -> (int)d.doubleValue()).toArray());

        final TrackerConfig ret = b.build();
        LOGGER.debug("Loaded tracker configuration from section \"{}\": {}", prefix, ret);
        return ret;
    }

    /**
     * Load a configuration from a classpath properties resource.
     *
     * @throws IllegalArgumentException if the resource can't be found or doesn't hold a valid configuration.
     */
    public static TrackerConfig load(final String resourceName, final String prefix) {
        final Properties props = new Properties();
        Validate.isTrue(PropertiesUtils.loadResource(props, resourceName), "Couldn't load the tracker configuration resource \"%s\"",
            resourceName);
        return fromProperties(props, prefix);
    }

    static int[] defaultDistanceBounds(final int imageWidth, final int imageHeight, final int numHats) {
        final int[] ret = new int[numHats + 1];
        final double halfWidth = imageWidth / 2.0;
        final double halfHeight = imageHeight / 2.0;
        for(int k = 0; k <= numHats; k++)
            ret[k] = (int)Math.hypot(halfWidth * k / numHats, halfHeight * k / numHats);
        return ret;
    }

    private static MatcherImpl parseMatcher(final String prefix, final String value) {
        try {
            return MatcherImpl.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch(final IllegalArgumentException iae) {
            throw new IllegalArgumentException("The property \"" + prefix + ".matcher\" should be one of " + Arrays.toString(MatcherImpl.values())
                + " but was \"" + value + "\"", iae);
        }
    }

    private static void validateAscending(final int[] bounds, final String what) {
        Validate.isTrue(bounds.length >= 2, "%s need at least 2 boundaries but there were %d", what, bounds.length);
        Validate.isTrue(bounds[0] >= 0, "%s can't start at a negative distance: %s", what, Arrays.toString(bounds));
        for(int i = 1; i < bounds.length; i++)
            Validate.isTrue(bounds[i] > bounds[i - 1], "%s must be strictly ascending: %s", what, Arrays.toString(bounds));
    }

    @Override
    public String toString() {
        return "TrackerConfig [imageWidth=" + imageWidth + ", imageHeight=" + imageHeight + ", matcher=" + matcher + ", hatK=" + hatK + ", hatL=" + hatL
            + ", hatNegK=" + hatNegK + ", hatNegL=" + hatNegL + ", smallHatK=" + smallHatK + ", hatPosRadiusMulti=" + hatPosRadiusMulti
            + ", posBiasRadiusMulti=" + posBiasRadiusMulti + ", posBiasStrengthMulti=" + posBiasStrengthMulti + ", numHats=" + numHats
            + ", distanceBounds=" + Arrays.toString(distanceBounds) + ", widthThresh=" + widthThresh + ", arThresh=" + arThresh + ", maxDivisor="
            + maxDivisor + ", minW=" + minW + ", targetCost=" + targetCost + ", noiseCenter=" + noiseCenter + ", noiseWidth=" + noiseWidth
            + ", viewingWidthDegrees=" + viewingWidthDegrees + ", maxDistance=" + maxDistance + ", maxNormedDistance=" + maxNormedDistance + "]";
    }

    public static class Builder {
        public static final double DEFAULT_HAT_K = 1.0;
        public static final double DEFAULT_HAT_L = 0.0;
        public static final double DEFAULT_HAT_NEG_K = 1.0;
        public static final double DEFAULT_HAT_NEG_L = 0.0;
        public static final double DEFAULT_SMALL_HAT_K = 0.0;
        public static final double DEFAULT_HAT_POS_RADIUS_MULTI = 1.5;
        public static final double DEFAULT_POS_BIAS_RADIUS_MULTI = 1.0;
        public static final double DEFAULT_POS_BIAS_STRENGTH_MULTI = 2.5;
        public static final int DEFAULT_NUM_HATS = 5;
        public static final double DEFAULT_WIDTH_THRESH = 0.3;
        public static final double DEFAULT_AR_THRESH = 0.2;
        public static final int DEFAULT_MAX_DIVISOR = 10;
        public static final double DEFAULT_MIN_W = 5.0;
        public static final double DEFAULT_TARGET_COST = 0.0;
        public static final double DEFAULT_NOISE_CENTER = 0.2;
        public static final double DEFAULT_NOISE_WIDTH = 0.15;
        public static final double DEFAULT_VIEWING_WIDTH_DEGREES = 15.375;

        private final int imageWidth;
        private final int imageHeight;
        private MatcherImpl matcher = MatcherImpl.SUPPRESSION;
        private double hatK = DEFAULT_HAT_K;
        private double hatL = DEFAULT_HAT_L;
        private double hatNegK = DEFAULT_HAT_NEG_K;
        private double hatNegL = DEFAULT_HAT_NEG_L;
        private double smallHatK = DEFAULT_SMALL_HAT_K;
        private double hatPosRadiusMulti = DEFAULT_HAT_POS_RADIUS_MULTI;
        private double posBiasRadiusMulti = DEFAULT_POS_BIAS_RADIUS_MULTI;
        private double posBiasStrengthMulti = DEFAULT_POS_BIAS_STRENGTH_MULTI;
        private int numHats = DEFAULT_NUM_HATS;
        private int[] distanceBounds = null;
        private double widthThresh = DEFAULT_WIDTH_THRESH;
        private double arThresh = DEFAULT_AR_THRESH;
        private int maxDivisor = DEFAULT_MAX_DIVISOR;
        private double minW = DEFAULT_MIN_W;
        private double targetCost = DEFAULT_TARGET_COST;
        private double noiseCenter = DEFAULT_NOISE_CENTER;
        private double noiseWidth = DEFAULT_NOISE_WIDTH;
        private double viewingWidthDegrees = DEFAULT_VIEWING_WIDTH_DEGREES;
        private Double maxDistance = null;
        private Double maxNormedDistance = null;

        private Builder(final int imageWidth, final int imageHeight) {
            Validate.isTrue(imageWidth > 0 && imageHeight > 0, "The image size must be positive but was %d x %d", imageWidth, imageHeight);
            this.imageWidth = imageWidth;
            this.imageHeight = imageHeight;
        }

        public Builder matcher(final MatcherImpl matcher) {
            this.matcher = Validate.notNull(matcher, "matcher");
            return this;
        }

        public Builder hatK(final double hatK) {
            this.hatK = hatK;
            return this;
        }

        public Builder hatL(final double hatL) {
            this.hatL = hatL;
            return this;
        }

        public Builder hatNegK(final double hatNegK) {
            this.hatNegK = hatNegK;
            return this;
        }

        public Builder hatNegL(final double hatNegL) {
            this.hatNegL = hatNegL;
            return this;
        }

        public Builder smallHatK(final double smallHatK) {
            this.smallHatK = smallHatK;
            return this;
        }

        public Builder hatPosRadiusMulti(final double hatPosRadiusMulti) {
            Validate.isTrue(hatPosRadiusMulti > 0, "hat-pos-radius-multi must be positive but was %f", hatPosRadiusMulti);
            this.hatPosRadiusMulti = hatPosRadiusMulti;
            return this;
        }

        public Builder posBiasRadiusMulti(final double posBiasRadiusMulti) {
            Validate.isTrue(posBiasRadiusMulti >= 0, "pos-bias-radius-multi can't be negative but was %f", posBiasRadiusMulti);
            this.posBiasRadiusMulti = posBiasRadiusMulti;
            return this;
        }

        public Builder posBiasStrengthMulti(final double posBiasStrengthMulti) {
            this.posBiasStrengthMulti = posBiasStrengthMulti;
            return this;
        }

        public Builder numHats(final int numHats) {
            Validate.isTrue(numHats >= 1, "num-hats must be at least 1 but was %d", numHats);
            this.numHats = numHats;
            return this;
        }

        /**
         * Set the distance bucket boundaries explicitly rather than deriving them from the image size. There must be
         * at least two, they must be strictly ascending, and their count minus one replaces {@code num-hats}.
         */
        public Builder distanceBuckets(final int... bounds) {
            Validate.notNull(bounds, "distance-buckets");
            validateAscending(bounds, "The distance buckets");
            this.distanceBounds = bounds.clone();
            return this;
        }

        public Builder widthThresh(final double widthThresh) {
            Validate.isTrue(widthThresh >= 0, "width-thresh can't be negative but was %f", widthThresh);
            this.widthThresh = widthThresh;
            return this;
        }

        public Builder arThresh(final double arThresh) {
            Validate.isTrue(arThresh >= 0, "ar-thresh can't be negative but was %f", arThresh);
            this.arThresh = arThresh;
            return this;
        }

        public Builder maxDivisor(final int maxDivisor) {
            Validate.isTrue(maxDivisor >= 1, "max-divisor must be at least 1 but was %d", maxDivisor);
            this.maxDivisor = maxDivisor;
            return this;
        }

        public Builder minW(final double minW) {
            Validate.isTrue(minW >= 0, "min-w can't be negative but was %f", minW);
            this.minW = minW;
            return this;
        }

        public Builder targetCost(final double targetCost) {
            this.targetCost = targetCost;
            return this;
        }

        public Builder noiseCenter(final double noiseCenter) {
            this.noiseCenter = noiseCenter;
            return this;
        }

        public Builder noiseWidth(final double noiseWidth) {
            Validate.isTrue(noiseWidth >= 0, "noise-width can't be negative but was %f", noiseWidth);
            this.noiseWidth = noiseWidth;
            return this;
        }

        public Builder viewingWidthDegrees(final double viewingWidthDegrees) {
            Validate.isTrue(viewingWidthDegrees > 0, "viewing-width-degrees must be positive but was %f", viewingWidthDegrees);
            this.viewingWidthDegrees = viewingWidthDegrees;
            return this;
        }

        /**
         * @param maxDistance the farthest, in pixels, a candidate's center may be from a slot's expected center for the
         *     nearest neighbor matchers to consider it. {@code null} means no limit.
         */
        public Builder maxDistance(final Double maxDistance) {
            Validate.isTrue(maxDistance == null || maxDistance >= 0, "max-distance can't be negative but was %s", (Object)maxDistance);
            this.maxDistance = maxDistance;
            return this;
        }

        /**
         * @param maxNormedDistance like {@link #maxDistance(Double)} but in multiples of the slot's prior region radius.
         */
        public Builder maxNormedDistance(final Double maxNormedDistance) {
            Validate.isTrue(maxNormedDistance == null || maxNormedDistance >= 0, "max-normed-distance can't be negative but was %s",
                (Object)maxNormedDistance);
            this.maxNormedDistance = maxNormedDistance;
            return this;
        }

        public TrackerConfig build() {
            return new TrackerConfig(this);
        }
    }
}
