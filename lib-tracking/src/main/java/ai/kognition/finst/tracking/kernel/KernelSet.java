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
import java.util.Collections;
import java.util.List;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.util.QuietCloseable;

/**
 * Every kernel image needed for targets of one {@link ShapeIndex}. A {@link KernelSet} owns its images and releases
 * them on {@link #close()}.
 */
public final class KernelSet implements QuietCloseable {
    public final ShapeIndex shape;
    public final KernelParameters parameters;
    public final double enhanceRadius;
    public final int biasRadius;

    private final FloatImage positive;
    private final List<FloatImage> big;
    private final List<FloatImage> small;
    private final FloatImage bias;

    KernelSet(final ShapeIndex shape, final KernelParameters parameters, final double enhanceRadius, final FloatImage positive,
        final List<FloatImage> big, final List<FloatImage> small, final int biasRadius, final FloatImage bias) {
        this.shape = shape;
        this.parameters = parameters;
        this.enhanceRadius = enhanceRadius;
        this.positive = positive;
        this.big = Collections.unmodifiableList(new ArrayList<>(big));
        this.small = Collections.unmodifiableList(new ArrayList<>(small));
        this.biasRadius = biasRadius;
        this.bias = bias;
    }

    /**
     * The excitatory lobe alone. Used to enhance a tracked target against the suppression map.
     */
    public FloatImage positive() {
        return positive;
    }

    /**
     * The inhibitory surround stamped for a tracked target in distance bucket {@code bucket}.
     */
    public FloatImage big(final int bucket) {
        return big.get(bucket);
    }

    /**
     * The weaker inhibitory surround stamped for an untracked candidate in distance bucket {@code bucket}.
     */
    public FloatImage small(final int bucket) {
        return small.get(bucket);
    }

    public FloatImage bias() {
        return bias;
    }

    public int bucketCount() {
        return big.size();
    }

    @Override
    public void close() {
        final List<FloatImage> all = new ArrayList<>(big);
        all.addAll(small);
        all.add(positive);
        all.add(bias);
        QuietCloseable.closeAll(all);
    }

    @Override
    public String toString() {
        return "KernelSet [" + shape + ", enhanceRadius=" + enhanceRadius + ", biasRadius=" + biasRadius + ", buckets=" + big.size() + "]";
    }
}
