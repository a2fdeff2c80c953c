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

import java.util.Arrays;

import ai.kognition.finst.image.FloatImage;
import ai.kognition.finst.util.QuietCloseable;

/**
 * Two suppression maps. Each cycle composes into the {@link #back()} buffer and then {@link #swap()}s, so the map from
 * the cycle before stays readable while the next one is being built.
 */
public class SuppressionBuffers implements QuietCloseable {
    private FloatImage front;
    private FloatImage back;

    public SuppressionBuffers(final int width, final int height) {
        front = FloatImage.zeros(width, height);
        back = FloatImage.zeros(width, height);
    }

    /**
     * The most recently composed map.
     */
    public FloatImage front() {
        return front;
    }

    /**
     * The map the next cycle composes into.
     */
    public FloatImage back() {
        return back;
    }

    public void swap() {
        final FloatImage tmp = front;
        front = back;
        back = tmp;
    }

    @Override
    public void close() {
        QuietCloseable.closeAll(Arrays.asList(front, back));
    }
}
