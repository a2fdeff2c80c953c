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

package ai.kognition.finst.tracking.match;

import ai.kognition.finst.image.geometry.Point;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;

/**
 * How the nearest neighbor matchers place and compare slots and candidates.
 */
public interface NearestMetric {

    /**
     * Region centers, the radius of the prior region, and straight line distance. A slot with a bias is placed midway
     * between its prior region and the bias.
     */
    NearestMetric EUCLIDEAN = new NearestMetric() {};

    default Point expectedCenter(final Location prior) {
        return prior.expectedCenter();
    }

    default Point center(final Region candidate) {
        return candidate.center();
    }

    /**
     * The length that {@code max-normed-distance} is measured in multiples of.
     */
    default double radius(final Location prior) {
        return prior.region().radius();
    }

    default double distanceSquared(final Point expected, final Point candidate) {
        return expected.distanceSquared(candidate);
    }
}
