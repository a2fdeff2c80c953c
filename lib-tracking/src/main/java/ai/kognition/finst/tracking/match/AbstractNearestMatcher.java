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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.lang3.Validate;

import ai.kognition.finst.image.geometry.Point;
import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.tracking.Location;

/**
 * Common ground for the nearest neighbor matchers: distances from each slot's expected center and the optional
 * distance caps.
 */
public abstract class AbstractNearestMatcher implements CorrespondenceMatcher {
    protected final Double maxDistance;
    protected final Double maxNormedDistance;
    protected final NearestMetric metric;

    /**
     * @param maxDistance pairs farther apart than this many pixels are never matched. {@code null} for no limit.
     * @param maxNormedDistance pairs farther apart than this many multiples of the slot's prior region radius are never
     *     matched. {@code null} for no limit.
     * @param metric where slots and candidates are and how far apart they are. Both caps are in its units.
     */
    protected AbstractNearestMatcher(final Double maxDistance, final Double maxNormedDistance, final NearestMetric metric) {
        this.maxDistance = maxDistance;
        this.maxNormedDistance = maxNormedDistance;
        this.metric = Validate.notNull(metric, "metric");
    }

    /**
     * Every (slot, candidate) pair within the caps, in slot then candidate order.
     */
    protected List<DistancePair> eligiblePairs(final Collection<Location> priors, final List<Region> candidates) {
        final List<DistancePair> ret = new ArrayList<>();
        for(final Location prior: priors) {
            final Point expected = metric.expectedCenter(prior);
            final double radius = metric.radius(prior);
            for(int i = 0; i < candidates.size(); i++) {
                final double d2 = metric.distanceSquared(expected, metric.center(candidates.get(i)));
                if(withinCaps(Math.sqrt(d2), radius))
                    ret.add(new DistancePair(prior.slot(), i, d2));
            }
        }
        return ret;
    }

    boolean withinCaps(final double distance, final double priorRadius) {
        if(maxDistance != null && distance > maxDistance)
            return false;
        if(maxNormedDistance != null) {
            final double normed = priorRadius > 0 ? distance / priorRadius : (distance == 0 ? 0 : Double.POSITIVE_INFINITY);
            if(normed > maxNormedDistance)
                return false;
        }
        return true;
    }
}
