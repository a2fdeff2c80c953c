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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.Validate;

import ai.kognition.finst.image.geometry.Point;
import ai.kognition.finst.image.geometry.Region;

/**
 * Everything the tracker needs for one cycle. Use {@link #builder()}.
 */
public final class CycleInput {
    private final List<Region> candidates;
    private final Point gaze;
    private final Map<Slot, Location> priors;
    private final boolean saccadeInProgress;

    private CycleInput(final Builder b) {
        candidates = Collections.unmodifiableList(new ArrayList<>(b.candidates));
        gaze = b.gaze;
        priors = Collections.unmodifiableMap(new LinkedHashMap<>(b.priors));
        saccadeInProgress = b.saccadeInProgress;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * This cycle's candidate regions. A candidate is identified by its position in this list.
     */
    public List<Region> candidates() {
        return candidates;
    }

    /**
     * Where the gaze is. When not given the tracker uses the center of the image.
     */
    public Optional<Point> gaze() {
        return Optional.ofNullable(gaze);
    }

    /**
     * Where every tracked slot was last seen, in the order the slots were added.
     */
    public Map<Slot, Location> priors() {
        return priors;
    }

    public boolean saccadeInProgress() {
        return saccadeInProgress;
    }

    public static class Builder {
        private final List<Region> candidates = new ArrayList<>();
        private Point gaze = null;
        private final Map<Slot, Location> priors = new LinkedHashMap<>();
        private boolean saccadeInProgress = false;

        private Builder() {}

        public Builder candidates(final Collection<Region> candidates) {
            Validate.noNullElements(candidates, "Candidate %d is null");
            this.candidates.addAll(candidates);
            return this;
        }

        public Builder candidate(final Region candidate) {
            this.candidates.add(Validate.notNull(candidate, "A candidate can't be null"));
            return this;
        }

        public Builder gaze(final Point gaze) {
            this.gaze = gaze;
            return this;
        }

        public Builder prior(final Location prior) {
            Validate.notNull(prior, "A prior location can't be null");
            Validate.isTrue(!priors.containsKey(prior.slot()), "There's already a prior location for %s", prior.slot());
            priors.put(prior.slot(), prior);
            return this;
        }

        public Builder priors(final Collection<Location> priors) {
            Validate.notNull(priors, "priors");
            priors.forEach(this::prior);
            return this;
        }

        /**
         * @throws IllegalArgumentException if any location is keyed under a slot other than its own.
         */
        public Builder priors(final Map<Slot, Location> priors) {
            Validate.notNull(priors, "priors");
            priors.forEach((slot, loc) -> {
                Validate.notNull(loc, "The prior location for %s is null", slot);
                Validate.isTrue(slot.equals(loc.slot()), "The prior location %s is keyed under a different slot, %s", loc, slot);
                prior(loc);
            });
            return this;
        }

        public Builder saccadeInProgress(final boolean saccadeInProgress) {
            this.saccadeInProgress = saccadeInProgress;
            return this;
        }

        public CycleInput build() {
            return new CycleInput(this);
        }
    }
}
