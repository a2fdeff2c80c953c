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

import ai.kognition.finst.tracking.Slot;

/**
 * A (slot, candidate) pair with the squared distance between the slot's expected center and the candidate's center.
 */
public final class DistancePair implements GreedyAssignment.Pairing {
    private final Slot slot;
    private final int candidate;
    public final double distanceSquared;

    public DistancePair(final Slot slot, final int candidate, final double distanceSquared) {
        this.slot = slot;
        this.candidate = candidate;
        this.distanceSquared = distanceSquared;
    }

    @Override
    public Slot slot() {
        return slot;
    }

    @Override
    public int candidate() {
        return candidate;
    }

    @Override
    public String toString() {
        return "DistancePair[ " + slot + ", candidate=" + candidate + ", d2=" + distanceSquared + " ]";
    }
}
