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

import java.util.Optional;

import org.apache.commons.lang3.Validate;

import ai.kognition.finst.image.geometry.Point;
import ai.kognition.finst.image.geometry.Region;

/**
 * Where a slot's target was last seen and, optionally, where it's expected to be next (the bias region).
 */
public final class Location {
    private final Slot slot;
    private final Region region;
    private final Region bias;

    private Location(final Slot slot, final Region region, final Region bias) {
        this.slot = Validate.notNull(slot, "A location needs a slot");
        this.region = Validate.notNull(region, "The location for %s needs a region", slot);
        this.bias = bias;
    }

    public static Location of(final Slot slot, final Region region) {
        return new Location(slot, region, null);
    }

    public static Location withBias(final Slot slot, final Region region, final Region bias) {
        return new Location(slot, region, Validate.notNull(bias, "The bias region for %s can't be null", slot));
    }

    public Slot slot() {
        return slot;
    }

    public Region region() {
        return region;
    }

    public Optional<Region> bias() {
        return Optional.ofNullable(bias);
    }

    /**
     * The point the target is expected to be near. This is the region's center or, when there's a bias
     * region, halfway between the region's center and the bias region's center.
     */
    public Point expectedCenter() {
        return bias == null ? region.center() : region.center().midpoint(bias.center());
    }

    @Override
    public String toString() {
        return "Location[ " + slot + ", " + region + (bias == null ? "" : ", bias=" + bias) + " ]";
    }
}
