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

import java.util.Objects;

import org.apache.commons.lang3.Validate;

/**
 * Identifies one tracked target. Slots are allocated and released outside of the tracker; the tracker only ever
 * fills in where each slot's target is now. Two slots are the same slot when their ids are equal.
 */
public final class Slot {
    private final Object id;

    private Slot(final Object id) {
        this.id = Validate.notNull(id, "A slot id can't be null");
    }

    public static Slot of(final Object id) {
        return new Slot(id);
    }

    public Object id() {
        return id;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null || getClass() != obj.getClass()) return false;
        return Objects.equals(id, ((Slot)obj).id);
    }

    @Override
    public String toString() {
        return "Slot[" + id + "]";
    }
}
