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

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.kognition.finst.tracking.Slot;

/**
 * Assigns candidates to slots by walking a list of (slot, candidate) pairs, best first, in two passes:
 * <ol>
 * <li>Each pair is taken if neither its slot nor its candidate has been taken yet.</li>
 * <li>Each pair is taken if its slot is still unassigned, even if the candidate was already given to another slot.</li>
 * </ol>
 * The second pass lets two targets share one candidate, as happens when one occludes the other.
 * <p>
 * This is greedy and so isn't guaranteed to find the best overall assignment.
 */
public final class GreedyAssignment {

    /**
     * One possible pairing of a slot with a candidate. Candidates are identified by their index in the cycle's
     * candidate list.
     */
    public static interface Pairing {
        Slot slot();

        int candidate();
    }

    private GreedyAssignment() {}

    /**
     * @param ordered the pairs, best first.
     * @return slot to candidate index for every slot that got one, in the order they were assigned.
     */
    public static Map<Slot, Integer> assign(final List<? extends Pairing> ordered) {
        final Map<Slot, Integer> ret = new LinkedHashMap<>();
        final Set<Integer> used = new HashSet<>();

        for(final Pairing p: ordered) {
            if(ret.containsKey(p.slot()) || used.contains(p.candidate()))
                continue;
            ret.put(p.slot(), p.candidate());
            used.add(p.candidate());
        }

        for(final Pairing p: ordered) {
            if(!ret.containsKey(p.slot()))
                ret.put(p.slot(), p.candidate());
        }
        return ret;
    }

}
