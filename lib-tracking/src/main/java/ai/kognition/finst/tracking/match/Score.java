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

/**
 * How strongly a candidate supports a slot. A score with a higher priority tier is always greater; within a tier the
 * larger overlap wins.
 * <ul>
 * <li>2: the candidate overlaps the slot's bias (expected next position).</li>
 * <li>1: the candidate overlaps the slot's enhanced region by more than the noise cutoff.</li>
 * <li>0: it doesn't.</li>
 * </ul>
 */
public final class Score implements Comparable<Score> {
    public static final int BIAS = 2;
    public static final int OVERLAP = 1;
    public static final int NONE = 0;

    public final double overlap;
    public final int priority;

    public Score(final double overlap, final int priority) {
        this.overlap = overlap;
        this.priority = priority;
    }

    public boolean isAssignable() {
        return priority >= OVERLAP;
    }

    @Override
    public int compareTo(final Score o) {
        final int ret = Integer.compare(priority, o.priority);
        return ret != 0 ? ret : Double.compare(overlap, o.overlap);
    }

    @Override
    public String toString() {
        return "Score[ overlap=" + overlap + ", priority=" + priority + " ]";
    }
}
