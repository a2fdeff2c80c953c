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

import ai.kognition.finst.tracking.TrackerConfig;

/**
 * The available {@link CorrespondenceMatcher}s.
 */
public enum MatcherImpl {
    SUPPRESSION {
        @Override
        public SuppressionScoredMatcher newMatcher(final TrackerConfig config) {
            return new SuppressionScoredMatcher(config);
        }

        @Override
        public boolean usesSuppression() {
            return true;
        }
    },
    ONE_TO_ONE {
        @Override
        public OneToOneNearestMatcher newMatcher(final TrackerConfig config) {
            return new OneToOneNearestMatcher(config);
        }

        @Override
        public boolean usesSuppression() {
            return false;
        }
    },
    NEAREST {
        @Override
        public NearestNeighborMatcher newMatcher(final TrackerConfig config) {
            return new NearestNeighborMatcher(config);
        }

        @Override
        public boolean usesSuppression() {
            return false;
        }
    };

    public abstract CorrespondenceMatcher newMatcher(TrackerConfig config);

    /**
     * Whether this matcher needs the suppression map and enhanced regions. When it doesn't the tracker skips building
     * them.
     */
    public abstract boolean usesSuppression();
}
