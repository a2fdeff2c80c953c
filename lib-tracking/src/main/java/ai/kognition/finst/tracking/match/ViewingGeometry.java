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
 * Converts pixel distances to degrees of visual angle, given how many degrees the full image width spans.
 */
public final class ViewingGeometry {
    private final double degreesPerPixel;

    public ViewingGeometry(final double viewingWidthDegrees, final int imageWidth) {
        this.degreesPerPixel = viewingWidthDegrees / imageWidth;
    }

    public double toDegrees(final double pixels) {
        return pixels * degreesPerPixel;
    }
}
