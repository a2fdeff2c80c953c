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

package ai.kognition.finst.image;

import java.util.Collection;
import java.util.Optional;

import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.util.QuietCloseable;

/**
 * A single channel, floating point image. This is the one image abstraction the tracker computes with;
 * everything that depends on how the pixels are actually stored is confined to implementations of this
 * interface. The implementation used by default, {@link CvFloatImage}, keeps the pixels in an OpenCV
 * {@code CV_32FC1} matrix in main memory.
 * <p>
 * Coordinates are {@code (x, y)} = {@code (column, row)}. Images own native memory and must be closed.
 */
public interface FloatImage extends QuietCloseable {

    public static FloatImage zeros(final int width, final int height) {
        return CvFloatImage.zeros(width, height);
    }

    /**
     * @param pixels row major pixel values. There must be exactly {@code width * height} of them.
     */
    public static FloatImage fromPixels(final int width, final int height, final float[] pixels) {
        return CvFloatImage.fromPixels(width, height, pixels);
    }

    int width();

    int height();

    default Region bounds() {
        return Region.of(0, 0, width(), height());
    }

    float get(int x, int y);

    /**
     * @return a row major copy of every pixel value.
     */
    float[] pixels();

    void setTo(double value);

    /**
     * Add {@code kernel} to this image with the kernel's center pixel over {@code (centerX, centerY)}. Any part
     * of the kernel that falls off of this image is ignored.
     *
     * @return the area of this image that was changed or {@link Optional#empty()} if the kernel didn't
     *     overlap the image at all.
     */
    Optional<Region> stamp(FloatImage kernel, int centerX, int centerY);

    /**
     * @param roi must lie entirely within this image.
     * @return a new image containing a copy of the {@code roi}. <b>The caller owns the image returned.</b>
     */
    FloatImage copy(Region roi);

    default FloatImage copy() {
        return copy(bounds());
    }

    /**
     * @return a new, bilinearly interpolated image of the given size. <b>The caller owns the image returned.</b>
     */
    FloatImage resize(int newWidth, int newHeight);

    /**
     * Find the bounding box of every pixel that's strictly greater than zero and that also falls within at
     * least one of the {@code within} regions.
     *
     * @return {@link Optional#empty()} if there are no such pixels.
     */
    Optional<Region> positiveBounds(Collection<Region> within);
}
