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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import ai.kognition.finst.image.geometry.Region;

public class CvFloatImageTest {
    private static final float EPSILON = 1e-6f;

    private static FloatImage filled(final int width, final int height, final float value) {
        final float[] px = new float[width * height];
        Arrays.fill(px, value);
        return FloatImage.fromPixels(width, height, px);
    }

    @Test
    public void fromPixelsIsRowMajor() {
        try(final FloatImage image = FloatImage.fromPixels(3, 2, new float[] {0, 1, 2, 3, 4, 5})) {
            assertEquals(3, image.width());
            assertEquals(2, image.height());
            assertEquals(2f, image.get(2, 0), EPSILON);
            assertEquals(3f, image.get(0, 1), EPSILON);
            assertArrayEquals(new float[] {0, 1, 2, 3, 4, 5}, image.pixels(), EPSILON);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromPixelsChecksTheLength() {
        FloatImage.fromPixels(3, 2, new float[5]);
    }

    @Test
    public void stampInsideAdds() {
        try(final FloatImage image = FloatImage.zeros(10, 10);
            final FloatImage kernel = filled(3, 3, 2f);) {
            image.setTo(1.0);
            assertEquals(Optional.of(Region.of(4, 4, 3, 3)), image.stamp(kernel, 5, 5));
            assertEquals(Optional.of(Region.of(5, 5, 3, 3)), image.stamp(kernel, 6, 6));

            assertEquals(3f, image.get(4, 4), EPSILON);
            assertEquals(5f, image.get(5, 5), EPSILON);
            assertEquals(5f, image.get(6, 6), EPSILON);
            assertEquals(3f, image.get(7, 7), EPSILON);
            assertEquals(1f, image.get(3, 3), EPSILON);
            assertEquals(1f, image.get(8, 8), EPSILON);
        }
    }

    @Test
    public void stampIsClippedAtTheEdges() {
        try(final FloatImage image = FloatImage.zeros(10, 10);
            final FloatImage kernel = FloatImage.fromPixels(3, 3, new float[] {1, 2, 3, 4, 5, 6, 7, 8, 9})) {
            assertEquals(Optional.of(Region.of(0, 0, 2, 2)), image.stamp(kernel, 0, 0));
            // only the lower right 2x2 of the kernel lands
            assertEquals(5f, image.get(0, 0), EPSILON);
            assertEquals(6f, image.get(1, 0), EPSILON);
            assertEquals(8f, image.get(0, 1), EPSILON);
            assertEquals(9f, image.get(1, 1), EPSILON);
            assertEquals(0f, image.get(2, 2), EPSILON);
        }
    }

    @Test
    public void stampOffTheImageDoesNothing() {
        try(final FloatImage image = FloatImage.zeros(10, 10);
            final FloatImage kernel = filled(3, 3, 1f);) {
            assertFalse(image.stamp(kernel, -2, 5).isPresent());
            assertFalse(image.stamp(kernel, 5, 11).isPresent());
            for(final float v: image.pixels())
                assertEquals(0f, v, EPSILON);
        }
    }

    @Test
    public void copyIsIndependent() {
        try(final FloatImage image = FloatImage.zeros(6, 6)) {
            image.setTo(2.0);
            try(final FloatImage copy = image.copy(Region.of(1, 2, 3, 2))) {
                assertEquals(3, copy.width());
                assertEquals(2, copy.height());
                copy.setTo(7.0);
                assertEquals(2f, image.get(1, 2), EPSILON);
                assertEquals(7f, copy.get(0, 0), EPSILON);
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void copyOutsideTheImageIsRejected() {
        try(final FloatImage image = FloatImage.zeros(6, 6)) {
            image.copy(Region.of(4, 4, 3, 3));
        }
    }

    @Test
    public void resizeKeepsConstantImagesConstant() {
        try(final FloatImage image = filled(3, 3, 4f);
            final FloatImage bigger = image.resize(9, 9);) {
            assertEquals(9, bigger.width());
            assertEquals(9, bigger.height());
            for(final float v: bigger.pixels())
                assertEquals(4f, v, 1e-4f);
        }
    }

    @Test
    public void positiveBoundsIsLimitedToTheFootprint() {
        try(final FloatImage image = FloatImage.zeros(20, 20)) {
            image.setTo(-1.0);
            try(final FloatImage blob = filled(3, 3, 2f);) {
                image.stamp(blob, 5, 5); // positive over 4..6
                image.stamp(blob, 15, 15); // positive over 14..16
            }

            final List<Region> justTheFirst = Collections.singletonList(Region.of(0, 0, 10, 10));
            assertEquals(Optional.of(Region.of(4, 4, 3, 3)), image.positiveBounds(justTheFirst));

            final List<Region> both = Arrays.asList(Region.of(0, 0, 10, 10), Region.of(12, 12, 20, 20));
            assertEquals(Optional.of(Region.of(4, 4, 13, 13)), image.positiveBounds(both));

            final List<Region> partial = Collections.singletonList(Region.of(5, 5, 10, 10));
            assertEquals(Optional.of(Region.of(5, 5, 10, 10)), image.positiveBounds(partial));
        }
    }

    @Test
    public void positiveBoundsOfNothing() {
        try(final FloatImage image = FloatImage.zeros(8, 8)) {
            assertFalse(image.positiveBounds(Collections.singletonList(image.bounds())).isPresent());
            image.setTo(1.0);
            assertFalse(image.positiveBounds(Collections.emptyList()).isPresent());
            assertTrue(image.positiveBounds(Collections.singletonList(image.bounds())).isPresent());
        }
    }
}
