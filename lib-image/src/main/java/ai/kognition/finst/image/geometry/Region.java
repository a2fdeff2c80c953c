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

package ai.kognition.finst.image.geometry;

import java.util.Optional;

import org.apache.commons.lang3.Validate;
import org.opencv.core.Rect;

/**
 * An immutable, axis aligned rectangle in integer pixel coordinates. The maximum x and y are
 * inclusive so a region at {@code (x, y)} with a width of 1 covers exactly column {@code x}.
 * <p>
 * A {@link Region} always has a positive width and height. Attempting to create one without will
 * throw an {@link IllegalArgumentException}.
 */
public final class Region {
    public final int x;
    public final int y;
    public final int width;
    public final int height;

    private Region(final int x, final int y, final int width, final int height) {
        Validate.isTrue(width > 0, "A region must have a positive width but was given %d", width);
        Validate.isTrue(height > 0, "A region must have a positive height but was given %d", height);
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static Region of(final int x, final int y, final int width, final int height) {
        return new Region(x, y, width, height);
    }

    /**
     * A region of the given size centered on {@code (centerX, centerY)}. The size is expected to be odd,
     * as all kernel images are, otherwise the extra column/row ends up on the right/bottom.
     */
    public static Region centeredAt(final int centerX, final int centerY, final int width, final int height) {
        return new Region(centerX - ((width - 1) / 2), centerY - ((height - 1) / 2), width, height);
    }

    public static Region fromOcv(final Rect rect) {
        return new Region(rect.x, rect.y, rect.width, rect.height);
    }

    public Rect toOcv() {
        return new Rect(x, y, width, height);
    }

    public int maxX() {
        return x + width - 1;
    }

    public int maxY() {
        return y + height - 1;
    }

    public int centerX() {
        return (int)(x + ((width - 1) / 2.0));
    }

    public int centerY() {
        return (int)(y + ((height - 1) / 2.0));
    }

    public Point center() {
        return new SimplePoint(centerY(), centerX());
    }

    /**
     * The mean of the half extents along x and y.
     */
    public double radius() {
        return (((width - 1) / 2.0) + ((height - 1) / 2.0)) / 2.0;
    }

    public long area() {
        return (long)width * height;
    }

    public int minExtent() {
        return Math.min(width, height);
    }

    public int maxExtent() {
        return Math.max(width, height);
    }

    public boolean intersects(final Region other) {
        return !(maxX() < other.x || other.maxX() < x || maxY() < other.y || other.maxY() < y);
    }

    public boolean contains(final Region other) {
        return x <= other.x && y <= other.y && maxX() >= other.maxX() && maxY() >= other.maxY();
    }

    public Optional<Region> intersection(final Region other) {
        final int minX = Math.max(x, other.x);
        final int minY = Math.max(y, other.y);
        final int maxX = Math.min(maxX(), other.maxX());
        final int maxY = Math.min(maxY(), other.maxY());
        if(maxX < minX || maxY < minY)
            return Optional.empty();
        return Optional.of(new Region(minX, minY, maxX - minX + 1, maxY - minY + 1));
    }

    /**
     * The smallest region that contains both {@code this} and {@code other}.
     */
    public Region union(final Region other) {
        final int minX = Math.min(x, other.x);
        final int minY = Math.min(y, other.y);
        final int maxX = Math.max(maxX(), other.maxX());
        final int maxY = Math.max(maxY(), other.maxY());
        return new Region(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }

    /**
     * Crop this region to an image of the given size.
     *
     * @return {@link Optional#empty()} if the region lies entirely off the image.
     */
    public Optional<Region> clip(final int imageWidth, final int imageHeight) {
        return intersection(new Region(0, 0, imageWidth, imageHeight));
    }

    public Region translate(final int dx, final int dy) {
        return new Region(x + dx, y + dy, width, height);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + x;
        result = prime * result + y;
        result = prime * result + width;
        result = prime * result + height;
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final Region other = (Region)obj;
        return x == other.x && y == other.y && width == other.width && height == other.height;
    }

    @Override
    public String toString() {
        return "Region[ x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + " ]";
    }
}
