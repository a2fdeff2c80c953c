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

/**
 * A point in image coordinates. {@code x} is the column and {@code y} is the row.
 */
public interface Point {

    public static Point xy(final double x, final double y) {
        return new SimplePoint(y, x);
    }

    public static String toString(final Point p) {
        return p.getClass().getSimpleName() + "[ x=" + p.x() + ", y=" + p.y() + " ]";
    }

    public double getRow();

    public double getCol();

    default public double x() {
        return getCol();
    }

    default public double y() {
        return getRow();
    }

    /**
     * This will return a point that's translated such that if the point passed in
     * is the same as {@code this} then the result will be the [0, 0].
     *
     * It basically results in [ this - toOrigin ];
     */
    default public Point subtract(final Point toOrigin) {
        return new SimplePoint(y() - toOrigin.y(), x() - toOrigin.x());
    }

    default public double magnitudeSquared() {
        final double y = y();
        final double x = x();
        return (y * y) + (x * x);
    }

    default public double distance(final Point other) {
        return Math.sqrt(distanceSquared(other));
    }

    default public double distanceSquared(final Point other) {
        return subtract(other).magnitudeSquared();
    }

    /**
     * The point halfway between {@code this} and {@code other}.
     */
    default public Point midpoint(final Point other) {
        return new SimplePoint((y() + other.y()) / 2.0, (x() + other.x()) / 2.0);
    }
}
