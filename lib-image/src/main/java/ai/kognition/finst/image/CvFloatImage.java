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

import static org.opencv.core.CvType.CV_32FC1;
import static org.opencv.core.CvType.CV_8UC1;

import java.util.Collection;
import java.util.Optional;

import org.apache.commons.lang3.Validate;
import org.opencv.core.Core;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import ai.kognition.finst.image.geometry.Region;

/**
 * {@link FloatImage} backed by a {@code CV_32FC1} {@link CvMat}.
 */
public class CvFloatImage implements FloatImage {
    private static final Scalar ZERO = new Scalar(0.0);
    private static final Scalar MASK_ON = new Scalar(255);

    private final CvMat mat;

    static {
        CvMat.initOpenCv();
    }

    /**
     * Take ownership of {@code mat}. It must be a single channel float matrix.
     */
    public CvFloatImage(final CvMat mat) {
        Validate.isTrue(mat.type() == CV_32FC1, "A %s must be CV_32FC1 but was given type %d", CvFloatImage.class.getSimpleName(), mat.type());
        this.mat = mat;
    }

    public static CvFloatImage zeros(final int width, final int height) {
        Validate.isTrue(width > 0 && height > 0, "Image dimensions must be positive but were %d x %d", width, height);
        return new CvFloatImage(CvMat.zeros(height, width, CV_32FC1));
    }

    public static CvFloatImage fromPixels(final int width, final int height, final float[] pixels) {
        Validate.isTrue(width > 0 && height > 0, "Image dimensions must be positive but were %d x %d", width, height);
        Validate.isTrue(pixels.length == width * height, "Expected %d pixels but was given %d", width * height, pixels.length);
        try(final CvMat m = new CvMat(height, width, CV_32FC1)) {
            m.put(0, 0, pixels);
            return new CvFloatImage(m.returnMe());
        }
    }

    @Override
    public int width() {
        return mat.cols();
    }

    @Override
    public int height() {
        return mat.rows();
    }

    @Override
    public float get(final int x, final int y) {
        final float[] ret = new float[1];
        mat.get(y, x, ret);
        return ret[0];
    }

    @Override
    public float[] pixels() {
        final float[] ret = new float[width() * height()];
        mat.get(0, 0, ret);
        return ret;
    }

    @Override
    public void setTo(final double value) {
        mat.setTo(new Scalar(value));
    }

    @Override
    public Optional<Region> stamp(final FloatImage kernel, final int centerX, final int centerY) {
        final Region footprint = Region.centeredAt(centerX, centerY, kernel.width(), kernel.height());
        final Optional<Region> clipped = footprint.clip(width(), height());
        if(clipped.isEmpty())
            return clipped;

        final Region dstArea = clipped.get();
        final Region srcArea = dstArea.translate(-footprint.x, -footprint.y);
        try(final Closer closer = new Closer()) {
            final CvMat kernelMat = kernel instanceof CvFloatImage ? ((CvFloatImage)kernel).mat
                : closer.add(fromPixels(kernel.width(), kernel.height(), kernel.pixels())).mat;
            final CvMat src = closer.add(CvMat.move(kernelMat.submat(srcArea.toOcv())));
            final CvMat dst = closer.add(CvMat.move(mat.submat(dstArea.toOcv())));
            Core.add(src, dst, dst);
        }
        return clipped;
    }

    @Override
    public CvFloatImage copy(final Region roi) {
        Validate.isTrue(bounds().contains(roi), "Can't copy %s out of an image that's %d x %d", roi, width(), height());
        try(final CvMat sub = CvMat.move(mat.submat(roi.toOcv()))) {
            return new CvFloatImage(CvMat.deepCopy(sub));
        }
    }

    @Override
    public CvFloatImage resize(final int newWidth, final int newHeight) {
        try(final CvMat ret = new CvMat()) {
            Imgproc.resize(mat, ret, new Size(newWidth, newHeight), 0, 0, Imgproc.INTER_LINEAR);
            return new CvFloatImage(ret.returnMe());
        }
    }

    @Override
    public Optional<Region> positiveBounds(final Collection<Region> within) {
        try(final Closer closer = new Closer()) {
            final CvMat positive = closer.add(new CvMat());
            Core.compare(mat, ZERO, positive, Core.CMP_GT);

            final CvMat footprint = closer.add(CvMat.zeros(height(), width(), CV_8UC1));
            for(final Region area: within) {
                final Optional<Region> clipped = area.clip(width(), height());
                if(clipped.isPresent()) {
                    try(final CvMat sub = CvMat.move(footprint.submat(clipped.get().toOcv()))) {
                        sub.setTo(MASK_ON);
                    }
                }
            }
            Core.bitwise_and(positive, footprint, positive);

            if(Core.countNonZero(positive) == 0)
                return Optional.empty();

            final MatOfPoint nonZero = closer.addMat(new MatOfPoint());
            Core.findNonZero(positive, nonZero);
            final Rect bounds = Imgproc.boundingRect(nonZero);
            return Optional.of(Region.fromOcv(bounds));
        }
    }

    @Override
    public void close() {
        mat.close();
    }

    @Override
    public String toString() {
        return CvFloatImage.class.getSimpleName() + "[ " + width() + " x " + height() + " ]";
    }
}
