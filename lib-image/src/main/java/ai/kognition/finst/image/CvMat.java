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

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

import ai.kognition.finst.util.QuietCloseable;

/**
 * <p>
 * An OpenCV <a href="https://docs.opencv.org/4.9.0/d3/d63/classcv_1_1Mat.html">Mat</a> that can be
 * managed as an {@link AutoCloseable}.
 * </p>
 *
 * <p>
 * The image data referred to by a {@code Mat} is <em>off-heap</em> from the perspective of the JVM, so the
 * garbage collector can't see how much memory it's actually using. Kernel images and suppression maps are
 * allocated every cycle, so they are all managed with a <em>"try-with-resource"</em> (or a {@link Closer})
 * and released as soon as they're no longer needed. Closing a {@link CvMat} releases the image data. The
 * (small) native header is still reclaimed by {@code Mat}'s own finalization.
 * </p>
 */
public class CvMat extends Mat implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CvMat.class);

    private boolean skipCloseOnceForReturn = false;
    private boolean releasedAlready = false;

    static {
        LOGGER.debug("Loading the OpenCV native library");
        OpenCV.loadLocally();
    }

    /**
     * Calling this guarantees the native OpenCV library is loaded before any other OpenCV class is touched.
     */
    public static void initOpenCv() {}

    /**
     * Construct's an empty {@link CvMat}.
     */
    public CvMat() {}

    /**
     * Construct a {@link CvMat} and preallocate the image space.
     *
     * @param rows number of rows
     * @param cols number of columns
     * @param type type of the {@link CvMat}. See
     *     <a href="https://docs.opencv.org/4.9.0/javadoc/org/opencv/core/CvType.html">CvType</a>
     */
    public CvMat(final int rows, final int cols, final int type) {
        super(rows, cols, type);
    }

    /**
     * Release the image data for this {@link CvMat}. Once the {@link CvMat} is closed it shouldn't be used.
     */
    @Override
    public void close() {
        if(!skipCloseOnceForReturn) {
            if(!releasedAlready) {
                release();
                releasedAlready = true;
            }
        } else
            skipCloseOnceForReturn = false; // next close counts.
    }

    /**
     * @return true once {@link #close()} has actually released the image data.
     */
    public boolean isClosed() {
        return releasedAlready;
    }

    /**
     * This method allows the developer to return a {@link CvMat} that's being managed by
     * a <em>"try-with-resource"</em> without worrying about the {@link CvMat}'s resources
     * being freed. As an example:
     *
     * <pre>
     * <code>
     *   try (CvMat matToReturn = new CvMat(); ) {
     *      // do something to fill in the matToReturn
     *
     *      return matToReturn.returnMe();
     *   }
     * </code>
     * </pre>
     *
     * Note: if you call {@link CvMat#returnMe()} and don't actually take ownership of the result, you will
     * leak the image data.
     */
    public CvMat returnMe() {
        skipCloseOnceForReturn = true;
        return this;
    }

    /**
     * Hand management of a {@code Mat}'s image data over to a new {@link CvMat}. The {@code Mat} passed
     * in <em>SHOULD NOT</em> be used after this call.
     *
     * @return a new {@link CvMat} that now references the image data. <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat move(final Mat mat) {
        if(mat == null)
            return null;
        if(mat instanceof CvMat)
            return (CvMat)mat;

        final CvMat ret = new CvMat();
        mat.assignTo(ret);
        mat.release();
        return ret;
    }

    /**
     * A complete deep copy of the provided {@code Mat}. Changes in one will not be reflected in the other.
     *
     * @return the copy. <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat deepCopy(final Mat mat) {
        final CvMat ret = new CvMat(mat.rows(), mat.cols(), mat.type());
        mat.copyTo(ret);
        return ret;
    }

    /**
     * Convenience method that wraps the return value of {@code Mat.zeros} in a {@link CvMat}.
     *
     * @return <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat zeros(final int rows, final int cols, final int type) {
        return CvMat.move(Mat.zeros(rows, cols, type));
    }

    /**
     * Release a {@code Mat} that may or may not be a {@link CvMat}.
     */
    public static void closeRawMat(final Mat mat) {
        if(mat == null)
            return;
        if(mat instanceof CvMat)
            ((CvMat)mat).close();
        else
            mat.release();
    }

    @Override
    public String toString() {
        return "CvMat: (" + getClass().getName() + "@" + Integer.toHexString(hashCode()) + ") " + super.toString();
    }
}
