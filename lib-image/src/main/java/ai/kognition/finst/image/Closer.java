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

import java.util.LinkedList;
import java.util.List;

import org.opencv.core.Mat;

import ai.kognition.finst.util.QuietCloseable;

/**
 * Manage resources from a single place. Resources are closed in the reverse order they were added.
 */
public class Closer implements QuietCloseable {
    private final List<AutoCloseable> toClose = new LinkedList<>();

    public <T extends AutoCloseable> T add(final T resource) {
        if(resource != null)
            toClose.add(0, resource);
        return resource;
    }

    public <T extends Mat> T addMat(final T mat) {
        if(mat == null)
            return null;
        if(mat instanceof AutoCloseable)
            add((AutoCloseable)mat);
        else
            toClose.add(0, (QuietCloseable)() -> CvMat.closeRawMat(mat));
        return mat;
    }

    @Override
    public void close() {
        QuietCloseable.closeAll(toClose);
        toClose.clear();
    }
}
