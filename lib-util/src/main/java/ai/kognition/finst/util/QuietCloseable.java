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

package ai.kognition.finst.util;

/**
 * An {@link AutoCloseable} whose {@code close} doesn't throw a checked exception so it
 * can be used in a <em>"try-with-resource"</em> without a catch block.
 */
@FunctionalInterface
public interface QuietCloseable extends AutoCloseable {
    @Override
    void close();

    /**
     * Close every one of the {@code closeables}, ignoring nulls. All of them are closed even if
     * one throws; the first exception is rethrown with any others attached as suppressed.
     */
    public static void closeAll(final Iterable<? extends AutoCloseable> closeables) {
        RuntimeException failure = null;
        for(final AutoCloseable cur: closeables) {
            if(cur == null)
                continue;
            try {
                cur.close();
            } catch(final Exception e) {
                final RuntimeException rte = e instanceof RuntimeException ? (RuntimeException)e : new RuntimeException(e);
                if(failure == null)
                    failure = rte;
                else
                    failure.addSuppressed(rte);
            }
        }
        if(failure != null)
            throw failure;
    }
}
