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

package ai.kognition.finst.tracking.kernel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.finst.image.geometry.Region;
import ai.kognition.finst.util.QuietCloseable;

/**
 * {@link KernelSet}s indexed by {@link KernelParameters} and {@link ShapeIndex}. Entries are kept in insertion order, looked up by a linear scan
 * where the first tolerant match wins, and never replaced once added.
 * <p>
 * A cache can be handed to more than one tracker. Trackers configured differently never see each other's kernels.
 * Growth and lookup are synchronized on the cache.
 * <p>
 * Nothing is ever evicted. A long running process that sees an unbounded variety of shapes would need an eviction
 * policy (least recently used would be the natural one) added here.
 */
public class KernelCache implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(KernelCache.class);

    private final List<KernelSet> entries = new ArrayList<>();

    /**
     * Make sure there's a {@link KernelSet} for the shape of every one of the {@code regions}, building any that are
     * missing with {@code builder}.
     *
     * @return this
     */
    public synchronized KernelCache ensureKernels(final Collection<Region> regions, final KernelSetBuilder builder) {
        for(final Region region: regions)
            kernelsFor(region, builder);
        return this;
    }

    /**
     * The {@link KernelSet} for the shape of {@code region}, building and adding it if there isn't one. The set returned
     * is owned by this cache.
     */
    public synchronized KernelSet kernelsFor(final Region region, final KernelSetBuilder builder) {
        final ShapeIndex shape = builder.shapeIndex(region);
        final Optional<KernelSet> existing = find(shape, builder.parameters(), builder.config().widthThresh, builder.config().arThresh);
        if(existing.isPresent())
            return existing.get();

        final KernelSet ret = builder.build(region);
        entries.add(ret);
        LOGGER.debug("Added kernels for {}. There are now {} entries in the cache.", shape, entries.size());
        return ret;
    }

    /**
     * The first entry built with {@code parameters} whose shape matches {@code shape}.
     */
    public synchronized Optional<KernelSet> find(final ShapeIndex shape, final KernelParameters parameters, final double widthThresh,
        final double arThresh) {
        for(final KernelSet cur: entries) {
            if(cur.parameters.equals(parameters) && cur.shape.matches(shape, widthThresh, arThresh))
                return Optional.of(cur);
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Release every {@link KernelSet} and empty the cache.
     */
    public synchronized void clear() {
        LOGGER.debug("Clearing {} entries from the kernel cache", entries.size());
        try {
            QuietCloseable.closeAll(entries);
        } finally {
            entries.clear();
        }
    }

    @Override
    public void close() {
        clear();
    }
}
