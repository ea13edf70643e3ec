/*
 * Copyright (C) 2021 Frode Randers
 * All rights reserved
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gautelis.viewer.series;

import org.gautelis.viewer.InconsistencyException;
import org.gautelis.viewer.extract.FrameExtractor;
import org.gautelis.viewer.extract.MetadataExtractor;
import org.gautelis.viewer.extract.OrderingKey;
import org.gautelis.viewer.model.Frame;
import org.gautelis.viewer.model.Instance;
import org.gautelis.viewer.model.Series;
import org.gautelis.viewer.model.SeriesMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups instances into series and establishes the frame order of each series.
 * <p>
 * Instances without a series instance UID are skipped. The descriptive
 * metadata of a series is taken from the first instance seen for it. Frames
 * are ordered by {@link OrderingKey} once all instances are absorbed, so the
 * final order does not depend on the order instances arrive in.
 * <p>
 * A failure while extracting the frames of one instance only costs that
 * instance its frames; aggregation as such never fails.
 */
public class SeriesAggregator {
    private static final Logger log = LoggerFactory.getLogger(SeriesAggregator.class);

    private final MetadataExtractor metadataExtractor;
    private final FrameExtractor frameExtractor;

    public SeriesAggregator(MetadataExtractor metadataExtractor, FrameExtractor frameExtractor) {
        this.metadataExtractor = metadataExtractor;
        this.frameExtractor = frameExtractor;
    }

    public SeriesAggregator() {
        this(new MetadataExtractor(), new FrameExtractor());
    }

    /**
     * @return series keyed by series instance UID, in order of first appearance
     */
    public Map<String, Series> aggregate(Iterable<Instance> instances) {
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();

        for (Instance instance : instances) {
            Optional<SeriesMetadata> metadata;
            try {
                metadata = metadataExtractor.extract(instance);

            } catch (RuntimeException re) {
                String info = "Skipping instance with unreadable metadata: " + instance.getSourceName();
                log.warn(info, re);
                continue;
            }
            if (!metadata.isPresent()) {
                continue;
            }

            SeriesMetadata md = metadata.get();
            Accumulator accumulator = accumulators.computeIfAbsent(md.getSeriesUID(), uid -> new Accumulator(md));
            accumulator.absorb(instance, md, extractFrames(instance));
        }

        Map<String, Series> series = new LinkedHashMap<>();
        for (Map.Entry<String, Accumulator> entry : accumulators.entrySet()) {
            series.put(entry.getKey(), entry.getValue().finish());
        }
        log.debug("Aggregated {} series", series.size());
        return series;
    }

    private List<Frame> extractFrames(Instance instance) {
        try {
            return frameExtractor.extractFrames(instance);

        } catch (IOException | InconsistencyException e) {
            log.warn("No frames from {}: {}", instance.getSourceName(), e.getMessage());

        } catch (RuntimeException re) {
            String info = "Failed to extract frames from " + instance.getSourceName();
            log.warn(info, re);
        }
        return Collections.emptyList();
    }

    /*
     * Collects the frames of one series until it is finalized
     */
    private static final class Accumulator {
        private final SeriesMetadata metadata;
        private final List<KeyedFrame> keyedFrames = new ArrayList<>();
        private final List<String> sourceNames = new ArrayList<>();

        private Accumulator(SeriesMetadata metadata) {
            this.metadata = metadata;
        }

        private void absorb(Instance instance, SeriesMetadata instanceMetadata, List<Frame> frames) {
            int ordinal = sourceNames.size();
            sourceNames.add(instance.getSourceName());

            OrderingKey key = OrderingKey.of(instanceMetadata, instance.getSourceName());
            for (int i = 0; i < frames.size(); i++) {
                keyedFrames.add(new KeyedFrame(key.forFrame(i), frames.get(i), ordinal));
            }
        }

        private Series finish() {
            Collections.sort(keyedFrames);
            List<Frame> frames = new ArrayList<>(keyedFrames.size());
            for (KeyedFrame kf : keyedFrames) {
                frames.add(kf.frame);
            }
            return new Series(metadata, frames, sourceNames);
        }
    }

    private static final class KeyedFrame implements Comparable<KeyedFrame> {
        private final OrderingKey key;
        private final Frame frame;
        private final int instanceOrdinal;

        private KeyedFrame(OrderingKey key, Frame frame, int instanceOrdinal) {
            this.key = key;
            this.frame = frame;
            this.instanceOrdinal = instanceOrdinal;
        }

        @Override
        public int compareTo(KeyedFrame other) {
            int c = key.compareTo(other.key);
            return c != 0 ? c : Integer.compare(instanceOrdinal, other.instanceOrdinal);
        }
    }
}
