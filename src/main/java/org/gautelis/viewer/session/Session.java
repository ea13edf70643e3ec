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
package org.gautelis.viewer.session;

import org.gautelis.viewer.Configuration;
import org.gautelis.viewer.NotFoundException;
import org.gautelis.viewer.model.Series;
import org.gautelis.viewer.render.DisplaySlot;
import org.gautelis.viewer.render.FrameRenderer;
import org.gautelis.viewer.render.FrameSampler;
import org.gautelis.viewer.render.ProgressiveFrameWindow;
import org.gautelis.viewer.render.RenderCache;
import org.gautelis.viewer.render.RenderRequest;
import org.gautelis.viewer.render.RenderedView;
import org.gautelis.viewer.render.SampledFrames;
import org.gautelis.viewer.series.SeriesSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * The series assembled from one upload, together with everything needed to
 * hand out their frames.
 * <p>
 * Encoded frames of ordinary series are memoized in a bounded cache. Series
 * longer than the progressive threshold are served through a window that only
 * keeps the frames around the most recently requested one.
 */
public class Session {
    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final Map<String, Series> series;
    private final List<String> invalidFiles;

    private final FrameRenderer renderer;
    private final FrameSampler sampler;
    private final FrameEncoder encoder = new FrameEncoder();
    private final RenderCache<String, EncodedFrame> encodedCache;
    private final Map<String, ProgressiveFrameWindow<EncodedFrame>> windows = new ConcurrentHashMap<>();

    private final int progressiveThreshold;
    private final int progressiveWindowSize;
    private final int maxSeriesExamples;

    Session(String id, Map<String, Series> series, List<String> invalidFiles, Configuration config, Executor executor) {
        this.id = id;
        this.series = Collections.unmodifiableMap(series);
        this.invalidFiles = Collections.unmodifiableList(new ArrayList<>(invalidFiles));

        this.renderer = new FrameRenderer(series, config, executor);
        this.sampler = new FrameSampler(config.samplingThreshold(), config.maxSampledFrames());
        this.encodedCache = new RenderCache<>(config.encodedCacheSize());

        this.progressiveThreshold = config.progressiveThreshold();
        this.progressiveWindowSize = config.progressiveWindowSize();
        this.maxSeriesExamples = config.maxSeriesExamples();
    }

    public String getId() {
        return id;
    }

    /**
     * @return series keyed by series instance UID, in first-seen order
     */
    public Map<String, Series> getSeries() {
        return series;
    }

    public Series getSeries(String seriesUID) throws NotFoundException {
        Series s = series.get(seriesUID);
        if (null == s) {
            throw new NotFoundException("Series not found: " + seriesUID + " (in " + id + ")");
        }
        return s;
    }

    public List<String> getInvalidFiles() {
        return invalidFiles;
    }

    public List<SeriesSummary> summaries() {
        List<SeriesSummary> summaries = new ArrayList<>(series.size());
        for (Series s : series.values()) {
            summaries.add(SeriesSummary.of(s, maxSeriesExamples));
        }
        return summaries;
    }

    public SessionSummary summarize() {
        return new SessionSummary(id, summaries(), invalidFiles);
    }

    /**
     * Retrieves one frame as an auto-windowed PNG.
     */
    public EncodedFrame getFrame(String seriesUID, int frameIndex) throws NotFoundException {
        Series s = getSeries(seriesUID);
        int total = s.getFrameCount();
        if (frameIndex < 0 || frameIndex >= total) {
            throw new NotFoundException(
                    "Frame index out of range: " + frameIndex + " (series " + seriesUID + " has " + total + ")");
        }

        if (total > progressiveThreshold) {
            ProgressiveFrameWindow<EncodedFrame> window = windows.computeIfAbsent(seriesUID, uid -> {
                log.debug("Serving {} frames of {} progressively", total, uid);
                return new ProgressiveFrameWindow<>(
                        total, progressiveWindowSize, index -> encoder.encode(index, s.getFrame(index), total));
            });
            return window.get(frameIndex);
        }

        return encodedCache.get(seriesUID + "/" + frameIndex, () -> encoder.encode(frameIndex, s.getFrame(frameIndex), total));
    }

    /**
     * Which frames of a series to present when navigating it.
     */
    public SampledFrames sample(String seriesUID) throws NotFoundException {
        return sampler.sample(getSeries(seriesUID).getFrameCount());
    }

    /**
     * A request for one frame under the configured default window and zoom.
     */
    public RenderRequest request(String seriesUID, int frameIndex) {
        return renderer.defaultRequest(seriesUID, frameIndex);
    }

    public RenderedView render(RenderRequest request) throws NotFoundException {
        return renderer.renderFinal(request);
    }

    public CompletableFuture<RenderedView> display(RenderRequest request, DisplaySlot slot) throws NotFoundException {
        return renderer.display(request, slot);
    }

    public FrameRenderer getRenderer() {
        return renderer;
    }

    @Override
    public String toString() {
        return "Session{" + id + ", " + series.size() + " series}";
    }
}
