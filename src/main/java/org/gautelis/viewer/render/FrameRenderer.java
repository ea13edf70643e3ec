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
package org.gautelis.viewer.render;

import org.gautelis.viewer.Configuration;
import org.gautelis.viewer.NotFoundException;
import org.gautelis.viewer.model.Frame;
import org.gautelis.viewer.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Renders frames of a fixed set of series, memoizing every result.
 * <p>
 * There are two paths. The instant path produces a coarse thumbnail straight
 * from the raw values with a min-max stretch, suitable for feedback while a
 * slider is dragged. The final path applies the requested window and zoom and
 * resamples with the configured interpolation. {@link #display} shows the
 * instant view right away and the final view when it is ready, and renders a
 * few neighboring frames ahead of request.
 * <p>
 * Background work runs on the supplied executor. Neighbor renders that the
 * executor rejects are skipped.
 * <p>
 * Final renders are restricted to the configured zoom range. Requests built by
 * {@link #defaultRequest} carry the configured default window and zoom.
 */
public class FrameRenderer {
    private static final Logger log = LoggerFactory.getLogger(FrameRenderer.class);

    private final Map<String, Series> series;
    private final Executor executor;

    private final Normalizer normalizer = new Normalizer();
    private final Resampler resampler = new Resampler();

    private final RenderCache<RenderRequest, DisplayBuffer> finalCache;
    private final RenderCache<InstantKey, DisplayBuffer> instantCache;

    private final int instantMaxDimension;
    private final int prerenderRadius;
    private final Interpolation finalInterpolation;

    private final WindowLevel defaultWindow;
    private final int defaultZoomPercent;
    private final int minZoomPercent;
    private final int maxZoomPercent;

    public FrameRenderer(Map<String, Series> series, Configuration config, Executor executor) {
        this.series = Collections.unmodifiableMap(new HashMap<>(series));
        this.executor = executor;

        this.finalCache = new RenderCache<>(config.renderCacheSize());
        this.instantCache = new RenderCache<>(config.instantCacheSize());

        this.instantMaxDimension = config.instantMaxDimension();
        this.prerenderRadius = config.prerenderRadius();
        this.finalInterpolation = config.finalInterpolation();

        this.defaultWindow = WindowLevel.of(config.defaultWindowWidth(), config.defaultWindowLevel());
        this.minZoomPercent = config.minZoomPercent();
        this.maxZoomPercent = config.maxZoomPercent();
        this.defaultZoomPercent = config.defaultZoomPercent();
        if (minZoomPercent > maxZoomPercent
                || defaultZoomPercent < minZoomPercent || defaultZoomPercent > maxZoomPercent) {
            throw new IllegalArgumentException("Invalid zoom configuration: default " + defaultZoomPercent
                    + "% not within " + minZoomPercent + "..." + maxZoomPercent + "%");
        }
    }

    /**
     * Frame at its native size, under the configured default window and zoom.
     */
    public RenderRequest defaultRequest(String seriesUID, int frameIndex) {
        return new RenderRequest(seriesUID, frameIndex, defaultWindow, null, defaultZoomPercent, 0);
    }

    /**
     * @return the zoom nearest to the given one that final renders accept
     */
    public int clampZoom(int zoomPercent) {
        return Math.max(minZoomPercent, Math.min(maxZoomPercent, zoomPercent));
    }

    /**
     * Windowed, resampled rendering of the requested frame. Computed at most
     * once per distinct request while it stays cached.
     */
    public RenderedView renderFinal(RenderRequest request) throws NotFoundException {
        checkZoom(request);
        Frame frame = frame(request);
        DisplayBuffer buffer = finalCache.get(request, () -> {
            DisplayBuffer normalized = normalizer.normalize(frame, request.getMode(), request.getWindow());
            return resampler.scale(normalized, request.getTargetMaxDimension(), request.getZoomPercent(), finalInterpolation);
        });
        return new RenderedView(request, buffer, RenderedView.Quality.FINAL);
    }

    /**
     * Coarse preview of the requested frame, ignoring window and zoom.
     */
    public RenderedView renderInstant(RenderRequest request) throws NotFoundException {
        Frame frame = frame(request);
        InstantKey key = new InstantKey(request.getSeriesUID(), request.getFrameIndex());
        DisplayBuffer buffer = instantCache.get(key, () -> normalizer.normalize(thumbnail(frame), WindowLevel.AUTO));
        return new RenderedView(request, buffer, RenderedView.Quality.INSTANT);
    }

    public boolean isRendered(RenderRequest request) {
        return finalCache.contains(request);
    }

    /**
     * Points the slot at this request and fills it: with the final view at once
     * if it is cached, otherwise with the instant view now and the final view
     * once rendered in the background.
     *
     * @return the final view, when ready
     */
    public CompletableFuture<RenderedView> display(RenderRequest request, DisplaySlot slot) throws NotFoundException {
        checkZoom(request);
        slot.request(request);

        CompletableFuture<RenderedView> result;
        if (isRendered(request)) {
            RenderedView view = renderFinal(request);
            slot.offer(view);
            result = CompletableFuture.completedFuture(view);

        } else {
            slot.offer(renderInstant(request));

            result = new CompletableFuture<>();
            Runnable task = () -> {
                try {
                    RenderedView view = renderFinal(request);
                    slot.offer(view);
                    result.complete(view);

                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            };
            try {
                executor.execute(task);

            } catch (RejectedExecutionException ree) {
                log.debug("Render queue full, rendering {} in caller", request);
                task.run();
            }
        }

        prerenderNeighbors(request);
        return result;
    }

    /**
     * Queues final renders of the frames within the pre-render radius of the
     * requested one, skipping those already cached.
     *
     * @return number of renders queued
     */
    public int prerenderNeighbors(RenderRequest request) throws NotFoundException {
        int frameCount = series(request.getSeriesUID()).getFrameCount();
        int queued = 0;

        for (int distance = 1; distance <= prerenderRadius; distance++) {
            for (int index : new int[]{request.getFrameIndex() + distance, request.getFrameIndex() - distance}) {
                if (index < 0 || index >= frameCount) {
                    continue;
                }
                RenderRequest neighbor = request.withFrameIndex(index);
                if (isRendered(neighbor)) {
                    continue;
                }
                try {
                    executor.execute(() -> {
                        try {
                            renderFinal(neighbor);

                        } catch (NotFoundException nfe) {
                            log.debug("Skipping pre-render of {}: {}", neighbor, nfe.getMessage());
                        }
                    });
                    queued++;

                } catch (RejectedExecutionException ree) {
                    log.debug("Render queue full, skipping pre-render of {}", neighbor);
                    return queued;
                }
            }
        }
        return queued;
    }

    public long getCachedCount() {
        return finalCache.size();
    }

    private void checkZoom(RenderRequest request) {
        int zoom = request.getZoomPercent();
        if (zoom < minZoomPercent || zoom > maxZoomPercent) {
            throw new IllegalArgumentException(
                    "Zoom " + zoom + "% outside " + minZoomPercent + "..." + maxZoomPercent + "%");
        }
    }

    private Series series(String seriesUID) throws NotFoundException {
        Series s = series.get(seriesUID);
        if (null == s) {
            throw new NotFoundException("Series not found: " + seriesUID);
        }
        return s;
    }

    private Frame frame(RenderRequest request) throws NotFoundException {
        Series s = series(request.getSeriesUID());
        int index = request.getFrameIndex();
        if (index < 0 || index >= s.getFrameCount()) {
            throw new NotFoundException(
                    "Frame index out of range: " + index + " (series " + s.getSeriesUID() + " has " + s.getFrameCount() + ")");
        }
        return s.getFrame(index);
    }

    /*
     * Every n:th sample in both directions, n chosen so that the longest side
     * ends up at most instantMaxDimension.
     */
    private Frame thumbnail(Frame frame) {
        int longest = Math.max(frame.getRows(), frame.getColumns());
        int step = Math.max(1, (longest + instantMaxDimension - 1) / instantMaxDimension);
        if (step == 1) {
            return frame;
        }
        int rows = (frame.getRows() + step - 1) / step;
        int columns = (frame.getColumns() + step - 1) / step;
        float[] values = new float[rows * columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                values[r * columns + c] = frame.get(r * step, c * step);
            }
        }
        return new Frame(rows, columns, values);
    }

    private static final class InstantKey {
        private final String seriesUID;
        private final int frameIndex;

        private InstantKey(String seriesUID, int frameIndex) {
            this.seriesUID = seriesUID;
            this.frameIndex = frameIndex;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof InstantKey)) {
                return false;
            }
            InstantKey other = (InstantKey) o;
            return frameIndex == other.frameIndex && seriesUID.equals(other.seriesUID);
        }

        @Override
        public int hashCode() {
            return 31 * seriesUID.hashCode() + frameIndex;
        }
    }
}
