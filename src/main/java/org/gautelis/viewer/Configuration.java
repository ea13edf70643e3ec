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
package org.gautelis.viewer;

import org.gautelis.viewer.render.Interpolation;

/**
 * Viewer settings. Every setting is bound to a property of the same name
 * (see {@link ConfigurationLoader}), and falls back to its default when the
 * property is not set.
 */
public interface Configuration {
    String NORMALIZE_ON_EXTRACTION = "normalize-on-extraction";
    String SAMPLING_THRESHOLD = "sampling-threshold";
    String MAX_SAMPLED_FRAMES = "max-sampled-frames";
    String PROGRESSIVE_THRESHOLD = "progressive-threshold";
    String PROGRESSIVE_WINDOW_SIZE = "progressive-window-size";
    String RENDER_CACHE_SIZE = "render-cache-size";
    String INSTANT_CACHE_SIZE = "instant-cache-size";
    String ENCODED_CACHE_SIZE = "encoded-cache-size";
    String PRERENDER_RADIUS = "prerender-radius";
    String PRERENDER_THREADS = "prerender-threads";
    String PRERENDER_QUEUE_SIZE = "prerender-queue-size";
    String INSTANT_MAX_DIMENSION = "instant-max-dimension";
    String FINAL_INTERPOLATION = "final-interpolation";
    String DEFAULT_WINDOW_WIDTH = "default-window-width";
    String DEFAULT_WINDOW_LEVEL = "default-window-level";
    String DEFAULT_ZOOM_PERCENT = "default-zoom-percent";
    String MIN_ZOOM_PERCENT = "min-zoom-percent";
    String MAX_ZOOM_PERCENT = "max-zoom-percent";
    String MAX_SERIES_EXAMPLES = "max-series-examples";

    /** Auto-window every frame into 0..255 already when extracting it (default false) */
    boolean normalizeOnExtraction();

    /** Series with more frames than this are navigated through a sub-sample (default 500) */
    int samplingThreshold();

    /** Size of that sub-sample (default 200) */
    int maxSampledFrames();

    /** Series with more frames than this are materialized progressively (default 2000) */
    int progressiveThreshold();

    int progressiveWindowSize();

    int renderCacheSize();

    int instantCacheSize();

    int encodedCacheSize();

    /** Number of frames on either side of the displayed one to render ahead, at most 5 (default 3) */
    int prerenderRadius();

    int prerenderThreads();

    int prerenderQueueSize();

    int instantMaxDimension();

    Interpolation finalInterpolation();

    double defaultWindowWidth();

    double defaultWindowLevel();

    int defaultZoomPercent();

    int minZoomPercent();

    int maxZoomPercent();

    int maxSeriesExamples();
}
