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

import java.util.Objects;

/**
 * What to render: one frame of one series under a window, zoom and target size.
 * Compared by value, which makes it usable as a cache key.
 */
public final class RenderRequest {
    public static final int DEFAULT_ZOOM_PERCENT = 100;

    private final String seriesUID;
    private final int frameIndex;
    private final WindowLevel window;
    private final NormalizationMode mode;
    private final int zoomPercent;
    private final int targetMaxDimension;

    public RenderRequest(
            String seriesUID, int frameIndex,
            Double windowWidth, Double windowLevel,
            int zoomPercent, int targetMaxDimension
    ) {
        this(seriesUID, frameIndex, WindowLevel.ofNullable(windowWidth, windowLevel), null, zoomPercent, targetMaxDimension);
    }

    public RenderRequest(
            String seriesUID, int frameIndex,
            WindowLevel window, NormalizationMode mode,
            int zoomPercent, int targetMaxDimension
    ) {
        this.seriesUID = Objects.requireNonNull(seriesUID, "series UID");
        if (zoomPercent <= 0) {
            throw new IllegalArgumentException("Zoom must be positive: " + zoomPercent);
        }
        if (targetMaxDimension < 0) {
            throw new IllegalArgumentException("Target dimension must not be negative: " + targetMaxDimension);
        }
        this.frameIndex = frameIndex;
        this.window = null == window ? WindowLevel.AUTO : window;
        if (null == mode) {
            mode = this.window.isAuto() ? NormalizationMode.AUTO_WINDOW : NormalizationMode.EXPLICIT_WINDOW;
        }
        this.mode = mode;
        this.zoomPercent = zoomPercent;
        this.targetMaxDimension = targetMaxDimension;
    }

    /**
     * Auto-windowed frame at its native size.
     */
    public static RenderRequest of(String seriesUID, int frameIndex) {
        return new RenderRequest(seriesUID, frameIndex, WindowLevel.AUTO, null, DEFAULT_ZOOM_PERCENT, 0);
    }

    public RenderRequest withFrameIndex(int frameIndex) {
        return new RenderRequest(seriesUID, frameIndex, window, mode, zoomPercent, targetMaxDimension);
    }

    public RenderRequest withWindow(WindowLevel window) {
        return new RenderRequest(seriesUID, frameIndex, window, null, zoomPercent, targetMaxDimension);
    }

    public RenderRequest withMode(NormalizationMode mode) {
        return new RenderRequest(seriesUID, frameIndex, window, mode, zoomPercent, targetMaxDimension);
    }

    public RenderRequest withZoom(int zoomPercent) {
        return new RenderRequest(seriesUID, frameIndex, window, mode, zoomPercent, targetMaxDimension);
    }

    public String getSeriesUID() {
        return seriesUID;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public WindowLevel getWindow() {
        return window;
    }

    public Double getWindowWidth() {
        return window.getWidth();
    }

    public Double getWindowLevel() {
        return window.getLevel();
    }

    public NormalizationMode getMode() {
        return mode;
    }

    public int getZoomPercent() {
        return zoomPercent;
    }

    public int getTargetMaxDimension() {
        return targetMaxDimension;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RenderRequest)) {
            return false;
        }
        RenderRequest other = (RenderRequest) o;
        return frameIndex == other.frameIndex
                && zoomPercent == other.zoomPercent
                && targetMaxDimension == other.targetMaxDimension
                && mode == other.mode
                && seriesUID.equals(other.seriesUID)
                && window.equals(other.window);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesUID, frameIndex, window, mode, zoomPercent, targetMaxDimension);
    }

    @Override
    public String toString() {
        return "RenderRequest{" + seriesUID + "#" + frameIndex + ", " + window + ", " + mode
                + ", zoom=" + zoomPercent + "%, max=" + targetMaxDimension + "}";
    }
}
