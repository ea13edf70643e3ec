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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Keeps at most windowSize contiguous frames of a very large series
 * materialized. Asking for a frame outside the current range re-centers the
 * range on that frame and releases everything outside it. Frames inside the
 * range are materialized when first asked for.
 *
 * @param <T> whatever a materialized frame is, e.g. an encoded image
 */
public class ProgressiveFrameWindow<T> {
    private static final Logger log = LoggerFactory.getLogger(ProgressiveFrameWindow.class);

    private final int totalFrames;
    private final int windowSize;
    private final IntFunction<T> materializer;

    private final Map<Integer, T> materialized = new HashMap<>();
    private int start = 0;
    private int end;

    public ProgressiveFrameWindow(int totalFrames, int windowSize, IntFunction<T> materializer) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.totalFrames = totalFrames;
        this.windowSize = windowSize;
        this.materializer = materializer;
        this.end = Math.min(totalFrames, windowSize);
    }

    public synchronized T get(int frameIndex) {
        if (frameIndex < 0 || frameIndex >= totalFrames) {
            throw new IndexOutOfBoundsException("Frame " + frameIndex + " of " + totalFrames);
        }
        if (frameIndex < start || frameIndex >= end) {
            recenter(frameIndex);
        }
        return materialized.computeIfAbsent(frameIndex, materializer::apply);
    }

    private void recenter(int frameIndex) {
        int newStart = Math.max(0, Math.min(frameIndex - windowSize / 2, totalFrames - windowSize));
        int newEnd = Math.min(totalFrames, newStart + windowSize);
        log.debug("Moving frame window from [{}, {}) to [{}, {})", start, end, newStart, newEnd);

        start = newStart;
        end = newEnd;
        materialized.keySet().removeIf(i -> i < start || i >= end);
    }

    public synchronized boolean contains(int frameIndex) {
        return frameIndex >= start && frameIndex < end;
    }

    public synchronized int getStart() {
        return start;
    }

    /**
     * @return exclusive end of the current range
     */
    public synchronized int getEnd() {
        return end;
    }

    public synchronized int getMaterializedCount() {
        return materialized.size();
    }

    public int getTotalFrames() {
        return totalFrames;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
