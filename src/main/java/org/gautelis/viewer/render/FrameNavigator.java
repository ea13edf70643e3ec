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

/**
 * Frame index arithmetic for stepping, mosaics and cine playback. All indices
 * are zero based.
 */
public final class FrameNavigator {

    private FrameNavigator() {
    }

    /**
     * @return the following frame, wrapping from the last to the first
     */
    public static int next(int frameIndex, int frameCount) {
        requireFrames(frameCount);
        return frameIndex + 1 < frameCount ? frameIndex + 1 : 0;
    }

    /**
     * @return the preceding frame, wrapping from the first to the last
     */
    public static int previous(int frameIndex, int frameCount) {
        requireFrames(frameCount);
        return frameIndex > 0 ? frameIndex - 1 : frameCount - 1;
    }

    /**
     * Four frames for a 2x2 mosaic around the current frame, at offsets
     * floor(-n/6), 0, n/6 and n/3 from it, each clamped to the series.
     */
    public static int[] mosaicPositions(int frameIndex, int frameCount) {
        requireFrames(frameCount);
        int[] offsets = {Math.floorDiv(-frameCount, 6), 0, frameCount / 6, frameCount / 3};
        int[] positions = new int[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            positions[i] = Math.min(Math.max(frameIndex + offsets[i], 0), frameCount - 1);
        }
        return positions;
    }

    /**
     * @return milliseconds between frames during playback
     */
    public static long cineDelayMillis(int framesPerSecond) {
        return 1000L / Math.max(1, framesPerSecond);
    }

    private static void requireFrames(int frameCount) {
        if (frameCount < 1) {
            throw new IllegalArgumentException("No frames to navigate");
        }
    }
}
