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

import java.util.Arrays;

/**
 * The navigable frames of a series: either every frame, or a uniform
 * sub-sample of an oversized series that always includes the last frame.
 */
public final class SampledFrames {
    private final int totalFrames;
    private final int[] frameIndices;

    /* package private */
    SampledFrames(int totalFrames, int[] frameIndices) {
        this.totalFrames = totalFrames;
        this.frameIndices = frameIndices;
    }

    public int getTotalFrames() {
        return totalFrames;
    }

    public int size() {
        return frameIndices.length;
    }

    public boolean isSampled() {
        return frameIndices.length < totalFrames;
    }

    /**
     * @return the true (zero based) frame index behind a sampled index
     */
    public int frameIndex(int sampledIndex) {
        if (sampledIndex < 0 || sampledIndex >= frameIndices.length) {
            throw new IndexOutOfBoundsException("Sampled index " + sampledIndex + " of " + frameIndices.length);
        }
        return frameIndices[sampledIndex];
    }

    /**
     * @return the one based frame number shown to the user for a sampled index,
     * relative to the full series
     */
    public int actualFrameNumber(int sampledIndex) {
        return frameIndex(sampledIndex) + 1;
    }

    /**
     * @return the sampled index whose frame lies closest to the given true frame index
     */
    public int nearestSampledIndex(int frameIndex) {
        int pos = Arrays.binarySearch(frameIndices, frameIndex);
        if (pos >= 0) {
            return pos;
        }
        int insertion = -pos - 1;
        if (insertion == 0) {
            return 0;
        }
        if (insertion >= frameIndices.length) {
            return frameIndices.length - 1;
        }
        int below = frameIndices[insertion - 1];
        int above = frameIndices[insertion];
        return frameIndex - below <= above - frameIndex ? insertion - 1 : insertion;
    }

    public int[] getFrameIndices() {
        return frameIndices.clone();
    }
}
