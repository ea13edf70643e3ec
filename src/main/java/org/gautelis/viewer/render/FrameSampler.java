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
 * Picks the navigable frame set of a series. Series up to the threshold are
 * navigated frame by frame. Larger series are navigated through
 * maxSampledFrames frames taken at a stride of totalFrames / maxSampledFrames,
 * the last of which is always the last frame of the series.
 */
public class FrameSampler {
    private final int threshold;
    private final int maxSampledFrames;

    public FrameSampler(int threshold, int maxSampledFrames) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Sampling threshold must not be negative: " + threshold);
        }
        if (maxSampledFrames < 1) {
            throw new IllegalArgumentException("At least one sampled frame needed: " + maxSampledFrames);
        }
        this.threshold = threshold;
        this.maxSampledFrames = maxSampledFrames;
    }

    public SampledFrames sample(int totalFrames) {
        if (totalFrames < 0) {
            throw new IllegalArgumentException("Negative frame count: " + totalFrames);
        }
        if (totalFrames <= threshold || totalFrames <= maxSampledFrames) {
            int[] all = new int[totalFrames];
            for (int i = 0; i < totalFrames; i++) {
                all[i] = i;
            }
            return new SampledFrames(totalFrames, all);
        }

        double stride = (double) totalFrames / maxSampledFrames;
        int[] indices = new int[maxSampledFrames];
        for (int i = 0; i < maxSampledFrames - 1; i++) {
            indices[i] = (int) Math.floor(i * stride);
        }
        indices[maxSampledFrames - 1] = totalFrames - 1;
        return new SampledFrames(totalFrames, indices);
    }

    public int getThreshold() {
        return threshold;
    }

    public int getMaxSampledFrames() {
        return maxSampledFrames;
    }
}
