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

import org.junit.Test;

import static org.junit.Assert.*;

public class FrameSamplerTest {

    @Test
    public void testSmallSeriesIsNotSampled() {
        SampledFrames frames = new FrameSampler(500, 200).sample(300);
        assertEquals(300, frames.size());
        assertFalse(frames.isSampled());
        assertEquals(299, frames.frameIndex(299));

        assertEquals(0, new FrameSampler(500, 200).sample(0).size());
    }

    @Test
    public void testLargeSeriesIsSampledUniformly() {
        SampledFrames frames = new FrameSampler(500, 20).sample(1000);

        assertEquals(20, frames.size());
        assertTrue(frames.isSampled());
        assertEquals(1000, frames.getTotalFrames());
        assertEquals(0, frames.frameIndex(0));
        assertEquals(50, frames.frameIndex(1));
        assertEquals(999, frames.frameIndex(19));

        assertEquals(1, frames.actualFrameNumber(0));
        assertEquals(1000, frames.actualFrameNumber(19));

        int[] indices = frames.getFrameIndices();
        for (int i = 1; i < indices.length; i++) {
            assertTrue(indices[i] > indices[i - 1]);
        }
    }

    @Test
    public void testNearestSampledIndex() {
        SampledFrames frames = new FrameSampler(500, 20).sample(1000);
        assertEquals(0, frames.nearestSampledIndex(0));
        assertEquals(1, frames.nearestSampledIndex(60));
        assertEquals(2, frames.nearestSampledIndex(90));
        assertEquals(19, frames.nearestSampledIndex(999));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testOutOfRange() {
        new FrameSampler(500, 20).sample(1000).frameIndex(20);
    }
}
