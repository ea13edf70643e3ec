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
package org.gautelis.viewer.extract;

import org.gautelis.viewer.InconsistencyException;
import org.gautelis.viewer.model.Frame;
import org.gautelis.viewer.model.Instance;
import org.gautelis.viewer.model.Keyword;
import org.gautelis.viewer.model.PixelPayload;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FrameExtractorTest {
    private final FrameExtractor extractor = new FrameExtractor();

    @Test
    public void testSingleFrame() throws Exception {
        List<Frame> frames = extractor.extractFrames(PixelPayload.of2D(new float[][]{{0, 1, 2}, {3, 4, 5}}), "MONOCHROME2");
        assertEquals(1, frames.size());
        assertEquals(2, frames.get(0).getRows());
        assertEquals(3, frames.get(0).getColumns());
        assertEquals(5f, frames.get(0).get(1, 2), 0f);
    }

    @Test
    public void testLeadingAxesBecomeFrames() throws Exception {
        float[] values = new float[3 * 2 * 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        List<Frame> frames = extractor.extractFrames(new PixelPayload(new int[]{3, 2, 2}, values), "");
        assertEquals(3, frames.size());
        assertEquals(8f, frames.get(2).get(0, 0), 0f);

        // 2 x 3 x (2 x 2) yields six frames in row-major order
        float[] four = new float[2 * 3 * 2 * 2];
        for (int i = 0; i < four.length; i++) {
            four[i] = i;
        }
        frames = extractor.extractFrames(new PixelPayload(new int[]{2, 3, 2, 2}, four), "");
        assertEquals(6, frames.size());
        assertEquals(20f, frames.get(5).get(0, 0), 0f);
    }

    @Test
    public void testMonochrome1UsesGlobalMaximum() throws Exception {
        // Maximum (100) only occurs in the second frame
        float[] values = {0, 10, 20, 30, 40, 50, 60, 100};
        List<Frame> frames = extractor.extractFrames(new PixelPayload(new int[]{2, 2, 2}, values), " MONOCHROME1 ");

        assertEquals(100f, frames.get(0).get(0, 0), 0f);
        assertEquals(70f, frames.get(0).get(1, 1), 0f);
        assertEquals(0f, frames.get(1).get(1, 1), 0f);
    }

    @Test
    public void testInversionIsSelfInverse() {
        PixelPayload payload = PixelPayload.of2D(new float[][]{{-5, 3}, {12, 7}});
        PixelPayload twice = FrameExtractor.invert(FrameExtractor.invert(payload, payload.max()), payload.max());
        for (int i = 0; i < payload.size(); i++) {
            assertEquals(payload.get(i), twice.get(i), 0f);
        }
    }

    @Test
    public void testOneDimensionalPayloadIsRejected() {
        try {
            extractor.extractFrames(new PixelPayload(new int[]{4}, new float[4]), "");
            fail("expected one dimensional payload to be rejected");
        } catch (InconsistencyException expected) {
            assertTrue(expected.getMessage().contains("1 dimension"));
        }
    }

    @Test
    public void testInstanceWithoutPixels() throws Exception {
        Instance instance = Instance.builder("sr.dcm").attribute(Keyword.SeriesInstanceUID, "1.2").build();
        assertTrue(extractor.extractFrames(instance).isEmpty());
    }

    @Test
    public void testNormalizingExtraction() throws Exception {
        FrameExtractor normalizing = new FrameExtractor(true);
        Frame frame = normalizing.extractFrames(PixelPayload.of2D(new float[][]{{-1000, 0}, {1000, 3000}}), "").get(0);

        assertEquals(0f, frame.min(), 0f);
        assertEquals(255f, frame.max(), 0f);
        assertEquals(63f, frame.get(0, 1), 0f);
    }
}
