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

import org.gautelis.viewer.model.Frame;
import org.junit.Test;

import static org.junit.Assert.*;

public class NormalizerTest {
    private final Normalizer normalizer = new Normalizer();

    private static final Frame CT = Frame.of(new float[][]{
            {-1024, -500, 0},
            {40, 400, 3071}
    });

    @Test
    public void testAutoWindowSpansFullRange() {
        DisplayBuffer buffer = normalizer.normalizeWindow(CT, null, null);
        assertEquals(3, buffer.getWidth());
        assertEquals(2, buffer.getHeight());
        assertEquals(1, buffer.getChannels());
        assertEquals(0, buffer.get(0, 0));
        assertEquals(255, buffer.get(2, 1));
    }

    @Test
    public void testExplicitWindowClips() {
        // Soft tissue window: [-160, 240]
        DisplayBuffer buffer = normalizer.normalizeWindow(CT, 400.0, 40.0);

        assertEquals(0, buffer.get(0, 0));
        assertEquals(0, buffer.get(1, 0));
        assertEquals(102, buffer.get(2, 0));
        assertEquals(127, buffer.get(0, 1));
        assertEquals(255, buffer.get(1, 1));
        assertEquals(255, buffer.get(2, 1));
    }

    @Test
    public void testOutputStaysInByteRange() {
        for (double width : new double[]{0.0, 0.5, 1.0, 255.0, 1e6}) {
            for (double level : new double[]{-5000.0, 0.0, 128.0, 5000.0}) {
                DisplayBuffer buffer = normalizer.normalizeWindow(CT, width, level);
                for (int i = 0; i < CT.size(); i++) {
                    int v = buffer.get(i);
                    assertTrue("value " + v + " for " + width + "/" + level, v >= 0 && v <= 255);
                }
            }
        }
    }

    @Test
    public void testZeroWidthWindowIsNotRescaled() {
        Frame frame = Frame.of(new float[][]{{50, 100, 150}});
        DisplayBuffer buffer = normalizer.normalizeWindow(frame, 0.0, 100.0);
        assertArrayEquals(new byte[]{0, 0, 0}, buffer.getData());

        // Constant frame with a zero width window centered on its value
        Frame constant = Frame.of(new float[][]{{42, 42}, {42, 42}});
        assertArrayEquals(new byte[4], normalizer.normalizeWindow(constant, 0.0, 42.0).getData());

        // A constant frame is auto-windowed to black
        Frame flat = Frame.of(new float[][]{{7, 7}, {7, 7}});
        assertArrayEquals(new byte[4], normalizer.normalize(flat, WindowLevel.AUTO).getData());
    }

    @Test
    public void testPassthrough() {
        Frame frame = Frame.of(new float[][]{{-3, 12.7f, 300}});
        DisplayBuffer buffer = normalizer.normalize(frame, NormalizationMode.RAW_PASSTHROUGH, WindowLevel.of(10, 5));
        assertEquals(0, buffer.get(0));
        assertEquals(12, buffer.get(1));
        assertEquals(255, buffer.get(2));
    }

    @Test
    public void testExplicitModeWithoutWindowFallsBackOnAuto() {
        assertEquals(
                normalizer.normalize(CT, WindowLevel.AUTO),
                normalizer.normalize(CT, NormalizationMode.EXPLICIT_WINDOW, WindowLevel.AUTO));
    }
}
