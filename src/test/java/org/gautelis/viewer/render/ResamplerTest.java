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

public class ResamplerTest {
    private final Resampler resampler = new Resampler();

    private static DisplayBuffer gradient(int width, int height) {
        byte[] data = new byte[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[y * width + x] = (byte) ((x * 255) / Math.max(1, width - 1));
            }
        }
        return new DisplayBuffer(width, height, 1, data);
    }

    @Test
    public void testTargetSize() {
        assertArrayEquals(new int[]{512, 256}, Resampler.targetSize(512, 256, 0, 100));
        assertArrayEquals(new int[]{128, 64}, Resampler.targetSize(512, 256, 128, 100));
        assertArrayEquals(new int[]{256, 128}, Resampler.targetSize(512, 256, 128, 200));
        assertArrayEquals(new int[]{5, 1}, Resampler.targetSize(1000, 1, 10, 50));
        assertArrayEquals(new int[]{1, 1}, Resampler.targetSize(1000, 1, 1, 50));
    }

    @Test
    public void testNearestNeighborDoubling() {
        DisplayBuffer source = new DisplayBuffer(2, 1, 1, new byte[]{10, (byte) 200});
        DisplayBuffer scaled = resampler.scale(source, 0, 200, Interpolation.NEAREST_NEIGHBOR);

        assertEquals(4, scaled.getWidth());
        assertEquals(2, scaled.getHeight());
        assertEquals(10, scaled.get(0, 0));
        assertEquals(10, scaled.get(1, 1));
        assertEquals(200, scaled.get(2, 0));
        assertEquals(200, scaled.get(3, 1));
    }

    @Test
    public void testSmoothInterpolationKeepsSizeAndRange() {
        DisplayBuffer source = gradient(64, 32);
        for (Interpolation interpolation : new Interpolation[]{Interpolation.BILINEAR, Interpolation.BICUBIC}) {
            DisplayBuffer scaled = resampler.scale(source, 0, 50, interpolation);
            assertEquals(32, scaled.getWidth());
            assertEquals(16, scaled.getHeight());
            assertEquals(1, scaled.getChannels());

            // Left edge stays dark, right edge stays bright
            assertTrue(scaled.get(0, 8) < 32);
            assertTrue(scaled.get(31, 8) > 223);
        }
    }

    @Test
    public void testRgbResize() {
        DisplayBuffer rgb = gradient(8, 8).toRgb();
        DisplayBuffer scaled = resampler.resize(rgb, 16, 16, Interpolation.BILINEAR);
        assertEquals(3, scaled.getChannels());
        assertEquals(16 * 16 * 3, scaled.getData().length);
    }

    @Test
    public void testSameSizeIsUntouched() {
        DisplayBuffer source = gradient(10, 10);
        assertSame(source, resampler.scale(source, 0, 100, Interpolation.BICUBIC));
    }
}
