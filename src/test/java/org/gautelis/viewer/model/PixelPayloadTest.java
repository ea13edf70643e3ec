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
package org.gautelis.viewer.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class PixelPayloadTest {

    @Test
    public void testShapeMustMatchValues() {
        try {
            new PixelPayload(new int[]{2, 3}, new float[5]);
            fail("expected shape mismatch to be rejected");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }

    @Test
    public void testOf2D() {
        PixelPayload payload = PixelPayload.of2D(new float[][]{{1, 2, 3}, {4, 5, 6}});
        assertEquals(2, payload.getDimensions());
        assertArrayEquals(new int[]{2, 3}, payload.getShape());
        assertEquals(6, payload.size());
        assertEquals(6f, payload.max(), 0f);
        assertArrayEquals(new float[]{4, 5}, payload.copyRange(3, 2), 0f);
    }

    @Test
    public void testFrameIsImmutable() {
        float[] values = {1, 2, 3, 4};
        Frame frame = new Frame(2, 2, values);
        values[0] = 100;
        assertEquals(1f, frame.get(0, 0), 0f);

        frame.getValues()[1] = 100;
        assertEquals(2f, frame.get(0, 1), 0f);

        assertEquals(1f, frame.min(), 0f);
        assertEquals(4f, frame.max(), 0f);
        assertEquals(Frame.of(new float[][]{{1, 2}, {3, 4}}), frame);
    }
}
