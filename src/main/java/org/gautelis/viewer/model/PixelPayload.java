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

import java.util.Arrays;

/**
 * Raw numeric pixel data of one instance, stored row-major with the last two
 * axes being rows and columns.
 */
public final class PixelPayload {
    private final int[] shape;
    private final float[] values;

    public PixelPayload(int[] shape, float[] values) {
        if (null == shape || null == values) {
            throw new NullPointerException("shape and values are required");
        }
        long expected = 1L;
        for (int extent : shape) {
            if (extent < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            expected *= extent;
        }
        if (expected != values.length) {
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(shape) + " does not match " + values.length + " values");
        }
        this.shape = shape.clone();
        this.values = values;
    }

    public static PixelPayload of2D(float[][] rows) {
        int height = rows.length;
        int width = height > 0 ? rows[0].length : 0;
        float[] values = new float[height * width];
        for (int r = 0; r < height; r++) {
            if (rows[r].length != width) {
                throw new IllegalArgumentException("Ragged row " + r);
            }
            System.arraycopy(rows[r], 0, values, r * width, width);
        }
        return new PixelPayload(new int[]{height, width}, values);
    }

    public int getDimensions() {
        return shape.length;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int size() {
        return values.length;
    }

    public float get(int index) {
        return values[index];
    }

    /**
     * Copies a contiguous run of values, e.g. one frame, into a new array.
     */
    public float[] copyRange(int from, int length) {
        return Arrays.copyOfRange(values, from, from + length);
    }

    public float max() {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            if (v > max) {
                max = v;
            }
        }
        return max;
    }
}
