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
 * One 2-D numeric image, the unit of display and caching. Immutable.
 */
public final class Frame {
    private final int rows;
    private final int columns;
    private final float[] values;

    public Frame(int rows, int columns, float[] values) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Negative frame dimensions " + rows + "x" + columns);
        }
        if ((long) rows * columns != values.length) {
            throw new IllegalArgumentException(
                    "Frame " + rows + "x" + columns + " does not match " + values.length + " values");
        }
        this.rows = rows;
        this.columns = columns;
        this.values = values.clone();
    }

    public static Frame of(float[][] data) {
        PixelPayload payload = PixelPayload.of2D(data);
        int[] shape = payload.getShape();
        return new Frame(shape[0], shape[1], payload.copyRange(0, payload.size()));
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int size() {
        return values.length;
    }

    public float get(int index) {
        return values[index];
    }

    public float get(int row, int column) {
        return values[row * columns + column];
    }

    public float[] getValues() {
        return values.clone();
    }

    public float min() {
        float min = Float.POSITIVE_INFINITY;
        for (float v : values) {
            if (v < min) {
                min = v;
            }
        }
        return min;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame)) {
            return false;
        }
        Frame other = (Frame) o;
        return rows == other.rows && columns == other.columns && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + columns) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Frame{" + rows + "x" + columns + "}";
    }
}
