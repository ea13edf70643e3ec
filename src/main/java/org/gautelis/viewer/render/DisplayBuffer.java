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

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * An 8-bit display image, either single channel (gray) or interleaved RGB.
 */
public final class DisplayBuffer {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    public DisplayBuffer(int width, int height, int channels, byte[] data) {
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Only 1 or 3 channels supported: " + channels);
        }
        if ((long) width * height * channels != data.length) {
            throw new IllegalArgumentException(
                    "Buffer " + width + "x" + height + "x" + channels + " does not match " + data.length + " bytes");
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * @return sample at the given byte position, as an unsigned value 0..255
     */
    public int get(int index) {
        return data[index] & 0xff;
    }

    public int get(int x, int y) {
        return get((y * width + x) * channels);
    }

    public byte[] getData() {
        return data.clone();
    }

    /* package private */
    byte[] data() {
        return data;
    }

    /**
     * @return an RGB buffer with the gray value replicated in each channel
     */
    public DisplayBuffer toRgb() {
        if (channels == 3) {
            return this;
        }
        byte[] rgb = new byte[data.length * 3];
        for (int i = 0; i < data.length; i++) {
            rgb[3 * i] = data[i];
            rgb[3 * i + 1] = data[i];
            rgb[3 * i + 2] = data[i];
        }
        return new DisplayBuffer(width, height, 3, rgb);
    }

    public BufferedImage toBufferedImage() {
        BufferedImage image;
        if (channels == 1) {
            image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            System.arraycopy(data, 0, target, 0, data.length);
        } else {
            image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
            byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < data.length; i += 3) {
                target[i] = data[i + 2];
                target[i + 1] = data[i + 1];
                target[i + 2] = data[i];
            }
        }
        return image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DisplayBuffer)) {
            return false;
        }
        DisplayBuffer other = (DisplayBuffer) o;
        return width == other.width && height == other.height
                && channels == other.channels && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "DisplayBuffer{" + width + "x" + height + (channels == 3 ? " RGB" : " gray") + "}";
    }
}
