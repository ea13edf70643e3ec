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

import java.awt.geom.AffineTransform;
import java.awt.image.AffineTransformOp;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;

/**
 * Changes the spatial sampling of a display buffer. Nearest neighbor only
 * picks existing samples, so it never produces values that were not in
 * the source.
 */
public class Resampler {

    /**
     * Computes the output size for a buffer of the given size, scaled so that its
     * longest side fits targetMaxDimension and then zoomed.
     *
     * @param targetMaxDimension longest side before zoom, or 0 to keep the source size
     * @param zoomPercent        zoom, 100 being no zoom
     * @return {width, height}, neither less than 1
     */
    public static int[] targetSize(int width, int height, int targetMaxDimension, int zoomPercent) {
        double scale = 1.0;
        int longest = Math.max(width, height);
        if (targetMaxDimension > 0 && longest > 0) {
            scale = (double) targetMaxDimension / longest;
        }
        scale *= zoomPercent / 100.0;
        return new int[]{
                Math.max(1, (int) Math.round(width * scale)),
                Math.max(1, (int) Math.round(height * scale))
        };
    }

    public DisplayBuffer scale(DisplayBuffer source, int targetMaxDimension, int zoomPercent, Interpolation interpolation) {
        if (source.getWidth() == 0 || source.getHeight() == 0) {
            return source;
        }
        int[] size = targetSize(source.getWidth(), source.getHeight(), targetMaxDimension, zoomPercent);
        return resize(source, size[0], size[1], interpolation);
    }

    public DisplayBuffer resize(DisplayBuffer source, int width, int height, Interpolation interpolation) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid target size " + width + "x" + height);
        }
        if (width == source.getWidth() && height == source.getHeight()) {
            return source;
        }
        if (interpolation == Interpolation.NEAREST_NEIGHBOR) {
            return nearest(source, width, height);
        }
        return transform(source, width, height, interpolation);
    }

    private DisplayBuffer nearest(DisplayBuffer source, int width, int height) {
        int channels = source.getChannels();
        int sw = source.getWidth();
        int sh = source.getHeight();
        byte[] src = source.data();
        byte[] out = new byte[width * height * channels];

        for (int y = 0; y < height; y++) {
            int sy = Math.min(sh - 1, (int) ((long) y * sh / height));
            for (int x = 0; x < width; x++) {
                int sx = Math.min(sw - 1, (int) ((long) x * sw / width));
                System.arraycopy(src, (sy * sw + sx) * channels, out, (y * width + x) * channels, channels);
            }
        }
        return new DisplayBuffer(width, height, channels, out);
    }

    private DisplayBuffer transform(DisplayBuffer source, int width, int height, Interpolation interpolation) {
        int channels = source.getChannels();
        int sw = source.getWidth();
        int sh = source.getHeight();

        int[] bandOffsets = channels == 1 ? new int[]{0} : new int[]{0, 1, 2};
        Raster src = Raster.createInterleavedRaster(
                new DataBufferByte(source.data(), source.data().length),
                sw, sh, sw * channels, channels, bandOffsets, null);
        WritableRaster dst = Raster.createInterleavedRaster(DataBuffer.TYPE_BYTE, width, height, channels, null);

        AffineTransform at = AffineTransform.getScaleInstance((double) width / sw, (double) height / sh);
        AffineTransformOp op = new AffineTransformOp(at, interpolation.getTransformType());
        op.filter(src, dst);

        byte[] out = ((DataBufferByte) dst.getDataBuffer()).getData();
        return new DisplayBuffer(width, height, channels, out);
    }
}
