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
import org.gautelis.viewer.render.DisplayBuffer;
import org.gautelis.viewer.render.Normalizer;
import org.gautelis.viewer.render.WindowLevel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Splits the pixel payload of an instance into 2-D frames.
 * <p>
 * A 2-D payload is one frame. For higher dimensionality the two last axes are
 * rows and columns and every leading axis is flattened into a single frame
 * axis, in row-major order. This assumes that leading axes index frames (or
 * slices), which holds for multi-frame grayscale data but not for interleaved
 * colour data.
 */
public class FrameExtractor {
    public static final String MONOCHROME1 = "MONOCHROME1";

    private final boolean normalizeFrames;
    private final Normalizer normalizer = new Normalizer();

    /**
     * @param normalizeFrames if true, each frame is auto-windowed into 0..255 on
     *                        extraction; otherwise frames keep their native range
     */
    public FrameExtractor(boolean normalizeFrames) {
        this.normalizeFrames = normalizeFrames;
    }

    public FrameExtractor() {
        this(false);
    }

    public boolean normalizesFrames() {
        return normalizeFrames;
    }

    public List<Frame> extractFrames(Instance instance) throws IOException, InconsistencyException {
        Optional<PixelPayload> payload = instance.loadPixelData();
        if (!payload.isPresent()) {
            return Collections.emptyList();
        }
        String photometric = instance.getAttribute(Keyword.PhotometricInterpretation).orElse("");
        return extractFrames(payload.get(), photometric);
    }

    public List<Frame> extractFrames(PixelPayload payload, String photometricInterpretation)
            throws InconsistencyException {

        int[] shape = payload.getShape();
        if (shape.length < 2) {
            throw new InconsistencyException(
                    "Pixel payload has " + shape.length + " dimension(s), at least 2 expected");
        }

        if (null != photometricInterpretation && MONOCHROME1.equals(photometricInterpretation.trim())) {
            // Global maximum is taken over the whole payload, before splitting
            payload = invert(payload, payload.max());
        }

        int rows = shape[shape.length - 2];
        int columns = shape[shape.length - 1];
        int frameSize = rows * columns;
        int frameCount = 1;
        for (int i = 0; i < shape.length - 2; i++) {
            frameCount *= shape[i];
        }

        List<Frame> frames = new ArrayList<>(frameCount);
        for (int f = 0; f < frameCount; f++) {
            Frame frame = new Frame(rows, columns, payload.copyRange(f * frameSize, frameSize));
            if (normalizeFrames) {
                frame = toFrame(normalizer.normalize(frame, WindowLevel.AUTO));
            }
            frames.add(frame);
        }
        return frames;
    }

    /**
     * Maps every value v to globalMax - v. Applying this twice with the same
     * globalMax restores the original values.
     */
    public static PixelPayload invert(PixelPayload payload, float globalMax) {
        float[] inverted = new float[payload.size()];
        for (int i = 0; i < inverted.length; i++) {
            inverted[i] = globalMax - payload.get(i);
        }
        return new PixelPayload(payload.getShape(), inverted);
    }

    private static Frame toFrame(DisplayBuffer buffer) {
        float[] values = new float[buffer.getWidth() * buffer.getHeight()];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.get(i);
        }
        return new Frame(buffer.getHeight(), buffer.getWidth(), values);
    }
}
