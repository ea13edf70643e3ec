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
package org.gautelis.viewer.session;

import org.gautelis.viewer.model.Frame;
import org.gautelis.viewer.render.DisplayBuffer;
import org.gautelis.viewer.render.Normalizer;
import org.gautelis.viewer.render.WindowLevel;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;

/**
 * Encodes frames as auto-windowed 8-bit PNG images.
 */
public class FrameEncoder {
    public static final String FORMAT = "png";

    private final Normalizer normalizer = new Normalizer();

    public EncodedFrame encode(int frameIndex, Frame frame, int totalFrames) {
        DisplayBuffer buffer = normalizer.normalize(frame, WindowLevel.AUTO);
        String data = Base64.getEncoder().encodeToString(toPng(buffer));
        return new EncodedFrame(frameIndex, data, buffer.getWidth(), buffer.getHeight(), totalFrames);
    }

    public byte[] toPng(DisplayBuffer buffer) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(buffer.toBufferedImage(), FORMAT, out)) {
                throw new IllegalStateException("No image writer for " + FORMAT);
            }
            return out.toByteArray();

        } catch (IOException ioe) {
            throw new UncheckedIOException("Failed to encode " + buffer, ioe);
        }
    }
}
