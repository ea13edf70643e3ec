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

import java.util.Base64;

/**
 * A frame as handed out at the session boundary: a base64 encoded PNG and its size.
 */
public final class EncodedFrame {
    private final int frameIndex;
    private final String data;
    private final int width;
    private final int height;
    private final int totalFrames;

    public EncodedFrame(int frameIndex, String data, int width, int height, int totalFrames) {
        this.frameIndex = frameIndex;
        this.data = data;
        this.width = width;
        this.height = height;
        this.totalFrames = totalFrames;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    /**
     * @return base64 encoded PNG
     */
    public String getData() {
        return data;
    }

    public byte[] getPng() {
        return Base64.getDecoder().decode(data);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getTotalFrames() {
        return totalFrames;
    }

    @Override
    public String toString() {
        return "EncodedFrame{" + (frameIndex + 1) + "/" + totalFrames + ", " + width + "x" + height + "}";
    }
}
