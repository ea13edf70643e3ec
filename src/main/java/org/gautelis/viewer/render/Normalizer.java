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

/**
 * Maps a frame of arbitrary numeric range into an 8-bit gray buffer.
 * <p>
 * Values are clipped into the window and rescaled linearly so that the lower
 * bound maps to 0 and the upper bound to 255. A window of zero width is not
 * rescaled; values are shifted by the lower bound only. Stateless, so a single
 * instance may be shared between threads.
 */
public class Normalizer {

    public DisplayBuffer normalizeWindow(Frame frame, Double windowWidth, Double windowLevel) {
        return normalize(frame, WindowLevel.ofNullable(windowWidth, windowLevel));
    }

    public DisplayBuffer normalize(Frame frame, WindowLevel window) {
        return normalize(frame, window.isAuto() ? NormalizationMode.AUTO_WINDOW : NormalizationMode.EXPLICIT_WINDOW, window);
    }

    public DisplayBuffer normalize(Frame frame, NormalizationMode mode, WindowLevel window) {
        switch (mode) {
            case RAW_PASSTHROUGH:
                return passthrough(frame);

            case EXPLICIT_WINDOW:
                if (!window.isAuto()) {
                    return rescale(frame, window.getLow(), window.getHigh());
                }
                // No explicit window to apply, so fall back on the frame's own range
                return autoWindow(frame);

            case AUTO_WINDOW:
            default:
                return autoWindow(frame);
        }
    }

    private DisplayBuffer autoWindow(Frame frame) {
        return rescale(frame, frame.min(), frame.max());
    }

    private DisplayBuffer rescale(Frame frame, double low, double high) {
        int n = frame.size();
        byte[] out = new byte[n];
        double range = high - low;
        for (int i = 0; i < n; i++) {
            double v = Math.min(Math.max(frame.get(i), low), high);
            double unit = range > 0.0 ? (v - low) / range : v - low;
            out[i] = (byte) clamp((int) (unit * 255.0));
        }
        return new DisplayBuffer(frame.getColumns(), frame.getRows(), 1, out);
    }

    private DisplayBuffer passthrough(Frame frame) {
        int n = frame.size();
        byte[] out = new byte[n];
        for (int i = 0; i < n; i++) {
            out[i] = (byte) clamp((int) frame.get(i));
        }
        return new DisplayBuffer(frame.getColumns(), frame.getRows(), 1, out);
    }

    private static int clamp(int v) {
        return v < 0 ? 0 : Math.min(v, 255);
    }
}
