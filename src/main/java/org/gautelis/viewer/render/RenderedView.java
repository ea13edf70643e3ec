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

/**
 * A display buffer together with the request it was rendered for.
 */
public final class RenderedView {

    public enum Quality {
        /** Coarse, unwindowed preview */
        INSTANT,

        /** Windowed and resampled result */
        FINAL
    }

    private final RenderRequest request;
    private final DisplayBuffer buffer;
    private final Quality quality;

    public RenderedView(RenderRequest request, DisplayBuffer buffer, Quality quality) {
        this.request = request;
        this.buffer = buffer;
        this.quality = quality;
    }

    public RenderRequest getRequest() {
        return request;
    }

    public DisplayBuffer getBuffer() {
        return buffer;
    }

    public Quality getQuality() {
        return quality;
    }

    public boolean isFinal() {
        return quality == Quality.FINAL;
    }

    @Override
    public String toString() {
        return "RenderedView{" + quality + ", " + request + ", " + buffer + "}";
    }
}
