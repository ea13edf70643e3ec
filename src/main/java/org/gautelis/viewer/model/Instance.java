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

import org.gautelis.viewer.InconsistencyException;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One decoded source payload: a metadata dictionary plus, possibly, a pixel
 * payload. Read-only once constructed.
 * <p>
 * Pixel data is reached through a {@link PixelLoader}, so that a payload whose
 * header decodes but whose pixel data does not may still contribute metadata.
 */
public final class Instance {

    public interface PixelLoader {
        PixelPayload load() throws IOException, InconsistencyException;
    }

    private final String sourceName;
    private final Map<Keyword, String> attributes;
    private final PixelLoader pixelLoader;

    private Instance(String sourceName, Map<Keyword, String> attributes, PixelLoader pixelLoader) {
        this.sourceName = sourceName;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.pixelLoader = pixelLoader;
    }

    public static Builder builder(String sourceName) {
        return new Builder(sourceName);
    }

    public String getSourceName() {
        return sourceName;
    }

    public Optional<String> getAttribute(Keyword keyword) {
        return Optional.ofNullable(attributes.get(keyword));
    }

    public Map<Keyword, String> getAttributes() {
        return attributes;
    }

    public boolean hasPixelData() {
        return null != pixelLoader;
    }

    /**
     * @return the pixel payload, or empty if this instance carries none
     * @throws IOException if pixel data could not be read
     * @throws InconsistencyException if pixel data is malformed
     */
    public Optional<PixelPayload> loadPixelData() throws IOException, InconsistencyException {
        if (null == pixelLoader) {
            return Optional.empty();
        }
        return Optional.ofNullable(pixelLoader.load());
    }

    @Override
    public String toString() {
        return "Instance{" + sourceName + "}";
    }

    public static final class Builder {
        private final String sourceName;
        private final Map<Keyword, String> attributes = new EnumMap<>(Keyword.class);
        private PixelLoader pixelLoader = null;

        private Builder(String sourceName) {
            this.sourceName = null == sourceName ? "" : sourceName;
        }

        public Builder attribute(Keyword keyword, String value) {
            if (null != value) {
                attributes.put(keyword, value);
            }
            return this;
        }

        public Builder pixels(PixelPayload payload) {
            this.pixelLoader = null == payload ? null : () -> payload;
            return this;
        }

        public Builder pixels(PixelLoader loader) {
            this.pixelLoader = loader;
            return this;
        }

        public Instance build() {
            return new Instance(sourceName, new EnumMap<>(attributes), pixelLoader);
        }
    }
}
