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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finalized series: descriptive metadata snapshotted from the first instance
 * seen with this series UID, and the frames of all its instances in their
 * permanent order.
 */
public final class Series {
    private final SeriesMetadata metadata;
    private final List<Frame> frames;
    private final List<String> sourceNames;

    public Series(SeriesMetadata metadata, List<Frame> frames, List<String> sourceNames) {
        this.metadata = metadata;
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        this.sourceNames = Collections.unmodifiableList(new ArrayList<>(sourceNames));
    }

    public String getSeriesUID() {
        return metadata.getSeriesUID();
    }

    public SeriesMetadata getMetadata() {
        return metadata;
    }

    public List<Frame> getFrames() {
        return frames;
    }

    public int getFrameCount() {
        return frames.size();
    }

    public Frame getFrame(int index) {
        return frames.get(index);
    }

    /**
     * @return names of the payloads absorbed into this series, in order of absorption
     */
    public List<String> getSourceNames() {
        return sourceNames;
    }

    @Override
    public String toString() {
        return "Series{" + metadata.getSeriesUID() + ", frames=" + frames.size() + "}";
    }
}
