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

import org.gautelis.viewer.model.SeriesMetadata;

import java.util.Objects;

/**
 * Composite sort key of one frame within its series:
 * (instance number, image index, acquisition number, acquisition time in
 * seconds, frame index within the instance), compared lexicographically.
 * Missing numeric hints sort last. Keys that tie on all of these are
 * finally ordered by source name.
 */
public final class OrderingKey implements Comparable<OrderingKey> {
    public static final double SORT_LAST = 1e12;

    private final double instanceNumber;
    private final double imageIndex;
    private final double acquisitionNumber;
    private final double acquisitionTimeSeconds;
    private final int localFrameIndex;
    private final String sourceName;

    public OrderingKey(
            double instanceNumber, double imageIndex, double acquisitionNumber,
            double acquisitionTimeSeconds, int localFrameIndex, String sourceName
    ) {
        this.instanceNumber = instanceNumber;
        this.imageIndex = imageIndex;
        this.acquisitionNumber = acquisitionNumber;
        this.acquisitionTimeSeconds = acquisitionTimeSeconds;
        this.localFrameIndex = localFrameIndex;
        this.sourceName = null == sourceName ? "" : sourceName;
    }

    /**
     * Key shared by all frames of an instance; specialize per frame with {@link #forFrame(int)}.
     */
    public static OrderingKey of(SeriesMetadata metadata, String sourceName) {
        return new OrderingKey(
                metadata.getInstanceNumber().orElse(SORT_LAST),
                metadata.getImageIndex().orElse(SORT_LAST),
                metadata.getAcquisitionNumber().orElse(SORT_LAST),
                AcquisitionTime.toSeconds(metadata.getAcquisitionTime()),
                0, sourceName
        );
    }

    public OrderingKey forFrame(int localFrameIndex) {
        return new OrderingKey(
                instanceNumber, imageIndex, acquisitionNumber,
                acquisitionTimeSeconds, localFrameIndex, sourceName
        );
    }

    public double getInstanceNumber() {
        return instanceNumber;
    }

    public double getImageIndex() {
        return imageIndex;
    }

    public double getAcquisitionNumber() {
        return acquisitionNumber;
    }

    public double getAcquisitionTimeSeconds() {
        return acquisitionTimeSeconds;
    }

    public int getLocalFrameIndex() {
        return localFrameIndex;
    }

    @Override
    public int compareTo(OrderingKey other) {
        int c = Double.compare(instanceNumber, other.instanceNumber);
        if (c != 0) {
            return c;
        }
        c = Double.compare(imageIndex, other.imageIndex);
        if (c != 0) {
            return c;
        }
        c = Double.compare(acquisitionNumber, other.acquisitionNumber);
        if (c != 0) {
            return c;
        }
        c = Double.compare(acquisitionTimeSeconds, other.acquisitionTimeSeconds);
        if (c != 0) {
            return c;
        }
        c = Integer.compare(localFrameIndex, other.localFrameIndex);
        if (c != 0) {
            return c;
        }
        return sourceName.compareTo(other.sourceName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderingKey)) {
            return false;
        }
        return compareTo((OrderingKey) o) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceNumber, imageIndex, acquisitionNumber,
                acquisitionTimeSeconds, localFrameIndex, sourceName);
    }

    @Override
    public String toString() {
        return "(" + instanceNumber + ", " + imageIndex + ", " + acquisitionNumber + ", "
                + acquisitionTimeSeconds + ", " + localFrameIndex + ", " + sourceName + ")";
    }
}
