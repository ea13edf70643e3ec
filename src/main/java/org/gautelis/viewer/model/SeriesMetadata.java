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

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Normalized metadata of one instance. Descriptive fields are never null
 * (absent values are empty strings); ordering hints are optional.
 */
public final class SeriesMetadata {
    private final String seriesUID;
    private final String patientName;
    private final String patientId;
    private final String studyDescription;
    private final String seriesDescription;
    private final String modality;
    private final String photometricInterpretation;
    private final Double instanceNumber;
    private final Double imageIndex;
    private final Double acquisitionNumber;
    private final String acquisitionTime;

    private SeriesMetadata(Builder b) {
        this.seriesUID = Objects.requireNonNull(b.seriesUID, "series UID");
        this.patientName = b.patientName;
        this.patientId = b.patientId;
        this.studyDescription = b.studyDescription;
        this.seriesDescription = b.seriesDescription;
        this.modality = b.modality;
        this.photometricInterpretation = b.photometricInterpretation;
        this.instanceNumber = b.instanceNumber;
        this.imageIndex = b.imageIndex;
        this.acquisitionNumber = b.acquisitionNumber;
        this.acquisitionTime = b.acquisitionTime;
    }

    public static Builder builder(String seriesUID) {
        return new Builder(seriesUID);
    }

    public String getSeriesUID() {
        return seriesUID;
    }

    public String getPatientName() {
        return patientName;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getStudyDescription() {
        return studyDescription;
    }

    public String getSeriesDescription() {
        return seriesDescription;
    }

    public String getModality() {
        return modality;
    }

    public String getPhotometricInterpretation() {
        return photometricInterpretation;
    }

    public OptionalDouble getInstanceNumber() {
        return null == instanceNumber ? OptionalDouble.empty() : OptionalDouble.of(instanceNumber);
    }

    public OptionalDouble getImageIndex() {
        return null == imageIndex ? OptionalDouble.empty() : OptionalDouble.of(imageIndex);
    }

    public OptionalDouble getAcquisitionNumber() {
        return null == acquisitionNumber ? OptionalDouble.empty() : OptionalDouble.of(acquisitionNumber);
    }

    /**
     * @return acquisition time as HHMMSS[.ffffff], or empty string
     */
    public String getAcquisitionTime() {
        return acquisitionTime;
    }

    @Override
    public String toString() {
        return "SeriesMetadata{" + seriesUID + ", " + modality + " '" + seriesDescription + "'}";
    }

    public static final class Builder {
        private final String seriesUID;
        private String patientName = "";
        private String patientId = "";
        private String studyDescription = "";
        private String seriesDescription = "";
        private String modality = "";
        private String photometricInterpretation = "";
        private Double instanceNumber = null;
        private Double imageIndex = null;
        private Double acquisitionNumber = null;
        private String acquisitionTime = "";

        private Builder(String seriesUID) {
            this.seriesUID = seriesUID;
        }

        public Builder patientName(String patientName) {
            this.patientName = orEmpty(patientName);
            return this;
        }

        public Builder patientId(String patientId) {
            this.patientId = orEmpty(patientId);
            return this;
        }

        public Builder studyDescription(String studyDescription) {
            this.studyDescription = orEmpty(studyDescription);
            return this;
        }

        public Builder seriesDescription(String seriesDescription) {
            this.seriesDescription = orEmpty(seriesDescription);
            return this;
        }

        public Builder modality(String modality) {
            this.modality = orEmpty(modality);
            return this;
        }

        public Builder photometricInterpretation(String photometricInterpretation) {
            this.photometricInterpretation = orEmpty(photometricInterpretation);
            return this;
        }

        public Builder instanceNumber(Double instanceNumber) {
            this.instanceNumber = instanceNumber;
            return this;
        }

        public Builder imageIndex(Double imageIndex) {
            this.imageIndex = imageIndex;
            return this;
        }

        public Builder acquisitionNumber(Double acquisitionNumber) {
            this.acquisitionNumber = acquisitionNumber;
            return this;
        }

        public Builder acquisitionTime(String acquisitionTime) {
            this.acquisitionTime = orEmpty(acquisitionTime);
            return this;
        }

        public SeriesMetadata build() {
            return new SeriesMetadata(this);
        }

        private static String orEmpty(String s) {
            return null == s ? "" : s;
        }
    }
}
