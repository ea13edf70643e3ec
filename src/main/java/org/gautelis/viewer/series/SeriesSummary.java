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
package org.gautelis.viewer.series;

import org.gautelis.viewer.model.Series;
import org.gautelis.viewer.model.SeriesMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a series selection list shows about a series.
 */
public final class SeriesSummary {
    private final String seriesUID;
    private final String modality;
    private final String seriesDescription;
    private final String studyDescription;
    private final String patientName;
    private final String patientId;
    private final int frameCount;
    private final List<String> examples;

    private SeriesSummary(Series series, int maxExamples) {
        SeriesMetadata md = series.getMetadata();
        this.seriesUID = series.getSeriesUID();
        this.modality = md.getModality();
        this.seriesDescription = md.getSeriesDescription();
        this.studyDescription = md.getStudyDescription();
        this.patientName = md.getPatientName();
        this.patientId = md.getPatientId();
        this.frameCount = series.getFrameCount();

        List<String> names = series.getSourceNames();
        this.examples = Collections.unmodifiableList(
                new ArrayList<>(names.subList(0, Math.min(names.size(), Math.max(0, maxExamples)))));
    }

    /**
     * @param maxExamples the most source names to list
     */
    public static SeriesSummary of(Series series, int maxExamples) {
        return new SeriesSummary(series, maxExamples);
    }

    public String getSeriesUID() {
        return seriesUID;
    }

    public String getModality() {
        return modality;
    }

    public String getSeriesDescription() {
        return seriesDescription;
    }

    public String getStudyDescription() {
        return studyDescription;
    }

    public String getPatientName() {
        return patientName;
    }

    public String getPatientId() {
        return patientId;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public List<String> getExamples() {
        return examples;
    }

    /**
     * @return e.g. "Doe, John (12345) -- CT Thorax"
     */
    public String getLabel() {
        return patientName + " (" + patientId + ") -- " + modality + " " + seriesDescription;
    }

    @Override
    public String toString() {
        return "SeriesSummary{" + seriesUID + ", " + modality + " '" + seriesDescription + "', frames=" + frameCount + "}";
    }
}
