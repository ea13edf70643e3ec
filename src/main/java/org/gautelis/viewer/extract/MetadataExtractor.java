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

import org.apache.commons.lang3.StringUtils;
import org.gautelis.viewer.model.Instance;
import org.gautelis.viewer.model.Keyword;
import org.gautelis.viewer.model.SeriesMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Produces normalized {@link SeriesMetadata} from a decoded instance.
 */
public class MetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    // DICOM pads string values with spaces (or NUL for UIDs)
    private static final String PADDING = " \0";

    /**
     * @param instance the decoded instance
     * @return metadata, or empty if the instance has no usable series instance UID
     */
    public Optional<SeriesMetadata> extract(Instance instance) {
        String seriesUID = value(instance, Keyword.SeriesInstanceUID);
        if (seriesUID.isEmpty()) {
            log.debug("No series instance UID in {}", instance.getSourceName());
            return Optional.empty();
        }

        SeriesMetadata metadata = SeriesMetadata.builder(seriesUID)
                .patientName(PersonNameFormatter.format(value(instance, Keyword.PatientName)))
                .patientId(value(instance, Keyword.PatientID))
                .studyDescription(value(instance, Keyword.StudyDescription))
                .seriesDescription(value(instance, Keyword.SeriesDescription))
                .modality(value(instance, Keyword.Modality))
                .photometricInterpretation(value(instance, Keyword.PhotometricInterpretation))
                .instanceNumber(number(instance, Keyword.InstanceNumber))
                .imageIndex(number(instance, Keyword.ImageIndex))
                .acquisitionNumber(number(instance, Keyword.AcquisitionNumber))
                .acquisitionTime(value(instance, Keyword.AcquisitionTime))
                .build();

        return Optional.of(metadata);
    }

    private static String value(Instance instance, Keyword keyword) {
        return instance.getAttribute(keyword)
                .map(v -> StringUtils.strip(v, PADDING))
                .orElse("");
    }

    /*
     * Numeric hints that are missing or do not parse are treated as absent
     */
    private static Double number(Instance instance, Keyword keyword) {
        String v = value(instance, keyword);
        if (v.isEmpty()) {
            return null;
        }
        try {
            double d = Double.parseDouble(v);
            return Double.isFinite(d) ? d : null;

        } catch (NumberFormatException nfe) {
            log.debug("Ignoring unparsable {} '{}' in {}", keyword, v, instance.getSourceName());
            return null;
        }
    }
}
