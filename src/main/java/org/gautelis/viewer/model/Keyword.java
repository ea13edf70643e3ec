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

/**
 * Attribute keywords (as in the DICOM data dictionary) under which a decoded
 * instance exposes its metadata, together with the tag each keyword denotes.
 */
public enum Keyword {
    PatientName("0010,0010"),
    PatientID("0010,0020"),
    StudyDescription("0008,1030"),
    SeriesDescription("0008,103E"),
    Modality("0008,0060"),
    SeriesInstanceUID("0020,000E"),
    InstanceNumber("0020,0013"),
    ImageIndex("0054,1330"),
    AcquisitionNumber("0020,0012"),
    AcquisitionTime("0008,0032"),
    PhotometricInterpretation("0028,0004"),
    Rows("0028,0010"),
    Columns("0028,0011");

    private final String tag;

    Keyword(String tag) {
        this.tag = tag;
    }

    /**
     * @return tag on the form "gggg,eeee"
     */
    public String getTag() {
        return tag;
    }
}
