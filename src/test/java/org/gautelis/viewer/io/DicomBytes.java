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
package org.gautelis.viewer.io;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes minimal DICOM Part 10 files, explicit VR little endian. Elements
 * are written in call order, so callers add them in ascending tag order.
 */
final class DicomBytes {
    static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private DicomBytes() {
        out.write(new byte[128], 0, 128);
        byte[] magic = "DICM".getBytes(StandardCharsets.US_ASCII);
        out.write(magic, 0, magic.length);
        string(0x0002, 0x0010, "UI", EXPLICIT_VR_LITTLE_ENDIAN);
    }

    static DicomBytes part10() {
        return new DicomBytes();
    }

    /**
     * Text element, padded to even length with NUL for UI and space otherwise.
     */
    DicomBytes string(int group, int element, String vr, String value) {
        byte[] text = value.getBytes(StandardCharsets.US_ASCII);
        int length = text.length + (text.length % 2);
        header(group, element, vr, length);
        out.write(text, 0, text.length);
        if (length > text.length) {
            out.write("UI".equals(vr) ? 0 : ' ');
        }
        return this;
    }

    DicomBytes unsigned(int group, int element, int value) {
        header(group, element, "US", 2);
        shortLE(value);
        return this;
    }

    /**
     * Pixel data (7FE0,0010) as OW, one 16-bit word per value.
     */
    DicomBytes pixelData(int... values) {
        header(0x7FE0, 0x0010, "OW", 2 * values.length);
        for (int v : values) {
            shortLE(v);
        }
        return this;
    }

    /**
     * Image pixel module for a single 16-bit grayscale frame.
     */
    DicomBytes image(String photometric, int rows, int columns, int pixelRepresentation) {
        unsigned(0x0028, 0x0002, 1);
        string(0x0028, 0x0004, "CS", photometric);
        unsigned(0x0028, 0x0010, rows);
        unsigned(0x0028, 0x0011, columns);
        unsigned(0x0028, 0x0100, 16);
        unsigned(0x0028, 0x0101, 16);
        unsigned(0x0028, 0x0102, 15);
        unsigned(0x0028, 0x0103, pixelRepresentation);
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }

    NamedPayload named(String name) {
        return new NamedPayload(name, toByteArray());
    }

    private void header(int group, int element, String vr, int length) {
        shortLE(group);
        shortLE(element);
        out.write(vr.charAt(0));
        out.write(vr.charAt(1));
        switch (vr) {
            case "OB":
            case "OW":
            case "SQ":
            case "UN":
            case "UT":
                shortLE(0);
                intLE(length);
                break;
            default:
                shortLE(length);
        }
    }

    private void shortLE(int value) {
        out.write(value & 0xff);
        out.write((value >> 8) & 0xff);
    }

    private void intLE(int value) {
        shortLE(value & 0xffff);
        shortLE((value >>> 16) & 0xffff);
    }
}
