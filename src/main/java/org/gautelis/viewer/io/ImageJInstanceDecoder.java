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

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.plugin.DICOM;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import ij.util.DicomTools;
import org.apache.commons.lang3.StringUtils;
import org.gautelis.viewer.InconsistencyException;
import org.gautelis.viewer.model.Instance;
import org.gautelis.viewer.model.Keyword;
import org.gautelis.viewer.model.PixelPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.util.Optional;

/**
 * Decodes DICOM Part 10 files using the ImageJ DICOM reader.
 * <p>
 * Payloads lacking the "DICM" magic after the 128 byte preamble are not
 * considered. Stored pixel values are passed on with the modality rescale
 * applied; photometric interpretation is left for the frame extractor.
 * Files whose header can be read but whose pixels cannot are still returned,
 * as instances without pixel data.
 */
public class ImageJInstanceDecoder implements InstanceDecoder {
    private static final Logger log = LoggerFactory.getLogger(ImageJInstanceDecoder.class);

    private static final int PREAMBLE_LENGTH = 128;
    private static final String UNNAMED = "instance.dcm";

    public static boolean hasDicomMagic(byte[] bytes) {
        return bytes.length >= PREAMBLE_LENGTH + 4
                && bytes[PREAMBLE_LENGTH] == 'D'
                && bytes[PREAMBLE_LENGTH + 1] == 'I'
                && bytes[PREAMBLE_LENGTH + 2] == 'C'
                && bytes[PREAMBLE_LENGTH + 3] == 'M';
    }

    @Override
    public Optional<Instance> decode(NamedPayload payload) {
        if (!hasDicomMagic(payload.getBytes())) {
            log.trace("Not DICOM: {}", payload.getName());
            return Optional.empty();
        }

        // ImageJ resolves an empty path through a file dialog
        String name = StringUtils.isBlank(payload.getName()) ? UNNAMED : payload.getName();

        try {
            DICOM dicom = new DICOM(new ByteArrayInputStream(payload.getBytes()));
            dicom.open(name);

            Instance.Builder builder = Instance.builder(payload.getName());
            if (dicom.getWidth() == 0) {
                // Header readable but no pixels ImageJ can open, e.g. compressed
                // transfer syntaxes or objects without pixel data
                String info = new DICOM(new ByteArrayInputStream(payload.getBytes())).getInfo(name);
                if (StringUtils.isBlank(info)) {
                    log.debug("ImageJ could not read header of {}", payload.getName());
                    return Optional.empty();
                }
                log.debug("No readable pixel data in {}", payload.getName());

                ImagePlus header = new ImagePlus();
                header.setProperty("Info", info);
                readAttributes(header, builder);
                return Optional.of(builder.build());
            }

            readAttributes(dicom, builder);

            final ImageStack stack = dicom.getStack();
            final Calibration calibration = dicom.getCalibration();
            builder.pixels(() -> toPayload(stack, calibration));
            return Optional.of(builder.build());

        } catch (RuntimeException re) {
            String info = "Failed to decode " + payload.getName() + ": " + re.getMessage();
            log.debug(info, re);
            return Optional.empty();
        }
    }

    private static void readAttributes(ImagePlus image, Instance.Builder builder) {
        for (Keyword keyword : Keyword.values()) {
            String value = DicomTools.getTag(image, keyword.getTag());
            if (null != value) {
                builder.attribute(keyword, value.trim());
            }
        }
    }

    private static PixelPayload toPayload(ImageStack stack, Calibration calibration) throws InconsistencyException {
        int slices = stack.getSize();
        int width = stack.getWidth();
        int height = stack.getHeight();
        int frameSize = width * height;
        if (slices < 1 || frameSize == 0) {
            throw new InconsistencyException("Empty image stack");
        }

        float[] values = new float[slices * frameSize];
        for (int s = 0; s < slices; s++) {
            ImageProcessor ip = stack.getProcessor(s + 1);
            boolean rescale = calibration.calibrated();
            if (ip instanceof ColorProcessor) {
                // luminance
                ip = ip.convertToFloatProcessor();
                rescale = false;
            }
            int offset = s * frameSize;
            for (int i = 0; i < frameSize; i++) {
                float v = ip.getf(i);
                values[offset + i] = rescale ? (float) calibration.getCValue(v) : v;
            }
        }

        int[] shape = slices == 1 ? new int[]{height, width} : new int[]{slices, height, width};
        return new PixelPayload(shape, values);
    }
}
