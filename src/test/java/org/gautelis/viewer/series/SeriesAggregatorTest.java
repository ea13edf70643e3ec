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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gautelis.viewer.model.Frame;
import org.gautelis.viewer.model.Instance;
import org.gautelis.viewer.model.Keyword;
import org.gautelis.viewer.model.PixelPayload;
import org.gautelis.viewer.model.Series;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.Assert.*;

public class SeriesAggregatorTest {
    private static final Logger log = LogManager.getLogger(SeriesAggregatorTest.class);

    private final SeriesAggregator aggregator = new SeriesAggregator();

    /*
     * A single frame instance whose only pixel value is its marker, so
     * frame order can be read back from the values.
     */
    private static Instance instance(String name, String seriesUID, String instanceNumber, float marker) {
        Instance.Builder builder = Instance.builder(name)
                .pixels(PixelPayload.of2D(new float[][]{{marker}}));
        if (null != seriesUID) {
            builder.attribute(Keyword.SeriesInstanceUID, seriesUID);
        }
        if (null != instanceNumber) {
            builder.attribute(Keyword.InstanceNumber, instanceNumber);
        }
        return builder.build();
    }

    private static List<Float> markers(Series series) {
        List<Float> markers = new ArrayList<>();
        for (Frame frame : series.getFrames()) {
            markers.add(frame.get(0));
        }
        return markers;
    }

    @Test
    public void testOrdersByInstanceNumber() {
        Map<String, Series> series = aggregator.aggregate(Arrays.asList(
                instance("c.dcm", "1.2.3", "3", 3),
                instance("a.dcm", "1.2.3", "1", 1),
                instance("b.dcm", "1.2.3", "2", 2)
        ));

        assertEquals(1, series.size());
        Series s = series.get("1.2.3");
        assertEquals(Arrays.asList(1f, 2f, 3f), markers(s));
        assertEquals(Arrays.asList("c.dcm", "a.dcm", "b.dcm"), s.getSourceNames());
    }

    @Test
    public void testInstancesWithoutSeriesUIDAreSkipped() {
        List<Instance> instances = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            instances.add(instance("i" + i + ".dcm", i == 4 ? null : "1.2.3", String.valueOf(i), i));
        }

        Map<String, Series> series = aggregator.aggregate(instances);
        assertEquals(1, series.size());
        assertEquals(9, series.get("1.2.3").getFrameCount());
        assertFalse(markers(series.get("1.2.3")).contains(4f));
    }

    @Test
    public void testOrderDoesNotDependOnArrival() {
        List<Instance> instances = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            // Two instances share each instance number, and four have none
            String number = i < 8 ? String.valueOf(i % 4) : null;
            instances.add(instance(String.format("f%02d.dcm", i), "9.9", number, i));
        }
        List<Float> expected = markers(aggregator.aggregate(instances).get("9.9"));

        Random random = new Random(4711);
        for (int round = 0; round < 20; round++) {
            List<Instance> shuffled = new ArrayList<>(instances);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, markers(aggregator.aggregate(shuffled).get("9.9")));
        }
        log.debug("Order after shuffling: {}", expected);
    }

    @Test
    public void testMultipleSeries() {
        float[] threeFrames = new float[3 * 2 * 2];
        Instance multiframe = Instance.builder("mf.dcm")
                .attribute(Keyword.SeriesInstanceUID, "2.2")
                .attribute(Keyword.Modality, "US")
                .pixels(new PixelPayload(new int[]{3, 2, 2}, threeFrames))
                .build();

        Map<String, Series> series = aggregator.aggregate(Arrays.asList(
                instance("a.dcm", "1.1", "1", 1),
                multiframe,
                instance("b.dcm", "1.1", "2", 2)
        ));

        assertEquals(Arrays.asList("1.1", "2.2"), new ArrayList<>(series.keySet()));
        assertEquals(2, series.get("1.1").getFrameCount());
        assertEquals(3, series.get("2.2").getFrameCount());
        assertEquals("US", series.get("2.2").getMetadata().getModality());
    }

    @Test
    public void testMetadataComesFromFirstInstance() {
        Instance first = Instance.builder("1.dcm")
                .attribute(Keyword.SeriesInstanceUID, "1.1")
                .attribute(Keyword.SeriesDescription, "first")
                .attribute(Keyword.InstanceNumber, "9")
                .pixels(PixelPayload.of2D(new float[][]{{9}}))
                .build();
        Instance second = Instance.builder("2.dcm")
                .attribute(Keyword.SeriesInstanceUID, "1.1")
                .attribute(Keyword.SeriesDescription, "second")
                .attribute(Keyword.InstanceNumber, "1")
                .pixels(PixelPayload.of2D(new float[][]{{1}}))
                .build();

        Series s = aggregator.aggregate(Arrays.asList(first, second)).get("1.1");
        assertEquals("first", s.getMetadata().getSeriesDescription());
        assertEquals(Arrays.asList(1f, 9f), markers(s));
    }

    @Test
    public void testFailingPixelDataCostsOnlyThatInstance() {
        Instance failing = Instance.builder("broken.dcm")
                .attribute(Keyword.SeriesInstanceUID, "1.1")
                .pixels(() -> {
                    throw new IOException("truncated pixel data");
                })
                .build();

        Map<String, Series> series = aggregator.aggregate(Arrays.asList(
                failing,
                instance("ok.dcm", "1.1", "1", 1)
        ));

        Series s = series.get("1.1");
        assertEquals(1, s.getFrameCount());
        assertEquals(Arrays.asList("broken.dcm", "ok.dcm"), s.getSourceNames());
    }

    @Test
    public void testSummary() {
        List<Instance> instances = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            instances.add(Instance.builder("img" + i + ".dcm")
                    .attribute(Keyword.SeriesInstanceUID, "1.1")
                    .attribute(Keyword.PatientName, "Doe^John")
                    .attribute(Keyword.PatientID, "42")
                    .attribute(Keyword.Modality, "MR")
                    .attribute(Keyword.SeriesDescription, "T1 axial")
                    .pixels(PixelPayload.of2D(new float[][]{{i}}))
                    .build());
        }

        SeriesSummary summary = SeriesSummary.of(aggregator.aggregate(instances).get("1.1"), 5);
        assertEquals(7, summary.getFrameCount());
        assertEquals(5, summary.getExamples().size());
        assertEquals("img0.dcm", summary.getExamples().get(0));
        assertEquals("Doe, John", summary.getPatientName());
        assertTrue(summary.getLabel().contains("MR"));
    }
}
