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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class AcquisitionTimeTest {

    @Test
    public void testToSeconds() {
        assertEquals(45296.5, AcquisitionTime.toSeconds("123456.5"), 1e-9);
        assertEquals(3600.0, AcquisitionTime.toSeconds("01"), 1e-9);
        assertEquals(3660.0, AcquisitionTime.toSeconds("0101"), 1e-9);
        assertEquals(45296.0, AcquisitionTime.toSeconds(" 123456 "), 1e-9);
    }

    @Test
    public void testUnparsableIsZero() {
        assertEquals(0.0, AcquisitionTime.toSeconds(null), 0.0);
        assertEquals(0.0, AcquisitionTime.toSeconds(""), 0.0);
        assertEquals(0.0, AcquisitionTime.toSeconds("12:34:56"), 0.0);
        assertEquals(0.0, AcquisitionTime.toSeconds("noon"), 0.0);
    }
}
