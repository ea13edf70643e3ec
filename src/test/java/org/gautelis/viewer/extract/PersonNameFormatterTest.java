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

public class PersonNameFormatterTest {

    @Test
    public void testStructuredNames() {
        assertEquals("Doe, John", PersonNameFormatter.format("Doe^John"));
        assertEquals("Doe, John Q", PersonNameFormatter.format("Doe^John^Q"));
        assertEquals("Doe, John Q Jr", PersonNameFormatter.format("Doe^John^Q^Jr"));
        assertEquals("Doe, Dr John Q Jr", PersonNameFormatter.format("Doe^John^Q^Dr^Jr"));
        assertEquals("Doe", PersonNameFormatter.format("Doe"));
        assertEquals("Doe", PersonNameFormatter.format("Doe^^^"));
        assertEquals("John", PersonNameFormatter.format("^John"));
    }

    @Test
    public void testIdeographicGroupsAreIgnored() {
        assertEquals("Yamada, Tarou", PersonNameFormatter.format("Yamada^Tarou=山田^太郎=やまだ^たろう"));
    }

    @Test
    public void testFallsBackOnLiteral() {
        assertEquals("a b c d e f", PersonNameFormatter.format("a^b^c^d^e^f"));
        assertEquals("", PersonNameFormatter.format("^^^"));
        assertEquals("", PersonNameFormatter.format(null));
        assertEquals("", PersonNameFormatter.format("   "));
    }
}
