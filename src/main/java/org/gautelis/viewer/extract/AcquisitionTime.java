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

/**
 * Parses acquisition times on the form HHMMSS[.ffffff] into seconds since midnight.
 */
public final class AcquisitionTime {

    private AcquisitionTime() {
    }

    /**
     * Missing trailing fields count as zero, so "1230" is 12:30:00. Any value
     * that cannot be parsed yields 0.0.
     *
     * @param hhmmss the time value, may be null
     * @return hours * 3600 + minutes * 60 + seconds
     */
    public static double toSeconds(String hhmmss) {
        if (null == hhmmss) {
            return 0.0;
        }
        try {
            String s = hhmmss.trim();
            double hours = field(s, 0, 2);
            double minutes = field(s, 2, 4);
            double seconds = field(s, 4, s.length());
            double total = hours * 3600.0 + minutes * 60.0 + seconds;
            return Double.isFinite(total) ? total : 0.0;

        } catch (NumberFormatException nfe) {
            return 0.0;
        }
    }

    private static double field(String s, int from, int to) {
        int start = Math.min(from, s.length());
        int end = Math.max(start, Math.min(to, s.length()));
        String part = s.substring(start, end);
        if (part.isEmpty()) {
            return 0.0;
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (!(Character.isDigit(c) || c == '.')) {
                throw new NumberFormatException("Not a time field: " + part);
            }
        }
        return Double.parseDouble(part);
    }
}
