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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats person names given as "family^given^middle^suffix" (or the five
 * component form "family^given^middle^prefix^suffix") for display, e.g.
 * "Doe^John^Q^Jr" becomes "Doe, John Q Jr".
 * <p>
 * Anything that does not parse as a structured name is shown as the literal
 * value with its delimiters replaced by spaces. Formatting never fails.
 */
public final class PersonNameFormatter {
    private static final Logger log = LoggerFactory.getLogger(PersonNameFormatter.class);

    private static final int MAX_COMPONENTS = 5;

    private PersonNameFormatter() {
    }

    public static String format(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        try {
            return formatStructured(raw);

        } catch (RuntimeException re) {
            log.debug("Falling back to literal person name: {}", re.getMessage());
            return literal(raw);
        }
    }

    private static String formatStructured(String raw) {
        // Only the alphabetic representation is of interest; ideographic and
        // phonetic groups follow after '='
        String alphabetic = StringUtils.substringBefore(raw, "=");
        String[] components = alphabetic.split("\\^", -1);
        if (components.length > MAX_COMPONENTS) {
            throw new IllegalArgumentException("Too many name components in '" + raw + "'");
        }

        String family = component(components, 0);
        String given = component(components, 1);
        String middle = component(components, 2);
        String prefix = "";
        String suffix = "";
        if (components.length == MAX_COMPONENTS) {
            prefix = component(components, 3);
            suffix = component(components, 4);
        } else {
            suffix = component(components, 3);
        }

        List<String> rest = new ArrayList<>();
        for (String part : new String[]{prefix, given, middle, suffix}) {
            if (!part.isEmpty()) {
                rest.add(part);
            }
        }

        if (family.isEmpty()) {
            if (rest.isEmpty()) {
                // e.g. "^^^" -- nothing structured to show
                return literal(raw);
            }
            return String.join(" ", rest);
        }
        if (rest.isEmpty()) {
            return family;
        }
        return family + ", " + String.join(" ", rest);
    }

    private static String component(String[] components, int i) {
        return i < components.length ? components[i].trim() : "";
    }

    static String literal(String raw) {
        String spaced = raw.replace('^', ' ').replace('=', ' ');
        return StringUtils.normalizeSpace(spaced);
    }
}
