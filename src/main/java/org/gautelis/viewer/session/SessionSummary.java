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
package org.gautelis.viewer.session;

import org.gautelis.viewer.series.SeriesSummary;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of opening a session: its id, its series and the archives that were rejected.
 */
public final class SessionSummary {
    private final String sessionId;
    private final List<SeriesSummary> series;
    private final List<String> invalidFiles;

    public SessionSummary(String sessionId, List<SeriesSummary> series, List<String> invalidFiles) {
        this.sessionId = sessionId;
        this.series = Collections.unmodifiableList(series);
        this.invalidFiles = Collections.unmodifiableList(invalidFiles);
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<SeriesSummary> getSeries() {
        return series;
    }

    /**
     * @return rejected archives, each as "name (reason)"
     */
    public List<String> getInvalidFiles() {
        return invalidFiles;
    }

    public int getTotalSeries() {
        return series.size();
    }
}
