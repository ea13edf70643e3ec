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

import java.util.Collections;
import java.util.List;

/**
 * Thrown when none of the archives handed to a new session could be read.
 */
public class UnreadableArchiveException extends Exception {
    private final List<String> rejected;

    public UnreadableArchiveException(String message, List<String> rejected) {
        super(message);
        this.rejected = Collections.unmodifiableList(rejected);
    }

    /**
     * @return the rejected archives, each as "name (reason)"
     */
    public List<String> getRejected() {
        return rejected;
    }
}
