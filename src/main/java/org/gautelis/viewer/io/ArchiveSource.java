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

import java.io.IOException;
import java.util.List;

/**
 * Yields the files of a container as a flat list of named payloads.
 */
public interface ArchiveSource {

    String getName();

    /**
     * @return every file in the container, directories excluded
     * @throws IOException if the container could not be read at all
     */
    List<NamedPayload> entries() throws IOException;
}
