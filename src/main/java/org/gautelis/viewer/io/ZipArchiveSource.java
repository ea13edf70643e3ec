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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * A zip archive held in memory.
 */
public class ZipArchiveSource implements ArchiveSource {
    private static final Logger log = LoggerFactory.getLogger(ZipArchiveSource.class);

    private final NamedPayload archive;

    public ZipArchiveSource(NamedPayload archive) {
        this.archive = archive;
    }

    /**
     * @return true if the payload starts with a zip local file header (or is an empty zip)
     */
    public static boolean isZip(byte[] bytes) {
        if (bytes.length < 4 || bytes[0] != 'P' || bytes[1] != 'K') {
            return false;
        }
        return (bytes[2] == 3 && bytes[3] == 4) || (bytes[2] == 5 && bytes[3] == 6);
    }

    @Override
    public String getName() {
        return archive.getName();
    }

    @Override
    public List<NamedPayload> entries() throws IOException {
        if (!isZip(archive.getBytes())) {
            throw new ZipException("Not a ZIP archive: " + archive.getName());
        }

        List<NamedPayload> entries = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(archive.getBytes()))) {
            ZipEntry entry;
            while (null != (entry = zis.getNextEntry())) {
                if (!entry.isDirectory()) {
                    entries.add(new NamedPayload(entry.getName(), zis.readAllBytes()));
                }
                zis.closeEntry();
            }
        }
        log.debug("Read {} entries from {}", entries.size(), archive.getName());
        return entries;
    }
}
