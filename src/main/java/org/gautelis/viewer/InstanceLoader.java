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
package org.gautelis.viewer;

import org.gautelis.viewer.io.ArchiveSource;
import org.gautelis.viewer.io.NamedPayload;
import org.gautelis.viewer.io.InstanceDecoder;
import org.gautelis.viewer.model.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads instances from archives, using an {@link InstanceDecoder} for each
 * payload. Payloads that do not decode are skipped.
 */
public class InstanceLoader {
    private static final Logger log = LoggerFactory.getLogger(InstanceLoader.class);

    private final InstanceDecoder decoder;

    public InstanceLoader(InstanceDecoder decoder) {
        this.decoder = decoder;
    }

    /**
     * Load all decodable instances in an archive.
     *
     * @param archive the archive
     * @return decoded instances, in archive order
     * @throws IOException if the archive itself could not be read
     */
    public List<Instance> load(ArchiveSource archive) throws IOException {
        List<NamedPayload> entries = archive.entries();
        List<Instance> instances = load(entries);
        log.info("Loaded {} of {} entries in {}", instances.size(), entries.size(), archive.getName());
        return instances;
    }

    /**
     * Load all decodable instances among a set of payloads.
     *
     * @param payloads the payloads
     * @return decoded instances, in payload order
     */
    public List<Instance> load(Iterable<NamedPayload> payloads) {
        List<Instance> instances = new ArrayList<>();
        for (NamedPayload payload : payloads) {
            load(payload).ifPresent(instances::add);
        }
        return instances;
    }

    /**
     * Load a single payload.
     *
     * @param payload the payload
     * @return the instance, or empty if the payload could not be decoded
     */
    public Optional<Instance> load(NamedPayload payload) {
        try {
            return decoder.decode(payload);

        } catch (RuntimeException re) {
            String info = "Could not decode " + payload.getName() + ": " + re.getMessage();
            log.warn(info, re);
            return Optional.empty();
        }
    }
}
