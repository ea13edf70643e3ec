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

import org.gautelis.viewer.model.Instance;

import java.util.Optional;

/**
 * Decodes one payload into an {@link Instance}.
 */
public interface InstanceDecoder {

    /**
     * @return the decoded instance, or empty if the payload is not something
     * this decoder understands
     */
    Optional<Instance> decode(NamedPayload payload);
}
