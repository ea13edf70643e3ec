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
import org.gautelis.viewer.io.InstanceDecoder;
import org.gautelis.viewer.io.NamedPayload;
import org.gautelis.viewer.model.Instance;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class InstanceLoaderTest {

    @Test
    public void testSkipsUndecodableEntries() throws Exception {
        NamedPayload good = new NamedPayload("a.dcm", new byte[]{1});
        NamedPayload unknown = new NamedPayload("readme.txt", new byte[]{2});
        NamedPayload broken = new NamedPayload("b.dcm", new byte[]{3});

        InstanceDecoder decoder = mock(InstanceDecoder.class);
        when(decoder.decode(good)).thenReturn(Optional.of(Instance.builder("a.dcm").build()));
        when(decoder.decode(unknown)).thenReturn(Optional.empty());
        when(decoder.decode(broken)).thenThrow(new IllegalStateException("truncated"));

        ArchiveSource archive = mock(ArchiveSource.class);
        when(archive.getName()).thenReturn("study.zip");
        when(archive.entries()).thenReturn(Arrays.asList(good, unknown, broken));

        List<Instance> instances = new InstanceLoader(decoder).load(archive);
        assertEquals(1, instances.size());
        assertEquals("a.dcm", instances.get(0).getSourceName());
        verify(decoder, times(3)).decode(any(NamedPayload.class));
    }
}
