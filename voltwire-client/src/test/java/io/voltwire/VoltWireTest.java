/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.voltwire;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class VoltWireTest {

    private static InputStream properties(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void shouldReadVersionFromFilteredProperties() {
        // when
        String version = VoltWire.version();

        // then
        assertThat(version).isNotBlank().doesNotContain("${");
        assertThat(VoltWire.buildInfo()).isSameAs(VoltWire.buildInfo());
        assertThat(VoltWire.buildInfo().toString()).startsWith("voltwire ");
    }

    @Test
    void shouldParseBuildMetadata() throws IOException {
        // when
        var info = VoltWire.readBuildInfo(properties("version=1.2.3\nbuildTime=2026-10-19T08:00:00Z\n"));

        // then
        assertThat(info.version()).isEqualTo("1.2.3");
        assertThat(info.buildTime()).isEqualTo("2026-10-19T08:00:00Z");
        assertThat(info).hasToString("voltwire 1.2.3 (built 2026-10-19T08:00:00Z)");
    }

    @Test
    void shouldTreatUnfilteredPlaceholdersAsUnknown() throws IOException {
        // when
        var info = VoltWire.readBuildInfo(properties("version=${project.version}\nbuildTime=${build.time}\n"));

        // then
        assertThat(info.version()).isEqualTo(VoltWire.UNKNOWN);
        assertThat(info.buildTime()).isEqualTo(VoltWire.UNKNOWN);
        assertThat(info).hasToString("voltwire unknown");
    }

    @Test
    void shouldTreatMissingOrBlankKeysAsUnknown() throws IOException {
        var info = VoltWire.readBuildInfo(properties("version=  \n"));

        assertThat(info.version()).isEqualTo(VoltWire.UNKNOWN);
        assertThat(info.buildTime()).isEqualTo(VoltWire.UNKNOWN);
    }
}
