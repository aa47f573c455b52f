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

import io.voltwire.client.tcp.VoltTcpConnection;
import io.voltwire.client.tcp.VoltTcpConnectionBuilder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Main entry point for opening VoltDB connections.
 *
 * <pre>{@code
 * try (var connection = VoltWire.connectionBuilder()
 *         .address("localhost:21212")
 *         .open()) {
 *     VoltRows rows = connection.call("HELLOWORLD.select", "French");
 *
 *     QueryFuture pending = connection.callAsync("HELLOWORLD.select", "Spanish");
 *     connection.drainAll();
 *     VoltRows spanish = pending.get();
 * }
 * }</pre>
 *
 * @see VoltTcpConnectionBuilder
 */
public final class VoltWire {
    private static final Logger log = LoggerFactory.getLogger(VoltWire.class);

    static final String BUILD_PROPERTIES = "/voltwire-version.properties";
    static final String UNKNOWN = "unknown";

    private VoltWire() {}

    /**
     * Creates a builder for TCP connections.
     *
     * @return a connection builder
     */
    public static VoltTcpConnectionBuilder connectionBuilder() {
        return VoltTcpConnection.builder();
    }

    /**
     * Returns the driver version, or {@code "unknown"} when the jar carries no build
     * metadata.
     *
     * @return the version string (e.g., "0.1.0")
     */
    public static String version() {
        return buildInfo().version();
    }

    public static BuildInfo buildInfo() {
        return BuildInfoHolder.INFO;
    }

    /**
     * Parses build metadata. Keys that are missing, blank or left unfiltered by the build
     * read as {@code "unknown"}.
     */
    static BuildInfo readBuildInfo(InputStream source) throws IOException {
        Properties props = new Properties();
        props.load(source);
        return new BuildInfo(filtered(props, "version"), filtered(props, "buildTime"));
    }

    private static String filtered(Properties props, String key) {
        String value = StringUtils.trimToNull(props.getProperty(key));
        if (value == null || value.startsWith("${")) {
            return UNKNOWN;
        }
        return value;
    }

    /**
     * Driver version and build timestamp, as stamped into the jar.
     */
    public record BuildInfo(String version, String buildTime) {

        @Override
        public String toString() {
            if (UNKNOWN.equals(buildTime)) {
                return "voltwire " + version;
            }
            return "voltwire " + version + " (built " + buildTime + ")";
        }
    }

    private static final class BuildInfoHolder {
        static final BuildInfo INFO = load();

        private static BuildInfo load() {
            try (InputStream in = VoltWire.class.getResourceAsStream(BUILD_PROPERTIES)) {
                if (in == null) {
                    log.debug("No {} on the classpath", BUILD_PROPERTIES);
                    return new BuildInfo(UNKNOWN, UNKNOWN);
                }
                return readBuildInfo(in);
            } catch (IOException e) {
                log.warn("Could not read build metadata from {}", BUILD_PROPERTIES, e);
                return new BuildInfo(UNKNOWN, UNKNOWN);
            }
        }
    }
}
