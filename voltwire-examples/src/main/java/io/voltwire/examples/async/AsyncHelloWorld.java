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

package io.voltwire.examples.async;

import io.voltwire.client.QueryFuture;
import io.voltwire.client.tcp.VoltTcpConnection;
import io.voltwire.exception.VoltWireException;
import io.voltwire.table.VoltTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Issues every insert and the select without waiting, then drains them all at once.
 */
public final class AsyncHelloWorld {

    private static final List<List<String>> GREETINGS = List.of(
            List.of("Hello", "World", "English"),
            List.of("Bonjour", "Monde", "French"),
            List.of("Hola", "Mundo", "Spanish"),
            List.of("Hej", "Verden", "Danish"),
            List.of("Ciao", "Mondo", "Italian"));

    private static final Logger log = LoggerFactory.getLogger(AsyncHelloWorld.class);

    private AsyncHelloWorld() {}

    public static void main(String[] args) {
        String address = args.length > 0 ? args[0] : "localhost:21212";
        try (var connection = VoltTcpConnection.builder().address(address).open()) {
            for (List<String> greeting : GREETINGS) {
                connection.callAsync("HELLOWORLD.insert", greeting.toArray());
            }
            QueryFuture select = connection.callAsync("HELLOWORLD.select", "French");

            List<QueryFuture> drained = connection.drainAll();
            log.info("Drained {} call(s)", drained.size());
            for (QueryFuture future : drained) {
                try {
                    future.get();
                } catch (VoltWireException e) {
                    log.warn("Call with handle {} failed: {}", future.handle(), e.getMessage());
                }
            }

            VoltTable table = select.rows().table(0);
            if (table.rowCount() > 0) {
                log.info("{}, {}!", table.row(0).getString("HELLO"), table.row(0).getString("WORLD"));
            } else {
                log.error("Select statement didn't return any data");
            }
        }
    }
}
