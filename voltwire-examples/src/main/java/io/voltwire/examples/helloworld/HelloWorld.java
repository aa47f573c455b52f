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

package io.voltwire.examples.helloworld;

import io.voltwire.client.tcp.VoltTcpConnection;
import io.voltwire.response.VoltResult;
import io.voltwire.response.VoltRows;
import io.voltwire.table.VoltTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Blocking hello-world against a server running the HELLOWORLD sample schema.
 */
public final class HelloWorld {

    private static final List<List<String>> GREETINGS = List.of(
            List.of("Hello", "World", "English"),
            List.of("Bonjour", "Monde", "French"),
            List.of("Hola", "Mundo", "Spanish"),
            List.of("Hej", "Verden", "Danish"),
            List.of("Ciao", "Mondo", "Italian"));

    private static final Logger log = LoggerFactory.getLogger(HelloWorld.class);

    private HelloWorld() {}

    public static void main(String[] args) {
        String address = args.length > 0 ? args[0] : "localhost:21212";
        try (var connection = VoltTcpConnection.open(address)) {
            for (List<String> greeting : GREETINGS) {
                VoltResult result = connection.exec("HELLOWORLD.insert", greeting.toArray());
                log.info("Inserted {} row(s) for {}", result.rowsAffected(), greeting.get(2));
            }

            VoltRows rows = connection.call("HELLOWORLD.select", "French");
            if (rows.tableCount() == 0 || rows.table(0).rowCount() == 0) {
                log.error("Select statement didn't return any data");
                return;
            }
            VoltTableRow row = rows.table(0).row(0);
            if (row.isNull("HELLO") || row.isNull("WORLD")) {
                log.warn("Unexpected null values");
            } else {
                log.info("{}, {}!", row.getString("HELLO"), row.getString("WORLD"));
            }
        }
    }
}
