/*
 * Copyright 2015 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.ovnsync.nsdb.backend;

import java.util.UUID;

/**
 * Request-time row identifiers. A named uuid stands for a row that is
 * inserted in the same transaction it is referenced in, and is replaced by
 * the real uuid when the transaction commits.
 */
public final class NamedUuid {

    private static final String PREFIX = "row_";

    private NamedUuid() {
    }

    /**
     * A fresh uuid-name. Every call returns a different token and no state
     * is shared between callers.
     */
    public static String generate() {
        return PREFIX + UUID.randomUUID().toString().replace('-', '_');
    }

    /**
     * Whether the identifier is a uuid-name rather than a database uuid.
     */
    public static boolean isNamed(String id) {
        return id != null && id.startsWith(PREFIX);
    }
}
