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

/**
 * Outcome of one operation of a committed transaction.
 */
public class OperationResult {

    private final int count;
    private final String uuid;

    public OperationResult(int count, String uuid) {
        this.count = count;
        this.uuid = uuid;
    }

    /** Number of rows the operation touched. */
    public int getCount() {
        return count;
    }

    /** Uuid assigned to the row created by an insert, null otherwise. */
    public String getUuid() {
        return uuid;
    }

    @Override
    public String toString() {
        return "OperationResult{count=" + count + ", uuid=" + uuid + '}';
    }
}
