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

import org.ovnsync.nsdb.model.NbRow;

/**
 * The requested row does not exist (any more) in the database.
 */
public class RowNotFoundException extends NbException {

    private static final long serialVersionUID = 1L;

    private final Class<? extends NbRow> rowClass;
    private final String uuid;

    public RowNotFoundException(Class<? extends NbRow> rowClass, String uuid) {
        super("object not found: " + NbRow.tableName(rowClass) + " " + uuid);
        this.rowClass = rowClass;
        this.uuid = uuid;
    }

    public Class<? extends NbRow> getRowClass() {
        return rowClass;
    }

    public String getUuid() {
        return uuid;
    }
}
