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
package org.ovnsync.nsdb.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Base class of the rows of the northbound database. Rows handed out by a
 * client are snapshots: changing them does not change the database until
 * they are part of a committed operation.
 */
public abstract class NbRow {

    public static final String COL_UUID = "_uuid";

    protected String uuid;

    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = uuid;
    }

    /** Names of the columns that {@link #getColumn} accepts. */
    public abstract List<String> columns();

    /** Value of a column, addressed by its schema name. */
    public abstract Object getColumn(String column);

    /** Sets a column addressed by its schema name. */
    public abstract void setColumn(String column, Object value);

    /** UUIDs of the rows this row holds strong references to. */
    public Collection<String> references() {
        return Collections.emptySet();
    }

    /**
     * Name of the table a row class is stored in.
     */
    public static String tableName(Class<? extends NbRow> clazz) {
        return table(clazz).name();
    }

    /**
     * Whether rows of the class are kept when nothing references them.
     */
    public static boolean isRoot(Class<? extends NbRow> clazz) {
        return table(clazz).root();
    }

    private static NbTable table(Class<? extends NbRow> clazz) {
        NbTable table = clazz.getAnnotation(NbTable.class);
        if (table == null) {
            throw new IllegalArgumentException(
                clazz.getName() + " is not annotated with @NbTable");
        }
        return table;
    }

    protected static IllegalArgumentException unknownColumn(
            Class<? extends NbRow> clazz, String column) {
        return new IllegalArgumentException(
            "No column " + column + " in table " + tableName(clazz));
    }
}
