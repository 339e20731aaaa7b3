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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import org.ovnsync.nsdb.model.NbRow;

/**
 * Overwrites columns of the row with the same uuid as the given row. Only
 * the named columns are written, and when no column is named all of them
 * are.
 */
public class Update extends Operation {

    private final String uuid;
    private final NbRow row;
    private final List<String> columns;

    public Update(NbRow row, String... columns) {
        super(Preconditions.checkNotNull(row).getClass());
        Preconditions.checkArgument(row.getUuid() != null,
                                    "Cannot update a row without uuid");
        for (String column : columns) {
            Preconditions.checkArgument(row.columns().contains(column),
                                        "No column %s in table %s", column,
                                        getTable());
        }
        this.uuid = row.getUuid();
        this.row = row;
        this.columns = columns.length == 0
                       ? row.columns()
                       : Collections.unmodifiableList(
                             new ArrayList<>(Arrays.asList(columns)));
    }

    /** Uuid of the updated row. */
    public String getUuid() {
        return uuid;
    }

    public NbRow getRow() {
        return row;
    }

    public List<String> getColumns() {
        return columns;
    }

    @Override
    public String getOp() {
        return UPDATE;
    }

    @Override
    public String toString() {
        return super.toString() + " " + uuid + " " + columns;
    }
}
