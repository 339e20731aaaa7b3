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

import com.google.common.base.Preconditions;

import org.ovnsync.nsdb.model.NbRow;

/**
 * An operation of a northbound database transaction. Operations are only
 * descriptions: nothing happens until a list of them is submitted through
 * {@link NbClient#transact}.
 */
public abstract class Operation {

    public static final String INSERT = "insert";
    public static final String UPDATE = "update";
    public static final String MUTATE = "mutate";
    public static final String DELETE = "delete";

    private final Class<? extends NbRow> rowClass;

    protected Operation(Class<? extends NbRow> rowClass) {
        this.rowClass = Preconditions.checkNotNull(rowClass);
    }

    /** The operation name, as in the database protocol. */
    public abstract String getOp();

    public Class<? extends NbRow> getRowClass() {
        return rowClass;
    }

    public String getTable() {
        return NbRow.tableName(rowClass);
    }

    @Override
    public String toString() {
        return getOp() + " on " + getTable();
    }
}
