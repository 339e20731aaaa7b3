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
 * Inserts a row. The row's uuid is taken as the uuid-name of the new row,
 * so that later operations of the same transaction may refer to it before
 * the database assigns the real identifier.
 */
public class Insert extends Operation {

    private final NbRow row;

    public Insert(NbRow row) {
        super(Preconditions.checkNotNull(row).getClass());
        Preconditions.checkArgument(NamedUuid.isNamed(row.getUuid()),
                                    "Insert requires a named uuid, got %s",
                                    row.getUuid());
        this.row = row;
    }

    public NbRow getRow() {
        return row;
    }

    public String getUuidName() {
        return row.getUuid();
    }

    @Override
    public String getOp() {
        return INSERT;
    }

    @Override
    public String toString() {
        return super.toString() + " as " + getUuidName();
    }
}
