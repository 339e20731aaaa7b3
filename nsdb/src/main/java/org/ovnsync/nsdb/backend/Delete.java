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
 * Deletes one row by uuid.
 */
public class Delete extends Operation {

    private final String uuid;

    public Delete(Class<? extends NbRow> rowClass, String uuid) {
        super(rowClass);
        this.uuid = Preconditions.checkNotNull(uuid);
    }

    public String getUuid() {
        return uuid;
    }

    @Override
    public String getOp() {
        return DELETE;
    }

    @Override
    public String toString() {
        return super.toString() + " " + uuid;
    }
}
