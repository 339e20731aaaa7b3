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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import org.ovnsync.nsdb.model.NbRow;

/**
 * Adds values to, or removes values from, a set column of one row. Values
 * may be uuid-names of rows inserted earlier in the same transaction.
 */
public class Mutate extends Operation {

    private final String uuid;
    private final String column;
    private final Mutator mutator;
    private final List<String> values;

    public Mutate(Class<? extends NbRow> rowClass, String uuid, String column,
                  Mutator mutator, Collection<String> values) {
        super(rowClass);
        this.uuid = Preconditions.checkNotNull(uuid);
        this.column = Preconditions.checkNotNull(column);
        this.mutator = Preconditions.checkNotNull(mutator);
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /** Uuid of the mutated row. */
    public String getUuid() {
        return uuid;
    }

    public String getColumn() {
        return column;
    }

    public Mutator getMutator() {
        return mutator;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public String getOp() {
        return MUTATE;
    }

    @Override
    public String toString() {
        return super.toString() + " " + uuid + " " + column + " " +
               mutator.value() + " " + values;
    }
}
