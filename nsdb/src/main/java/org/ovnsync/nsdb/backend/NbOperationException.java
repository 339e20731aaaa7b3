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

import java.util.List;

/**
 * The database rejected an operation of a transaction, so none of the
 * operations of the transaction was applied.
 */
public class NbOperationException extends NbException {

    private static final long serialVersionUID = 1L;

    public final String transaction;
    public final Integer opIndex;
    public final Operation op;
    public final String error;
    public final String details;

    public NbOperationException(String transaction, List<Operation> ops,
                                Integer idx, String error, String details) {
        super((idx == null || idx >= ops.size())
              ? String.format("%s: %s: %s", transaction, error, details)
              : String.format("%s: %s: %s: %s", transaction, ops.get(idx),
                              error, details));
        this.transaction = transaction;
        this.opIndex = idx;
        this.op = (idx == null || idx >= ops.size()) ? null : ops.get(idx);
        this.error = error;
        this.details = details;
    }
}
