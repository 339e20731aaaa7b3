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

import com.google.common.base.Predicate;
import com.google.common.util.concurrent.ListenableFuture;

import org.ovnsync.nsdb.model.NbRow;

/**
 * Transactional client of the northbound database. Connection handling and
 * the wire protocol live behind this interface; implementations must be
 * safe to use from several threads.
 */
public interface NbClient {

    /**
     * Gets a snapshot of the row with the given uuid. The future fails with
     * {@link RowNotFoundException} if there is no such row.
     */
    <T extends NbRow> ListenableFuture<T> get(Class<T> table, String uuid);

    /**
     * Lists snapshots of the rows of a table accepted by the predicate.
     */
    <T extends NbRow> ListenableFuture<List<T>> list(
        Class<T> table, Predicate<? super T> where);

    /**
     * Submits the operations as one atomic transaction: either all of them
     * apply or none does. The future fails with {@link NbOperationException}
     * when the database rejects one of the operations.
     *
     * @param name the transaction name, used for logging and auditing
     */
    ListenableFuture<List<OperationResult>> transact(String name,
                                                     List<Operation> ops);
}
