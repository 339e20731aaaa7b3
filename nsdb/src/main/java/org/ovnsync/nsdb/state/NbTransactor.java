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
package org.ovnsync.nsdb.state;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.annotation.Nullable;

import com.google.common.base.Predicate;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.inject.Inject;
import org.apache.commons.lang.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ovnsync.nsdb.backend.NbClient;
import org.ovnsync.nsdb.backend.NbOperationException;
import org.ovnsync.nsdb.backend.Operation;
import org.ovnsync.nsdb.backend.OperationResult;
import org.ovnsync.nsdb.backend.RowNotFoundException;
import org.ovnsync.nsdb.config.NorthboundConfig;
import org.ovnsync.nsdb.model.NbRow;

/**
 * Blocking access to the northbound database. Waits for the answers of the
 * {@link NbClient} no longer than the configured request timeout and turns
 * client failures into {@link StateAccessException}s.
 */
public class NbTransactor {

    private static final Logger log =
        LoggerFactory.getLogger(NbTransactor.class);

    private final NbClient client;
    private final NorthboundConfig config;

    @Inject
    public NbTransactor(NbClient client, NorthboundConfig config) {
        this.client = client;
        this.config = config;
    }

    /**
     * Gets a row by uuid.
     *
     * @throws NotFoundException if there is no such row
     */
    public <T extends NbRow> T get(Class<T> clazz, String uuid)
            throws StateAccessException {
        return await(client.get(clazz, uuid),
                     "get " + NbRow.tableName(clazz) + " " + uuid);
    }

    public <T extends NbRow> List<T> list(Class<T> clazz,
                                          @Nullable Predicate<? super T> where)
            throws StateAccessException {
        return await(client.list(clazz, where),
                     "list " + NbRow.tableName(clazz));
    }

    /**
     * Commits the operations as a single transaction. An empty list is not
     * sent to the database.
     *
     * @param name transaction name
     * @param ops operations to apply atomically
     * @param purpose what the transaction does, including the keys of the
     *                rows involved, used in logs and errors
     * @throws TransactionException if the transaction was not applied
     * @throws StateTimeoutException if there was no answer in time
     */
    public List<OperationResult> commit(String name, List<Operation> ops,
                                        String purpose)
            throws StateAccessException {
        if (ops.isEmpty()) {
            log.warn("No operation to commit for {}", purpose);
            return Collections.emptyList();
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        dump(name, ops);
        try {
            return await(client.transact(name, ops), purpose);
        } catch (StateTimeoutException e) {
            log.error("Outcome of transaction {} is unknown: {}", name,
                      e.getMessage());
            throw e;
        } catch (StateAccessException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            Integer opIndex = null;
            if (cause instanceof NbOperationException) {
                opIndex = ((NbOperationException) cause).opIndex;
            }
            TransactionException ex =
                new TransactionException(name, purpose, opIndex, cause);
            log.error(ex.getMessage());
            throw ex;
        } finally {
            stopWatch.stop();
            log.debug("Transaction " + name + " took " + stopWatch.getTime() +
                      " milliseconds.");
        }
    }

    /**
     * Waits for a client answer.
     *
     * @param action description of the request, for error messages
     */
    public <T> T await(ListenableFuture<T> future, String action)
            throws StateAccessException {
        int timeout = config.getRequestTimeout();
        try {
            return future.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StateTimeoutException(
                action + " timed out after " + timeout + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateAccessException(action + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RowNotFoundException) {
                RowNotFoundException nf = (RowNotFoundException) cause;
                throw new NotFoundException(nf.getRowClass(), nf.getUuid(),
                                            nf);
            }
            throw new StateAccessException(
                action + " failed: " + cause.getMessage(), cause);
        }
    }

    private static void dump(String name, List<Operation> ops) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("******** BEGIN TRANSACTION {} *********", name);
        for (Operation op : ops) {
            log.debug(op.toString());
        }
        log.debug("******** END TRANSACTION {} *********", name);
    }
}
