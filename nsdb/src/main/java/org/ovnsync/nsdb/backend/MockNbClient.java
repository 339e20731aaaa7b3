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
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.google.common.base.Predicate;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ovnsync.nsdb.model.NbRow;

/**
 * This is an in-memory, naive implementation of the NbClient interface.
 * It is meant to be used in tests. However, it is packaged here so that it
 * can be used by external projects.
 *
 * Rows are kept serialized, so every read returns an independent snapshot.
 * A transaction is applied to a copy of the tables that replaces them only
 * if every operation succeeds. After each transaction, rows of non-root
 * tables that no row references any more are deleted.
 */
public class MockNbClient implements NbClient {

    private static final Logger log =
        LoggerFactory.getLogger(MockNbClient.class);

    private static final String ERR_CONSTRAINT = "constraint violation";
    private static final String ERR_REFERENTIAL =
        "referential integrity violation";
    private static final String ERR_DOMAIN = "domain error";

    private final RowSerializer serializer = new RowSerializer();

    private Map<Class<? extends NbRow>, Map<String, byte[]>> tables =
        new HashMap<>();

    private final List<String> transactions = new ArrayList<>();

    private RuntimeException nextFailure = null;

    /** An operation the database rejects. */
    private static class OpFailure extends Exception {
        private static final long serialVersionUID = 1L;
        final String error;
        final String details;

        OpFailure(String error, String details) {
            super(error + ": " + details);
            this.error = error;
            this.details = details;
        }
    }

    @Override
    public synchronized <T extends NbRow> ListenableFuture<T> get(
            Class<T> table, String uuid) {
        byte[] data = table(tables, table).get(uuid);
        if (data == null) {
            return Futures.immediateFailedFuture(
                new RowNotFoundException(table, uuid));
        }
        try {
            return Futures.immediateFuture(serializer.deserialize(data, table));
        } catch (SerializationException e) {
            return Futures.immediateFailedFuture(
                new NbException("Cannot read " + uuid, e));
        }
    }

    @Override
    public synchronized <T extends NbRow> ListenableFuture<List<T>> list(
            Class<T> table, Predicate<? super T> where) {
        List<T> rows = new ArrayList<>();
        try {
            for (byte[] data : table(tables, table).values()) {
                T row = serializer.deserialize(data, table);
                if (where == null || where.apply(row)) {
                    rows.add(row);
                }
            }
        } catch (SerializationException e) {
            return Futures.immediateFailedFuture(
                new NbException("Cannot list " + NbRow.tableName(table), e));
        }
        return Futures.immediateFuture(rows);
    }

    @Override
    public synchronized ListenableFuture<List<OperationResult>> transact(
            String name, List<Operation> ops) {
        transactions.add(name);

        if (nextFailure != null) {
            RuntimeException failure = nextFailure;
            nextFailure = null;
            log.debug("Transaction {} failed on request: {}", name,
                      failure.getMessage());
            return Futures.immediateFailedFuture(failure);
        }

        Map<Class<? extends NbRow>, Map<String, byte[]>> working = copyTables();
        Map<String, String> named = new HashMap<>();
        List<OperationResult> results = new ArrayList<>(ops.size());
        Map<String, Integer> addedRefs = new LinkedHashMap<>();

        int index = 0;
        try {
            for (; index < ops.size(); index++) {
                results.add(apply(working, named, addedRefs, index,
                                  ops.get(index)));
            }
            for (Map.Entry<String, Integer> ref : addedRefs.entrySet()) {
                if (!containsRow(working, ref.getKey())) {
                    index = ref.getValue();
                    throw new OpFailure(ERR_REFERENTIAL,
                                        "reference to missing row " +
                                        ref.getKey());
                }
            }
            collectGarbage(working);
        } catch (OpFailure f) {
            log.debug("Transaction {} rejected: {}", name, f.getMessage());
            return Futures.immediateFailedFuture(
                new NbOperationException(name, ops, index, f.error,
                                         f.details));
        } catch (SerializationException e) {
            return Futures.immediateFailedFuture(
                new NbException("Transaction " + name + " failed", e));
        }

        tables = working;
        log.debug("Transaction {} committed {} operations", name, ops.size());
        return Futures.immediateFuture(results);
    }

    private OperationResult apply(
            Map<Class<? extends NbRow>, Map<String, byte[]>> working,
            Map<String, String> named, Map<String, Integer> addedRefs,
            int index, Operation op)
            throws OpFailure, SerializationException {

        if (op instanceof Insert) {
            Insert insert = (Insert) op;
            if (named.containsKey(insert.getUuidName())) {
                throw new OpFailure(ERR_DOMAIN, "duplicate uuid-name " +
                                                insert.getUuidName());
            }
            String uuid = UUID.randomUUID().toString();
            named.put(insert.getUuidName(), uuid);
            NbRow row = serializer.copy(insert.getRow());
            row.setUuid(uuid);
            table(working, op.getRowClass()).put(uuid,
                                                 serializer.serialize(row));
            return new OperationResult(1, uuid);
        }

        if (op instanceof Update) {
            Update update = (Update) op;
            String uuid = resolve(named, update.getUuid());
            NbRow stored = read(working, op.getRowClass(), uuid);
            if (stored == null) {
                return new OperationResult(0, null);
            }
            for (String column : update.getColumns()) {
                stored.setColumn(column, update.getRow().getColumn(column));
            }
            table(working, op.getRowClass()).put(uuid,
                                                 serializer.serialize(stored));
            return new OperationResult(1, null);
        }

        if (op instanceof Mutate) {
            Mutate mutate = (Mutate) op;
            String uuid = resolve(named, mutate.getUuid());
            NbRow stored = read(working, op.getRowClass(), uuid);
            if (stored == null) {
                return new OperationResult(0, null);
            }
            if (!stored.columns().contains(mutate.getColumn())) {
                throw new OpFailure(ERR_CONSTRAINT, "no column " +
                                    mutate.getColumn() + " in " +
                                    op.getTable());
            }
            Object current = stored.getColumn(mutate.getColumn());
            if (!(current instanceof Collection)) {
                throw new OpFailure(ERR_DOMAIN, "column " +
                                    mutate.getColumn() + " is not a set");
            }
            Set<String> values = new LinkedHashSet<>();
            for (Object value : (Collection<?>) current) {
                values.add((String) value);
            }
            for (String value : mutate.getValues()) {
                String resolved = resolve(named, value);
                if (mutate.getMutator() == Mutator.INSERT) {
                    values.add(resolved);
                    addedRefs.put(resolved, index);
                } else {
                    values.remove(resolved);
                }
            }
            stored.setColumn(mutate.getColumn(), values);
            table(working, op.getRowClass()).put(uuid,
                                                 serializer.serialize(stored));
            return new OperationResult(1, null);
        }

        if (op instanceof Delete) {
            String uuid = resolve(named, ((Delete) op).getUuid());
            byte[] removed = table(working, op.getRowClass()).remove(uuid);
            return new OperationResult(removed == null ? 0 : 1, null);
        }

        throw new OpFailure(ERR_DOMAIN, "unsupported operation " + op.getOp());
    }

    private void collectGarbage(
            Map<Class<? extends NbRow>, Map<String, byte[]>> working)
            throws SerializationException {
        Set<String> referenced = new HashSet<>();
        for (Map.Entry<Class<? extends NbRow>, Map<String, byte[]>> table
                : working.entrySet()) {
            for (byte[] data : table.getValue().values()) {
                referenced.addAll(
                    serializer.deserialize(data, table.getKey()).references());
            }
        }
        for (Map.Entry<Class<? extends NbRow>, Map<String, byte[]>> table
                : working.entrySet()) {
            if (NbRow.isRoot(table.getKey())) {
                continue;
            }
            Iterator<String> it = table.getValue().keySet().iterator();
            while (it.hasNext()) {
                String uuid = it.next();
                if (!referenced.contains(uuid)) {
                    log.debug("Removing unreferenced {} row {}",
                              NbRow.tableName(table.getKey()), uuid);
                    it.remove();
                }
            }
        }
    }

    private static String resolve(Map<String, String> named, String id) {
        String uuid = named.get(id);
        return uuid == null ? id : uuid;
    }

    private static boolean containsRow(
            Map<Class<? extends NbRow>, Map<String, byte[]>> working,
            String uuid) {
        for (Map<String, byte[]> rows : working.values()) {
            if (rows.containsKey(uuid)) {
                return true;
            }
        }
        return false;
    }

    private NbRow read(Map<Class<? extends NbRow>, Map<String, byte[]>> working,
                       Class<? extends NbRow> clazz, String uuid)
            throws SerializationException {
        byte[] data = table(working, clazz).get(uuid);
        return data == null ? null : serializer.deserialize(data, clazz);
    }

    private static Map<String, byte[]> table(
            Map<Class<? extends NbRow>, Map<String, byte[]>> tables,
            Class<? extends NbRow> clazz) {
        Map<String, byte[]> table = tables.get(clazz);
        if (table == null) {
            table = new LinkedHashMap<>();
            tables.put(clazz, table);
        }
        return table;
    }

    private Map<Class<? extends NbRow>, Map<String, byte[]>> copyTables() {
        Map<Class<? extends NbRow>, Map<String, byte[]>> copy =
            new HashMap<>();
        for (Map.Entry<Class<? extends NbRow>, Map<String, byte[]>> table
                : tables.entrySet()) {
            copy.put(table.getKey(), new LinkedHashMap<>(table.getValue()));
        }
        return copy;
    }

    /**
     * Stores a copy of the row as is, bypassing transactions, reference
     * checks and garbage collection. Lets tests build states that a real
     * database would only expose transiently, like dangling references or
     * duplicated routes. A row without uuid gets a new one.
     *
     * @return the uuid of the stored row
     */
    public synchronized String seed(NbRow row) {
        try {
            NbRow copy = serializer.copy(row);
            if (copy.getUuid() == null) {
                copy.setUuid(UUID.randomUUID().toString());
            }
            table(tables, copy.getClass()).put(copy.getUuid(),
                                               serializer.serialize(copy));
            return copy.getUuid();
        } catch (SerializationException e) {
            throw new NbException("Cannot seed " + row, e);
        }
    }

    /**
     * Removes a row bypassing transactions, as a concurrent writer would.
     */
    public synchronized boolean remove(Class<? extends NbRow> table,
                                       String uuid) {
        return table(tables, table).remove(uuid) != null;
    }

    /**
     * Makes the next transaction fail with the given exception without
     * applying any of its operations.
     */
    public synchronized void failNextTransaction(RuntimeException failure) {
        this.nextFailure = failure;
    }

    /** Number of rows stored in a table, referenced or not. */
    public synchronized int size(Class<? extends NbRow> table) {
        return table(tables, table).size();
    }

    public synchronized boolean contains(Class<? extends NbRow> table,
                                         String uuid) {
        return table(tables, table).containsKey(uuid);
    }

    /** Names of the transactions submitted so far, in order. */
    public synchronized List<String> getTransactions() {
        return new ArrayList<>(transactions);
    }
}
