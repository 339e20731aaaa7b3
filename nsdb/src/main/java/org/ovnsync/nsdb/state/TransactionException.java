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

/**
 * A transaction was rejected or failed in transit. Carries what the
 * transaction was meant to do and, when the database reported it, the
 * index of the operation that failed.
 */
public class TransactionException extends StateAccessException {

    private static final long serialVersionUID = 1L;

    private final String transaction;
    private final Integer opIndex;

    public TransactionException(String transaction, String purpose,
                                Integer opIndex, Throwable cause) {
        super(purpose + " (transaction " + transaction + "): " +
              cause.getMessage(), cause);
        this.transaction = transaction;
        this.opIndex = opIndex;
    }

    public String getTransaction() {
        return transaction;
    }

    /** Index of the failed operation, or null if unknown. */
    public Integer getOpIndex() {
        return opIndex;
    }
}
