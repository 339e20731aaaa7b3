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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SettableFuture;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import org.ovnsync.nsdb.backend.Delete;
import org.ovnsync.nsdb.backend.NbClient;
import org.ovnsync.nsdb.backend.NbException;
import org.ovnsync.nsdb.backend.NbOperationException;
import org.ovnsync.nsdb.backend.Operation;
import org.ovnsync.nsdb.backend.OperationResult;
import org.ovnsync.nsdb.backend.RowNotFoundException;
import org.ovnsync.nsdb.config.NorthboundConfig;
import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@RunWith(MockitoJUnitRunner.class)
public class TestNbTransactor {

    @Mock
    private NbClient client;

    @Mock
    private NorthboundConfig config;

    private NbTransactor transactor;
    private List<Operation> ops;

    @Before
    public void setUp() {
        transactor = new NbTransactor(client, config);
        ops = new ArrayList<>();
        ops.add(new Delete(LogicalRouter.class, "r1"));
    }

    @Test
    public void testCommit() throws Exception {
        doReturn(100).when(config).getRequestTimeout();
        List<OperationResult> results =
            Collections.singletonList(new OperationResult(1, null));
        doReturn(Futures.immediateFuture(results))
            .when(client).transact("tx", ops);

        assertThat(transactor.commit("tx", ops, "delete router r1"),
                   sameInstance(results));
    }

    @Test
    public void testEmptyCommitIsSkipped() throws Exception {
        List<OperationResult> results = transactor.commit(
            "tx", new ArrayList<Operation>(), "nothing");

        assertThat(results, empty());
        verify(client, never()).transact(anyString(), anyList());
    }

    @Test
    public void testRejectedTransaction() throws Exception {
        doReturn(100).when(config).getRequestTimeout();
        NbOperationException error = new NbOperationException(
            "tx", ops, 0, "constraint violation", "bad row");
        doReturn(Futures.immediateFailedFuture(error))
            .when(client).transact("tx", ops);

        try {
            transactor.commit("tx", ops, "delete router r1");
            fail("Expected a TransactionException");
        } catch (TransactionException e) {
            assertThat(e.getTransaction(), equalTo("tx"));
            assertThat(e.getOpIndex(), is(0));
            assertThat(e.getCause(), sameInstance((Throwable) error));
            assertThat(e.getMessage(), containsString("delete router r1"));
        }
    }

    @Test
    public void testTransportFailure() throws Exception {
        doReturn(100).when(config).getRequestTimeout();
        doReturn(Futures.immediateFailedFuture(new NbException("closed")))
            .when(client).transact("tx", ops);

        try {
            transactor.commit("tx", ops, "delete router r1");
            fail("Expected a TransactionException");
        } catch (TransactionException e) {
            assertThat(e.getOpIndex(), nullValue());
            assertThat(e.getCause(), instanceOf(NbException.class));
        }
    }

    @Test
    public void testCommitTimeout() throws Exception {
        doReturn(10).when(config).getRequestTimeout();
        SettableFuture<List<OperationResult>> pending = SettableFuture.create();
        doReturn(pending).when(client).transact("tx", ops);

        try {
            transactor.commit("tx", ops, "delete router r1");
            fail("Expected a StateTimeoutException");
        } catch (StateTimeoutException e) {
            assertThat(pending.isCancelled(), is(true));
        }
    }

    @Test
    public void testGetMissingRow() throws Exception {
        doReturn(100).when(config).getRequestTimeout();
        doReturn(Futures.immediateFailedFuture(new RowNotFoundException(
                LogicalRouterStaticRoute.class, "route-1")))
            .when(client).get(LogicalRouterStaticRoute.class, "route-1");

        try {
            transactor.get(LogicalRouterStaticRoute.class, "route-1");
            fail("Expected a NotFoundException");
        } catch (NotFoundException e) {
            assertThat(e.getId(), equalTo((Object) "route-1"));
            assertThat(e.getClazz(),
                       equalTo((Object) LogicalRouterStaticRoute.class));
        }
    }

    @Test
    public void testInterruptedWait() throws Exception {
        doReturn(1000).when(config).getRequestTimeout();
        Thread.currentThread().interrupt();
        try {
            transactor.await(SettableFuture.create(), "wait");
            fail("Expected a StateAccessException");
        } catch (StateAccessException e) {
            assertThat(e.getCause(), instanceOf(InterruptedException.class));
            assertThat(Thread.interrupted(), is(true));
        }
    }
}
