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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;

import com.google.common.base.Predicate;
import org.junit.Before;
import org.junit.Test;

import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

public class TestMockNbClient {

    private MockNbClient client;
    private String routerId;

    @Before
    public void setUp() {
        client = new MockNbClient();
        routerId = client.seed(new LogicalRouter(null, "lr0"));
    }

    private LogicalRouterStaticRoute newRoute(String nexthop) {
        return new LogicalRouterStaticRoute(NamedUuid.generate())
            .setIpPrefix("10.0.0.0/24")
            .setNexthop(nexthop);
    }

    private List<Operation> createOps(LogicalRouterStaticRoute... routes) {
        List<Operation> ops = new ArrayList<>();
        List<String> uuids = new ArrayList<>();
        for (LogicalRouterStaticRoute route : routes) {
            ops.add(new Insert(route));
            uuids.add(route.getUuid());
        }
        ops.add(new Mutate(LogicalRouter.class, routerId,
                           LogicalRouter.COL_STATIC_ROUTES, Mutator.INSERT,
                           uuids));
        return ops;
    }

    private Throwable failureOf(java.util.concurrent.Future<?> future)
            throws InterruptedException {
        try {
            future.get();
        } catch (ExecutionException e) {
            return e.getCause();
        }
        fail("Expected the future to fail");
        return null;
    }

    @Test
    public void testNamedUuidsResolveWithinTransaction() throws Exception {
        LogicalRouterStaticRoute route = newRoute("192.168.0.1");

        List<OperationResult> results =
            client.transact("test", createOps(route)).get();

        assertThat(results, hasSize(2));
        String uuid = results.get(0).getUuid();
        assertThat(uuid, notNullValue());
        assertThat(NamedUuid.isNamed(uuid), is(false));
        assertThat(results.get(1).getCount(), is(1));

        LogicalRouter router = client.get(LogicalRouter.class, routerId).get();
        assertThat(router.getStaticRoutes(), contains(uuid));

        LogicalRouterStaticRoute stored =
            client.get(LogicalRouterStaticRoute.class, uuid).get();
        assertThat(stored.getUuid(), equalTo(uuid));
        assertThat(stored.getNexthop(), equalTo("192.168.0.1"));
        assertThat(client.getTransactions(), contains("test"));
    }

    @Test
    public void testRejectedOperationAppliesNothing() throws Exception {
        List<Operation> ops = createOps(newRoute("192.168.0.1"));
        // The name column is not a set.
        ops.add(new Mutate(LogicalRouter.class, routerId,
                           LogicalRouter.COL_NAME, Mutator.INSERT,
                           Arrays.asList("x")));

        Throwable failure = failureOf(client.transact("test", ops));

        assertThat(failure, instanceOf(NbOperationException.class));
        NbOperationException ex = (NbOperationException) failure;
        assertThat(ex.opIndex, is(2));
        assertThat(ex.op, sameInstance(ops.get(2)));
        assertThat(ex.transaction, equalTo("test"));
        assertThat(client.size(LogicalRouterStaticRoute.class), is(0));
        assertThat(client.get(LogicalRouter.class, routerId).get()
                       .getStaticRoutes(), empty());
    }

    @Test
    public void testReferenceToMissingRowIsRejected() throws Exception {
        List<Operation> ops = new ArrayList<>();
        ops.add(new Mutate(LogicalRouter.class, routerId,
                           LogicalRouter.COL_STATIC_ROUTES, Mutator.INSERT,
                           Arrays.asList("no-such-route")));

        Throwable failure = failureOf(client.transact("test", ops));

        assertThat(failure, instanceOf(NbOperationException.class));
        assertThat(((NbOperationException) failure).opIndex, is(0));
        assertThat(((NbOperationException) failure).error,
                   startsWith("referential integrity"));
    }

    @Test
    public void testDuplicateUuidNameIsRejected() throws Exception {
        LogicalRouterStaticRoute route = newRoute("192.168.0.1");
        List<Operation> ops = createOps(route, route);

        Throwable failure = failureOf(client.transact("test", ops));

        assertThat(((NbOperationException) failure).opIndex, is(1));
        assertThat(client.size(LogicalRouterStaticRoute.class), is(0));
    }

    @Test
    public void testUnreferencedRoutesAreCollected() throws Exception {
        String uuid = client.transact("add", createOps(newRoute("192.168.0.1")))
            .get().get(0).getUuid();

        List<Operation> ops = new ArrayList<>();
        ops.add(new Mutate(LogicalRouter.class, routerId,
                           LogicalRouter.COL_STATIC_ROUTES, Mutator.DELETE,
                           Arrays.asList(uuid)));
        client.transact("del", ops).get();

        assertThat(client.contains(LogicalRouterStaticRoute.class, uuid),
                   is(false));
        assertThat(client.contains(LogicalRouter.class, routerId), is(true));
    }

    @Test
    public void testInsertWithoutReferenceIsCollected() throws Exception {
        List<Operation> ops = new ArrayList<>();
        ops.add(new Insert(newRoute("192.168.0.1")));

        List<OperationResult> results = client.transact("test", ops).get();

        assertThat(results.get(0).getCount(), is(1));
        assertThat(client.size(LogicalRouterStaticRoute.class), is(0));
    }

    @Test
    public void testUpdateWritesOnlyNamedColumns() throws Exception {
        String uuid = client.transact("add", createOps(newRoute("192.168.0.1")))
            .get().get(0).getUuid();

        LogicalRouterStaticRoute change = new LogicalRouterStaticRoute(uuid)
            .setNexthop("192.168.0.2")
            .setBfd("bfd-1");
        List<Operation> ops = new ArrayList<>();
        ops.add(new Update(change, LogicalRouterStaticRoute.COL_BFD));
        client.transact("update", ops).get();

        LogicalRouterStaticRoute stored =
            client.get(LogicalRouterStaticRoute.class, uuid).get();
        assertThat(stored.getBfd(), equalTo("bfd-1"));
        assertThat(stored.getNexthop(), equalTo("192.168.0.1"));
        assertThat(stored.getIpPrefix(), equalTo("10.0.0.0/24"));
    }

    @Test
    public void testOperationsOnMissingRowsCountZero() throws Exception {
        List<Operation> ops = new ArrayList<>();
        ops.add(new Update(new LogicalRouterStaticRoute("missing")));
        ops.add(new Delete(LogicalRouter.class, "missing"));

        List<OperationResult> results = client.transact("test", ops).get();

        assertThat(results.get(0).getCount(), is(0));
        assertThat(results.get(1).getCount(), is(0));
    }

    @Test
    public void testGetMissingRow() throws Exception {
        Throwable failure =
            failureOf(client.get(LogicalRouterStaticRoute.class, "missing"));

        assertThat(failure, instanceOf(RowNotFoundException.class));
        assertThat(((RowNotFoundException) failure).getUuid(),
                   equalTo("missing"));
    }

    @Test
    public void testRowsAreSnapshots() throws Exception {
        LogicalRouter router = client.get(LogicalRouter.class, routerId).get();
        router.setName("changed");
        router.getStaticRoutes().add("whatever");

        LogicalRouter again = client.get(LogicalRouter.class, routerId).get();
        assertThat(again.getName(), equalTo("lr0"));
        assertThat(again.getStaticRoutes(), empty());
    }

    @Test
    public void testListFiltersRows() throws Exception {
        client.seed(new LogicalRouter(null, "lr1"));

        List<LogicalRouter> routers = client.list(
            LogicalRouter.class, new Predicate<LogicalRouter>() {
                @Override
                public boolean apply(LogicalRouter router) {
                    return "lr1".equals(router.getName());
                }
            }).get();

        assertThat(routers, hasSize(1));
        assertThat(routers.get(0).getName(), equalTo("lr1"));
        assertThat(client.list(LogicalRouter.class, null).get(), hasSize(2));
    }

    @Test
    public void testInjectedFailure() throws Exception {
        NbException error = new NbException("connection lost");
        client.failNextTransaction(error);

        Throwable failure = failureOf(
            client.transact("test", createOps(newRoute("192.168.0.1"))));

        assertThat(failure, sameInstance((Throwable) error));
        assertThat(client.size(LogicalRouterStaticRoute.class), is(0));

        // Only the next transaction fails.
        client.transact("test", createOps(newRoute("192.168.0.1"))).get();
        assertThat(client.size(LogicalRouterStaticRoute.class), is(1));
    }

    @Test
    public void testSeedKeepsDanglingReferences() throws Exception {
        LogicalRouter router = new LogicalRouter(null, "lr1")
            .setStaticRoutes(Arrays.asList("gone"));
        String uuid = client.seed(router);

        assertThat(client.get(LogicalRouter.class, uuid).get()
                       .getStaticRoutes(), contains("gone"));
    }
}
