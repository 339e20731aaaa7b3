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
package org.ovnsync.routes;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import org.ovnsync.nsdb.backend.Insert;
import org.ovnsync.nsdb.backend.Mutate;
import org.ovnsync.nsdb.backend.Mutator;
import org.ovnsync.nsdb.backend.NamedUuid;
import org.ovnsync.nsdb.backend.Operation;
import org.ovnsync.nsdb.backend.Update;
import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;
import org.ovnsync.nsdb.model.RoutePolicy;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class TestStaticRouteOpBuilder {

    private StaticRouteOpBuilder builder;
    private LogicalRouter router;

    @Before
    public void setUp() {
        builder = new StaticRouteOpBuilder();
        router = new LogicalRouter("r-1", "lr0");
    }

    @Test
    public void testPrepareCreateAttachesRoutes() {
        LogicalRouterStaticRoute named =
            new LogicalRouterStaticRoute(NamedUuid.generate());
        LogicalRouterStaticRoute anonymous = new LogicalRouterStaticRoute();

        List<Operation> ops =
            builder.prepareCreate(router, Arrays.asList(named, anonymous));

        assertThat(ops, hasSize(3));
        assertThat(ops.get(0), instanceOf(Insert.class));
        assertThat(ops.get(1), instanceOf(Insert.class));
        assertThat(NamedUuid.isNamed(anonymous.getUuid()), is(true));
        assertThat(anonymous.getPolicy(), is(RoutePolicy.DST_IP));

        Mutate attach = (Mutate) ops.get(2);
        assertThat(attach.getUuid(), equalTo("r-1"));
        assertThat(attach.getColumn(),
                   equalTo(LogicalRouter.COL_STATIC_ROUTES));
        assertThat(attach.getMutator(), is(Mutator.INSERT));
        assertThat(attach.getValues(),
                   contains(named.getUuid(), anonymous.getUuid()));
    }

    @Test
    public void testPrepareCreateNothing() {
        List<LogicalRouterStaticRoute> none =
            Collections.singletonList(null);
        assertThat(builder.prepareCreate(router, none), empty());
    }

    @Test
    public void testPrepareDetach() {
        List<Operation> ops = builder.prepareRoutesMutation(
            router, Arrays.asList("a", "b"), Mutator.DELETE);

        assertThat(ops, hasSize(1));
        assertThat(((Mutate) ops.get(0)).getMutator(), is(Mutator.DELETE));
        assertThat(builder.prepareRoutesMutation(
                       router, Collections.<String>emptyList(),
                       Mutator.DELETE), empty());
    }

    @Test
    public void testPrepareClear() {
        router.setStaticRoutes(Arrays.asList("a", "b"));

        List<Operation> ops = builder.prepareClear(router);

        assertThat(ops, hasSize(1));
        Update update = (Update) ops.get(0);
        assertThat(update.getUuid(), equalTo("r-1"));
        assertThat(update.getColumns(),
                   contains(LogicalRouter.COL_STATIC_ROUTES));
        assertThat(((LogicalRouter) update.getRow()).getStaticRoutes(),
                   empty());
        // The given router is not changed.
        assertThat(router.getStaticRoutes(), hasSize(2));
    }
}
