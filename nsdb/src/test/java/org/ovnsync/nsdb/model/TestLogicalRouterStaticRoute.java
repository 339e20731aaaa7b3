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
package org.ovnsync.nsdb.model;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import org.ovnsync.nsdb.backend.RowSerializer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class TestLogicalRouterStaticRoute {

    private LogicalRouterStaticRoute route() {
        return new LogicalRouterStaticRoute("route-1")
            .setRouteTable("rtb")
            .setPolicy(RoutePolicy.SRC_IP)
            .setIpPrefix("10.0.0.0/24")
            .setNexthop("192.168.0.1")
            .setBfd("bfd-1")
            .setOption("ecmp_symmetric_reply", "true")
            .setExternalIds(Collections.singletonMap("vendor", "ovnsync"));
    }

    @Test
    public void testColumns() {
        LogicalRouterStaticRoute route = route();

        assertThat(route.getColumn(LogicalRouterStaticRoute.COL_POLICY),
                   equalTo((Object) RoutePolicy.SRC_IP));
        assertThat(route.getColumn(LogicalRouterStaticRoute.COL_NEXTHOP),
                   equalTo((Object) "192.168.0.1"));

        route.setColumn(LogicalRouterStaticRoute.COL_NEXTHOP, "192.168.0.2");
        route.setColumn(LogicalRouterStaticRoute.COL_BFD, null);
        assertThat(route.getNexthop(), equalTo("192.168.0.2"));
        assertThat(route.getBfd(), nullValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownColumn() {
        route().getColumn("name");
    }

    @Test
    public void testTables() {
        assertThat(NbRow.tableName(LogicalRouterStaticRoute.class),
                   equalTo("Logical_Router_Static_Route"));
        assertThat(NbRow.isRoot(LogicalRouterStaticRoute.class), is(false));
        assertThat(NbRow.isRoot(LogicalRouter.class), is(true));
        assertThat(route().references(), empty());
    }

    @Test
    public void testRouterReferencesItsRoutes() {
        LogicalRouter router = new LogicalRouter("r1", "lr0")
            .setStaticRoutes(Arrays.asList("a", "b"));
        assertThat(router.references(), containsInAnyOrder("a", "b"));
    }

    @Test
    public void testSerializedCopy() throws Exception {
        LogicalRouterStaticRoute route = route();

        LogicalRouterStaticRoute copy = new RowSerializer().copy(route);

        assertThat(copy, equalTo(route));
        assertThat(copy, not(sameInstance(route)));
        copy.getOptions().clear();
        assertThat(route.getOptions().get("ecmp_symmetric_reply"),
                   equalTo("true"));
    }

    @Test
    public void testSerializedCopyWithoutPolicy() throws Exception {
        LogicalRouterStaticRoute route = route().setPolicy(null);

        LogicalRouterStaticRoute copy = new RowSerializer().copy(route);

        assertThat(copy, equalTo(route));
        assertThat(copy.getEffectivePolicy(), is(RoutePolicy.DST_IP));
    }
}
