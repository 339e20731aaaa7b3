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

import org.junit.Test;

import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;
import org.ovnsync.nsdb.model.RoutePolicy;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class TestStaticRouteKey {

    @Test
    public void testNormalization() {
        StaticRouteKey unset = new StaticRouteKey(null, null, "10.0.0.0/24");
        StaticRouteKey explicit =
            new StaticRouteKey("", RoutePolicy.DST_IP, "10.0.0.0/24");

        assertThat(unset, equalTo(explicit));
        assertThat(unset.hashCode(), is(explicit.hashCode()));
        assertThat(unset.getPolicy(), is(RoutePolicy.DST_IP));
        assertThat(unset.getRouteTable(), equalTo(""));
    }

    @Test
    public void testKeyIgnoresNexthop() {
        LogicalRouterStaticRoute a = new LogicalRouterStaticRoute()
            .setIpPrefix("10.0.0.0/24").setNexthop("192.168.0.1");
        LogicalRouterStaticRoute b = new LogicalRouterStaticRoute()
            .setIpPrefix("10.0.0.0/24").setNexthop("192.168.0.2");

        assertThat(StaticRouteKey.of(a), equalTo(StaticRouteKey.of(b)));
    }

    @Test
    public void testFieldsDoNotBlend() {
        // Concatenated as strings, these two would collide.
        StaticRouteKey first = new StaticRouteKey("a-b", null, "c");
        StaticRouteKey second = new StaticRouteKey("a", null, "b-c");

        assertThat(first, not(equalTo(second)));
        assertThat(new StaticRouteKey("", RoutePolicy.SRC_IP, "10.0.0.0/24"),
                   not(equalTo(new StaticRouteKey("", null, "10.0.0.0/24"))));
    }
}
