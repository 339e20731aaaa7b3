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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;
import org.ovnsync.nsdb.model.RoutePolicy;

/**
 * The domain key of a static route within one router: routing table,
 * policy and prefix. Routes sharing a key form an ECMP group and are told
 * apart by their nexthop. An unset table is the default one and an unset
 * policy is {@link RoutePolicy#DEFAULT}.
 */
public final class StaticRouteKey {

    private final String routeTable;
    private final RoutePolicy policy;
    private final String ipPrefix;

    public StaticRouteKey(String routeTable, RoutePolicy policy,
                          String ipPrefix) {
        this.routeTable = routeTable == null ? "" : routeTable;
        this.policy = RoutePolicy.orDefault(policy);
        this.ipPrefix = ipPrefix == null ? "" : ipPrefix;
    }

    public static StaticRouteKey of(LogicalRouterStaticRoute route) {
        return new StaticRouteKey(route.getRouteTable(), route.getPolicy(),
                                  route.getIpPrefix());
    }

    public String getRouteTable() {
        return routeTable;
    }

    public RoutePolicy getPolicy() {
        return policy;
    }

    public String getIpPrefix() {
        return ipPrefix;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof StaticRouteKey)) return false;
        final StaticRouteKey other = (StaticRouteKey) obj;
        return routeTable.equals(other.routeTable)
               && policy == other.policy
               && ipPrefix.equals(other.ipPrefix);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(routeTable, policy, ipPrefix);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("routeTable", routeTable)
            .add("policy", policy)
            .add("ipPrefix", ipPrefix).toString();
    }
}
