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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A row of the Logical_Router_Static_Route table. Routes are not a root
 * table: a route is only alive while a logical router lists it in its
 * static_routes column.
 */
@NbTable(name = "Logical_Router_Static_Route", root = false)
public class LogicalRouterStaticRoute extends NbRow {

    public static final String COL_ROUTE_TABLE = "route_table";
    public static final String COL_POLICY = "policy";
    public static final String COL_IP_PREFIX = "ip_prefix";
    public static final String COL_NEXTHOP = "nexthop";
    public static final String COL_BFD = "bfd";
    public static final String COL_OPTIONS = "options";
    public static final String COL_EXTERNAL_IDS = "external_ids";

    private static final List<String> COLUMNS = Arrays.asList(
        COL_ROUTE_TABLE, COL_POLICY, COL_IP_PREFIX, COL_NEXTHOP, COL_BFD,
        COL_OPTIONS, COL_EXTERNAL_IDS);

    private String routeTable = "";
    private RoutePolicy policy;
    private String ipPrefix = "";
    private String nexthop = "";
    private String bfd;
    private Map<String, String> options = new HashMap<>();
    private Map<String, String> externalIds = new HashMap<>();

    public LogicalRouterStaticRoute() {
    }

    public LogicalRouterStaticRoute(String uuid) {
        this.uuid = uuid;
    }

    public String getRouteTable() {
        return routeTable;
    }

    public LogicalRouterStaticRoute setRouteTable(String routeTable) {
        this.routeTable = routeTable == null ? "" : routeTable;
        return this;
    }

    /**
     * The policy as stored, which may be unset.
     */
    public RoutePolicy getPolicy() {
        return policy;
    }

    /**
     * The policy the route is evaluated with.
     */
    public RoutePolicy getEffectivePolicy() {
        return RoutePolicy.orDefault(policy);
    }

    public LogicalRouterStaticRoute setPolicy(RoutePolicy policy) {
        this.policy = policy;
        return this;
    }

    public String getIpPrefix() {
        return ipPrefix;
    }

    public LogicalRouterStaticRoute setIpPrefix(String ipPrefix) {
        this.ipPrefix = ipPrefix == null ? "" : ipPrefix;
        return this;
    }

    public String getNexthop() {
        return nexthop;
    }

    public LogicalRouterStaticRoute setNexthop(String nexthop) {
        this.nexthop = nexthop == null ? "" : nexthop;
        return this;
    }

    public String getBfd() {
        return bfd;
    }

    public LogicalRouterStaticRoute setBfd(String bfd) {
        this.bfd = bfd;
        return this;
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public LogicalRouterStaticRoute setOptions(Map<String, String> options) {
        this.options = options == null ? new HashMap<String, String>()
                                       : new HashMap<>(options);
        return this;
    }

    public LogicalRouterStaticRoute setOption(String key, String value) {
        options.put(key, value);
        return this;
    }

    public Map<String, String> getExternalIds() {
        return externalIds;
    }

    public LogicalRouterStaticRoute setExternalIds(
            Map<String, String> externalIds) {
        this.externalIds = externalIds == null ? new HashMap<String, String>()
                                               : new HashMap<>(externalIds);
        return this;
    }

    @Override
    public List<String> columns() {
        return COLUMNS;
    }

    @Override
    public Object getColumn(String column) {
        switch (column) {
            case COL_ROUTE_TABLE: return routeTable;
            case COL_POLICY: return policy;
            case COL_IP_PREFIX: return ipPrefix;
            case COL_NEXTHOP: return nexthop;
            case COL_BFD: return bfd;
            case COL_OPTIONS: return options;
            case COL_EXTERNAL_IDS: return externalIds;
            default:
                throw unknownColumn(LogicalRouterStaticRoute.class, column);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void setColumn(String column, Object value) {
        switch (column) {
            case COL_ROUTE_TABLE: setRouteTable((String) value); break;
            case COL_POLICY: setPolicy((RoutePolicy) value); break;
            case COL_IP_PREFIX: setIpPrefix((String) value); break;
            case COL_NEXTHOP: setNexthop((String) value); break;
            case COL_BFD: setBfd((String) value); break;
            case COL_OPTIONS: setOptions((Map<String, String>) value); break;
            case COL_EXTERNAL_IDS:
                setExternalIds((Map<String, String>) value);
                break;
            default:
                throw unknownColumn(LogicalRouterStaticRoute.class, column);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof LogicalRouterStaticRoute)) return false;

        final LogicalRouterStaticRoute other = (LogicalRouterStaticRoute) obj;

        return Objects.equal(uuid, other.uuid)
               && Objects.equal(routeTable, other.routeTable)
               && Objects.equal(policy, other.policy)
               && Objects.equal(ipPrefix, other.ipPrefix)
               && Objects.equal(nexthop, other.nexthop)
               && Objects.equal(bfd, other.bfd)
               && Objects.equal(options, other.options)
               && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, routeTable, policy, ipPrefix, nexthop,
                                bfd, options, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("uuid", uuid)
            .add("routeTable", routeTable)
            .add("policy", policy)
            .add("ipPrefix", ipPrefix)
            .add("nexthop", nexthop)
            .add("bfd", bfd)
            .add("options", options)
            .add("externalIds", externalIds).toString();
    }
}
