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

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Predicate;

import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;
import org.ovnsync.nsdb.model.RoutePolicy;

/**
 * Predicates over static routes, to be combined with
 * {@link com.google.common.base.Predicates#and}.
 */
public final class StaticRouteFilters {

    private StaticRouteFilters() {
    }

    public static Predicate<LogicalRouterStaticRoute> routeTable(
            final String routeTable) {
        final String table = routeTable == null ? "" : routeTable;
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return table.equals(route.getRouteTable());
            }
        };
    }

    /**
     * Matches routes evaluated with the given policy. Routes without
     * policy, like a null argument, stand for the default policy.
     */
    public static Predicate<LogicalRouterStaticRoute> policy(
            RoutePolicy policy) {
        final RoutePolicy expected = RoutePolicy.orDefault(policy);
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return route.getEffectivePolicy() == expected;
            }
        };
    }

    public static Predicate<LogicalRouterStaticRoute> ipPrefix(
            final String ipPrefix) {
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return route.getIpPrefix().equals(ipPrefix);
            }
        };
    }

    public static Predicate<LogicalRouterStaticRoute> nexthop(
            final String nexthop) {
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return route.getNexthop().equals(nexthop);
            }
        };
    }

    public static Predicate<LogicalRouterStaticRoute> key(
            final StaticRouteKey key) {
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return key.equals(StaticRouteKey.of(route));
            }
        };
    }

    /**
     * Matches routes whose key is among the given ones.
     */
    public static Predicate<LogicalRouterStaticRoute> keyIn(
            final Collection<StaticRouteKey> keys) {
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return keys.contains(StaticRouteKey.of(route));
            }
        };
    }

    /**
     * Matches routes whose external ids satisfy the filter, see
     * {@link #matchesExternalIds}.
     */
    public static Predicate<LogicalRouterStaticRoute> externalIds(
            final Map<String, String> filter) {
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return matchesExternalIds(route.getExternalIds(), filter);
            }
        };
    }

    public static Predicate<LogicalRouterStaticRoute> option(
            final String key, final String value) {
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return route.getOptions().containsKey(key)
                       && route.getOptions().get(key).equals(value);
            }
        };
    }

    /**
     * Matches routes whose uuid is one of the given ones.
     */
    public static Predicate<LogicalRouterStaticRoute> uuidIn(
            Collection<String> uuids) {
        final Set<String> set = new HashSet<>(uuids);
        return new Predicate<LogicalRouterStaticRoute>() {
            @Override
            public boolean apply(LogicalRouterStaticRoute route) {
                return set.contains(route.getUuid());
            }
        };
    }

    /**
     * Checks external ids against a filter. A filter entry with an empty
     * value only requires the key to be present with a non-empty value,
     * any other entry requires the exact value. Ids with fewer entries than
     * the filter never match.
     */
    public static boolean matchesExternalIds(Map<String, String> externalIds,
                                             Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (externalIds == null || externalIds.size() < filter.size()) {
            return false;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            String actual = externalIds.get(entry.getKey());
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                if (actual == null || actual.isEmpty()) {
                    return false;
                }
            } else if (!entry.getValue().equals(actual)) {
                return false;
            }
        }
        return true;
    }
}
