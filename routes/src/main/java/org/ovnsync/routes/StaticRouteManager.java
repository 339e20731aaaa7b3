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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ovnsync.nsdb.backend.Mutator;
import org.ovnsync.nsdb.backend.NamedUuid;
import org.ovnsync.nsdb.backend.Operation;
import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;
import org.ovnsync.nsdb.model.RoutePolicy;
import org.ovnsync.nsdb.state.AmbiguousStateException;
import org.ovnsync.nsdb.state.InvalidStateOperationException;
import org.ovnsync.nsdb.state.NbTransactor;
import org.ovnsync.nsdb.state.NotFoundException;
import org.ovnsync.nsdb.state.StateAccessException;

import static org.ovnsync.routes.StaticRouteFilters.externalIds;
import static org.ovnsync.routes.StaticRouteFilters.ipPrefix;
import static org.ovnsync.routes.StaticRouteFilters.keyIn;
import static org.ovnsync.routes.StaticRouteFilters.nexthop;
import static org.ovnsync.routes.StaticRouteFilters.option;
import static org.ovnsync.routes.StaticRouteFilters.policy;
import static org.ovnsync.routes.StaticRouteFilters.routeTable;
import static org.ovnsync.routes.StaticRouteFilters.uuidIn;

/**
 * Keeps the static routes of logical routers in line with the desired
 * routing state. Every change is one atomic transaction. Deletions and
 * reconciliations are no-ops when their target does not exist, so any call
 * can be repeated from scratch.
 *
 * Routes are read by following the references of their router, one row at
 * a time. A reference whose row has been removed in between is skipped.
 */
public class StaticRouteManager {

    private static final Logger log =
        LoggerFactory.getLogger(StaticRouteManager.class);

    public static final String TX_ROUTES_ADD = "lr-routes-add";
    public static final String TX_ROUTE_DEL = "lr-route-del";
    public static final String TX_ROUTE_UPDATE = "net-update";
    public static final String TX_ROUTES_CLEAR = "lr-route-clear";

    /** Option set on routes that belong to a BFD-gated ECMP group. */
    public static final String OPT_ECMP_SYMMETRIC_REPLY =
        "ecmp_symmetric_reply";

    /**
     * Customizes a route built by {@link #newStaticRoute}.
     */
    public interface RouteOption {
        void apply(LogicalRouterStaticRoute route);
    }

    private final NbTransactor transactor;
    private final LogicalRouterManager routerManager;
    private final StaticRouteOpBuilder opBuilder;

    @Inject
    public StaticRouteManager(NbTransactor transactor,
                              LogicalRouterManager routerManager,
                              StaticRouteOpBuilder opBuilder) {
        this.transactor = transactor;
        this.routerManager = routerManager;
        this.opBuilder = opBuilder;
    }

    /**
     * Creates routes and attaches them to a router, all at once.
     *
     * @throws NotFoundException if the router does not exist
     * @throws InvalidStateOperationException if a route has the key and
     *         nexthop of a route of the router or of another route of the
     *         batch, in which case nothing is created
     */
    public void createStaticRoutes(String routerName,
                                   List<LogicalRouterStaticRoute> routes)
            throws StateAccessException {
        if (routes == null || routes.isEmpty()) {
            return;
        }
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              false);

        SetMultimap<StaticRouteKey, String> taken =
            LinkedHashMultimap.create();
        for (LogicalRouterStaticRoute route : listStaticRoutes(
                router, Predicates.<LogicalRouterStaticRoute>alwaysTrue())) {
            taken.put(StaticRouteKey.of(route), route.getNexthop());
        }
        for (LogicalRouterStaticRoute route : routes) {
            if (route == null) {
                continue;
            }
            StaticRouteKey key = StaticRouteKey.of(route);
            if (!taken.put(key, route.getNexthop())) {
                throw new InvalidStateOperationException(
                    "logical router " + routerName + " already has static " +
                    "route " + key + " via " + route.getNexthop());
            }
        }
        create(router, routes);
    }

    /**
     * Reconciles the ECMP group of a route key with the desired nexthops.
     * Routes of the group whose nexthop is not desired are removed first,
     * then the missing nexthops are added. A route with a BFD session other
     * than the given one is left alone.
     *
     * @param policy route policy, null for the default one
     * @param bfdId BFD session of the new routes, may be null
     * @param externalIds external ids of the new routes
     */
    public void addStaticRoute(String routerName, String routeTable,
                               @Nullable RoutePolicy policy, String ipPrefix,
                               @Nullable String bfdId,
                               @Nullable Map<String, String> externalIds,
                               String... nexthops)
            throws StateAccessException {
        String table = routeTable == null ? "" : routeTable;
        RoutePolicy effective = RoutePolicy.orDefault(policy);

        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              false);
        List<LogicalRouterStaticRoute> routes = listStaticRoutes(
            router, routeFilter(table, effective, ipPrefix, null));

        Set<String> desired = new LinkedHashSet<>(Arrays.asList(nexthops));
        Set<String> existing = new HashSet<>();
        List<String> toDel = new ArrayList<>();
        for (LogicalRouterStaticRoute route : routes) {
            if (desired.contains(route.getNexthop())) {
                existing.add(route.getNexthop());
            } else {
                if (route.getBfd() != null && bfdId != null
                    && !route.getBfd().equals(bfdId)) {
                    continue;
                }
                toDel.add(route.getUuid());
            }
        }

        List<LogicalRouterStaticRoute> toAdd = new ArrayList<>();
        for (String hop : desired) {
            if (!existing.contains(hop)) {
                toAdd.add(buildStaticRoute(table, effective, ipPrefix, hop,
                                           bfdId, externalIds));
            }
        }

        if (!toDel.isEmpty()) {
            log.info("logical router {} del static routes: {}", routerName,
                     toDel);
            detach(router, toDel);
        }
        create(router, toAdd);
    }

    /**
     * Overwrites columns of the stored route that has the uuid of the given
     * one. No column means every column.
     *
     * @throws InvalidStateOperationException if the route is null, has no
     *         uuid or a column is unknown
     */
    public void updateStaticRoute(LogicalRouterStaticRoute route,
                                  String... columns)
            throws StateAccessException {
        if (route == null) {
            throw new InvalidStateOperationException("route is null");
        }
        if (route.getUuid() == null) {
            throw new InvalidStateOperationException(
                "route " + StaticRouteKey.of(route) + " has no uuid");
        }
        List<Operation> ops;
        try {
            ops = opBuilder.prepareUpdate(route, columns);
        } catch (IllegalArgumentException e) {
            throw new InvalidStateOperationException(e.getMessage(), e);
        }
        transactor.commit(TX_ROUTE_UPDATE, ops, String.format(
            "update logical router static route 'policy %s ip_prefix %s'",
            route.getEffectivePolicy(), route.getIpPrefix()));
    }

    /**
     * Deletes the route with the given key and nexthop, or the whole ECMP
     * group when the nexthop is empty.
     *
     * @param routeTable route table, null for any
     * @param policy route policy, null for the default one
     */
    public void deleteStaticRoute(String routerName,
                                  @Nullable String routeTable,
                                  @Nullable RoutePolicy policy,
                                  String ipPrefix, @Nullable String nexthop)
            throws StateAccessException {
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              true);
        if (router == null) {
            return;
        }

        List<LogicalRouterStaticRoute> routes = listStaticRoutes(
            router, routeFilter(routeTable, RoutePolicy.orDefault(policy),
                                ipPrefix, null));
        List<String> uuids = new ArrayList<>(routes.size());
        for (LogicalRouterStaticRoute route : routes) {
            if (nexthop == null || nexthop.isEmpty()
                || route.getNexthop().equals(nexthop)) {
                uuids.add(route.getUuid());
            }
        }
        detach(router, uuids);
    }

    /**
     * Deletes one route of a router by uuid, whatever its key.
     */
    public void deleteStaticRouteByUuid(String routerName, String uuid)
            throws StateAccessException {
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              true);
        if (router == null) {
            return;
        }
        detach(router, Arrays.asList(uuid));
    }

    /**
     * Deletes the routes of a router whose external ids match the filter.
     *
     * @see StaticRouteFilters#matchesExternalIds
     */
    public void deleteStaticRoutesByExternalIds(
            String routerName, Map<String, String> externalIds)
            throws StateAccessException {
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              true);
        if (router == null) {
            return;
        }

        List<String> uuids = new ArrayList<>();
        for (LogicalRouterStaticRoute route : listStaticRoutes(
                router, routeFilter(null, null, null, externalIds))) {
            uuids.add(route.getUuid());
        }
        detach(router, uuids);
    }

    /**
     * Deletes the routes of a router matching any of the given ones. A
     * candidate matches the routes with its key and nexthop, or every route
     * with its key when its nexthop is empty. Only the routes the router
     * references are considered.
     */
    public void batchDeleteStaticRoutes(
            String routerName, Collection<LogicalRouterStaticRoute> candidates)
            throws StateAccessException {
        if (candidates == null || candidates.isEmpty()) {
            return;
        }
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              true);
        if (router == null) {
            return;
        }

        SetMultimap<StaticRouteKey, String> nexthops =
            LinkedHashMultimap.create();
        for (LogicalRouterStaticRoute candidate : candidates) {
            if (candidate != null) {
                nexthops.put(StaticRouteKey.of(candidate),
                             candidate.getNexthop());
            }
        }
        if (nexthops.isEmpty()) {
            return;
        }

        List<LogicalRouterStaticRoute> routes = transactor.list(
            LogicalRouterStaticRoute.class,
            Predicates.and(uuidIn(router.getStaticRoutes()),
                           keyIn(nexthops.keySet())));

        List<String> uuids = new ArrayList<>(routes.size());
        for (LogicalRouterStaticRoute route : routes) {
            Set<String> expected = nexthops.get(StaticRouteKey.of(route));
            if (expected.contains("")
                || expected.contains(route.getNexthop())) {
                uuids.add(route.getUuid());
            }
        }
        detach(router, uuids);
    }

    /**
     * Detaches every route of a router without reading them.
     *
     * @throws NotFoundException if the router does not exist
     */
    public void clearStaticRoutes(String routerName)
            throws StateAccessException {
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              false);
        transactor.commit(TX_ROUTES_CLEAR, opBuilder.prepareClear(router),
                          "clear logical router " + routerName +
                          " static routes");
    }

    /**
     * @throws NotFoundException if there is no such route
     */
    public LogicalRouterStaticRoute getStaticRouteByUuid(String uuid)
            throws StateAccessException {
        return transactor.get(LogicalRouterStaticRoute.class, uuid);
    }

    /**
     * Gets the route of a router with the given key and nexthop.
     *
     * @param ignoreNotFound return null instead of failing when there is no
     *                       such route
     * @throws NotFoundException if the router does not exist, or the route
     *         does not and absence is not tolerated
     * @throws AmbiguousStateException if several routes match
     */
    public LogicalRouterStaticRoute getStaticRoute(
            String routerName, String routeTable, @Nullable RoutePolicy policy,
            String ipPrefix, String nexthop, boolean ignoreNotFound)
            throws StateAccessException {
        StaticRouteKey key = new StaticRouteKey(routeTable, policy, ipPrefix);
        LogicalRouter router = routerManager.getLogicalRouter(routerName,
                                                              false);
        List<LogicalRouterStaticRoute> routes = listStaticRoutes(
            router, Predicates.and(StaticRouteFilters.key(key),
                                   nexthop(nexthop == null ? "" : nexthop)));

        String desc = String.format(
            "logical router %s static route 'policy %s ip_prefix %s " +
            "nexthop %s'", routerName, key.getPolicy(), key.getIpPrefix(),
            nexthop);
        if (routes.isEmpty()) {
            if (ignoreNotFound) {
                return null;
            }
            throw new NotFoundException(LogicalRouterStaticRoute.class, desc);
        }
        if (routes.size() > 1) {
            List<String> uuids = new ArrayList<>(routes.size());
            for (LogicalRouterStaticRoute route : routes) {
                uuids.add(route.getUuid());
            }
            AmbiguousStateException ex = new AmbiguousStateException(
                LogicalRouterStaticRoute.class, desc, uuids);
            log.error(ex.getMessage());
            throw ex;
        }
        return routes.get(0);
    }

    public boolean staticRouteExists(String routerName, String routeTable,
                                     @Nullable RoutePolicy policy,
                                     String ipPrefix, String nexthop)
            throws StateAccessException {
        return getStaticRoute(routerName, routeTable, policy, ipPrefix,
                              nexthop, true) != null;
    }

    /**
     * Lists the routes of a router.
     *
     * @param routeTable route table, null for any
     * @param policy route policy, null for any
     * @param ipPrefix prefix, null or empty for any
     * @param externalIds external id filter, null or empty for any
     * @throws NotFoundException if the router does not exist
     */
    public List<LogicalRouterStaticRoute> listStaticRoutes(
            String routerName, @Nullable String routeTable,
            @Nullable RoutePolicy policy, @Nullable String ipPrefix,
            @Nullable Map<String, String> externalIds)
            throws StateAccessException {
        return listStaticRoutes(
            routerManager.getLogicalRouter(routerName, false),
            routeFilter(routeTable, policy, ipPrefix, externalIds));
    }

    /**
     * Lists the routes of a router whose option has the given value.
     */
    public List<LogicalRouterStaticRoute> listStaticRoutesByOption(
            String routerName, String key, String value)
            throws StateAccessException {
        return listStaticRoutes(
            routerManager.getLogicalRouter(routerName, false),
            option(key, value));
    }

    /**
     * Builds, without storing it, a route with a named uuid for the given
     * router. When a BFD session is given the route references it and is
     * marked as part of a BFD-gated ECMP group.
     *
     * @return the route, or null if the router already has it
     */
    public LogicalRouterStaticRoute newStaticRoute(
            String routerName, String routeTable, @Nullable RoutePolicy policy,
            String ipPrefix, String nexthop, @Nullable String bfdId,
            @Nullable Map<String, String> externalIds, RouteOption... options)
            throws StateAccessException {
        if (routerName == null || routerName.isEmpty()) {
            throw new InvalidStateOperationException(
                "the logical router name is required");
        }
        RoutePolicy effective = RoutePolicy.orDefault(policy);
        if (staticRouteExists(routerName, routeTable, effective, ipPrefix,
                              nexthop)) {
            return null;
        }
        LogicalRouterStaticRoute route = new LogicalRouterStaticRoute(
            NamedUuid.generate())
            .setRouteTable(routeTable)
            .setPolicy(effective)
            .setIpPrefix(ipPrefix)
            .setNexthop(nexthop)
            .setExternalIds(externalIds);
        for (RouteOption option : options) {
            option.apply(route);
        }
        return withBfd(route, bfdId);
    }

    private static LogicalRouterStaticRoute buildStaticRoute(
            String routeTable, RoutePolicy policy, String ipPrefix,
            String nexthop, String bfdId, Map<String, String> externalIds) {
        LogicalRouterStaticRoute route = new LogicalRouterStaticRoute(
            NamedUuid.generate())
            .setRouteTable(routeTable)
            .setPolicy(policy)
            .setIpPrefix(ipPrefix)
            .setNexthop(nexthop)
            .setExternalIds(externalIds);
        return withBfd(route, bfdId);
    }

    private static LogicalRouterStaticRoute withBfd(
            LogicalRouterStaticRoute route, String bfdId) {
        if (bfdId != null) {
            route.setBfd(bfdId);
            route.setOption(OPT_ECMP_SYMMETRIC_REPLY, "true");
        }
        return route;
    }

    private static Predicate<LogicalRouterStaticRoute> routeFilter(
            String routeTable, RoutePolicy policy, String ipPrefix,
            Map<String, String> externalIds) {
        List<Predicate<LogicalRouterStaticRoute>> filters = new ArrayList<>();
        if (externalIds != null && !externalIds.isEmpty()) {
            filters.add(externalIds(externalIds));
        }
        if (routeTable != null) {
            filters.add(routeTable(routeTable));
        }
        if (policy != null) {
            filters.add(policy(policy));
        }
        if (ipPrefix != null && !ipPrefix.isEmpty()) {
            filters.add(ipPrefix(ipPrefix));
        }
        return Predicates.and(filters);
    }

    private List<LogicalRouterStaticRoute> listStaticRoutes(
            LogicalRouter router,
            Predicate<? super LogicalRouterStaticRoute> filter)
            throws StateAccessException {
        List<LogicalRouterStaticRoute> routes =
            new ArrayList<>(router.getStaticRoutes().size());
        for (String uuid : router.getStaticRoutes()) {
            LogicalRouterStaticRoute route;
            try {
                route = transactor.get(LogicalRouterStaticRoute.class, uuid);
            } catch (NotFoundException e) {
                // Removed since the router was read.
                log.debug("Skipping static route {} of logical router {}: {}",
                          uuid, router.getName(), e.getMessage());
                continue;
            }
            if (filter.apply(route)) {
                routes.add(route);
            }
        }
        return routes;
    }

    private void create(LogicalRouter router,
                        List<LogicalRouterStaticRoute> routes)
            throws StateAccessException {
        List<Operation> ops = opBuilder.prepareCreate(router, routes);
        if (ops.isEmpty()) {
            return;
        }
        transactor.commit(TX_ROUTES_ADD, ops,
                          "add static routes " + describe(routes) +
                          " to logical router " + router.getName());
    }

    private void detach(LogicalRouter router, List<String> uuids)
            throws StateAccessException {
        if (uuids.isEmpty()) {
            return;
        }
        transactor.commit(TX_ROUTE_DEL,
                          opBuilder.prepareRoutesMutation(router, uuids,
                                                          Mutator.DELETE),
                          "delete static routes " + uuids +
                          " from logical router " + router.getName());
    }

    private static String describe(List<LogicalRouterStaticRoute> routes) {
        List<String> keys = new ArrayList<>(routes.size());
        for (LogicalRouterStaticRoute route : routes) {
            if (route != null) {
                keys.add(route.getRouteTable() + " " +
                         route.getEffectivePolicy() + " " +
                         route.getIpPrefix() + " via " + route.getNexthop());
            }
        }
        return keys.toString();
    }
}
