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
import java.util.Collection;
import java.util.List;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ovnsync.nsdb.backend.Insert;
import org.ovnsync.nsdb.backend.Mutate;
import org.ovnsync.nsdb.backend.Mutator;
import org.ovnsync.nsdb.backend.NamedUuid;
import org.ovnsync.nsdb.backend.Operation;
import org.ovnsync.nsdb.backend.Update;
import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.model.LogicalRouterStaticRoute;

/**
 * Builds the operations that change static routes. Creating or removing a
 * route always goes along with the matching change of the static_routes
 * column of its router, in the same list of operations.
 */
public class StaticRouteOpBuilder {

    private static final Logger log =
        LoggerFactory.getLogger(StaticRouteOpBuilder.class);

    /**
     * Constructs a list of operations to create routes and attach them to a
     * router. Routes without a named uuid are given one, and routes without
     * policy are given the default one.
     *
     * @param router the owner of the routes
     * @param routes routes to create, null entries are ignored
     * @return the operations, empty if there is no route to create
     */
    public List<Operation> prepareCreate(LogicalRouter router,
                                         Collection<LogicalRouterStaticRoute>
                                             routes) {
        Preconditions.checkNotNull(router.getUuid());
        List<Operation> ops = new ArrayList<>();
        List<String> uuids = new ArrayList<>();
        for (LogicalRouterStaticRoute route : routes) {
            if (route == null) {
                continue;
            }
            if (!NamedUuid.isNamed(route.getUuid())) {
                route.setUuid(NamedUuid.generate());
            }
            route.setPolicy(route.getEffectivePolicy());
            ops.add(new Insert(route));
            uuids.add(route.getUuid());
        }
        ops.addAll(prepareRoutesMutation(router, uuids, Mutator.INSERT));
        log.debug("Prepared {} operations to create {} routes on router {}",
                  ops.size(), uuids.size(), router.getName());
        return ops;
    }

    /**
     * Constructs the operation to add or remove route references to or from
     * a router. Removed routes are reclaimed by the database once no router
     * references them.
     *
     * @return the operations, empty if there is no uuid
     */
    public List<Operation> prepareRoutesMutation(LogicalRouter router,
                                                 Collection<String> uuids,
                                                 Mutator mutator) {
        List<Operation> ops = new ArrayList<>();
        if (!uuids.isEmpty()) {
            ops.add(new Mutate(LogicalRouter.class, router.getUuid(),
                               LogicalRouter.COL_STATIC_ROUTES, mutator,
                               uuids));
        }
        return ops;
    }

    /**
     * Constructs the operation to overwrite columns of a stored route with
     * the values in the given one. No column means every column.
     */
    public List<Operation> prepareUpdate(LogicalRouterStaticRoute route,
                                         String... columns) {
        List<Operation> ops = new ArrayList<>();
        ops.add(new Update(route, columns));
        return ops;
    }

    /**
     * Constructs the operation that detaches every route of a router. The
     * route rows are not read.
     */
    public List<Operation> prepareClear(LogicalRouter router) {
        LogicalRouter cleared = new LogicalRouter(router.getUuid(),
                                                  router.getName());
        List<Operation> ops = new ArrayList<>();
        ops.add(new Update(cleared, LogicalRouter.COL_STATIC_ROUTES));
        return ops;
    }
}
