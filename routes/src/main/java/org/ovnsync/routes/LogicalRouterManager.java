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
import java.util.List;

import com.google.common.base.Predicate;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.state.AmbiguousStateException;
import org.ovnsync.nsdb.state.InvalidStateOperationException;
import org.ovnsync.nsdb.state.NbTransactor;
import org.ovnsync.nsdb.state.NotFoundException;
import org.ovnsync.nsdb.state.StateAccessException;

/**
 * Resolves logical routers by name.
 */
public class LogicalRouterManager {

    private static final Logger log =
        LoggerFactory.getLogger(LogicalRouterManager.class);

    private final NbTransactor transactor;

    @Inject
    public LogicalRouterManager(NbTransactor transactor) {
        this.transactor = transactor;
    }

    /**
     * Gets the router with the given name.
     *
     * @param name router name, required
     * @param ignoreNotFound return null instead of failing when there is no
     *                       such router
     * @throws InvalidStateOperationException if the name is empty
     * @throws NotFoundException if there is no such router and absence is
     *                           not tolerated
     * @throws AmbiguousStateException if several routers have the name
     */
    public LogicalRouter getLogicalRouter(final String name,
                                          boolean ignoreNotFound)
            throws StateAccessException {
        if (name == null || name.isEmpty()) {
            throw new InvalidStateOperationException(
                "the logical router name is required");
        }

        List<LogicalRouter> routers = transactor.list(
            LogicalRouter.class, new Predicate<LogicalRouter>() {
                @Override
                public boolean apply(LogicalRouter router) {
                    return name.equals(router.getName());
                }
            });

        if (routers.isEmpty()) {
            if (ignoreNotFound) {
                log.debug("No logical router {}", name);
                return null;
            }
            throw new NotFoundException(LogicalRouter.class, name);
        }
        if (routers.size() > 1) {
            List<String> uuids = new ArrayList<>(routers.size());
            for (LogicalRouter router : routers) {
                uuids.add(router.getUuid());
            }
            AmbiguousStateException ex = new AmbiguousStateException(
                LogicalRouter.class, name, uuids);
            log.error(ex.getMessage());
            throw ex;
        }
        return routers.get(0);
    }
}
