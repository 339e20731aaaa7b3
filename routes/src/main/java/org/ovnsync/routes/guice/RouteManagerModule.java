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
package org.ovnsync.routes.guice;

import com.google.inject.PrivateModule;
import com.google.inject.Singleton;

import org.ovnsync.nsdb.backend.NbClient;
import org.ovnsync.nsdb.config.NorthboundConfig;
import org.ovnsync.nsdb.state.NbTransactor;
import org.ovnsync.routes.LogicalRouterManager;
import org.ovnsync.routes.StaticRouteManager;
import org.ovnsync.routes.StaticRouteOpBuilder;

/**
 * Exposes the static route and logical router managers. Needs an
 * {@link NbClient} and a {@link NorthboundConfig} bound elsewhere.
 */
public class RouteManagerModule extends PrivateModule {

    @Override
    protected void configure() {
        requireBinding(NbClient.class);
        requireBinding(NorthboundConfig.class);

        bind(NbTransactor.class).in(Singleton.class);
        bind(StaticRouteOpBuilder.class).in(Singleton.class);

        bind(LogicalRouterManager.class).in(Singleton.class);
        expose(LogicalRouterManager.class);

        bind(StaticRouteManager.class).in(Singleton.class);
        expose(StaticRouteManager.class);
    }
}
