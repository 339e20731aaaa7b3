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
package org.ovnsync.nsdb.guice;

import com.google.inject.PrivateModule;
import com.google.inject.Singleton;

import org.ovnsync.nsdb.backend.MockNbClient;
import org.ovnsync.nsdb.backend.NbClient;

/**
 * Binds an in-memory {@link MockNbClient} as the {@link NbClient}. Both
 * types are exposed so tests can reach the mock hooks.
 */
public class MockNbClientModule extends PrivateModule {

    @Override
    protected void configure() {
        bind(MockNbClient.class).in(Singleton.class);
        bind(NbClient.class).to(MockNbClient.class);
        expose(NbClient.class);
        expose(MockNbClient.class);
    }
}
