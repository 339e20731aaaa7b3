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

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import org.ovnsync.nsdb.backend.MockNbClient;
import org.ovnsync.nsdb.config.NorthboundConfig;
import org.ovnsync.nsdb.model.LogicalRouter;
import org.ovnsync.nsdb.state.AmbiguousStateException;
import org.ovnsync.nsdb.state.InvalidStateOperationException;
import org.ovnsync.nsdb.state.NbTransactor;
import org.ovnsync.nsdb.state.NotFoundException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.lenient;

@RunWith(MockitoJUnitRunner.class)
public class TestLogicalRouterManager {

    @Mock
    private NorthboundConfig config;

    private MockNbClient client;
    private LogicalRouterManager manager;

    @Before
    public void setUp() {
        lenient().when(config.getRequestTimeout()).thenReturn(1000);
        client = new MockNbClient();
        manager = new LogicalRouterManager(new NbTransactor(client, config));
    }

    @Test
    public void testGetLogicalRouter() throws Exception {
        String uuid = client.seed(new LogicalRouter(null, "lr0"));
        client.seed(new LogicalRouter(null, "lr1"));

        LogicalRouter router = manager.getLogicalRouter("lr0", false);

        assertThat(router.getUuid(), equalTo(uuid));
        assertThat(router.getName(), equalTo("lr0"));
    }

    @Test
    public void testMissingRouter() throws Exception {
        assertThat(manager.getLogicalRouter("lr0", true), nullValue());
        try {
            manager.getLogicalRouter("lr0", false);
            fail("Expected a NotFoundException");
        } catch (NotFoundException e) {
            assertThat(e.getId(), equalTo((Object) "lr0"));
        }
    }

    @Test
    public void testDuplicatedName() throws Exception {
        client.seed(new LogicalRouter(null, "lr0"));
        client.seed(new LogicalRouter(null, "lr0"));

        try {
            manager.getLogicalRouter("lr0", true);
            fail("Expected an AmbiguousStateException");
        } catch (AmbiguousStateException e) {
            assertThat(e.getMatches(), hasSize(2));
        }
    }

    @Test(expected = InvalidStateOperationException.class)
    public void testEmptyName() throws Exception {
        manager.getLogicalRouter("", true);
    }
}
