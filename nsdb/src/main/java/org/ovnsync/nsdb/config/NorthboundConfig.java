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
package org.ovnsync.nsdb.config;

import org.ovnsync.config.ConfigGroup;
import org.ovnsync.config.ConfigInt;

/**
 * Northbound database client configuration.
 */
@ConfigGroup(NorthboundConfig.GROUP_NAME)
public interface NorthboundConfig {

    String GROUP_NAME = "northbound";

    /** Milliseconds to wait for the answer to a request. */
    @ConfigInt(key = "request_timeout", defaultValue = 15000)
    int getRequestTimeout();
}
