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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which address of a packet a static route prefix is matched against.
 */
public enum RoutePolicy {

    DST_IP("dst-ip"),
    SRC_IP("src-ip");

    public static final RoutePolicy DEFAULT = DST_IP;

    private final String value;

    private RoutePolicy(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RoutePolicy forValue(String v) {
        if (v == null || v.isEmpty()) return null;
        for (RoutePolicy policy : RoutePolicy.values()) {
            if (v.equalsIgnoreCase(policy.value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown route policy: " + v);
    }

    /**
     * The policy a route is evaluated with: unset means {@link #DEFAULT}.
     */
    public static RoutePolicy orDefault(RoutePolicy policy) {
        return policy == null ? DEFAULT : policy;
    }

    @Override
    public String toString() {
        return value;
    }
}
