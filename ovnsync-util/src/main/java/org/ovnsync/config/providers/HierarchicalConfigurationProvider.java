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
package org.ovnsync.config.providers;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.SubnodeConfiguration;

import org.ovnsync.config.ConfigProvider;

/**
 * Provider backed by a commons-configuration tree, where each config group
 * is a first level node (an INI section).
 */
public class HierarchicalConfigurationProvider extends ConfigProvider {

    private final HierarchicalConfiguration config;

    public HierarchicalConfigurationProvider(HierarchicalConfiguration config) {
        this.config = config;
    }

    /**
     * Sub-configuration for the group, or null if the backend does not
     * define it.
     */
    private SubnodeConfiguration group(String group) {
        if (config.configurationsAt(group).isEmpty()) {
            return null;
        }
        return config.configurationAt(group);
    }

    @Override
    public String getValue(String group, String key, String defaultValue) {
        SubnodeConfiguration subConfig = group(group);
        return subConfig == null ? defaultValue
                                 : subConfig.getString(key, defaultValue);
    }

    @Override
    public int getValue(String group, String key, int defaultValue) {
        SubnodeConfiguration subConfig = group(group);
        return subConfig == null ? defaultValue
                                 : subConfig.getInt(key, defaultValue);
    }

    @Override
    public long getValue(String group, String key, long defaultValue) {
        SubnodeConfiguration subConfig = group(group);
        return subConfig == null ? defaultValue
                                 : subConfig.getLong(key, defaultValue);
    }

    @Override
    public boolean getValue(String group, String key, boolean defaultValue) {
        SubnodeConfiguration subConfig = group(group);
        return subConfig == null ? defaultValue
                                 : subConfig.getBoolean(key, defaultValue);
    }

    @Override
    public Map<String, Object> getAll() {
        Map<String, Object> values = new TreeMap<>();
        Iterator<String> keys = config.getKeys();
        while (keys.hasNext()) {
            String key = keys.next();
            values.put(key, config.getProperty(key));
        }
        return values;
    }
}
