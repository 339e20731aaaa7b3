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

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A row of the Logical_Router table. Only the columns the route
 * synchronization needs are modelled.
 */
@NbTable(name = "Logical_Router")
public class LogicalRouter extends NbRow {

    public static final String COL_NAME = "name";
    public static final String COL_STATIC_ROUTES = "static_routes";
    public static final String COL_OPTIONS = "options";
    public static final String COL_EXTERNAL_IDS = "external_ids";

    private static final List<String> COLUMNS = Arrays.asList(
        COL_NAME, COL_STATIC_ROUTES, COL_OPTIONS, COL_EXTERNAL_IDS);

    private String name = "";
    private Set<String> staticRoutes = new LinkedHashSet<>();
    private Map<String, String> options = new HashMap<>();
    private Map<String, String> externalIds = new HashMap<>();

    public LogicalRouter() {
    }

    public LogicalRouter(String uuid, String name) {
        this.uuid = uuid;
        setName(name);
    }

    public String getName() {
        return name;
    }

    public LogicalRouter setName(String name) {
        this.name = name == null ? "" : name;
        return this;
    }

    public Set<String> getStaticRoutes() {
        return staticRoutes;
    }

    public LogicalRouter setStaticRoutes(Collection<String> staticRoutes) {
        this.staticRoutes = staticRoutes == null
                            ? new LinkedHashSet<String>()
                            : new LinkedHashSet<>(staticRoutes);
        return this;
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public LogicalRouter setOptions(Map<String, String> options) {
        this.options = options == null ? new HashMap<String, String>()
                                       : new HashMap<>(options);
        return this;
    }

    public Map<String, String> getExternalIds() {
        return externalIds;
    }

    public LogicalRouter setExternalIds(Map<String, String> externalIds) {
        this.externalIds = externalIds == null ? new HashMap<String, String>()
                                               : new HashMap<>(externalIds);
        return this;
    }

    @Override
    public Collection<String> references() {
        return staticRoutes;
    }

    @Override
    public List<String> columns() {
        return COLUMNS;
    }

    @Override
    public Object getColumn(String column) {
        switch (column) {
            case COL_NAME: return name;
            case COL_STATIC_ROUTES: return staticRoutes;
            case COL_OPTIONS: return options;
            case COL_EXTERNAL_IDS: return externalIds;
            default: throw unknownColumn(LogicalRouter.class, column);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void setColumn(String column, Object value) {
        switch (column) {
            case COL_NAME: setName((String) value); break;
            case COL_STATIC_ROUTES:
                setStaticRoutes((Collection<String>) value);
                break;
            case COL_OPTIONS: setOptions((Map<String, String>) value); break;
            case COL_EXTERNAL_IDS:
                setExternalIds((Map<String, String>) value);
                break;
            default: throw unknownColumn(LogicalRouter.class, column);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof LogicalRouter)) return false;

        final LogicalRouter other = (LogicalRouter) obj;

        return Objects.equal(uuid, other.uuid)
               && Objects.equal(name, other.name)
               && Objects.equal(staticRoutes, other.staticRoutes)
               && Objects.equal(options, other.options)
               && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, staticRoutes, options,
                                externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("uuid", uuid)
            .add("name", name)
            .add("staticRoutes", staticRoutes)
            .add("options", options)
            .add("externalIds", externalIds).toString();
    }
}
