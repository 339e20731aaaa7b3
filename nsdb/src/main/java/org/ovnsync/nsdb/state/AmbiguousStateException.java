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
package org.ovnsync.nsdb.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A lookup expected to identify a single row matched several of them.
 */
public class AmbiguousStateException extends StateAccessException {

    private static final long serialVersionUID = 1L;

    private final Class<?> clazz;
    private final Object key;
    private final List<String> matches;

    public AmbiguousStateException(Class<?> clazz, Object key,
                                   List<String> matches) {
        super("More than one " + clazz.getSimpleName() + " matches " + key +
              ": " + matches);
        this.clazz = clazz;
        this.key = key;
        this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    }

    public Class<?> getClazz() {
        return clazz;
    }

    public Object getKey() {
        return key;
    }

    /** UUIDs of the matching rows. */
    public List<String> getMatches() {
        return matches;
    }
}
