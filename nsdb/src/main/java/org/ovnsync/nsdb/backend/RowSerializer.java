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
package org.ovnsync.nsdb.backend;

import java.io.IOException;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.ovnsync.nsdb.model.NbRow;

/**
 * JSON representation of rows, based on their fields only.
 */
public class RowSerializer {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public RowSerializer() {
        objectMapper.setVisibility(PropertyAccessor.ALL, Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.FIELD, Visibility.ANY);
        objectMapper.configure(
            DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public <T extends NbRow> byte[] serialize(T row)
            throws SerializationException {
        try {
            return objectMapper.writeValueAsBytes(row);
        } catch (IOException e) {
            throw new SerializationException(
                "Could not serialize row " + row.getUuid(), e, row.getClass());
        }
    }

    public <T extends NbRow> T deserialize(byte[] data, Class<T> clazz)
            throws SerializationException {
        try {
            return objectMapper.readValue(data, clazz);
        } catch (IOException e) {
            throw new SerializationException("Could not deserialize row", e,
                                             clazz);
        }
    }

    /**
     * An independent copy of the row.
     */
    @SuppressWarnings("unchecked")
    public <T extends NbRow> T copy(T row) throws SerializationException {
        return deserialize(serialize(row), (Class<T>) row.getClass());
    }
}
