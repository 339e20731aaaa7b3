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

/**
 * A row could not be converted to or from its stored representation.
 */
public class SerializationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Class<?> clazz;

    public SerializationException(String msg, Throwable e, Class<?> clazz) {
        super(msg, e);
        this.clazz = clazz;
    }

    @Override
    public String getMessage() {
        return clazz + " could not be (de)serialized. " + super.getMessage();
    }
}
