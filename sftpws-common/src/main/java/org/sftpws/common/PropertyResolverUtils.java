/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.sftpws.common;

import java.util.Map;

import org.sftpws.common.util.GenericUtils;
import org.sftpws.common.util.ValidateUtils;

public final class PropertyResolverUtils {
    private PropertyResolverUtils() {
        throw new UnsupportedOperationException("No instance allowed");
    }

    public static Long toLong(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Long) {
            return (Long) value;
        } else if (value instanceof Number) {
            return ((Number) value).longValue();
        } else { // we parse the string in case it is not a valid long value
            return Long.valueOf(value.toString());
        }
    }

    public static Integer toInteger(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Integer) {
            return (Integer) value;
        } else if (value instanceof Number) {
            return ((Number) value).intValue();
        } else { // we parse the string in case this is NOT a valid integer string
            return Integer.valueOf(value.toString());
        }
    }

    /**
     * @param  props The {@link Map} of properties to update
     * @param  name  The property name
     * @param  value The new value - if {@code null} or an empty {@link CharSequence} the property is <U>removed</U>
     * @return       The previous value - {@code null} if none
     */
    public static Object updateProperty(Map<String, Object> props, String name, Object value) {
        String key = ValidateUtils.checkNotNullAndNotEmpty(name, "No property name");
        if ((value == null) || ((value instanceof CharSequence) && GenericUtils.isEmpty((CharSequence) value))) {
            return props.remove(key);
        } else {
            return props.put(key, value);
        }
    }

    public static Object updateProperty(PropertyResolver resolver, String name, Object value) {
        return updateProperty(resolver.getProperties(), name, value);
    }

    /**
     * @param  resolver The {@link PropertyResolver} instance - ignored if {@code null}
     * @param  name     The property name
     * @return          The first non-{@code null} value found while walking up the resolvers chain
     */
    public static Object resolvePropertyValue(PropertyResolver resolver, String name) {
        String key = ValidateUtils.checkNotNullAndNotEmpty(name, "No property name");
        for (PropertyResolver r = resolver; r != null; r = r.getParentPropertyResolver()) {
            Map<String, ?> props = r.getProperties();
            Object value = GenericUtils.isEmpty(props) ? null : props.get(key);
            if (value != null) {
                return value;
            }
        }

        return null;
    }
}
