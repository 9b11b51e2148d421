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
package org.sftpws.common.util.logging;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Predicate;

import org.sftpws.common.util.GenericUtils;
import org.slf4j.Logger;

public final class LoggingUtils {
    private LoggingUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * Scans using reflection API for all fields that are {@code public static final} that start with the given common
     * prefix (case <U>sensitive</U>) - e.g., {@code SSH_FXP_}.
     *
     * @param  clazz        The {@link Class} to query
     * @param  commonPrefix The expected common prefix
     * @return              A {@link NavigableMap} of all the matching fields, where key=the field's {@link Integer}
     *                      value and mapping=the field's name
     */
    public static NavigableMap<Integer, String> generateMnemonicMap(Class<?> clazz, String commonPrefix) {
        return generateMnemonicMap(clazz, f -> f.getName().startsWith(commonPrefix));
    }

    /**
     * Scans using reflection API for all <U>numeric {@code public static final}</U> fields that are also accepted by
     * the predicate. If several fields share the same value, the first one encountered wins.
     *
     * @param  clazz    The {@link Class} to query
     * @param  acceptor The {@link Predicate} used to decide whether to process the {@link Field}
     * @return          A {@link NavigableMap} of all the matching fields, where key=the field's {@link Integer}
     *                  value and mapping=the field's name
     */
    public static NavigableMap<Integer, String> generateMnemonicMap(Class<?> clazz, Predicate<? super Field> acceptor) {
        Collection<Field> fields = getMnemonicFields(clazz, acceptor);
        if (GenericUtils.isEmpty(fields)) {
            return Collections.emptyNavigableMap();
        }

        NavigableMap<Integer, String> result = new TreeMap<>(Comparator.naturalOrder());
        for (Field f : fields) {
            Number value;
            try {
                value = (Number) f.get(null);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot access " + f.getName(), e);
            }
            result.putIfAbsent(value.intValue(), f.getName());
        }

        return result;
    }

    public static Collection<Field> getMnemonicFields(Class<?> clazz, Predicate<? super Field> acceptor) {
        Field[] fields = clazz.getFields();
        List<Field> result = new ArrayList<>(fields.length);
        for (Field f : fields) {
            int mods = f.getModifiers();
            if ((!Modifier.isPublic(mods)) || (!Modifier.isStatic(mods)) || (!Modifier.isFinal(mods))) {
                continue;
            }

            Class<?> type = f.getType();
            if ((type != Integer.TYPE) && (type != Byte.TYPE) && (type != Short.TYPE)) {
                continue;
            }

            if (acceptor.test(f)) {
                result.add(f);
            }
        }
        return result;
    }

    /**
     * @param  map   A mnemonic map generated by {@link #generateMnemonicMap(Class, String)}
     * @param  value The value to look up
     * @return       The mnemonic name, or the value itself as a string if not found
     */
    public static String getMnemonic(Map<Integer, String> map, int value) {
        String name = map.get(value);
        return (name == null) ? Integer.toString(value) : name;
    }

    public static void debug(Logger log, String message, Object o1, Object o2, Throwable t) {
        if (log.isTraceEnabled() && (t != null)) {
            log.debug(message, o1, o2, t);
        } else if (log.isDebugEnabled()) {
            log.debug(message, o1, o2);
        }
    }

    public static void debug(Logger log, String message, Object o1, Object o2, Object o3, Throwable t) {
        if (log.isTraceEnabled() && (t != null)) {
            log.debug(message, o1, o2, o3, t);
        } else if (log.isDebugEnabled()) {
            log.debug(message, o1, o2, o3);
        }
    }

    public static void warn(Logger log, String message, Object o1, Object o2, Throwable t) {
        if (log.isDebugEnabled() && (t != null)) {
            log.warn(message, o1, o2, t);
        } else if (log.isWarnEnabled()) {
            log.warn(message, o1, o2);
        }
    }

    public static void warn(Logger log, String message, Object o1, Object o2, Object o3, Throwable t) {
        if (log.isDebugEnabled() && (t != null)) {
            log.warn(message, o1, o2, o3, t);
        } else if (log.isWarnEnabled()) {
            log.warn(message, o1, o2, o3);
        }
    }
}
