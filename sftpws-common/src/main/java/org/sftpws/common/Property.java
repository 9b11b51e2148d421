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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import org.sftpws.common.util.ValidateUtils;

/**
 * Property definition.
 *
 * @param <T> The generic property type
 */
public interface Property<T> extends NamedResource {

    static Property<String> string(String name) {
        return new StringProperty(name);
    }

    static Property<Integer> integer(String name, int def) {
        return new IntegerProperty(name, def);
    }

    static Property<Duration> duration(String name, Duration def) {
        return new DurationProperty(name, def);
    }

    static <T> Property<T> validating(Property<T> prop, Consumer<? super T> validator) {
        return new Validating<>(prop, validator);
    }

    abstract class BaseProperty<T> implements Property<T> {
        private final String name;
        private final Class<T> type;
        private final Optional<T> defaultValue;

        protected BaseProperty(String name, Class<T> type, T defaultValue) {
            this.name = ValidateUtils.checkNotNullAndNotEmpty(name, "No name provided");
            this.type = Objects.requireNonNull(type, "Type must be provided");
            this.defaultValue = Optional.ofNullable(defaultValue);
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Class<T> getType() {
            return type;
        }

        @Override
        public Optional<T> getDefault() {
            return defaultValue;
        }

        @Override
        public Optional<T> get(PropertyResolver resolver) {
            Object propValue = PropertyResolverUtils.resolvePropertyValue(resolver, getName());
            return (propValue != null) ? Optional.of(fromStorage(propValue)) : getDefault();
        }

        @Override
        public T getOrCustomDefault(PropertyResolver resolver, T defaultValue) {
            Object propValue = PropertyResolverUtils.resolvePropertyValue(resolver, getName());
            return (propValue != null) ? fromStorage(propValue) : defaultValue;
        }

        @Override
        public void set(PropertyResolver resolver, T value) {
            PropertyResolverUtils.updateProperty(resolver, getName(), toStorage(value));
        }

        protected Object toStorage(T value) {
            return value;
        }

        protected abstract T fromStorage(Object value);

        @Override
        public String toString() {
            return "Property[" + getName() + "](" + getType().getSimpleName() + ")";
        }
    }

    /**
     * Stored as milliseconds
     */
    class DurationProperty extends BaseProperty<Duration> {
        public DurationProperty(String name, Duration def) {
            super(name, Duration.class, def);
        }

        @Override
        protected Object toStorage(Duration value) {
            return (value != null) ? value.toMillis() : null;
        }

        @Override
        protected Duration fromStorage(Object value) {
            Long val = PropertyResolverUtils.toLong(value);
            return (val != null) ? Duration.ofMillis(val) : null;
        }
    }

    class StringProperty extends BaseProperty<String> {
        public StringProperty(String name) {
            super(name, String.class, null);
        }

        @Override
        protected String fromStorage(Object value) {
            return (value != null) ? value.toString() : null;
        }
    }

    class IntegerProperty extends BaseProperty<Integer> {
        public IntegerProperty(String name, Integer defaultValue) {
            super(name, Integer.class, defaultValue);
        }

        @Override
        protected Integer fromStorage(Object value) {
            return PropertyResolverUtils.toInteger(value);
        }
    }

    class Validating<T> implements Property<T> {
        protected final Property<T> delegate;
        protected final Consumer<? super T> validator;

        public Validating(Property<T> delegate, Consumer<? super T> validator) {
            this.delegate = delegate;
            this.validator = validator;
        }

        @Override
        public String getName() {
            return delegate.getName();
        }

        @Override
        public Class<T> getType() {
            return delegate.getType();
        }

        @Override
        public Optional<T> getDefault() {
            return delegate.getDefault();
        }

        @Override
        public Optional<T> get(PropertyResolver resolver) {
            Optional<T> t = delegate.get(resolver);
            t.ifPresent(validator);
            return t;
        }

        @Override
        public T getOrCustomDefault(PropertyResolver resolver, T defaultValue) {
            T value = delegate.getOrCustomDefault(resolver, defaultValue);
            validator.accept(value);
            return value;
        }

        @Override
        public void set(PropertyResolver resolver, T value) {
            validator.accept(value);
            delegate.set(resolver, value);
        }
    }

    /**
     * @return The property type
     */
    Class<T> getType();

    /**
     * @return The default value - if any
     */
    Optional<T> getDefault();

    /**
     * @param  resolver The {@link PropertyResolver} to query for the property value.
     * @return          The {@link Optional} result - if resolver does not contain a value then the default (if any)
     */
    Optional<T> get(PropertyResolver resolver);

    default T getRequired(PropertyResolver resolver) {
        return get(resolver).get();
    }

    T getOrCustomDefault(PropertyResolver resolver, T defaultValue);

    void set(PropertyResolver resolver, T value);
}
