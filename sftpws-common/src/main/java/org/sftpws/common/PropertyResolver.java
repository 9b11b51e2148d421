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

/**
 * Indicates an entity that can be configured using properties. The properties are kept in a {@link Map} and looked up
 * along the parent chain, so a client inherits the configuration of the factory that created it unless it overrides a
 * value.
 */
public interface PropertyResolver {
    /**
     * @return The parent resolver that can be used to query for missing properties - {@code null} if no parent
     */
    PropertyResolver getParentPropertyResolver();

    /**
     * @return A thread-safe {@link Map} of the properties local to this resolver
     */
    Map<String, Object> getProperties();
}
