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
package org.sftpws.sftp.client.impl;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.sftpws.common.NamedResource;
import org.sftpws.sftp.common.SftpConstants;

/**
 * Optional operations that are only available if the server announced the matching extension with version "1".
 */
public enum SftpFeature implements NamedResource {
    HARDLINK(SftpConstants.EXT_HARDLINK),
    POSIX_RENAME(SftpConstants.EXT_POSIX_RENAME);

    public static final Set<SftpFeature> VALUES = Collections.unmodifiableSet(EnumSet.allOf(SftpFeature.class));

    private final String extensionName;

    SftpFeature(String extensionName) {
        this.extensionName = extensionName;
    }

    /**
     * @return The name of the extension that enables this feature
     */
    @Override
    public String getName() {
        return extensionName;
    }
}
