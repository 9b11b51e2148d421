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
package org.sftpws.sftp.common;

import java.time.Instant;

/**
 * Generic file metadata. Every value is optional and {@code null} when unknown.
 */
public interface FileStats {
    Long getSize();

    Integer getUid();

    Integer getGid();

    /**
     * @return The POSIX permissions including the file type bits
     */
    Integer getPermissions();

    Instant getAccessTime();

    Instant getModifyTime();

    /**
     * @return Number of hard links - never sent on the wire
     */
    Integer getLinkCount();

    default boolean isDirectory() {
        return isFileType(SftpConstants.S_IFDIR);
    }

    default boolean isRegularFile() {
        return isFileType(SftpConstants.S_IFREG);
    }

    default boolean isSymbolicLink() {
        return isFileType(SftpConstants.S_IFLNK);
    }

    default boolean isFileType(int type) {
        Integer perms = getPermissions();
        return (perms != null) && ((perms & SftpConstants.S_IFMT) == type);
    }
}
