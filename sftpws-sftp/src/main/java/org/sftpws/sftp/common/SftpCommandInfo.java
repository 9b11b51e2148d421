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

import java.util.Objects;

import org.sftpws.sftp.client.SftpClient.Handle;

/**
 * Describes the command a request was issued for. Error messages and {@link SftpException}s are built from it.
 */
public class SftpCommandInfo {
    private final String command;

    public SftpCommandInfo(String command) {
        this.command = Objects.requireNonNull(command, "No command");
    }

    public String getCommand() {
        return command;
    }

    public String getPath() {
        return null;
    }

    public Handle getHandle() {
        return null;
    }

    /**
     * @return The argument shown in error messages - the quoted path, the handle or empty
     */
    public String getArgument() {
        String path = getPath();
        if (path != null) {
            return "'" + path + "'";
        }

        Handle handle = getHandle();
        return (handle == null) ? "" : handle.toString();
    }

    @Override
    public String toString() {
        return getCommand() + " " + getArgument();
    }

    public static SftpCommandInfo forPath(String command, String path) {
        return new PathCommandInfo(command, path);
    }

    public static SftpCommandInfo forHandle(String command, Handle handle) {
        return new HandleCommandInfo(command, handle);
    }

    public static class PathCommandInfo extends SftpCommandInfo {
        private final String path;

        public PathCommandInfo(String command, String path) {
            super(command);
            this.path = path;
        }

        @Override
        public String getPath() {
            return path;
        }
    }

    public static class HandleCommandInfo extends SftpCommandInfo {
        private final Handle handle;

        public HandleCommandInfo(String command, Handle handle) {
            super(command);
            this.handle = handle;
        }

        @Override
        public Handle getHandle() {
            return handle;
        }
    }

    /**
     * Context of a two-path command such as {@code link}
     */
    public static class LinkCommandInfo extends SftpCommandInfo {
        private final String oldPath;
        private final String newPath;

        public LinkCommandInfo(String command, String oldPath, String newPath) {
            super(command);
            this.oldPath = oldPath;
            this.newPath = newPath;
        }

        public String getOldPath() {
            return oldPath;
        }

        public String getNewPath() {
            return newPath;
        }
    }

    public static class RenameCommandInfo extends LinkCommandInfo {
        private final int flags;

        public RenameCommandInfo(String oldPath, String newPath, int flags) {
            super("rename", oldPath, newPath);
            this.flags = flags;
        }

        /**
         * @return The {@code SSH_FXP_RENAME_XXX} flags
         */
        public int getFlags() {
            return flags;
        }
    }

    public static class SymlinkCommandInfo extends SftpCommandInfo {
        private final String targetPath;
        private final String linkPath;

        public SymlinkCommandInfo(String targetPath, String linkPath) {
            super("symlink");
            this.targetPath = targetPath;
            this.linkPath = linkPath;
        }

        public String getTargetPath() {
            return targetPath;
        }

        public String getLinkPath() {
            return linkPath;
        }
    }
}
