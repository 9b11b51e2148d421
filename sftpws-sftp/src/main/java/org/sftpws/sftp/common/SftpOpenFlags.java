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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.sftpws.common.util.ValidateUtils;

import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_ALL;
import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_APPEND;
import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_CREAT;
import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_EXCL;
import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_READ;
import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_TRUNC;
import static org.sftpws.sftp.common.SftpConstants.SSH_FXF_WRITE;

/**
 * Translates between fopen-style mode strings ({@code "r"}, {@code "w+"}, {@code "ax"}...) and the
 * {@code SSH_FXF_XXX} open flags.
 */
public final class SftpOpenFlags {
    private SftpOpenFlags() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  mode                     The mode string
     * @return                          The matching open flags
     * @throws IllegalArgumentException If the mode string is not recognized
     */
    public static int toMask(String mode) {
        ValidateUtils.checkNotNull(mode, "No open mode");
        switch (mode) {
            case "r":
                return SSH_FXF_READ;
            case "r+":
                return SSH_FXF_READ | SSH_FXF_WRITE;
            case "w":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_TRUNC;
            case "w+":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_TRUNC | SSH_FXF_READ;
            case "wx":
            case "xw":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_EXCL;
            case "wx+":
            case "xw+":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_EXCL | SSH_FXF_READ;
            case "a":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_APPEND;
            case "a+":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_APPEND | SSH_FXF_READ;
            case "ax":
            case "xa":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_APPEND | SSH_FXF_EXCL;
            case "ax+":
            case "xa+":
                return SSH_FXF_WRITE | SSH_FXF_CREAT | SSH_FXF_APPEND | SSH_FXF_EXCL | SSH_FXF_READ;
            default:
                throw new IllegalArgumentException("Invalid flags '" + mode + "'");
        }
    }

    public static int toMask(int flags) {
        return flags & SSH_FXF_ALL;
    }

    /**
     * Normalizes the flags and returns the mode strings that open a file the same way.
     *
     * @param  flags The open flags
     * @return       One or two equivalent mode strings, most specific first
     */
    public static List<String> fromMask(int flags) {
        int mask = normalize(flags);
        switch (mask) {
            case 1:
                return Collections.singletonList("r");
            case 2:
            case 3:
                return Collections.singletonList("r+");
            case 10:
                return Arrays.asList("wx", "r+");
            case 11:
                return Arrays.asList("wx+", "r+");
            case 14:
                return Collections.singletonList("a");
            case 15:
                return Collections.singletonList("a+");
            case 26:
                return Collections.singletonList("w");
            case 27:
                return Collections.singletonList("w+");
            case 42:
                return Collections.singletonList("wx");
            case 43:
                return Collections.singletonList("wx+");
            case 46:
                return Collections.singletonList("ax");
            case 47:
                return Collections.singletonList("ax+");
            default:
                // normalization leaves only the values above
                throw new IllegalStateException("Unsupported flags: 0x" + Integer.toHexString(flags));
        }
    }

    /**
     * EXCL cancels TRUNC, TRUNC cancels APPEND, one of READ/WRITE is required (READ by default), without CREAT only
     * READ/WRITE remain and CREAT implies WRITE.
     *
     * @param  flags The open flags
     * @return       The normalized flags
     */
    public static int normalize(int flags) {
        int mask = flags & SSH_FXF_ALL;
        if ((mask & SSH_FXF_EXCL) != 0) {
            mask &= ~SSH_FXF_TRUNC;
        }
        if ((mask & SSH_FXF_TRUNC) != 0) {
            mask &= ~SSH_FXF_APPEND;
        }
        if ((mask & (SSH_FXF_READ | SSH_FXF_WRITE)) == 0) {
            mask |= SSH_FXF_READ;
        }
        if ((mask & SSH_FXF_CREAT) == 0) {
            mask &= SSH_FXF_READ | SSH_FXF_WRITE;
        } else {
            mask |= SSH_FXF_WRITE;
        }
        return mask;
    }
}
