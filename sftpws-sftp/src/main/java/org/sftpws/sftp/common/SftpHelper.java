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

import org.sftpws.common.util.buffer.Buffer;

/**
 * Translates SFTP status replies into {@link SftpException}s.
 */
public final class SftpHelper {
    private SftpHelper() {
        throw new UnsupportedOperationException("No instance allowed");
    }

    /**
     * Reads an {@code SSH_FXP_STATUS} payload. The optional language tag is ignored.
     *
     * @param  buffer The {@link Buffer} positioned at the status code
     * @param  info   The context of the request
     * @return        {@code null} if the status is {@code SSH_FX_OK}, the error otherwise
     */
    public static SftpException readStatus(Buffer buffer, SftpCommandInfo info) {
        int status = buffer.getInt();
        String message = buffer.getString();
        if (status == SftpConstants.SSH_FX_OK) {
            return null;
        }

        return createError(status, message, info);
    }

    public static SftpException createError(int status, String description, SftpCommandInfo info) {
        return createError(SftpErrorCode.fromStatus(status), status, description, info);
    }

    /**
     * @param  code        The reported error code
     * @param  status      The raw {@code SSH_FX_XXX} status
     * @param  description The server message or local reason
     * @param  info        The context of the failed command
     * @return             An exception whose message reads {@code "<code>, <command> <argument>"}
     */
    public static SftpException createError(
            SftpErrorCode code, int status, String description, SftpCommandInfo info) {
        Objects.requireNonNull(info, "No command info");
        String message = code.name() + ", " + info.getCommand() + " " + info.getArgument();
        return new SftpException(message, code, status, description, info);
    }
}
