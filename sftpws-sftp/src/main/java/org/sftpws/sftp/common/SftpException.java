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

import java.io.IOException;

import org.sftpws.sftp.client.SftpClient.Handle;

/**
 * Reports a failed request: either an error status returned by the server or a local condition (not connected,
 * unsupported operation, connection closed) that prevented the request from completing.
 */
public class SftpException extends IOException {
    private static final long serialVersionUID = 8096963562429466995L;
    private final int status;
    private final SftpErrorCode errorCode;
    private final String description;
    private final transient SftpCommandInfo commandInfo;

    public SftpException(int status, String msg) {
        this(msg, SftpErrorCode.fromStatus(status), status, msg, null);
    }

    public SftpException(String msg, SftpErrorCode errorCode, int status, String description,
                         SftpCommandInfo commandInfo) {
        super(msg);
        this.status = status;
        this.errorCode = errorCode;
        this.description = description;
        this.commandInfo = commandInfo;
    }

    /**
     * @return The raw {@code SSH_FX_XXX} status value
     */
    public int getStatus() {
        return status;
    }

    public SftpErrorCode getErrorCode() {
        return errorCode;
    }

    public int getErrno() {
        return errorCode.getErrno();
    }

    /**
     * @return The message sent by the server (or the local reason) - may be empty
     */
    public String getDescription() {
        return description;
    }

    /**
     * @return The context of the failed command - may be {@code null}
     */
    public SftpCommandInfo getCommandInfo() {
        return commandInfo;
    }

    public String getPath() {
        return (commandInfo == null) ? null : commandInfo.getPath();
    }

    public Handle getHandle() {
        return (commandInfo == null) ? null : commandInfo.getHandle();
    }

    @Override
    public String toString() {
        return "SFTP error (" + SftpConstants.getStatusName(getStatus()) + "): " + getMessage();
    }
}
