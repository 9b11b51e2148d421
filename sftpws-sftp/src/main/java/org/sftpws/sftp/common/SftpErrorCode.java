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

/**
 * POSIX-like error codes reported for failed requests, each with its numeric errno.
 */
public enum SftpErrorCode {
    EOF(1),
    ENOENT(34),
    EACCES(3),
    EFAILURE(-2),
    ENOTCONN(31),
    ESHUTDOWN(46),
    ENOSYS(35),
    EIO(55),
    UNKNOWN(-1);

    private final int errno;

    SftpErrorCode(int errno) {
        this.errno = errno;
    }

    public int getErrno() {
        return errno;
    }

    /**
     * @param  status An {@code SSH_FX_XXX} status value
     * @return        The matching error code - {@link #UNKNOWN} for unrecognized values
     */
    public static SftpErrorCode fromStatus(int status) {
        switch (status) {
            case SftpConstants.SSH_FX_EOF:
                return EOF;
            case SftpConstants.SSH_FX_NO_SUCH_FILE:
                return ENOENT;
            case SftpConstants.SSH_FX_PERMISSION_DENIED:
                return EACCES;
            case SftpConstants.SSH_FX_OK:
            case SftpConstants.SSH_FX_FAILURE:
            case SftpConstants.SSH_FX_BAD_MESSAGE:
                return EFAILURE;
            case SftpConstants.SSH_FX_NO_CONNECTION:
                return ENOTCONN;
            case SftpConstants.SSH_FX_CONNECTION_LOST:
                return ESHUTDOWN;
            case SftpConstants.SSH_FX_OP_UNSUPPORTED:
                return ENOSYS;
            default:
                return UNKNOWN;
        }
    }
}
