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
package org.sftpws.sftp.client.channel;

import java.io.IOException;

/**
 * A transport failure: the connection could not be established or was closed abnormally.
 */
public class SftpChannelException extends IOException {
    private static final long serialVersionUID = -1957434315937316427L;

    private final String code;
    private final int nativeCode;

    public SftpChannelException(String message, String code, int nativeCode) {
        this(message, code, nativeCode, null);
    }

    public SftpChannelException(String message, String code, int nativeCode, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.nativeCode = nativeCode;
    }

    /**
     * @return Symbolic error code, e.g. {@code ECONNREFUSED}
     */
    public String getCode() {
        return code;
    }

    /**
     * @return The WebSocket close code - negative if not closed by a close frame
     */
    public int getNativeCode() {
        return nativeCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getCode() + "/" + getNativeCode() + "]: " + getMessage();
    }
}
