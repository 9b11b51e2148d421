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

/**
 * WebSocket close codes.
 *
 * @see <A HREF="https://tools.ietf.org/html/rfc6455#section-7.4.1">RFC 6455 section 7.4.1</A>
 */
public final class CloseReason {
    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int PROTOCOL_ERROR = 1002;
    public static final int UNSUPPORTED = 1003;
    public static final int NO_STATUS = 1005;
    public static final int ABNORMAL = 1006;
    public static final int BAD_DATA = 1007;
    public static final int POLICY_VIOLATION = 1008;
    public static final int TOO_LARGE = 1009;
    public static final int NO_EXTENSIONS_NEGOTIATED = 1010;
    public static final int UNEXPECTED_CONDITION = 1011;
    public static final int FAILED_TLS_HANDSHAKE = 1015;

    private CloseReason() {
        throw new UnsupportedOperationException("No instance");
    }
}
