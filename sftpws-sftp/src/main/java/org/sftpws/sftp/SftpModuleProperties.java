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
package org.sftpws.sftp;

import java.time.Duration;

import org.sftpws.common.Property;
import org.sftpws.common.util.ValidateUtils;

/**
 * Configurable properties for sftpws-sftp.
 */
public final class SftpModuleProperties {
    /**
     * Maximum number of bytes requested by a single read - longer reads are shortened to this value.
     */
    public static final Property<Integer> MAX_READ_BLOCK_LENGTH
            = Property.validating(Property.integer("sftp-max-read-block-length", 256 * 1024),
                    l -> ValidateUtils.checkTrue(l > 0, "Read block length must be positive: %d", l.longValue()));

    /**
     * Maximum number of bytes sent by a single write - longer writes are rejected.
     */
    public static final Property<Integer> MAX_WRITE_BLOCK_LENGTH
            = Property.validating(Property.integer("sftp-max-write-block-length", 32 * 1024),
                    l -> ValidateUtils.checkTrue(l > 0, "Write block length must be positive: %d", l.longValue()));

    /**
     * WebSocket sub-protocol requested when connecting - none if not set.
     */
    public static final Property<String> WEBSOCKET_SUBPROTOCOL
            = Property.string("sftp-websocket-subprotocol");

    /**
     * Timeout for establishing the WebSocket connection.
     */
    public static final Property<Duration> WEBSOCKET_CONNECT_TIMEOUT
            = Property.duration("sftp-websocket-connect-timeout", Duration.ofSeconds(15L));

    private SftpModuleProperties() {
        throw new UnsupportedOperationException("No instance");
    }
}
