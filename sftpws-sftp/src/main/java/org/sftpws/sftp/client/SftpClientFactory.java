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
package org.sftpws.sftp.client;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import org.sftpws.sftp.client.channel.SftpChannel;

public interface SftpClientFactory {
    /**
     * Binds a new client to an open channel and performs the version handshake.
     *
     * @param  channel The channel
     * @return         Completes with the ready client, or exceptionally with the handshake failure
     */
    CompletableFuture<SftpClient> createSftpClient(SftpChannel channel);

    /**
     * Connects to a WebSocket endpoint and performs the version handshake.
     *
     * @param  address  The endpoint address
     * @param  username User name for HTTP basic authentication - {@code null} for none
     * @param  password Password for HTTP basic authentication
     * @return          Completes with the ready client, or exceptionally with the connection or handshake failure
     */
    CompletableFuture<SftpClient> connect(URI address, String username, String password);

    default CompletableFuture<SftpClient> connect(URI address) {
        return connect(address, null, null);
    }
}
