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

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.sftpws.common.PropertyResolver;
import org.sftpws.common.util.GenericUtils;
import org.sftpws.common.util.logging.AbstractLoggingBean;
import org.sftpws.sftp.SftpModuleProperties;

/**
 * Opens {@link WebSocketChannel}s using the JDK HTTP client.
 */
public class WebSocketChannelFactory extends AbstractLoggingBean {
    private final HttpClient httpClient;

    public WebSocketChannelFactory() {
        this(null);
    }

    /**
     * @param httpClient The client used to open connections - if {@code null} one is created per connection with the
     *                   configured connect timeout
     */
    public WebSocketChannelFactory(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * @param  address  The endpoint address ({@code ws://} or {@code wss://})
     * @param  resolver The configuration
     * @param  username User name for HTTP basic authentication - {@code null} for none
     * @param  password The password - {@code null} is sent as empty
     * @return          Completes with the open channel, or exceptionally with an {@link SftpChannelException}
     */
    public CompletableFuture<WebSocketChannel> connect(
            URI address, PropertyResolver resolver, String username, String password) {
        Duration timeout = SftpModuleProperties.WEBSOCKET_CONNECT_TIMEOUT.getRequired(resolver);
        HttpClient client = (httpClient != null)
                ? httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();

        WebSocket.Builder builder = client.newWebSocketBuilder().connectTimeout(timeout);
        String protocol = SftpModuleProperties.WEBSOCKET_SUBPROTOCOL.getOrCustomDefault(resolver, null);
        if (GenericUtils.isNotEmpty(protocol)) {
            builder.subprotocols(protocol);
        }
        if (username != null) {
            builder.header("Authorization", toBasicAuthorization(username, password));
        }

        if (log.isDebugEnabled()) {
            log.debug("connect({}) protocol={}, user={}, timeout={}", address, protocol, username, timeout);
        }

        WebSocketChannel channel = new WebSocketChannel(address.toString());
        return builder.buildAsync(address, channel).handle((ws, t) -> {
            if (t != null) {
                Throwable cause = (t instanceof CompletionException) && (t.getCause() != null) ? t.getCause() : t;
                log.warn("connect({}) failed: {}", address, cause.toString());
                throw new CompletionException(
                        new SftpChannelException("Connection refused", "ECONNREFUSED", CloseReason.ABNORMAL, cause));
            }

            channel.markEstablished();
            return channel;
        });
    }

    public static String toBasicAuthorization(String username, String password) {
        String credentials = username + ":" + ((password == null) ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
