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
package org.sftpws.sftp.client.impl;

import java.io.Closeable;
import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.sftpws.common.PropertyResolver;
import org.sftpws.common.util.ValidateUtils;
import org.sftpws.common.util.logging.AbstractLoggingBean;
import org.sftpws.common.util.threads.ThreadUtils;
import org.sftpws.sftp.client.SftpClient;
import org.sftpws.sftp.client.SftpClientFactory;
import org.sftpws.sftp.client.channel.SftpChannel;
import org.sftpws.sftp.client.channel.WebSocketChannelFactory;

/**
 * Creates {@link DefaultSftpClient}s. The factory is the {@link PropertyResolver} its clients are configured from and
 * assigns each client a session identifier. Closing the factory shuts down the callback executor if the factory
 * created it.
 */
public class DefaultSftpClientFactory
        extends AbstractLoggingBean
        implements SftpClientFactory, PropertyResolver, Closeable {
    public static final String CALLBACKS_POOL_NAME = "callbacks";

    private final AtomicInteger sessionIds = new AtomicInteger(0);
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final Map<String, Object> properties = new ConcurrentHashMap<>();
    private final PropertyResolver parentResolver;
    private final Executor executor;
    private final boolean shutdownExecutor;
    private final WebSocketChannelFactory channelFactory;

    public DefaultSftpClientFactory() {
        this(null, null, null);
    }

    /**
     * @param parentResolver Resolver consulted for properties not set on this factory - may be {@code null}
     * @param executor       Runs the callbacks of requests that fail before being sent - if {@code null} a single
     *                       daemon thread is used and shut down by {@link #close()}. An executor given here is never
     *                       shut down by the factory.
     * @param channelFactory Opens the WebSocket connections - if {@code null} a default one is used
     */
    public DefaultSftpClientFactory(
            PropertyResolver parentResolver, Executor executor, WebSocketChannelFactory channelFactory) {
        this.parentResolver = parentResolver;
        if (executor == null) {
            this.executor = ThreadUtils.newSingleThreadExecutor(CALLBACKS_POOL_NAME);
            this.shutdownExecutor = true;
        } else {
            this.executor = executor;
            this.shutdownExecutor = false;
        }
        this.channelFactory = (channelFactory == null) ? new WebSocketChannelFactory() : channelFactory;
    }

    @Override
    public PropertyResolver getParentPropertyResolver() {
        return parentResolver;
    }

    @Override
    public Map<String, Object> getProperties() {
        return properties;
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * @return {@code true} if the executor was created by the factory and is shut down when it is closed
     */
    public boolean isShutdownExecutor() {
        return shutdownExecutor;
    }

    public boolean isOpen() {
        return open.get();
    }

    @Override
    public CompletableFuture<SftpClient> createSftpClient(SftpChannel channel) {
        Objects.requireNonNull(channel, "No channel");
        ValidateUtils.checkState(isOpen(), "Factory is closed");
        DefaultSftpClient client = createDefaultSftpClient(sessionIds.incrementAndGet());
        CompletableFuture<SftpClient> result = new CompletableFuture<>();
        try {
            client.bind(channel, (err, v) -> {
                if (err != null) {
                    debug("createSftpClient({}) handshake failed: {}", client.getSessionId(), err.getMessage(), err);
                    result.completeExceptionally(err);
                } else {
                    if (log.isDebugEnabled()) {
                        log.debug("createSftpClient({}) ready - extensions={}",
                                client.getSessionId(), client.getServerExtensions().keySet());
                    }
                    result.complete(client);
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }

        return result;
    }

    protected DefaultSftpClient createDefaultSftpClient(int sessionId) {
        return new DefaultSftpClient(sessionId, this, executor);
    }

    @Override
    public CompletableFuture<SftpClient> connect(URI address, String username, String password) {
        Objects.requireNonNull(address, "No address");
        ValidateUtils.checkState(isOpen(), "Factory is closed");
        return channelFactory.connect(address, this, username, password)
                .thenCompose(this::createSftpClient);
    }

    /**
     * Shuts down the executor if the factory created it. Clients already created keep working but their locally
     * detected failures are no longer reported once the executor is shut down.
     */
    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }

        if (shutdownExecutor) {
            ExecutorService service = (ExecutorService) executor;
            if (log.isDebugEnabled()) {
                log.debug("close() shutting down executor");
            }
            service.shutdownNow();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[sessions=" + sessionIds.get() + "]";
    }
}
