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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.sftpws.sftp.SftpModuleProperties;
import org.sftpws.sftp.client.SftpClient;
import org.sftpws.sftp.common.SftpConstants;
import org.sftpws.sftp.common.SftpException;
import org.sftpws.sftp.common.SftpPacketReader;
import org.sftpws.util.test.JUnitTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * @author <a href="mailto:dev@sftpws.org">SFTP-WS Project</a>
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class DefaultSftpClientFactoryTest extends JUnitTestSupport {
    public DefaultSftpClientFactoryTest() {
        super();
    }

    @Test
    void createdClientIsReady() throws Exception {
        DefaultSftpClientFactory factory = new DefaultSftpClientFactory(null, Runnable::run, null);
        SftpClient client = factory.createSftpClient(new RespondingChannel(SftpConstants.SFTP_V3))
                .get(5L, TimeUnit.SECONDS);
        assertTrue(client.isReady());
        assertEquals("1", client.getServerExtensions().get(SftpConstants.EXT_HARDLINK));

        DefaultSftpClient second = (DefaultSftpClient) factory.createSftpClient(
                new RespondingChannel(SftpConstants.SFTP_V3)).get(5L, TimeUnit.SECONDS);
        assertEquals(((DefaultSftpClient) client).getSessionId() + 1, second.getSessionId());
    }

    @Test
    void clientInheritsFactoryProperties() throws Exception {
        DefaultSftpClientFactory factory = new DefaultSftpClientFactory(null, Runnable::run, null);
        SftpModuleProperties.MAX_WRITE_BLOCK_LENGTH.set(factory, 1024);
        DefaultSftpClient client = (DefaultSftpClient) factory.createSftpClient(
                new RespondingChannel(SftpConstants.SFTP_V3)).get(5L, TimeUnit.SECONDS);
        assertEquals(1024, client.getMaxWriteBlockLength());
        assertEquals(SftpModuleProperties.MAX_READ_BLOCK_LENGTH.getDefault().get().intValue(),
                client.getMaxReadBlockLength());
    }

    @Test
    void invalidBlockLengthIsRejected() {
        DefaultSftpClientFactory factory = new DefaultSftpClientFactory(null, Runnable::run, null);
        assertThrows(IllegalArgumentException.class, () -> SftpModuleProperties.MAX_READ_BLOCK_LENGTH.set(factory, 0));
    }

    @Test
    void handshakeFailureCompletesExceptionally() {
        DefaultSftpClientFactory factory = new DefaultSftpClientFactory(null, Runnable::run, null);
        RespondingChannel channel = new RespondingChannel(6L);
        CompletableFuture<SftpClient> future = factory.createSftpClient(channel);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5L, TimeUnit.SECONDS));
        SftpException cause = assertObjectInstanceOf("cause", SftpException.class, e.getCause());
        assertEquals("Unexpected protocol version", cause.getDescription());
        assertTrue(channel.isClosed());
    }

    @Test
    void closeShutsDownOwnedExecutor() {
        DefaultSftpClientFactory factory = new DefaultSftpClientFactory();
        assertTrue(factory.isShutdownExecutor());
        ExecutorService executor = assertObjectInstanceOf("executor", ExecutorService.class, factory.getExecutor());
        assertFalse(executor.isShutdown());

        factory.close();
        assertFalse(factory.isOpen());
        assertTrue(executor.isShutdown());
        // idempotent
        factory.close();
        assertThrows(IllegalStateException.class,
                () -> factory.createSftpClient(new RespondingChannel(SftpConstants.SFTP_V3)));
    }

    @Test
    void closeLeavesSuppliedExecutorAlone() {
        ExecutorService executor = mock(ExecutorService.class);
        DefaultSftpClientFactory factory = new DefaultSftpClientFactory(null, executor, null);
        assertFalse(factory.isShutdownExecutor());

        factory.close();
        assertFalse(factory.isOpen());
        verifyNoInteractions(executor);
    }

    /**
     * Answers the handshake synchronously from within {@code send}
     */
    private static class RespondingChannel extends RecordingChannel {
        private final long version;

        RespondingChannel(long version) {
            this.version = version;
        }

        @Override
        public void send(byte[] packet) {
            super.send(packet);
            SftpPacketReader request = new SftpPacketReader(packet);
            if (request.getType() == SftpConstants.SSH_FXP_INIT) {
                getListener().onMessage(SftpResponses.version(version, SftpConstants.EXT_HARDLINK, "1"));
            }
        }
    }
}
