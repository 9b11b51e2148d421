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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.sftpws.sftp.client.SftpClient.DirEntry;
import org.sftpws.sftp.client.channel.CloseReason;
import org.sftpws.sftp.common.SftpConstants;
import org.sftpws.sftp.common.SftpErrorCode;
import org.sftpws.sftp.common.SftpException;
import org.sftpws.sftp.common.SftpPacketReader;
import org.sftpws.util.test.JUnitTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Covers the directory listing and upload loops and session teardown.
 *
 * @author <a href="mailto:dev@sftpws.org">SFTP-WS Project</a>
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class DefaultSftpClientTest extends JUnitTestSupport {
    private RecordingChannel channel;
    private DefaultSftpClient client;

    public DefaultSftpClientTest() {
        super();
    }

    @BeforeEach
    void setUp() {
        channel = new RecordingChannel();
        client = new DefaultSftpClient(7, null, Runnable::run);
        RecordingCallback<Void> init = new RecordingCallback<>();
        client.bind(channel, init);
        assertSame(client, channel.getListener());
        client.onMessage(SftpResponses.version(SftpConstants.SFTP_V3));
        init.assertSuccess();
    }

    @Test
    void bindTwiceIsRejected() {
        assertTrue(client.isBound());
        assertThrows(IllegalStateException.class, () -> client.bind(new RecordingChannel(), new RecordingCallback<>()));
    }

    @Test
    void failedHandshakeEndsSession() {
        RecordingChannel other = new RecordingChannel();
        DefaultSftpClient fresh = new DefaultSftpClient(8, null, Runnable::run);
        RecordingCallback<Void> init = new RecordingCallback<>();
        fresh.bind(other, init);
        fresh.onMessage(SftpResponses.version(5L));

        assertEquals(SftpConstants.SSH_FX_BAD_MESSAGE, init.assertFailure().getStatus());
        assertFalse(fresh.isBound());
        assertTrue(other.isClosed());
        assertEquals(CloseReason.PROTOCOL_ERROR, other.getCloseCode());
    }

    @Test
    void listReadsUntilEndOfDirectory() {
        RecordingCallback<List<DirEntry>> cb = new RecordingCallback<>();
        client.list("/dir", cb);

        SftpPacketReader opendir = channel.getLastRequest();
        assertEquals(SftpConstants.SSH_FXP_OPENDIR, opendir.getType());
        client.onMessage(SftpResponses.handle(opendir.getId(), new byte[] { 1 }));

        client.onMessage(SftpResponses.names(channel.getLastRequest().getId(),
                new DirEntry("a", "a", null), new DirEntry("b", "b", null)));
        client.onMessage(SftpResponses.names(channel.getLastRequest().getId(), new DirEntry("c", "c", null)));
        assertFalse(cb.isDone());

        SftpPacketReader readdir = channel.getLastRequest();
        assertEquals(SftpConstants.SSH_FXP_READDIR, readdir.getType());
        client.onMessage(SftpResponses.status(readdir.getId(), SftpConstants.SSH_FX_EOF, "EOF"));

        List<DirEntry> entries = cb.assertSuccess();
        assertEquals(3, entries.size());
        assertEquals("c", entries.get(2).getFilename());
        assertEquals(SftpConstants.SSH_FXP_CLOSE, channel.getLastRequest().getType());
    }

    @Test
    void listReturnsPartialEntriesOnError() {
        RecordingCallback<List<DirEntry>> cb = new RecordingCallback<>();
        client.list("/dir", cb);
        client.onMessage(SftpResponses.handle(channel.getLastRequest().getId(), new byte[] { 1 }));
        client.onMessage(SftpResponses.names(channel.getLastRequest().getId(), new DirEntry("a", "a", null)));
        client.onMessage(SftpResponses.status(
                channel.getLastRequest().getId(), SftpConstants.SSH_FX_PERMISSION_DENIED, "Denied"));

        SftpException err = cb.assertFailure();
        assertEquals(SftpErrorCode.EACCES, err.getErrorCode());
        assertEquals(1, cb.getResult().size());

        // close failure is only logged
        client.onMessage(SftpResponses.status(channel.getLastRequest().getId(), SftpConstants.SSH_FX_FAILURE, "Nope"));
        assertEquals(1, cb.getInvocations());
    }

    @Test
    void listOfMissingDirectory() {
        RecordingCallback<List<DirEntry>> cb = new RecordingCallback<>();
        client.list("/missing", cb);
        client.onMessage(SftpResponses.status(
                channel.getLastRequest().getId(), SftpConstants.SSH_FX_NO_SUCH_FILE, "Missing"));

        assertEquals(SftpErrorCode.ENOENT, cb.assertFailure().getErrorCode());
        assertTrue(cb.getResult().isEmpty());
    }

    @Test
    void uploadWritesBlocksThenCloses() {
        int block = client.getMaxWriteBlockLength();
        byte[] data = new byte[2 * block + 100];
        for (int index = 0; index < data.length; index++) {
            data[index] = (byte) index;
        }

        RecordingCallback<Void> cb = new RecordingCallback<>();
        client.upload("/upload.bin", data, cb);

        SftpPacketReader open = channel.getLastRequest();
        assertEquals("/upload.bin", open.getString());
        assertEquals(SftpConstants.SSH_FXF_WRITE | SftpConstants.SSH_FXF_CREAT | SftpConstants.SSH_FXF_TRUNC,
                open.getUInt());
        client.onMessage(SftpResponses.handle(open.getId(), new byte[] { 9 }));

        List<Integer> lengths = new ArrayList<>();
        long expectedPosition = 0L;
        while (channel.getLastRequest().getType() == SftpConstants.SSH_FXP_WRITE) {
            SftpPacketReader write = channel.getLastRequest();
            write.getBytes();
            assertEquals(expectedPosition, write.getLong());
            byte[] chunk = write.getBytes();
            assertEquals(data[(int) expectedPosition], chunk[0]);
            lengths.add(chunk.length);
            expectedPosition += chunk.length;
            client.onMessage(SftpResponses.ok(write.getId()));
        }

        assertEquals(Arrays.asList(block, block, 100), lengths);
        SftpPacketReader close = channel.getLastRequest();
        assertEquals(SftpConstants.SSH_FXP_CLOSE, close.getType());
        assertFalse(cb.isDone());
        client.onMessage(SftpResponses.ok(close.getId()));
        cb.assertSuccess();
    }

    @Test
    void uploadReportsCloseFailure() {
        RecordingCallback<Void> cb = new RecordingCallback<>();
        client.upload("/small.txt", new byte[] { 1, 2 }, cb);
        client.onMessage(SftpResponses.handle(channel.getLastRequest().getId(), new byte[] { 9 }));
        client.onMessage(SftpResponses.ok(channel.getLastRequest().getId()));

        SftpPacketReader close = channel.getLastRequest();
        assertEquals(SftpConstants.SSH_FXP_CLOSE, close.getType());
        client.onMessage(SftpResponses.status(close.getId(), SftpConstants.SSH_FX_FAILURE, "Disk full"));
        assertEquals("Disk full", cb.assertFailure().getDescription());
    }

    @Test
    void uploadReportsWriteFailure() {
        RecordingCallback<Void> cb = new RecordingCallback<>();
        client.upload("/small.txt", new byte[] { 1, 2 }, cb);
        client.onMessage(SftpResponses.handle(channel.getLastRequest().getId(), new byte[] { 9 }));
        client.onMessage(SftpResponses.status(
                channel.getLastRequest().getId(), SftpConstants.SSH_FX_PERMISSION_DENIED, "Read only"));

        client.onMessage(SftpResponses.ok(channel.getLastRequest().getId()));
        assertEquals("Read only", cb.assertFailure().getDescription());
    }

    @Test
    void protocolViolationEndsSession() {
        RecordingCallback<Void> pending = new RecordingCallback<>();
        client.unlink("/x", pending);

        client.onMessage(new byte[] { 0, 0, 0, 9, 101 });

        assertTrue(channel.isClosed());
        assertEquals(CloseReason.PROTOCOL_ERROR, channel.getCloseCode());
        assertEquals(SftpErrorCode.ESHUTDOWN, pending.assertFailure().getErrorCode());
        assertFalse(client.isReady());
    }

    @Test
    void violatingResponseFailsItsRequest() {
        RecordingCallback<String> resolved = new RecordingCallback<>();
        client.realpath("/a/../b", resolved);
        long id = channel.getLastRequest().getId();

        client.onMessage(SftpResponses.names(id, new DirEntry("a", "a", null), new DirEntry("b", "b", null)));

        SftpException err = resolved.assertFailure();
        assertEquals(SftpConstants.SSH_FX_BAD_MESSAGE, err.getStatus());
        assertEquals("/a/../b", err.getPath());
        assertEquals(CloseReason.PROTOCOL_ERROR, channel.getCloseCode());
        assertFalse(client.isReady());
    }

    @Test
    void unknownResponseEndsSession() {
        client.onMessage(SftpResponses.ok(1234L));
        assertEquals(CloseReason.PROTOCOL_ERROR, channel.getCloseCode());
    }

    @Test
    void channelCloseFailsPendingRequests() {
        RecordingCallback<String> pending = new RecordingCallback<>();
        client.realpath(".", pending);

        client.onClose(new IOException("Connection aborted"));

        SftpException err = pending.assertFailure();
        assertEquals(SftpConstants.SSH_FX_CONNECTION_LOST, err.getStatus());
        assertFalse(client.isBound());
    }

    @Test
    void textMessagesAreForwarded() {
        List<String> received = new ArrayList<>();
        client.onTextMessage("ignored");
        client.setTextMessageListener(received::add);
        client.onTextMessage("{\"type\":\"stdout\"}");
        assertEquals(Arrays.asList("{\"type\":\"stdout\"}"), received);
    }
}
