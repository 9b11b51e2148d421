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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.sftpws.common.PropertyResolver;
import org.sftpws.common.util.ValidateUtils;
import org.sftpws.common.util.buffer.BufferException;
import org.sftpws.sftp.client.SftpCallback;
import org.sftpws.sftp.client.channel.CloseReason;
import org.sftpws.sftp.client.channel.SftpChannel;
import org.sftpws.sftp.client.channel.SftpChannelListener;
import org.sftpws.sftp.common.SftpException;
import org.sftpws.sftp.common.SftpProtocolException;

/**
 * Binds the protocol engine to a channel: binary messages are processed as SFTP responses, text messages are passed
 * to an optional listener and the session ends when the channel closes or the server violates the protocol.
 */
public class DefaultSftpClient extends AbstractSftpClient implements SftpChannelListener {
    private final AtomicBoolean bound = new AtomicBoolean(false);
    private volatile Consumer<String> textMessageListener;

    public DefaultSftpClient(int sessionId, PropertyResolver resolver, Executor executor) {
        super(sessionId, resolver, executor);
    }

    public Consumer<String> getTextMessageListener() {
        return textMessageListener;
    }

    /**
     * @param listener Receives the text messages sent by the peer - {@code null} to ignore them
     */
    public void setTextMessageListener(Consumer<String> listener) {
        this.textMessageListener = listener;
    }

    public boolean isBound() {
        return bound.get();
    }

    /**
     * Attaches to the channel and performs the version handshake. If the handshake fails the session is ended before
     * the callback is invoked.
     *
     * @param  channel               The channel
     * @param  callback              Receives the handshake outcome
     * @throws IllegalStateException If already bound
     */
    public void bind(SftpChannel channel, SftpCallback<Void> callback) {
        ValidateUtils.checkNotNull(channel, "No channel");
        ValidateUtils.checkNotNull(callback, "No callback");
        ValidateUtils.checkState(bound.compareAndSet(false, true), "Already bound");

        channel.setListener(this);
        try {
            init(channel, (err, result) -> {
                if (err != null) {
                    debug("bind({}) handshake failed: {}", sessionId, err.getMessage(), err);
                    end();
                    bound.set(false);
                }
                callback.onComplete(err, result);
            });
        } catch (RuntimeException e) {
            channel.setListener(null);
            bound.set(false);
            throw e;
        }
    }

    @Override
    public void onMessage(byte[] packet) {
        try {
            process(packet);
        } catch (SftpProtocolException | BufferException | ArithmeticException e) {
            log.error("onMessage({}) protocol violation ({}): {}", sessionId, e.getClass().getSimpleName(), e.getMessage());
            debug("onMessage({}) {} details", sessionId, e.getClass().getSimpleName(), e);
            end(CloseReason.PROTOCOL_ERROR, "Protocol violation");
        }
    }

    @Override
    public void onTextMessage(String message) {
        Consumer<String> listener = textMessageListener;
        if (listener == null) {
            if (log.isDebugEnabled()) {
                log.debug("onTextMessage({}) ignored {} chars", sessionId, message.length());
            }
            return;
        }

        listener.accept(message);
    }

    @Override
    public void onClose(IOException reason) {
        if (reason == null) {
            if (log.isDebugEnabled()) {
                log.debug("onClose({}) channel closed", sessionId);
            }
        } else {
            log.warn("onClose({}) channel failed: {}", sessionId, reason.toString());
        }

        end();
        bound.set(false);
    }

    @Override
    public void list(String path, SftpCallback<List<DirEntry>> callback) {
        checkCallback(callback);
        opendir(path, (err, handle) -> {
            if (err != null) {
                callback.onComplete(err, Collections.emptyList());
                return;
            }

            readdir(handle, new DirectoryLister(handle, callback));
        });
    }

    @Override
    public void upload(String path, byte[] data, SftpCallback<Void> callback) {
        checkCallback(callback);
        ValidateUtils.checkNotNull(data, "Missing data");
        open(path, "w", null, (err, handle) -> {
            if (err != null) {
                callback.onComplete(err, null);
                return;
            }

            new Uploader(handle, data, callback).writeNext();
        });
    }

    /**
     * Reads directory batches until the listing is exhausted or fails, then closes the handle.
     */
    protected class DirectoryLister implements SftpCallback<List<DirEntry>> {
        private final Handle handle;
        private final SftpCallback<List<DirEntry>> callback;
        private final List<DirEntry> entries = new ArrayList<>();

        protected DirectoryLister(Handle handle, SftpCallback<List<DirEntry>> callback) {
            this.handle = handle;
            this.callback = callback;
        }

        @Override
        public void onComplete(SftpException error, List<DirEntry> batch) {
            if ((error != null) || batch.isEmpty()) {
                close(handle, (closeErr, v) -> {
                    if (closeErr != null) {
                        log.warn("list({}) failed to close {}: {}", sessionId, handle, closeErr.getMessage());
                    }
                });
                callback.onComplete(error, entries);
                return;
            }

            entries.addAll(batch);
            readdir(handle, this);
        }
    }

    /**
     * Writes the data in blocks of at most the maximum write length, then closes the handle.
     */
    protected class Uploader implements SftpCallback<Void> {
        private final Handle handle;
        private final byte[] data;
        private final SftpCallback<Void> callback;
        private int offset;
        private int length;

        protected Uploader(Handle handle, byte[] data, SftpCallback<Void> callback) {
            this.handle = handle;
            this.data = data;
            this.callback = callback;
        }

        protected void writeNext() {
            if (offset >= data.length) {
                finish(null);
                return;
            }

            length = Math.min(data.length - offset, maxWriteBlockLength);
            write(handle, data, offset, length, offset, this);
        }

        @Override
        public void onComplete(SftpException error, Void result) {
            if (error != null) {
                finish(error);
                return;
            }

            offset += length;
            writeNext();
        }

        protected void finish(SftpException writeError) {
            close(handle, (closeErr, v) -> {
                if (closeErr != null) {
                    log.warn("upload({}) failed to close {}: {}", sessionId, handle, closeErr.getMessage());
                }
                callback.onComplete((writeError != null) ? writeError : closeErr, null);
            });
        }
    }
}
