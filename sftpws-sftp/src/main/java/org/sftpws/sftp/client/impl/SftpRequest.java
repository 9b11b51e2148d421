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

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.sftpws.sftp.client.SftpCallback;
import org.sftpws.sftp.common.SftpCommandInfo;
import org.sftpws.sftp.common.SftpException;
import org.sftpws.sftp.common.SftpPacketReader;

/**
 * A request awaiting its response.
 *
 * @param <T> Type of result
 */
public class SftpRequest<T> {
    private final long id;
    private final SftpCommandInfo commandInfo;
    private final SftpCallback<T> callback;
    private final SftpResponseParser<T> parser;
    private final AtomicBoolean done = new AtomicBoolean(false);

    public SftpRequest(long id, SftpCommandInfo commandInfo, SftpCallback<T> callback, SftpResponseParser<T> parser) {
        this.id = id;
        this.commandInfo = Objects.requireNonNull(commandInfo, "No command info");
        this.callback = Objects.requireNonNull(callback, "No callback");
        this.parser = Objects.requireNonNull(parser, "No parser");
    }

    public long getId() {
        return id;
    }

    public SftpCommandInfo getCommandInfo() {
        return commandInfo;
    }

    /**
     * Marks the request done and returns its callback, so that a follow-up request completes it instead
     *
     * @return                       The callback
     * @throws IllegalStateException If the request is already done
     */
    public SftpCallback<T> handOver() {
        if (!done.compareAndSet(false, true)) {
            throw new IllegalStateException("Request already done: " + this);
        }
        return callback;
    }

    public void handleResponse(SftpPacketReader response) {
        parser.parse(response, this);
    }

    /**
     * @return {@code true} once the callback has been invoked
     */
    public boolean isDone() {
        return done.get();
    }

    /**
     * Invokes the callback with the result unless the request is already done
     *
     * @param  result The result
     * @return        {@code false} if the request was already done
     */
    public boolean complete(T result) {
        if (!done.compareAndSet(false, true)) {
            return false;
        }

        callback.onComplete(null, result);
        return true;
    }

    /**
     * Invokes the callback with the error unless the request is already done
     *
     * @param  error The error
     * @return       {@code false} if the request was already done
     */
    public boolean fail(SftpException error) {
        Objects.requireNonNull(error, "No error");
        if (!done.compareAndSet(false, true)) {
            return false;
        }

        callback.onComplete(error, null);
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + getId() + ", " + getCommandInfo() + "]";
    }
}
