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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.sftpws.common.PropertyResolver;
import org.sftpws.common.util.GenericUtils;
import org.sftpws.common.util.ValidateUtils;
import org.sftpws.common.util.buffer.Buffer;
import org.sftpws.common.util.buffer.BufferUtils;
import org.sftpws.common.util.logging.AbstractLoggingBean;
import org.sftpws.sftp.SftpModuleProperties;
import org.sftpws.sftp.client.SftpCallback;
import org.sftpws.sftp.client.SftpClient;
import org.sftpws.sftp.client.channel.CloseReason;
import org.sftpws.sftp.client.channel.SftpChannel;
import org.sftpws.sftp.common.FileStats;
import org.sftpws.sftp.common.SftpAttributes;
import org.sftpws.sftp.common.SftpCommandInfo;
import org.sftpws.sftp.common.SftpCommandInfo.LinkCommandInfo;
import org.sftpws.sftp.common.SftpCommandInfo.RenameCommandInfo;
import org.sftpws.sftp.common.SftpCommandInfo.SymlinkCommandInfo;
import org.sftpws.sftp.common.SftpConstants;
import org.sftpws.sftp.common.SftpErrorCode;
import org.sftpws.sftp.common.SftpException;
import org.sftpws.sftp.common.SftpHelper;
import org.sftpws.sftp.common.SftpOpenFlags;
import org.sftpws.sftp.common.SftpPacket;
import org.sftpws.sftp.common.SftpPacketReader;
import org.sftpws.sftp.common.SftpPacketWriter;
import org.sftpws.sftp.common.SftpProtocolException;
import org.sftpws.sftp.common.extensions.SftpExtensions;

/**
 * The SFTP v3 protocol engine. Requests are written to the bound {@link SftpChannel} and matched with their responses
 * by request identifier, so responses may arrive in any order. The engine owns no threads: responses are processed on
 * the thread that calls {@link #process(byte[])}, and failures detected before anything is sent are reported through
 * the {@link Executor} given at construction.
 */
public abstract class AbstractSftpClient extends AbstractLoggingBean implements SftpClient {
    /**
     * Number of times a read that returned no data is re-issued before giving up
     */
    public static final int MAX_EMPTY_READ_RETRIES = 4;

    /**
     * Room reserved in every packet for the envelope and the non-data fields
     */
    public static final int PACKET_HEADER_SLACK = 1024;

    protected final int sessionId;
    protected final Executor executor;
    protected final int maxReadBlockLength;
    protected final int maxWriteBlockLength;

    private final AtomicReference<SftpChannel> host = new AtomicReference<>();
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final Object requestsLock = new Object();
    // guarded by requestsLock
    private Map<Long, SftpRequest<?>> requests = new LinkedHashMap<>();
    // guarded by requestsLock
    private long nextId = 1L;
    private volatile boolean ready;
    private volatile Map<String, Object> extensions = Collections.emptyMap();
    private volatile Map<SftpFeature, String> features = Collections.emptyMap();

    protected AbstractSftpClient(int sessionId, PropertyResolver resolver, Executor executor) {
        this.sessionId = sessionId;
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.maxReadBlockLength = SftpModuleProperties.MAX_READ_BLOCK_LENGTH.getRequired(resolver);
        this.maxWriteBlockLength = SftpModuleProperties.MAX_WRITE_BLOCK_LENGTH.getRequired(resolver);
    }

    public int getSessionId() {
        return sessionId;
    }

    public int getMaxReadBlockLength() {
        return maxReadBlockLength;
    }

    public int getMaxWriteBlockLength() {
        return maxWriteBlockLength;
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public Map<String, Object> getServerExtensions() {
        return extensions;
    }

    /**
     * @param  feature The feature
     * @return         {@code true} if the server enabled it during the handshake
     */
    public boolean isSupported(SftpFeature feature) {
        return features.containsKey(feature);
    }

    @Override
    public long getBytesSent() {
        return bytesSent.get();
    }

    @Override
    public long getBytesReceived() {
        return bytesReceived.get();
    }

    /**
     * @return Number of requests awaiting a response
     */
    public int getPendingRequestsCount() {
        synchronized (requestsLock) {
            return requests.size();
        }
    }

    /**
     * Attaches the channel and sends {@code SSH_FXP_INIT}. The callback is invoked once the server version has been
     * received and validated.
     *
     * @param  channel               The channel to use
     * @param  callback              Receives the handshake outcome
     * @throws IllegalStateException If already initialized
     */
    public void init(SftpChannel channel, SftpCallback<Void> callback) {
        ValidateUtils.checkNotNull(channel, "No channel");
        ValidateUtils.checkNotNull(callback, "No callback");
        ValidateUtils.checkState(initialized.compareAndSet(false, true), "Already initialized");
        ValidateUtils.checkState(host.compareAndSet(null, channel), "Already bound");

        synchronized (requestsLock) {
            nextId = 1L;
        }

        SftpPacketWriter request = new SftpPacketWriter(
                maxWriteBlockLength + PACKET_HEADER_SLACK, SftpConstants.SSH_FXP_INIT, SftpPacket.NO_ID);
        request.start();
        request.putUInt(SftpConstants.SFTP_V3);

        execute(request, new SftpCommandInfo("init"), callback, (response, pending) -> handleVersion(channel, response, pending));
    }

    protected void handleVersion(SftpChannel channel, SftpPacketReader response, SftpRequest<Void> request) {
        SftpCommandInfo info = request.getCommandInfo();
        if (response.getType() != SftpConstants.SSH_FXP_VERSION) {
            log.warn("handleVersion({}) unexpected handshake response: {}", sessionId, response.getTypeName());
            channel.close(CloseReason.PROTOCOL_ERROR, "Unexpected message");
            request.fail(SftpHelper.createError(SftpConstants.SSH_FX_BAD_MESSAGE, "Unexpected message", info));
            return;
        }

        long version = response.getUInt();
        if (version != SftpConstants.SFTP_V3) {
            log.warn("handleVersion({}) unsupported protocol version: {}", sessionId, version);
            channel.close(CloseReason.PROTOCOL_ERROR, "Unexpected protocol version");
            request.fail(SftpHelper.createError(SftpConstants.SSH_FX_BAD_MESSAGE, "Unexpected protocol version", info));
            return;
        }

        Map<String, Object> exts = new TreeMap<>();
        while (response.available() >= Integer.BYTES) {
            String name = response.getString();
            Object value = SftpExtensions.read(response, name);
            if (SftpExtensions.isOpenSSHExtension(name)) {
                // may be repeated
                Object prev = exts.get(name);
                if ((prev instanceof String) && (value instanceof String)) {
                    value = prev + "," + value;
                }
            }
            exts.put(name, value);
        }

        Map<SftpFeature, String> supported = new EnumMap<>(SftpFeature.class);
        for (SftpFeature feature : SftpFeature.VALUES) {
            String name = feature.getName();
            Object value = exts.get(name);
            if ((value instanceof String) && SftpExtensions.contains((String) value, "1")) {
                supported.put(feature, name);
            }
        }

        extensions = Collections.unmodifiableMap(exts);
        features = Collections.unmodifiableMap(supported);
        ready = true;

        if (log.isDebugEnabled()) {
            log.debug("handleVersion({}) version={}, extensions={}, features={}",
                    sessionId, version, exts.keySet(), supported.keySet());
        }

        request.complete(null);
    }

    /**
     * Handles a packet received from the channel.
     *
     * @param  packet                The packet bytes
     * @throws SftpProtocolException If the packet is malformed, answers no pending request or is not a valid response
     *                               to it
     */
    public void process(byte[] packet) {
        bytesReceived.addAndGet(packet.length);
        SftpPacketReader response = new SftpPacketReader(packet);
        long id = response.getId();
        if (log.isDebugEnabled()) {
            log.debug("process({}) received id={}, type={}, length={}", sessionId, id, response.getTypeName(), packet.length);
        }
        if (log.isTraceEnabled()) {
            log.trace("process({}) id={} raw: {}", sessionId, id, BufferUtils.toHex(packet));
        }

        SftpRequest<?> request;
        synchronized (requestsLock) {
            request = requests.remove(id);
        }

        if (request == null) {
            throw new SftpProtocolException("Unknown response ID: " + id);
        }

        try {
            request.handleResponse(response);
        } catch (RuntimeException e) {
            // the request is no longer pending, so teardown would not reach it
            if (!request.isDone()) {
                failViolatedRequest(request, e);
            }
            throw e;
        }
    }

    protected void failViolatedRequest(SftpRequest<?> request, RuntimeException violation) {
        SftpException err = SftpHelper.createError(
                SftpConstants.SSH_FX_BAD_MESSAGE, violation.getMessage(), request.getCommandInfo());
        try {
            request.fail(err);
        } catch (RuntimeException e) {
            warn("failViolatedRequest({}) callback of {} failed: {}", sessionId, request, e.toString(), e);
        }
    }

    @Override
    public void end() {
        ready = false;
        SftpChannel channel = host.getAndSet(null);
        if (channel != null) {
            if (log.isDebugEnabled()) {
                log.debug("end({}) closing channel", sessionId);
            }
            channel.close();
        }

        failRequests(SftpConstants.SSH_FX_CONNECTION_LOST, "Connection closed");
    }

    /**
     * Closes the channel with the given code and fails every pending request
     *
     * @param code   The close code
     * @param reason The close description
     */
    protected void end(int code, String reason) {
        ready = false;
        SftpChannel channel = host.getAndSet(null);
        if (channel != null) {
            channel.close(code, reason);
        }

        failRequests(SftpConstants.SSH_FX_CONNECTION_LOST, "Connection closed");
    }

    protected void failRequests(int status, String message) {
        Map<Long, SftpRequest<?>> pending;
        synchronized (requestsLock) {
            pending = requests;
            requests = new LinkedHashMap<>();
        }

        if (pending.isEmpty()) {
            return;
        }

        if (log.isDebugEnabled()) {
            log.debug("failRequests({}) failing {} pending requests: {}", sessionId, pending.size(), message);
        }

        for (SftpRequest<?> request : pending.values()) {
            try {
                request.fail(SftpHelper.createError(status, message, request.getCommandInfo()));
            } catch (RuntimeException e) {
                warn("failRequests({}) callback of {} failed: {}", sessionId, request, e.toString(), e);
            }
        }
    }

    @Override
    public void open(String path, String mode, FileStats attrs, SftpCallback<Handle> callback) {
        open(path, SftpOpenFlags.toMask(mode), attrs, callback);
    }

    @Override
    public void open(String path, int flags, FileStats attrs, SftpCallback<Handle> callback) {
        checkCallback(callback);
        String p = checkPath(path, "path");

        SftpAttributes wireAttrs = SftpAttributes.from(attrs);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_OPEN);
        request.putString(p);
        request.putUInt(SftpOpenFlags.toMask(flags));
        wireAttrs.encode(request);

        execute(request, SftpCommandInfo.forPath("open", p), callback, this::parseHandle);
    }

    @Override
    public void close(Handle handle, SftpCallback<Void> callback) {
        checkCallback(callback);
        byte[] h = toHandle(handle);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_CLOSE);
        request.putBytes(h);

        execute(request, SftpCommandInfo.forHandle("close", handle), callback, this::parseStatus);
    }

    @Override
    public void read(
            Handle handle, byte[] buffer, int offset, int length, long position, SftpCallback<ReadResult> callback) {
        checkCallback(callback);
        byte[] h = toHandle(handle);
        if (buffer != null) {
            checkBuffer(buffer, offset, length);
        } else {
            ValidateUtils.checkTrue(length >= 0, "Invalid length: %d", length);
        }
        checkPosition(position);

        int len = Math.min(length, maxReadBlockLength);
        ReadContext context = new ReadContext(h, buffer, offset, len, position, 0);
        SftpCommandInfo info = SftpCommandInfo.forHandle("read", handle);
        execute(createReadRequest(context), info, callback, (response, request) -> parseData(response, request, context));
    }

    protected SftpPacketWriter createReadRequest(ReadContext context) {
        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_READ);
        request.putBytes(context.handle);
        request.putLong(context.position);
        request.putUInt(context.length);
        return request;
    }

    @Override
    public void write(
            Handle handle, byte[] buffer, int offset, int length, long position, SftpCallback<Void> callback) {
        checkCallback(callback);
        byte[] h = toHandle(handle);
        ValidateUtils.checkNotNull(buffer, "Missing buffer");
        checkBuffer(buffer, offset, length);
        checkPosition(position);
        ValidateUtils.checkTrue(length <= maxWriteBlockLength,
                "Length exceeds maximum allowed data block length: %d", length);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_WRITE);
        request.putBytes(h);
        request.putLong(position);
        request.putBytes(buffer, offset, length);

        execute(request, SftpCommandInfo.forHandle("write", handle), callback, this::parseStatus);
    }

    @Override
    public void lstat(String path, SftpCallback<SftpAttributes> callback) {
        pathCommand(SftpConstants.SSH_FXP_LSTAT, "lstat", path, callback, this::parseAttribs);
    }

    @Override
    public void stat(String path, SftpCallback<SftpAttributes> callback) {
        pathCommand(SftpConstants.SSH_FXP_STAT, "stat", path, callback, this::parseAttribs);
    }

    @Override
    public void fstat(Handle handle, SftpCallback<SftpAttributes> callback) {
        checkCallback(callback);
        byte[] h = toHandle(handle);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_FSTAT);
        request.putBytes(h);

        execute(request, SftpCommandInfo.forHandle("fstat", handle), callback, this::parseAttribs);
    }

    @Override
    public void setstat(String path, FileStats attrs, SftpCallback<Void> callback) {
        checkCallback(callback);
        String p = checkPath(path, "path");

        SftpAttributes wireAttrs = SftpAttributes.from(attrs);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_SETSTAT);
        request.putString(p);
        wireAttrs.encode(request);

        execute(request, SftpCommandInfo.forPath("setstat", p), callback, this::parseStatus);
    }

    @Override
    public void fsetstat(Handle handle, FileStats attrs, SftpCallback<Void> callback) {
        checkCallback(callback);
        byte[] h = toHandle(handle);

        SftpAttributes wireAttrs = SftpAttributes.from(attrs);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_FSETSTAT);
        request.putBytes(h);
        wireAttrs.encode(request);

        execute(request, SftpCommandInfo.forHandle("fsetstat", handle), callback, this::parseStatus);
    }

    @Override
    public void opendir(String path, SftpCallback<Handle> callback) {
        pathCommand(SftpConstants.SSH_FXP_OPENDIR, "opendir", path, callback, this::parseHandle);
    }

    @Override
    public void readdir(Handle handle, SftpCallback<List<DirEntry>> callback) {
        checkCallback(callback);
        byte[] h = toHandle(handle);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_READDIR);
        request.putBytes(h);

        execute(request, SftpCommandInfo.forHandle("readdir", handle), callback, this::parseItems);
    }

    @Override
    public void unlink(String path, SftpCallback<Void> callback) {
        pathCommand(SftpConstants.SSH_FXP_REMOVE, "unlink", path, callback, this::parseStatus);
    }

    @Override
    public void mkdir(String path, FileStats attrs, SftpCallback<Void> callback) {
        checkCallback(callback);
        String p = checkPath(path, "path");

        SftpAttributes wireAttrs = SftpAttributes.from(attrs);

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_MKDIR);
        request.putString(p);
        wireAttrs.encode(request);

        execute(request, SftpCommandInfo.forPath("mkdir", p), callback, this::parseStatus);
    }

    @Override
    public void rmdir(String path, SftpCallback<Void> callback) {
        pathCommand(SftpConstants.SSH_FXP_RMDIR, "rmdir", path, callback, this::parseStatus);
    }

    @Override
    public void realpath(String path, SftpCallback<String> callback) {
        pathCommand(SftpConstants.SSH_FXP_REALPATH, "realpath", path, callback, this::parsePath);
    }

    @Override
    public void readlink(String path, SftpCallback<String> callback) {
        pathCommand(SftpConstants.SSH_FXP_READLINK, "readlink", path, callback, this::parsePath);
    }

    @Override
    public void rename(String oldPath, String newPath, int flags, SftpCallback<Void> callback) {
        checkCallback(callback);
        String oldP = checkPath(oldPath, "oldPath");
        String newP = checkPath(newPath, "newPath");

        RenameCommandInfo info = new RenameCommandInfo(oldP, newP, flags);
        switch (flags) {
            case SftpConstants.SSH_FXP_RENAME_NONE: {
                SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_RENAME);
                request.putString(oldP);
                request.putString(newP);
                execute(request, info, callback, this::parseStatus);
                break;
            }
            case SftpConstants.SSH_FXP_RENAME_OVERWRITE:
                featureCommand(SftpFeature.POSIX_RENAME, info, callback, this::parseStatus, oldP, newP);
                break;
            default:
                defer(callback, SftpHelper.createError(
                        SftpConstants.SSH_FX_OP_UNSUPPORTED, "Unsupported rename flags", info));
        }
    }

    @Override
    public void symlink(String targetPath, String linkPath, SftpCallback<Void> callback) {
        checkCallback(callback);
        String target = checkPath(targetPath, "targetPath");
        String link = checkPath(linkPath, "linkPath");

        SftpPacketWriter request = createRequest(SftpConstants.SSH_FXP_SYMLINK);
        request.putString(target);
        request.putString(link);

        execute(request, new SymlinkCommandInfo(target, link), callback, this::parseStatus);
    }

    @Override
    public void link(String oldPath, String newPath, SftpCallback<Void> callback) {
        checkCallback(callback);
        String oldP = checkPath(oldPath, "oldPath");
        String newP = checkPath(newPath, "newPath");

        featureCommand(SftpFeature.HARDLINK, new LinkCommandInfo("link", oldP, newP), callback, this::parseStatus,
                oldP, newP);
    }

    protected <T> void pathCommand(
            int type, String command, String path, SftpCallback<T> callback, SftpResponseParser<T> parser) {
        checkCallback(callback);
        String p = checkPath(path, "path");

        SftpPacketWriter request = createRequest(type);
        request.putString(p);

        execute(request, SftpCommandInfo.forPath(command, p), callback, parser);
    }

    /**
     * Sends an {@code SSH_FXP_EXTENDED} request for a negotiated feature. If the server did not enable the feature
     * nothing is sent and the callback receives an {@code SSH_FX_OP_UNSUPPORTED} error.
     *
     * @param <T>      Type of result
     * @param feature  The required feature
     * @param info     The command context
     * @param callback The callback
     * @param parser   The response parser
     * @param args     The string arguments of the request
     */
    protected <T> void featureCommand(
            SftpFeature feature, SftpCommandInfo info, SftpCallback<T> callback, SftpResponseParser<T> parser,
            String... args) {
        String extension = features.get(feature);
        if (extension == null) {
            if (log.isDebugEnabled()) {
                log.debug("featureCommand({}) {} not supported for {}", sessionId, feature, info);
            }
            defer(callback, SftpHelper.createError(SftpConstants.SSH_FX_OP_UNSUPPORTED, "Operation not supported", info));
            return;
        }

        SftpPacketWriter request = createRequest(extension);
        for (String a : args) {
            request.putString(a);
        }

        execute(request, info, callback, parser);
    }

    protected SftpPacketWriter createRequest(int type) {
        SftpPacketWriter request = new SftpPacketWriter(maxWriteBlockLength + PACKET_HEADER_SLACK, type, nextRequestId());
        request.start();
        return request;
    }

    protected SftpPacketWriter createRequest(String extension) {
        SftpPacketWriter request = new SftpPacketWriter(
                maxWriteBlockLength + PACKET_HEADER_SLACK, extension, nextRequestId());
        request.start();
        return request;
    }

    protected long nextRequestId() {
        synchronized (requestsLock) {
            long id = nextId;
            nextId = (id + 1L) & BufferUtils.MAX_UINT32_VALUE;
            return id;
        }
    }

    /**
     * Registers the request and writes it to the channel. The request is registered before it is sent so that a
     * response delivered on another thread always finds it.
     *
     * @param <T>                    Type of result
     * @param request                The finished request
     * @param info                   The command context
     * @param callback               Receives the outcome
     * @param parser                 Interprets the response
     * @throws IllegalStateException If a request with the same identifier is already pending
     */
    protected <T> void execute(
            SftpPacketWriter request, SftpCommandInfo info, SftpCallback<T> callback, SftpResponseParser<T> parser) {
        SftpChannel channel = host.get();
        if (channel == null) {
            if (log.isDebugEnabled()) {
                log.debug("execute({}) not connected - {}", sessionId, info);
            }
            defer(callback, SftpHelper.createError(SftpConstants.SSH_FX_NO_CONNECTION, "Not connected", info));
            return;
        }

        long id = request.getId();
        byte[] packet = request.finish();
        SftpRequest<T> pending = new SftpRequest<>(id, info, callback, parser);
        synchronized (requestsLock) {
            ValidateUtils.checkState(!requests.containsKey(id), "Duplicate request: %d", id);
            requests.put(id, pending);
        }

        if (log.isDebugEnabled()) {
            log.debug("execute({}) send id={}, type={}, length={}", sessionId, id, request.getTypeName(), packet.length);
        }
        if (log.isTraceEnabled()) {
            log.trace("execute({}) id={} raw: {}", sessionId, id, BufferUtils.toHex(packet));
        }

        try {
            channel.send(packet);
        } catch (RuntimeException e) {
            synchronized (requestsLock) {
                requests.remove(id);
            }
            throw e;
        }

        bytesSent.addAndGet(packet.length);
    }

    protected <T> void defer(SftpCallback<T> callback, SftpException error) {
        executor.execute(() -> callback.onComplete(error, null));
    }

    /**
     * @param  response              The response
     * @param  expectedType          The expected response type
     * @param  request               The request
     * @return                       {@code true} if the response is of the expected type, {@code false} if it was an
     *                               error status that has been reported to the request
     * @throws SftpProtocolException If the response is of another type
     */
    protected boolean checkResponse(SftpPacketReader response, int expectedType, SftpRequest<?> request) {
        int type = response.getType();
        if (type == SftpConstants.SSH_FXP_STATUS) {
            SftpException err = SftpHelper.readStatus(response, request.getCommandInfo());
            if (err != null) {
                request.fail(err);
                return false;
            }
        }

        if (type != expectedType) {
            throw new SftpProtocolException("Unexpected packet received: " + response.getTypeName()
                                            + " for " + request.getCommandInfo().getCommand());
        }

        return true;
    }

    protected void parseStatus(SftpPacketReader response, SftpRequest<Void> request) {
        if (checkResponse(response, SftpConstants.SSH_FXP_STATUS, request)) {
            request.complete(null);
        }
    }

    protected void parseAttribs(SftpPacketReader response, SftpRequest<SftpAttributes> request) {
        if (!checkResponse(response, SftpConstants.SSH_FXP_ATTRS, request)) {
            return;
        }

        SftpAttributes attrs = SftpAttributes.decode(response);
        attrs.clearFlags();
        request.complete(attrs);
    }

    protected void parseHandle(SftpPacketReader response, SftpRequest<Handle> request) {
        if (!checkResponse(response, SftpConstants.SSH_FXP_HANDLE, request)) {
            return;
        }

        byte[] id = response.getBytes();
        request.complete(new Handle(id, this));
    }

    protected void parsePath(SftpPacketReader response, SftpRequest<String> request) {
        if (!checkResponse(response, SftpConstants.SSH_FXP_NAME, request)) {
            return;
        }

        int count = response.getInt();
        if (count != 1) {
            throw new SftpProtocolException("Invalid response: expected 1 name, got " + count);
        }

        request.complete(response.getString());
    }

    protected void parseItems(SftpPacketReader response, SftpRequest<List<DirEntry>> request) {
        if (response.getType() == SftpConstants.SSH_FXP_STATUS) {
            SftpException err = SftpHelper.readStatus(response, request.getCommandInfo());
            if (err != null) {
                if (err.getStatus() == SftpConstants.SSH_FX_EOF) {
                    request.complete(Collections.emptyList());
                } else {
                    request.fail(err);
                }
                return;
            }
        }

        if (response.getType() != SftpConstants.SSH_FXP_NAME) {
            throw new SftpProtocolException("Unexpected packet received: " + response.getTypeName() + " for readdir");
        }

        int count = response.getInt();
        if (count < 0) {
            throw new SftpProtocolException("Invalid entries count: " + count);
        }

        List<DirEntry> entries = new ArrayList<>(Math.min(count, 1024));
        for (int index = 0; index < count; index++) {
            String filename = response.getString();
            String longFilename = response.getString();
            SftpAttributes attrs = SftpAttributes.decode(response);
            entries.add(new DirEntry(filename, longFilename, attrs));
        }

        request.complete(entries);
    }

    /**
     * Completes a read. An {@code SSH_FX_EOF} status is a zero-byte result. An empty {@code SSH_FXP_DATA} reply is
     * re-issued at the same position up to {@link #MAX_EMPTY_READ_RETRIES} times before failing with {@code EIO}.
     *
     * @param response The response
     * @param request  The request
     * @param context  The read parameters
     */
    protected void parseData(SftpPacketReader response, SftpRequest<ReadResult> request, ReadContext context) {
        SftpCommandInfo info = request.getCommandInfo();
        if (response.getType() == SftpConstants.SSH_FXP_STATUS) {
            SftpException err = SftpHelper.readStatus(response, info);
            if (err == null) {
                throw new SftpProtocolException("Unexpected OK status for read");
            }

            if (err.getStatus() == SftpConstants.SSH_FX_EOF) {
                request.complete(new ReadResult(GenericUtils.EMPTY_BYTE_ARRAY, 0));
            } else {
                request.fail(err);
            }
            return;
        }

        if (response.getType() != SftpConstants.SSH_FXP_DATA) {
            throw new SftpProtocolException("Unexpected packet received: " + response.getTypeName() + " for read");
        }

        Buffer data = response.getBufferView();
        int len = data.available();
        if (len > context.length) {
            throw new SftpProtocolException(
                    "Received too much data: requested=" + context.length + ", received=" + len);
        }

        if (len == 0) {
            if (context.retries >= MAX_EMPTY_READ_RETRIES) {
                log.warn("parseData({}) no data after {} retries - {}", sessionId, context.retries, info);
                request.fail(SftpHelper.createError(
                        SftpErrorCode.EIO, SftpConstants.SSH_FX_FAILURE, "Unable to read data", info));
                return;
            }

            ReadContext next = context.retry();
            if (log.isDebugEnabled()) {
                log.debug("parseData({}) empty data - retry #{} for {}", sessionId, next.retries, info);
            }
            SftpCallback<ReadResult> callback = request.handOver();
            try {
                execute(createReadRequest(next), info, callback, (r, q) -> parseData(r, q, next));
            } catch (RuntimeException e) {
                warn("parseData({}) failed to re-issue {}: {}", sessionId, info, e.toString(), e);
                callback.onComplete(SftpHelper.createError(
                        SftpErrorCode.EIO, SftpConstants.SSH_FX_FAILURE, "Unable to read data", info), null);
            }
            return;
        }

        byte[] buf = context.buffer;
        int off = context.offset;
        if (buf == null) {
            buf = new byte[len];
            off = 0;
        }
        data.getRawBytes(buf, off, len);
        request.complete(new ReadResult(buf, len));
    }

    protected void checkCallback(SftpCallback<?> callback) {
        ValidateUtils.checkNotNull(callback, "Missing callback");
    }

    /**
     * @param  path                     The path
     * @param  name                     The argument name used in error messages
     * @return                          The path with a leading {@code ~} replaced by {@code .}
     * @throws IllegalArgumentException If the path is {@code null} or empty
     */
    protected String checkPath(String path, String name) {
        ValidateUtils.checkNotNull(path, "Missing %s", name);
        ValidateUtils.checkTrue(!path.isEmpty(), "Empty %s", name);
        if (path.charAt(0) == '~') {
            if (path.length() == 1) {
                return ".";
            }
            if (path.charAt(1) == '/') {
                return "." + path.substring(1);
            }
        }
        return path;
    }

    protected byte[] toHandle(Handle handle) {
        ValidateUtils.checkNotNull(handle, "Missing handle");
        ValidateUtils.checkTrue(handle.getOwner() == this, "Invalid handle: %s", handle);
        return handle.getIdentifier();
    }

    protected void checkBuffer(byte[] buffer, int offset, int length) {
        ValidateUtils.checkTrue(offset >= 0, "Invalid offset: %d", offset);
        ValidateUtils.checkTrue(length >= 0, "Invalid length: %d", length);
        ValidateUtils.checkTrue((long) offset + length <= buffer.length,
                "Offset or length is out of bounds: offset=%d, length=%d, size=%d", offset, length, buffer.length);
    }

    protected void checkPosition(long position) {
        ValidateUtils.checkTrue(position >= 0L, "Invalid position: %d", position);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[session=" + sessionId + ", ready=" + isReady() + "]";
    }

    /**
     * Parameters of a read, kept across re-issued requests
     */
    protected static class ReadContext {
        protected final byte[] handle;
        protected final byte[] buffer;
        protected final int offset;
        protected final int length;
        protected final long position;
        protected final int retries;

        protected ReadContext(byte[] handle, byte[] buffer, int offset, int length, long position, int retries) {
            this.handle = handle;
            this.buffer = buffer;
            this.offset = offset;
            this.length = length;
            this.position = position;
            this.retries = retries;
        }

        protected ReadContext retry() {
            return new ReadContext(handle, buffer, offset, length, position, retries + 1);
        }
    }
}
