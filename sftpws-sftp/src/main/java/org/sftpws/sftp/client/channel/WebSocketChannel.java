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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

import org.sftpws.common.util.logging.AbstractLoggingBean;

/**
 * {@link SftpChannel} on top of a JDK {@link WebSocket}. Sends are queued so that at most one is outstanding, and
 * fragmented messages are re-assembled before being handed to the listener.
 */
public class WebSocketChannel extends AbstractLoggingBean implements SftpChannel, WebSocket.Listener {
    private final String address;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object sendLock = new Object();
    private volatile WebSocket webSocket;
    private volatile SftpChannelListener listener;
    private volatile boolean established;
    private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);
    private ByteArrayOutputStream binaryParts;
    private StringBuilder textParts;

    public WebSocketChannel(String address) {
        super();
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    public boolean isEstablished() {
        return established;
    }

    /**
     * Called once the opening handshake has completed
     */
    protected void markEstablished() {
        established = true;
    }

    @Override
    public void setListener(SftpChannelListener listener) {
        this.listener = listener;
    }

    @Override
    public void send(byte[] packet) {
        if (closed.get()) {
            if (log.isDebugEnabled()) {
                log.debug("send({}) ignore {} bytes - closed", address, packet.length);
            }
            return;
        }

        WebSocket ws = webSocket;
        if (ws == null) {
            throw new IllegalStateException("Not connected: " + address);
        }

        ByteBuffer data = ByteBuffer.wrap(packet);
        synchronized (sendLock) {
            lastSend = lastSend.thenCompose(v -> ws.sendBinary(data, true))
                    .whenComplete((w, t) -> {
                        if (t != null) {
                            onSendFailure(ws, t);
                        }
                    });
        }
    }

    @Override
    public void send(String message) {
        if (closed.get()) {
            if (log.isDebugEnabled()) {
                log.debug("send({}) ignore text message - closed", address);
            }
            return;
        }

        WebSocket ws = webSocket;
        if (ws == null) {
            throw new IllegalStateException("Not connected: " + address);
        }

        synchronized (sendLock) {
            lastSend = lastSend.thenCompose(v -> ws.sendText(message, true))
                    .whenComplete((w, t) -> {
                        if (t != null) {
                            onSendFailure(ws, t);
                        }
                    });
        }
    }

    @Override
    public void close(int code, String description) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        listener = null;

        WebSocket ws = webSocket;
        if (ws == null) {
            return;
        }

        int sendCode = toSendableCode(code);
        String reason = (description == null) ? "" : description;
        if (log.isDebugEnabled()) {
            log.debug("close({}) code={}, reason={}", address, sendCode, reason);
        }

        synchronized (sendLock) {
            lastSend = lastSend.handle((v, t) -> null)
                    .thenCompose(v -> ws.sendClose(sendCode, reason))
                    .whenComplete((w, t) -> {
                        if (t != null) {
                            log.debug("close({}) failed to send close frame: {}", address, t.toString());
                            ws.abort();
                        }
                    });
        }
    }

    @Override
    public void onOpen(WebSocket ws) {
        webSocket = ws;
        if (log.isDebugEnabled()) {
            log.debug("onOpen({}) subprotocol={}", address, ws.getSubprotocol());
        }
        ws.request(1L);
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);

        byte[] packet = null;
        if (last && (binaryParts == null)) {
            packet = chunk;
        } else {
            if (binaryParts == null) {
                binaryParts = new ByteArrayOutputStream(chunk.length * 2);
            }
            binaryParts.write(chunk, 0, chunk.length);
            if (last) {
                packet = binaryParts.toByteArray();
                binaryParts = null;
            }
        }

        if (packet != null) {
            SftpChannelListener l = listener;
            if ((l == null) || closed.get()) {
                if (log.isDebugEnabled()) {
                    log.debug("onBinary({}) dropped {} bytes - no listener", address, packet.length);
                }
            } else {
                try {
                    l.onMessage(packet);
                } catch (RuntimeException e) {
                    warn("onBinary({}) listener failed to handle {} bytes: {}", address, packet.length, e.toString(), e);
                }
            }
        }

        ws.request(1L);
        return null;
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        String message = null;
        if (last && (textParts == null)) {
            message = data.toString();
        } else {
            if (textParts == null) {
                textParts = new StringBuilder();
            }
            textParts.append(data);
            if (last) {
                message = textParts.toString();
                textParts = null;
            }
        }

        if (message != null) {
            SftpChannelListener l = listener;
            if ((l != null) && (!closed.get())) {
                try {
                    l.onTextMessage(message);
                } catch (RuntimeException e) {
                    warn("onText({}) listener failed to handle {} chars: {}", address, message.length(), e.toString(), e);
                }
            }
        }

        ws.request(1L);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        if (log.isDebugEnabled()) {
            log.debug("onClose({}) code={}, reason={}", address, statusCode, reason);
        }
        handleClose(toCloseException(statusCode, reason, established));
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        warn("onError({}) {}: {}", address, error.getClass().getSimpleName(), error.getMessage(), error);
        SftpChannelException reason = toCloseException(CloseReason.ABNORMAL, error.getMessage(), established);
        handleClose(new SftpChannelException(reason.getMessage(), reason.getCode(), reason.getNativeCode(), error));
    }

    protected void onSendFailure(WebSocket ws, Throwable t) {
        Throwable cause = (t instanceof CompletionException) && (t.getCause() != null) ? t.getCause() : t;
        warn("send({}) failed: {}", address, cause.toString(), cause);
        handleClose(new SftpChannelException("Send failed: " + cause.getMessage(), "EFAILURE", -1, cause));
        ws.abort();
    }

    /**
     * Closes the channel in response to the peer or a transport failure and notifies the listener.
     *
     * @param reason The failure - {@code null} for a clean close
     */
    protected void handleClose(SftpChannelException reason) {
        if (closed.get()) {
            return;
        }

        SftpChannelListener l = listener;
        close();

        IOException err = reason;
        if ((err == null) && (!established)) {
            err = new SftpChannelException("Connection refused", "ECONNREFUSED", CloseReason.NORMAL);
        }

        if (l != null) {
            l.onClose(err);
        } else if (err != null) {
            log.warn("handleClose({}) no listener for {}", address, err.toString());
        }
    }

    /**
     * @param  code     The received close code
     * @param  reason   The received close reason
     * @param  opened   Whether the connection was established
     * @return          The matching failure - {@code null} for a normal closure
     */
    public static SftpChannelException toCloseException(int code, String reason, boolean opened) {
        String message = "Connection failed";
        String errCode = "EFAILURE";
        switch (code) {
            case CloseReason.NORMAL:
                return null;
            case CloseReason.GOING_AWAY:
                message = "Endpoint is going away";
                errCode = "X_GOINGAWAY";
                break;
            case CloseReason.PROTOCOL_ERROR:
                message = "Protocol error";
                errCode = "EPROTOTYPE";
                break;
            case CloseReason.ABNORMAL:
                if (opened) {
                    message = "Connection aborted";
                    errCode = "ECONNABORTED";
                } else {
                    message = "Connection refused";
                    errCode = "ECONNREFUSED";
                }
                break;
            case CloseReason.BAD_DATA:
                message = "Invalid message";
                break;
            case CloseReason.POLICY_VIOLATION:
                message = "Prohibited message";
                break;
            case CloseReason.TOO_LARGE:
                message = "Message too large";
                break;
            case CloseReason.NO_EXTENSIONS_NEGOTIATED:
                message = "Connection terminated";
                errCode = "ECONNRESET";
                break;
            case CloseReason.UNEXPECTED_CONDITION:
                message = "Connection reset";
                errCode = "ECONNRESET";
                break;
            case CloseReason.FAILED_TLS_HANDSHAKE:
                message = "Unable to negotiate secure connection";
                break;
            default:
                break;
        }

        return new SftpChannelException(message, errCode, code);
    }

    /**
     * The JDK client refuses to send the reserved codes, so they are moved to the private range (1002 becomes 3002).
     *
     * @param  code The requested close code
     * @return      A code the client is allowed to send
     */
    public static int toSendableCode(int code) {
        switch (code) {
            case CloseReason.NORMAL:
            case CloseReason.GOING_AWAY:
            case CloseReason.POLICY_VIOLATION:
            case CloseReason.UNEXPECTED_CONDITION:
                return code;
            default:
                if ((code >= 3000) && (code <= 4999)) {
                    return code;
                }
                if ((code > CloseReason.NORMAL) && (code < 2000)) {
                    return code + 2000;
                }
                return CloseReason.NORMAL;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + address + "]";
    }
}
