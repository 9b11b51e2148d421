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

/**
 * A bidirectional, message oriented transport. Each binary message carries exactly one SFTP packet.
 */
public interface SftpChannel {
    /**
     * Sends a binary message. Ignored once the channel is closed.
     *
     * @param packet The packet bytes
     */
    void send(byte[] packet);

    /**
     * Sends a text message. Ignored once the channel is closed.
     *
     * @param message The text
     */
    void send(String message);

    default void close() {
        close(CloseReason.NORMAL, null);
    }

    /**
     * Closes the channel. The listener is detached first, so it is not notified of a locally requested close.
     *
     * @param code        The close code
     * @param description Optional description
     */
    void close(int code, String description);

    /**
     * @param listener Receives the incoming messages and the close notification - {@code null} to detach
     */
    void setListener(SftpChannelListener listener);
}
