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
package org.sftpws.sftp.common;

import org.sftpws.common.util.buffer.Buffer;
import org.sftpws.common.util.buffer.ByteArrayBuffer;

/**
 * Reads a received packet. Unless created in raw mode the envelope is parsed on construction and the read position
 * is left at the start of the payload.
 */
public class SftpPacketReader extends ByteArrayBuffer implements SftpPacket {
    private final int type;
    private final String extendedType;
    private final long id;

    public SftpPacketReader(byte[] data) {
        this(data, 0, data.length, false);
    }

    /**
     * @param data Packet bytes
     * @param off  Offset of the packet
     * @param len  Number of bytes
     * @param raw  {@code true} if the data has no envelope, e.g. a nested structure
     */
    public SftpPacketReader(byte[] data, int off, int len, boolean raw) {
        super(data, off, len);

        if (raw) {
            type = -1;
            extendedType = null;
            id = NO_ID;
            return;
        }

        long length = getUInt() + Integer.BYTES;
        if (length != len) {
            throw new InvalidPacketException("Invalid packet received: declared=" + length + ", actual=" + len);
        }

        type = getUByte();
        if (SftpPacket.isNumbered(type)) {
            id = getUInt();
            extendedType = (type == SftpConstants.SSH_FXP_EXTENDED) ? getString() : null;
        } else {
            id = NO_ID;
            extendedType = null;
        }
    }

    /**
     * Creates an envelope-less reader over the next opaque data item, sharing this packet's bytes.
     *
     * @return The structured reader
     */
    public SftpPacketReader getStructuredData() {
        Buffer view = getBufferView();
        return new SftpPacketReader(view.array(), view.rpos(), view.available(), true);
    }

    @Override
    public int getType() {
        return type;
    }

    @Override
    public String getExtendedType() {
        return extendedType;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[type=" + getTypeName() + ", id=" + getId() + ", available=" + available()
               + "]";
    }
}
