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

import java.util.Arrays;

import org.sftpws.common.util.ValidateUtils;
import org.sftpws.common.util.buffer.ByteArrayBuffer;

/**
 * Builds an outgoing packet in a buffer of fixed capacity: {@link #start()} writes the envelope with a placeholder
 * length, the payload is appended and {@link #finish()} patches the length and returns the packet bytes.
 */
public class SftpPacketWriter extends ByteArrayBuffer implements SftpPacket {
    private final int type;
    private final String extendedType;
    private final long id;

    public SftpPacketWriter(int capacity, int type, long id) {
        this(capacity, type, null, id);
    }

    public SftpPacketWriter(int capacity, String extendedType, long id) {
        this(capacity, SftpConstants.SSH_FXP_EXTENDED,
             ValidateUtils.checkNotNullAndNotEmpty(extendedType, "No extension name"), id);
    }

    protected SftpPacketWriter(int capacity, int type, String extendedType, long id) {
        super(capacity);
        this.type = type;
        this.extendedType = extendedType;
        this.id = SftpPacket.isNumbered(type) ? id : NO_ID;
    }

    /**
     * Writes the envelope. May be called again to discard any payload written so far.
     */
    public void start() {
        wpos(0);
        putInt(0L); // length placeholder
        putByte((byte) type);

        if (SftpPacket.isNumbered(type)) {
            putUInt(id);
            if (extendedType != null) {
                putString(extendedType);
            }
        }
    }

    /**
     * @return A copy of the packet bytes with the correct length prefix
     */
    public byte[] finish() {
        int length = wpos();
        ValidateUtils.checkState(length >= HEADER_LENGTH, "Packet not started");

        wpos(0);
        putInt(length - Integer.BYTES);
        wpos(length);
        return Arrays.copyOf(array(), length);
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
}
