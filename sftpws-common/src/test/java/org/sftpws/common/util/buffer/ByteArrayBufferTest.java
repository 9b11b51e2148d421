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
package org.sftpws.common.util.buffer;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.sftpws.util.test.JUnitTestSupport;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="mailto:dev@sftpws.org">SFTP-WS Project</a>
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class ByteArrayBufferTest extends JUnitTestSupport {
    public ByteArrayBufferTest() {
        super();
    }

    @Test
    void integersAreBigEndian() {
        Buffer buffer = new ByteArrayBuffer(Integer.BYTES + Short.BYTES);
        buffer.putInt(0x01020304L);
        buffer.putShort(0x0506);
        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5, 6 }, buffer.array());
        assertEquals(0x01020304, buffer.getInt());
        assertEquals(0x0506, buffer.getUShort());
    }

    @Test
    void signedReadsSignExtend() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { (byte) 0xFF, (byte) 0xFE, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
                (byte) 0xFD });
        assertEquals(-1, buffer.getByte());
        assertEquals(0xFE, buffer.getUByte());
        assertEquals(-1, buffer.getShort());
        assertEquals(0xFFFD, buffer.getUShort());
    }

    @Test
    void unsignedIntRead() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFE });
        assertEquals(0xFFFFFFFEL, buffer.getUInt());
    }

    @Test
    void longIsHighWordThenLowWord() {
        Buffer buffer = new ByteArrayBuffer(Long.BYTES);
        buffer.putLong(0x0000000100000002L);
        assertArrayEquals(new byte[] { 0, 0, 0, 1, 0, 0, 0, 2 }, buffer.array());
        assertEquals(0x0000000100000002L, buffer.getLong());
    }

    @Test
    void unsignedLongBeyondRangeIsRejected() {
        Buffer buffer = new ByteArrayBuffer(Long.BYTES);
        buffer.putLong(-1L);
        assertThrows(ArithmeticException.class, buffer::getUInt64);
        assertEquals(0, buffer.rpos(), "Read position moved");
        assertEquals(-1L, buffer.getLong());
    }

    @Test
    void stringIsLengthPrefixedUtf8() {
        String value = "résumé";
        byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
        Buffer buffer = new ByteArrayBuffer(Integer.BYTES + encoded.length);
        buffer.putString(value);
        assertEquals(encoded.length, new ByteArrayBuffer(buffer.array()).getInt());
        assertEquals(value, buffer.getString());
        assertEquals(0, buffer.available());
    }

    @Test
    void readPastEndLeavesPositionUnchanged() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { 0, 0, 0, 10, 'a', 'b' });
        BufferException e = assertThrows(BufferException.class, buffer::getString);
        assertEquals("Unexpected end of packet: requested=10, available=2", e.getMessage());
        assertEquals(0, buffer.rpos());
        assertThrows(BufferException.class, buffer::getBytes);
        assertEquals(0, buffer.rpos());
        assertEquals(10, buffer.getInt());
    }

    @Test
    void writePastCapacityLeavesBufferUnchanged() {
        Buffer buffer = new ByteArrayBuffer(6);
        buffer.putShort(7);
        assertThrows(BufferCapacityException.class, () -> buffer.putString("abc"));
        assertEquals(2, buffer.wpos());
        assertThrows(BufferCapacityException.class, () -> buffer.putLong(1L));
        assertEquals(2, buffer.wpos());
        buffer.putInt(9L);
        assertEquals(0, buffer.capacity());
    }

    @Test
    void ownedBytesAreCopied() {
        byte[] data = { 0, 0, 0, 2, 7, 8 };
        Buffer buffer = new ByteArrayBuffer(data);
        byte[] owned = buffer.getBytes();
        assertArrayEquals(new byte[] { 7, 8 }, owned);
        data[4] = 9;
        assertEquals(7, owned[0]);
    }

    @Test
    void bufferViewSharesSourceArray() {
        byte[] data = { 0, 0, 0, 3, 1, 2, 3, 4 };
        Buffer buffer = new ByteArrayBuffer(data);
        Buffer view = buffer.getBufferView();
        assertSame(data, view.array());
        assertEquals(3, view.available());
        assertEquals(7, buffer.rpos());
        data[4] = 5;
        assertEquals(5, view.getByte());
        assertNotSame(data, ByteArrayBuffer.getCompactClone(data, 0, data.length).array());
    }

    @Test
    void negativeItemLengthIsRejected() {
        Buffer buffer = new ByteArrayBuffer(new byte[] { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF });
        BufferException e = assertThrows(BufferException.class, buffer::getBufferView);
        assertEquals("Bad item length: -1", e.getMessage());
        assertEquals(0, buffer.rpos());
    }

    @Test
    void invalidUInt32IsRejected() {
        Buffer buffer = new ByteArrayBuffer(Integer.BYTES);
        assertThrows(IllegalArgumentException.class, () -> buffer.putUInt(-1L));
        assertThrows(IllegalArgumentException.class, () -> buffer.putUInt(BufferUtils.MAX_UINT32_VALUE + 1L));
        buffer.putUInt(BufferUtils.MAX_UINT32_VALUE);
        assertEquals(-1, buffer.getInt());
    }

    @Test
    void hexDump() {
        assertEquals("0a ff", BufferUtils.toHex((byte) 0x0A, (byte) 0xFF));
        assertEquals("0aff", BufferUtils.toHex(BufferUtils.EMPTY_HEX_SEPARATOR, (byte) 0x0A, (byte) 0xFF));
    }
}
