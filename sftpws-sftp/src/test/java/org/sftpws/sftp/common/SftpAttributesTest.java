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

import java.time.Instant;

import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.sftpws.common.util.buffer.ByteArrayBuffer;
import org.sftpws.util.test.JUnitTestSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="mailto:dev@sftpws.org">SFTP-WS Project</a>
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class SftpAttributesTest extends JUnitTestSupport {
    public SftpAttributesTest() {
        super();
    }

    @Test
    void emptyAttributesEncodeAsMaskOnly() {
        ByteArrayBuffer buffer = new ByteArrayBuffer(16);
        SftpAttributes.from(null).encode(buffer);
        assertEquals(Integer.BYTES, buffer.available());
        assertEquals(0, buffer.getInt());
    }

    @Test
    void fieldsFollowPresenceMask() {
        Stats stats = new Stats();
        stats.size = 0x1_0000_0001L;
        stats.permissions = SftpConstants.S_IFREG | 0644;
        stats.accessTime = Instant.ofEpochSecond(1_500_000_000L);
        stats.modifyTime = Instant.ofEpochSecond(1_600_000_000L);

        SftpAttributes attrs = SftpAttributes.from(stats);
        assertEquals(SftpConstants.SSH_FILEXFER_ATTR_SIZE
                     | SftpConstants.SSH_FILEXFER_ATTR_PERMISSIONS
                     | SftpConstants.SSH_FILEXFER_ATTR_ACMODTIME,
                attrs.getFlags());

        ByteArrayBuffer buffer = new ByteArrayBuffer(64);
        attrs.encode(buffer);
        assertEquals(attrs.getFlags(), buffer.getInt());
        assertEquals(1L, buffer.getUInt()); // size high word
        assertEquals(1L, buffer.getUInt()); // size low word
        assertEquals(SftpConstants.S_IFREG | 0644, buffer.getInt());
        assertEquals(1_500_000_000L, buffer.getUInt());
        assertEquals(1_600_000_000L, buffer.getUInt());
        assertEquals(0, buffer.available());

        buffer.rpos(0);
        assertEquals(attrs, SftpAttributes.decode(buffer));
    }

    @Test
    void missingOwnerDefaultsToZero() {
        Stats stats = new Stats();
        stats.uid = 1000;

        SftpAttributes attrs = SftpAttributes.from(stats);
        assertEquals(SftpConstants.SSH_FILEXFER_ATTR_UIDGID, attrs.getFlags());
        assertEquals(Integer.valueOf(1000), attrs.getUid());
        assertEquals(Integer.valueOf(0), attrs.getGid());
    }

    @Test
    void timesMustBeSetTogether() {
        Stats mtimeOnly = new Stats();
        mtimeOnly.modifyTime = Instant.ofEpochSecond(1000L);
        assertThrows(IllegalArgumentException.class, () -> SftpAttributes.from(mtimeOnly));

        Stats atimeOnly = new Stats();
        atimeOnly.accessTime = Instant.ofEpochSecond(1000L);
        assertThrows(IllegalArgumentException.class, () -> SftpAttributes.from(atimeOnly));
    }

    @Test
    void negativeSizeIsRejected() {
        Stats stats = new Stats();
        stats.size = -1L;
        assertThrows(IllegalArgumentException.class, () -> SftpAttributes.from(stats));
    }

    @Test
    void hugeSizeIsNotSupported() {
        ByteArrayBuffer buffer = new ByteArrayBuffer(16);
        buffer.putInt(SftpConstants.SSH_FILEXFER_ATTR_SIZE);
        buffer.putUInt(0x80000000L);
        buffer.putUInt(0L);
        assertThrows(ArithmeticException.class, () -> SftpAttributes.decode(buffer));
    }

    @Test
    void extendedPairsAreSkipped() {
        ByteArrayBuffer buffer = new ByteArrayBuffer(128);
        buffer.putInt(SftpConstants.SSH_FILEXFER_ATTR_PERMISSIONS | SftpConstants.SSH_FILEXFER_ATTR_EXTENDED);
        buffer.putInt(SftpConstants.S_IFDIR | 0755);
        buffer.putInt(2L);
        buffer.putString("acl@example.com");
        buffer.putString("data");
        buffer.putString("mime@example.com");
        buffer.putString("text/plain");
        buffer.putString("trailer");

        SftpAttributes attrs = SftpAttributes.decode(buffer);
        assertTrue(attrs.isDirectory());
        assertNull(attrs.getSize());
        assertEquals("trailer", buffer.getString());
    }

    @Test
    void extendedFlagWritesEmptySection() {
        ByteArrayBuffer buffer = new ByteArrayBuffer(16);
        SftpAttributes.from(null).withExtended().encode(buffer);
        assertEquals(SftpConstants.SSH_FILEXFER_ATTR_EXTENDED, buffer.getInt());
        assertEquals(0L, buffer.getUInt());
        assertEquals(0, buffer.available());
    }

    @Test
    void clearedMaskKeepsValues() {
        Stats stats = new Stats();
        stats.size = 10L;
        SftpAttributes attrs = SftpAttributes.from(stats);
        attrs.clearFlags();
        assertEquals(0, attrs.getFlags());
        assertEquals(Long.valueOf(10L), attrs.getSize());
    }

    @Test
    void fileTypePredicates() {
        Stats stats = new Stats();
        assertFalse(stats.isRegularFile());

        stats.permissions = SftpConstants.S_IFLNK | 0777;
        assertTrue(stats.isSymbolicLink());
        assertFalse(stats.isDirectory());
        assertFalse(stats.isRegularFile());

        stats.permissions = SftpConstants.S_IFREG | 0600;
        assertTrue(stats.isRegularFile());
        assertTrue(stats.isFileType(SftpConstants.S_IFREG));
    }

    private static class Stats implements FileStats {
        Long size;
        Integer uid;
        Integer gid;
        Integer permissions;
        Instant accessTime;
        Instant modifyTime;

        Stats() {
            super();
        }

        @Override
        public Long getSize() {
            return size;
        }

        @Override
        public Integer getUid() {
            return uid;
        }

        @Override
        public Integer getGid() {
            return gid;
        }

        @Override
        public Integer getPermissions() {
            return permissions;
        }

        @Override
        public Instant getAccessTime() {
            return accessTime;
        }

        @Override
        public Instant getModifyTime() {
            return modifyTime;
        }

        @Override
        public Integer getLinkCount() {
            return null;
        }
    }
}
