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
import java.util.Objects;

import org.sftpws.common.util.ValidateUtils;
import org.sftpws.common.util.buffer.Buffer;

/**
 * SFTP v3 file attributes: a presence mask followed by the fields whose bit is set, in the order size, uid and gid,
 * permissions, access and modification times (seconds).
 */
public class SftpAttributes implements FileStats {
    private int flags;
    private Long size;
    private Integer uid;
    private Integer gid;
    private Integer permissions;
    private Instant accessTime;
    private Instant modifyTime;
    private Integer linkCount;

    public SftpAttributes() {
        super();
    }

    /**
     * Decodes attributes from the current read position. Extended type/data pairs are skipped.
     *
     * @param  buffer The {@link Buffer} to read from
     * @return        The decoded attributes
     */
    public static SftpAttributes decode(Buffer buffer) {
        SftpAttributes attrs = new SftpAttributes();
        int flags = buffer.getInt();
        attrs.flags = flags;

        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_SIZE) != 0) {
            attrs.size = buffer.getUInt64();
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_UIDGID) != 0) {
            attrs.uid = buffer.getInt();
            attrs.gid = buffer.getInt();
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_PERMISSIONS) != 0) {
            attrs.permissions = buffer.getInt();
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_ACMODTIME) != 0) {
            attrs.accessTime = Instant.ofEpochSecond(buffer.getUInt());
            attrs.modifyTime = Instant.ofEpochSecond(buffer.getUInt());
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_EXTENDED) != 0) {
            long count = buffer.getUInt();
            for (long index = 0L; index < count; index++) {
                buffer.skipString(); // type
                buffer.skipString(); // data
            }
        }

        return attrs;
    }

    /**
     * Builds the attributes to send from generic metadata. A missing uid or gid is sent as 0.
     *
     * @param  stats                    The metadata - may be {@code null} for &quot;no attributes&quot;
     * @return                          The attributes
     * @throws IllegalArgumentException If the size is negative or only one of the access and modification times is
     *                                  set
     */
    public static SftpAttributes from(FileStats stats) {
        SftpAttributes attrs = new SftpAttributes();
        if (stats == null) {
            return attrs;
        }

        int flags = 0;
        Long statsSize = stats.getSize();
        if (statsSize != null) {
            ValidateUtils.checkTrue(statsSize >= 0L, "Negative size: %d", statsSize.longValue());
            flags |= SftpConstants.SSH_FILEXFER_ATTR_SIZE;
            attrs.size = statsSize;
        }

        Integer statsUid = stats.getUid();
        Integer statsGid = stats.getGid();
        if ((statsUid != null) || (statsGid != null)) {
            flags |= SftpConstants.SSH_FILEXFER_ATTR_UIDGID;
            attrs.uid = (statsUid == null) ? 0 : statsUid;
            attrs.gid = (statsGid == null) ? 0 : statsGid;
        }

        Integer perms = stats.getPermissions();
        if (perms != null) {
            flags |= SftpConstants.SSH_FILEXFER_ATTR_PERMISSIONS;
            attrs.permissions = perms;
        }

        Instant atime = stats.getAccessTime();
        Instant mtime = stats.getModifyTime();
        if ((atime != null) || (mtime != null)) {
            ValidateUtils.checkTrue((atime != null) && (mtime != null),
                    "Access and modification times must be set together: atime=%s, mtime=%s", atime, mtime);
            flags |= SftpConstants.SSH_FILEXFER_ATTR_ACMODTIME;
            attrs.accessTime = atime;
            attrs.modifyTime = mtime;
        }

        attrs.linkCount = stats.getLinkCount();
        attrs.flags = flags;
        return attrs;
    }

    /**
     * Writes the mask and the fields it selects. If the extended bit is set an empty extended section is written.
     *
     * @param buffer The {@link Buffer} to write to
     */
    public void encode(Buffer buffer) {
        buffer.putInt(flags);

        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_SIZE) != 0) {
            buffer.putLong(valueOf(size, "size"));
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_UIDGID) != 0) {
            buffer.putInt(valueOf(uid, "uid"));
            buffer.putInt(valueOf(gid, "gid"));
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_PERMISSIONS) != 0) {
            buffer.putInt(valueOf(permissions, "permissions"));
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_ACMODTIME) != 0) {
            buffer.putUInt(valueOf(accessTime, "accessTime").getEpochSecond());
            buffer.putUInt(valueOf(modifyTime, "modifyTime").getEpochSecond());
        }
        if ((flags & SftpConstants.SSH_FILEXFER_ATTR_EXTENDED) != 0) {
            buffer.putInt(0L);
        }
    }

    private static <T> T valueOf(T value, String name) {
        return ValidateUtils.checkNotNull(value, "Flagged attribute has no value: %s", name);
    }

    /**
     * @return The {@code SSH_FILEXFER_ATTR_XXX} presence mask
     */
    public int getFlags() {
        return flags;
    }

    /**
     * Clears the presence mask. The field values are kept.
     */
    public void clearFlags() {
        flags = 0;
    }

    /**
     * Sets the extended bit, so that an empty extended section is written
     */
    public SftpAttributes withExtended() {
        flags |= SftpConstants.SSH_FILEXFER_ATTR_EXTENDED;
        return this;
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
        return linkCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(flags, size, uid, gid, permissions, accessTime, modifyTime);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if ((obj == null) || (obj.getClass() != getClass())) {
            return false;
        }

        SftpAttributes other = (SftpAttributes) obj;
        return (flags == other.flags)
                && Objects.equals(size, other.size)
                && Objects.equals(uid, other.uid)
                && Objects.equals(gid, other.gid)
                && Objects.equals(permissions, other.permissions)
                && Objects.equals(accessTime, other.accessTime)
                && Objects.equals(modifyTime, other.modifyTime);
    }

    @Override
    public String toString() {
        return "flags=0x" + Integer.toHexString(flags)
               + ", size=" + size
               + ", uid=" + uid
               + ", gid=" + gid
               + ", permissions=" + ((permissions == null) ? null : Integer.toOctalString(permissions))
               + ", atime=" + accessTime
               + ", mtime=" + modifyTime;
    }
}
