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
package org.sftpws.sftp.client;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.sftpws.common.util.buffer.BufferUtils;
import org.sftpws.sftp.common.FileStats;
import org.sftpws.sftp.common.SftpAttributes;
import org.sftpws.sftp.common.SftpConstants;

/**
 * Asynchronous SFTP version 3 client. Every operation reports its outcome through an {@link SftpCallback}; argument
 * errors are thrown immediately as {@link IllegalArgumentException}s.
 */
public interface SftpClient {
    /**
     * A file or directory handle returned by the server. Only valid for the client that opened it.
     */
    class Handle {
        private final byte[] id;
        private final SftpClient owner;

        public Handle(byte[] id, SftpClient owner) {
            this.id = Objects.requireNonNull(id, "No handle identifier");
            this.owner = Objects.requireNonNull(owner, "No owner");
        }

        /**
         * @return The raw handle bytes - must not be modified
         */
        public byte[] getIdentifier() {
            return id;
        }

        public SftpClient getOwner() {
            return owner;
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(id);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (!(obj instanceof Handle)) {
                return false;
            }

            Handle other = (Handle) obj;
            return (owner == other.owner) && Arrays.equals(id, other.id);
        }

        @Override
        public String toString() {
            return "0x" + BufferUtils.toHex(id, 0, id.length, BufferUtils.EMPTY_HEX_SEPARATOR);
        }
    }

    class DirEntry {
        private final String filename;
        private final String longFilename;
        private final SftpAttributes attributes;

        public DirEntry(String filename, String longFilename, SftpAttributes attributes) {
            this.filename = filename;
            this.longFilename = longFilename;
            this.attributes = attributes;
        }

        public String getFilename() {
            return filename;
        }

        public String getLongFilename() {
            return longFilename;
        }

        public SftpAttributes getAttributes() {
            return attributes;
        }

        @Override
        public String toString() {
            return getFilename() + "[" + getLongFilename() + "]: " + getAttributes();
        }
    }

    /**
     * Outcome of a read: the buffer holding the data and the number of bytes read into it.
     */
    class ReadResult {
        private final byte[] buffer;
        private final int bytesRead;

        public ReadResult(byte[] buffer, int bytesRead) {
            this.buffer = buffer;
            this.bytesRead = bytesRead;
        }

        /**
         * @return The caller's buffer if one was supplied, otherwise a new array holding exactly the data read
         */
        public byte[] getBuffer() {
            return buffer;
        }

        /**
         * @return Number of bytes read - zero at end of file
         */
        public int getBytesRead() {
            return bytesRead;
        }
    }

    /**
     * @return {@code true} once the version handshake has completed
     */
    boolean isReady();

    /**
     * @return The extensions announced by the server - empty until the handshake completes
     */
    Map<String, Object> getServerExtensions();

    long getBytesSent();

    long getBytesReceived();

    void open(String path, String mode, FileStats attrs, SftpCallback<Handle> callback);

    void open(String path, int flags, FileStats attrs, SftpCallback<Handle> callback);

    void close(Handle handle, SftpCallback<Void> callback);

    /**
     * @param handle   The file handle
     * @param buffer   The buffer to read into - if {@code null} a new array is allocated
     * @param offset   Offset in the buffer
     * @param length   Requested length - shortened to the maximum read block length
     * @param position Position in the file
     * @param callback Receives the {@link ReadResult}
     */
    void read(Handle handle, byte[] buffer, int offset, int length, long position, SftpCallback<ReadResult> callback);

    /**
     * @param  handle                   The file handle
     * @param  buffer                   The data
     * @param  offset                   Offset of the data in the buffer
     * @param  length                   Number of bytes to write
     * @param  position                 Position in the file
     * @param  callback                 Receives the outcome
     * @throws IllegalArgumentException If the length exceeds the maximum write block length
     */
    void write(Handle handle, byte[] buffer, int offset, int length, long position, SftpCallback<Void> callback);

    void lstat(String path, SftpCallback<SftpAttributes> callback);

    void stat(String path, SftpCallback<SftpAttributes> callback);

    void fstat(Handle handle, SftpCallback<SftpAttributes> callback);

    void setstat(String path, FileStats attrs, SftpCallback<Void> callback);

    void fsetstat(Handle handle, FileStats attrs, SftpCallback<Void> callback);

    void opendir(String path, SftpCallback<Handle> callback);

    /**
     * @param handle   The directory handle
     * @param callback Receives the next batch of entries - an empty list once the listing is exhausted
     */
    void readdir(Handle handle, SftpCallback<List<DirEntry>> callback);

    void unlink(String path, SftpCallback<Void> callback);

    void mkdir(String path, FileStats attrs, SftpCallback<Void> callback);

    void rmdir(String path, SftpCallback<Void> callback);

    void realpath(String path, SftpCallback<String> callback);

    void readlink(String path, SftpCallback<String> callback);

    default void rename(String oldPath, String newPath, SftpCallback<Void> callback) {
        rename(oldPath, newPath, SftpConstants.SSH_FXP_RENAME_NONE, callback);
    }

    /**
     * @param oldPath  Existing path
     * @param newPath  New path
     * @param flags    {@code SSH_FXP_RENAME_NONE}, or {@code SSH_FXP_RENAME_OVERWRITE} if the server supports
     *                 {@code posix-rename@openssh.com} - other flags are reported as unsupported
     * @param callback Receives the outcome
     */
    void rename(String oldPath, String newPath, int flags, SftpCallback<Void> callback);

    void symlink(String targetPath, String linkPath, SftpCallback<Void> callback);

    /**
     * Creates a hard link - requires the {@code hardlink@openssh.com} extension
     *
     * @param oldPath  Existing path
     * @param newPath  Link path
     * @param callback Receives the outcome
     */
    void link(String oldPath, String newPath, SftpCallback<Void> callback);

    /**
     * Opens the directory, reads all its entries and closes it.
     *
     * @param path     Directory path
     * @param callback Receives the entries - on failure the entries read so far accompany the error
     */
    void list(String path, SftpCallback<List<DirEntry>> callback);

    /**
     * Creates or truncates the file and writes the data in chunks of the maximum write block length.
     *
     * @param path     File path
     * @param data     File content
     * @param callback Invoked once the file has been closed
     */
    void upload(String path, byte[] data, SftpCallback<Void> callback);

    /**
     * Closes the channel and fails every pending request with a connection-lost error
     */
    void end();
}
