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

/**
 * The envelope of an SFTP packet: {@code uint32 length}, {@code byte type}, {@code uint32 id} (absent for
 * {@code SSH_FXP_INIT} and {@code SSH_FXP_VERSION}) and, for {@code SSH_FXP_EXTENDED}, the extension name.
 */
public interface SftpPacket {
    /**
     * Identifier of unnumbered packets
     */
    long NO_ID = -1L;

    /**
     * Size of the length prefix plus the type byte
     */
    int HEADER_LENGTH = Integer.BYTES + Byte.BYTES;

    /**
     * @return The {@code SSH_FXP_XXX} opcode
     */
    int getType();

    /**
     * @return The extension name for {@code SSH_FXP_EXTENDED} packets - {@code null} otherwise
     */
    String getExtendedType();

    /**
     * @return The unsigned 32-bit request identifier - {@link #NO_ID} for unnumbered packets
     */
    long getId();

    default String getTypeName() {
        String extType = getExtendedType();
        return (extType == null) ? SftpConstants.getCommandMessageName(getType()) : extType;
    }

    static boolean isNumbered(int type) {
        return (type != SftpConstants.SSH_FXP_INIT) && (type != SftpConstants.SSH_FXP_VERSION);
    }
}
