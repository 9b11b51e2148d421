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
package org.sftpws.sftp.common.extensions;

import org.sftpws.common.util.ValidateUtils;
import org.sftpws.common.util.buffer.Buffer;
import org.sftpws.sftp.common.SftpPacketReader;

/**
 * @param <T> Parse result type
 */
public abstract class AbstractParser<T> implements ExtensionParser<T> {
    private final String name;

    protected AbstractParser(String name) {
        this.name = ValidateUtils.checkNotNullAndNotEmpty(name, "No extension name");
    }

    @Override
    public final String getName() {
        return name;
    }

    /**
     * @param  buffer The {@link Buffer} positioned at an opaque data item
     * @return        An envelope-less reader over the item's bytes
     */
    protected static SftpPacketReader toStructuredReader(Buffer buffer) {
        if (buffer instanceof SftpPacketReader) {
            return ((SftpPacketReader) buffer).getStructuredData();
        }

        Buffer view = buffer.getBufferView();
        return new SftpPacketReader(view.array(), view.rpos(), view.available(), true);
    }

    @Override
    public String toString() {
        return getName();
    }
}
