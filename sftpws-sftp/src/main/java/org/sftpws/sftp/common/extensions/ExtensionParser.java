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

import org.sftpws.common.NamedResource;
import org.sftpws.common.util.buffer.Buffer;

/**
 * Decodes the value of a server extension announced in {@code SSH_FXP_VERSION}.
 *
 * @param <T> Result type
 */
public interface ExtensionParser<T> extends NamedResource {
    /**
     * @param  buffer The {@link Buffer} positioned at the extension value
     * @return        The decoded value
     */
    T parse(Buffer buffer);
}
