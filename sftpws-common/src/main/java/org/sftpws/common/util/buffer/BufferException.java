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

/**
 * Thrown when a read requires more bytes than remain in a {@link Buffer} (&quot;unexpected end of packet&quot;) or
 * when a length field is negative.
 */
public class BufferException extends RuntimeException {
    private static final long serialVersionUID = 658645233475011039L;

    public BufferException(String message) {
        super(message);
    }
}
