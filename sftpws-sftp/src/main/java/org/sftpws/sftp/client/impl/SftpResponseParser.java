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
package org.sftpws.sftp.client.impl;

import org.sftpws.sftp.common.SftpPacketReader;
import org.sftpws.sftp.common.SftpProtocolException;

/**
 * Interprets the response to a request and completes it.
 *
 * @param <T> Type of result
 */
@FunctionalInterface
public interface SftpResponseParser<T> {
    /**
     * @param  response              The received packet, positioned at its payload
     * @param  request               The request the response belongs to
     * @throws SftpProtocolException If the response violates the protocol
     */
    void parse(SftpPacketReader response, SftpRequest<T> request);
}
