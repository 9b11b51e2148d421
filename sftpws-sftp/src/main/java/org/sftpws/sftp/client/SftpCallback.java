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

import org.sftpws.sftp.common.SftpException;

/**
 * Receives the outcome of an asynchronous request. Invoked exactly once, either with an error or with the result.
 *
 * @param <T> Result type - {@link Void} for requests that only report success
 */
@FunctionalInterface
public interface SftpCallback<T> {
    /**
     * @param error  The failure - {@code null} if successful
     * @param result The result - {@code null} on failure or if there is no result
     */
    void onComplete(SftpException error, T result);
}
