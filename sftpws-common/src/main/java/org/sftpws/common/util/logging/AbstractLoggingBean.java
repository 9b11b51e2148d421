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
package org.sftpws.common.util.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves as a common base class for the classes that require some kind of logging.
 */
public abstract class AbstractLoggingBean {
    protected final Logger log;

    /**
     * Default constructor - creates a logger using the full class name
     */
    protected AbstractLoggingBean() {
        log = LoggerFactory.getLogger(getClass());
    }

    protected void debug(String message, Object o1, Object o2, Throwable t) {
        LoggingUtils.debug(log, message, o1, o2, t);
    }

    protected void debug(String message, Object o1, Object o2, Object o3, Throwable t) {
        LoggingUtils.debug(log, message, o1, o2, o3, t);
    }

    protected void warn(String message, Object o1, Object o2, Throwable t) {
        LoggingUtils.warn(log, message, o1, o2, t);
    }

    protected void warn(String message, Object o1, Object o2, Object o3, Throwable t) {
        LoggingUtils.warn(log, message, o1, o2, o3, t);
    }
}
