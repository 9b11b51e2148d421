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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.sftpws.common.util.GenericUtils;
import org.sftpws.common.util.buffer.Buffer;
import org.sftpws.sftp.common.SftpConstants;

/**
 * Encodes and decodes the extension pairs exchanged during the version handshake. Known extensions carry a string
 * value, except {@code vendor-id} and {@code newline@vandyke.com} which carry a nested structure. Unknown extensions are
 * returned as raw bytes.
 */
public final class SftpExtensions {
    public static final NavigableSet<String> KNOWN_EXTENSIONS = Collections.unmodifiableNavigableSet(
            new TreeSet<>(Arrays.asList(
                    SftpConstants.EXT_POSIX_RENAME,
                    SftpConstants.EXT_STATVFS,
                    SftpConstants.EXT_FSTATVFS,
                    SftpConstants.EXT_HARDLINK,
                    SftpConstants.EXT_FSYNC,
                    SftpConstants.EXT_NEWLINE,
                    SftpConstants.EXT_NEWLINE_PLAIN,
                    SftpConstants.EXT_NEWLINE_VANDYKE,
                    SftpConstants.EXT_CHARSET,
                    SftpConstants.EXT_METADATA,
                    SftpConstants.EXT_VERSIONS,
                    SftpConstants.EXT_VENDOR_ID)));

    private static final Map<String, ExtensionParser<?>> STRUCTURED_PARSERS;

    static {
        Map<String, ExtensionParser<?>> parsers = new TreeMap<>();
        parsers.put(VendorIdParser.INSTANCE.getName(), VendorIdParser.INSTANCE);
        parsers.put(NewlineParser.INSTANCE.getName(), NewlineParser.INSTANCE);
        STRUCTURED_PARSERS = Collections.unmodifiableMap(parsers);
    }

    private SftpExtensions() {
        throw new UnsupportedOperationException("No instance");
    }

    public static boolean isKnown(String name) {
        return (name != null) && KNOWN_EXTENSIONS.contains(name);
    }

    /**
     * @param  values A comma separated list - may be {@code null}
     * @param  value  The value to look for
     * @return        {@code true} if the list contains the exact value
     */
    public static boolean contains(String values, String value) {
        return ("," + values + ",").contains("," + value + ",");
    }

    public static void write(Buffer buffer, String name, String value) {
        buffer.putString(name);
        buffer.putString(value);
    }

    /**
     * @param  buffer The {@link Buffer} positioned at the extension value
     * @param  name   The extension name
     * @return        A {@link VendorIdParser.VendorId}, a {@link NewlineParser.Newline}, a {@link String} for other
     *                known extensions or a {@code byte[]} for unknown ones
     */
    public static Object read(Buffer buffer, String name) {
        ExtensionParser<?> parser = STRUCTURED_PARSERS.get(name);
        if (parser != null) {
            return parser.parse(buffer);
        }

        if (isKnown(name)) {
            return buffer.getString();
        } else {
            return buffer.getBytes();
        }
    }

    public static boolean isOpenSSHExtension(String name) {
        return GenericUtils.isNotEmpty(name) && name.endsWith(SftpConstants.OPENSSH_EXTENSION_SUFFIX);
    }
}
