/*
 * Copyright 2014-2025 Andrew Gaul <andrew@gaul.org>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gaul.ossclient;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sends one request and buffers its response.  Implementations own
 * connection pooling, TLS and timeouts; they do not retry.
 */
public interface OssTransport extends Closeable {
    /**
     * @throws IOException on connection, TLS or timeout failures; HTTP error
     *     statuses are returned as responses
     */
    OssResponse execute(OssRequest request) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
