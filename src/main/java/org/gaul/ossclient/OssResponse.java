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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimap;

/**
 * Status, headers and buffered body returned by an {@link OssTransport}.
 * Header names are lower-cased so lookups are case-insensitive.
 */
public final class OssResponse {
    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final String reason;
    private final ImmutableListMultimap<String, String> headers;
    private final byte[] body;

    public OssResponse(int statusCode, String reason,
            Multimap<String, String> headers, byte[] body) {
        this.statusCode = statusCode;
        this.reason = Strings.nullToEmpty(reason);
        var builder = ImmutableListMultimap.<String, String>builder();
        for (Map.Entry<String, String> entry : headers.entries()) {
            builder.put(entry.getKey().toLowerCase(Locale.ROOT),
                    entry.getValue());
        }
        this.headers = builder.build();
        this.body = body == null ? EMPTY : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public ImmutableListMultimap<String, String> getHeaders() {
        return headers;
    }

    public List<String> getHeaders(String name) {
        return headers.get(requireNonNull(name).toLowerCase(Locale.ROOT));
    }

    public byte[] getBody() {
        return body;
    }
}
