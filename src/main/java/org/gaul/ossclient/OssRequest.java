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

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

/** A fully addressed and signed request, ready for an {@link OssTransport}. */
public final class OssRequest {
    private final String method;
    private final String url;
    private final ImmutableListMultimap<String, String> headers;
    @Nullable private final byte[] body;

    OssRequest(String method, String url, ListMultimap<String, String> headers,
            @Nullable byte[] body) {
        this.method = requireNonNull(method);
        this.url = requireNonNull(url);
        this.headers = ImmutableListMultimap.copyOf(headers);
        this.body = body;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public ImmutableListMultimap<String, String> getHeaders() {
        return headers;
    }

    /** Request payload; only PUT requests carry one. */
    @Nullable
    public byte[] getBody() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
