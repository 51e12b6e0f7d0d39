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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

/** Options for put and copy. */
public final class PutOptions {
    private static final PutOptions DEFAULT = builder().build();

    @Nullable private final String contentType;
    private final ImmutableMap<String, String> userMetadata;
    private final ImmutableMap<String, String> headers;
    private final Map<String, String> queryParameters;
    private final boolean contentMd5;

    private PutOptions(Builder builder) {
        this.contentType = builder.contentType;
        this.userMetadata = ImmutableMap.copyOf(builder.userMetadata);
        this.headers = ImmutableMap.copyOf(builder.headers);
        this.queryParameters = Collections.unmodifiableMap(
                new LinkedHashMap<>(builder.queryParameters));
        this.contentMd5 = builder.contentMd5;
    }

    public static PutOptions defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getContentType() {
        return Optional.ofNullable(contentType);
    }

    /** User metadata keys without the x-oss-meta- prefix. */
    public ImmutableMap<String, String> getUserMetadata() {
        return userMetadata;
    }

    public ImmutableMap<String, String> getHeaders() {
        return headers;
    }

    /** Query parameters in URL order; null values are flag parameters. */
    public Map<String, String> getQueryParameters() {
        return queryParameters;
    }

    public boolean isContentMd5() {
        return contentMd5;
    }

    public static final class Builder {
        @Nullable private String contentType;
        private final Map<String, String> userMetadata = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> queryParameters =
                new LinkedHashMap<>();
        private boolean contentMd5;

        Builder() {
        }

        public Builder contentType(String contentType) {
            this.contentType = requireNonNull(contentType);
            return this;
        }

        /**
         * Sent as x-oss-meta-key.  Values must be printable ASCII; anything
         * else fails the request with an ENCODING error.
         */
        public Builder userMetadata(String key, String value) {
            userMetadata.put(requireNonNull(key), requireNonNull(value));
            return this;
        }

        public Builder userMetadata(Map<String, String> userMetadata) {
            for (Map.Entry<String, String> entry : userMetadata.entrySet()) {
                userMetadata(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(requireNonNull(name), requireNonNull(value));
            return this;
        }

        public Builder queryParameter(String name, @Nullable String value) {
            queryParameters.put(requireNonNull(name), value);
            return this;
        }

        /** Send a Content-MD5 header computed from the payload. */
        public Builder contentMd5(boolean contentMd5) {
            this.contentMd5 = contentMd5;
            return this;
        }

        public PutOptions build() {
            return new PutOptions(this);
        }
    }
}
