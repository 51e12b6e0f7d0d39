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
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Options for get. */
public final class GetOptions {
    private static final GetOptions DEFAULT = builder().build();

    private final ImmutableSet<String> metadataKeys;
    private final ImmutableMap<String, String> headers;
    private final Map<String, String> queryParameters;

    private GetOptions(Builder builder) {
        this.metadataKeys = ImmutableSet.copyOf(builder.metadataKeys);
        this.headers = ImmutableMap.copyOf(builder.headers);
        this.queryParameters = Collections.unmodifiableMap(
                new LinkedHashMap<>(builder.queryParameters));
    }

    public static GetOptions defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * User metadata keys to return, without the x-oss-meta- prefix.  Empty
     * means all user metadata.
     */
    public ImmutableSet<String> getMetadataKeys() {
        return metadataKeys;
    }

    public ImmutableMap<String, String> getHeaders() {
        return headers;
    }

    public Map<String, String> getQueryParameters() {
        return queryParameters;
    }

    public static final class Builder {
        private final Set<String> metadataKeys = new LinkedHashSet<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Map<String, String> queryParameters =
                new LinkedHashMap<>();

        Builder() {
        }

        /**
         * Select a user metadata entry, matched case-insensitively and
         * returned under key as given.
         */
        public Builder metadataKey(String key) {
            metadataKeys.add(requireNonNull(key));
            return this;
        }

        /** Extra request header, e.g., Range. */
        public Builder header(String name, String value) {
            headers.put(requireNonNull(name), requireNonNull(value));
            return this;
        }

        /**
         * Query parameter, e.g., response-content-type.  A null value sends a
         * flag parameter.
         */
        public Builder queryParameter(String name, @Nullable String value) {
            queryParameters.put(requireNonNull(name), value);
            return this;
        }

        public GetOptions build() {
            return new GetOptions(this);
        }
    }
}
