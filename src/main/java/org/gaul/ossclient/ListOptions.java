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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import javax.annotation.Nullable;

import com.google.common.base.Strings;

/**
 * Options for a V2 object listing.  Every field is optional; unset fields are
 * omitted from the request so the service applies its own defaults.
 */
public final class ListOptions {
    static final int MAX_KEYS_LIMIT = 1000;

    private static final ListOptions DEFAULT = builder().build();

    @Nullable private final String prefix;
    @Nullable private final String marker;
    @Nullable private final String delimiter;
    private final int maxKeys;

    private ListOptions(Builder builder) {
        this.prefix = builder.prefix;
        this.marker = builder.marker;
        this.delimiter = builder.delimiter;
        this.maxKeys = builder.maxKeys;
    }

    public static ListOptions defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.prefix = prefix;
        builder.marker = marker;
        builder.delimiter = delimiter;
        builder.maxKeys = maxKeys;
        return builder;
    }

    public Optional<String> getPrefix() {
        return Optional.ofNullable(prefix);
    }

    /** Continuation token from {@link ListPage#getNextMarker()}. */
    public Optional<String> getMarker() {
        return Optional.ofNullable(marker);
    }

    public Optional<String> getDelimiter() {
        return Optional.ofNullable(delimiter);
    }

    public OptionalInt getMaxKeys() {
        return maxKeys == 0 ? OptionalInt.empty() : OptionalInt.of(maxKeys);
    }

    /**
     * Query parameters of the request, in the order they appear in the URL.
     * Only continuation-token is a signed sub-resource.
     */
    Map<String, String> toQueryParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("list-type", "2");
        if (marker != null) {
            params.put("continuation-token", marker);
        }
        if (delimiter != null) {
            params.put("delimiter", delimiter);
        }
        if (maxKeys != 0) {
            params.put("max-keys", String.valueOf(maxKeys));
        }
        if (prefix != null) {
            params.put("prefix", prefix);
        }
        return Collections.unmodifiableMap(params);
    }

    public static final class Builder {
        @Nullable private String prefix;
        @Nullable private String marker;
        @Nullable private String delimiter;
        private int maxKeys;

        Builder() {
        }

        /** Empty strings clear the prefix. */
        public Builder prefix(String prefix) {
            this.prefix = Strings.emptyToNull(requireNonNull(prefix));
            return this;
        }

        /** Empty strings clear the marker, restarting from the first page. */
        public Builder marker(String marker) {
            this.marker = Strings.emptyToNull(requireNonNull(marker));
            return this;
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = Strings.emptyToNull(requireNonNull(delimiter));
            return this;
        }

        public Builder maxKeys(int maxKeys) {
            checkArgument(maxKeys > 0 && maxKeys <= MAX_KEYS_LIMIT,
                    "max-keys must be between 1 and %s, was: %s",
                    MAX_KEYS_LIMIT, maxKeys);
            this.maxKeys = maxKeys;
            return this;
        }

        public ListOptions build() {
            return new ListOptions(this);
        }
    }
}
