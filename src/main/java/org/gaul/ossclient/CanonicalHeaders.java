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

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;

/** Signature-relevant projection of a request's headers. */
final class CanonicalHeaders {
    private static final Joiner VALUE_JOINER = Joiner.on(',');

    private CanonicalHeaders() { }

    /**
     * Lower-cased x-oss- headers sorted by name, one name:value line each.
     * Values of headers which collide after lower-casing are comma-joined in
     * their original order.
     */
    static String canonicalize(Multimap<String, String> headers) {
        ListMultimap<String, String> canonicalizedHeaders =
                MultimapBuilder.treeKeys().arrayListValues().build();
        for (Map.Entry<String, String> entry : headers.entries()) {
            String headerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (!headerName.startsWith(OssClientConstants.OSS_HEADER_PREFIX)) {
                continue;
            }
            canonicalizedHeaders.put(headerName,
                    Strings.nullToEmpty(entry.getValue()));
        }

        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, Collection<String>> entry :
                canonicalizedHeaders.asMap().entrySet()) {
            builder.append(entry.getKey()).append(':')
                    .append(VALUE_JOINER.join(entry.getValue())).append('\n');
        }
        return builder.toString();
    }

    /** First value of a header, matching its name case-insensitively. */
    @Nullable
    static String getFirst(Multimap<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entries()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
