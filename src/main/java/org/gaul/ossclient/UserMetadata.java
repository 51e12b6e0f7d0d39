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

import static org.gaul.ossclient.OssClientConstants.USER_METADATA_PREFIX;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;

/** Maps user metadata to and from x-oss-meta- headers. */
final class UserMetadata {
    private UserMetadata() { }

    static ListMultimap<String, String> toHeaders(Map<String, String> metadata) {
        var builder = ImmutableListMultimap.<String, String>builder();
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            builder.put(USER_METADATA_PREFIX + entry.getKey(),
                    entry.getValue());
        }
        return builder.build();
    }

    /**
     * Extract user metadata from response headers.  Keys are lower-cased since
     * HTTP header names are case-insensitive; repeated headers keep their
     * first value.
     */
    static Map<String, String> fromHeaders(Multimap<String, String> headers) {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, Collection<String>> entry :
                headers.asMap().entrySet()) {
            String headerName = entry.getKey().toLowerCase(Locale.ROOT);
            if (!headerName.startsWith(USER_METADATA_PREFIX) ||
                    entry.getValue().isEmpty()) {
                continue;
            }
            metadata.putIfAbsent(
                    headerName.substring(USER_METADATA_PREFIX.length()),
                    entry.getValue().iterator().next());
        }
        return ImmutableMap.copyOf(metadata);
    }
}
