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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Projects request query parameters onto the sub-resources which OSS includes
 * in the signature.  Parameters outside {@link #SIGNED_SUBRESOURCES} still
 * travel in the URL but do not affect the signature.
 */
final class CanonicalResource {
    static final Set<String> SIGNED_SUBRESOURCES = ImmutableSet.of(
            "acl",
            "uploads",
            "location",
            "cors",
            "logging",
            "website",
            "referer",
            "lifecycle",
            "delete",
            "append",
            "tagging",
            "objectMeta",
            "uploadId",
            "partNumber",
            "security-token",
            "position",
            "img",
            "style",
            "styleName",
            "replication",
            "replicationProgress",
            "replicationLocation",
            "cname",
            "bucketInfo",
            "comp",
            "qos",
            "live",
            "status",
            "vod",
            "startTime",
            "endTime",
            "symlink",
            "x-oss-process",
            "response-content-type",
            "response-content-language",
            "response-expires",
            "response-cache-control",
            "response-content-disposition",
            "response-content-encoding",
            "udf",
            "udfName",
            "udfImage",
            "udfId",
            "udfImageDesc",
            "udfApplication",
            "udfApplicationLog",
            "restore",
            "callback",
            "callback-var",
            "continuation-token"
    );

    private CanonicalResource() { }

    /**
     * Render the signed sub-resources of params as k1=v1&amp;k2&amp;k3=v3,
     * sorted by name.  A null value denotes a flag parameter which contributes
     * only its name.
     */
    static String canonicalize(Map<String, String> params) {
        List<String> subresources = new ArrayList<>();
        for (String name : params.keySet()) {
            if (SIGNED_SUBRESOURCES.contains(name)) {
                subresources.add(name);
            }
        }
        Collections.sort(subresources);

        StringBuilder builder = new StringBuilder();
        for (String subresource : subresources) {
            if (builder.length() > 0) {
                builder.append('&');
            }
            builder.append(subresource);
            String value = params.get(subresource);
            if (value != null) {
                builder.append('=').append(value);
            }
        }
        return builder.toString();
    }

    /**
     * Render all params in iteration order, the form used in the request URL.
     */
    static String queryString(Map<String, String> params) {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (builder.length() > 0) {
                builder.append('&');
            }
            builder.append(entry.getKey());
            if (entry.getValue() != null) {
                builder.append('=').append(entry.getValue());
            }
        }
        return builder.toString();
    }
}
