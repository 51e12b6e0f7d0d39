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

import com.google.common.base.CharMatcher;

/** Scheme and host of the service; buckets are addressed as subdomains. */
final class OssEndpoint {
    private static final String HTTPS = "https://";
    private static final String HTTP = "http://";

    private final boolean secure;
    private final String host;

    private OssEndpoint(boolean secure, String host) {
        this.secure = secure;
        this.host = requireNonNull(host);
    }

    /** Parse [http://|https://]host[:port]; no scheme means HTTP. */
    static OssEndpoint parse(String endpoint) {
        requireNonNull(endpoint, "endpoint");
        boolean secure;
        String host;
        if (endpoint.startsWith(HTTPS)) {
            secure = true;
            host = endpoint.substring(HTTPS.length());
        } else if (endpoint.startsWith(HTTP)) {
            secure = false;
            host = endpoint.substring(HTTP.length());
        } else {
            secure = false;
            host = endpoint;
        }
        host = CharMatcher.is('/').trimTrailingFrom(host);
        checkArgument(!host.isEmpty(), "endpoint must name a host, was: %s",
                endpoint);
        checkArgument(host.indexOf('/') < 0,
                "endpoint path must be empty, was: %s", endpoint);
        return new OssEndpoint(secure, host);
    }

    boolean isSecure() {
        return secure;
    }

    String getHost() {
        return host;
    }

    /**
     * Virtual-hosted URL.  Bucket, key and query are inserted verbatim;
     * escaping them is the caller's responsibility.
     */
    String url(String bucket, String objectKey, String query) {
        StringBuilder builder = new StringBuilder()
                .append(secure ? HTTPS : HTTP);
        if (!bucket.isEmpty()) {
            builder.append(bucket).append('.');
        }
        builder.append(host).append('/').append(objectKey);
        if (!query.isEmpty()) {
            builder.append('?').append(query);
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return (secure ? HTTPS : HTTP) + host;
    }
}
