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

public final class OssClientConstants {
    /**
     * Service endpoint, e.g., https://oss-cn-hangzhou.aliyuncs.com.  A
     * missing scheme means plain HTTP.
     */
    public static final String PROPERTY_ENDPOINT =
            "oss.endpoint";
    public static final String PROPERTY_BUCKET =
            "oss.bucket";
    public static final String PROPERTY_IDENTITY =
            "oss.identity";
    public static final String PROPERTY_CREDENTIAL =
            "oss.credential";
    /** Connect timeout in milliseconds. */
    public static final String PROPERTY_CONNECT_TIMEOUT =
            "oss.connect-timeout";
    /** Timeout for a whole request and response exchange in milliseconds. */
    public static final String PROPERTY_REQUEST_TIMEOUT =
            "oss.request-timeout";
    /** Largest response body the transport will buffer, in bytes. */
    public static final String PROPERTY_MAX_RESPONSE_SIZE =
            "oss.max-response-size";

    /** Prefix marking user metadata headers on both requests and responses. */
    public static final String USER_METADATA_PREFIX = "x-oss-meta-";
    /** Prefix of provider headers which participate in signing. */
    static final String OSS_HEADER_PREFIX = "x-oss-";

    private OssClientConstants() {
        throw new AssertionError("Cannot instantiate utility constructor");
    }
}
