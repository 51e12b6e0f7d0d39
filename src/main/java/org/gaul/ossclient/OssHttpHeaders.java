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

final class OssHttpHeaders {
    static final String COPY_SOURCE = "x-oss-copy-source";
    static final String METADATA_DIRECTIVE = "x-oss-metadata-directive";
    static final String REQUEST_ID = "x-oss-request-id";

    /** Query parameters carried by presigned URLs. */
    static final String PARAMETER_ACCESS_KEY_ID = "OSSAccessKeyId";
    static final String PARAMETER_EXPIRES = "Expires";
    static final String PARAMETER_SIGNATURE = "Signature";

    private OssHttpHeaders() {
        throw new AssertionError("intentionally unimplemented");
    }
}
