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

/** Client operations and the error kind each reports on a non-2xx status. */
enum OssOperation {
    GET_OBJECT("GET", "get object", OssErrorKind.GET_ERROR),
    PUT_OBJECT("PUT", "put object", OssErrorKind.PUT_ERROR),
    COPY_OBJECT("PUT", "copy object", OssErrorKind.COPY_ERROR),
    DELETE_OBJECT("DELETE", "delete object", OssErrorKind.DELETE_ERROR),
    HEAD_OBJECT("HEAD", "head object", OssErrorKind.HEAD_ERROR),
    LIST_OBJECTS("GET", "list objects", OssErrorKind.GET_ERROR),
    LIST_BUCKETS("GET", "list buckets", OssErrorKind.GET_ERROR);

    private final String method;
    private final String description;
    private final OssErrorKind errorKind;

    OssOperation(String method, String description, OssErrorKind errorKind) {
        this.method = requireNonNull(method);
        this.description = requireNonNull(description);
        this.errorKind = requireNonNull(errorKind);
    }

    String getMethod() {
        return method;
    }

    String getDescription() {
        return description;
    }

    OssErrorKind getErrorKind() {
        return errorKind;
    }
}
