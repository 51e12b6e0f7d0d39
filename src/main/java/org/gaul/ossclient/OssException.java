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

import java.util.OptionalInt;

@SuppressWarnings("serial")
public final class OssException extends Exception {
    private final OssErrorKind kind;
    private final int statusCode;

    OssException(OssErrorKind kind, String message) {
        this(kind, message, -1, (Throwable) null);
    }

    OssException(OssErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    OssException(OssErrorKind kind, String message, int statusCode) {
        this(kind, message, statusCode, (Throwable) null);
    }

    private OssException(OssErrorKind kind, String message, int statusCode,
            Throwable cause) {
        super(requireNonNull(message), cause);
        this.kind = requireNonNull(kind);
        this.statusCode = statusCode;
    }

    public OssErrorKind getKind() {
        return kind;
    }

    /** HTTP status of the response, present only for operation errors. */
    public OptionalInt getStatusCode() {
        return statusCode < 0 ? OptionalInt.empty() :
                OptionalInt.of(statusCode);
    }

    @Override
    public String getMessage() {
        return kind.getLabel() + ": " + super.getMessage();
    }
}
