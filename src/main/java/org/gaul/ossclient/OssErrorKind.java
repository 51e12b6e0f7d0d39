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

/** Classes of failure an {@link OssClient} operation can report. */
public enum OssErrorKind {
    /** Connection, DNS, TLS or timeout failure surfaced by the transport. */
    TRANSPORT("TRANSPORT ERROR"),
    /** Header or URL bytes which cannot be sent on the wire. */
    ENCODING("ENCODING ERROR"),
    PUT_ERROR("PUT ERROR"),
    GET_ERROR("GET ERROR"),
    COPY_ERROR("COPY ERROR"),
    DELETE_ERROR("DELETE ERROR"),
    HEAD_ERROR("HEAD ERROR"),
    /** Malformed response document. */
    DECODE("DECODE ERROR"),
    /** Response body which is not valid UTF-8 when text was requested. */
    STRING_CONVERSION("STRING CONVERSION ERROR");

    private final String label;

    OssErrorKind(String label) {
        this.label = requireNonNull(label);
    }

    String getLabel() {
        return label;
    }
}
