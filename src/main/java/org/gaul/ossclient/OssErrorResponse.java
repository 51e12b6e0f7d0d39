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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

/** Body of a non-2xx response, e.g., Code NoSuchKey. */
// CHECKSTYLE:OFF
@JsonIgnoreProperties(ignoreUnknown = true)
final class OssErrorResponse {
    @JacksonXmlProperty(localName = "Code")
    String code;

    @JacksonXmlProperty(localName = "Message")
    String message;

    @JacksonXmlProperty(localName = "RequestId")
    String requestId;
}
// CHECKSTYLE:ON
