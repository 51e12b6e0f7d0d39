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

import java.io.IOException;
import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps non-2xx responses to operation errors. */
final class OssErrorClassifier {
    private static final Logger logger = LoggerFactory.getLogger(
            OssErrorClassifier.class);
    private static final XmlMapper mapper = new XmlMapper();

    private OssErrorClassifier() {
        throw new AssertionError("intentionally unimplemented");
    }

    static void checkResponse(OssOperation operation, OssResponse response)
            throws OssException {
        if (response.isSuccess()) {
            return;
        }
        StringBuilder message = new StringBuilder()
                .append("can not ").append(operation.getDescription())
                .append(", status code: ").append(response.getStatusCode());
        if (!response.getReason().isEmpty()) {
            message.append(' ').append(response.getReason());
        }
        OssErrorResponse error = parseError(response.getBody());
        String requestId = null;
        if (error != null) {
            appendDetail(message, "code", error.code);
            appendDetail(message, "message", error.message);
            requestId = error.requestId;
        }
        if (Strings.isNullOrEmpty(requestId)) {
            List<String> requestIds = response.getHeaders(
                    OssHttpHeaders.REQUEST_ID);
            requestId = requestIds.isEmpty() ? null : requestIds.get(0);
        }
        appendDetail(message, "request id", requestId);
        throw new OssException(operation.getErrorKind(), message.toString(),
                response.getStatusCode());
    }

    @Nullable
    private static OssErrorResponse parseError(byte[] body) {
        // HEAD responses and some proxies carry no error document
        if (body.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(body, OssErrorResponse.class);
        } catch (IOException ioe) {
            logger.debug("unparseable error body: {}", ioe.getMessage());
            return null;
        }
    }

    private static void appendDetail(StringBuilder message, String label,
            @Nullable String value) {
        if (!Strings.isNullOrEmpty(value)) {
            message.append(", ").append(label).append(": ").append(value);
        }
    }
}
