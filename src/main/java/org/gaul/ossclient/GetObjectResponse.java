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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

/** Buffered object content with its user metadata and response headers. */
public final class GetObjectResponse {
    private final byte[] content;
    private final ImmutableMap<String, String> metadata;
    private final ImmutableListMultimap<String, String> headers;

    GetObjectResponse(byte[] content, Map<String, String> metadata,
            ImmutableListMultimap<String, String> headers) {
        this.content = requireNonNull(content);
        this.metadata = ImmutableMap.copyOf(metadata);
        this.headers = requireNonNull(headers);
    }

    public byte[] getContent() {
        return content;
    }

    /**
     * Content decoded as UTF-8.
     *
     * @throws OssException of kind STRING_CONVERSION if the content is not
     *     valid UTF-8
     */
    public String getContentAsString() throws OssException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException cce) {
            throw new OssException(OssErrorKind.STRING_CONVERSION,
                    "object content is not valid UTF-8", cce);
        }
    }

    /** User metadata with the x-oss-meta- prefix removed. */
    public ImmutableMap<String, String> getMetadata() {
        return metadata;
    }

    /** Response headers with lower-cased names. */
    public ImmutableListMultimap<String, String> getHeaders() {
        return headers;
    }
}
