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

import com.google.common.base.Strings;
import com.google.common.collect.Multimap;
import com.google.common.net.HttpHeaders;

/**
 * Inputs of the OSS V1 string-to-sign.  Built for a single request and
 * discarded with it.
 */
final class CanonicalRequest {
    private final String verb;
    private final String contentMd5;
    private final String contentType;
    private final String dateOrExpires;
    private final String canonicalHeaders;
    private final String canonicalResource;

    CanonicalRequest(String verb, String contentMd5, String contentType,
            String dateOrExpires, String canonicalHeaders,
            String canonicalResource) {
        this.verb = requireNonNull(verb);
        this.contentMd5 = requireNonNull(contentMd5);
        this.contentType = requireNonNull(contentType);
        this.dateOrExpires = requireNonNull(dateOrExpires);
        this.canonicalHeaders = requireNonNull(canonicalHeaders);
        this.canonicalResource = requireNonNull(canonicalResource);
    }

    /**
     * Collect the signed parts of a request.
     *
     * @param headers outgoing headers; Content-MD5, Content-Type and the x-oss-
     *     headers are read from them
     * @param dateOrExpires RFC 1123 date for header signing or expiry epoch
     *     seconds for presigned URLs
     * @param subresources output of {@link CanonicalResource#canonicalize}
     */
    static CanonicalRequest create(String verb, Multimap<String, String> headers,
            String dateOrExpires, String bucket, String objectKey,
            String subresources) {
        return new CanonicalRequest(verb,
                Strings.nullToEmpty(CanonicalHeaders.getFirst(headers,
                        HttpHeaders.CONTENT_MD5)),
                Strings.nullToEmpty(CanonicalHeaders.getFirst(headers,
                        HttpHeaders.CONTENT_TYPE)),
                dateOrExpires,
                CanonicalHeaders.canonicalize(headers),
                resourcePath(bucket, objectKey, subresources));
    }

    /** Service-level requests have no bucket and sign the root resource. */
    static String resourcePath(String bucket, String objectKey,
            String subresources) {
        StringBuilder builder = new StringBuilder().append('/');
        if (!bucket.isEmpty()) {
            builder.append(bucket).append('/').append(objectKey);
        }
        if (!subresources.isEmpty()) {
            builder.append('?').append(subresources);
        }
        return builder.toString();
    }

    String getVerb() {
        return verb;
    }

    String getContentMd5() {
        return contentMd5;
    }

    String getContentType() {
        return contentType;
    }

    String getDateOrExpires() {
        return dateOrExpires;
    }

    String getCanonicalHeaders() {
        return canonicalHeaders;
    }

    String getCanonicalResource() {
        return canonicalResource;
    }

    String stringToSign() {
        return new StringBuilder()
                .append(verb).append('\n')
                .append(contentMd5).append('\n')
                .append(contentType).append('\n')
                .append(dateOrExpires).append('\n')
                .append(canonicalHeaders)
                .append(canonicalResource)
                .toString();
    }

    @Override
    public String toString() {
        return "Verb: " + verb +
                "; Content-MD5: " + contentMd5 +
                "; Content-Type: " + contentType +
                "; date: " + dateOrExpires +
                "; resource: " + canonicalResource;
    }
}
