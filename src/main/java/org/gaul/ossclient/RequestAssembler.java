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

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.Date;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.net.HttpHeaders;

/**
 * Turns bucket, key, options and payload into signed {@link OssRequest}s.
 * Holds only immutable state and may be shared between threads.
 */
final class RequestAssembler {
    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final String keyId;
    private final String keySecret;
    private final OssEndpoint endpoint;
    private final Clock clock;

    RequestAssembler(String keyId, String keySecret, OssEndpoint endpoint,
            Clock clock) {
        this.keyId = requireNonNull(keyId);
        this.keySecret = requireNonNull(keySecret);
        this.endpoint = requireNonNull(endpoint);
        this.clock = requireNonNull(clock);
    }

    /**
     * Build a header-signed request.
     *
     * @param headers caller headers, in the order they are sent
     * @param params all query parameters; only the signed sub-resources among
     *     them feed the signature
     * @param body payload, or null for requests without one
     */
    OssRequest assemble(String method, String bucket, String objectKey,
            Multimap<String, String> headers, Map<String, String> params,
            @Nullable byte[] body) throws OssException {
        ListMultimap<String, String> requestHeaders =
                LinkedListMultimap.create(headers);
        if (body != null) {
            requestHeaders.put(HttpHeaders.CONTENT_LENGTH,
                    String.valueOf(body.length));
        }
        String date = OssSignature.formatDate(Date.from(clock.instant()));
        requestHeaders.put(HttpHeaders.DATE, date);

        CanonicalRequest canonicalRequest = CanonicalRequest.create(method,
                requestHeaders, date, bucket, objectKey,
                CanonicalResource.canonicalize(params));
        requestHeaders.put(HttpHeaders.AUTHORIZATION,
                OssSignature.authorization(keyId, keySecret,
                        canonicalRequest));
        OssSignature.checkHeaders(requestHeaders);

        String url = checkUrl(endpoint.url(bucket, objectKey,
                CanonicalResource.queryString(params)));
        return new OssRequest(method, url, requestHeaders, body);
    }

    /** PUT of a payload with content type, user metadata and extra headers. */
    OssRequest assemblePut(String bucket, String objectKey, PutOptions options,
            byte[] content) throws OssException {
        ListMultimap<String, String> headers = LinkedListMultimap.create();
        // set explicitly so the transport never adds an unsigned one
        headers.put(HttpHeaders.CONTENT_TYPE,
                options.getContentType().orElse(DEFAULT_CONTENT_TYPE));
        if (options.isContentMd5()) {
            headers.put(HttpHeaders.CONTENT_MD5, contentMd5(content));
        }
        headers.putAll(UserMetadata.toHeaders(options.getUserMetadata()));
        for (Map.Entry<String, String> entry :
                options.getHeaders().entrySet()) {
            headers.put(entry.getKey(), entry.getValue());
        }
        return assemble("PUT", bucket, objectKey, headers,
                options.getQueryParameters(), content);
    }

    /**
     * URL which lets a bearer without credentials issue the request until
     * expires, in seconds since the epoch.
     */
    String presign(String method, String bucket, String objectKey,
            long expires, Map<String, String> params) throws OssException {
        CanonicalRequest canonicalRequest = CanonicalRequest.create(method,
                LinkedListMultimap.create(), String.valueOf(expires), bucket,
                objectKey, CanonicalResource.canonicalize(params));
        String query = CanonicalResource.queryString(params);
        if (!query.isEmpty()) {
            query += "&";
        }
        query += OssSignature.presignedQuery(keyId, keySecret,
                canonicalRequest);
        return checkUrl(endpoint.url(bucket, objectKey, query));
    }

    OssEndpoint getEndpoint() {
        return endpoint;
    }

    Clock getClock() {
        return clock;
    }

    static String contentMd5(byte[] content) {
        @SuppressWarnings("deprecation")
        byte[] digest = Hashing.md5().hashBytes(content).asBytes();
        return BaseEncoding.base64().encode(digest);
    }

    private static String checkUrl(String url) throws OssException {
        try {
            new URI(url);
        } catch (URISyntaxException use) {
            throw new OssException(OssErrorKind.ENCODING,
                    "invalid request URL: " + url, use);
        }
        return url;
    }
}
