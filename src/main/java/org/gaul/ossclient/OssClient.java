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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.net.HttpHeaders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for an OSS bucket.  Instances are immutable and thread-safe; each
 * operation is a single blocking round trip without retries.
 */
public final class OssClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(
            OssClient.class);

    private final RequestAssembler assembler;
    private final OssTransport transport;
    private final String bucket;

    private OssClient(RequestAssembler assembler, OssTransport transport,
            String bucket) {
        this.assembler = requireNonNull(assembler);
        this.transport = requireNonNull(transport);
        this.bucket = requireNonNull(bucket);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Client for another bucket sharing credentials and transport. */
    public OssClient withBucket(String bucket) {
        return new OssClient(assembler, transport, bucket);
    }

    public String getBucket() {
        return bucket;
    }

    public String getEndpoint() {
        return assembler.getEndpoint().toString();
    }

    public GetObjectResponse get(String key) throws OssException {
        return get(key, GetOptions.defaults());
    }

    public GetObjectResponse get(String key, GetOptions options)
            throws OssException {
        ListMultimap<String, String> headers = LinkedListMultimap.create();
        for (Map.Entry<String, String> entry :
                options.getHeaders().entrySet()) {
            headers.put(entry.getKey(), entry.getValue());
        }
        OssRequest request = assembler.assemble(
                OssOperation.GET_OBJECT.getMethod(), requireBucket(),
                requireNonNull(key), headers, options.getQueryParameters(),
                null);
        OssResponse response = execute(OssOperation.GET_OBJECT, request);

        Map<String, String> metadata = UserMetadata.fromHeaders(
                response.getHeaders());
        if (!options.getMetadataKeys().isEmpty()) {
            var builder = ImmutableMap.<String, String>builder();
            for (String metadataKey : options.getMetadataKeys()) {
                String value = metadata.get(
                        metadataKey.toLowerCase(Locale.ROOT));
                if (value != null) {
                    builder.put(metadataKey, value);
                }
            }
            metadata = builder.build();
        }
        return new GetObjectResponse(response.getBody(), metadata,
                response.getHeaders());
    }

    public void put(byte[] content, String key) throws OssException {
        put(content, key, PutOptions.defaults());
    }

    public void put(byte[] content, String key, PutOptions options)
            throws OssException {
        OssRequest request = assembler.assemblePut(requireBucket(),
                requireNonNull(key), options, requireNonNull(content));
        execute(OssOperation.PUT_OBJECT, request);
    }

    /** Server-side copy within this bucket. */
    public void copy(String sourceKey, String destKey) throws OssException {
        copy(sourceKey, destKey, PutOptions.defaults());
    }

    /**
     * Server-side copy within this bucket.  Supplying user metadata replaces
     * the metadata of the source instead of copying it.
     */
    public void copy(String sourceKey, String destKey, PutOptions options)
            throws OssException {
        String copyBucket = requireBucket();
        ListMultimap<String, String> headers = LinkedListMultimap.create();
        headers.put(HttpHeaders.CONTENT_TYPE, options.getContentType()
                .orElse(RequestAssembler.DEFAULT_CONTENT_TYPE));
        headers.put(OssHttpHeaders.COPY_SOURCE,
                "/" + copyBucket + "/" + requireNonNull(sourceKey));
        if (!options.getUserMetadata().isEmpty()) {
            headers.put(OssHttpHeaders.METADATA_DIRECTIVE, "REPLACE");
            headers.putAll(UserMetadata.toHeaders(options.getUserMetadata()));
        }
        for (Map.Entry<String, String> entry :
                options.getHeaders().entrySet()) {
            headers.put(entry.getKey(), entry.getValue());
        }
        OssRequest request = assembler.assemble(
                OssOperation.COPY_OBJECT.getMethod(), copyBucket,
                requireNonNull(destKey), headers,
                options.getQueryParameters(), new byte[0]);
        execute(OssOperation.COPY_OBJECT, request);
    }

    public void delete(String key) throws OssException {
        OssRequest request = assembler.assemble(
                OssOperation.DELETE_OBJECT.getMethod(), requireBucket(),
                requireNonNull(key), LinkedListMultimap.create(),
                ImmutableMap.of(), null);
        execute(OssOperation.DELETE_OBJECT, request);
    }

    /**
     * Delete each key in turn.  The first failure is thrown and the remaining
     * keys are left in place.
     */
    public void deleteMulti(Iterable<String> keys) throws OssException {
        for (String key : keys) {
            delete(key);
        }
    }

    /** User metadata of an object, with the x-oss-meta- prefix removed. */
    public Map<String, String> head(String key) throws OssException {
        OssRequest request = assembler.assemble(
                OssOperation.HEAD_OBJECT.getMethod(), requireBucket(),
                requireNonNull(key), LinkedListMultimap.create(),
                ImmutableMap.of(), null);
        OssResponse response = execute(OssOperation.HEAD_OBJECT, request);
        return UserMetadata.fromHeaders(response.getHeaders());
    }

    /** Keys of one listing page. */
    public ImmutableList<String> listObjects(ListOptions options)
            throws OssException {
        return ListingDecoder.decodeKeys(new ByteArrayInputStream(
                listRaw(options).getBody()));
    }

    /** One listing page; pass its next marker back to continue. */
    public ListPage listDetails(ListOptions options) throws OssException {
        return ListingDecoder.decodePage(new ByteArrayInputStream(
                listRaw(options).getBody()));
    }

    private OssResponse listRaw(ListOptions options) throws OssException {
        OssRequest request = assembler.assemble(
                OssOperation.LIST_OBJECTS.getMethod(), requireBucket(), "",
                LinkedListMultimap.create(), options.toQueryParameters(),
                null);
        return execute(OssOperation.LIST_OBJECTS, request);
    }

    /** Buckets owned by the credentials, independent of this bucket. */
    public ImmutableList<BucketSummary> listBuckets() throws OssException {
        OssRequest request = assembler.assemble(
                OssOperation.LIST_BUCKETS.getMethod(), "", "",
                LinkedListMultimap.create(), ImmutableMap.of(), null);
        OssResponse response = execute(OssOperation.LIST_BUCKETS, request);
        return ListingDecoder.decodeBuckets(response.getBody());
    }

    /**
     * URL granting verb on key until expires, in seconds since the epoch.
     */
    public String presignedUrl(String verb, String key, long expires)
            throws OssException {
        return presignedUrl(verb, key, expires, ImmutableMap.of());
    }

    /**
     * URL granting verb on key until expires, in seconds since the epoch.
     * Params are appended to the URL and the allow-listed ones are signed.
     */
    public String presignedUrl(String verb, String key, long expires,
            Map<String, String> params) throws OssException {
        return assembler.presign(requireNonNull(verb), requireBucket(),
                requireNonNull(key), expires, params);
    }

    public String presignedUrl(String verb, String key, Duration validFor)
            throws OssException {
        checkArgument(!validFor.isNegative(), "negative duration: %s",
                validFor);
        long expires = assembler.getClock().instant().plus(validFor)
                .getEpochSecond();
        return presignedUrl(verb, key, expires);
    }

    /** Close the transport, which clients from withBucket share. */
    @Override
    public void close() throws IOException {
        transport.close();
    }

    private String requireBucket() {
        checkState(!bucket.isEmpty(), "bucket is not set");
        return bucket;
    }

    private OssResponse execute(OssOperation operation, OssRequest request)
            throws OssException {
        logger.debug("{}: {}", operation.getDescription(), request);
        OssResponse response;
        try {
            response = transport.execute(request);
        } catch (IOException ioe) {
            throw new OssException(OssErrorKind.TRANSPORT,
                    "can not " + operation.getDescription() + ": " +
                    ioe.getMessage(), ioe);
        }
        OssErrorClassifier.checkResponse(operation, response);
        return response;
    }

    public static final class Builder {
        private String endpoint;
        private String bucket = "";
        private String identity;
        private String credential;
        private Clock clock = Clock.systemUTC();
        private OssTransport transport;
        private JettyOssTransport.Builder transportBuilder =
                JettyOssTransport.builder();

        Builder() {
        }

        /** Read endpoint, bucket, credentials and transport settings. */
        public static Builder fromProperties(Properties properties) {
            String endpoint = properties.getProperty(
                    OssClientConstants.PROPERTY_ENDPOINT);
            checkArgument(endpoint != null, "Properties file must contain: %s",
                    OssClientConstants.PROPERTY_ENDPOINT);
            String identity = properties.getProperty(
                    OssClientConstants.PROPERTY_IDENTITY);
            checkArgument(identity != null, "Properties file must contain: %s",
                    OssClientConstants.PROPERTY_IDENTITY);
            String credential = properties.getProperty(
                    OssClientConstants.PROPERTY_CREDENTIAL);
            checkArgument(credential != null,
                    "Properties file must contain: %s",
                    OssClientConstants.PROPERTY_CREDENTIAL);

            Builder builder = new Builder()
                    .endpoint(endpoint)
                    .credentials(identity, credential);
            builder.transportBuilder =
                    JettyOssTransport.Builder.fromProperties(properties);

            String bucket = properties.getProperty(
                    OssClientConstants.PROPERTY_BUCKET);
            if (bucket != null) {
                builder.bucket(bucket);
            }
            return builder;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = requireNonNull(endpoint);
            return this;
        }

        public Builder bucket(String bucket) {
            this.bucket = requireNonNull(bucket);
            return this;
        }

        public Builder credentials(String identity, String credential) {
            this.identity = requireNonNull(identity);
            this.credential = requireNonNull(credential);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = requireNonNull(clock);
            return this;
        }

        /** Use transport instead of a Jetty transport built by this client. */
        public Builder transport(OssTransport transport) {
            this.transport = requireNonNull(transport);
            return this;
        }

        public OssClient build() throws IOException {
            checkState(endpoint != null, "endpoint is not set");
            checkState(identity != null, "credentials are not set");
            RequestAssembler assembler = new RequestAssembler(identity,
                    credential, OssEndpoint.parse(endpoint), clock);
            OssTransport ossTransport = transport;
            if (ossTransport == null) {
                ossTransport = transportBuilder.build();
            }
            return new OssClient(assembler, ossTransport, bucket);
        }
    }
}
