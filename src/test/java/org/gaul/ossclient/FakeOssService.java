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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.net.HttpHeaders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory object store speaking the OSS REST dialect.  Every request is
 * authenticated with a signature computed independently of the client.
 */
final class FakeOssService implements OssTransport {
    static final String HOST = "oss.example.com";

    private static final Logger logger = LoggerFactory.getLogger(
            FakeOssService.class);
    private static final String FAKE_REQUEST_ID = "4442587FB7D0A2F9";
    private static final int DEFAULT_MAX_KEYS = 100;
    private static final Set<String> SIGNED_SUBRESOURCES = ImmutableSet.of(
            "acl", "continuation-token", "partNumber",
            "response-content-type", "uploadId");

    private final String identity;
    private final String credential;
    private final Clock clock;
    private final XMLOutputFactory xmlOutputFactory =
            XMLOutputFactory.newFactory();
    private final Map<String, SortedMap<String, StoredObject>> buckets =
            new TreeMap<>();
    private final Set<String> deniedKeys = new TreeSet<>();
    private final List<OssRequest> requests = new ArrayList<>();
    private IOException failure;

    static final class StoredObject {
        final byte[] content;
        final String contentType;
        final ImmutableMap<String, String> metadata;

        StoredObject(byte[] content, String contentType,
                Map<String, String> metadata) {
            this.content = content;
            this.contentType = contentType;
            this.metadata = ImmutableMap.copyOf(metadata);
        }

        String eTag() {
            @SuppressWarnings("deprecation")
            byte[] md5 = Hashing.md5().hashBytes(content).asBytes();
            return "\"" + BaseEncoding.base16().encode(md5) + "\"";
        }
    }

    FakeOssService(String identity, String credential, Clock clock) {
        this.identity = identity;
        this.credential = credential;
        this.clock = clock;
    }

    void createBucket(String bucket) {
        buckets.put(bucket, new TreeMap<>());
    }

    /** Answer 403 for every request naming key. */
    void denyKey(String key) {
        deniedKeys.add(key);
    }

    /** Fail every following request as an unreachable host would. */
    void failWith(IOException ioe) {
        failure = ioe;
    }

    StoredObject getObject(String bucket, String key) {
        return buckets.get(bucket).get(key);
    }

    List<OssRequest> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    @Override
    public OssResponse execute(OssRequest request) throws IOException {
        requests.add(request);
        if (failure != null) {
            throw failure;
        }

        URI uri = URI.create(request.getUrl());
        String host = uri.getHost();
        String bucket = host.equals(HOST) ? "" :
                host.substring(0, host.length() - HOST.length() - 1);
        String key = uri.getRawPath().isEmpty() ? "" :
                uri.getRawPath().substring(1);
        Map<String, String> params = parseQuery(uri.getRawQuery());

        String stringToSign = stringToSign(request, bucket, key, params);
        logger.trace("stringToSign: {}", stringToSign);
        OssResponse denied = authenticate(request, params, stringToSign);
        if (denied != null) {
            return denied;
        }

        if (bucket.isEmpty()) {
            return request.getMethod().equals("GET") ? listBuckets() :
                    error(405, "Method Not Allowed", "MethodNotAllowed",
                            "The specified method is not allowed.");
        }
        SortedMap<String, StoredObject> objects = buckets.get(bucket);
        if (objects == null) {
            return error(404, "Not Found", "NoSuchBucket",
                    "The specified bucket does not exist.");
        }
        if (deniedKeys.contains(key)) {
            return error(403, "Forbidden", "AccessDenied",
                    "You have no right to access this object.");
        }

        switch (request.getMethod()) {
        case "PUT":
            return handlePut(request, bucket, key, objects);
        case "GET":
            if (key.isEmpty()) {
                return listObjects(params, objects);
            }
            return handleGet(objects.get(key), false);
        case "HEAD":
            return handleGet(objects.get(key), true);
        case "DELETE":
            objects.remove(key);
            return new OssResponse(204, "No Content",
                    ImmutableListMultimap.of(), null);
        default:
            return error(405, "Method Not Allowed", "MethodNotAllowed",
                    "The specified method is not allowed.");
        }
    }

    private String stringToSign(OssRequest request, String bucket,
            String key, Map<String, String> params) {
        SortedMap<String, List<String>> ossHeaders = new TreeMap<>();
        for (Map.Entry<String, String> entry :
                request.getHeaders().entries()) {
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            if (name.startsWith("x-oss-")) {
                ossHeaders.computeIfAbsent(name, k -> new ArrayList<>())
                        .add(entry.getValue());
            }
        }

        boolean queryAuth = params.containsKey("OSSAccessKeyId");
        StringBuilder builder = new StringBuilder()
                .append(request.getMethod()).append('\n')
                .append(Strings.nullToEmpty(header(request,
                        HttpHeaders.CONTENT_MD5))).append('\n')
                .append(Strings.nullToEmpty(header(request,
                        HttpHeaders.CONTENT_TYPE))).append('\n')
                .append(queryAuth ? params.get("Expires") :
                        Strings.nullToEmpty(header(request,
                                HttpHeaders.DATE)))
                .append('\n');
        for (Map.Entry<String, List<String>> entry : ossHeaders.entrySet()) {
            builder.append(entry.getKey()).append(':')
                    .append(String.join(",", entry.getValue())).append('\n');
        }
        builder.append('/');
        if (!bucket.isEmpty()) {
            builder.append(bucket).append('/').append(key);
        }

        char separator = '?';
        for (String subresource : new TreeSet<>(params.keySet())) {
            if (SIGNED_SUBRESOURCES.contains(subresource)) {
                builder.append(separator).append(subresource);
                String value = params.get(subresource);
                if (value != null) {
                    builder.append('=').append(value);
                }
                separator = '&';
            }
        }
        return builder.toString();
    }

    private OssResponse authenticate(OssRequest request,
            Map<String, String> params, String stringToSign)
            throws IOException {
        String expected = hmacSha1(stringToSign);
        if (params.containsKey("OSSAccessKeyId")) {
            if (!identity.equals(params.get("OSSAccessKeyId"))) {
                return error(403, "Forbidden", "InvalidAccessKeyId",
                        "The OSS Access Key Id you provided does not exist.");
            }
            if (Long.parseLong(params.get("Expires")) <
                    clock.instant().getEpochSecond()) {
                return error(403, "Forbidden", "AccessDenied",
                        "Request has expired.");
            }
            if (!expected.equals(params.get("Signature"))) {
                return error(403, "Forbidden", "SignatureDoesNotMatch",
                        "The request signature we calculated does not match.");
            }
            return null;
        }

        String authorization = header(request, HttpHeaders.AUTHORIZATION);
        if (authorization == null || header(request, HttpHeaders.DATE) ==
                null) {
            return error(403, "Forbidden", "AccessDenied",
                    "Anonymous access is forbidden.");
        }
        if (!authorization.equals("OSS " + identity + ":" + expected)) {
            return error(403, "Forbidden", "SignatureDoesNotMatch",
                    "The request signature we calculated does not match.");
        }
        return null;
    }

    private OssResponse handlePut(OssRequest request, String bucket,
            String key, SortedMap<String, StoredObject> objects)
            throws IOException {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry :
                request.getHeaders().entries()) {
            if (entry.getKey().toLowerCase(Locale.ROOT).startsWith(
                    OssClientConstants.USER_METADATA_PREFIX)) {
                metadata.put(entry.getKey(), entry.getValue());
            }
        }

        String copySource = header(request, OssHttpHeaders.COPY_SOURCE);
        if (copySource != null) {
            String prefix = "/" + bucket + "/";
            StoredObject source = copySource.startsWith(prefix) ?
                    objects.get(copySource.substring(prefix.length())) : null;
            if (source == null) {
                return error(404, "Not Found", "NoSuchKey",
                        "The specified key does not exist.");
            }
            boolean replace = "REPLACE".equals(header(request,
                    OssHttpHeaders.METADATA_DIRECTIVE));
            objects.put(key, new StoredObject(source.content,
                    source.contentType,
                    replace ? metadata : source.metadata));
            return new OssResponse(200, "OK", ImmutableListMultimap.of(),
                    null);
        }

        byte[] content = request.getBody() == null ? new byte[0] :
                request.getBody();
        String contentMd5 = header(request, HttpHeaders.CONTENT_MD5);
        if (contentMd5 != null) {
            byte[] actual;
            try {
                actual = MessageDigest.getInstance("MD5").digest(content);
            } catch (NoSuchAlgorithmException nsae) {
                throw new IOException(nsae);
            }
            if (!BaseEncoding.base64().encode(actual).equals(contentMd5)) {
                return error(400, "Bad Request", "InvalidDigest",
                        "The Content-MD5 you specified is not valid.");
            }
        }
        StoredObject object = new StoredObject(content,
                header(request, HttpHeaders.CONTENT_TYPE), metadata);
        objects.put(key, object);
        return new OssResponse(200, "OK",
                ImmutableListMultimap.of(HttpHeaders.ETAG, object.eTag()),
                null);
    }

    private OssResponse handleGet(StoredObject object, boolean head)
            throws IOException {
        if (object == null) {
            if (head) {
                return new OssResponse(404, "Not Found",
                        ImmutableListMultimap.of(), null);
            }
            return error(404, "Not Found", "NoSuchKey",
                    "The specified key does not exist.");
        }
        ListMultimap<String, String> headers = LinkedListMultimap.create();
        headers.put(HttpHeaders.CONTENT_TYPE,
                Strings.nullToEmpty(object.contentType));
        headers.put(HttpHeaders.ETAG, object.eTag());
        headers.put(OssHttpHeaders.REQUEST_ID, FAKE_REQUEST_ID);
        for (Map.Entry<String, String> entry : object.metadata.entrySet()) {
            headers.put(entry.getKey(), entry.getValue());
        }
        return new OssResponse(200, "OK", headers,
                head ? null : object.content);
    }

    private OssResponse listObjects(Map<String, String> params,
            SortedMap<String, StoredObject> objects) throws IOException {
        if (!"2".equals(params.get("list-type"))) {
            return error(400, "Bad Request", "InvalidArgument",
                    "list-type must be 2");
        }
        String prefix = Strings.nullToEmpty(params.get("prefix"));
        String delimiter = params.get("delimiter");
        String token = params.get("continuation-token");
        int maxKeys = params.containsKey("max-keys") ?
                Integer.parseInt(params.get("max-keys")) : DEFAULT_MAX_KEYS;

        SortedMap<String, StoredObject> candidates = token == null ?
                objects : objects.tailMap(token);
        Map<String, StoredObject> contents = new LinkedHashMap<>();
        Set<String> commonPrefixes = new TreeSet<>();
        String nextToken = null;
        for (Map.Entry<String, StoredObject> entry : candidates.entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(prefix)) {
                continue;
            }
            String commonPrefix = null;
            if (delimiter != null) {
                int index = key.indexOf(delimiter, prefix.length());
                if (index >= 0) {
                    commonPrefix = key.substring(0,
                            index + delimiter.length());
                }
            }
            if (commonPrefix != null && commonPrefixes.contains(commonPrefix)) {
                continue;
            }
            if (contents.size() + commonPrefixes.size() == maxKeys) {
                nextToken = key;
                break;
            }
            if (commonPrefix != null) {
                commonPrefixes.add(commonPrefix);
            } else {
                contents.put(key, entry.getValue());
            }
        }

        ByteArrayOutputStream os = new ByteArrayOutputStream();
        try {
            XMLStreamWriter xml = xmlOutputFactory.createXMLStreamWriter(os,
                    "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("ListBucketResult");
            writeSimpleElement(xml, "Prefix", prefix);
            writeSimpleElement(xml, "MaxKeys", String.valueOf(maxKeys));
            if (delimiter != null) {
                writeSimpleElement(xml, "Delimiter", delimiter);
            }
            writeSimpleElement(xml, "IsTruncated",
                    String.valueOf(nextToken != null));
            if (nextToken != null) {
                writeSimpleElement(xml, "NextContinuationToken", nextToken);
            }
            writeSimpleElement(xml, "KeyCount",
                    String.valueOf(contents.size() + commonPrefixes.size()));
            for (Map.Entry<String, StoredObject> entry : contents.entrySet()) {
                xml.writeStartElement("Contents");
                writeSimpleElement(xml, "Key", entry.getKey());
                writeSimpleElement(xml, "LastModified",
                        "2024-01-01T00:00:00.000Z");
                writeSimpleElement(xml, "ETag", entry.getValue().eTag());
                writeSimpleElement(xml, "Type", "Normal");
                writeSimpleElement(xml, "Size",
                        String.valueOf(entry.getValue().content.length));
                writeSimpleElement(xml, "StorageClass", "Standard");
                xml.writeEndElement();
            }
            for (String commonPrefix : commonPrefixes) {
                xml.writeStartElement("CommonPrefixes");
                writeSimpleElement(xml, "Prefix", commonPrefix);
                xml.writeEndElement();
            }
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
        } catch (XMLStreamException xse) {
            throw new IOException(xse);
        }
        return new OssResponse(200, "OK", ImmutableListMultimap.of(
                HttpHeaders.CONTENT_TYPE, "application/xml"), os.toByteArray());
    }

    private OssResponse listBuckets() throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        try {
            XMLStreamWriter xml = xmlOutputFactory.createXMLStreamWriter(os,
                    "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("ListAllMyBucketsResult");
            xml.writeStartElement("Owner");
            writeSimpleElement(xml, "ID", identity);
            writeSimpleElement(xml, "DisplayName", identity);
            xml.writeEndElement();
            xml.writeStartElement("Buckets");
            for (String bucket : buckets.keySet()) {
                xml.writeStartElement("Bucket");
                writeSimpleElement(xml, "CreationDate",
                        "2024-01-01T00:00:00.000Z");
                writeSimpleElement(xml, "Location", "oss-cn-hangzhou");
                writeSimpleElement(xml, "Name", bucket);
                writeSimpleElement(xml, "StorageClass", "Standard");
                xml.writeEndElement();
            }
            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
        } catch (XMLStreamException xse) {
            throw new IOException(xse);
        }
        return new OssResponse(200, "OK", ImmutableListMultimap.of(
                HttpHeaders.CONTENT_TYPE, "application/xml"), os.toByteArray());
    }

    private OssResponse error(int status, String reason, String code,
            String message) throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        try {
            XMLStreamWriter xml = xmlOutputFactory.createXMLStreamWriter(os,
                    "UTF-8");
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("Error");
            writeSimpleElement(xml, "Code", code);
            writeSimpleElement(xml, "Message", message);
            writeSimpleElement(xml, "RequestId", FAKE_REQUEST_ID);
            writeSimpleElement(xml, "HostId", HOST);
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
        } catch (XMLStreamException xse) {
            throw new IOException(xse);
        }
        return new OssResponse(status, reason, ImmutableListMultimap.of(
                HttpHeaders.CONTENT_TYPE, "application/xml"), os.toByteArray());
    }

    private String hmacSha1(String stringToSign) {
        Mac mac;
        try {
            mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(credential.getBytes(
                    StandardCharsets.UTF_8), "HmacSHA1"));
        } catch (InvalidKeyException | NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
        return BaseEncoding.base64().encode(mac.doFinal(
                stringToSign.getBytes(StandardCharsets.UTF_8)));
    }

    private static String header(OssRequest request, String name) {
        for (Map.Entry<String, String> entry :
                request.getHeaders().entries()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int index = pair.indexOf('=');
            if (index < 0) {
                params.put(pair, null);
            } else {
                params.put(pair.substring(0, index), URLDecoder.decode(
                        pair.substring(index + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private static void writeSimpleElement(XMLStreamWriter xml,
            String elementName, String characters) throws XMLStreamException {
        xml.writeStartElement(elementName);
        xml.writeCharacters(characters);
        xml.writeEndElement();
    }
}
