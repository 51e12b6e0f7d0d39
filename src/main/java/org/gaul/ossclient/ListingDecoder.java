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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.collect.ImmutableList;

/**
 * Decodes listing documents.  Object listings are read with a forward-only
 * StAX cursor so large pages are never materialized as a tree; any failure
 * discards the partially decoded page.
 */
final class ListingDecoder {
    private static final XMLInputFactory xmlInputFactory;
    private static final XmlMapper xmlMapper = new XmlMapper();

    static {
        xmlInputFactory = XMLInputFactory.newFactory();
        xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        xmlInputFactory.setProperty(
                XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    private enum State {
        IDLE,
        IN_CONTENTS,
        IN_COMMON_PREFIXES
    }

    private ListingDecoder() { }

    /** Keys of a ListBucketResult document, in document order. */
    static ImmutableList<String> decodeKeys(InputStream is)
            throws OssException {
        var builder = ImmutableList.<String>builder();
        for (ObjectSummary summary : decodePage(is).getEntries()) {
            builder.add(summary.getKey());
        }
        return builder.build();
    }

    static ListPage decodePage(InputStream is) throws OssException {
        try {
            XMLStreamReader xml = xmlInputFactory.createXMLStreamReader(is);
            try {
                return decodePage(xml);
            } finally {
                xml.close();
            }
        } catch (XMLStreamException xse) {
            throw new OssException(OssErrorKind.DECODE,
                    "malformed listing: " + xse.getMessage(), xse);
        }
    }

    private static ListPage decodePage(XMLStreamReader xml)
            throws XMLStreamException, OssException {
        List<ObjectSummary> entries = new ArrayList<>();
        List<String> commonPrefixes = new ArrayList<>();
        boolean truncated = false;
        String nextMarker = "";

        State state = State.IDLE;
        String key = "";
        String lastModified = "";
        String eTag = "";
        String size = "";

        while (xml.hasNext()) {
            int event = xml.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String name = xml.getLocalName();
                switch (state) {
                case IDLE:
                    if (name.equals("Contents")) {
                        key = "";
                        lastModified = "";
                        eTag = "";
                        size = "";
                        state = State.IN_CONTENTS;
                    } else if (name.equals("CommonPrefixes")) {
                        state = State.IN_COMMON_PREFIXES;
                    } else if (name.equals("IsTruncated")) {
                        truncated = parseBoolean(xml.getElementText());
                    } else if (name.equals("NextContinuationToken")) {
                        nextMarker = xml.getElementText();
                    }
                    break;
                case IN_CONTENTS:
                    switch (name) {
                    case "Key":
                        key = xml.getElementText();
                        break;
                    case "LastModified":
                        lastModified = xml.getElementText();
                        break;
                    case "ETag":
                        eTag = xml.getElementText();
                        break;
                    case "Size":
                        size = xml.getElementText();
                        break;
                    default:
                        break;
                    }
                    break;
                case IN_COMMON_PREFIXES:
                    if (name.equals("Prefix")) {
                        commonPrefixes.add(xml.getElementText());
                    }
                    break;
                default:
                    throw new IllegalStateException("unknown state: " + state);
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                String name = xml.getLocalName();
                if (state == State.IN_CONTENTS && name.equals("Contents")) {
                    entries.add(new ObjectSummary(key, lastModified, eTag,
                            size));
                    state = State.IDLE;
                } else if (state == State.IN_COMMON_PREFIXES &&
                        name.equals("CommonPrefixes")) {
                    state = State.IDLE;
                }
            }
        }

        if (state != State.IDLE) {
            throw new OssException(OssErrorKind.DECODE,
                    "unexpected end of listing in state " + state);
        }
        return new ListPage(entries, commonPrefixes, truncated, nextMarker);
    }

    private static boolean parseBoolean(String text) throws OssException {
        switch (text.trim()) {
        case "true":
            return true;
        case "false":
            return false;
        default:
            throw new OssException(OssErrorKind.DECODE,
                    "invalid IsTruncated value: " + text);
        }
    }

    /** Buckets of a ListAllMyBucketsResult document. */
    static ImmutableList<BucketSummary> decodeBuckets(byte[] body)
            throws OssException {
        ListAllMyBucketsResult result;
        try {
            result = xmlMapper.readValue(body, ListAllMyBucketsResult.class);
        } catch (IOException ioe) {
            throw new OssException(OssErrorKind.DECODE,
                    "malformed bucket listing: " + ioe.getMessage(), ioe);
        }
        var builder = ImmutableList.<BucketSummary>builder();
        if (result != null && result.buckets != null) {
            for (ListAllMyBucketsResult.Bucket bucket : result.buckets) {
                if (bucket.name == null) {
                    throw new OssException(OssErrorKind.DECODE,
                            "bucket without a name");
                }
                builder.add(new BucketSummary(bucket.name, bucket.location,
                        bucket.creationDate, bucket.storageClass));
            }
        }
        return builder.build();
    }
}
