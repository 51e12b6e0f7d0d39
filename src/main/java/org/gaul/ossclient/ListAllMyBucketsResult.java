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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

// CHECKSTYLE:OFF
@JsonIgnoreProperties(ignoreUnknown = true)
final class ListAllMyBucketsResult {
    @JacksonXmlProperty(localName = "Bucket")
    @JacksonXmlElementWrapper(localName = "Buckets")
    List<Bucket> buckets;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Bucket {
        @JacksonXmlProperty(localName = "Name")
        String name;
        @JacksonXmlProperty(localName = "Location")
        String location;
        @JacksonXmlProperty(localName = "CreationDate")
        String creationDate;
        @JacksonXmlProperty(localName = "StorageClass")
        String storageClass;
    }
}
// CHECKSTYLE:ON
