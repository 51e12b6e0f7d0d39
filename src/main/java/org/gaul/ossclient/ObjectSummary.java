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

import java.util.Objects;

/** One Contents entry of a listing, fields kept as sent on the wire. */
public final class ObjectSummary {
    private final String key;
    private final String lastModified;
    private final String eTag;
    private final String size;

    public ObjectSummary(String key, String lastModified, String eTag,
            String size) {
        this.key = requireNonNull(key);
        this.lastModified = requireNonNull(lastModified);
        this.eTag = requireNonNull(eTag);
        this.size = requireNonNull(size);
    }

    public String getKey() {
        return key;
    }

    public String getLastModified() {
        return lastModified;
    }

    public String getETag() {
        return eTag;
    }

    public String getSize() {
        return size;
    }

    /** @throws NumberFormatException if the service sent a non-numeric size */
    public long getSizeAsLong() {
        return Long.parseLong(size);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        } else if (!(object instanceof ObjectSummary)) {
            return false;
        }
        ObjectSummary other = (ObjectSummary) object;
        return key.equals(other.key) &&
                lastModified.equals(other.lastModified) &&
                eTag.equals(other.eTag) &&
                size.equals(other.size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, lastModified, eTag, size);
    }

    @Override
    public String toString() {
        return "ObjectSummary{key=" + key + ", lastModified=" + lastModified +
                ", eTag=" + eTag + ", size=" + size + "}";
    }
}
