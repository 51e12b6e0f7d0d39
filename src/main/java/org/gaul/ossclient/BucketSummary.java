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

public final class BucketSummary {
    private final String name;
    private final String location;
    private final String creationDate;
    private final String storageClass;

    public BucketSummary(String name, String location, String creationDate,
            String storageClass) {
        this.name = requireNonNull(name);
        this.location = Strings.nullToEmpty(location);
        this.creationDate = Strings.nullToEmpty(creationDate);
        this.storageClass = Strings.nullToEmpty(storageClass);
    }

    public String getName() {
        return name;
    }

    public String getLocation() {
        return location;
    }

    public String getCreationDate() {
        return creationDate;
    }

    public String getStorageClass() {
        return storageClass;
    }

    @Override
    public String toString() {
        return name + " " + location + " " + creationDate;
    }
}
