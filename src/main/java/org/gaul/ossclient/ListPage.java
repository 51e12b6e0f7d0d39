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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * One page of a listing.  When {@link #isTruncated()} is true, pass
 * {@link #getNextMarker()} as {@link ListOptions.Builder#marker} to fetch the
 * next page; otherwise the listing is complete and the marker is empty.
 */
public final class ListPage {
    private final ImmutableList<ObjectSummary> entries;
    private final ImmutableList<String> commonPrefixes;
    private final boolean truncated;
    private final String nextMarker;

    public ListPage(List<ObjectSummary> entries, List<String> commonPrefixes,
            boolean truncated, String nextMarker) {
        this.entries = ImmutableList.copyOf(entries);
        this.commonPrefixes = ImmutableList.copyOf(commonPrefixes);
        this.truncated = truncated;
        this.nextMarker = truncated ? Strings.nullToEmpty(nextMarker) : "";
    }

    public ImmutableList<ObjectSummary> getEntries() {
        return entries;
    }

    public ImmutableList<String> getCommonPrefixes() {
        return commonPrefixes;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public String getNextMarker() {
        return nextMarker;
    }

    @Override
    public String toString() {
        return "ListPage{entries=" + entries.size() +
                ", commonPrefixes=" + commonPrefixes +
                ", truncated=" + truncated +
                ", nextMarker=" + nextMarker + "}";
    }
}
