package io.hubfetch.download.nodes;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.hubfetch.api.catalog.NodeDescriptor;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/// Common node filters.
///
/// Path patterns are shell style globs matched against the node path without its leading `./`,
/// ignoring case. As with `fnmatch`, `*` matches any run of characters including `/`, `?`
/// matches a single character and `[...]` or `[!...]` a character class, so `*.tiff` selects
/// every raster wherever it sits. A leading `**/` may also match no directory at all.
public final class NodeFilters {

    private NodeFilters() {
    }

    /// @return a filter accepting every node
    public static NodeFilter all() {
        return node -> true;
    }

    /// @param maxBytes the largest accepted node size
    /// @return a filter accepting nodes no larger than maxBytes
    public static NodeFilter maxSize(long maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("Maximum node size cannot be negative: " + maxBytes);
        }
        return node -> node.size() <= maxBytes;
    }

    /// @param glob a path glob
    /// @return a filter accepting nodes whose path matches the glob
    public static NodeFilter pathMatches(String glob) {
        Pattern pattern = globToPattern(glob);
        return node -> pattern.matcher(normalize(node)).matches();
    }

    /// @param glob a path glob
    /// @return a filter rejecting nodes whose path matches the glob
    public static NodeFilter pathExcludes(String glob) {
        return pathMatches(glob).negate();
    }

    /// @param filters the filters to combine
    /// @return a filter accepting nodes accepted by all filters, or every node if none are given
    public static NodeFilter and(NodeFilter... filters) {
        return Arrays.stream(filters).reduce(all(), NodeFilter::and);
    }

    /// @param filters the filters to combine
    /// @return a filter accepting nodes accepted by any filter, or no node if none are given
    public static NodeFilter or(NodeFilter... filters) {
        return Arrays.stream(filters).reduce(node -> false, NodeFilter::or);
    }

    /// @param filter a filter
    /// @return its negation
    public static NodeFilter not(NodeFilter filter) {
        return filter.negate();
    }

    private static String normalize(NodeDescriptor node) {
        return node.relativePath().toLowerCase(Locale.ROOT);
    }

    static Pattern globToPattern(String glob) {
        if (glob == null || glob.isBlank()) {
            throw new IllegalArgumentException("Glob pattern is required");
        }
        String source = glob.startsWith("./") ? glob.substring(2) : glob;
        source = source.toLowerCase(Locale.ROOT);
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '*') {
                int end = i;
                while (end < source.length() && source.charAt(end) == '*') {
                    end++;
                }
                // "**/" also matches no directory at all
                if (end - i > 1 && end < source.length() && source.charAt(end) == '/') {
                    regex.append("(?:.*/)?");
                    end++;
                } else {
                    regex.append(".*");
                }
                i = end;
            } else if (c == '?') {
                regex.append('.');
                i++;
            } else if (c == '[') {
                int close = classEnd(source, i);
                if (close < 0) {
                    regex.append(Pattern.quote("["));
                    i++;
                } else {
                    regex.append(characterClass(source.substring(i + 1, close)));
                    i = close + 1;
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.toString());
    }

    /// @return the index of the `]` closing the class opened at start, or -1 if it is unclosed
    private static int classEnd(String source, int start) {
        int j = start + 1;
        if (j < source.length() && source.charAt(j) == '!') {
            j++;
        }
        // a leading ']' is a member of the class
        if (j < source.length() && source.charAt(j) == ']') {
            j++;
        }
        while (j < source.length() && source.charAt(j) != ']') {
            j++;
        }
        return j < source.length() ? j : -1;
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int k = 0;
        if (body.startsWith("!")) {
            cls.append('^');
            k = 1;
        }
        for (; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' && k > 0 && k < body.length() - 1) {
                cls.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                cls.append(c);
            } else {
                cls.append('\\').append(c);
            }
        }
        return cls.append(']').toString();
    }
}
