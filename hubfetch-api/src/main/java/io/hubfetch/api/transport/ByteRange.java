package io.hubfetch.api.transport;

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

/// A byte range for an HTTP `Range` request header.
///
/// @param start the first byte, inclusive
/// @param end the last byte, inclusive, or negative for an open ended range
public record ByteRange(long start, long end) {
    public ByteRange {
        if (start < 0) throw new IllegalArgumentException("Range start cannot be negative: " + start);
        if (end >= 0 && end < start) throw new IllegalArgumentException("Range end " + end + " is before start " + start);
    }

    /// @param start the first byte
    /// @return a range from start to the end of the resource
    public static ByteRange from(long start) {
        return new ByteRange(start, -1);
    }

    /// @param start the first byte
    /// @param end the last byte, inclusive
    /// @return a closed range
    public static ByteRange of(long start, long end) {
        return new ByteRange(start, end);
    }

    /// @return true if the range extends to the end of the resource
    public boolean isOpenEnded() {
        return end < 0;
    }

    /// @return the value for a `Range` header, e.g. `bytes=100-` or `bytes=0-1`
    public String toHeaderValue() {
        return "bytes=" + start + "-" + (isOpenEnded() ? "" : String.valueOf(end));
    }

    @Override
    public String toString() {
        return toHeaderValue();
    }
}
