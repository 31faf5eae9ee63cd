package io.hubfetch.transport;

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

import com.google.gson.annotations.SerializedName;

/// Gson bindings for the parts of OData documents the catalog client reads.
final class ODataModel {

    private ODataModel() {
    }

    static class ProductEnvelope {
        ProductEntry d;
    }

    static class ProductEntry {
        @SerializedName("Id")
        String id;
        @SerializedName("Name")
        String name;
        @SerializedName("ContentLength")
        String contentLength;
        @SerializedName("Checksum")
        ChecksumEntry checksum;
        @SerializedName("Online")
        Boolean online;
        @SerializedName("__metadata")
        Metadata metadata;
    }

    static class ChecksumEntry {
        @SerializedName("Algorithm")
        String algorithm;
        @SerializedName("Value")
        String value;
    }

    static class Metadata {
        @SerializedName("media_src")
        String mediaSrc;
    }

    static class NodeEnvelope {
        NodeEntry d;
    }

    static class NodeEntry {
        @SerializedName("ContentLength")
        String contentLength;
    }

    static class ErrorEnvelope {
        ErrorEntry error;
    }

    static class ErrorEntry {
        ErrorMessage message;
    }

    static class ErrorMessage {
        String value;
    }
}
