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

/// Selects the files of a product package to download.
@FunctionalInterface
public interface NodeFilter {

    /// @param node a node listed in the product manifest
    /// @return true to download the node
    boolean accept(NodeDescriptor node);

    /// @param other another filter
    /// @return a filter accepting nodes accepted by both
    default NodeFilter and(NodeFilter other) {
        return node -> accept(node) && other.accept(node);
    }

    /// @param other another filter
    /// @return a filter accepting nodes accepted by either
    default NodeFilter or(NodeFilter other) {
        return node -> accept(node) || other.accept(node);
    }

    /// @return a filter accepting the nodes this one rejects
    default NodeFilter negate() {
        return node -> !accept(node);
    }
}
