/// Selection of individual files from multi-file product packages.
///
/// A {@link io.hubfetch.download.nodes.NodeFilter} in the download configuration switches the
/// downloader from whole archives to per-file downloads driven by the product manifest, which
/// {@link io.hubfetch.download.nodes.ManifestParser} reads.
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
