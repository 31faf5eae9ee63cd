/// Concurrent, resumable and verified download of products from the data hub.
///
/// {@link io.hubfetch.download.Downloader} is the entry point. It combines a
/// {@link io.hubfetch.download.ResumableTransfer} per file, a
/// {@link io.hubfetch.download.RetrievalTrigger} for products in the Long Term Archive and a
/// {@link io.hubfetch.download.ConcurrencyLimiter} that keeps all requests within the hub's quotas.
package io.hubfetch.download;

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
