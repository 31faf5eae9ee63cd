/// Error taxonomy for data hub access.
///
/// All types are unchecked and extend {@link io.hubfetch.api.errors.DataHubException}.
/// Retry decisions are made on the concrete type:
///
/// - {@link io.hubfetch.api.errors.UnauthorizedException}: fatal, aborts a whole batch
/// - {@link io.hubfetch.api.errors.ServerErrorException}: transient
/// - {@link io.hubfetch.api.errors.LTAException}: transient unless {@code isTerminal()}
/// - {@link io.hubfetch.api.errors.InvalidChecksumException}: retried at the download level
/// - {@link io.hubfetch.api.errors.ChecksumUnavailableException}: not retried
/// - {@link io.hubfetch.api.errors.DownloadCancelledException}: propagates immediately
package io.hubfetch.api.errors;

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
