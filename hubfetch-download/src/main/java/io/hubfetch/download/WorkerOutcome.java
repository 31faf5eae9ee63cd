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

/// What a batch worker reports back when it finishes. Workers never throw.
///
/// @param productId the product the worker handled
/// @param role which pool the worker ran in
/// @param kind how the work ended
/// @param product the downloaded product, for successful download workers
/// @param error the failure, for failed workers
record WorkerOutcome(String productId, Role role, Kind kind, ResolvedProduct product, Exception error) {

    enum Role {
        DOWNLOAD,
        TRIGGER
    }

    enum Kind {
        /// the work completed
        OK,
        /// the work failed with an error
        FAILED,
        /// the batch stop signal ended the work
        CANCELLED,
        /// a download worker gave up because the product never came online
        SKIPPED
    }

    static WorkerOutcome downloaded(ResolvedProduct product) {
        return new WorkerOutcome(product.id(), Role.DOWNLOAD, Kind.OK, product, null);
    }

    static WorkerOutcome online(String productId) {
        return new WorkerOutcome(productId, Role.TRIGGER, Kind.OK, null, null);
    }

    static WorkerOutcome failed(String productId, Role role, Exception error) {
        return new WorkerOutcome(productId, role, Kind.FAILED, null, error);
    }

    static WorkerOutcome cancelled(String productId, Role role) {
        return new WorkerOutcome(productId, role, Kind.CANCELLED, null, null);
    }

    static WorkerOutcome skipped(String productId) {
        return new WorkerOutcome(productId, Role.DOWNLOAD, Kind.SKIPPED, null, null);
    }
}
