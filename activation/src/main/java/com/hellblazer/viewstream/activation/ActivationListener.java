/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Viewstream.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewstream.activation;

/**
 * Activation lifecycle notifications. Exceptions thrown by listeners are logged and ignored.
 */
public interface ActivationListener {

    default void viewportReady(String viewportId) {
    }

    /**
     * A viewport became READY through adjacency or predictive preloading rather than an explicit activation.
     */
    default void viewportPreloaded(String viewportId) {
    }

    default void viewportDeactivated(String viewportId) {
    }

    default void viewportFailed(String viewportId, Throwable error) {
    }
}
