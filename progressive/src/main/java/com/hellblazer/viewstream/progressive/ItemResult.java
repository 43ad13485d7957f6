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
package com.hellblazer.viewstream.progressive;

/**
 * Outcome of one item in a chunk. Exactly one of {@code item} and {@code error} is non-null.
 */
public record ItemResult(String itemId, LoadedItem item, Throwable error) {

    public static ItemResult loaded(String itemId, LoadedItem item) {
        return new ItemResult(itemId, item, null);
    }

    public static ItemResult failed(String itemId, Throwable error) {
        return new ItemResult(itemId, null, error);
    }

    public boolean isLoaded() {
        return error == null;
    }
}
