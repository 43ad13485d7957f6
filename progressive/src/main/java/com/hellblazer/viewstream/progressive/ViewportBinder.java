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
 * Binds a loading session to the viewport resource its chunks are loaded into. The scheduler binds the session before
 * dispatching each of its chunks and unbinds it once the session is finished or cancelled. Binding an already bound
 * session must confirm the resource is still held, reacquiring it if it was lost.
 */
public interface ViewportBinder {

    /**
     * @return false when no viewport resource is available right now; the chunk stays queued
     */
    boolean bind(String sessionId);

    void unbind(String sessionId);
}
