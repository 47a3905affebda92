package me.forma.organizer.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.forma.organizer.domain.model.Destination;

import java.util.Optional;

/**
 * Port for turning an unresolved folder destination into one the host may
 * write to.
 */
public interface DestinationResolverPort {

    /**
     * Resolve a placeholder destination.
     *
     * @param placeholder
     *            unresolved folder destination identified by its display path
     * @return the resolved destination carrying an access token, or empty when
     *         the folder cannot be accessed
     */
    Optional<Destination> resolve(Destination placeholder);
}
