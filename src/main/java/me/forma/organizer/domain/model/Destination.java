package me.forma.organizer.domain.model;

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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Where a matched file should go: either the trash or a folder identified by a
 * display path such as {@code Documents/Finance}.
 *
 * <p>
 * A folder destination starts unresolved and becomes usable only after a
 * {@link me.forma.organizer.port.outbound.DestinationResolverPort} attaches an
 * opaque access token to it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Destination {

    public enum Type {
        TRASH, FOLDER
    }

    private static final String TRASH_DISPLAY_NAME = "Trash";

    Type type;
    String displayPath;
    String accessToken;

    public static Destination trash() {
        return new Destination(Type.TRASH, TRASH_DISPLAY_NAME, null);
    }

    public static Destination unresolved(String displayPath) {
        return new Destination(Type.FOLDER, requirePath(displayPath), null);
    }

    public static Destination resolved(String displayPath, String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token must not be blank");
        }
        return new Destination(Type.FOLDER, requirePath(displayPath), accessToken);
    }

    public boolean isTrash() {
        return type == Type.TRASH;
    }

    /**
     * Trash needs no resolution; folders are resolved once they carry a token.
     */
    public boolean isResolved() {
        return isTrash() || accessToken != null;
    }

    /**
     * Same target regardless of resolution state.
     */
    public boolean sameTarget(Destination other) {
        if (other == null || type != other.type) {
            return false;
        }
        return isTrash() || displayPath.equals(other.displayPath);
    }

    private static String requirePath(String displayPath) {
        if (displayPath == null || displayPath.isBlank()) {
            throw new IllegalArgumentException("Destination path must not be blank");
        }
        return displayPath;
    }
}
