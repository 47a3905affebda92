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

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Set of folders a rule category applies to. A global scope applies
 * everywhere.
 *
 * <p>
 * Folder containment is decided on path components, so {@code /a/b} contains
 * {@code /a/b/c.pdf} but not {@code /a/bc/d.pdf}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CategoryScope {

    private static final CategoryScope GLOBAL = new CategoryScope(true, List.of());

    boolean global;
    List<String> folders;

    public static CategoryScope global() {
        return GLOBAL;
    }

    public static CategoryScope folders(Collection<String> folders) {
        if (folders == null || folders.isEmpty()) {
            throw new IllegalArgumentException("Folder scope needs at least one folder");
        }
        return new CategoryScope(false, List.copyOf(folders));
    }

    /**
     * Whether a file at the given path falls inside this scope.
     */
    public boolean contains(String filePath) {
        if (global) {
            return true;
        }
        Optional<Path> file = toPath(filePath);
        if (file.isEmpty()) {
            return false;
        }
        return folders.stream()
                .map(CategoryScope::toPath)
                .flatMap(Optional::stream)
                .anyMatch(folder -> file.get().startsWith(folder));
    }

    /**
     * Whether some file could be inside both scopes: either is global, or one
     * folder of each side is equal to or nested in the other.
     */
    public boolean couldOverlap(CategoryScope other) {
        if (other == null || global || other.global) {
            return true;
        }
        for (String mine : folders) {
            Optional<Path> first = toPath(mine);
            if (first.isEmpty()) {
                continue;
            }
            for (String theirs : other.folders) {
                Optional<Path> second = toPath(theirs);
                if (second.isPresent()
                        && (first.get().startsWith(second.get()) || second.get().startsWith(first.get()))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Optional<Path> toPath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(value).normalize());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
