package me.forma.organizer.adapter.outbound.resolver;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.forma.organizer.domain.model.Destination;
import me.forma.organizer.infrastructure.config.OrganizerProperties;
import me.forma.organizer.port.outbound.DestinationResolverPort;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves display paths such as {@code Documents/Finance} against configured
 * known-folder roots ({@code organizer.resolver.roots.Documents=/home/u/Documents}).
 *
 * <p>
 * The first path segment selects the root, case-insensitively. A leading
 * {@code ~/} is ignored. Paths that would climb out of their root are refused.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnownFolderDestinationResolver implements DestinationResolverPort {

    private final OrganizerProperties properties;

    @Override
    public Optional<Destination> resolve(Destination placeholder) {
        if (placeholder == null || placeholder.isTrash()) {
            return Optional.ofNullable(placeholder);
        }
        if (placeholder.isResolved()) {
            return Optional.of(placeholder);
        }

        List<String> segments = segments(placeholder.getDisplayPath());
        if (segments.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> root = findRoot(segments.get(0));
        if (root.isEmpty()) {
            log.debug("[Resolver] No known folder for '{}'", placeholder.getDisplayPath());
            return Optional.empty();
        }

        try {
            Path rootPath = Path.of(root.get()).toAbsolutePath().normalize();
            Path target = rootPath;
            for (String segment : segments.subList(1, segments.size())) {
                target = target.resolve(segment);
            }
            target = target.normalize();
            if (!target.startsWith(rootPath)) {
                log.warn("[Resolver] Refusing '{}': escapes its root", placeholder.getDisplayPath());
                return Optional.empty();
            }
            return Optional.of(Destination.resolved(placeholder.getDisplayPath(), target.toString()));
        } catch (InvalidPathException e) {
            log.warn("[Resolver] Invalid path '{}': {}", placeholder.getDisplayPath(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> findRoot(String name) {
        for (Map.Entry<String, String> entry : properties.getResolver().getRoots().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && entry.getValue() != null && !entry.getValue().isBlank()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private static List<String> segments(String displayPath) {
        String path = displayPath.trim();
        if (path.startsWith("~/")) {
            path = path.substring(2);
        }
        return Arrays.stream(path.split("/"))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .toList();
    }
}
