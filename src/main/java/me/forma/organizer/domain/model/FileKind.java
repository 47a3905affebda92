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

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed table of file kinds and the extensions that belong to each. Kind names
 * are accepted in singular or plural form, case-insensitively.
 */
public enum FileKind {
    IMAGE("image", Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif", "heic", "heif", "webp", "svg", "ico")),
    AUDIO("audio", Set.of("mp3", "wav", "aac", "flac", "ogg", "m4a", "wma", "aiff", "ape")),
    VIDEO("video", Set.of("mp4", "mov", "avi", "mkv", "flv", "wmv", "m4v", "mpg", "mpeg", "webm")),
    DOCUMENT("document", Set.of("pdf", "doc", "docx", "txt", "rtf", "odt", "pages", "tex")),
    SPREADSHEET("spreadsheet", Set.of("xls", "xlsx", "csv", "numbers", "ods")),
    PRESENTATION("presentation", Set.of("ppt", "pptx", "key", "odp")),
    ARCHIVE("archive", Set.of("zip", "rar", "7z", "tar", "gz", "bz2", "xz", "dmg", "pkg", "iso")),
    CODE("code", Set.of("swift", "py", "js", "ts", "java", "cpp", "c", "h", "cs", "rb", "go", "rs", "php", "html",
            "css", "json", "xml", "yaml", "yml"));

    private final String singularName;
    private final Set<String> extensions;

    FileKind(String singularName, Set<String> extensions) {
        this.singularName = singularName;
        this.extensions = extensions;
    }

    public boolean includes(String extension) {
        if (extension == null) {
            return false;
        }
        return extensions.contains(stripDot(extension).toLowerCase(Locale.ROOT));
    }

    /**
     * Looks up a kind by name. "image", "Images" and "IMAGE" all resolve to
     * {@link #IMAGE}; unknown names resolve to empty.
     */
    public static Optional<FileKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FileKind kind : values()) {
            if (kind.singularName.equals(normalized) || (kind.singularName + "s").equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    private static String stripDot(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }
}
