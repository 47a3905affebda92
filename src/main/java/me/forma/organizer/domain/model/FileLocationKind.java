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

/**
 * Well-known folder a file was discovered in.
 */
public enum FileLocationKind {
    HOME("Home"), DESKTOP("Desktop"), DOWNLOADS("Downloads"), DOCUMENTS("Documents"), PICTURES("Pictures"), MUSIC(
            "Music"), CUSTOM("Custom Folder"), UNKNOWN("Unknown");

    private final String displayName;

    FileLocationKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
