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
 * Kinds of user activity recorded in the history log.
 */
public enum ActivityType {
    FILE_ORGANIZED, FILE_MOVED, FILE_SKIPPED, FILE_DELETED, RULE_APPLIED, RULE_CREATED, RULE_UPDATED, RULE_DELETED, SCAN_COMPLETED;

    /**
     * Whether the activity represents a file being placed into a destination.
     */
    public boolean isOrganization() {
        return this == FILE_ORGANIZED || this == FILE_MOVED;
    }
}
