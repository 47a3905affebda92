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
 * Kind of overlap between a candidate rule and an existing one, ordered by
 * severity.
 */
public enum OverlapType {
    EXACT_DUPLICATE(3, "Exact duplicate"), CONFLICTING(2, "Conflicting rule"), SUBSET(1,
            "Covered by existing rule"), SUPERSET(1, "Broader than existing rule"), PARTIAL_OVERLAP(0, "Partial overlap");

    private final int severity;
    private final String displayName;

    OverlapType(int severity, String displayName) {
        this.severity = severity;
        this.displayName = displayName;
    }

    public int getSeverity() {
        return severity;
    }

    public String getDisplayName() {
        return displayName;
    }
}
