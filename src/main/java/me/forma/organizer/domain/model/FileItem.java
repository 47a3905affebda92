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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a file discovered by a scan, plus the outcome of classifying it.
 *
 * <p>
 * Classification never mutates an item; it returns a copy with the
 * destination, confidence, reason and matched rule filled in (or cleared).
 */
@Value
@Builder(toBuilder = true)
public class FileItem {

    String path;
    String name;
    String fileExtension;
    long sizeInBytes;
    Instant creationDate;
    Instant modificationDate;
    Instant lastAccessedDate;

    @Builder.Default
    FileLocationKind location = FileLocationKind.UNKNOWN;

    Destination destination;

    @Builder.Default
    FileStatus status = FileStatus.PENDING;

    UUID matchedRuleId;
    Double confidenceScore;
    String matchReason;

    String rejectedDestination;
    int rejectionCount;

    public FileItem withoutClassification() {
        return toBuilder()
                .destination(null)
                .status(FileStatus.PENDING)
                .matchedRuleId(null)
                .confidenceScore(null)
                .matchReason(null)
                .build();
    }
}
