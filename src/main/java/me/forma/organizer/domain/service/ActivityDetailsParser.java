package me.forma.organizer.domain.service;

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

import java.util.List;

/**
 * Recovers destination paths from the free-text details of activity records.
 *
 * <p>
 * Markers are tried in order and matched case-insensitively; the text after
 * the first marker found is the destination, trimmed. Details without a marker
 * yield an empty string.
 */
public final class ActivityDetailsParser {

    static final List<String> DESTINATION_MARKERS = List.of("Moved to ", "Organized to ", "to ");
    static final List<String> REJECTION_MARKERS = List.of("Skipped suggestion for ", "Rejected ", "Skipped: ");

    private ActivityDetailsParser() {
    }

    /**
     * {@code "Moved to Documents/Finance"} gives {@code "Documents/Finance"}.
     */
    public static String extractDestination(String details) {
        return extractAfterMarker(details, DESTINATION_MARKERS);
    }

    /**
     * {@code "Skipped suggestion for Desktop/Temp"} gives
     * {@code "Desktop/Temp"}.
     */
    public static String extractRejectedDestination(String details) {
        return extractAfterMarker(details, REJECTION_MARKERS);
    }

    private static String extractAfterMarker(String details, List<String> markers) {
        if (details == null || details.isEmpty()) {
            return "";
        }
        for (String marker : markers) {
            int index = indexOfIgnoreCase(details, marker);
            if (index >= 0) {
                return details.substring(index + marker.length()).trim();
            }
        }
        return "";
    }

    private static int indexOfIgnoreCase(String text, String marker) {
        for (int i = 0; i + marker.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, marker, 0, marker.length())) {
                return i;
            }
        }
        return -1;
    }
}
