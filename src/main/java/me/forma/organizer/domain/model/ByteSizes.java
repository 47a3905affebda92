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

/**
 * Human-readable byte counts using binary units.
 */
public final class ByteSizes {

    private static final double KB = 1024;
    private static final double MB = KB * 1024;
    private static final double GB = MB * 1024;
    private static final double TB = GB * 1024;

    private ByteSizes() {
    }

    public static String format(long bytes) {
        double value = bytes;
        if (value >= TB) {
            return String.format(Locale.ROOT, "%.1fTB", value / TB);
        } else if (value >= GB) {
            return String.format(Locale.ROOT, "%.1fGB", value / GB);
        } else if (value >= MB) {
            return String.format(Locale.ROOT, "%.0fMB", value / MB);
        } else if (value >= KB) {
            return String.format(Locale.ROOT, "%.0fKB", value / KB);
        }
        return bytes + "B";
    }
}
