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
 * Discriminator for {@link Condition} variants.
 */
public enum ConditionKind {
    EXTENSION_EQUALS, NAME_STARTS_WITH, NAME_CONTAINS, NAME_ENDS_WITH, OLDER_THAN, MODIFIED_OLDER_THAN, ACCESSED_OLDER_THAN, LARGER_THAN, KIND_EQUALS, FROM_LOCATION, NEGATED, TIME_OF_DAY, DAYS_OF_WEEK
}
