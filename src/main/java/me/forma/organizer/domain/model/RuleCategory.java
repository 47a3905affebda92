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

import java.util.UUID;

/**
 * Named group of rules sharing a folder scope.
 */
@Value
@Builder(toBuilder = true)
public class RuleCategory {

    public static final String DEFAULT_NAME = "General";

    @Builder.Default
    UUID id = UUID.randomUUID();

    @Builder.Default
    String name = DEFAULT_NAME;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    CategoryScope scope = CategoryScope.global();
}
