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

import lombok.RequiredArgsConstructor;
import me.forma.organizer.port.outbound.DestinationResolverPort;
import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link ClassificationEngine} per scan so that each batch
 * gets its own destination cache.
 */
@Component
@RequiredArgsConstructor
public class ClassificationEngineFactory {

    private final ConditionEvaluator conditionEvaluator;
    private final DestinationResolverPort destinationResolver;

    public ClassificationEngine create() {
        return new ClassificationEngine(conditionEvaluator, destinationResolver);
    }
}
