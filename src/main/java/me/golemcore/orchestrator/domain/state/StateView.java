package me.golemcore.orchestrator.domain.state;

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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of session state.
 */
public interface StateView {

    Optional<Object> get(String key);

    default boolean contains(String key) {
        return get(key).isPresent();
    }

    /**
     * Value rendered as text: strings as-is, anything else through
     * {@link Object#toString()}.
     */
    default Optional<String> getText(String key) {
        return get(key).map(String::valueOf);
    }

    Set<String> keys();

    /**
     * Immutable copy of every entry visible through this view, keys sorted.
     */
    Map<String, Object> asMap();
}
