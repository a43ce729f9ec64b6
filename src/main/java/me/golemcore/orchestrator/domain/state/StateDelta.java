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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes made by one parallel branch, keyed by the branch that made them.
 */
public record StateDelta(String source, Map<String, Object> writes) {

    public StateDelta {
        writes = writes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(writes)) : Map.of();
    }

    public boolean isEmpty() {
        return writes.isEmpty();
    }
}
