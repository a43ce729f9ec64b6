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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Argument checks and merge logic common to the root store and branch
 * overlays.
 */
@Slf4j
abstract class AbstractSharedState implements SharedState {

    protected abstract void put(String key, Object value);

    @Override
    public final void set(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("State key must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("State value for key '" + key + "' must not be null");
        }
        put(key, value);
    }

    @Override
    public StateView snapshot() {
        return new StateSnapshot(asMap());
    }

    @Override
    public List<String> merge(List<StateDelta> deltas) {
        Objects.requireNonNull(deltas, "deltas");
        Map<String, String> writers = new HashMap<>();
        List<String> collisions = new ArrayList<>();
        for (StateDelta delta : deltas) {
            for (Map.Entry<String, Object> entry : delta.writes().entrySet()) {
                String previousWriter = writers.put(entry.getKey(), delta.source());
                if (previousWriter != null) {
                    collisions.add(entry.getKey());
                    log.warn("[State] Parallel branches '{}' and '{}' both wrote key '{}', keeping value from '{}'",
                            previousWriter, delta.source(), entry.getKey(), delta.source());
                }
                set(entry.getKey(), entry.getValue());
            }
        }
        return collisions;
    }
}
