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
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Root state store of one session. Safe for concurrent use; each write is
 * atomic per key.
 */
public class SessionStateStore extends AbstractSharedState {

    private final String sessionId;
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public SessionStateStore(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    protected void put(String key, Object value) {
        values.put(key, value);
    }

    @Override
    public Optional<Object> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeMap<>(values).keySet());
    }

    @Override
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }

    @Override
    public String toString() {
        return "SessionStateStore[" + sessionId + "]" + keys();
    }
}
