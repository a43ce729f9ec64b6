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
 * Copy-on-write overlay used by one parallel branch. Reads fall through to the
 * snapshot taken at fan-out; writes stay local until the parent merges the
 * branch {@link #delta()}.
 */
public class BranchStateStore extends AbstractSharedState {

    private final String branchName;
    private final StateView base;
    private final Map<String, Object> writes = new ConcurrentHashMap<>();

    public BranchStateStore(String branchName, StateView base) {
        this.branchName = branchName;
        this.base = base;
    }

    @Override
    protected void put(String key, Object value) {
        writes.put(key, value);
    }

    @Override
    public Optional<Object> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Object local = writes.get(key);
        if (local != null) {
            return Optional.of(local);
        }
        return base.get(key);
    }

    @Override
    public Set<String> keys() {
        return asMap().keySet();
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> merged = new TreeMap<>(base.asMap());
        merged.putAll(writes);
        return Collections.unmodifiableMap(merged);
    }

    public StateDelta delta() {
        return new StateDelta(branchName, new TreeMap<>(writes));
    }

    public String getBranchName() {
        return branchName;
    }
}
