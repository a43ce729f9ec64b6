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

import java.util.List;

/**
 * Mutable key/value store shared by the components of one session. Values are
 * never null; a write replaces any previous value under the same key.
 */
public interface SharedState extends StateView {

    void set(String key, Object value);

    /**
     * Frozen view of the current contents.
     */
    StateView snapshot();

    /**
     * Applies branch deltas in the given order. A key written by more than one
     * delta keeps the value of the later delta.
     *
     * @return keys written by more than one delta
     */
    List<String> merge(List<StateDelta> deltas);
}
