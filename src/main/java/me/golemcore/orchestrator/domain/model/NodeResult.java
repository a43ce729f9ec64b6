package me.golemcore.orchestrator.domain.model;

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
 * Output of a workflow node. For parallel composites {@code branchOutputs}
 * maps each child name to its output in declared order; it is empty
 * otherwise.
 */
public record NodeResult(String name, String output, Map<String, String> branchOutputs) {

    public NodeResult {
        branchOutputs = branchOutputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(branchOutputs))
                : Map.of();
    }

    public static NodeResult of(String name, String output) {
        return new NodeResult(name, output, Map.of());
    }
}
