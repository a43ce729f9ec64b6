package me.golemcore.orchestrator.domain.component;

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
 * Base interface for pluggable components of the orchestrator. External tools
 * are components; agents and composites are described by immutable
 * {@link me.golemcore.orchestrator.domain.model.WorkflowNode} descriptors
 * instead.
 */
public interface Component {

    /**
     * Checks whether this component is configured and usable. Disabled
     * components stay registered and answer with a failure result.
     *
     * @return true if the component is enabled
     */
    default boolean isEnabled() {
        return true;
    }
}
