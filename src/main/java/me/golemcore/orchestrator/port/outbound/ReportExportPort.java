package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.RunResult;

import java.nio.file.Path;

/**
 * Port for persisting the outcome of a completed run for later reading.
 */
public interface ReportExportPort {

    /**
     * Writes a report of the run and returns where it was stored.
     *
     * @throws java.io.UncheckedIOException
     *             if the report cannot be written
     */
    Path export(RunResult result);
}
