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

package me.golemcore.spoiler.domain.model;

/**
 * States a text message passes through in the message pipeline.
 *
 * <pre>
 * RECEIVED → GATE_CHECKED → SKIPPED
 *                         → MATCHED → REWRITTEN → REPUBLISH_ATTEMPTED → SUCCEEDED | DEGRADED
 * </pre>
 */
public enum PipelineState {
    RECEIVED,
    GATE_CHECKED,
    SKIPPED,
    MATCHED,
    REWRITTEN,
    REPUBLISH_ATTEMPTED,
    SUCCEEDED,
    DEGRADED;

    public boolean isTerminal() {
        return this == SKIPPED || this == SUCCEEDED || this == DEGRADED;
    }
}
