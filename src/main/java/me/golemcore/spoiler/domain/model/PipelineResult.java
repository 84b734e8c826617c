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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one pipeline run.
 */
@Data
@Builder
public class PipelineResult {

    private PipelineState state;

    /**
     * Why the run ended in {@link PipelineState#SKIPPED}, null otherwise.
     */
    private SkipReason skipReason;

    @Builder.Default
    private List<String> matchedKeywords = List.of();

    /**
     * Attributed, spoiler-marked text; set once the run reached
     * {@link PipelineState#REWRITTEN}.
     */
    private String republishedText;

    /**
     * Whether deleting the original succeeded. Meaningful only for
     * {@link PipelineState#DEGRADED}, where either step may have failed.
     */
    private boolean originalDeleted;

    public static PipelineResult skipped(SkipReason reason) {
        return PipelineResult.builder()
                .state(PipelineState.SKIPPED)
                .skipReason(reason)
                .build();
    }

    public enum SkipReason {
        CHAT_DISABLED,
        NO_KEYWORDS,
        NO_TEXT,
        NO_MATCH
    }
}
