package me.golemcore.oracle.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of the sticky orientation. Snapshots are appended, never rewritten.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AegisState {

    public static final double DEFAULT_TEMPERATURE = 1.0;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private String summary = "";

    @Builder.Default
    private double temperature = DEFAULT_TEMPERATURE;

    private Instant createdAt;

    public static AegisState initial() {
        return AegisState.builder().build();
    }
}
