package me.golemcore.pipeline.port.outbound;

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

import me.golemcore.pipeline.domain.model.GenerationRequest;
import me.golemcore.pipeline.domain.model.GenerationResponse;

/**
 * Structured-output generation service. One call per attempt; retries are
 * the caller's concern.
 *
 * <p>
 * Failures surface as {@link me.golemcore.pipeline.domain.exception.AnalysisException}
 * subclasses that tell retryable from non-retryable causes, or as
 * {@link me.golemcore.pipeline.domain.exception.ConfigurationException} when
 * the service is not configured.
 */
public interface GenerationPort {

    String getProviderId();

    GenerationResponse generate(GenerationRequest request);
}
