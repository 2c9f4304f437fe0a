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

package me.golemcore.pipeline.usage;

import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the USD cost of a call from its token counts. Prices are per 1K
 * tokens and matched by model-name fragment; unknown models cost nothing.
 */
@Component
public class ModelPricingTable {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int COST_SCALE = 6;

    private final Map<String, PipelineProperties.ModelPricing> pricing;

    public ModelPricingTable(PipelineProperties properties) {
        this.pricing = properties.getUsage().getPricing();
    }

    public BigDecimal cost(String model, long inputTokens, long outputTokens) {
        PipelineProperties.ModelPricing price = find(model);
        if (price == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal input = price.getInputPer1k().multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal output = price.getOutputPer1k().multiply(BigDecimal.valueOf(outputTokens));
        return input.add(output).divide(THOUSAND, COST_SCALE, RoundingMode.HALF_UP);
    }

    private PipelineProperties.ModelPricing find(String model) {
        if (model == null) {
            return null;
        }
        String normalized = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, PipelineProperties.ModelPricing> entry : pricing.entrySet()) {
            if (normalized.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                return entry.getValue();
            }
        }
        return null;
    }
}
