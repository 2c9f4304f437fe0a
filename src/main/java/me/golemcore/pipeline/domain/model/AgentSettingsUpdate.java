package me.golemcore.pipeline.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial update of non-schedule agent settings; null fields are left
 * untouched.
 */
@Value
@Builder
public class AgentSettingsUpdate {

    String modelName;
    BigDecimal temperature;
    Integer maxTokens;
    Integer rateLimitPerHour;
    BigDecimal costLimitDailyUsd;
    String updatedBy;
}
