package com.stockharvest.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RiskAssessment {
    public final RiskLevel riskLevel;
    public final double riskScore;
    public final List<String> riskFactors;
    public final String recommendation;
}
