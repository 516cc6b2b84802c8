package com.stockharvest.jp.signal;

import com.stockharvest.jp.model.TrendDirection;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TimeframeConsistency {
    public final Map<String, TrendDirection> trends;
    public final double consistency;
    public final TrendDirection overallDirection;
}
