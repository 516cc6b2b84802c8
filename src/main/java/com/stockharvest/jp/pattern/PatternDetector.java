package com.stockharvest.jp.pattern;

import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.PatternId;
import com.stockharvest.jp.model.StockSnapshot;

/**
 * One rule chain. Implementations never throw: unexpected failures come back as
 * {@link com.stockharvest.jp.model.VerdictStatus#ERROR} verdicts.
 */
public interface PatternDetector {

    PatternId patternId();

    DetectionVerdict evaluate(StockSnapshot snapshot, IndicatorSet indicators);
}
