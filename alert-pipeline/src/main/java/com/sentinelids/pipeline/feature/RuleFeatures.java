package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;

/**
 * Sensor rule id features. Ids above one million are local or community
 * rules rather than the vendor rule set.
 *
 * @author Naveed Gung
 */
final class RuleFeatures implements FeatureExtractor.FeatureGroup {

    static final long LOCAL_RULE_THRESHOLD = 1_000_000L;

    @Override
    public int width() {
        return 2;
    }

    @Override
    public void extract(RawAlert alert, double[] into, int offset) {
        long ruleId = alert.hasSensorRule() ? alert.sensorRuleId() : 0L;
        into[offset] = ruleId;
        into[offset + 1] = ruleId > LOCAL_RULE_THRESHOLD ? 1.0 : 0.0;
    }
}
