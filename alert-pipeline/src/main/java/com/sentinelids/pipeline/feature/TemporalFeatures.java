package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;

/**
 * Reserved slots for hour of day, day of week and time since the previous
 * alert from the same source. Always zero in extractor version 1.
 *
 * @author Naveed Gung
 */
final class TemporalFeatures implements FeatureExtractor.FeatureGroup {

    @Override
    public int width() {
        return 3;
    }

    @Override
    public void extract(RawAlert alert, double[] into, int offset) {
        into[offset] = 0.0;
        into[offset + 1] = 0.0;
        into[offset + 2] = 0.0;
    }
}
