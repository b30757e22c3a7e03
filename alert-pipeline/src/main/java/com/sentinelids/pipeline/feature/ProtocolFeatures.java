package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;

import java.util.List;

/**
 * One-hot protocol encoding. Unknown protocols encode as all zeros.
 *
 * @author Naveed Gung
 */
final class ProtocolFeatures implements FeatureExtractor.FeatureGroup {

    static final List<String> PROTOCOLS = List.of("TCP", "UDP", "ICMP", "HTTP", "HTTPS");

    @Override
    public int width() {
        return PROTOCOLS.size();
    }

    @Override
    public void extract(RawAlert alert, double[] into, int offset) {
        String protocol = alert.protocol();
        for (int i = 0; i < PROTOCOLS.size(); i++) {
            into[offset + i] = PROTOCOLS.get(i).equalsIgnoreCase(protocol) ? 1.0 : 0.0;
        }
    }
}
