package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;

/**
 * Port numbers, privileged-port flags and well-known service class.
 *
 * @author Naveed Gung
 */
final class PortFeatures implements FeatureExtractor.FeatureGroup {

    /** Service classes by index: web, email, ftp, ssh, dns, dhcp, telnet, snmp. */
    private static final int[][] SERVICE_PORTS = {
            {80, 443, 8080, 8443},
            {25, 110, 143, 993, 995},
            {20, 21},
            {22},
            {53},
            {67, 68},
            {23},
            {161, 162}
    };

    /** Class index for ports outside every service class. */
    static final int UNKNOWN_SERVICE = SERVICE_PORTS.length;

    @Override
    public int width() {
        return 6;
    }

    @Override
    public void extract(RawAlert alert, double[] into, int offset) {
        int src = alert.sourcePort();
        int dst = alert.destinationPort();
        into[offset] = src;
        into[offset + 1] = dst;
        into[offset + 2] = src < 1024 ? 1.0 : 0.0;
        into[offset + 3] = dst < 1024 ? 1.0 : 0.0;
        into[offset + 4] = serviceClass(src);
        into[offset + 5] = serviceClass(dst);
    }

    static int serviceClass(int port) {
        for (int i = 0; i < SERVICE_PORTS.length; i++) {
            for (int candidate : SERVICE_PORTS[i]) {
                if (candidate == port) {
                    return i;
                }
            }
        }
        return UNKNOWN_SERVICE;
    }
}
