package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;

import java.util.HashMap;
import java.util.Map;

/**
 * Address characteristics. Anything that is not a dotted quad gets zero
 * entropy and is neither private nor multicast.
 *
 * @author Naveed Gung
 */
final class AddressFeatures implements FeatureExtractor.FeatureGroup {

    @Override
    public int width() {
        return 6;
    }

    @Override
    public void extract(RawAlert alert, double[] into, int offset) {
        String src = alert.sourceIp();
        String dst = alert.destinationIp();
        into[offset] = octetEntropy(src);
        into[offset + 1] = octetEntropy(dst);
        into[offset + 2] = isPrivate(src) ? 1.0 : 0.0;
        into[offset + 3] = isPrivate(dst) ? 1.0 : 0.0;
        into[offset + 4] = isMulticast(src) ? 1.0 : 0.0;
        into[offset + 5] = isMulticast(dst) ? 1.0 : 0.0;
    }

    /** Shannon entropy (bits) of the distribution of the four octet strings. */
    static double octetEntropy(String ip) {
        String[] octets = split(ip);
        if (octets == null) {
            return 0.0;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (String octet : octets) {
            counts.merge(octet, 1, Integer::sum);
        }
        double entropy = 0.0;
        // iterate in octet order so the floating point sum is identical on every run
        for (String octet : octets) {
            Integer count = counts.remove(octet);
            if (count != null) {
                double p = (double) count / octets.length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }

    /** RFC 1918 ranges. */
    static boolean isPrivate(String ip) {
        int[] octets = parse(ip);
        if (octets == null) {
            return false;
        }
        return octets[0] == 10
                || (octets[0] == 172 && octets[1] >= 16 && octets[1] <= 31)
                || (octets[0] == 192 && octets[1] == 168);
    }

    static boolean isMulticast(String ip) {
        String[] octets = ip == null ? null : ip.split("\\.", -1);
        if (octets == null || octets.length == 0) {
            return false;
        }
        try {
            int first = Integer.parseInt(octets[0].trim());
            return first >= 224 && first <= 239;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String[] split(String ip) {
        if (ip == null) {
            return null;
        }
        String[] octets = ip.split("\\.", -1);
        return octets.length == 4 ? octets : null;
    }

    private static int[] parse(String ip) {
        String[] parts = split(ip);
        if (parts == null) {
            return null;
        }
        int[] octets = new int[4];
        try {
            for (int i = 0; i < 4; i++) {
                octets[i] = Integer.parseInt(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return octets;
    }
}
