package com.sentinelids.pipeline.feature;

import com.sentinelids.pipeline.alert.RawAlert;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    private static RawAlert alert(String src, String dst, int srcPort, int dstPort, String protocol, String message,
            Long ruleId) {
        return new RawAlert(src, dst, srcPort, dstPort, protocol, message, ruleId,
                Instant.parse("2024-03-01T10:15:30Z"), null, null);
    }

    @Test
    void shouldAlwaysProduceFixedLength() {
        assertEquals(FeatureExtractor.FEATURE_LENGTH,
                extractor.extract(alert("10.0.0.5", "192.168.1.10", 51515, 22, "TCP", "scan", 1L)).length);
        assertEquals(FeatureExtractor.FEATURE_LENGTH,
                extractor.extract(alert(null, "not-an-ip", -1, 70000, null, null, null)).length);
        assertEquals(FeatureExtractor.FEATURE_LENGTH, extractor.extract(null).length);
    }

    @Test
    void shouldBeDeterministic() {
        RawAlert alert = alert("203.0.113.7", "10.1.2.3", 4444, 443, "https", "Exploit attempt: CVE-2024-1234!", 9L);

        assertArrayEquals(extractor.extract(alert), extractor.extract(alert));
    }

    @Test
    void shouldExtractSshScanFromPrivateHost() {
        double[] f = extractor.extract(alert("10.0.0.5", "192.168.1.10", 51515, 22, "TCP",
                "ET SCAN Potential SSH Scan", 2001219L));

        // address
        assertEquals(1.5, f[0], 1e-9);
        assertEquals(2.0, f[1], 1e-9);
        assertEquals(1.0, f[2]);
        assertEquals(1.0, f[3]);
        assertEquals(0.0, f[4]);
        // port
        assertEquals(51515.0, f[6]);
        assertEquals(22.0, f[7]);
        assertEquals(0.0, f[8]);
        assertEquals(1.0, f[9]);
        assertEquals(PortFeatures.UNKNOWN_SERVICE, f[10]);
        assertEquals(3.0, f[11]);
        // protocol one-hot
        assertEquals(1.0, f[12]);
        assertEquals(0.0, f[13] + f[14] + f[15] + f[16]);
        // message
        assertEquals(26.0, f[17]);
        assertEquals(5.0, f[18]);
        assertEquals(0.0, f[19]);
        assertEquals(0.0, f[20]);
        assertEquals(1.0, f[21]);
        assertEquals(0.0, f[22]);
        // temporal placeholders
        assertEquals(0.0, f[23] + f[24] + f[25]);
        // rule
        assertEquals(2001219.0, f[26]);
        assertEquals(1.0, f[27]);
    }

    @Test
    void shouldDegradeMalformedInputsToDefaults() {
        double[] f = extractor.extract(alert("garbage", "1.2.3", 0, 0, "", "", null));

        assertEquals(0.0, f[0]);
        assertEquals(0.0, f[1]);
        assertEquals(0.0, f[2]);
        assertEquals(0.0, f[3]);
        for (int i = 12; i < 17; i++) {
            assertEquals(0.0, f[i], "protocol slot " + i);
        }
        assertEquals(0.0, f[17]);
        assertEquals(0.0, f[26]);
    }

    @Test
    void shouldRecogniseMulticastAndPrivateRanges() {
        assertTrue(AddressFeatures.isMulticast("224.0.0.251"));
        assertFalse(AddressFeatures.isMulticast("8.8.8.8"));
        assertTrue(AddressFeatures.isPrivate("172.16.0.1"));
        assertTrue(AddressFeatures.isPrivate("192.168.0.1"));
        assertFalse(AddressFeatures.isPrivate("172.32.0.1"));
        assertEquals(0.0, AddressFeatures.octetEntropy("1.1.1.1"));
        assertEquals(2.0, AddressFeatures.octetEntropy("1.2.3.4"), 1e-9);
    }

    @Test
    void shouldClassifyWellKnownServicePorts() {
        assertEquals(0, PortFeatures.serviceClass(443));
        assertEquals(1, PortFeatures.serviceClass(25));
        assertEquals(3, PortFeatures.serviceClass(22));
        assertEquals(4, PortFeatures.serviceClass(53));
        assertEquals(PortFeatures.UNKNOWN_SERVICE, PortFeatures.serviceClass(31337));
    }
}
