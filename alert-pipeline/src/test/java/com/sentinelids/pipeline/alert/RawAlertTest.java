package com.sentinelids.pipeline.alert;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class RawAlertTest {

    @Test
    void shouldApplyDefaultsForMissingValues() {
        RawAlert alert = new RawAlert(null, " ", 0, 0, null, null, null, null, null, null);

        assertEquals(RawAlert.UNKNOWN_IP, alert.sourceIp());
        assertEquals(RawAlert.UNKNOWN_IP, alert.destinationIp());
        assertEquals(RawAlert.UNKNOWN_PROTOCOL, alert.protocol());
        assertEquals("", alert.message());
        assertFalse(alert.hasSensorRule());
    }

    @Test
    void shouldUpperCaseProtocolIndependentlyOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            RawAlert alert = new RawAlert("10.0.0.5", "10.0.0.1", 0, 0, " icmp ", "", null, null, null, null);

            assertEquals("ICMP", alert.protocol());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
