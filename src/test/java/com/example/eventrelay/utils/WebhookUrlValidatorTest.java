package com.example.eventrelay.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebhookUrlValidatorTest {

    private final WebhookUrlValidator validator = new WebhookUrlValidator(true,
            "127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16");

    @Test
    void testSafeUrls() {
        assertTrue(validator.isSafeUrl("https://1.1.1.1"));
        assertTrue(validator.isSafeUrl("http://8.8.8.8/webhook"));
    }

    @Test
    void testUnsafeProtocols() {
        assertFalse(validator.isSafeUrl("ftp://example.com/file"));
        assertFalse(validator.isSafeUrl("file:///etc/passwd"));
        assertFalse(validator.isSafeUrl("gopher://example.com"));
        assertFalse(validator.isSafeUrl("not a url"));
        assertFalse(validator.isSafeUrl(""));
    }

    @Test
    void testBlockedIps() {
        assertFalse(validator.isSafeUrl("http://localhost:8080"));
        assertFalse(validator.isSafeUrl("http://127.0.0.1:8080"));
        assertFalse(validator.isSafeUrl("http://192.168.1.1"));
        assertFalse(validator.isSafeUrl("http://10.0.0.5"));
        assertFalse(validator.isSafeUrl("http://169.254.169.254/latest/meta-data"));
        assertFalse(validator.isSafeUrl("http://0.0.0.0"));
    }

    @Test
    void testIpv6Loopback() {
        assertFalse(validator.isSafeUrl("http://[::1]"));
        assertFalse(validator.isSafeUrl("http://[fd00::1]"));
    }

    @Test
    void testDisabledStillChecksScheme() {
        WebhookUrlValidator permissive = new WebhookUrlValidator(false, "");

        assertTrue(permissive.isSafeUrl("http://localhost:8080/hook"));
        assertFalse(permissive.isSafeUrl("ftp://localhost/file"));
        assertThrows(IllegalArgumentException.class, () -> permissive.validate("http:///nohost"));
    }
}
