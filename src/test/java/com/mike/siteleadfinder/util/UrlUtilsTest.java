package com.mike.siteleadfinder.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    @DisplayName("withScheme adds https only when no http(s) scheme is present")
    void withScheme() {
        assertEquals("https://example.com", UrlUtils.withScheme("example.com"));
        assertEquals("http://example.com", UrlUtils.withScheme(" http://example.com "));
        assertEquals("HTTPS://Example.com", UrlUtils.withScheme("HTTPS://Example.com"));
        assertEquals("", UrlUtils.withScheme(null));
        assertEquals("", UrlUtils.withScheme("  "));
    }

    @Test
    @DisplayName("extractHost lower-cases and drops www.")
    void extractHost() {
        assertEquals("joespizza.com", UrlUtils.extractHost("https://WWW.JoesPizza.com/menu"));
        assertEquals("anas.wixsite.com", UrlUtils.extractHost("anas.wixsite.com/home"));
        assertEquals("bad host.com", UrlUtils.extractHost("http://bad host.com/x"));
        assertEquals("joes pizza.com", UrlUtils.extractHost("https://www.Joes Pizza.com"));
        assertEquals("", UrlUtils.extractHost(""));
    }

    @Test
    @DisplayName("isSameOrSubdomain matches exact host and subdomains only")
    void isSameOrSubdomain() {
        assertTrue(UrlUtils.isSameOrSubdomain("wix.com", "wix.com"));
        assertTrue(UrlUtils.isSameOrSubdomain("m.facebook.com", "facebook.com"));
        assertFalse(UrlUtils.isSameOrSubdomain("notwix.com", "wix.com"));
        assertFalse(UrlUtils.isSameOrSubdomain(null, "wix.com"));
    }

    @Test
    @DisplayName("isSecure checks the https prefix")
    void isSecure() {
        assertTrue(UrlUtils.isSecure("https://a.com"));
        assertFalse(UrlUtils.isSecure("http://a.com"));
        assertFalse(UrlUtils.isSecure(null));
    }
}
