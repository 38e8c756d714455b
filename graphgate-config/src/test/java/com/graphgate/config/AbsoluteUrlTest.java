package com.graphgate.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AbsoluteUrlTest {

    @Test
    void parse_roundTripsExactString() {
        String raw = "https://api.example.com:8443/v1/users?limit=10";
        AbsoluteUrl url = AbsoluteUrl.parse(raw);
        assertEquals(raw, url.toString());
        assertEquals("api.example.com", url.getHost());
        assertEquals(raw, url.toUrl().toString());
    }

    @Test
    void parse_rejectsNonUrlWithRawValueInMessage() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse("not a url"));
        assertEquals("Malformed url: not a url", e.getMessage());
    }

    @Test
    void parse_rejectsRelativeOpaqueAndUnknownScheme() {
        assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse("/relative/path"));
        assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse("mailto:ops@example.com"));
        assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse("foo://example.com"));
        assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse(""));
        assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse(null));
    }

    @Test
    void parse_acceptsUnderscoreHostsAndFileUrls() {
        AbsoluteUrl service = AbsoluteUrl.parse("http://user_service:8080/api");
        assertEquals("http://user_service:8080/api", service.toString());
        assertEquals("user_service", service.getHost());

        AbsoluteUrl file = AbsoluteUrl.parse("file:///etc/gateway");
        assertEquals("file:///etc/gateway", file.toString());
        assertEquals("", file.getHost());
    }

    @Test
    void parse_rejectsHttpWithoutAuthority() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> AbsoluteUrl.parse("http:///users"));
        assertEquals("Malformed url: http:///users", e.getMessage());
    }

    @Test
    void equals_comparesStringForm() {
        assertEquals(AbsoluteUrl.parse("http://localhost:8080"), AbsoluteUrl.parse("http://localhost:8080"));
        assertEquals(AbsoluteUrl.parse("http://localhost:8080").hashCode(), AbsoluteUrl.parse("http://localhost:8080").hashCode());
    }
}
