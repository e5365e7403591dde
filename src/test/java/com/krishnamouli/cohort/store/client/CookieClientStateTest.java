package com.krishnamouli.cohort.store.client;

import com.krishnamouli.cohort.store.Assignment;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CookieClientStateTest {

    @Test
    void testReadsInboundCookies() {
        CookieClientState state = new CookieClientState("ab_exp_u1=abc; theme=dark");

        assertEquals("abc", state.read("ab_exp_u1"));
        assertEquals("dark", state.read("theme"));
        assertNull(state.read("missing"));
        assertTrue(state.setCookieHeaders().isEmpty());
    }

    @Test
    void testNullHeader() {
        CookieClientState state = new CookieClientState(null);
        assertNull(state.read("anything"));
    }

    @Test
    void testWriteProducesSetCookie() {
        CookieClientState state = new CookieClientState(null);
        state.write("ab_exp_u1", "value", Duration.ofMinutes(30));

        assertEquals("value", state.read("ab_exp_u1"));
        List<String> headers = state.setCookieHeaders();
        assertEquals(1, headers.size());
        String header = headers.get(0);
        assertTrue(header.startsWith("ab_exp_u1=value"), header);
        assertTrue(header.contains("Max-Age=1800"), header);
        assertTrue(header.contains("Path=/"), header);
        assertTrue(header.contains("SameSite=Lax"), header);
    }

    @Test
    void testDeleteHidesInboundValue() {
        CookieClientState state = new CookieClientState("ab_exp_u1=abc");
        state.delete("ab_exp_u1");

        assertNull(state.read("ab_exp_u1"));
        assertTrue(state.setCookieHeaders().get(0).contains("Max-Age=0"));
    }

    @Test
    void testAssignmentSurvivesCookieRoundTrip() {
        CookieClientState first = new CookieClientState(null);
        ClientStateAssignmentStore store = new ClientStateAssignmentStore(first, "ab_");
        store.set("exp", "u1", "B", Duration.ofMinutes(30));

        // Browser sends back name=value
        String setCookie = first.setCookieHeaders().get(0);
        String pair = setCookie.substring(0, setCookie.indexOf(';'));

        CookieClientState second = new CookieClientState(pair);
        Assignment restored = new ClientStateAssignmentStore(second, "ab_").get("exp", "u1").orElseThrow();
        assertEquals("B", restored.getVariantId());
        assertTrue(restored.getAssignedAt().isBefore(Instant.now().plusSeconds(1)));
    }

    @Test
    void testSubjectIdsOutsideCookieNameCharset() {
        CookieClientState first = new CookieClientState(null);
        ClientStateAssignmentStore store = new ClientStateAssignmentStore(first, "ab_");
        store.set("exp", "alice@example.com", "A", Duration.ofMinutes(30));
        store.set("exp", "josé, jr.; x=y/z", "B", Duration.ofMinutes(30));

        List<String> headers = first.setCookieHeaders();
        assertEquals(2, headers.size());

        StringBuilder cookieHeader = new StringBuilder();
        for (String header : headers) {
            if (cookieHeader.length() > 0) {
                cookieHeader.append("; ");
            }
            cookieHeader.append(header, 0, header.indexOf(';'));
        }

        ClientStateAssignmentStore restored =
                new ClientStateAssignmentStore(new CookieClientState(cookieHeader.toString()), "ab_");
        assertEquals("A", restored.get("exp", "alice@example.com").orElseThrow().getVariantId());
        assertEquals("B", restored.get("exp", "josé, jr.; x=y/z").orElseThrow().getVariantId());
    }
}
