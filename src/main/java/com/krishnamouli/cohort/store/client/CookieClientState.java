package com.krishnamouli.cohort.store.client;

import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.CookieHeaderNames;
import io.netty.handler.codec.http.cookie.DefaultCookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import io.netty.handler.codec.http.cookie.ServerCookieEncoder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request-scoped view of browser cookies: reads the inbound {@code Cookie}
 * header and collects the {@code Set-Cookie} headers to send back.
 */
public class CookieClientState implements ClientState {
    private final Map<String, String> inbound = new HashMap<>();
    private final Map<String, Cookie> outbound = new LinkedHashMap<>();

    public CookieClientState(String cookieHeader) {
        if (cookieHeader != null && !cookieHeader.isEmpty()) {
            for (Cookie cookie : ServerCookieDecoder.STRICT.decode(cookieHeader)) {
                inbound.put(cookie.name(), cookie.value());
            }
        }
    }

    @Override
    public String read(String name) {
        Cookie pending = outbound.get(name);
        if (pending != null) {
            return pending.maxAge() == 0 ? null : pending.value();
        }
        return inbound.get(name);
    }

    @Override
    public void write(String name, String value, Duration maxAge) {
        DefaultCookie cookie = new DefaultCookie(name, value);
        cookie.setPath("/");
        cookie.setMaxAge(maxAge.getSeconds());
        cookie.setSameSite(CookieHeaderNames.SameSite.Lax);
        outbound.put(name, cookie);
    }

    @Override
    public void delete(String name) {
        DefaultCookie cookie = new DefaultCookie(name, "");
        cookie.setPath("/");
        cookie.setMaxAge(0);
        outbound.put(name, cookie);
    }

    /**
     * Header values for every cookie written or deleted during the request.
     */
    public List<String> setCookieHeaders() {
        return new ArrayList<>(ServerCookieEncoder.STRICT.encode(outbound.values()));
    }
}
