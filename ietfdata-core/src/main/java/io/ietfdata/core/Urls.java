package io.ietfdata.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to build request URLs: collection paths, query strings with sorted keys, and
 * server-relative continuation cursors.
 */
public final class Urls {
    private Urls() {}

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    /**
     * Resolves a server-relative path (which may carry a query string) against the API origin.
     */
    public static URI resolve(URI origin, String relative) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(relative, "relative");
        return origin.resolve(relative);
    }

    /**
     * Resolves {@code collectionPath + segment + "/"} against the origin, encoding the segment.
     * {@code @} is left as is so email addresses stay readable in logs.
     */
    public static URI member(URI origin, String collectionPath, String segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.isEmpty()) {
            throw new IllegalArgumentException("segment must not be empty");
        }
        String encoded = encode(segment).replace("+", "%20").replace("%40", "@");
        return resolve(origin, collectionPath + encoded + "/");
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
