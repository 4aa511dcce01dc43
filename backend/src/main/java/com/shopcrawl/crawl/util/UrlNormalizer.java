package com.shopcrawl.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Canonical form used for dedup claims: lower-case scheme and host, no default port,
 * no fragment, no trailing slash except for the root path, query parameters sorted.
 */
public final class UrlNormalizer {
    private static final Comparator<String> QUERY_PARAM_ORDER = Comparator
        .comparing(UrlNormalizer::paramName)
        .thenComparing(Comparator.naturalOrder());

    private UrlNormalizer() {
    }

    public static String normalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        URI uri = safeUri(candidate.trim());
        if (uri == null || !uri.isAbsolute() || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.isEmpty()) {
            return null;
        }

        StringBuilder out = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            out.append(uri.getRawUserInfo()).append('@');
        }
        out.append(host);
        int port = uri.getPort();
        if (port > 0 && !isDefaultPort(scheme, port)) {
            out.append(':').append(port);
        }
        out.append(canonicalPath(uri.getRawPath()));
        String query = sortedQuery(uri.getRawQuery());
        if (query != null) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    /**
     * Seeds may be bare domains ({@code shop.example}) or full URLs.
     */
    public static String seedToUrl(String seed) {
        if (seed == null || seed.isBlank()) {
            return null;
        }
        String value = seed.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        return normalize(value);
    }

    /**
     * Politeness and scope key for a URL: its host without a leading {@code www.}.
     */
    public static String domainOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return domainKey(uri.getHost());
    }

    public static String domainKey(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String lower = host.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("www.") && lower.length() > 4) {
            return lower.substring(4);
        }
        return lower;
    }

    public static boolean isWithinDomains(String url, Collection<String> seedDomains) {
        String domain = domainOf(url);
        if (domain == null || seedDomains == null) {
            return false;
        }
        for (String seed : seedDomains) {
            String seedDomain = seed.contains("://") ? domainOf(seed) : domainKey(seed);
            if (seedDomain == null) {
                continue;
            }
            if (domain.equals(seedDomain) || domain.endsWith("." + seedDomain)) {
                return true;
            }
        }
        return false;
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private static String canonicalPath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String path = rawPath;
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private static String sortedQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        List<String> params = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (!part.isEmpty()) {
                params.add(part);
            }
        }
        if (params.isEmpty()) {
            return null;
        }
        params.sort(QUERY_PARAM_ORDER);
        return String.join("&", params);
    }

    private static String paramName(String param) {
        int idx = param.indexOf('=');
        return idx < 0 ? param : param.substring(0, idx);
    }
}
