package com.devseo.audit.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

public final class CrawlUrlUtils {
    private static final Set<String> ASSET_EXTENSIONS = Set.of(
        "pdf", "jpg", "jpeg", "png", "gif", "svg", "webp", "mp4", "mp3",
        "zip", "css", "js", "woff", "woff2", "ttf", "eot"
    );

    private CrawlUrlUtils() {
    }

    /**
     * Parses an absolute http(s) URL with a host, or returns null.
     */
    public static URI parseHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri = safeUri(url.trim());
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return null;
        }
        return uri;
    }

    /**
     * Scheme, host and port of {@code uri}, without a trailing slash.
     */
    public static String siteBase(URI uri) {
        StringBuilder base = new StringBuilder()
            .append(uri.getScheme().toLowerCase(Locale.ROOT))
            .append("://")
            .append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            base.append(':').append(uri.getPort());
        }
        return base.toString();
    }

    /**
     * Resolves {@code raw} against {@code base}, drops query and fragment and collapses trailing
     * slashes, so that equivalent URLs compare equal. Returns null for anything that is not http(s).
     */
    public static String normalize(String raw, String base) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            URI baseUri = new URI(base);
            URI resolved = baseUri.resolve(raw.trim());
            if (resolved.getScheme() == null || resolved.getHost() == null) {
                return null;
            }
            String scheme = resolved.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            String path = resolved.getRawPath() == null ? "" : resolved.getRawPath().replaceAll("/+$", "");
            if (path.isEmpty()) {
                path = "/";
            }
            StringBuilder normalized = new StringBuilder()
                .append(scheme)
                .append("://")
                .append(resolved.getHost().toLowerCase(Locale.ROOT));
            if (resolved.getPort() != -1) {
                normalized.append(':').append(resolved.getPort());
            }
            return normalized.append(path).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Host plus path without trailing slash, lower-cased; used to compare page URLs with link targets.
     */
    public static String comparisonKey(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return url == null ? "" : url.toLowerCase(Locale.ROOT);
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath().replaceAll("/+$", "");
        if (path.isEmpty()) {
            path = "/";
        }
        return (uri.getHost() + path).toLowerCase(Locale.ROOT);
    }

    public static boolean isAsset(String url) {
        if (url == null) {
            return false;
        }
        String withoutQuery = url.split("\\?", 2)[0];
        String lastSegment = withoutQuery.substring(withoutQuery.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String extension = lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ASSET_EXTENSIONS.contains(extension);
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        return uri == null || uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static boolean sameHost(String url, String host) {
        String candidate = host(url);
        return candidate != null && host != null && candidate.equals(host.toLowerCase(Locale.ROOT));
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
}
