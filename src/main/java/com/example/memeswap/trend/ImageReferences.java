package com.example.memeswap.trend;

import java.net.URI;
import java.util.Collection;
import java.util.Locale;

/**
 * Classifies image references by their URL alone.
 */
public final class ImageReferences {

    private ImageReferences() {
    }

    /**
     * True when the URL points at a static raster image: its path ends in one
     * of {@code extensions}, or it carries no extension and is served by one
     * of {@code imageHosts}.  Animated or video formats ({@code .gif},
     * {@code .gifv}, {@code .mp4}) never qualify.
     */
    public static boolean isStaticRaster(String url, Collection<String> extensions, Collection<String> imageHosts) {
        if (url == null || url.isBlank()) return false;
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            return false;
        }
        String ext = extensionOf(uri.getPath());
        if (!ext.isEmpty()) {
            return extensions.stream().anyMatch(e -> e.equalsIgnoreCase(ext));
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        return imageHosts.stream().anyMatch(h -> host.equals(h.toLowerCase(Locale.ROOT)));
    }

    /** Lower-case extension of the last path segment, or empty. */
    public static String extensionOf(String path) {
        if (path == null) return "";
        int slash = path.lastIndexOf('/');
        String last = path.substring(slash + 1);
        int dot = last.lastIndexOf('.');
        if (dot < 0 || dot == last.length() - 1) return "";
        return last.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
