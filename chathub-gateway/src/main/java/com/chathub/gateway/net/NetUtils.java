package com.chathub.gateway.net;

/**
 * Client address helpers for the WebSocket handshake.
 */
public final class NetUtils {

    private NetUtils() {
    }

    /**
     * Check if an IP is a loopback address.
     * Matches: 127.x.x.x, ::1, ::ffff:127.x
     */
    public static boolean isLoopbackAddress(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        if (ip.startsWith("127."))
            return true;
        if ("::1".equals(ip))
            return true;
        // InetAddress.getHostAddress() returns full-form IPv6 for loopback
        if ("0:0:0:0:0:0:0:1".equals(ip))
            return true;
        return ip.startsWith("::ffff:127.");
    }

    /**
     * Normalize an IP address (trim, lowercase, strip IPv4-mapped prefix).
     */
    public static String normalizeIp(String ip) {
        if (ip == null || ip.isBlank())
            return null;
        String value = ip.trim().toLowerCase();
        return value.startsWith("::ffff:") ? value.substring("::ffff:".length()) : value;
    }

    /**
     * Strip optional port suffix from an IP string.
     * e.g. "127.0.0.1:8080" → "127.0.0.1", "[::1]:8080" → "::1"
     */
    public static String stripOptionalPort(String ip) {
        if (ip == null)
            return null;
        if (ip.startsWith("[")) {
            int end = ip.indexOf(']');
            if (end != -1)
                return ip.substring(1, end);
        }
        // IPv4 with port: only strip if there's exactly one colon
        int lastColon = ip.lastIndexOf(':');
        if (lastColon > -1 && ip.contains(".") && ip.indexOf(':') == lastColon) {
            return ip.substring(0, lastColon);
        }
        return ip;
    }

    /**
     * First client IP of an X-Forwarded-For header value.
     */
    public static String parseForwardedForClientIp(String forwardedFor) {
        if (forwardedFor == null || forwardedFor.isBlank())
            return null;
        String first = forwardedFor.split(",")[0].trim();
        if (first.isEmpty())
            return null;
        return normalizeIp(stripOptionalPort(first));
    }

    public static String parseRealIp(String realIp) {
        if (realIp == null || realIp.isBlank())
            return null;
        return normalizeIp(stripOptionalPort(realIp.trim()));
    }

    /**
     * Proxy headers are honoured for loopback peers (a local reverse proxy) and,
     * when explicitly configured, for every peer.
     */
    public static boolean shouldTrustProxyHeaders(String remoteAddr, boolean trustConfigured) {
        return trustConfigured || isLoopbackAddress(normalizeIp(remoteAddr));
    }

    /**
     * Resolve the origin address of a connecting client.
     *
     * <p>
     * Untrusted peers always get their socket address, so a direct client cannot
     * spoof its origin through headers.
     * </p>
     *
     * @return the resolved address, {@code "unknown"} if nothing is known
     */
    public static String resolveClientIp(
            String remoteAddr, String forwardedFor, String realIp, boolean trustConfigured) {
        String remote = normalizeIp(remoteAddr);
        if (shouldTrustProxyHeaders(remoteAddr, trustConfigured)) {
            String fromForwarded = parseForwardedForClientIp(forwardedFor);
            if (fromForwarded != null)
                return fromForwarded;
            String fromRealIp = parseRealIp(realIp);
            if (fromRealIp != null)
                return fromRealIp;
        }
        return remote != null ? remote : "unknown";
    }
}
