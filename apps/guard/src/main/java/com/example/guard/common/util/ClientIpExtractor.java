package com.example.guard.common.util;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetSocketAddress;
import java.util.regex.Pattern;

/**
 * Resolves the network address a protection report should be attributed to
 * when the calling service does not supply one.
 *
 * <p>X-Forwarded-For is only honoured when the direct peer is a private-network proxy.
 */
public final class ClientIpExtractor {

    public static final String UNKNOWN = "unknown";

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private ClientIpExtractor() {}

    @NonNull
    public static String extract(@NonNull ServerWebExchange exchange) {
        return extract(exchange.getRequest());
    }

    @NonNull
    public static String extract(@NonNull ServerHttpRequest request) {
        String peer = peerAddress(request);
        if (!isTrustedProxy(peer)) {
            return peer;
        }
        String forwardedFor = request.getHeaders().getFirst(X_FORWARDED_FOR);
        if (forwardedFor == null || forwardedFor.isBlank()) {
            return peer;
        }
        // Rightmost untrusted hop is the address the first proxy saw
        String[] hops = forwardedFor.split(",");
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (isValidIp(hop) && !isTrustedProxy(hop)) {
                return hop;
            }
        }
        String first = hops[0].trim();
        return isValidIp(first) ? first : peer;
    }

    /**
     * Prefers an explicitly reported address, falling back to the request peer.
     */
    @NonNull
    public static String resolve(@Nullable String reported, @NonNull ServerWebExchange exchange) {
        if (isValidIp(reported)) {
            return reported.trim();
        }
        return extract(exchange);
    }

    public static boolean isValidIp(@Nullable String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        return IP_ADDRESS_PATTERN.matcher(ip.trim()).matches();
    }

    /**
     * Private ranges: 10/8, 172.16/12, 192.168/16, loopback and IPv6 link-local / unique-local.
     */
    public static boolean isTrustedProxy(@Nullable String ip) {
        if (ip == null) {
            return false;
        }
        if (ip.startsWith("10.") || ip.startsWith("192.168.")
                || ip.equals("127.0.0.1") || ip.equals("::1")) {
            return true;
        }
        if (ip.startsWith("172.")) {
            String[] octets = ip.split("\\.");
            if (octets.length < 2) {
                return false;
            }
            try {
                int second = Integer.parseInt(octets[1]);
                return second >= 16 && second <= 31;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return ip.startsWith("fe80:") || ip.startsWith("fc") || ip.startsWith("fd");
    }

    @NonNull
    private static String peerAddress(ServerHttpRequest request) {
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return UNKNOWN;
        }
        return remote.getAddress().getHostAddress();
    }
}
