package com.adobe.daiji.filter;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Collection;

/**
 * Resolves the originating client address of a request.
 *
 * <p>{@code X-Forwarded-For} is only honored when the connection comes from a
 * trusted proxy. The header is then read right to left and the first hop that
 * is not itself a trusted proxy is the client, so a value prepended by the
 * client cannot pick its own address.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class ClientAddress {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private ClientAddress() {
    }

    /**
     * Returns the client address of a request.
     *
     * @param request        the HTTP request
     * @param trustedProxies addresses of proxies allowed to set {@code X-Forwarded-For}
     * @return the client address
     */
    public static String of(HttpServletRequest request, Collection<String> trustedProxies) {
        String remoteAddr = request.getRemoteAddr();
        String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwardedFor == null || forwardedFor.isBlank() || !trustedProxies.contains(remoteAddr)) {
            return remoteAddr;
        }

        String[] hops = forwardedFor.split(",");
        String client = remoteAddr;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (hop.isEmpty()) {
                continue;
            }
            client = hop;
            if (!trustedProxies.contains(hop)) {
                break;
            }
        }
        return client;
    }
}
