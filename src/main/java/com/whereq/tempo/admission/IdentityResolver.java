package com.whereq.tempo.admission;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Derives the caller identifier used for rate limiting and job ownership.
 * Prefers the user id forwarded by the authentication layer, falls back to the network address.
 */
@Component
public class IdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public String resolve(ServerHttpRequest request) {
        String userId = request.getHeaders().getFirst(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId.trim();
        }

        String forwarded = request.getHeaders().getFirst(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }

        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return "ip:" + remote.getAddress().getHostAddress();
        }
        return "ip:unknown";
    }
}
