package com.hargapangan.api.security;

import com.hargapangan.audit.Actor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Reads the caller identity set by the gateway: X-User-Id, X-User-Role (admin|editor|viewer, default
 * viewer) and the client IP from X-Forwarded-For or the remote address.
 */
@Component
public class ActorResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public Actor resolve(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();
        String id = headers.getFirst(USER_ID_HEADER);
        Actor.Role role = Actor.Role.fromHeader(headers.getFirst(USER_ROLE_HEADER));
        return new Actor(id != null && !id.isBlank() ? id.strip() : null, role,
                clientIp(request), headers.getFirst(HttpHeaders.USER_AGENT));
    }

    /** Resolved actor, failing unless it is an admin. */
    public Actor requireAdmin(ServerHttpRequest request) {
        Actor actor = resolve(request);
        if (!actor.isElevated()) {
            throw new ForbiddenException("Admin role required");
        }
        return actor;
    }

    /** Resolved actor, failing unless it is an admin or editor with a user id. */
    public Actor requireEditor(ServerHttpRequest request) {
        Actor actor = resolve(request);
        if (!actor.canEdit() || actor.id() == null) {
            throw new ForbiddenException("Editor or admin role required");
        }
        return actor;
    }

    /** Resolved actor, failing when no user id is present. */
    public Actor requireUser(ServerHttpRequest request) {
        Actor actor = resolve(request);
        if (actor.id() == null) {
            throw new ForbiddenException("User identity required");
        }
        return actor;
    }

    public static String clientIp(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma >= 0 ? forwarded.substring(0, comma) : forwarded).strip();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            return remote.getAddress().getHostAddress();
        }
        return "unknown";
    }
}
