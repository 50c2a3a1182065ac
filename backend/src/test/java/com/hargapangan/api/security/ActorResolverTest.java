package com.hargapangan.api.security;

import com.hargapangan.audit.Actor;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorResolverTest {

    private final ActorResolver resolver = new ActorResolver();

    @Test
    void readsGatewayHeaders() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/api/v1/overrides")
                .header(ActorResolver.USER_ID_HEADER, " u-1 ")
                .header(ActorResolver.USER_ROLE_HEADER, "Editor")
                .header(ActorResolver.FORWARDED_FOR_HEADER, "203.0.113.7, 10.0.0.1")
                .header("User-Agent", "curl/8")
                .build();

        Actor actor = resolver.resolve(request);

        assertThat(actor.id()).isEqualTo("u-1");
        assertThat(actor.role()).isEqualTo(Actor.Role.EDITOR);
        assertThat(actor.ipAddress()).isEqualTo("203.0.113.7");
        assertThat(actor.userAgent()).isEqualTo("curl/8");
    }

    @Test
    void missingOrUnknownRoleIsViewer() {
        assertThat(resolver.resolve(MockServerHttpRequest.get("/").build()).role()).isEqualTo(Actor.Role.VIEWER);
        assertThat(resolver.resolve(MockServerHttpRequest.get("/")
                .header(ActorResolver.USER_ROLE_HEADER, "root").build()).role()).isEqualTo(Actor.Role.VIEWER);
    }

    @Test
    void fallsBackToRemoteAddress() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .remoteAddress(new InetSocketAddress("192.0.2.10", 40000))
                .build();

        assertThat(ActorResolver.clientIp(request)).isEqualTo("192.0.2.10");
    }

    @Test
    void roleChecks() {
        MockServerHttpRequest editor = MockServerHttpRequest.get("/")
                .header(ActorResolver.USER_ID_HEADER, "u-1")
                .header(ActorResolver.USER_ROLE_HEADER, "editor")
                .build();
        MockServerHttpRequest anonymousEditor = MockServerHttpRequest.get("/")
                .header(ActorResolver.USER_ROLE_HEADER, "editor")
                .build();

        assertThat(resolver.requireEditor(editor).id()).isEqualTo("u-1");
        assertThat(resolver.requireUser(editor).id()).isEqualTo("u-1");
        assertThatThrownBy(() -> resolver.requireAdmin(editor)).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> resolver.requireEditor(anonymousEditor)).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> resolver.requireUser(anonymousEditor)).isInstanceOf(ForbiddenException.class);
    }
}
