package com.mobifone.updatecenter.configuration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditorAwareImplTest {

    private final AuditorAwareImpl auditorAware = new AuditorAwareImpl();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void fallsBackToSystemWithoutAuthentication() {
        assertThat(auditorAware.getCurrentAuditor()).contains(AuditorAwareImpl.SYSTEM);
    }

    @Test
    void usesAuthenticatedName() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                "alice", "n/a", List.of(new SimpleGrantedAuthority("ROLE_OPERATOR"))));

        assertThat(auditorAware.getCurrentAuditor()).contains("alice");
    }
}
