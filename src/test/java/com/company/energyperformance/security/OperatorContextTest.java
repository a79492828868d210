package com.company.energyperformance.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorContextTest {

    private final OperatorContext operatorContext = new OperatorContext();

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void backgroundWorkRunsAsSystem() {
        assertThat(operatorContext.currentOperator()).isEqualTo(OperatorContext.SYSTEM_OPERATOR);
    }

    @Test
    void prefersEmailClaim() {
        authenticate(Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("user-123")
                .claim("email", "analyst@plant.example")
                .issuedAt(Instant.now())
                .build());

        assertThat(operatorContext.currentOperator()).isEqualTo("analyst@plant.example");
    }

    @Test
    void fallsBackToPreferredUsernameThenSubject() {
        authenticate(Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("user-123")
                .claim("preferred_username", "analyst")
                .build());
        assertThat(operatorContext.currentOperator()).isEqualTo("analyst");

        authenticate(Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("user-123")
                .build());
        assertThat(operatorContext.currentOperator()).isEqualTo("user-123");
    }

    private static void authenticate(Jwt jwt) {
        SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt, List.of()));
    }
}
