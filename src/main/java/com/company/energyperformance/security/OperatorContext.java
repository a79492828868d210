package com.company.energyperformance.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Identity of the operator behind the current request, recorded on trained, resolved
 * and adjusted records
 */
@Component
@Slf4j
public class OperatorContext {

    public static final String SYSTEM_OPERATOR = "system";

    /**
     * Email when the token carries one, otherwise the subject. Background jobs run as "system".
     */
    public String currentOperator() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return SYSTEM_OPERATOR;
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String email = emailOf(jwt);
            return email != null ? email : jwt.getSubject();
        }

        log.warn("Unexpected authentication principal type: {}",
                authentication.getPrincipal().getClass());
        return authentication.getName();
    }

    private static String emailOf(Jwt jwt) {
        String email = jwt.getClaimAsString("email");
        if (email == null) {
            email = jwt.getClaimAsString("preferred_username");
        }
        return email;
    }
}
