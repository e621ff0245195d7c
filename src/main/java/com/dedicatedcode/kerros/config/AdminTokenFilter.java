/*
 *  This file is part of kerros.
 *
 *  Kerros is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Kerros is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Kerros. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.kerros.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates admin requests carrying the configured password in the {@code X-Admin-Token} header.
 */
@Service
public class AdminTokenFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdminTokenFilter.class);

    static final String HEADER = "X-Admin-Token";

    private final String adminPassword;

    public AdminTokenFilter(@Value("${kerros.admin.password:}") String adminPassword) {
        this.adminPassword = adminPassword;
        if (adminPassword.isBlank()) {
            logger.warn("kerros.admin.password is not set, admin endpoints are unreachable");
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = request.getHeader(HEADER);

        if (token != null && !adminPassword.isBlank() && matches(token)) {
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(
                            "admin",
                            null,
                            List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))
                    );
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } else if (token != null) {
            logger.warn("Rejected admin token for {} from {}", request.getRequestURI(), request.getRemoteAddr());
        }

        filterChain.doFilter(request, response);
    }

    private boolean matches(String token) {
        return MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8), adminPassword.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/admin/");
    }
}
