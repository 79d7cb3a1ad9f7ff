package com.agrinova.backend.global.security;

import java.io.IOException;

import com.agrinova.backend.global.error.ProblemResponse;
import com.agrinova.backend.modules.auth.domain.AuthFailureKind;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        ProblemResponse body;
        HttpStatus status;
        if (request.getAttribute(JwtAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE) instanceof AuthFailureKind kind) {
            status = kind.getStatus();
            body = ProblemResponse.of(status, kind.name(), kind.getDefaultDetail(), request.getRequestURI());
        } else {
            status = HttpStatus.UNAUTHORIZED;
            body = ProblemResponse.of(status, "unauthorized", "Authentication required", request.getRequestURI());
        }

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
