package com.dedupstore.api.security;

import com.dedupstore.api.dto.response.ErrorResponse;
import com.dedupstore.core.exception.ValidationException;
import com.dedupstore.core.service.UploadValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;

/**
 * Resolves the caller from the {@code UserId} header and exposes it as a request attribute.
 * Requests without a valid id are answered with 400 before reaching a controller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserIdFilter extends OncePerRequestFilter {
    
    public static final String HEADER = "UserId";
    public static final String ATTRIBUTE = "dedupstore.userId";
    
    private final UploadValidator uploadValidator;
    private final ObjectMapper objectMapper;
    
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return !uri.startsWith("/api/") || uri.startsWith("/api/v1/health");
    }
    
    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String userId = request.getHeader(HEADER);
        try {
            uploadValidator.validateUserId(userId == null ? null : userId.trim());
        } catch (ValidationException e) {
            log.debug("Rejected request without valid user id | uri={} | reason={}", request.getRequestURI(), e.getMessage());
            String message = userId == null || userId.isBlank() ? "UserId header is required" : e.getMessage();
            writeError(request, response, message);
            return;
        }
        
        request.setAttribute(ATTRIBUTE, userId.trim());
        filterChain.doFilter(request, response);
    }
    
    private void writeError(HttpServletRequest request, HttpServletResponse response, String message) throws IOException {
        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid user")
            .message(message)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .build();
        response.setStatus(HttpStatus.BAD_REQUEST.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
