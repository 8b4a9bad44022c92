package com.opspos.config;

import com.opspos.api.dto.response.ApiErrorResponse;
import com.opspos.api.dto.response.ApiResponse;
import java.util.List;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps every {@code /api} response body in an {@link ApiResponse} stamped with this terminal's id.
 * Actuator and error bodies, plain strings and bodies that are already envelopes pass through.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private static final List<String> PASS_THROUGH_PREFIXES = List.of("/actuator", "/error");

    private final TerminalConfig terminalConfig;

    public ApiResponseAdvice(TerminalConfig terminalConfig) {
        this.terminalConfig = terminalConfig;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        String path = request.getURI().getPath();
        for (String prefix : PASS_THROUGH_PREFIXES) {
            if (path.startsWith(prefix)) {
                return body;
            }
        }
        return ApiResponse.of(terminalConfig.getTerminalId(), body);
    }
}
