package com.tradingplatform.config;

import com.tradingplatform.api.dto.response.ApiErrorResponse;
import com.tradingplatform.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful controller bodies in {@link ApiResponse} stamped with the request path.
 * Actuator and {@code /error} responses, bodies that already are envelopes, null bodies and
 * plain strings are written unchanged.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private static final String ACTUATOR_PREFIX = "/actuator";
    private static final String ERROR_PATH = "/error";

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        String path = request.getURI().getPath();
        return isWritableAsIs(body, path, selectedConverterType) ? body : ApiResponse.of(body, path);
    }

    private static boolean isWritableAsIs(
            Object body, String path, Class<? extends HttpMessageConverter<?>> converterType) {
        if (body == null || body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return true;
        }
        // StringHttpMessageConverter cannot serialize the envelope
        return StringHttpMessageConverter.class.isAssignableFrom(converterType)
                || path.startsWith(ACTUATOR_PREFIX)
                || path.equals(ERROR_PATH);
    }
}
