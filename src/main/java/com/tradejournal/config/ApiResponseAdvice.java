package com.tradejournal.config;

import com.tradejournal.api.dto.response.ApiErrorResponse;
import com.tradejournal.api.dto.response.ApiResponse;
import com.tradejournal.api.dto.response.ReconstructionResponse;
import java.util.ArrayList;
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
 * Wraps successful {@code /api} bodies in {@link ApiResponse}. Reconstruction results get
 * warnings attached when skipped rows or incomplete trades make the P&L figures partial.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

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
        if (!request.getURI().getPath().startsWith("/api")
                || body instanceof ApiResponse<?>
                || body instanceof ApiErrorResponse) {
            return body;
        }
        if (body instanceof ReconstructionResponse reconstruction) {
            return ApiResponse.of(reconstruction, partialDataWarnings(reconstruction));
        }
        return ApiResponse.of(body);
    }

    static List<String> partialDataWarnings(ReconstructionResponse reconstruction) {
        List<String> warnings = new ArrayList<>();
        if (reconstruction.getSkippedRows() > 0) {
            warnings.add(reconstruction.getSkippedRows() + " trade row(s) could not be parsed and were skipped");
        }
        if (reconstruction.getIncompleteTrades() > 0) {
            warnings.add(reconstruction.getIncompleteTrades()
                    + " trade(s) close a position opened before this export; their P&L is partial");
        }
        return warnings;
    }
}
