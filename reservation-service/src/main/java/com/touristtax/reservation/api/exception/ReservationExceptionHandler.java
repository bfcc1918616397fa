package com.touristtax.reservation.api.exception;

import com.touristtax.common.dto.BaseResponse;
import com.touristtax.reservation.exception.UnsupportedCityException;
import com.touristtax.reservation.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

/**
 * Validation errors that carry data the caller can act on: the offending field,
 * or the list of cities that do have a rate. Runs ahead of the global handler.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ReservationExceptionHandler {

    @ExceptionHandler(UnsupportedCityException.class)
    public ResponseEntity<BaseResponse<Map<String, List<String>>>> handleUnsupportedCity(UnsupportedCityException ex) {
        log.warn("Unsupported city: {}", ex.getMessage());
        BaseResponse<Map<String, List<String>>> response = BaseResponse.error(
                ex.getMessage(), ex.getErrorCode(), Map.of("supportedCities", ex.getSupportedCities()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<BaseResponse<Map<String, String>>> handleValidation(ValidationException ex) {
        log.warn("Validation failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        Map<String, String> details = ex.getField() == null ? null : Map.of(ex.getField(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), details));
    }
}
