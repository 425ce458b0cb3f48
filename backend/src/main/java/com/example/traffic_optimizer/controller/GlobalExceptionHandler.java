package com.example.traffic_optimizer.controller;

import com.example.traffic_optimizer.exception.CityNotFoundException;
import com.example.traffic_optimizer.exception.InvalidModeProfileException;
import com.example.traffic_optimizer.exception.RegionDataException;
import com.example.traffic_optimizer.exception.UnknownTransportModeException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     *  1. 잘못된 요청 (400)
     */
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @ExceptionHandler({UnknownTransportModeException.class, IllegalArgumentException.class})
    public ApiResponse<Void> handleBadRequest(RuntimeException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ApiResponse.error(e.getMessage());
    }

    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ApiResponse<Void> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", message);
        return ApiResponse.error(message);
    }

    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @ExceptionHandler({ConstraintViolationException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ApiResponse<Void> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ApiResponse.error(e.getMessage());
    }

    /**
     *  2. 없는 도시 (404)
     */
    @ResponseStatus(HttpStatus.NOT_FOUND)
    @ExceptionHandler(CityNotFoundException.class)
    public ApiResponse<Void> handleCityNotFound(CityNotFoundException e) {
        return ApiResponse.error(e.getMessage());
    }

    /**
     *  3. 설정/데이터 오류 (500)
     */
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    @ExceptionHandler({InvalidModeProfileException.class, RegionDataException.class})
    public ApiResponse<Void> handleConfigurationError(RuntimeException e) {
        log.error("Engine configuration error", e);
        return ApiResponse.error(e.getMessage());
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
