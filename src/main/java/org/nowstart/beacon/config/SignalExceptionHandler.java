package org.nowstart.beacon.config;

import feign.FeignException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.beacon.data.exception.SignalApiException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class SignalExceptionHandler {

    @ExceptionHandler(SignalApiException.class)
    public ProblemDetail handleSignalApiException(SignalApiException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(exception.getStatus(), exception.getMessage());
        problemDetail.setProperty("code", exception.getCode());
        return problemDetail;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationException(MethodArgumentNotValidException exception) {
        List<String> details = exception.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .toList();
        return validationProblem(details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException exception) {
        List<String> details = exception.getConstraintViolations()
                .stream()
                .map(ConstraintViolation::getMessage)
                .toList();
        return validationProblem(details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody() {
        return validationProblem(List.of("request body is missing or malformed"));
    }

    /**
     * Provider failures surface as 502, the provider's own status is kept in {@code upstreamStatus}.
     */
    @ExceptionHandler(FeignException.class)
    public ProblemDetail handleFeignException(FeignException exception) {
        log.warn("Market data request failed. status={}, message={}", exception.status(), exception.getMessage());

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, extractFeignDetail(exception));
        problemDetail.setProperty("code", "market_data_error");
        problemDetail.setProperty("upstreamStatus", exception.status());
        return problemDetail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException(Exception exception) {
        log.error("Unexpected error while handling signal request", exception);

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected server error"
        );
        problemDetail.setProperty("code", "internal_error");
        return problemDetail;
    }

    private ProblemDetail validationProblem(List<String> details) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }

    private String extractFeignDetail(FeignException exception) {
        String body = exception.contentUTF8();
        if (body != null && !body.isBlank()) {
            return body;
        }

        String message = exception.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }

        return "Market data request failed";
    }
}
