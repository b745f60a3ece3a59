package czm.dabs_be.web;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex, HttpServletRequest request) {
        log.debug("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), ex.getCode(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of(
                ex.getCode(),
                ex.getMessage(),
                ex.getDetails(),
                ex.getStatus().value(),
                request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(ex.getStatus()).body(body);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class, MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex, HttpServletRequest request) {
        log.debug("{} {} has malformed input: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.of(
                ApiException.VALIDATION,
                "Invalid input. Check the selected project and the request parameters.",
                ex.getMessage(),
                HttpStatus.BAD_REQUEST.value(),
                request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ApiErrorResponse> handleTimeout(QueryTimeoutException ex, HttpServletRequest request) {
        log.error("Storage timeout on {} {}", request.getMethod(), request.getRequestURI(), ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "STORAGE_TIMEOUT",
                "The database did not answer in time. Nothing was saved, please try again.",
                ex.getMostSpecificCause().getMessage(),
                HttpStatus.GATEWAY_TIMEOUT.value(),
                request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiErrorResponse> handleStorage(DataAccessException ex, HttpServletRequest request) {
        log.error("Storage failure on {} {} (query: {})", request.getMethod(), request.getRequestURI(),
                request.getQueryString(), ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "STORAGE",
                "The database request failed. Try again or contact the administrator.",
                truncate(ex.getMostSpecificCause().getMessage(), 500),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), ex);
        ApiErrorResponse body = ApiErrorResponse.of(
                "UNKNOWN",
                "An unexpected error occurred. Try again or contact the administrator.",
                ex.getMessage(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static String truncate(String s, int max) { if (s == null) return null; return s.length() <= max ? s : s.substring(0, max) + "..."; }
}
