package czm.dabs_be.web;

import org.springframework.http.HttpStatus;

/**
 * Expected, recoverable failure of a core operation. The code is the stable, machine readable part
 * of the error; the message is meant for the user.
 */
public class ApiException extends RuntimeException {
    public static final String VALIDATION = "VALIDATION";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String DUPLICATE_NAME = "DUPLICATE_NAME";
    public static final String NO_SOURCE_DATA = "NO_SOURCE_DATA";
    public static final String TARGET_NOT_EMPTY = "TARGET_NOT_EMPTY";
    public static final String NOTHING_TO_COPY = "NOTHING_TO_COPY";

    private final String code;
    private final HttpStatus status;
    private final String details;

    private ApiException(String code, String message, String details, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
        this.details = details;
    }

    public static ApiException validation(String message) {
        return new ApiException(VALIDATION, message, null, HttpStatus.BAD_REQUEST);
    }

    public static ApiException validation(String message, String details) {
        return new ApiException(VALIDATION, message, details, HttpStatus.BAD_REQUEST);
    }

    public static ApiException notFound(String message) {
        return new ApiException(NOT_FOUND, message, null, HttpStatus.NOT_FOUND);
    }

    public static ApiException notFound(String message, String details) {
        return new ApiException(NOT_FOUND, message, details, HttpStatus.NOT_FOUND);
    }

    public static ApiException duplicateName(String message, String details) {
        return new ApiException(DUPLICATE_NAME, message, details, HttpStatus.CONFLICT);
    }

    public static ApiException noSourceData(String message, String details) {
        return new ApiException(NO_SOURCE_DATA, message, details, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    public static ApiException targetNotEmpty(String message, String details) {
        return new ApiException(TARGET_NOT_EMPTY, message, details, HttpStatus.CONFLICT);
    }

    public static ApiException nothingToCopy(String message, String details) {
        return new ApiException(NOTHING_TO_COPY, message, details, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDetails() {
        return details;
    }
}
