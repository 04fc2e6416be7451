package com.di.dataqc.exception;

import com.di.dataqc.aspect.ErrorCategory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the controllers to an {@link ErrorResponse}:
 * <ul>
 *   <li>404: {@link ResourceNotFoundException}, unknown paths</li>
 *   <li>400: {@link RuleConfigurationException}, {@link ColumnNotFoundException}, {@link IllegalArgumentException},
 *       bean validation and malformed requests</li>
 *   <li>413: upload too large</li>
 *   <li>502: {@link ConnectorException}</li>
 *   <li>500: SQL errors and everything else</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({ResourceNotFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception e) {
        ErrorResponse response = buildErrorResponse(ErrorCategory.NOT_FOUND, e, HttpStatus.NOT_FOUND);
        if (e instanceof ResourceNotFoundException) {
            ResourceNotFoundException notFound = (ResourceNotFoundException) e;
            response.addDetail("resourceType", notFound.getResourceType());
            response.addDetail("resourceId", notFound.getResourceId());
        }
        logError("NOT_FOUND", ErrorCategory.NOT_FOUND, e, HttpStatus.NOT_FOUND);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler({RuleConfigurationException.class, ColumnNotFoundException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        if (e instanceof ColumnNotFoundException) {
            response.addDetail("missingColumns", ((ColumnNotFoundException) e).getMissingColumns());
        }
        logError("VALIDATION_EXCEPTION", category, e, HttpStatus.BAD_REQUEST);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Bean validation and malformed request bodies, parameters or parts.
     */
    @ExceptionHandler({BindException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class, jakarta.validation.ConstraintViolationException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        if (e instanceof BindException) {
            List<FieldError> errors = ((BindException) e).getFieldErrors();
            response.setMessage(errors.isEmpty() ? "Request validation failed" : errors.stream()
                    .map(error -> error.getField() + ": " + error.getDefaultMessage())
                    .collect(Collectors.joining("; ")));
            Map<String, String> fields = new LinkedHashMap<>();
            errors.forEach(error -> fields.putIfAbsent(error.getField(), error.getDefaultMessage()));
            response.addDetail("fieldErrors", fields);
        }
        logError("INVALID_REQUEST", category, e, HttpStatus.BAD_REQUEST);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("METHOD_NOT_ALLOWED", category, e, HttpStatus.METHOD_NOT_ALLOWED);
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(buildErrorResponse(category, e, HttpStatus.METHOD_NOT_ALLOWED));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UPLOAD_TOO_LARGE", category, e, HttpStatus.PAYLOAD_TOO_LARGE);
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(buildErrorResponse(category, e, HttpStatus.PAYLOAD_TOO_LARGE));
    }

    @ExceptionHandler(ConnectorException.class)
    public ResponseEntity<ErrorResponse> handleConnectorException(ConnectorException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_GATEWAY);
        response.addDetail("connectorType", e.getConnectorType());
        SQLException sqlException = findCause(e, SQLException.class);
        if (sqlException != null) {
            response.addDetail("sqlState", sqlException.getSQLState());
            response.addDetail("sqlErrorCategory", ErrorCategory.categorize(sqlException).name());
        }
        logError("CONNECTOR_EXCEPTION", category, e, HttpStatus.BAD_GATEWAY);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    @ExceptionHandler({SQLException.class, DataAccessException.class})
    public ResponseEntity<ErrorResponse> handleSqlException(Exception e) {
        SQLException sqlException = e instanceof SQLException ? (SQLException) e : findCause(e, SQLException.class);
        ErrorCategory category = sqlException != null
                ? ErrorCategory.categorize(sqlException) : ErrorCategory.DATABASE_ERROR;
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR);
        if (sqlException != null) {
            response.addDetail("sqlState", sqlException.getSQLState());
            response.addDetail("errorCode", sqlException.getErrorCode());
        }
        logError("SQL_EXCEPTION", category, e, HttpStatus.INTERNAL_SERVER_ERROR);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e, HttpStatus.INTERNAL_SERVER_ERROR);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    // ------------------------------------------------------------------------

    /**
     * Client errors are logged at WARN without a stack trace; server errors at ERROR with one.
     */
    private void logError(String eventType, ErrorCategory category, Throwable exception, HttpStatus status) {
        String requestId = MDC.get("requestId");
        if (status.is5xxServerError()) {
            log.error("[CONTROLLER] {} requestId={} status={} category={}: {}", eventType, requestId,
                    status.value(), category.getName(), messageOf(exception), exception);
        } else {
            log.warn("[CONTROLLER] {} requestId={} status={} category={}: {}", eventType, requestId,
                    status.value(), category.getName(), messageOf(exception));
        }
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    private static <T extends Throwable> T findCause(Throwable exception, Class<T> type) {
        Throwable cause = exception;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return type.cast(cause);
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return null;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error body for all API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
