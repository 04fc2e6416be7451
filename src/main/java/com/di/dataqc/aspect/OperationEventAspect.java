package com.di.dataqc.aspect;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Logs start, completion and failure of methods annotated with {@link LogOperation}, tagged with the
 * request id from the MDC. Failures are logged with their {@link ErrorCategory} and re-thrown unchanged.
 */
@Slf4j
@Aspect
@Component
public class OperationEventAspect {

    @Around("@annotation(com.di.dataqc.aspect.LogOperation)")
    public Object logOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        LogOperation annotation = method.getAnnotation(LogOperation.class);

        String eventType = annotation.eventType();
        String requestId = MDC.get("requestId");
        Map<String, Object> context = extractContext(joinPoint.getArgs(), method, annotation);
        long startTime = System.currentTimeMillis();

        log.info("[EVENT] {}_STARTED requestId={} {}", eventType, requestId, context);
        try {
            Object result = joinPoint.proceed();
            long durationMs = System.currentTimeMillis() - startTime;
            log.info("[EVENT] {}_COMPLETED requestId={} durationMs={}", eventType, requestId, durationMs);
            return result;
        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory category = ErrorCategory.categorize(e);
            Throwable rootCause = getRootCause(e);
            log.warn("[EVENT] {}_FAILED requestId={} durationMs={} errorCategory={} errorType={} message={}{}",
                    eventType, requestId, durationMs, category.name(), e.getClass().getSimpleName(),
                    e.getMessage(),
                    rootCause != e ? " rootCause=" + rootCause.getClass().getSimpleName() + ": " + rootCause.getMessage() : "");
            throw e;
        }
    }

    static Map<String, Object> extractContext(Object[] args, Method method, LogOperation annotation) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("method", method.getDeclaringClass().getSimpleName() + "." + method.getName());
        String[] names = annotation.parameterNames();
        for (int i = 0; i < Math.min(names.length, args.length); i++) {
            if (names[i] == null || names[i].isEmpty()) {
                continue;
            }
            String lower = names[i].toLowerCase(Locale.ROOT);
            if (lower.contains("password") || lower.contains("secret") || lower.contains("credential")) {
                context.put(names[i], "***");
            } else {
                context.put(names[i], describe(args[i]));
            }
        }
        return context;
    }

    /**
     * Short loggable form: datasets by shape, collections by size, strings with passwords masked,
     * other objects by type name.
     */
    static Object describe(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof Enum) {
            return value;
        }
        if (value instanceof String) {
            String text = InputValidator.sanitizeForLogging((String) value);
            return text.length() > 200 ? text.substring(0, 200) + "..." : text;
        }
        if (value instanceof Dataset) {
            return value.toString();
        }
        if (value instanceof Collection) {
            return "size=" + ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return "size=" + ((Map<?, ?>) value).size();
        }
        return value.getClass().getSimpleName();
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }
}
