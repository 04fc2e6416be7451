package com.di.dataqc.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method for operation event logging by {@link OperationEventAspect}: one {@code <eventType>_STARTED}
 * line, then {@code _COMPLETED} with the duration or {@code _FAILED} with the error category.
 *
 * <pre>
 * {@code
 * @LogOperation(eventType = "RECONCILE", parameterNames = {"request"})
 * public ReconciliationResult reconcile(ReconciliationRequest request) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogOperation {

    /**
     * Event type prefix, e.g. {@code RULE_BATCH}.
     */
    String eventType();

    /**
     * Names for the method arguments, in order, to include in the event context. Empty means none.
     */
    String[] parameterNames() default {};
}
