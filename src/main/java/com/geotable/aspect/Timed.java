package com.geotable.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks methods whose execution time is recorded and logged
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {

    /**
     * Operation name used as metric tag; defaults to the method name
     */
    String value() default "";

    /**
     * Log level for timing output
     */
    LogLevel logLevel() default LogLevel.DEBUG;

    enum LogLevel {
        DEBUG, INFO
    }
}
