package com.buildingsync.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks methods whose execution time is logged and handed to the REST layer
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Timed {
    
    /**
     * Name of the timed operation, defaults to the method name
     */
    String value() default "";
    
    LogLevel logLevel() default LogLevel.DEBUG;
    
    enum LogLevel {
        DEBUG, INFO, WARN
    }
}
