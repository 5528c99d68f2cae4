package com.example.starterkit.projectgen.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Logs how long the annotated method took. Only applies to calls that go
 * through the Spring proxy.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogExecutionTime {
    /**
     * Label printed in the log line; defaults to the method signature
     */
    String value() default "";
}
