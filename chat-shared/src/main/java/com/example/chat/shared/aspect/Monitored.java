package com.example.chat.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Opts a bean, or single methods of it, into {@link MonitoringAspect}: each call is counted
 * under {@code chat.<value>.calls} and timed under {@code chat.<value>.latency}, tagged by call
 * site and status. Reactive results are timed until they terminate. A method-level annotation
 * wins over the one on its class.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {
    /** Layer name used in the metric names, e.g. {@code event-publisher}. */
    String value();
}
