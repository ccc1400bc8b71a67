package com.example.chat.shared.aspect;

import com.example.chat.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Times {@link Monitored} methods. Methods returning a {@link Mono} or {@link Flux} are timed
 * from subscription to termination rather than to assembly.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    @Around("@within(com.example.chat.shared.aspect.Monitored) || @annotation(com.example.chat.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Monitored monitored = signature.getMethod().getAnnotation(Monitored.class);
        if (monitored == null) {
            monitored = joinPoint.getTarget().getClass().getAnnotation(Monitored.class);
        }
        if (monitored == null) {
            return joinPoint.proceed();
        }

        Operation operation = new Operation(monitored.value(),
                joinPoint.getTarget().getClass().getSimpleName(), signature.getName());
        long start = System.nanoTime();
        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable e) {
            record(operation, System.nanoTime() - start, e);
            throw e;
        }

        if (result instanceof Mono<?> mono) {
            return Mono.defer(() -> {
                long subscribed = System.nanoTime();
                return mono.doOnSuccess(value -> record(operation, System.nanoTime() - subscribed, null))
                        .doOnError(error -> record(operation, System.nanoTime() - subscribed, error));
            });
        }
        if (result instanceof Flux<?> flux) {
            return Flux.defer(() -> {
                long subscribed = System.nanoTime();
                return flux.doOnComplete(() -> record(operation, System.nanoTime() - subscribed, null))
                        .doOnError(error -> record(operation, System.nanoTime() - subscribed, error));
            });
        }
        record(operation, System.nanoTime() - start, null);
        return result;
    }

    private void record(Operation operation, long elapsedNanos, Throwable error) {
        long millis = elapsedNanos / 1_000_000;
        String status = error == null ? "success" : "error";
        metricsCollector.recordTimer("chat." + operation.type() + ".latency", millis,
                "class", operation.className(), "method", operation.method(), "status", status);
        metricsCollector.incrementCounter("chat." + operation.type() + ".calls",
                "class", operation.className(), "method", operation.method(), "status", status);
        if (error == null) {
            log.debug("{}.{} ({}) completed in {}ms", operation.className(), operation.method(), operation.type(), millis);
        } else {
            metricsCollector.incrementCounter("chat.errors",
                    "type", operation.type(), "class", operation.className(), "method", operation.method());
            log.warn("{}.{} ({}) failed after {}ms: {}", operation.className(), operation.method(),
                    operation.type(), millis, error.getMessage());
        }
    }

    private record Operation(String type, String className, String method) {}
}
