package com.example.progress.shared.aspect;

import com.example.progress.shared.config.MonitoringConfig;
import com.example.progress.shared.dto.CorrelatedRequest;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.ProgressMetricsCollector metricsCollector;

    @Around("@within(com.example.progress.shared.aspect.Monitored) || @annotation(com.example.progress.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        // Method-level annotation wins over the class-level one
        Monitored monitored = method.getAnnotation(Monitored.class);
        if (monitored == null) {
            monitored = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String operationType = monitored.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        Span currentSpan = Span.current();
        if (currentSpan.getSpanContext().isValid()) {
            for (Object arg : joinPoint.getArgs()) {
                if (arg instanceof CorrelatedRequest request && request.getCorrelationId() != null) {
                    currentSpan.setAttribute("app.correlation_id", request.getCorrelationId());
                    break;
                }
            }
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("progress." + operationType + ".latency", duration,
                    "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("progress." + operationType + ".calls",
                    "class", className, "method", methodName, "status", "success");
            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("progress." + operationType + ".latency", duration,
                    "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("progress." + operationType + ".calls",
                    "class", className, "method", methodName, "status", "error");
            if (currentSpan.getSpanContext().isValid()) {
                currentSpan.recordException(e);
            }
            log.warn("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }
}
