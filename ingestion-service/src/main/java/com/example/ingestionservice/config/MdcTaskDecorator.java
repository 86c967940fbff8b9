package com.example.ingestionservice.config;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * TaskDecorator to propagate MDC (Mapped Diagnostic Context) across thread boundaries.
 * 
 * Thread Lifecycle:
 * 1. Submission endpoint puts correlation ID into MDC
 * 2. Task submitted to backfillTaskExecutor
 * 3. decorate() called on submitting thread → captures MDC
 * 4. Worker thread restores MDC before run()
 * 5. finally block restores the worker's previous context (or clears it)
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> parentContext = MDC.getCopyOfContextMap();

        return () -> {
            Map<String, String> previousContext = MDC.getCopyOfContextMap();
            try {
                if (parentContext != null) {
                    MDC.setContextMap(parentContext);
                } else {
                    MDC.clear();
                }
                runnable.run();
            } finally {
                if (previousContext != null) {
                    MDC.setContextMap(previousContext);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
