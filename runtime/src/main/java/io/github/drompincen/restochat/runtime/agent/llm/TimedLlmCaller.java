package io.github.drompincen.restochat.runtime.agent.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs model calls on the bounded-elastic scheduler with a per-call timeout. Every failure,
 * including the timeout, surfaces as {@link ModelCallException}.
 */
public class TimedLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(TimedLlmCaller.class);

    private final LlmService llmService;
    private final Duration timeout;

    public TimedLlmCaller(LlmService llmService, Duration timeout) {
        this.llmService = llmService;
        this.timeout = timeout;
    }

    public String call(LlmRequest request) {
        return call(request, timeout);
    }

    /** Same as {@link #call(LlmRequest)} with a caller-chosen limit; null means the default. */
    public String call(LlmRequest request, Duration limit) {
        Duration timeout = limit != null ? limit : this.timeout;
        long start = System.currentTimeMillis();
        try {
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            String text = Mono.fromCallable(() -> callWithMdc(request, mdc))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
            log.debug("{} call finished in {} ms", request.purpose(), System.currentTimeMillis() - start);
            return text != null ? text : "";
        } catch (ModelCallException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = cause instanceof TimeoutException
                    ? "timed out after " + timeout.toSeconds() + "s"
                    : cause.getMessage();
            log.warn("{} call failed: {}", request.purpose(), reason);
            throw new ModelCallException(request.purpose() + " call failed: " + reason, cause);
        }
    }

    private String callWithMdc(LlmRequest request, Map<String, String> mdc) {
        if (mdc != null) MDC.setContextMap(mdc);
        try {
            return llmService.blockingResponse(request);
        } finally {
            MDC.clear();
        }
    }

    public boolean isAvailable() {
        return llmService.isAvailable();
    }
}
