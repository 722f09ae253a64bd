package com.analytics.workflow.domain.webhook;

import com.analytics.workflow.config.WebhookQueueProperties;
import com.analytics.workflow.domain.exception.HandlerTimeoutException;
import com.analytics.workflow.domain.model.WebhookQueueItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the webhook handler for one item with a hard timeout.
 * 
 * The call happens on the webhook handler pool, never on the caller's
 * thread; past timeout-ms the future is cancelled (interrupting the
 * handler) and the attempt fails with HandlerTimeoutException. A full
 * pool rejects the call before the handler starts.
 */
@Slf4j
@Component
public class WebhookDispatcher {
    
    private final WebhookHandler handler;
    private final Executor handlerExecutor;
    private final WebhookQueueProperties properties;
    
    public WebhookDispatcher(WebhookHandler handler,
                             @Qualifier("webhookHandlerExecutor") Executor handlerExecutor,
                             WebhookQueueProperties properties) {
        this.handler = handler;
        this.handlerExecutor = handlerExecutor;
        this.properties = properties;
    }
    
    /**
     * @throws HandlerTimeoutException when the handler overruns the timeout
     * @throws java.util.concurrent.RejectedExecutionException when the handler pool is full
     * @throws Exception whatever the handler threw
     */
    public void dispatch(WebhookQueueItem item) throws Exception {
        Callable<Void> call = () -> {
            handler.handle(item);
            return null;
        };
        FutureTask<Void> task = new FutureTask<>(call);
        handlerExecutor.execute(task);
        await(task, item);
    }
    
    private void await(Future<Void> task, WebhookQueueItem item) throws Exception {
        long timeoutMs = properties.getTimeoutMs();
        try {
            task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Webhook item {} (tenant {}) timed out after {} ms", item.getId(), item.getTenantId(), timeoutMs);
            throw new HandlerTimeoutException(item.getId(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
