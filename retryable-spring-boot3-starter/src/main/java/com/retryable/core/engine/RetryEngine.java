package com.retryable.core.engine;

import com.retryable.core.RetryPolicy;
import com.retryable.core.function.CheckedSupplier;
import com.retryable.core.spi.RetryListener;
import com.retryable.core.spi.RetryPredicate;
import com.retryable.model.Failure;
import com.retryable.model.RetryResult;
import com.retryable.model.ctx.InvocationContext;
import com.retryable.model.ctx.RetryContext;
import com.retryable.model.enums.RetryState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * 重试执行循环
 * ATTEMPTING → SUCCEEDED | EXHAUSTED_FAILED | DENIED | PREDICATE_FAILED | RETRYABLY_FAILED → ATTEMPTING
 * 全部在调用线程上执行, 等待为阻塞等待
 */
@Slf4j
public class RetryEngine {

    private final RetryPolicy policy;

    private final List<RetryListener> listeners;

    public RetryEngine(RetryPolicy policy) {
        this.policy = policy;
        this.listeners = policy.getListeners();
    }

    public <T> RetryResult<T> execute(InvocationContext ctx, CheckedSupplier<T> operation) {
        RetryContext view = ctx.readOnly();
        while (true) {
            ctx.setState(RetryState.ATTEMPTING);
            log.info("[Retryable] executing {} - #{} of {}", ctx.getName(), ctx.getCurrentAttempt(), ctx.getTotalTries());
            fire(l -> l.onAttempt(view));

            T value;
            try {
                value = operation.get();
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable t) {
                ctx.setLastFailure(Failure.ofOperation(t, ctx.getCurrentAttempt()));
                log.debug("[Retryable] {} caused an exception of type {}", ctx.getName(), t.getClass().getName());
                if (t instanceof InterruptedException) {
                    // 操作本身被中断, 视为取消
                    Thread.currentThread().interrupt();
                    log.warn("[Retryable] {} interrupted during attempt #{}", ctx.getName(), ctx.getCurrentAttempt());
                    return terminate(ctx, view, RetryState.INTERRUPTED);
                }

                RetryState next = decide(ctx);
                if (next.isTerminal()) {
                    return terminate(ctx, view, next);
                }
                if (!awaitRetry(ctx, view)) {
                    return terminate(ctx, view, RetryState.INTERRUPTED);
                }
                continue;
            }

            ctx.setState(RetryState.SUCCEEDED);
            fire(l -> l.onSuccess(view));
            return RetryResult.success(value, ctx.getCurrentAttempt());
        }
    }

    /**
     * 失败判定, 顺序固定：耗尽 → 拒绝列表 → 谓词
     * 最后一次允许的执行失败时不再查看拒绝列表和谓词
     */
    private RetryState decide(InvocationContext ctx) {
        Failure failure = ctx.getLastFailure();
        if (ctx.isLastAttempt()) {
            return RetryState.EXHAUSTED_FAILED;
        }

        if (policy.isDenied(failure.getCause())) {
            log.error("[Retryable] {} is in the deny list for {}, rethrowing",
                    failure.kind().getName(), ctx.getName());
            return RetryState.DENIED;
        }

        RetryPredicate predicate = ctx.getRetryPredicate();
        if (predicate != null) {
            log.debug("[Retryable] determining retryability of {} with {}", failure.kind().getName(), predicate);
            boolean retryable;
            try {
                retryable = predicate.test(failure);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable pe) {
                log.error("[Retryable] {} raised {} trying to determine if {} was retryable, this kills the retry",
                        predicate, pe.getClass().getName(), failure.kind().getName(), pe);
                ctx.setLastFailure(Failure.ofPredicate(pe, ctx.getCurrentAttempt()));
                return RetryState.PREDICATE_FAILED;
            }
            if (!retryable) {
                log.error("[Retryable] {} says that {} is not retryable", predicate, failure.kind().getName());
                return RetryState.DENIED;
            }
            log.debug("[Retryable] {} failed with {}, trying {} more times",
                    ctx.getName(), failure.getCause().toString(), ctx.remainingTries());
        }
        return RetryState.RETRYABLY_FAILED;
    }

    /**
     * 等待后进入下一次执行
     * @return false=等待期间被中断
     */
    private boolean awaitRetry(InvocationContext ctx, RetryContext view) {
        ctx.setState(RetryState.RETRYABLY_FAILED);
        Duration delay = ctx.getCurrentDelay();
        log.debug("[Retryable] {} will retry in {} ms", ctx.getName(), delay.toMillis());
        fire(l -> l.onRetry(view, ctx.getLastFailure(), delay));
        try {
            policy.getSleeper().sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("[Retryable] {} interrupted while waiting to retry #{}", ctx.getName(), ctx.getCurrentAttempt() + 1);
            return false;
        }
        // 第 n 次执行失败后的重试是第 n 次重试, 下一个等待对应第 n+1 次重试
        Duration next = policy.getBackoffPolicy()
                .delayBefore(ctx.getCurrentAttempt() + 1, ctx.getInitialDelay(), ctx.getBackoffMultiplier());
        ctx.advance(next);
        return true;
    }

    private <T> RetryResult<T> terminate(InvocationContext ctx, RetryContext view, RetryState state) {
        Failure failure = ctx.getLastFailure();
        if (ctx.getCurrentAttempt() > 1) {
            failure = failure.withRetryCount(ctx.getCurrentAttempt());
            ctx.setLastFailure(failure);
        }
        ctx.setState(state);
        if (state == RetryState.EXHAUSTED_FAILED) {
            log.debug("[Retryable] completed {} tries of {}", ctx.getCurrentAttempt(), ctx.getName());
        }
        Failure last = failure;
        fire(l -> l.onFailure(view, last));
        return RetryResult.failure(state, failure, ctx.getCurrentAttempt());
    }

    private void fire(Consumer<RetryListener> event) {
        for (RetryListener l : listeners) {
            try {
                event.accept(l);
            } catch (Exception e) {
                log.warn("[Retryable] listener {} failed", l.getClass().getName(), e);
            }
        }
    }
}
