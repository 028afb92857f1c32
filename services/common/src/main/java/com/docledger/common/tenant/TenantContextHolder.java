package com.docledger.common.tenant;

import com.docledger.common.error.BusinessException;
import com.docledger.common.error.ErrorCode;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Binds the {@link TenantContext} to the current thread and mirrors it into the logging MDC.
 */
public final class TenantContextHolder {

    public static final String TENANT_ID_KEY = "tenantId";
    public static final String ACTOR_ID_KEY = "actorId";

    private static final ThreadLocal<TenantContext> CONTEXT = new ThreadLocal<>();

    private TenantContextHolder() {
    }

    public static void set(TenantContext context) {
        if (context == null) {
            clear();
            return;
        }
        CONTEXT.set(context);
        MDC.put(TENANT_ID_KEY, context.getTenantId());
        MDC.put(ACTOR_ID_KEY, context.getActorId());
    }

    public static Optional<TenantContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the bound context or rejects the call when none is bound.
     */
    public static TenantContext require() {
        TenantContext context = CONTEXT.get();
        if (context == null) {
            throw new BusinessException(ErrorCode.SEC_TENANT_CONTEXT_MISSING, null);
        }
        return context;
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(TENANT_ID_KEY);
        MDC.remove(ACTOR_ID_KEY);
    }

    /**
     * Runs {@code action} with {@code context} bound, restoring the previous binding afterwards.
     */
    public static <T> T callAs(TenantContext context, Supplier<T> action) {
        TenantContext previous = CONTEXT.get();
        set(context);
        try {
            return action.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    public static void runAs(TenantContext context, Runnable action) {
        callAs(context, () -> {
            action.run();
            return null;
        });
    }
}
