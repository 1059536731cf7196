package io.otel.messaging.operators;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.otel.messaging.logging.MdcCorrelation;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.CompletableObserver;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.MaybeObserver;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.core.SingleObserver;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.functions.Function;
import io.reactivex.rxjava3.plugins.RxJavaPlugins;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries the OpenTelemetry context captured when a {@link Single}, {@link Maybe} or
 * {@link Completable} is assembled into its subscription and signals, and into tasks run
 * on RxJava schedulers. Without it, a traced WebClient call continued on another scheduler
 * would lose its parent span.
 *
 * {@link #enable()} is called by {@code TelemetrySdk}; it is idempotent.
 */
public final class RxContextPropagation {
    private static final Logger log = LoggerFactory.getLogger(RxContextPropagation.class);
    private static final AtomicBoolean enabled = new AtomicBoolean(false);

    private RxContextPropagation() {
        // Utility class
    }

    public static void enable() {
        if (enabled.compareAndSet(false, true)) {
            registerHooks();
            log.info("RxJava3 OpenTelemetry context propagation enabled");
        }
    }

    /**
     * Remove every hook, including hooks registered by others. Intended for tests.
     */
    public static void disable() {
        if (enabled.compareAndSet(true, false)) {
            RxJavaPlugins.reset();
        }
    }

    public static boolean isEnabled() {
        return enabled.get();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void registerHooks() {
        Function existingSingleHook = RxJavaPlugins.getOnSingleAssembly();
        RxJavaPlugins.setOnSingleAssembly(single -> {
            Single result = new ContextSingle<>(single, Context.current());
            return existingSingleHook != null ? (Single) existingSingleHook.apply(result) : result;
        });

        Function existingMaybeHook = RxJavaPlugins.getOnMaybeAssembly();
        RxJavaPlugins.setOnMaybeAssembly(maybe -> {
            Maybe result = new ContextMaybe<>(maybe, Context.current());
            return existingMaybeHook != null ? (Maybe) existingMaybeHook.apply(result) : result;
        });

        Function existingCompletableHook = RxJavaPlugins.getOnCompletableAssembly();
        RxJavaPlugins.setOnCompletableAssembly(completable -> {
            Completable result = new ContextCompletable(completable, Context.current());
            return existingCompletableHook != null ? (Completable) existingCompletableHook.apply(result) : result;
        });

        RxJavaPlugins.setScheduleHandler(RxContextPropagation::wrap);
    }

    /**
     * Bind a runnable to the context current at the time of this call. MDC follows along.
     */
    public static Runnable wrap(Runnable runnable) {
        Context context = Context.current();
        return () -> {
            try (MdcCorrelation.MdcScope scope = MdcCorrelation.makeCurrent(context)) {
                runnable.run();
            }
        };
    }

    private static final class ContextSingle<T> extends Single<T> {
        private final Single<T> source;
        private final Context context;

        ContextSingle(Single<T> source, Context context) {
            this.source = source;
            this.context = context;
        }

        @Override
        protected void subscribeActual(SingleObserver<? super T> observer) {
            try (Scope scope = context.makeCurrent()) {
                source.subscribe(new SingleObserver<T>() {
                    @Override
                    public void onSubscribe(Disposable d) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onSubscribe(d);
                        }
                    }

                    @Override
                    public void onSuccess(T value) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onSuccess(value);
                        }
                    }

                    @Override
                    public void onError(Throwable e) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onError(e);
                        }
                    }
                });
            }
        }
    }

    private static final class ContextMaybe<T> extends Maybe<T> {
        private final Maybe<T> source;
        private final Context context;

        ContextMaybe(Maybe<T> source, Context context) {
            this.source = source;
            this.context = context;
        }

        @Override
        protected void subscribeActual(MaybeObserver<? super T> observer) {
            try (Scope scope = context.makeCurrent()) {
                source.subscribe(new MaybeObserver<T>() {
                    @Override
                    public void onSubscribe(Disposable d) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onSubscribe(d);
                        }
                    }

                    @Override
                    public void onSuccess(T value) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onSuccess(value);
                        }
                    }

                    @Override
                    public void onError(Throwable e) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onError(e);
                        }
                    }

                    @Override
                    public void onComplete() {
                        try (Scope s = context.makeCurrent()) {
                            observer.onComplete();
                        }
                    }
                });
            }
        }
    }

    private static final class ContextCompletable extends Completable {
        private final Completable source;
        private final Context context;

        ContextCompletable(Completable source, Context context) {
            this.source = source;
            this.context = context;
        }

        @Override
        protected void subscribeActual(CompletableObserver observer) {
            try (Scope scope = context.makeCurrent()) {
                source.subscribe(new CompletableObserver() {
                    @Override
                    public void onSubscribe(Disposable d) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onSubscribe(d);
                        }
                    }

                    @Override
                    public void onComplete() {
                        try (Scope s = context.makeCurrent()) {
                            observer.onComplete();
                        }
                    }

                    @Override
                    public void onError(Throwable e) {
                        try (Scope s = context.makeCurrent()) {
                            observer.onError(e);
                        }
                    }
                });
            }
        }
    }
}
