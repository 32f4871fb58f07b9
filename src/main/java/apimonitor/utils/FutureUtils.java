package apimonitor.utils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * CompletableFuture 工具
 */
public final class FutureUtils {

    private FutureUtils() {
    }

    /**
     * 剥离 CompletionException / ExecutionException 包装，返回真实异常
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 调用返回 future 的操作，同步抛出的异常也转换为失败的 future
     */
    public static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("operation returned null future"));
            }
            return future;
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
