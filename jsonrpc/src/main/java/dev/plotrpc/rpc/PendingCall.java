package dev.plotrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * One outstanding call. Starts out issued and ends exactly once, either resolved by the matching
 * reply or cancelled by the caller. A cancelled call completes with {@code null} and any reply
 * that arrives later is dropped.
 *
 * <p>There is no timeout inside the call itself. Either wait on {@link #result()} and invoke
 * {@link #cancel()} when giving up, or use {@link #await(Duration)} which does both.</p>
 */
public final class PendingCall {

    private final long id;
    private final String method;
    private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
    private final Consumer<PendingCall> onCancel;

    PendingCall(long id, String method, Consumer<PendingCall> onCancel) {
        this.id = id;
        this.method = method;
        this.onCancel = onCancel;
    }

    public long id() {
        return id;
    }

    public String method() {
        return method;
    }

    /**
     * Completes with the reply's {@code result} member, with {@code null} after cancellation, or
     * exceptionally with a {@link JsonRpcException} when the reply was an error.
     */
    public CompletableFuture<JsonNode> result() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Resolve the call to {@code null} and forget its correlation state. Does nothing once the
     * call has completed.
     * @return {@code true} if this invocation cancelled the call
     */
    public boolean cancel() {
        if (!result.complete(null)) {
            return false;
        }
        onCancel.accept(this);
        return true;
    }

    /**
     * Wait up to {@code timeout} for the reply, cancelling the call if none arrived.
     * @return the result, or {@code null} when the call timed out or was cancelled
     * @throws JsonRpcException if the remote side answered with an error
     */
    public JsonNode await(Duration timeout) throws JsonRpcException, InterruptedException {
        try {
            return result.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (cancel()) {
                return null;
            }
            // The reply won the race against cancel().
            return join();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    boolean resolve(JsonNode value) {
        return result.complete(value);
    }

    boolean fail(JsonRpcException error) {
        return result.completeExceptionally(error);
    }

    private JsonNode join() throws JsonRpcException, InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static JsonRpcException unwrap(ExecutionException e) {
        if (e.getCause() instanceof JsonRpcException rpcError) {
            return rpcError;
        }
        return new JsonRpcException(JsonRpcErrorCode.INTERNAL_ERROR, String.valueOf(e.getCause()));
    }

    @Override
    public String toString() {
        return "PendingCall[id=" + id + ", method=" + method + ", done=" + result.isDone() + "]";
    }
}
