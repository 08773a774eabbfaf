// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

/**
 * A request that was written and has not been consumed yet. Waited-for
 * requests complete {@link #future}; detached ones hand their result to
 * {@link #handler} instead.
 */
record PendingRequest(
        long id,
        String method,
        List<Object> params,
        long startNanos,
        CompletableFuture<RpcResult> future,
        @Nullable Consumer<RpcResult> handler) {

    static PendingRequest awaited(long id, String method, List<Object> params) {
        return new PendingRequest(id, method, params, System.nanoTime(), new CompletableFuture<>(), null);
    }

    static PendingRequest detached(long id, String method, List<Object> params, Consumer<RpcResult> handler) {
        return new PendingRequest(id, method, params, System.nanoTime(), new CompletableFuture<>(), handler);
    }

    boolean isDetached() {
        return handler != null;
    }
}
