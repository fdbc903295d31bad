package com.dburyak.jsonrpc2;

import io.reactivex.rxjava3.core.Completable;

/**
 * Chain component that may hold resources (connections, pending writes) to release when the server goes away.
 */
public interface AsyncCloseable {

    /**
     * Releases resources. Called once, after the last dispatch. Nothing to release by default.
     */
    default Completable closeAsync() {
        return Completable.complete();
    }
}
