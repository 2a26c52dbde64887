package com.blockscope.indexer.prevout;

import com.blockscope.domain.OutPoint;
import com.blockscope.domain.Prevout;

/**
 * Outcome of one worker lookup. prevout may be null on success when the output does not exist or pays no address.
 */
public record PrevoutLookupResult(OutPoint outPoint, Prevout prevout, RuntimeException error) {

    public static PrevoutLookupResult ok(OutPoint outPoint, Prevout prevout) {
        return new PrevoutLookupResult(outPoint, prevout, null);
    }

    public static PrevoutLookupResult failed(OutPoint outPoint, RuntimeException error) {
        return new PrevoutLookupResult(outPoint, null, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
