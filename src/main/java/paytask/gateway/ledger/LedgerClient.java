package paytask.gateway.ledger;

import paytask.gateway.ledger.dto.GetBlocksArgs;
import paytask.gateway.ledger.dto.QueryBlocksResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Query side of the external ledger.
 * Calls are asynchronous; a failed query completes the future exceptionally
 * with a {@link LedgerException}.
 */
public interface LedgerClient {

    CompletableFuture<QueryBlocksResponse> queryBlocks(GetBlocksArgs args);
}
