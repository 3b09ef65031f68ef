package paytask.gateway.ledger;

import paytask.gateway.ledger.dto.GetBlocksArgs;
import paytask.gateway.ledger.dto.QueryBlocksResponse;
import paytask.gateway.ledger.dto.QueryBlocksResponse.Block;
import paytask.gateway.ledger.dto.QueryBlocksResponse.Transfer;
import paytask.gateway.util.ShortHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Checks that a payer transferred the expected amount to the service with a
 * given memo, in exactly one ledger block.
 *
 * <p>
 * Sender and receiver are compared by {@link ShortHash} digests of the account
 * identifiers, not byte for byte. Two different addresses with the same digest
 * would pass; this matches the payment flows already in use.
 */
public class LedgerVerifier {

    private static final Logger log = LoggerFactory.getLogger(LedgerVerifier.class);

    private final LedgerClient ledgerClient;
    private final AccountAddress serviceAddress;

    public LedgerVerifier(LedgerClient ledgerClient, String serviceIdentity) {
        this.ledgerClient = ledgerClient;
        this.serviceAddress = AccountAddress.of(serviceIdentity);
    }

    /**
     * Look for a matching transfer in block {@code blockHeight}.
     *
     * @return future completing with true on the first matching transfer, false
     *         otherwise; completes exceptionally if the ledger query fails
     */
    public CompletableFuture<Boolean> verify(String payer, long expectedAmount, long blockHeight, long memo) {
        long senderDigest = ShortHash.of(AccountAddress.of(payer).bytes());
        long receiverDigest = ShortHash.of(serviceAddress.bytes());

        return ledgerClient.queryBlocks(GetBlocksArgs.single(blockHeight))
                .thenApply(response -> {
                    boolean found = response.blocks().stream()
                            .anyMatch(block -> matches(block, senderDigest, receiverDigest, expectedAmount, memo));
                    log.debug("Payment memo={} payer={} block={} verified={}", memo, payer, blockHeight, found);
                    return found;
                });
    }

    public AccountAddress serviceAddress() {
        return serviceAddress;
    }

    private boolean matches(Block block, long senderDigest, long receiverDigest, long amount, long memo) {
        if (block == null || block.transaction() == null) {
            return false;
        }
        QueryBlocksResponse.Transaction tx = block.transaction();
        if (tx.operation() == null || tx.operation().transfer() == null) {
            return false;
        }
        Transfer transfer = tx.operation().transfer();

        if (!BigInteger.valueOf(memo).equals(tx.memo())) {
            return false;
        }
        if (transfer.amount() == null || !BigInteger.valueOf(amount).equals(transfer.amount().e8s())) {
            return false;
        }
        return senderDigest == digest(transfer.from()) && receiverDigest == digest(transfer.to());
    }

    private static long digest(String hexAddress) {
        try {
            return ShortHash.of(AccountAddress.fromHex(hexAddress).bytes());
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed ledger address '{}': {}", hexAddress, e.getMessage());
            return -1L;
        }
    }
}
