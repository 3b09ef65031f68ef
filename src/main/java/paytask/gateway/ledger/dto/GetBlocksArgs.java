package paytask.gateway.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ledger block range query: {@code [start, start + length)}.
 */
public record GetBlocksArgs(
        @JsonProperty("start") long start,
        @JsonProperty("length") long length) {

    public GetBlocksArgs {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
    }

    public static GetBlocksArgs single(long block) {
        return new GetBlocksArgs(block, 1);
    }
}
