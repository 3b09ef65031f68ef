package paytask.gateway.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.List;

/**
 * Ledger response to a block range query.
 * Only the fields used for payment verification are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryBlocksResponse(
        @JsonProperty("chain_length") Long chainLength,
        @JsonProperty("first_block_index") Long firstBlockIndex,
        @JsonProperty("blocks") List<Block> blocks) {

    public QueryBlocksResponse {
        blocks = blocks != null ? List.copyOf(blocks) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Block(
            @JsonProperty("transaction") Transaction transaction) {
    }

    /** Operation may be absent; non-transfer operations map to a null transfer. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Transaction(
            @JsonProperty("memo") BigInteger memo,
            @JsonProperty("operation") Operation operation) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Operation(
            @JsonProperty("Transfer") Transfer transfer) {
    }

    /** Account identifiers are hex encoded. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Transfer(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("amount") Tokens amount,
            @JsonProperty("fee") Tokens fee) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tokens(
            @JsonProperty("e8s") BigInteger e8s) {
    }
}
