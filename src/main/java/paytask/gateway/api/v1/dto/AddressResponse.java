package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ledger account identifier of an identity, hex encoded.
 */
public record AddressResponse(
        @JsonProperty("identity") String identity,
        @JsonProperty("address") String address) {
}
