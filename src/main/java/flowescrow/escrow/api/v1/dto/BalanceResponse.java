package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /api/v1/balances/{account}
 */
public record BalanceResponse(
        @JsonProperty("account") String account,
        @JsonProperty("balance") long balance) {
}
