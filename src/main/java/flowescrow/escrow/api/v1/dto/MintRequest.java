package flowescrow.escrow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating tokens on a wallet.
 * POST /api/v1/balances/mint
 */
public record MintRequest(
        @JsonProperty("account") String account,
        @JsonProperty("amount") Long amount) {

    public void validate() {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("account is required");
        }
        if (amount == null || amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }
}
