package com.alphix.liquidity.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The preparer's answer to "what must happen next" for an intent. Valid for exactly one step.
 */
public sealed interface PreparedStep {

    /**
     * ERC20 allowance to grant before anything else. Amount in raw token units.
     */
    record NeedsErc20Approval(TokenRef token, String spender, BigInteger amount) implements PreparedStep {
        public NeedsErc20Approval {
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(spender, "spender");
            Objects.requireNonNull(amount, "amount");
        }
    }

    /**
     * EIP-712 permit to sign. The typed data carries domain, types, primaryType and message and is
     * passed to the wallet unchanged.
     */
    record NeedsPermitSignature(String tokenSymbol, JsonNode typedData, String permit2Address)
            implements PreparedStep {
        public NeedsPermitSignature {
            Objects.requireNonNull(typedData, "typedData");
            Objects.requireNonNull(permit2Address, "permit2Address");
        }

        public JsonNode message() {
            return typedData.path("message");
        }

        /**
         * Token addresses the permit authorizes: every {@code details[i].token} of a batch, or the
         * single {@code details.token}.
         */
        public List<String> tokenAddresses() {
            JsonNode details = message().path("details");
            List<String> addresses = new ArrayList<>();
            if (details.isArray()) {
                for (JsonNode detail : details) {
                    String token = detail.path("token").asText(null);
                    if (token != null && !token.isBlank()) {
                        addresses.add(token);
                    }
                }
            } else {
                String token = details.path("token").asText(null);
                if (token != null && !token.isBlank()) {
                    addresses.add(token);
                }
            }
            return addresses;
        }
    }

    record ReadyToMint(RawTransaction transaction) implements PreparedStep {
        public ReadyToMint {
            Objects.requireNonNull(transaction, "transaction");
        }
    }
}
