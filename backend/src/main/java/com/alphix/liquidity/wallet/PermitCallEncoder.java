package com.alphix.liquidity.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint48;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds Permit2 {@code permit(owner, permit, signature)} calldata from a signed EIP-712 message.
 * Handles both PermitSingle ({@code details} object) and PermitBatch ({@code details} array).
 */
@Component
public class PermitCallEncoder {

    static final String PERMIT_SINGLE_SIGNATURE =
            "permit(address,((address,uint160,uint48,uint48),address,uint256),bytes)";
    static final String PERMIT_BATCH_SIGNATURE =
            "permit(address,((address,uint160,uint48,uint48)[],address,uint256),bytes)";

    public static class PermitDetails extends StaticStruct {
        public String token;
        public BigInteger amount;
        public BigInteger expiration;
        public BigInteger nonce;

        public PermitDetails(String token, BigInteger amount, BigInteger expiration, BigInteger nonce) {
            super(new Address(160, token), new Uint160(amount), new Uint48(expiration), new Uint48(nonce));
            this.token = token;
            this.amount = amount;
            this.expiration = expiration;
            this.nonce = nonce;
        }
    }

    public static class PermitSingle extends StaticStruct {
        public PermitDetails details;
        public String spender;
        public BigInteger sigDeadline;

        public PermitSingle(PermitDetails details, String spender, BigInteger sigDeadline) {
            super(details, new Address(160, spender), new Uint256(sigDeadline));
            this.details = details;
            this.spender = spender;
            this.sigDeadline = sigDeadline;
        }
    }

    public static class PermitBatch extends DynamicStruct {
        public List<PermitDetails> details;
        public String spender;
        public BigInteger sigDeadline;

        public PermitBatch(List<PermitDetails> details, String spender, BigInteger sigDeadline) {
            super(new DynamicArray<>(PermitDetails.class, details), new Address(160, spender), new Uint256(sigDeadline));
            this.details = details;
            this.spender = spender;
            this.sigDeadline = sigDeadline;
        }
    }

    public String encode(final String owner, final JsonNode message, final String signature) {
        JsonNode details = message.path("details");
        if (details.isMissingNode() || details.isNull()) {
            throw new IllegalArgumentException("Permit message has no details");
        }
        String spender = requireText(message, "spender");
        BigInteger sigDeadline = toBigInteger(message.path("sigDeadline"));
        DynamicBytes sig = new DynamicBytes(Numeric.hexStringToByteArray(signature));

        List<Type> params;
        String methodSignature;
        if (details.isArray()) {
            List<PermitDetails> entries = new ArrayList<>();
            for (JsonNode detail : details) {
                entries.add(permitDetails(detail));
            }
            if (entries.isEmpty()) {
                throw new IllegalArgumentException("Permit batch is empty");
            }
            params = Arrays.asList(new Address(owner), new PermitBatch(entries, spender, sigDeadline), sig);
            methodSignature = PERMIT_BATCH_SIGNATURE;
        } else {
            params = Arrays.asList(new Address(owner), new PermitSingle(permitDetails(details), spender, sigDeadline), sig);
            methodSignature = PERMIT_SINGLE_SIGNATURE;
        }
        return selector(methodSignature) + FunctionEncoder.encodeConstructor(params);
    }

    /**
     * First four bytes of the keccak hash of the canonical signature, 0x-prefixed.
     */
    static String selector(final String methodSignature) {
        return Hash.sha3String(methodSignature).substring(0, 10);
    }

    private static PermitDetails permitDetails(final JsonNode detail) {
        return new PermitDetails(
                requireText(detail, "token"),
                toBigInteger(detail.path("amount")),
                toBigInteger(detail.path("expiration")),
                toBigInteger(detail.path("nonce")));
    }

    private static String requireText(final JsonNode node, final String field) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Permit field missing: " + field);
        }
        return value;
    }

    /**
     * uint fields arrive as JSON numbers, decimal strings or 0x-hex strings.
     */
    static BigInteger toBigInteger(final JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            throw new IllegalArgumentException("Missing numeric permit field");
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        String text = node.asText().trim();
        if (Numeric.containsHexPrefix(text)) {
            return Numeric.toBigInt(text);
        }
        return new BigInteger(text);
    }
}
