package com.alphix.liquidity.client;

import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.PreparedStep;
import com.alphix.liquidity.model.RawTransaction;
import com.alphix.liquidity.model.TokenRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Reads a prepare-mint-tx answer into a {@link PreparedStep}.
 *
 * Shapes:
 * - {@code needsApproval=false}: {@code transaction {to, data, value}}
 * - {@code approvalType=ERC20_TO_PERMIT2}: {@code approvalTokenAddress, approveToAddress, approvalAmount}
 * - {@code approvalType=PERMIT2_SIGNATURE_FOR_PM}: {@code signatureDetails {domain, types, primaryType, message}}
 */
@Component
public class PreparedStepParser {

    public PreparedStep parse(final JsonNode root, final DepositIntent intent) {
        if (root == null || !root.has("needsApproval")) {
            throw new CollaboratorException("Prepare response has no needsApproval flag");
        }
        if (!root.path("needsApproval").asBoolean()) {
            JsonNode tx = root.path("transaction");
            String to = text(tx, "to");
            String data = text(tx, "data");
            return new PreparedStep.ReadyToMint(new RawTransaction(to, data, uint(tx.path("value"), BigInteger.ZERO)));
        }

        String approvalType = root.path("approvalType").asText("");
        if (DepositConstants.APPROVAL_TYPE_ERC20.equals(approvalType)) {
            TokenRef token = resolveToken(root, intent);
            String spender = root.path("approveToAddress").asText(DepositConstants.PERMIT2_ADDRESS);
            BigInteger amount = uint(root.path("approvalAmount"), DepositConstants.MAX_UINT256);
            return new PreparedStep.NeedsErc20Approval(token, spender, amount);
        }
        if (DepositConstants.APPROVAL_TYPE_PERMIT2.equals(approvalType)) {
            JsonNode details = root.path("signatureDetails");
            if (!details.isObject() || !details.path("message").isObject()) {
                throw new CollaboratorException("Permit step without signatureDetails.message");
            }
            String permit2 = root.path("permit2Address").asText(DepositConstants.PERMIT2_ADDRESS);
            String symbol = root.path("approvalTokenSymbol").asText(null);
            return new PreparedStep.NeedsPermitSignature(symbol, ((ObjectNode) details).deepCopy(), permit2);
        }
        throw new CollaboratorException("Unknown approvalType: " + approvalType);
    }

    private static TokenRef resolveToken(final JsonNode root, final DepositIntent intent) {
        String address = root.path("approvalTokenAddress").asText(null);
        String symbol = root.path("approvalTokenSymbol").asText(null);
        for (TokenRef candidate : new TokenRef[] {intent.token0(), intent.token1()}) {
            if (candidate.sameAddress(address) || (address == null && candidate.symbol().equals(symbol))) {
                return candidate;
            }
        }
        throw new CollaboratorException("Approval requested for token outside the deposit: "
                + (address != null ? address : symbol));
    }

    private static String text(final JsonNode node, final String field) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new CollaboratorException("Prepared transaction is missing " + field);
        }
        return value;
    }

    private static BigInteger uint(final JsonNode node, final BigInteger fallback) {
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        }
        String raw = node.asText().trim();
        try {
            return Numeric.containsHexPrefix(raw) ? Numeric.toBigInt(raw) : new BigInteger(raw);
        } catch (NumberFormatException e) {
            throw new CollaboratorException("Not an integer: " + raw, e);
        }
    }
}
