package com.alphix.liquidity.client;

import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.PreparedStep;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreparedStepParserTest {

    private static final TokenRef WETH = new TokenRef("WETH", "0x4200000000000000000000000000000000000006", 18, 4);
    private static final TokenRef USDC = new TokenRef("USDC", "0x036CbD53842c5426634e7929541eC2318f3dCF7e", 6, 2);
    private static final DepositIntent INTENT = new DepositIntent(WETH, USDC, BigDecimal.ONE, new BigDecimal("2000"),
        new TickRange(-600, 600), InputSide.TOKEN0);

    private final ObjectMapper mapper = new ObjectMapper();
    private final PreparedStepParser parser = new PreparedStepParser();

    @Test
    void testReadyToMint() throws Exception {
        PreparedStep step = parser.parse(json("""
            {"needsApproval": false,
             "transaction": {"to": "0x00000000000000000000000000000000000000bb", "data": "0xabcdef", "value": "0x10"}}
            """), INTENT);

        PreparedStep.ReadyToMint ready = (PreparedStep.ReadyToMint) step;
        assertThat(ready.transaction().to()).isEqualTo("0x00000000000000000000000000000000000000bb");
        assertThat(ready.transaction().data()).isEqualTo("0xabcdef");
        assertThat(ready.transaction().value()).isEqualTo(BigInteger.valueOf(16));
    }

    @Test
    void testErc20ApprovalMatchesTokenCaseInsensitively() throws Exception {
        PreparedStep step = parser.parse(json("""
            {"needsApproval": true, "approvalType": "ERC20_TO_PERMIT2",
             "approvalTokenAddress": "0x036cbd53842c5426634e7929541ec2318f3dcf7e",
             "approvalTokenSymbol": "USDC",
             "approveToAddress": "0x000000000022D473030F116dDEE9F6B43aC78BA3"}
            """), INTENT);

        PreparedStep.NeedsErc20Approval approval = (PreparedStep.NeedsErc20Approval) step;
        assertThat(approval.token()).isEqualTo(USDC);
        assertThat(approval.amount()).isEqualTo(DepositConstants.MAX_UINT256);
    }

    @Test
    void testPermitKeepsTypedDataOpaque() throws Exception {
        PreparedStep step = parser.parse(json("""
            {"needsApproval": true, "approvalType": "PERMIT2_SIGNATURE_FOR_PM",
             "approvalTokenSymbol": "WETH",
             "signatureDetails": {
               "domain": {"name": "Permit2", "chainId": 84532},
               "primaryType": "PermitBatch",
               "message": {"details": [{"token": "0x4200000000000000000000000000000000000006"},
                                       {"token": "0x036CbD53842c5426634e7929541eC2318f3dCF7e"}],
                           "spender": "0x00000000000000000000000000000000000000bb", "sigDeadline": "1"}}}
            """), INTENT);

        PreparedStep.NeedsPermitSignature permit = (PreparedStep.NeedsPermitSignature) step;
        assertThat(permit.tokenAddresses()).hasSize(2);
        assertThat(permit.permit2Address()).isEqualTo(DepositConstants.PERMIT2_ADDRESS);
        assertThat(permit.typedData().path("domain").path("name").asText()).isEqualTo("Permit2");
    }

    @Test
    void testRejectsMalformedAnswers() throws Exception {
        assertThatThrownBy(() -> parser.parse(json("{}"), INTENT)).isInstanceOf(CollaboratorException.class);
        assertThatThrownBy(() -> parser.parse(json("{\"needsApproval\": true, \"approvalType\": \"NOPE\"}"), INTENT))
            .isInstanceOf(CollaboratorException.class);
        assertThatThrownBy(() -> parser.parse(json("""
            {"needsApproval": true, "approvalType": "ERC20_TO_PERMIT2",
             "approvalTokenAddress": "0x0000000000000000000000000000000000000bad"}
            """), INTENT)).isInstanceOf(CollaboratorException.class);
        assertThatThrownBy(() -> parser.parse(json("{\"needsApproval\": false, \"transaction\": {}}"), INTENT))
            .isInstanceOf(CollaboratorException.class);
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }
}
