package com.alphix.liquidity.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.crypto.StructuredDataEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class Web3jWalletSignerTest {

    private static final String PRIVATE_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";

    private static final String PERMIT_SINGLE = """
        {"domain": {"name": "Permit2", "chainId": 84532,
                    "verifyingContract": "0x000000000022D473030F116dDEE9F6B43aC78BA3"},
         "types": {
           "PermitDetails": [{"name": "token", "type": "address"}, {"name": "amount", "type": "uint160"},
                             {"name": "expiration", "type": "uint48"}, {"name": "nonce", "type": "uint48"}],
           "PermitSingle": [{"name": "details", "type": "PermitDetails"}, {"name": "spender", "type": "address"},
                            {"name": "sigDeadline", "type": "uint256"}]},
         "primaryType": "PermitSingle",
         "message": {"details": {"token": "0x4200000000000000000000000000000000000006", "amount": 1000000,
                                 "expiration": 1900000000, "nonce": 0},
                     "spender": "0x00000000000000000000000000000000000000bb", "sigDeadline": 1900000000}}
        """;

    @Mock
    private Web3j web3j;

    private final ObjectMapper mapper = new ObjectMapper();
    private Credentials credentials;
    private Web3jWalletSigner signer;

    @BeforeEach
    void setUp() {
        credentials = Credentials.create(PRIVATE_KEY);
        signer = new Web3jWalletSigner(web3j, credentials, mapper, Runnable::run, 10, 3);
    }

    @Test
    void testAccountIsCredentialAddress() {
        assertThat(signer.account()).isEqualTo(credentials.getAddress());
    }

    @Test
    void testDomainTypeDerivedFromPresentFields() throws Exception {
        ObjectNode completed = signer.withDomainType(mapper.readTree(PERMIT_SINGLE));

        JsonNode domainType = completed.path("types").path("EIP712Domain");
        assertThat(domainType).hasSize(3);
        assertThat(domainType.get(0).path("name").asText()).isEqualTo("name");
        assertThat(domainType.get(1).path("name").asText()).isEqualTo("chainId");
        assertThat(domainType.get(2).path("name").asText()).isEqualTo("verifyingContract");
    }

    @Test
    void testTypedDataSignatureRecoversSigner() throws Exception {
        JsonNode typedData = mapper.readTree(PERMIT_SINGLE);

        String signature = signer.sign(typedData);

        byte[] raw = Numeric.hexStringToByteArray(signature);
        assertThat(raw).hasSize(65);
        byte[] hash = new StructuredDataEncoder(mapper.writeValueAsString(signer.withDomainType(typedData)))
            .hashStructuredData();
        Sign.SignatureData parts = new Sign.SignatureData(raw[64],
            Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
        BigInteger publicKey = Sign.signedMessageHashToKey(hash, parts);
        assertThat(Numeric.prependHexPrefix(Keys.getAddress(publicKey))).isEqualTo(credentials.getAddress());
    }

    @Test
    void testApproveCalldata() {
        String data = Web3jWalletSigner.encodeApprove("0x000000000022D473030F116dDEE9F6B43aC78BA3", BigInteger.TEN);

        assertThat(data).startsWith("0x095ea7b3");
        assertThat(data).hasSize(2 + 8 + 128);
        assertThat(data).endsWith("000a");
    }

    @Test
    void testRejectionCode() {
        assertThat(WalletRejectedException.isRejectionCode(4001)).isTrue();
        assertThat(WalletRejectedException.isRejectionCode(-32000)).isFalse();
    }
}
