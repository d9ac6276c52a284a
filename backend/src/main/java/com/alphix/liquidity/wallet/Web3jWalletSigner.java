// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.wallet;

import com.alphix.liquidity.client.CollaboratorException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.crypto.StructuredDataEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link WalletSigner} backed by a local key and a JSON-RPC node.
 */
public class Web3jWalletSigner implements WalletSigner {

    private static final Logger logger = LoggerFactory.getLogger(Web3jWalletSigner.class);

    private static final String[][] DOMAIN_FIELDS = {
            {"name", "string"},
            {"version", "string"},
            {"chainId", "uint256"},
            {"verifyingContract", "address"},
            {"salt", "bytes32"}
    };

    private final Web3j web3j;
    private final Credentials credentials;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final long pollIntervalMs;
    private final int maxPollAttempts;

    public Web3jWalletSigner(final Web3j web3j,
                             final Credentials credentials,
                             final ObjectMapper mapper,
                             final Executor executor,
                             final long pollIntervalMs,
                             final int maxPollAttempts) {
        this.web3j = web3j;
        this.credentials = credentials;
        this.mapper = mapper;
        this.executor = executor;
        this.pollIntervalMs = pollIntervalMs;
        this.maxPollAttempts = maxPollAttempts;
    }

    @Override
    public String account() {
        return credentials.getAddress();
    }

    @Override
    public CompletableFuture<Long> chainId() {
        return web3j.ethChainId().sendAsync().thenApply(response -> {
            checkError(response);
            return response.getChainId().longValue();
        });
    }

    @Override
    public CompletableFuture<String> approve(final String tokenAddress, final String spender, final BigInteger amount) {
        return sendTransaction(tokenAddress, encodeApprove(spender, amount), BigInteger.ZERO);
    }

    @Override
    public CompletableFuture<String> signTypedData(final JsonNode typedData) {
        return CompletableFuture.supplyAsync(() -> sign(typedData), executor);
    }

    @Override
    public CompletableFuture<String> sendTransaction(final String to, final String data, final BigInteger value) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                EthChainId chain = web3j.ethChainId().send();
                checkError(chain);
                RawTransactionManager txManager =
                        new RawTransactionManager(web3j, credentials, chain.getChainId().longValue());
                EthGasPrice gasPrice = web3j.ethGasPrice().send();
                checkError(gasPrice);
                BigInteger gasLimit = estimateGas(to, data, value);
                EthSendTransaction sent = txManager.sendTransaction(gasPrice.getGasPrice(), gasLimit, to, data, value);
                checkError(sent);
                logger.info("Sent transaction {} to {}", sent.getTransactionHash(), to);
                return sent.getTransactionHash();
            } catch (IOException e) {
                throw new UncheckedIOException("RPC failure sending transaction to " + to, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<ReceiptStatus> waitForReceipt(final String txHash) {
        return CompletableFuture.supplyAsync(() -> {
            PollingTransactionReceiptProcessor processor =
                    new PollingTransactionReceiptProcessor(web3j, pollIntervalMs, maxPollAttempts);
            try {
                TransactionReceipt receipt = processor.waitForTransactionReceipt(txHash);
                ReceiptStatus status = receipt.isStatusOK() ? ReceiptStatus.CONFIRMED : ReceiptStatus.REVERTED;
                logger.info("Receipt for {}: {} (block {})", txHash, status, receipt.getBlockNumber());
                return status;
            } catch (IOException e) {
                throw new UncheckedIOException("RPC failure polling receipt " + txHash, e);
            } catch (TransactionException e) {
                throw new CollaboratorException("No receipt for " + txHash + ": " + e.getMessage(), e);
            }
        }, executor);
    }

    static String encodeApprove(final String spender, final BigInteger amount) {
        Function approve = new Function("approve",
                Arrays.asList(new Address(spender), new Uint256(amount)),
                Collections.emptyList());
        return FunctionEncoder.encode(approve);
    }

    /**
     * EIP-712 signature as 0x-prefixed r || s || v.
     */
    String sign(final JsonNode typedData) {
        try {
            StructuredDataEncoder encoder = new StructuredDataEncoder(mapper.writeValueAsString(withDomainType(typedData)));
            Sign.SignatureData signature = Sign.signMessage(encoder.hashStructuredData(), credentials.getEcKeyPair(), false);
            byte[] packed = new byte[65];
            System.arraycopy(signature.getR(), 0, packed, 0, 32);
            System.arraycopy(signature.getS(), 0, packed, 32, 32);
            packed[64] = signature.getV()[0];
            return Numeric.toHexString(packed);
        } catch (IOException e) {
            throw new CollaboratorException("Typed data could not be encoded: " + e.getMessage(), e);
        }
    }

    /**
     * Payloads may omit the EIP712Domain type; derive it from the domain fields actually present.
     */
    ObjectNode withDomainType(final JsonNode typedData) {
        ObjectNode copy = typedData.deepCopy();
        JsonNode types = copy.path("types");
        if (types.isObject() && !types.has("EIP712Domain")) {
            ArrayNode domainType = mapper.createArrayNode();
            JsonNode domain = copy.path("domain");
            for (String[] field : DOMAIN_FIELDS) {
                if (domain.has(field[0])) {
                    domainType.addObject().put("name", field[0]).put("type", field[1]);
                }
            }
            ((ObjectNode) types).set("EIP712Domain", domainType);
        }
        return copy;
    }

    private BigInteger estimateGas(final String to, final String data, final BigInteger value) throws IOException {
        Transaction call = Transaction.createFunctionCallTransaction(
                credentials.getAddress(), null, null, null, to, value, data);
        EthEstimateGas estimate = web3j.ethEstimateGas(call).send();
        checkError(estimate);
        // 20% headroom over the node's estimate
        return estimate.getAmountUsed().multiply(BigInteger.valueOf(12)).divide(BigInteger.TEN);
    }

    private static void checkError(final Response<?> response) {
        if (!response.hasError()) {
            return;
        }
        Response.Error error = response.getError();
        if (WalletRejectedException.isRejectionCode(error.getCode())) {
            throw new WalletRejectedException(error.getMessage());
        }
        throw new CollaboratorException(error.getMessage(), error.getCode(), null);
    }
}
