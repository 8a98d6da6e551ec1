package io.x402.schemes.evm;

import io.x402.config.X402Config;
import io.x402.model.ExactEvmPayload;
import io.x402.schemes.LedgerRejectionException;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

/** {@link EvmLedger} over web3j JSON-RPC. The facilitator's key signs and pays for settlement. */
public final class Web3jEvmLedger implements EvmLedger {

    private final Web3j web3j;
    private final TransactionManager transactionManager;
    private final X402Config config;

    public Web3jEvmLedger(Web3j web3j, Credentials credentials, long chainId, X402Config config) {
        this.web3j = web3j;
        this.transactionManager = new RawTransactionManager(web3j, credentials, chainId);
        this.config = config;
    }

    @Override
    public BigInteger balanceOf(String asset, String owner) throws IOException {
        Function function = new Function("balanceOf",
                Arrays.<Type>asList(new Address(owner)),
                Arrays.<TypeReference<?>>asList(new TypeReference<Uint256>() {}));
        EthCall response = web3j.ethCall(
                Transaction.createEthCallTransaction(owner, asset, FunctionEncoder.encode(function)),
                DefaultBlockParameterName.LATEST).send();
        if (response.hasError()) {
            throw new IOException("balanceOf failed: " + response.getError().getMessage());
        }
        List<Type> values = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (values.isEmpty()) {
            throw new IOException("balanceOf returned no value for " + asset);
        }
        return (BigInteger) values.get(0).getValue();
    }

    @Override
    public EvmReceipt transferWithAuthorization(String asset, ExactEvmPayload payload, Duration timeout)
            throws IOException, TimeoutException {
        ExactEvmPayload.Authorization authorization = payload.authorization;
        byte[] signature = Numeric.hexStringToByteArray(payload.signature);
        int v = signature[64] & 0xff;
        if (v < 27) {
            v += 27;
        }
        Function function = new Function("transferWithAuthorization",
                Arrays.<Type>asList(
                        new Address(authorization.from),
                        new Address(authorization.to),
                        new Uint256(new BigInteger(authorization.value)),
                        new Uint256(new BigInteger(authorization.validAfter)),
                        new Uint256(new BigInteger(authorization.validBefore)),
                        new Bytes32(Numeric.hexStringToByteArray(authorization.nonce)),
                        new Uint8(BigInteger.valueOf(v)),
                        new Bytes32(Arrays.copyOfRange(signature, 0, 32)),
                        new Bytes32(Arrays.copyOfRange(signature, 32, 64))),
                Collections.emptyList());

        BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
        EthSendTransaction sent = transactionManager.sendTransaction(
                gasPrice, BigInteger.valueOf(config.getEvmGasLimit()), asset,
                FunctionEncoder.encode(function), BigInteger.ZERO);
        if (sent.hasError()) {
            throw new LedgerRejectionException(sent.getError().getMessage());
        }
        String hash = sent.getTransactionHash();

        long pollMillis = config.getPollInterval().toMillis();
        int attempts = (int) Math.max(1, timeout.toMillis() / Math.max(1, pollMillis));
        TransactionReceiptProcessor processor = new PollingTransactionReceiptProcessor(web3j, pollMillis, attempts);
        try {
            TransactionReceipt receipt = processor.waitForTransactionReceipt(hash);
            return new EvmReceipt(hash, receipt.isStatusOK());
        } catch (TransactionException e) {
            throw new TimeoutException("No receipt for " + hash + " within " + timeout);
        }
    }
}
