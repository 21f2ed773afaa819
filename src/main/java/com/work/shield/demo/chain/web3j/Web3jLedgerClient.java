package com.work.shield.demo.chain.web3j;

import com.work.shield.core.chain.CommitmentEvent;
import com.work.shield.core.chain.LedgerClient;
import com.work.shield.core.chain.LedgerSubmission;
import com.work.shield.core.exception.RelayerFailureException;
import com.work.shield.core.model.EncryptedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes12;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 基于 Web3j 的账本客户端：
 * - eth_getLogs 读取 Deposited / OutputCommitted 事件
 * - eth_call 读取 currentRoot()
 * - 配置了中继私钥时，签名并发送 submitTx 后等待回执
 */
public class Web3jLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClient.class);

    static final Event DEPOSITED = new Event("Deposited", Arrays.<TypeReference<?>>asList(
            new TypeReference<Address>(true) {
            },
            new TypeReference<Uint256>() {
            },
            new TypeReference<Bytes32>() {
            },
            new TypeReference<Uint256>() {
            }));

    static final Event OUTPUT_COMMITTED = new Event("OutputCommitted", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {
            },
            new TypeReference<Uint8>() {
            },
            new TypeReference<DynamicBytes>() {
            },
            new TypeReference<Bytes12>() {
            },
            new TypeReference<DynamicBytes>() {
            },
            new TypeReference<Uint256>() {
            }));

    private final Web3j web3j;
    private final String contractAddress;
    private final RawTransactionManager transactionManager;
    private final PollingTransactionReceiptProcessor receiptProcessor;
    private final BigInteger gasLimit;

    /**
     * 只读客户端，submitTransaction 不可用。
     */
    public Web3jLedgerClient(Web3j web3j, String contractAddress) {
        this(web3j, contractAddress, null, 0L, 0L, Duration.ofSeconds(2), 1);
    }

    public Web3jLedgerClient(Web3j web3j, String contractAddress, String relayerPrivateKey, long chainId,
                             long gasLimit, Duration receiptPollInterval, int receiptPollAttempts) {
        this.web3j = web3j;
        this.contractAddress = contractAddress;
        if (relayerPrivateKey == null || relayerPrivateKey.trim().isEmpty()) {
            this.transactionManager = null;
            this.receiptProcessor = null;
        } else {
            this.transactionManager = new RawTransactionManager(web3j, Credentials.create(relayerPrivateKey), chainId);
            this.receiptProcessor = new PollingTransactionReceiptProcessor(web3j, receiptPollInterval.toMillis(),
                    receiptPollAttempts);
        }
        this.gasLimit = BigInteger.valueOf(gasLimit);
    }

    @Override
    public String submitTransaction(LedgerSubmission submission) {
        if (transactionManager == null) {
            throw new UnsupportedOperationException("未配置 ledger.relayer-private-key，Web3jLedgerClient 只提供读能力");
        }
        List<EncryptedOutputStruct> outputs = new ArrayList<>();
        for (EncryptedOutput output : submission.getEncryptedOutputs()) {
            outputs.add(EncryptedOutputStruct.of(output));
        }
        Function function = new Function("submitTx",
                Arrays.<Type>asList(
                        new DynamicArray<>(EncryptedOutputStruct.class, outputs),
                        new DynamicBytes(submission.getProof()),
                        new DynamicBytes(submission.getPublicValues())),
                Collections.<TypeReference<?>>emptyList());
        String data = FunctionEncoder.encode(function);

        try {
            BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
            EthSendTransaction sent = transactionManager.sendTransaction(gasPrice, gasLimit, contractAddress, data,
                    BigInteger.ZERO);
            if (sent.hasError()) {
                throw new RelayerFailureException("submitTx rejected: " + sent.getError().getMessage());
            }
            String txHash = sent.getTransactionHash();
            TransactionReceipt receipt = receiptProcessor.waitForTransactionReceipt(txHash);
            if (!receipt.isStatusOK()) {
                throw new RelayerFailureException("submitTx reverted txHash=" + txHash + " status=" + receipt.getStatus());
            }
            log.info("submitTx confirmed txHash={} block={} outputs={}", txHash, receipt.getBlockNumber(),
                    outputs.size());
            return txHash;
        } catch (IOException | TransactionException e) {
            log.warn("Web3j submitTx failed contract={} err={}", contractAddress, e.getMessage());
            throw new RelayerFailureException("submitTx failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<CommitmentEvent> readCommitmentLog(long fromBlock) {
        List<CommitmentEvent> events = new ArrayList<>();
        for (Log entry : getLogs(DEPOSITED, fromBlock)) {
            List<Type> values = FunctionReturnDecoder.decode(entry.getData(), DEPOSITED.getNonIndexedParameters());
            byte[] commitment = (byte[]) values.get(1).getValue();
            long leafIndex = ((BigInteger) values.get(2).getValue()).longValue();
            events.add(new CommitmentEvent(CommitmentEvent.Kind.DEPOSIT, commitment, leafIndex,
                    entry.getBlockNumber().longValue(), entry.getLogIndex().longValue()));
        }
        for (Log entry : getLogs(OUTPUT_COMMITTED, fromBlock)) {
            byte[] commitment = Numeric.hexStringToByteArray(entry.getTopics().get(1));
            List<Type> values = FunctionReturnDecoder.decode(entry.getData(),
                    OUTPUT_COMMITTED.getNonIndexedParameters());
            long leafIndex = ((BigInteger) values.get(4).getValue()).longValue();
            events.add(new CommitmentEvent(CommitmentEvent.Kind.OUTPUT, commitment, leafIndex,
                    entry.getBlockNumber().longValue(), entry.getLogIndex().longValue()));
        }
        events.sort(Comparator.comparingLong(CommitmentEvent::getBlockNumber)
                .thenComparingLong(CommitmentEvent::getLogIndex));
        return events;
    }

    @Override
    public byte[] currentRoot() {
        Function function = new Function("currentRoot", Collections.<Type>emptyList(),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bytes32>() {
                }));
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contractAddress, FunctionEncoder.encode(function)),
                    DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new RelayerFailureException("currentRoot call failed: " + resp.getError().getMessage());
            }
            List<Type> values = FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters());
            if (values.isEmpty()) {
                throw new RelayerFailureException("currentRoot returned no data");
            }
            return (byte[]) values.get(0).getValue();
        } catch (IOException e) {
            log.warn("Web3j currentRoot failed contract={} err={}", contractAddress, e.getMessage());
            throw new RelayerFailureException("currentRoot failed: " + e.getMessage(), e);
        }
    }

    private List<Log> getLogs(Event event, long fromBlock) {
        EthFilter filter = new EthFilter(DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameterName.LATEST, contractAddress);
        filter.addSingleTopic(EventEncoder.encode(event));
        try {
            EthLog resp = web3j.ethGetLogs(filter).send();
            if (resp.hasError()) {
                throw new RelayerFailureException("eth_getLogs failed: " + resp.getError().getMessage());
            }
            List<Log> logs = new ArrayList<>();
            for (EthLog.LogResult result : resp.getLogs()) {
                logs.add((Log) result.get());
            }
            log.debug("eth_getLogs event={} fromBlock={} count={}", event.getName(), fromBlock, logs.size());
            return logs;
        } catch (IOException e) {
            log.warn("Web3j getLogs failed event={} err={}", event.getName(), e.getMessage());
            throw new RelayerFailureException("eth_getLogs failed: " + e.getMessage(), e);
        }
    }
}
