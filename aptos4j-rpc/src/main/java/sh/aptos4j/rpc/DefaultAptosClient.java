// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;

import sh.aptos4j.core.DebugLogger;
import sh.aptos4j.core.LogFormatter;
import sh.aptos4j.core.auth.Signer;
import sh.aptos4j.core.builder.AptosTxBuilderException;
import sh.aptos4j.core.builder.TransactionDefaults;
import sh.aptos4j.core.builder.TransactionRequest;
import sh.aptos4j.core.error.ChainMismatchException;
import sh.aptos4j.core.tx.RawTransaction;
import sh.aptos4j.core.tx.SignedTransaction;
import sh.aptos4j.core.tx.TransactionSigning;
import sh.aptos4j.core.tx.ViewPayload;
import sh.aptos4j.core.types.AccountAddress;

/**
 * Default implementation of {@link AptosClient} over an {@link AptosTransport}.
 *
 * <p>
 * This class implements the transaction lifecycle:
 * <ol>
 * <li>Checks the node's chain id against the configured one, once</li>
 * <li>Fetches the sequence number if the request has none</li>
 * <li>Optionally asks the node for a gas unit price estimate</li>
 * <li>Signs with {@link TransactionSigning} in the envelope the request calls for</li>
 * <li>Submits the BCS bytes and optionally waits for the result</li>
 * </ol>
 *
 * <p>
 * <strong>Chain ID Enforcement:</strong> the node's chain id is fetched on first use and cached
 * in an {@link AtomicReference}. With an expected chain id of {@code 0} any chain is accepted.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe as long as the transport is. Callers
 * submitting concurrently from one account should manage sequence numbers themselves.
 *
 * @since 0.1.0
 */
public final class DefaultAptosClient implements AptosClient {

    private final AptosTransport transport;
    private final Signer signer;
    private final int expectedChainId;
    private final TransactionDefaults defaults;
    private final Clock clock;
    private final boolean estimateGasPrice;
    private final AtomicReference<Integer> cachedChainId = new AtomicReference<>();

    private DefaultAptosClient(final Builder builder) {
        this.transport = Objects.requireNonNull(builder.transport, "transport cannot be null");
        this.signer = Objects.requireNonNull(builder.signer, "signer cannot be null");
        this.expectedChainId = builder.expectedChainId;
        this.defaults = Objects.requireNonNull(builder.defaults, "defaults cannot be null");
        this.clock = Objects.requireNonNull(builder.clock, "clock cannot be null");
        this.estimateGasPrice = builder.estimateGasPrice;
    }

    public static Builder builder(final AptosTransport transport, final Signer signer) {
        return new Builder(transport, signer);
    }

    public static DefaultAptosClient create(final AptosTransport transport, final Signer signer) {
        return builder(transport, signer).build();
    }

    @Override
    public int chainId() {
        final Integer cached = cachedChainId.get();
        if (cached != null) {
            return cached;
        }
        final int actual = transport.getChainId();
        if (expectedChainId > 0 && actual != expectedChainId) {
            throw new ChainMismatchException(expectedChainId, actual);
        }
        cachedChainId.compareAndSet(null, actual);
        return actual;
    }

    @Override
    public RawTransaction prepare(final TransactionRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        if (!request.sender().equals(signer.address())) {
            throw new AptosTxBuilderException(
                    "request sender " + request.sender() + " is not the client signer " + signer.address());
        }
        final int chainId = chainId();
        if (request.chainId() != null && request.chainId() != chainId) {
            throw new ChainMismatchException(request.chainId(), chainId);
        }

        TransactionRequest filled = request.withChainId(chainId);
        if (filled.sequenceNumber() == null) {
            filled = filled.withSequenceNumber(transport.getSequenceNumber(filled.sender()));
        }
        if (filled.gasUnitPrice() == null && estimateGasPrice) {
            filled = filled.withGasUnitPrice(transport.estimateGasPrice());
        }

        final RawTransaction raw = filled.toRawTransaction(defaults, clock);
        DebugLogger.logTx(LogFormatter.formatTxBuild(raw.sender().toString(), raw.sequenceNumber(),
                raw.chainId(), raw.maxGasAmount(), raw.gasUnitPrice()));
        return raw;
    }

    @Override
    public List<TransactionResult> simulate(
            final TransactionRequest request,
            final List<? extends Signer> secondary,
            final @Nullable Signer feePayer) {
        checkParticipants(request, secondary, feePayer, true);
        final RawTransaction raw = prepare(request);
        final SignedTransaction simulation;
        if (request.isFeePayer()) {
            simulation = TransactionSigning.simulateFeePayer(raw, signer, secondary, feePayer);
        } else if (request.isMultiAgent()) {
            simulation = TransactionSigning.simulateMultiAgent(raw, signer, secondary);
        } else {
            simulation = TransactionSigning.simulate(raw, signer);
        }
        final List<TransactionResult> results = transport.simulateTransaction(simulation.toBcs());
        DebugLogger.logTx(LogFormatter.formatTxSimulate(raw.sender().toString(), results.size()));
        return results;
    }

    @Override
    public String signAndSubmit(
            final TransactionRequest request,
            final List<? extends Signer> secondary,
            final @Nullable Signer feePayer) {
        checkParticipants(request, secondary, feePayer, false);
        final RawTransaction raw = prepare(request);
        final SignedTransaction signed;
        if (request.isFeePayer()) {
            signed = TransactionSigning.signFeePayer(raw, signer, secondary, feePayer);
        } else if (request.isMultiAgent()) {
            signed = TransactionSigning.signMultiAgent(raw, signer, secondary);
        } else {
            signed = TransactionSigning.sign(raw, signer);
        }
        return submit(signed);
    }

    @Override
    public TransactionResult signAndSubmitAndWait(final TransactionRequest request) {
        return waitForTransaction(signAndSubmit(request));
    }

    @Override
    public String submit(final SignedTransaction signed) {
        Objects.requireNonNull(signed, "signed cannot be null");
        final long start = System.nanoTime();
        final String hash = transport.submitSignedTransaction(signed.toBcs());
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logTx(LogFormatter.formatTxSubmit(hash, durationMicros));
        return hash;
    }

    @Override
    public TransactionResult waitForTransaction(final String hash) {
        final TransactionResult result = transport.waitForTransaction(hash);
        DebugLogger.logTx(LogFormatter.formatTxResult(hash, result.success(), String.valueOf(result.vmStatus())));
        return result;
    }

    @Override
    public List<Object> view(final ViewPayload payload, final @Nullable Long ledgerVersion) {
        Objects.requireNonNull(payload, "payload cannot be null");
        return transport.view(payload.toBcs(), ledgerVersion);
    }

    private static void checkParticipants(
            final TransactionRequest request,
            final List<? extends Signer> secondary,
            final @Nullable Signer feePayer,
            final boolean simulation) {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(secondary, "secondary cannot be null");
        final List<AccountAddress> addresses = new ArrayList<>(secondary.size());
        for (Signer s : secondary) {
            addresses.add(s.address());
        }
        if (!addresses.equals(request.secondarySigners())) {
            throw new AptosTxBuilderException(
                    "secondary signers " + addresses + " do not match request " + request.secondarySigners());
        }
        if (feePayer != null && !request.isFeePayer()) {
            throw new AptosTxBuilderException("fee payer signer given for a request without a fee payer");
        }
        if (feePayer == null && request.isFeePayer() && !simulation) {
            throw new AptosTxBuilderException("fee payer request needs a fee payer signer");
        }
        if (feePayer != null && !AccountAddress.ZERO.equals(request.feePayer())
                && !feePayer.address().equals(request.feePayer())) {
            throw new AptosTxBuilderException(
                    "fee payer signer " + feePayer.address() + " is not the request fee payer " + request.feePayer());
        }
    }

    public static final class Builder {
        private final AptosTransport transport;
        private final Signer signer;
        private int expectedChainId;
        private TransactionDefaults defaults = TransactionDefaults.defaults();
        private Clock clock = Clock.systemUTC();
        private boolean estimateGasPrice;

        private Builder(final AptosTransport transport, final Signer signer) {
            this.transport = transport;
            this.signer = signer;
        }

        /**
         * @param expectedChainId the chain id the node must report, or {@code 0} for any
         * @return this builder
         */
        public Builder expectedChainId(final int expectedChainId) {
            if (expectedChainId < 0 || expectedChainId > 255) {
                throw new IllegalArgumentException("expectedChainId must be in [0, 255], got: " + expectedChainId);
            }
            this.expectedChainId = expectedChainId;
            return this;
        }

        public Builder defaults(final TransactionDefaults defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @param estimateGasPrice whether to ask the node for a gas unit price when the request has none
         * @return this builder
         */
        public Builder estimateGasPrice(final boolean estimateGasPrice) {
            this.estimateGasPrice = estimateGasPrice;
            return this;
        }

        public DefaultAptosClient build() {
            return new DefaultAptosClient(this);
        }
    }
}
