package io.rndr.core.node;

import io.rndr.core.escrow.EscrowLedger;
import io.rndr.core.ledger.LedgerRuntime;
import io.rndr.core.protocol.AbiCodec;
import io.rndr.core.token.TokenLedger;

import java.math.BigInteger;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Sets up freshly deployed ledgers:
 * - token and escrow initialized with the configured owner
 * - token linked to the escrow address
 * - genesis allocations bridged in through the child chain manager, so they
 *   count as minted supply
 */
public final class GenesisBuilder {
    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /**
     * Initialize everything in one unit if the token has not been initialized yet.
     * Idempotent: returns false and changes nothing on an existing state.
     */
    public static boolean initIfNeeded(LedgerRuntime runtime, TokenLedger token, EscrowLedger escrow,
                                       TokenLedger legacyToken, NodeConfig config) {
        if (token.isInitialized()) {
            return false;
        }
        runtime.execute("genesis", () -> {
            if (legacyToken != null) {
                legacyToken.initialize(config.owner, config.bridgeManager,
                        config.tokenName + " (legacy)", config.tokenSymbol);
            }
            token.initialize(config.owner, config.bridgeManager, config.tokenName, config.tokenSymbol,
                    legacyToken == null ? null : legacyToken.address());
            escrow.initialize(config.owner, token.address());
            token.setEscrowContractAddress(config.owner, escrow.address());
            seedBalances(token, config.bridgeManager, config.genesisAllocations);
        });
        LOG.info("Genesis applied: " + token.symbol() + " supply " + token.totalSupply());
        return true;
    }

    /** Mint initial balances through the bridge entry point. */
    public static void seedBalances(TokenLedger token, String bridgeManager, Map<String, BigInteger> allocations) {
        if (allocations == null || allocations.isEmpty()) return;
        for (Map.Entry<String, BigInteger> e : allocations.entrySet()) {
            BigInteger amount = e.getValue() == null ? BigInteger.ZERO : e.getValue();
            token.deposit(bridgeManager, e.getKey(), AbiCodec.encodeUint256(amount));
        }
    }
}
