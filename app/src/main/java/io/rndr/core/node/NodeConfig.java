package io.rndr.core.node;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/** Simple config holder for a local ledger node. */
public final class NodeConfig {
    public final String tokenAddress;
    public final String escrowAddress;
    public final String owner;
    public final String bridgeManager;
    public final String legacyTokenAddress;   // null: no migration source
    public final String tokenName;
    public final String tokenSymbol;
    public final Map<String, BigInteger> genesisAllocations;
    public final boolean prevalidateDisbursals;

    public NodeConfig(String tokenAddress, String escrowAddress, String owner, String bridgeManager,
                      String legacyTokenAddress, String tokenName, String tokenSymbol,
                      Map<String, BigInteger> genesisAllocations, boolean prevalidateDisbursals) {
        this.tokenAddress = tokenAddress;
        this.escrowAddress = escrowAddress;
        this.owner = owner;
        this.bridgeManager = bridgeManager;
        this.legacyTokenAddress = legacyTokenAddress;
        this.tokenName = tokenName;
        this.tokenSymbol = tokenSymbol;
        this.genesisAllocations = genesisAllocations;
        this.prevalidateDisbursals = prevalidateDisbursals;
    }

    public static NodeConfig defaultLocal() {
        Map<String, BigInteger> alloc = new LinkedHashMap<>();
        alloc.put("alice123456", BigInteger.valueOf(1_000_000L));
        alloc.put("bob654321", BigInteger.valueOf(500_000L));
        return new NodeConfig(
                "rndr-token",
                "rndr-escrow",
                "rndr-owner",
                "child-chain-manager",
                null,
                "Render Token",
                "RNDR",
                alloc,
                false         // disbursals pay out step by step
        );
    }

    public NodeConfig withOwner(String owner, String bridgeManager) {
        return new NodeConfig(tokenAddress, escrowAddress, owner, bridgeManager, legacyTokenAddress,
                tokenName, tokenSymbol, genesisAllocations, prevalidateDisbursals);
    }

    public NodeConfig withLegacyTokenAddress(String legacyTokenAddress) {
        return new NodeConfig(tokenAddress, escrowAddress, owner, bridgeManager, legacyTokenAddress,
                tokenName, tokenSymbol, genesisAllocations, prevalidateDisbursals);
    }

    public NodeConfig withGenesisAllocations(Map<String, BigInteger> genesisAllocations) {
        return new NodeConfig(tokenAddress, escrowAddress, owner, bridgeManager, legacyTokenAddress,
                tokenName, tokenSymbol, new LinkedHashMap<>(genesisAllocations), prevalidateDisbursals);
    }

    public NodeConfig withPrevalidateDisbursals(boolean prevalidateDisbursals) {
        return new NodeConfig(tokenAddress, escrowAddress, owner, bridgeManager, legacyTokenAddress,
                tokenName, tokenSymbol, genesisAllocations, prevalidateDisbursals);
    }
}
