package io.rndr.core.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigInteger;

/**
 * Notification emitted by a ledger. External systems correlate user and job ids
 * to escrow balances through these, so every mutating path emits one.
 * {@code contract} is the address of the emitting ledger.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LedgerEvent.Transfer.class, name = "Transfer"),
        @JsonSubTypes.Type(value = LedgerEvent.Approval.class, name = "Approval"),
        @JsonSubTypes.Type(value = LedgerEvent.Escrow.class, name = "Escrow"),
        @JsonSubTypes.Type(value = LedgerEvent.UserBalanceUpdate.class, name = "UserBalanceUpdate"),
        @JsonSubTypes.Type(value = LedgerEvent.JobBalanceUpdate.class, name = "JobBalanceUpdate"),
        @JsonSubTypes.Type(value = LedgerEvent.AddressUpdate.class, name = "AddressUpdate"),
        @JsonSubTypes.Type(value = LedgerEvent.OwnershipTransferred.class, name = "OwnershipTransferred"),
        @JsonSubTypes.Type(value = LedgerEvent.TokenMigration.class, name = "TokenMigration")
})
public interface LedgerEvent {

    String contract();

    record Transfer(String contract, String from, String to, BigInteger value) implements LedgerEvent {}

    record Approval(String contract, String owner, String spender, BigInteger value) implements LedgerEvent {}

    record Escrow(String contract, String from, String userId, BigInteger amount) implements LedgerEvent {}

    record UserBalanceUpdate(String contract, String userId, BigInteger balance) implements LedgerEvent {}

    record JobBalanceUpdate(String contract, String jobId, BigInteger balance) implements LedgerEvent {}

    /**
     * A privileged configuration slot changed. {@code slot} is one of
     * {@code escrowContractAddress}, {@code childChainManager}, {@code legacyTokenAddress},
     * {@code disbursalAddress} or {@code renderTokenAddress}.
     */
    record AddressUpdate(String contract, String slot, String address) implements LedgerEvent {}

    record OwnershipTransferred(String contract, String previousOwner, String newOwner) implements LedgerEvent {}

    record TokenMigration(String contract, String account, BigInteger amount) implements LedgerEvent {}
}
