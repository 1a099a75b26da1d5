package io.rndr.core.ledger;

import java.math.BigInteger;

/** Entry points a token ledger uses to credit an escrow ledger after moving tokens to it. */
public interface EscrowReceiver {

    String address();

    void fundUser(String caller, String userId, BigInteger amount);

    /** Legacy job-keyed variant of {@link #fundUser}. */
    void fundJob(String caller, String jobId, BigInteger amount);
}
