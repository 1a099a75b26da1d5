package io.rndr.core.ledger;

import java.math.BigInteger;

/**
 * What one ledger may ask of a token ledger it only knows by address.
 * {@code caller} is the identity on whose behalf the call is made.
 */
public interface FungibleToken {

    String address();

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    boolean transfer(String caller, String to, BigInteger amount);

    boolean transferFrom(String caller, String from, String to, BigInteger amount);
}
