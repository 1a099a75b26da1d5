package io.rndr.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_ADDRESS_LEN = 128;         // sanity cap
    public static final int MIN_ADDRESS_LEN = 3;
    public static final int UINT256_BYTES = 32;
}
