package io.rndr.core.protocol;

/**
 * Account identifiers are opaque strings. The null reference, a blank string and
 * any spelling of the all-zero hex address all count as the null address.
 */
public final class Address {
    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private Address(){}

    public static boolean isZero(String addr) {
        if (addr == null || addr.isBlank()) return true;
        String s = addr.trim();
        if (s.startsWith("0x") || s.startsWith("0X")) {
            s = s.substring(2);
        }
        if (s.isEmpty()) return true;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) != '0') return false;
        }
        return true;
    }

    public static boolean isValid(String addr) {
        if (isZero(addr)) return false;
        int len = addr.length();
        if (len < ProtocolLimits.MIN_ADDRESS_LEN || len > ProtocolLimits.MAX_ADDRESS_LEN) return false;
        for (int i = 0; i < len; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || c == '_' || c == '-' || c == ':';
            if (!ok) return false;
        }
        return true;
    }
}
