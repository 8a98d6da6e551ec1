package io.x402.schemes;

import java.math.BigInteger;
import java.util.regex.Pattern;

/** Parsing of amounts given as decimal strings in the smallest indivisible unit. */
public final class Amounts {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");
    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private Amounts() {}

    /**
     * @throws IllegalArgumentException if the value is not a non-negative integer
     */
    public static BigInteger parse(String amount) {
        if (amount == null || !DIGITS.matcher(amount).matches()) {
            throw new IllegalArgumentException("Amount must be a non-negative integer in the smallest unit: " + amount);
        }
        return new BigInteger(amount);
    }

    /**
     * Amount that fits a signed 64-bit ledger field (Hedera tinybars and token units).
     *
     * @throws IllegalArgumentException if the value is malformed or exceeds {@link Long#MAX_VALUE}
     */
    public static long parseInt64(String amount) {
        BigInteger value = parse(amount);
        if (value.bitLength() > 63) {
            throw new IllegalArgumentException("Amount exceeds the 64-bit ledger range: " + amount);
        }
        return value.longValue();
    }

    /**
     * Amount that fits an unsigned 64-bit ledger field (lamports and SPL token units),
     * returned as the same 64 bits in a {@code long}.
     *
     * @throws IllegalArgumentException if the value is malformed or exceeds 2^64 - 1
     */
    public static long parseUint64(String amount) {
        BigInteger value = parse(amount);
        if (value.compareTo(UINT64_MAX) > 0) {
            throw new IllegalArgumentException("Amount exceeds the unsigned 64-bit range: " + amount);
        }
        return value.longValue();
    }
}
