package io.x402.schemes;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    void parsesLargeIntegersExactly() {
        assertEquals(new BigInteger("115792089237316195423570985008687907853269984665640564039457584007913129639935"),
                Amounts.parse("115792089237316195423570985008687907853269984665640564039457584007913129639935"));
        assertEquals(9_007_199_254_740_993L, Amounts.parseInt64("9007199254740993"));
    }

    @Test
    void rejectsNonIntegers() {
        for (String bad : new String[]{"", "-1", "1.5", "1e6", " 1", "0x10", null}) {
            assertThrows(IllegalArgumentException.class, () -> Amounts.parse(bad), String.valueOf(bad));
        }
    }

    @Test
    void enforcesLedgerRanges() {
        assertEquals(Long.MAX_VALUE, Amounts.parseInt64("9223372036854775807"));
        assertThrows(IllegalArgumentException.class, () -> Amounts.parseInt64("9223372036854775808"));

        assertEquals(-1L, Amounts.parseUint64("18446744073709551615"));
        assertThrows(IllegalArgumentException.class, () -> Amounts.parseUint64("18446744073709551616"));
    }
}
