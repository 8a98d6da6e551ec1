package io.x402.schemes.svm;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/** Compact-u16 length prefix of the Solana wire format: 7 bits per byte, at most 3 bytes. */
final class ShortVec {

    static final int MAX = 0xffff;

    private ShortVec() {}

    static void write(ByteArrayOutputStream out, int value) {
        if (value < 0 || value > MAX) {
            throw new IllegalArgumentException("compact-u16 out of range: " + value);
        }
        int rest = value;
        while (true) {
            int b = rest & 0x7f;
            rest >>>= 7;
            if (rest == 0) {
                out.write(b);
                return;
            }
            out.write(b | 0x80);
        }
    }

    static int read(ByteBuffer in) {
        int value = 0;
        for (int i = 0; i < 3; i++) {
            int b = in.get() & 0xff;
            value |= (b & 0x7f) << (7 * i);
            if ((b & 0x80) == 0) {
                if (i > 0 && b == 0) {
                    throw new IllegalArgumentException("non-canonical compact-u16");
                }
                if (value > MAX) {
                    throw new IllegalArgumentException("compact-u16 out of range");
                }
                return value;
            }
        }
        throw new IllegalArgumentException("compact-u16 longer than 3 bytes");
    }
}
