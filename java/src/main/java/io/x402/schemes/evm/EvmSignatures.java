package io.x402.schemes.evm;

import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/** 65-byte r||s||v secp256k1 signatures over EIP-712 digests. */
final class EvmSignatures {

    private EvmSignatures() {}

    static String sign(byte[] digest, ECKeyPair keyPair) {
        Sign.SignatureData signature = Sign.signMessage(digest, keyPair, false);
        byte[] bytes = new byte[65];
        System.arraycopy(signature.getR(), 0, bytes, 0, 32);
        System.arraycopy(signature.getS(), 0, bytes, 32, 32);
        bytes[64] = signature.getV()[0];
        return Numeric.toHexString(bytes);
    }

    static Sign.SignatureData parse(String hex) {
        byte[] bytes = Numeric.hexStringToByteArray(hex);
        if (bytes.length != 65) {
            throw new IllegalArgumentException("signature must be 65 bytes, got " + bytes.length);
        }
        byte v = bytes[64];
        if (v < 27) {
            v += 27;
        }
        return new Sign.SignatureData(v, Arrays.copyOfRange(bytes, 0, 32), Arrays.copyOfRange(bytes, 32, 64));
    }

    /** Lower-case 0x address of the key that produced {@code signature} over {@code digest}. */
    static String recoverAddress(byte[] digest, Sign.SignatureData signature) throws SignatureException {
        BigInteger publicKey = Sign.signedMessageHashToKey(digest, signature);
        return Numeric.prependHexPrefix(Keys.getAddress(publicKey));
    }
}
