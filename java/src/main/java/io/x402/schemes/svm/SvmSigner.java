package io.x402.schemes.svm;

import io.github.novacrypto.base58.Base58;
import io.x402.config.X402Config;
import io.x402.network.NetworkFamily;
import io.x402.signer.Signer;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.security.SecureRandom;
import java.util.Arrays;

/** Ed25519 keypair plus the RPC endpoint of its cluster. */
public final class SvmSigner implements Signer {

    private final Ed25519PrivateKeyParameters privateKey;
    private final SolanaPublicKey publicKey;
    private final SvmRpc rpc;

    public SvmSigner(Ed25519PrivateKeyParameters privateKey, SvmRpc rpc) {
        this.privateKey = privateKey;
        this.publicKey = new SolanaPublicKey(privateKey.generatePublicKey().getEncoded());
        this.rpc = rpc;
    }

    /**
     * @param secretKey base58 of the 64-byte keypair (seed then public key) or of a 32-byte seed
     */
    public static SvmSigner fromBase58(String secretKey, SvmRpc rpc) {
        byte[] bytes;
        try {
            bytes = Base58.base58Decode(secretKey);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("secret key is not base58", e);
        }
        if (bytes.length != 64 && bytes.length != 32) {
            throw new IllegalArgumentException("secret key must be 32 or 64 bytes, got " + bytes.length);
        }
        SvmSigner signer = new SvmSigner(new Ed25519PrivateKeyParameters(Arrays.copyOf(bytes, 32), 0), rpc);
        if (bytes.length == 64
                && !signer.publicKey.equals(new SolanaPublicKey(Arrays.copyOfRange(bytes, 32, 64)))) {
            throw new IllegalArgumentException("keypair public half does not match its seed");
        }
        return signer;
    }

    public static SvmSigner create(String network, String secretKey, X402Config config) {
        return fromBase58(secretKey, new JsonRpcSvmClient(config.rpcUrl(network)));
    }

    public static SvmSigner generate(SvmRpc rpc) {
        return new SvmSigner(new Ed25519PrivateKeyParameters(new SecureRandom()), rpc);
    }

    @Override
    public NetworkFamily family() {
        return NetworkFamily.SVM;
    }

    @Override
    public String address() {
        return publicKey.toBase58();
    }

    public SolanaPublicKey publicKey() {
        return publicKey;
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    public SvmRpc getRpc() {
        return rpc;
    }
}
