package dao.fhe.stocksim.oracle;

import dao.fhe.stocksim.util.CryptoUtil;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Decryption proof format: one or more 65-byte signatures (r || s || v) concatenated, each an
 * Ethereum-prefixed ECDSA signature over
 * <pre>
 * keccak256(uint256(requestId) || h0 || h1 || h2 || h3 || keccak256(cleartexts) || contractIdentity)
 * </pre>
 */
public final class DecryptionProofs {
    private DecryptionProofs() {}

    public static final int SIGNATURE_SIZE = 65;

    public static byte[] digest(long requestId, List<byte[]> handles, byte[] cleartexts, byte[] contractIdentity) {
        List<byte[]> parts = new ArrayList<>();
        parts.add(CryptoUtil.uint256(requestId));
        for (byte[] h : handles) {
            if (h.length != CryptoUtil.WORD_SIZE) {
                throw new IllegalArgumentException("Handle must be 32 bytes, got " + h.length);
            }
            parts.add(h);
        }
        parts.add(CryptoUtil.keccak256(cleartexts));
        parts.add(contractIdentity);
        return CryptoUtil.keccak256(CryptoUtil.concat(parts.toArray(new byte[0][])));
    }

    /**
     * Sign {@code digest} with every key, in order.
     */
    public static byte[] sign(byte[] digest, List<ECKeyPair> signers) {
        byte[] out = new byte[SIGNATURE_SIZE * signers.size()];
        int pos = 0;
        for (ECKeyPair keyPair : signers) {
            Sign.SignatureData sig = Sign.signPrefixedMessage(digest, keyPair);
            System.arraycopy(sig.getR(), 0, out, pos, 32);
            System.arraycopy(sig.getS(), 0, out, pos + 32, 32);
            out[pos + 64] = sig.getV()[0];
            pos += SIGNATURE_SIZE;
        }
        return out;
    }

    /**
     * Addresses (0x-prefixed, lower case) that produced the signatures in {@code proof}.
     */
    public static List<String> recoverSigners(byte[] digest, byte[] proof) throws SignatureException {
        if (proof == null || proof.length == 0 || proof.length % SIGNATURE_SIZE != 0) {
            throw new SignatureException("Proof length must be a non-zero multiple of " + SIGNATURE_SIZE);
        }
        List<String> signers = new ArrayList<>();
        for (int pos = 0; pos < proof.length; pos += SIGNATURE_SIZE) {
            byte[] r = Arrays.copyOfRange(proof, pos, pos + 32);
            byte[] s = Arrays.copyOfRange(proof, pos + 32, pos + 64);
            byte v = proof[pos + 64];
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, new Sign.SignatureData(v, r, s));
            signers.add(addressOf(publicKey));
        }
        return signers;
    }

    public static String addressOf(BigInteger publicKey) {
        return "0x" + Keys.getAddress(publicKey).toLowerCase(Locale.ROOT);
    }

    public static String addressOf(ECKeyPair keyPair) {
        return addressOf(keyPair.getPublicKey());
    }
}
