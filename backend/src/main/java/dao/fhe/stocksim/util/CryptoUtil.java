package dao.fhe.stocksim.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Byte and hex helpers shared by the commitment, the cleartext decoder and the proof code.
 *
 * Handles are 32 bytes, accounts and the contract identity are 20-byte EVM-style addresses.
 * Everything is rendered as lower-case 0x-prefixed hex.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static final int WORD_SIZE = 32;
    public static final int ADDRESS_SIZE = 20;

    private static final Pattern HEX = Pattern.compile("^(0x|0X)?[0-9a-fA-F]*$");

    public static String toHex0x(byte[] bytes) {
        return Numeric.toHexString(bytes);
    }

    public static String cleanHex(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    public static boolean isHex(String value) {
        return value != null && HEX.matcher(value.trim()).matches() && cleanHex(value.trim()).length() % 2 == 0;
    }

    /**
     * Decode arbitrary-length hex (with or without 0x).
     */
    public static byte[] fromHex(String value) {
        if (!isHex(value)) {
            throw new IllegalArgumentException("Not a hex string: " + value);
        }
        return Numeric.hexStringToByteArray(cleanHex(value.trim()));
    }

    public static byte[] fromHexExact(String value, int size) {
        byte[] bytes = fromHex(value);
        if (bytes.length != size) {
            throw new IllegalArgumentException("Expected " + size + " bytes, got " + bytes.length + ": " + value);
        }
        return bytes;
    }

    /**
     * Canonical form of an account or contract address: 0x + 40 lower-case hex chars.
     */
    public static String normalizeAddress(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Address is null");
        }
        return toHex0x(fromHexExact(address, ADDRESS_SIZE)).toLowerCase(Locale.ROOT);
    }

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    /**
     * Left-padded big-endian uint256 encoding, as Solidity lays out a word.
     */
    public static byte[] uint256(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Value does not fit uint256: " + value);
        }
        return Numeric.toBytesPadded(value, WORD_SIZE);
    }

    public static byte[] uint256(long value) {
        return uint256(BigInteger.valueOf(value));
    }

    public static boolean isAllZero(byte[] bytes) {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }
}
