package dao.fhe.stocksim.model;

import dao.fhe.stocksim.util.CryptoUtil;

import java.util.Locale;

/**
 * Content of one encrypted slot: either {@link Kind#UNSET} or a 32-byte ciphertext handle.
 */
public record CiphertextSlot(Kind kind, String handleHex) {

    public enum Kind { UNSET, CIPHERTEXT }

    private static final CiphertextSlot UNSET = new CiphertextSlot(Kind.UNSET, null);

    public CiphertextSlot {
        if (kind == Kind.CIPHERTEXT) {
            byte[] raw = CryptoUtil.fromHexExact(handleHex, CryptoUtil.WORD_SIZE);
            if (CryptoUtil.isAllZero(raw)) {
                throw new IllegalArgumentException("Zero handle is reserved for unset slots");
            }
            handleHex = CryptoUtil.toHex0x(raw).toLowerCase(Locale.ROOT);
        } else if (handleHex != null) {
            throw new IllegalArgumentException("Unset slot cannot carry a handle");
        }
    }

    public static CiphertextSlot unset() {
        return UNSET;
    }

    public static CiphertextSlot of(String handleHex) {
        return new CiphertextSlot(Kind.CIPHERTEXT, handleHex);
    }

    public boolean isSet() {
        return kind == Kind.CIPHERTEXT;
    }

    /**
     * Word used for commitments and oracle requests; unset encodes as 32 zero bytes.
     */
    public byte[] toWord() {
        if (!isSet()) return new byte[CryptoUtil.WORD_SIZE];
        return CryptoUtil.fromHex(handleHex);
    }
}
