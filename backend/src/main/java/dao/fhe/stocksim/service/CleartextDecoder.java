package dao.fhe.stocksim.service;

import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.model.DecryptedState;
import dao.fhe.stocksim.model.SlotName;
import dao.fhe.stocksim.util.CryptoUtil;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Decodes oracle cleartexts: four big-endian unsigned 32-byte words at offsets 0, 32, 64, 96,
 * in slot order. Bytes past the fourth word are ignored.
 */
public final class CleartextDecoder {
    private CleartextDecoder() {}

    public static final int ENCODED_SIZE = SlotName.values().length * CryptoUtil.WORD_SIZE;

    public static DecryptedState decode(byte[] cleartexts) {
        if (cleartexts == null || cleartexts.length < ENCODED_SIZE) {
            int len = cleartexts == null ? 0 : cleartexts.length;
            throw new SimulationException(ErrorKind.MALFORMED_CLEARTEXT,
                    "Cleartexts must be at least " + ENCODED_SIZE + " bytes, got " + len);
        }
        return new DecryptedState(
                word(cleartexts, SlotName.STOCK_PRICE),
                word(cleartexts, SlotName.PLAYER_BALANCE),
                word(cleartexts, SlotName.PLAYER_STOCK_HOLDING),
                word(cleartexts, SlotName.NEWS_IMPACT)
        );
    }

    private static BigInteger word(byte[] data, SlotName slot) {
        int offset = slot.ordinal() * CryptoUtil.WORD_SIZE;
        return new BigInteger(1, Arrays.copyOfRange(data, offset, offset + CryptoUtil.WORD_SIZE));
    }
}
