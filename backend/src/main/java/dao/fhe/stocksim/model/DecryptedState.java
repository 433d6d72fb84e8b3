package dao.fhe.stocksim.model;

import java.math.BigInteger;

/**
 * Plaintext values published by a successful decryption, in slot order.
 */
public record DecryptedState(
        BigInteger stockPrice,
        BigInteger playerBalance,
        BigInteger playerStockHolding,
        BigInteger newsImpact
) {}
