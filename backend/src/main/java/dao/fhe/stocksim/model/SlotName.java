package dao.fhe.stocksim.model;

/**
 * The four encrypted slots of a batch. Declaration order is the fixed order used for the
 * state commitment, for the oracle request and for decoding cleartexts.
 */
public enum SlotName {
    STOCK_PRICE,
    PLAYER_BALANCE,
    PLAYER_STOCK_HOLDING,
    NEWS_IMPACT
}
