package dao.fhe.stocksim.model;

public enum ActionCategory {
    SUBMISSION,
    DECRYPTION_REQUEST
}
