package dao.fhe.stocksim.controller;

public final class ApiHeaders {
    private ApiHeaders() {}

    /** Calling account; session and wallet handling live outside this service. */
    public static final String ACCOUNT = "X-Account";
}
