package dao.fhe.stocksim.oracle;

import java.util.List;

/**
 * A decryption waiting for the external relayer. Handles are 0x-prefixed hex in slot order.
 */
public record OracleRequest(
        long requestId,
        List<String> handles,
        String callbackSelector,
        long requestedAt // unix seconds
) {}
