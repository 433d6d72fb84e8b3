package dao.fhe.stocksim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    /**
     * Addresses of the KMS signers whose signatures make up a decryption proof.
     */
    private List<String> signers = new ArrayList<>();

    /**
     * Minimum number of distinct configured signers a proof must carry.
     */
    private int threshold = 1;

    /**
     * Callback identifier handed to the oracle with each request.
     */
    private String callbackSelector = "onDecryptionFulfilled";

    /**
     * First request id issued by the oracle sequence.
     */
    private long firstRequestId = 1;
}
