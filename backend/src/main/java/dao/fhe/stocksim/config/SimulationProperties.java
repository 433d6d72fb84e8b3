package dao.fhe.stocksim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "simulation")
@Data
public class SimulationProperties {

    /**
     * Initial owner account (0x-prefixed 20-byte hex).
     * Example: 0x5B38Da6a701c568545dCfcB03FcB875f56beddC4
     */
    private String owner;

    /**
     * Accounts holding the news provider role at startup.
     */
    private List<String> providers = new ArrayList<>();

    /**
     * Minimum seconds between two actions of the same category by one account.
     */
    private long cooldownSeconds = 30;

    /**
     * Identity of this simulation instance, bound into every state commitment and every
     * decryption proof (0x-prefixed 20-byte hex).
     */
    private String contractIdentity;
}
