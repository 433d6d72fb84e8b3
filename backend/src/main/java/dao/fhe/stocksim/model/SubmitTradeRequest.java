package dao.fhe.stocksim.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class SubmitTradeRequest {

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$")
    private String balanceHandle;

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$")
    private String holdingHandle;
}
