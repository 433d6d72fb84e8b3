package dao.fhe.stocksim.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class AccountRequest {

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$")
    private String account;
}
