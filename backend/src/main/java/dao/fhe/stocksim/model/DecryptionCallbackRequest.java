package dao.fhe.stocksim.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class DecryptionCallbackRequest {

    @NotNull
    private Long requestId;

    @NotBlank
    @Pattern(regexp = "^0x([0-9a-fA-F]{2})*$")
    private String cleartexts;      // abi-encoded uint256[4], hex

    @NotBlank
    @Pattern(regexp = "^0x([0-9a-fA-F]{2})*$")
    private String proof;           // concatenated 65-byte signatures, hex
}
