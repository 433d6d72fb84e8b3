package dao.fhe.stocksim.service;

import dao.fhe.stocksim.config.SimulationProperties;
import dao.fhe.stocksim.model.CiphertextSlot;
import dao.fhe.stocksim.model.EncryptedSlotSet;
import dao.fhe.stocksim.model.SlotName;
import dao.fhe.stocksim.util.CryptoUtil;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class StateCommitmentService {

    private final byte[] contractIdentity;

    public StateCommitmentService(SimulationProperties props) {
        if (props.getContractIdentity() == null || props.getContractIdentity().isBlank()) {
            throw new IllegalStateException("simulation.contract-identity must be configured");
        }
        this.contractIdentity = CryptoUtil.fromHexExact(props.getContractIdentity().trim(), CryptoUtil.ADDRESS_SIZE);
    }

    /**
     * State commitment over one batch:
     * keccak256(stockPrice || playerBalance || playerStockHolding || newsImpact || contractIdentity)
     * with each handle as a 32-byte word (unset = zero word) and the identity as 20 bytes.
     */
    public byte[] commit(List<CiphertextSlot> ordered) {
        if (ordered == null || ordered.size() != SlotName.values().length) {
            throw new IllegalArgumentException("Commitment needs exactly " + SlotName.values().length + " slots");
        }
        byte[] packed = new byte[ordered.size() * CryptoUtil.WORD_SIZE + CryptoUtil.ADDRESS_SIZE];
        int pos = 0;
        for (CiphertextSlot slot : ordered) {
            System.arraycopy(slot.toWord(), 0, packed, pos, CryptoUtil.WORD_SIZE);
            pos += CryptoUtil.WORD_SIZE;
        }
        System.arraycopy(contractIdentity, 0, packed, pos, CryptoUtil.ADDRESS_SIZE);
        return CryptoUtil.keccak256(packed);
    }

    public String commitHex(EncryptedSlotSet slots) {
        return CryptoUtil.toHex0x(commit(slots.ordered())).toLowerCase(Locale.ROOT);
    }

    public byte[] getContractIdentity() {
        return contractIdentity.clone();
    }
}
