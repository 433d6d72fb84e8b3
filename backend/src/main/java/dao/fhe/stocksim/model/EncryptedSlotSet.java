package dao.fhe.stocksim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The four slots of one batch. Writes replace the previous handle of a slot.
 */
public class EncryptedSlotSet {

    private final long batchId;
    private final EnumMap<SlotName, CiphertextSlot> slots = new EnumMap<>(SlotName.class);

    public EncryptedSlotSet(long batchId) {
        this.batchId = batchId;
        for (SlotName name : SlotName.values()) {
            slots.put(name, CiphertextSlot.unset());
        }
    }

    public long getBatchId() {
        return batchId;
    }

    public CiphertextSlot get(SlotName name) {
        return slots.get(name);
    }

    public void put(SlotName name, CiphertextSlot slot) {
        slots.put(name, slot);
    }

    /**
     * Slots in {@link SlotName} order, unset ones included.
     */
    public List<CiphertextSlot> ordered() {
        return new ArrayList<>(slots.values());
    }

    public Map<SlotName, CiphertextSlot> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(slots));
    }

    public EncryptedSlotSet copy() {
        EncryptedSlotSet c = new EncryptedSlotSet(batchId);
        c.slots.putAll(slots);
        return c;
    }
}
