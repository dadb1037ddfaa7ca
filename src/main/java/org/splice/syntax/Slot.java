package org.splice.syntax;

import java.util.Objects;

/** One named field of a {@link Variant}. */
public final class Slot {

    public final String name;
    public final SlotType type;
    public final int index;

    private Slot(String name, SlotType type, int index) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.index = index;
    }

    static Slot[] table(Object... nameTypePairs) {
        Slot[] slots = new Slot[nameTypePairs.length / 2];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new Slot((String) nameTypePairs[2 * i], (SlotType) nameTypePairs[2 * i + 1], i);
        }
        return slots;
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
