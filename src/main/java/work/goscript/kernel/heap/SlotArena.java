package work.goscript.kernel.heap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.PointerType;
import work.goscript.kernel.value.RuntimeValue;
import work.goscript.kernel.value.SlotId;

/**
 * Storage slots addressed by pointer values. Slot ids are handed out in allocation order and never reused,
 * and every arena tags its ids with its own number, so two pointers are equal exactly when they came from
 * the same allocation.
 */
public final class SlotArena {
    private static final Logger LOG = LoggerFactory.getLogger(SlotArena.class);

    private static final AtomicLong NEXT_ARENA = new AtomicLong();

    private final long arenaId = NEXT_ARENA.incrementAndGet();
    private final List<Slot> slots = new ArrayList<>();

    /**
     * Allocates a slot of type {@code type} holding {@code initial} and returns a pointer to it.
     */
    public RuntimeValue.PointerValue allocate(GosType type, RuntimeValue initial) {
        Objects.requireNonNull(type, "type");
        var stored = ValueAssigner.assign(initial, type);
        slots.add(new Slot(type, stored));
        var id = new SlotId(arenaId, slots.size());
        LOG.debug("allocated slot {} of type {}", id, type.typeName());
        return new RuntimeValue.PointerValue(new PointerType(type), id);
    }

    public RuntimeValue.PointerValue newZero(GosType type) {
        return allocate(type, type.zeroValue());
    }

    public RuntimeValue load(RuntimeValue.PointerValue pointer) {
        return slot(pointer).value.copyValue();
    }

    public void store(RuntimeValue.PointerValue pointer, RuntimeValue value) {
        var slot = slot(pointer);
        slot.value = ValueAssigner.assign(value, slot.type);
    }

    public int size() {
        return slots.size();
    }

    private Slot slot(RuntimeValue.PointerValue pointer) {
        Objects.requireNonNull(pointer, "pointer");
        if (pointer.isNil()) {
            throw new KernelPanicException(PanicCode.NIL_DEREFERENCE,
                "invalid memory address or nil pointer dereference");
        }
        var token = pointer.slot();
        long id = token.id();
        if (token.arena() != arenaId || id > slots.size()) {
            throw new IllegalStateException("pointer " + pointer.slot() + " does not belong to this arena");
        }
        return slots.get((int) (id - 1));
    }

    private static final class Slot {
        private final GosType type;
        private RuntimeValue value;

        private Slot(GosType type, RuntimeValue value) {
            this.type = type;
            this.value = value;
        }
    }
}
