package work.goscript.kernel.value;

/**
 * Identity token of a storage slot: the issuing arena plus the slot's position in it. Pointers compare by
 * token, never by the slot's contents.
 */
public record SlotId(long arena, long id) {
    public SlotId {
        if (arena <= 0) {
            throw new IllegalArgumentException("arena id must be positive: " + arena);
        }
        if (id <= 0) {
            throw new IllegalArgumentException("slot id must be positive: " + id);
        }
    }

    @Override
    public String toString() {
        return "0x" + Long.toHexString(arena) + String.format("%08x", id);
    }
}
