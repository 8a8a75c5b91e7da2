package work.goscript.kernel.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.equality.ValueKey;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.GosType;
import work.goscript.kernel.types.MapType;

/**
 * Associative container keyed by runtime values. An uninitialized map reads as empty and rejects writes;
 * {@link #make(MapType)} is the only way to obtain an initialized one.
 */
public final class MapValue implements RuntimeValue {
    private static final int MAX_PRESIZE = 1 << 16;

    private final MapType mapType;
    private final LinkedHashMap<ValueKey, Entry> table;

    private MapValue(MapType mapType, LinkedHashMap<ValueKey, Entry> table) {
        this.mapType = Objects.requireNonNull(mapType, "mapType");
        this.table = table;
    }

    public static MapValue nil(MapType type) {
        return new MapValue(type, null);
    }

    public static MapValue make(MapType type) {
        return new MapValue(type, new LinkedHashMap<>());
    }

    public static MapValue make(MapType type, long sizeHint) {
        if (sizeHint < 0) {
            throw new KernelPanicException(PanicCode.INDEX_OUT_OF_RANGE, "makemap: size out of range");
        }
        return new MapValue(type, new LinkedHashMap<>((int) Math.min(sizeHint, MAX_PRESIZE)));
    }

    public MapType mapType() {
        return mapType;
    }

    public MapState state() {
        if (table == null) {
            return MapState.UNINITIALIZED;
        }
        return table.isEmpty() ? MapState.EMPTY : MapState.POPULATED;
    }

    public boolean isNil() {
        return table == null;
    }

    public int len() {
        return table == null ? 0 : table.size();
    }

    /**
     * Returns the value stored for {@code key}, or the zero value of the value type when the key is absent.
     */
    public RuntimeValue get(RuntimeValue key) {
        return lookup(key).value();
    }

    public Lookup lookup(RuntimeValue key) {
        var normalized = keyOf(key);
        var entry = table == null ? null : table.get(normalized);
        if (entry == null) {
            return new Lookup(mapType.value().zeroValue(), false);
        }
        return new Lookup(entry.value().copyValue(), true);
    }

    public void set(RuntimeValue key, RuntimeValue value) {
        var normalized = keyOf(key);
        if (table == null) {
            throw new KernelPanicException(PanicCode.NIL_MAP_WRITE, "assignment to entry in nil map");
        }
        var stored = ValueAssigner.assign(value, mapType.value());
        table.put(normalized, new Entry(normalized.value(), stored));
    }

    /**
     * Removes {@code key}. Deleting from an uninitialized map or deleting an absent key does nothing.
     */
    public boolean delete(RuntimeValue key) {
        var normalized = keyOf(key);
        if (table == null) {
            return false;
        }
        return table.remove(normalized) != null;
    }

    /**
     * Snapshot of the current entries, used for range iteration.
     */
    public List<Entry> entries() {
        if (table == null) {
            return List.of();
        }
        var snapshot = new ArrayList<Entry>(table.size());
        for (Entry entry : table.values()) {
            snapshot.add(new Entry(entry.key().copyValue(), entry.value().copyValue()));
        }
        return snapshot;
    }

    @Override
    public String kind() {
        return "map";
    }

    @Override
    public GosType type() {
        return mapType;
    }

    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }

    private ValueKey keyOf(RuntimeValue key) {
        return ValueKey.of(ValueAssigner.assign(Objects.requireNonNull(key, "key"), mapType.key()));
    }

    public enum MapState {
        UNINITIALIZED,
        EMPTY,
        POPULATED
    }

    public record Lookup(RuntimeValue value, boolean found) {}

    public record Entry(RuntimeValue key, RuntimeValue value) {}
}
