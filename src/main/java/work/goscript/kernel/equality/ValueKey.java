package work.goscript.kernel.equality;

import work.goscript.kernel.value.RuntimeValue;

/**
 * Adapts a runtime value to {@link java.util.Map} keys using {@link ValueEquality}.
 */
public final class ValueKey {
    private final RuntimeValue value;
    private final int hash;

    private ValueKey(RuntimeValue value, int hash) {
        this.value = value;
        this.hash = hash;
    }

    /**
     * Wraps {@code value}, failing immediately when it is not a hashable key kind.
     */
    public static ValueKey of(RuntimeValue value) {
        return new ValueKey(value, ValueEquality.hash(value));
    }

    public RuntimeValue value() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ValueKey that && hash == that.hash && ValueEquality.equal(value, that.value);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "ValueKey[" + value + "]";
    }
}
