package work.goscript.kernel.literal;

import java.util.Objects;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Explicit key of a composite literal element: a struct field name, an array index or a map key.
 */
public sealed interface LiteralKey permits LiteralKey.Field, LiteralKey.Index, LiteralKey.MapKey {
    String describe();

    record Field(String name) implements LiteralKey {
        public Field {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String describe() {
            return "field " + name;
        }
    }

    record Index(long index) implements LiteralKey {
        @Override
        public String describe() {
            return "index " + index;
        }
    }

    record MapKey(RuntimeValue key) implements LiteralKey {
        public MapKey {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String describe() {
            return "key " + key.kind();
        }
    }
}
