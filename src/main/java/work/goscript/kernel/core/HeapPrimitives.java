package work.goscript.kernel.core;

import java.util.Map;
import work.goscript.kernel.runtime.ExecutionContext;
import work.goscript.kernel.runtime.Registry;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Pointer slots: {@code new(T)} or {@code &T{...}}, dereference and store through a pointer.
 */
public final class HeapPrimitives {
    private HeapPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register("gos://heap/new@1", HeapPrimitives::allocate);
        registry.register("gos://heap/load@1", HeapPrimitives::load);
        registry.register("gos://heap/store@1", HeapPrimitives::store);
        return registry;
    }

    private static Object allocate(ExecutionContext ctx, Map<String, Object> input) {
        var type = PrimitiveInputs.type(ctx, input);
        if (!input.containsKey("value")) {
            return PrimitiveInputs.result(ctx.arena().newZero(type));
        }
        var initial = PrimitiveInputs.value(ctx, input, "value", type);
        return PrimitiveInputs.result(ctx.arena().allocate(type, initial));
    }

    private static Object load(ExecutionContext ctx, Map<String, Object> input) {
        var pointer = PrimitiveInputs.runtime(input, "pointer", RuntimeValue.PointerValue.class);
        return PrimitiveInputs.result(ctx.arena().load(pointer));
    }

    private static Object store(ExecutionContext ctx, Map<String, Object> input) {
        var pointer = PrimitiveInputs.runtime(input, "pointer", RuntimeValue.PointerValue.class);
        var value = PrimitiveInputs.value(ctx, input, "value", pointer.pointerType().element());
        ctx.arena().store(pointer, value);
        return PrimitiveInputs.result(pointer);
    }
}
