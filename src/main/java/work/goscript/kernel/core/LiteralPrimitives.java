package work.goscript.kernel.core;

import java.util.Map;
import work.goscript.kernel.runtime.ExecutionContext;
import work.goscript.kernel.runtime.Registry;
import work.goscript.kernel.runtime.ValueDecoder;
import work.goscript.kernel.types.ArrayType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.types.StructType;

/**
 * Composite literal construction: {@code T{...}} for struct, array and map types.
 */
public final class LiteralPrimitives {
    private LiteralPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register("gos://literal/struct@1", LiteralPrimitives::structLiteral);
        registry.register("gos://literal/array@1", LiteralPrimitives::arrayLiteral);
        registry.register("gos://literal/map@1", LiteralPrimitives::mapLiteral);
        return registry;
    }

    private static Object structLiteral(ExecutionContext ctx, Map<String, Object> input) {
        var type = PrimitiveInputs.type(ctx, input, StructType.class);
        var entries = ValueDecoder.entries(input.get("entries"), type, ctx);
        return PrimitiveInputs.result(ctx.literals().buildStruct(type, entries));
    }

    private static Object arrayLiteral(ExecutionContext ctx, Map<String, Object> input) {
        var type = PrimitiveInputs.type(ctx, input, ArrayType.class);
        var entries = ValueDecoder.entries(input.get("entries"), type, ctx);
        return PrimitiveInputs.result(ctx.literals().buildArray(type, entries));
    }

    private static Object mapLiteral(ExecutionContext ctx, Map<String, Object> input) {
        var type = PrimitiveInputs.type(ctx, input, MapType.class);
        var entries = ValueDecoder.entries(input.get("entries"), type, ctx);
        return PrimitiveInputs.result(ctx.literals().buildMap(type, entries));
    }
}
