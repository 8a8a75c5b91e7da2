package work.goscript.kernel.core;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.goscript.kernel.convert.ValueAssigner;
import work.goscript.kernel.runtime.ExecutionContext;
import work.goscript.kernel.runtime.Registry;
import work.goscript.kernel.shared.KernelPanicException;
import work.goscript.kernel.shared.PanicCode;
import work.goscript.kernel.types.BasicType;
import work.goscript.kernel.types.MapType;
import work.goscript.kernel.value.MapValue;
import work.goscript.kernel.value.RuntimeValue;

/**
 * Map container operations: make, nil, index read, comma-ok read, store, delete, len and the nil check.
 * Maps are references, so a map value taken from state is updated in place.
 */
public final class MapPrimitives {
    private static final Logger LOG = LoggerFactory.getLogger(MapPrimitives.class);

    private MapPrimitives() {}

    public static Registry register(Registry registry) {
        registry.register("gos://map/make@1", MapPrimitives::make);
        registry.register("gos://map/nil@1", MapPrimitives::nil);
        registry.register("gos://map/get@1", MapPrimitives::get);
        registry.register("gos://map/lookup@1", MapPrimitives::lookup);
        registry.register("gos://map/set@1", MapPrimitives::set);
        registry.register("gos://map/delete@1", MapPrimitives::delete);
        registry.register("gos://map/len@1", MapPrimitives::len);
        registry.register("gos://map/is_nil@1", MapPrimitives::isNil);
        return registry;
    }

    private static Object make(ExecutionContext ctx, Map<String, Object> input) {
        var type = PrimitiveInputs.type(ctx, input, MapType.class);
        if (!input.containsKey("size")) {
            return PrimitiveInputs.result(MapValue.make(type));
        }
        var size = PrimitiveInputs.value(ctx, input, "size", BasicType.INT);
        return PrimitiveInputs.result(MapValue.make(type, sizeHint(size)));
    }

    private static Object nil(ExecutionContext ctx, Map<String, Object> input) {
        return PrimitiveInputs.result(MapValue.nil(PrimitiveInputs.type(ctx, input, MapType.class)));
    }

    private static Object get(ExecutionContext ctx, Map<String, Object> input) {
        var map = PrimitiveInputs.map(input);
        var key = PrimitiveInputs.value(ctx, input, "key", map.mapType().key());
        return PrimitiveInputs.result(map.get(key));
    }

    private static Object lookup(ExecutionContext ctx, Map<String, Object> input) {
        var map = PrimitiveInputs.map(input);
        var key = PrimitiveInputs.value(ctx, input, "key", map.mapType().key());
        var found = map.lookup(key);
        var result = new LinkedHashMap<String, Object>();
        result.put("value", found.value());
        result.put("found", new RuntimeValue.BoolValue(found.found()));
        return result;
    }

    private static Object set(ExecutionContext ctx, Map<String, Object> input) {
        var map = PrimitiveInputs.map(input);
        var key = PrimitiveInputs.value(ctx, input, "key", map.mapType().key());
        var value = PrimitiveInputs.value(ctx, input, "value", map.mapType().value());
        map.set(key, value);
        LOG.trace("stored entry in {}; len={}", map.mapType().typeName(), map.len());
        return PrimitiveInputs.result(map);
    }

    private static Object delete(ExecutionContext ctx, Map<String, Object> input) {
        var map = PrimitiveInputs.map(input);
        var key = PrimitiveInputs.value(ctx, input, "key", map.mapType().key());
        boolean removed = map.delete(key);
        var result = new LinkedHashMap<String, Object>();
        result.put("value", map);
        result.put("deleted", new RuntimeValue.BoolValue(removed));
        return result;
    }

    private static Object len(ExecutionContext ctx, Map<String, Object> input) {
        return PrimitiveInputs.result(RuntimeValue.IntValue.of(PrimitiveInputs.map(input).len()));
    }

    private static Object isNil(ExecutionContext ctx, Map<String, Object> input) {
        return PrimitiveInputs.result(new RuntimeValue.BoolValue(PrimitiveInputs.map(input).isNil()));
    }

    private static long sizeHint(RuntimeValue size) {
        if (size instanceof RuntimeValue.UntypedConst constant) {
            size = ValueAssigner.assign(constant, BasicType.INT);
        }
        if (size instanceof RuntimeValue.IntValue n) {
            if (!n.basic().signed() && n.bits() < 0) {
                throw new KernelPanicException(PanicCode.INDEX_OUT_OF_RANGE, "makemap: size out of range");
            }
            return n.bits();
        }
        throw KernelPanicException.of(PanicCode.TYPE_MISMATCH, "non-integer size argument in make(%s)", size.kind());
    }
}
