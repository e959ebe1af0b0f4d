package org.l5xst;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Optional;

import com.google.gson.*;

/**
 * Gson set up for IR dumps: pretty printed, with {@link Optional} fields written as their value or null.
 */
public final class JsonSupport {
    private JsonSupport() {}

    public static Gson gson() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .registerTypeHierarchyAdapter(Optional.class, new OptionalAdapter())
            .create();
    }

    static final class OptionalAdapter implements JsonSerializer<Optional<?>>, JsonDeserializer<Optional<?>> {
        @Override
        public Optional<?> deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context)
            throws JsonParseException {
            if (json == null || json.isJsonNull()) {
                return Optional.empty();
            }
            return Optional.ofNullable(context.deserialize(json, inner(typeOfT)));
        }

        @Override
        public JsonElement serialize(Optional<?> src, Type typeOfSrc, JsonSerializationContext context) {
            if (src.isEmpty()) {
                return JsonNull.INSTANCE;
            }
            return context.serialize(src.get(), inner(typeOfSrc));
        }

        // Raw Optional carries no element type; fall back to the runtime class.
        private static Type inner(Type type) {
            if (type instanceof ParameterizedType p) {
                return p.getActualTypeArguments()[0];
            }
            return Object.class;
        }
    }
}
