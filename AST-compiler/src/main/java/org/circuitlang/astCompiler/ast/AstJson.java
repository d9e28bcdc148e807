package org.circuitlang.astCompiler.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.compiler.errors.InternalCompilerError;
import org.circuitlang.util.Utilities;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** JSON rendering of whole trees. */
public class AstJson {
    private AstJson() {}

    public static String toJsonString(AstNode node) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        try {
            return mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(node.toJson(mapper));
        } catch (JsonProcessingException ex) {
            throw new InternalCompilerError("Could not serialize " + node.getClass().getSimpleName(), node);
        }
    }

    /** Returns a copy of the JSON tree with every property named 'key' removed, at any depth. */
    public static JsonNode removeKey(JsonNode json, String key) {
        JsonNode result = json.deepCopy();
        removeKeyInPlace(result, key);
        return result;
    }

    /** Compare trees modulo location. */
    public static JsonNode withoutSpans(AstNode node) {
        return removeKey(node.toJson(), "span");
    }

    private static void removeKeyInPlace(JsonNode json, String key) {
        if (json.isObject()) {
            ObjectNode object = (ObjectNode) json;
            object.remove(key);
            List<String> fields = new ArrayList<>();
            Iterator<String> it = object.fieldNames();
            it.forEachRemaining(fields::add);
            for (String field: fields)
                removeKeyInPlace(object.get(field), key);
        } else if (json.isArray()) {
            for (JsonNode element: json)
                removeKeyInPlace(element, key);
        }
    }
}
