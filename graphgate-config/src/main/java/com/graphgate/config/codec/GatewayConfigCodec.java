package com.graphgate.config.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphgate.config.AbsoluteUrl;
import com.graphgate.config.GatewayConfiguration;
import com.graphgate.config.GraphQLConfig;
import com.graphgate.config.RootSchema;
import com.graphgate.config.ServerConfig;
import com.graphgate.config.schema.Arg;
import com.graphgate.config.schema.Field;
import com.graphgate.config.step.ConstantStep;
import com.graphgate.config.step.HttpMethod;
import com.graphgate.config.step.HttpStep;
import com.graphgate.config.step.ObjPathStep;
import com.graphgate.config.step.Step;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON encoding and decoding of the gateway configuration.
 * <p>
 * Wire names differ from the model: {@code typeOf} is {@code "type"}, {@code list} is {@code "isList"},
 * {@code required} is {@code "isRequired"} and the server base URL is {@code "baseURL"}. A step is an
 * object with a single tag key: {@code "http"} (object payload), {@code "const"} (the literal value
 * itself) or {@code "objectPath"} (the path map itself).
 * <p>
 * Encoding omits absent values and {@code false} modifiers and writes map keys in sorted order.
 * Decoding rejects duplicate object keys, ignores unknown keys, treats {@code null} like a missing
 * key (except for a constant's value) and reports failures as {@link ConfigDecodeException} with the
 * JSON path of the bad value.
 */
public final class GatewayConfigCodec {

    static final String TAG_HTTP = "http";
    static final String TAG_CONST = "const";
    static final String TAG_OBJECT_PATH = "objectPath";

    private static final String ROOT = "$";

    // Duplicate type, field or argument names are rejected instead of keeping the last one.
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private GatewayConfigCodec() {
    }

    /**
     * Parses and decodes a configuration document.
     *
     * @param json JSON text (e.g. file contents)
     * @return the decoded configuration
     * @throws ConfigDecodeException when the text is not JSON or does not describe a configuration
     */
    public static GatewayConfiguration fromJson(String json) throws ConfigDecodeException {
        if (json == null) {
            throw new ConfigDecodeException(ROOT, "no JSON content");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigDecodeException(ROOT, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        return decode(root);
    }

    /** Serializes the configuration to compact JSON. */
    public static String toJson(GatewayConfiguration config) {
        try {
            return MAPPER.writeValueAsString(encode(config));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes the configuration to indented JSON. */
    public static String toJsonPretty(GatewayConfiguration config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(encode(config));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    // --- encode ---

    public static ObjectNode encode(GatewayConfiguration config) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("version", config.getVersion());
        node.set("server", encodeServer(config.getServer()));
        node.set("graphQL", encodeGraphQL(config.getGraphQL()));
        return node;
    }

    public static ObjectNode encodeServer(ServerConfig server) {
        ObjectNode node = MAPPER.createObjectNode();
        if (server.getBaseUrl() != null) {
            node.put("baseURL", server.getBaseUrl().toString());
        }
        return node;
    }

    public static ObjectNode encodeGraphQL(GraphQLConfig graphQL) {
        ObjectNode node = MAPPER.createObjectNode();
        ObjectNode schema = node.putObject("schema");
        RootSchema root = graphQL.getSchema();
        if (root.getQuery() != null) schema.put("query", root.getQuery());
        if (root.getMutation() != null) schema.put("mutation", root.getMutation());
        ObjectNode types = node.putObject("types");
        for (Map.Entry<String, Map<String, Field>> type : new TreeMap<>(graphQL.getTypes()).entrySet()) {
            ObjectNode fields = types.putObject(type.getKey());
            for (Map.Entry<String, Field> field : new TreeMap<>(type.getValue()).entrySet()) {
                fields.set(field.getKey(), encodeField(field.getValue()));
            }
        }
        return node;
    }

    public static ObjectNode encodeField(Field field) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", field.getTypeOf());
        if (field.isList()) node.put("isList", true);
        if (field.isRequired()) node.put("isRequired", true);
        if (field.getSteps() != null) {
            ArrayNode steps = node.putArray("steps");
            for (Step step : field.getSteps()) {
                steps.add(encodeStep(step));
            }
        }
        if (field.getArgs() != null) {
            ObjectNode args = node.putObject("args");
            for (Map.Entry<String, Arg> arg : new TreeMap<>(field.getArgs()).entrySet()) {
                args.set(arg.getKey(), encodeArg(arg.getValue()));
            }
        }
        return node;
    }

    public static ObjectNode encodeArg(Arg arg) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", arg.getTypeOf());
        if (arg.isList()) node.put("isList", true);
        if (arg.isRequired()) node.put("isRequired", true);
        return node;
    }

    public static ObjectNode encodeStep(Step step) {
        ObjectNode node = MAPPER.createObjectNode();
        if (step instanceof HttpStep http) {
            ObjectNode payload = node.putObject(TAG_HTTP);
            payload.put("path", http.path());
            if (http.method() != null) payload.put("method", http.method().name());
            if (http.input() != null) payload.set("input", http.input());
            if (http.output() != null) payload.set("output", http.output());
        } else if (step instanceof ConstantStep constant) {
            node.set(TAG_CONST, constant.json());
        } else if (step instanceof ObjPathStep objPath) {
            ObjectNode payload = node.putObject(TAG_OBJECT_PATH);
            for (Map.Entry<String, List<String>> e : new TreeMap<>(objPath.map()).entrySet()) {
                ArrayNode segments = payload.putArray(e.getKey());
                e.getValue().forEach(segments::add);
            }
        } else {
            throw new IllegalArgumentException("Unsupported step: " + step);
        }
        return node;
    }

    // --- decode ---

    public static GatewayConfiguration decode(JsonNode node) throws ConfigDecodeException {
        requireObject(node, ROOT);
        JsonNode version = optional(node, "version");
        JsonNode server = optional(node, "server");
        JsonNode graphQL = optional(node, "graphQL");
        return new GatewayConfiguration(
                version != null ? readInt(version, child(ROOT, "version")) : 0,
                server != null ? decodeServer(server, child(ROOT, "server")) : ServerConfig.empty(),
                graphQL != null ? decodeGraphQL(graphQL, child(ROOT, "graphQL")) : GraphQLConfig.empty());
    }

    public static ServerConfig decodeServer(JsonNode node) throws ConfigDecodeException {
        return decodeServer(node, ROOT);
    }

    public static Field decodeField(JsonNode node) throws ConfigDecodeException {
        return decodeField(node, ROOT);
    }

    public static Arg decodeArg(JsonNode node) throws ConfigDecodeException {
        return decodeArg(node, ROOT);
    }

    public static Step decodeStep(JsonNode node) throws ConfigDecodeException {
        return decodeStep(node, ROOT);
    }

    private static ServerConfig decodeServer(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        JsonNode baseUrl = optional(node, "baseURL");
        if (baseUrl == null) {
            return ServerConfig.empty();
        }
        String urlPath = child(path, "baseURL");
        String raw = readString(baseUrl, urlPath);
        try {
            return new ServerConfig(AbsoluteUrl.parse(raw));
        } catch (IllegalArgumentException e) {
            throw new ConfigDecodeException(urlPath, e.getMessage(), e);
        }
    }

    private static GraphQLConfig decodeGraphQL(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        RootSchema schema = RootSchema.empty();
        JsonNode schemaNode = optional(node, "schema");
        if (schemaNode != null) {
            String schemaPath = child(path, "schema");
            requireObject(schemaNode, schemaPath);
            JsonNode query = optional(schemaNode, "query");
            JsonNode mutation = optional(schemaNode, "mutation");
            schema = new RootSchema(
                    query != null ? readString(query, child(schemaPath, "query")) : null,
                    mutation != null ? readString(mutation, child(schemaPath, "mutation")) : null);
        }
        Map<String, Map<String, Field>> types = new LinkedHashMap<>();
        JsonNode typesNode = optional(node, "types");
        if (typesNode != null) {
            String typesPath = child(path, "types");
            requireObject(typesNode, typesPath);
            Iterator<Map.Entry<String, JsonNode>> it = typesNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> type = it.next();
                String typePath = child(typesPath, type.getKey());
                requireObject(type.getValue(), typePath);
                Map<String, Field> fields = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fieldIt = type.getValue().fields();
                while (fieldIt.hasNext()) {
                    Map.Entry<String, JsonNode> field = fieldIt.next();
                    fields.put(field.getKey(), decodeField(field.getValue(), child(typePath, field.getKey())));
                }
                types.put(type.getKey(), fields);
            }
        }
        return new GraphQLConfig(schema, types);
    }

    private static Field decodeField(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        String typeOf = readString(required(node, "type", path), child(path, "type"));
        boolean list = readFlag(node, "isList", path);
        boolean required = readFlag(node, "isRequired", path);

        List<Step> steps = null;
        JsonNode stepsNode = optional(node, "steps");
        if (stepsNode != null) {
            String stepsPath = child(path, "steps");
            if (!stepsNode.isArray()) {
                throw new ConfigDecodeException(stepsPath, "expected array, got " + describe(stepsNode));
            }
            steps = new ArrayList<>(stepsNode.size());
            for (int i = 0; i < stepsNode.size(); i++) {
                steps.add(decodeStep(stepsNode.get(i), index(stepsPath, i)));
            }
        }

        Map<String, Arg> args = null;
        JsonNode argsNode = optional(node, "args");
        if (argsNode != null) {
            String argsPath = child(path, "args");
            requireObject(argsNode, argsPath);
            args = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = argsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> arg = it.next();
                args.put(arg.getKey(), decodeArg(arg.getValue(), child(argsPath, arg.getKey())));
            }
        }
        return new Field(typeOf, list, required, steps, args);
    }

    private static Arg decodeArg(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        String typeOf = readString(required(node, "type", path), child(path, "type"));
        return new Arg(typeOf, readFlag(node, "isList", path), readFlag(node, "isRequired", path));
    }

    private static Step decodeStep(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        if (node.size() != 1) {
            throw new ConfigDecodeException(path, "expected exactly one of " + TAG_HTTP + ", " + TAG_CONST + ", "
                    + TAG_OBJECT_PATH + ", got " + node.size() + " keys");
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String tag = entry.getKey();
        JsonNode payload = entry.getValue();
        String payloadPath = child(path, tag);
        switch (tag) {
            case TAG_HTTP:
                return decodeHttp(payload, payloadPath);
            case TAG_CONST:
                return new ConstantStep(payload);
            case TAG_OBJECT_PATH:
                return decodeObjPath(payload, payloadPath);
            default:
                throw new ConfigDecodeException(path, "unknown step '" + tag + "', expected one of "
                        + TAG_HTTP + ", " + TAG_CONST + ", " + TAG_OBJECT_PATH);
        }
    }

    private static HttpStep decodeHttp(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        String stepPath = readString(required(node, "path", path), child(path, "path"));
        HttpMethod method = null;
        JsonNode methodNode = optional(node, "method");
        if (methodNode != null) {
            String methodPath = child(path, "method");
            String raw = readString(methodNode, methodPath);
            method = HttpMethod.fromValue(raw);
            if (method == null) {
                throw new ConfigDecodeException(methodPath, "unknown HTTP method '" + raw + "'");
            }
        }
        return new HttpStep(stepPath, method, optional(node, "input"), optional(node, "output"));
    }

    private static ObjPathStep decodeObjPath(JsonNode node, String path) throws ConfigDecodeException {
        requireObject(node, path);
        Map<String, List<String>> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String entryPath = child(path, e.getKey());
            JsonNode segments = e.getValue();
            if (segments == null || !segments.isArray()) {
                throw new ConfigDecodeException(entryPath, "expected array, got " + describe(segments));
            }
            List<String> values = new ArrayList<>(segments.size());
            for (int i = 0; i < segments.size(); i++) {
                values.add(readString(segments.get(i), index(entryPath, i)));
            }
            map.put(e.getKey(), values);
        }
        return new ObjPathStep(map);
    }

    // --- helpers ---

    /** Value under {@code key}, or null when the key is missing or holds JSON null. */
    private static JsonNode optional(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value;
    }

    private static JsonNode required(JsonNode node, String key, String path) throws ConfigDecodeException {
        JsonNode value = optional(node, key);
        if (value == null) {
            throw new ConfigDecodeException(child(path, key), "missing required value");
        }
        return value;
    }

    private static void requireObject(JsonNode node, String path) throws ConfigDecodeException {
        if (node == null || !node.isObject()) {
            throw new ConfigDecodeException(path, "expected object, got " + describe(node));
        }
    }

    private static String readString(JsonNode node, String path) throws ConfigDecodeException {
        if (!node.isTextual()) {
            throw new ConfigDecodeException(path, "expected string, got " + describe(node));
        }
        return node.textValue();
    }

    private static int readInt(JsonNode node, String path) throws ConfigDecodeException {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ConfigDecodeException(path, "expected int, got " + describe(node));
        }
        return node.intValue();
    }

    private static boolean readFlag(JsonNode node, String key, String path) throws ConfigDecodeException {
        JsonNode value = optional(node, key);
        if (value == null) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new ConfigDecodeException(child(path, key), "expected boolean, got " + describe(value));
        }
        return value.booleanValue();
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) return "nothing";
        return node.getNodeType().name().toLowerCase();
    }

    private static String child(String path, String key) {
        return path + "." + key;
    }

    private static String index(String path, int i) {
        return path + "[" + i + "]";
    }
}
