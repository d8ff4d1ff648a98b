package com.cgen.cli;

import com.cgen.ast.*;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * 把 JSON 描述的语法树还原为 AST 节点
 *
 * <p>每个节点是带 {@code "kind"} 成员的对象，例如
 * {@code {"kind":"decl","name":"x","type":{"kind":"u8"}}}。
 * 出错时抛出 {@link TreeFormatException}，携带出错元素的 JSON 路径。</p>
 */
public class TreeReader {

    private static final Logger LOG = Logger.getLogger(TreeReader.class.getName());

    /** 支持的节点种类 */
    public static final List<String> KINDS = Collections.unmodifiableList(Arrays.asList(
            "program",
            "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "f32", "f64",
            "type", "pointer", "array", "static",
            "literal", "decl", "assign", "block", "function", "return",
            "field", "struct", "deref", "ref", "local", "call"));

    private static final List<String> LITERAL_MEMBERS = Arrays.asList(
            "int", "long", "ulong", "float", "double", "char", "string");

    private static final BigInteger ULONG_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private int nodeCount;

    /**
     * 解析 JSON 文本并构造整棵树
     */
    public Node read(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new TreeFormatException("$", "malformed JSON: " + e.getMessage(), e);
        }
        nodeCount = 0;
        Node node = readNode(root, "$");
        LOG.fine("loaded tree: root=" + node.getVariantName() + ", nodes=" + nodeCount);
        return node;
    }

    private Node readNode(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new TreeFormatException(path, "expected a node object");
        }
        JsonObject obj = element.getAsJsonObject();
        String kind = requireString(obj, "kind", path);
        try {
            Node node = build(kind, obj, path);
            nodeCount++;
            return node;
        } catch (IncompleteNodeException | NodeOwnershipException | IllegalArgumentException e) {
            throw new TreeFormatException(path, e.getMessage(), e);
        }
    }

    private Node build(String kind, JsonObject obj, String path) {
        switch (kind) {
            case "program":
                return new Program(readList(obj, "declarations", path, true));
            case "i8":
            case "i16":
            case "i32":
            case "i64":
            case "u8":
            case "u16":
            case "u32":
            case "u64":
            case "f32":
            case "f64":
                return new Primitive(Primitive.Kind.valueOf(kind.toUpperCase(Locale.ROOT)));
            case "type":
                return Nodes.type(requireString(obj, "name", path));
            case "pointer":
                return Nodes.pointerOf(readChild(obj, "inner", path));
            case "array":
                return Nodes.arrayOf(readChild(obj, "inner", path), readSize(obj, path));
            case "static":
                return Nodes.staticOf(readChild(obj, "inner", path));
            case "literal":
                return readLiteral(obj, path);
            case "decl":
                return Nodes.declLocal(requireString(obj, "name", path), readChild(obj, "type", path));
            case "assign":
                return Nodes.assign(readChild(obj, "lhs", path), readChild(obj, "rhs", path));
            case "block":
                return new Block(readList(obj, "statements", path, false));
            case "function":
                return readFunction(obj, path);
            case "return":
                return Nodes.ret(readChild(obj, "value", path));
            case "field":
                return Nodes.field(readChild(obj, "owner", path), requireString(obj, "name", path));
            case "struct":
                return Nodes.declType(requireString(obj, "name", path), readList(obj, "fields", path, true));
            case "deref":
                return Nodes.deref(readChild(obj, "inner", path));
            case "ref":
                return Nodes.getRef(readChild(obj, "inner", path));
            case "local":
                return Nodes.local(requireString(obj, "name", path));
            case "call":
                return Nodes.call(readChild(obj, "callee", path), readList(obj, "arguments", path, false));
            default:
                throw new TreeFormatException(path + ".kind", "unknown node kind '" + kind + "'");
        }
    }

    private Function readFunction(JsonObject obj, String path) {
        String name = requireString(obj, "name", path);
        Node returnType = readChild(obj, "returnType", path);
        List<Node> parameters = readList(obj, "parameters", path, false);
        Block body = readChild(obj, "body", path).as(Block.class)
                .orElseThrow(() -> new TreeFormatException(path + ".body", "function body must be a block"));
        return Nodes.function(name, returnType, parameters, body);
    }

    private Literal readLiteral(JsonObject obj, String path) {
        String member = null;
        for (String candidate : LITERAL_MEMBERS) {
            if (obj.has(candidate)) {
                if (member != null) {
                    throw new TreeFormatException(path, "literal has both '" + member + "' and '" + candidate + "'");
                }
                member = candidate;
            }
        }
        if (member == null) {
            throw new TreeFormatException(path, "literal needs one of " + LITERAL_MEMBERS);
        }

        String memberPath = path + "." + member;
        JsonElement value = obj.get(member);
        switch (member) {
            case "int": {
                long v = requireInteger(value, memberPath);
                if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                    throw new TreeFormatException(memberPath, "int literal out of range: " + v);
                }
                return Nodes.literal((int) v);
            }
            case "long":
                return Nodes.literal(requireInteger(value, memberPath));
            case "ulong":
                return Nodes.unsignedLiteral(requireUnsignedLong(value, memberPath));
            case "float":
                return Nodes.literal(requireNumber(value, memberPath).floatValue());
            case "double":
                return Nodes.literal(requireNumber(value, memberPath).doubleValue());
            case "char": {
                String text = requireString(value, memberPath);
                if (text.length() != 1) {
                    throw new TreeFormatException(memberPath, "char literal must be exactly one character");
                }
                return Nodes.literal(text.charAt(0));
            }
            default:
                return Nodes.literal(requireString(value, memberPath));
        }
    }

    private long readSize(JsonObject obj, String path) {
        if (!obj.has("size")) {
            return 0;
        }
        return requireInteger(obj.get("size"), path + ".size");
    }

    // ============ 成员读取 ============

    private Node readChild(JsonObject obj, String member, String path) {
        if (!obj.has(member)) {
            throw new TreeFormatException(path, "missing member '" + member + "'");
        }
        return readNode(obj.get(member), path + "." + member);
    }

    private List<Node> readList(JsonObject obj, String member, String path, boolean required) {
        if (!obj.has(member)) {
            if (required) {
                throw new TreeFormatException(path, "missing member '" + member + "'");
            }
            return Collections.emptyList();
        }
        JsonElement element = obj.get(member);
        String listPath = path + "." + member;
        if (!element.isJsonArray()) {
            throw new TreeFormatException(listPath, "expected an array");
        }
        JsonArray array = element.getAsJsonArray();
        List<Node> nodes = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            nodes.add(readNode(array.get(i), listPath + "[" + i + "]"));
        }
        return nodes;
    }

    private static String requireString(JsonObject obj, String member, String path) {
        if (!obj.has(member)) {
            throw new TreeFormatException(path, "missing member '" + member + "'");
        }
        return requireString(obj.get(member), path + "." + member);
    }

    private static String requireString(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new TreeFormatException(path, "expected a string");
        }
        return element.getAsString();
    }

    private static long requireInteger(JsonElement element, String path) {
        try {
            return requireNumber(element, path).longValueExact();
        } catch (ArithmeticException e) {
            throw new TreeFormatException(path, "expected an integer", e);
        }
    }

    private static long requireUnsignedLong(JsonElement element, String path) {
        BigInteger v;
        try {
            v = requireNumber(element, path).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new TreeFormatException(path, "expected an integer", e);
        }
        if (v.signum() < 0 || v.compareTo(ULONG_MAX) > 0) {
            throw new TreeFormatException(path, "ulong literal out of range: " + v);
        }
        return v.longValue();
    }

    private static BigDecimal requireNumber(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new TreeFormatException(path, "expected a number");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        try {
            return primitive.getAsBigDecimal();
        } catch (NumberFormatException e) {
            throw new TreeFormatException(path, "invalid number '" + primitive.getAsString() + "'", e);
        }
    }
}
