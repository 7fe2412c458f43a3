package com.lispcalc.print;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lispcalc.error.MalformedInputException;
import com.lispcalc.parser.Expr;
import com.lispcalc.parser.Expr.Binding;
import com.lispcalc.parser.Expr.Call;
import com.lispcalc.parser.Expr.ExprInterface;
import com.lispcalc.parser.Expr.ExprVisitor;
import com.lispcalc.parser.Expr.Let;
import com.lispcalc.parser.Expr.Var;

/**
 * JSON form of the AST, for tooling that wants the tree rather than its source text.
 *
 * <pre>
 *   {"type":"number","value":n}
 *   {"type":"call","op":"+","args":[...]}
 *   {"type":"let","bindings":[{"name":"x","value":...}],"body":...}
 *   {"type":"var","name":"x"}
 * </pre>
 */
public final class AstJson implements ExprVisitor<JsonNode> {

    private static final ObjectMapper om = new ObjectMapper();

    private AstJson() {}

    public static JsonNode toJson(ExprInterface expr) {
        return expr.accept(new AstJson());
    }

    public static String toJsonString(ExprInterface expr) {
        try {
            return om.writeValueAsString(toJson(expr));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("AST serialization failed", e);
        }
    }

    public static ExprInterface fromJsonString(String json) {
        try {
            return fromJson(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedInputException(0, "Invalid AST JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static ExprInterface fromJson(JsonNode node) {
        if (node == null || !node.isObject()) throw bad("expected an object node");
        String type = text(node, "type");
        switch (type) {
            case "number": {
                JsonNode v = node.get("value");
                if (v == null || !v.canConvertToInt() || !v.isIntegralNumber()) throw bad("number node needs an int 'value'");
                return new Expr.Number(v.intValue());
            }
            case "call": {
                List<ExprInterface> args = new ArrayList<>();
                JsonNode arr = node.get("args");
                if (arr != null) {
                    if (!arr.isArray()) throw bad("call 'args' must be an array");
                    for (JsonNode a : arr) args.add(fromJson(a));
                }
                return new Call(text(node, "op"), args);
            }
            case "let": {
                JsonNode arr = node.get("bindings");
                if (arr == null || !arr.isArray() || arr.size() == 0) throw bad("let needs a non-empty 'bindings' array");
                List<Binding> bindings = new ArrayList<>();
                for (JsonNode b : arr) {
                    bindings.add(new Binding(text(b, "name"), fromJson(b.get("value"))));
                }
                return new Let(bindings, fromJson(node.get("body")));
            }
            case "var":
                return new Var(text(node, "name"));
            default:
                throw bad("unknown node type '" + type + "'");
        }
    }

    @Override
    public JsonNode visitNumberExpr(Expr.Number expr) {
        ObjectNode out = om.createObjectNode();
        out.put("type", "number");
        out.put("value", expr.value);
        return out;
    }

    @Override
    public JsonNode visitCallExpr(Call expr) {
        ObjectNode out = om.createObjectNode();
        out.put("type", "call");
        out.put("op", expr.operator);
        ArrayNode args = out.putArray("args");
        for (ExprInterface a : expr.args) args.add(a.accept(this));
        return out;
    }

    @Override
    public JsonNode visitLetExpr(Let expr) {
        ObjectNode out = om.createObjectNode();
        out.put("type", "let");
        ArrayNode bindings = out.putArray("bindings");
        for (Binding b : expr.bindings) {
            ObjectNode bn = bindings.addObject();
            bn.put("name", b.name);
            bn.set("value", b.value.accept(this));
        }
        out.set("body", expr.body.accept(this));
        return out;
    }

    @Override
    public JsonNode visitVarExpr(Var expr) {
        ObjectNode out = om.createObjectNode();
        out.put("type", "var");
        out.put("name", expr.name);
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = (node == null) ? null : node.get(field);
        if (v == null || !v.isTextual()) throw bad("missing string field '" + field + "'");
        return v.asText();
    }

    private static MalformedInputException bad(String message) {
        return new MalformedInputException(0, "Invalid AST JSON: " + message);
    }
}
