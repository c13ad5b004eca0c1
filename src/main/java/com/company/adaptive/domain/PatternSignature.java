package com.company.adaptive.domain;

import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.request.StoreRequest;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Normalized description of an operation's shape: kind, target collection and the
 * shape of its filter. Literal argument values never appear in a signature, so
 * {@code where author = "a"} and {@code where author = "b"} share one trail.
 */
@Value
public class PatternSignature {
    OperationKind kind;
    String collection;
    String shape;

    public static PatternSignature of(OperationKind kind, String collection, StoreRequest request) {
        return new PatternSignature(kind, collection, shapeOf(request));
    }

    public String value() {
        return kind.tagValue() + ":" + collection + ":" + shape;
    }

    @Override
    public String toString() {
        return value();
    }

    static String shapeOf(StoreRequest request) {
        if (request == null) {
            return "*";
        }
        List<String> parts = new ArrayList<>();
        if (request.getIds() != null && !request.getIds().isEmpty()) {
            parts.add("ids");
        }
        if (request.getWhere() != null && !request.getWhere().isEmpty()) {
            parts.add("where(" + whereShape(request.getWhere()) + ")");
        }
        if (request.getText() != null && !request.getText().isBlank()) {
            parts.add("text");
        }
        if (request.getDocuments() != null && !request.getDocuments().isEmpty()) {
            parts.add("docs");
        }
        return parts.isEmpty() ? "*" : String.join("+", parts);
    }

    private static String whereShape(Map<String, Object> where) {
        StringJoiner joiner = new StringJoiner(",");
        new TreeMap<>(where).forEach((field, value) -> joiner.add(field + ":" + typeOf(value)));
        return joiner.toString();
    }

    private static String typeOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Map<?, ?> nested) {
            // operator objects such as {"$gt": 3}: keep the operator names only
            StringJoiner ops = new StringJoiner("|", "{", "}");
            nested.keySet().stream().map(String::valueOf).sorted().forEach(ops::add);
            return ops.toString();
        }
        if (value instanceof Iterable<?>) {
            return "list";
        }
        return "string";
    }
}
