package com.docledger.document.service;

import com.docledger.document.domain.payload.DocumentPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structural diff of two payloads, reported as sorted dotted leaf paths
 * ({@code contactInfo.businessName}). Objects are descended, arrays are compared as whole
 * values, and a null value is the same as an absent one.
 */
@Component
@RequiredArgsConstructor
public class PayloadDiffer {

    private final ObjectMapper objectMapper;

    public List<String> diff(DocumentPayload before, DocumentPayload after) {
        SortedSet<String> paths = new TreeSet<>();
        collect("", toTree(before), toTree(after), paths);
        return new ArrayList<>(paths);
    }

    private JsonNode toTree(DocumentPayload payload) {
        return objectMapper.valueToTree(payload != null ? payload : DocumentPayload.empty());
    }

    private void collect(String path, JsonNode left, JsonNode right, Set<String> out) {
        boolean leftAbsent = isAbsent(left);
        boolean rightAbsent = isAbsent(right);
        if (leftAbsent && rightAbsent) {
            return;
        }
        boolean leftObject = !leftAbsent && left.isObject();
        boolean rightObject = !rightAbsent && right.isObject();
        if ((leftObject || leftAbsent) && (rightObject || rightAbsent)) {
            Set<String> names = new TreeSet<>();
            if (leftObject) {
                left.fieldNames().forEachRemaining(names::add);
            }
            if (rightObject) {
                right.fieldNames().forEachRemaining(names::add);
            }
            for (String name : names) {
                collect(child(path, name),
                    leftObject ? left.get(name) : null,
                    rightObject ? right.get(name) : null,
                    out);
            }
            return;
        }
        if (leftAbsent || rightAbsent || !left.equals(right)) {
            out.add(path);
        }
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }
}
