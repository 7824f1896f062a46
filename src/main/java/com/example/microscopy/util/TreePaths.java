package com.example.microscopy.util;

import com.example.microscopy.model.RecordSections;
import com.example.microscopy.model.UnitCode;
import com.example.microscopy.rule.ValueCaster;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 元数据树的路径读写工具。
 *  - get：按 key 路径逐层向下取，任何一层取不到（key 不存在 / 下标越界 / 类型不对）都返回 null，不抛异常
 *  - set：按路径写入，中间层不存在就自动创建 ObjectNode
 *
 * 数组节点上，纯数字的 segment 当作下标。
 */
public final class TreePaths {

    private static final Logger log = LoggerFactory.getLogger(TreePaths.class);

    private TreePaths() {}

    /**
     * 按 key 路径逐层向下取，取不到就返回 null。
     * JSON null 也视为取不到。
     */
    public static JsonNode get(JsonNode node, List<String> path) {
        JsonNode cur = node;
        for (String k : path) {
            if (cur == null || cur.isMissingNode() || cur.isNull()) {
                return null;
            }
            cur = child(cur, k);
        }
        if (cur == null || cur.isMissingNode() || cur.isNull()) {
            return null;
        }
        return cur;
    }

    public static JsonNode get(JsonNode node, String... keys) {
        return get(node, Arrays.asList(keys));
    }

    /**
     * 取值并做类型转换；转换失败等同于取不到，返回 null。
     */
    public static JsonNode get(JsonNode node, List<String> path, ValueCaster caster) {
        JsonNode raw = get(node, path);
        if (raw == null) {
            return null;
        }
        if (caster == null) {
            return raw;
        }
        try {
            return caster.cast(raw);
        } catch (RuntimeException e) {
            log.trace("Cast failed at {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * 简单判断某条路径是否存在
     */
    public static boolean hasPath(JsonNode node, String... keys) {
        return get(node, keys) != null;
    }

    /**
     * 按路径写入 value。
     *
     * @param unit     不为 null 时写成 {"value": v, "unit": code}
     * @param override false 时，目标位置已有非空值就不写
     * @return 是否真的写入了
     */
    public static boolean set(ObjectNode tree, List<String> path, JsonNode value, UnitCode unit, boolean override) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }

        ObjectNode cur = tree;
        for (int i = 0; i < path.size() - 1; i++) {
            String k = path.get(i);
            JsonNode next = cur.get(k);
            if (next == null || next.isNull()) {
                cur = cur.putObject(k);
            } else if (next.isObject()) {
                cur = (ObjectNode) next;
            } else if (override) {
                // 标量挡住了路径，只有 override 时才替换
                cur = cur.putObject(k);
            } else {
                log.trace("Path {} blocked by a non-object node at '{}'", path, k);
                return false;
            }
        }

        String leaf = path.get(path.size() - 1);
        if (!override && !isEmpty(cur.get(leaf))) {
            return false;
        }
        cur.set(leaf, wrap(value, unit));
        return true;
    }

    /**
     * null / missing / JSON null / 空对象 / 空数组 都算空
     */
    public static boolean isEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        return node.isContainerNode() && node.size() == 0;
    }

    private static JsonNode wrap(JsonNode value, UnitCode unit) {
        if (unit == null) {
            return value;
        }
        ObjectNode withUnit = JsonNodeFactory.instance.objectNode();
        withUnit.set(RecordSections.VALUE, value);
        withUnit.put(RecordSections.UNIT, unit.getCode());
        return withUnit;
    }

    private static JsonNode child(JsonNode node, String key) {
        if (node.isObject()) {
            return node.get(key);
        }
        if (node.isArray()) {
            int idx = parseIndex(key);
            return idx < 0 ? null : node.get(idx);
        }
        return null;
    }

    private static int parseIndex(String key) {
        if (key == null || key.isEmpty() || key.length() > 9) {
            return -1;
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        return Integer.parseInt(key);
    }
}
