package com.example.microscopy.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 常用的类型转换。
 *
 * 注意：数字字符串会先 trim 再解析；容器节点（对象/数组）除 LIST 外一律视为转换失败。
 */
public final class Casters {

    private Casters() {}

    /** 普通十进制写法（可带指数）；不接受 Java 字面量后缀、十六进制、Infinity / NaN */
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** 转 double：数字或数字字符串 */
    public static final ValueCaster FLOAT = raw -> {
        if (raw.isNumber()) {
            return DoubleNode.valueOf(raw.doubleValue());
        }
        if (raw.isTextual()) {
            return DoubleNode.valueOf(parseDecimal(raw.textValue()));
        }
        throw new IllegalArgumentException("not a number: " + raw.getNodeType());
    };

    /** 转 int：浮点数向 0 截断，字符串必须是整数 */
    public static final ValueCaster INT = raw -> {
        if (raw.isIntegralNumber()) {
            if (!raw.canConvertToInt()) {
                throw new IllegalArgumentException("integer out of range: " + raw.asText());
            }
            return IntNode.valueOf(raw.intValue());
        }
        if (raw.isNumber()) {
            double d = raw.doubleValue();
            if (!Double.isFinite(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                throw new IllegalArgumentException("cannot truncate to int: " + d);
            }
            return IntNode.valueOf((int) d);
        }
        if (raw.isTextual()) {
            return IntNode.valueOf(Integer.parseInt(raw.textValue().trim()));
        }
        throw new IllegalArgumentException("not an integer: " + raw.getNodeType());
    };

    /** 转字符串：任何标量都可以 */
    public static final ValueCaster STRING = raw -> {
        if (raw.isValueNode()) {
            return TextNode.valueOf(raw.asText());
        }
        throw new IllegalArgumentException("not a scalar: " + raw.getNodeType());
    };

    /** 转 boolean：布尔值 / 数字（非 0 为 true）/ 常见的真假字符串 */
    public static final ValueCaster BOOL = raw -> {
        if (raw.isBoolean()) {
            return BooleanNode.valueOf(raw.booleanValue());
        }
        if (raw.isNumber()) {
            return BooleanNode.valueOf(raw.doubleValue() != 0.0);
        }
        if (raw.isTextual()) {
            String s = raw.textValue().trim().toLowerCase(Locale.ROOT);
            switch (s) {
                case "true", "1", "yes", "on":
                    return BooleanNode.TRUE;
                case "false", "0", "no", "off":
                    return BooleanNode.FALSE;
                default:
                    throw new IllegalArgumentException("not a boolean: " + s);
            }
        }
        throw new IllegalArgumentException("not a boolean: " + raw.getNodeType());
    };

    /** 只接受数组，返回一份拷贝 */
    public static final ValueCaster LIST = raw -> {
        if (raw.isArray()) {
            return raw.deepCopy();
        }
        throw new IllegalArgumentException("not a list: " + raw.getNodeType());
    };

    /** DigitalMicrograph 的光阑标签，例如 "2.5 mm" -> 2.5 */
    public static final ValueCaster MILLIMETER_LABEL = raw -> {
        if (!raw.isTextual()) {
            throw new IllegalArgumentException("aperture label is not text: " + raw.getNodeType());
        }
        return DoubleNode.valueOf(parseDecimal(raw.textValue().replace(" mm", "")));
    };

    static double parseDecimal(String text) {
        String s = text.trim();
        if (!DECIMAL.matcher(s).matches()) {
            throw new NumberFormatException("not a decimal number: " + text);
        }
        return Double.parseDouble(s);
    }
}
