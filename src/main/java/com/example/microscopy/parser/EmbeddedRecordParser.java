package com.example.microscopy.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 解析 FEI Tecnai 塞进 DM tag 里的那串自由文本：
 *
 *   "Microscope Tecnai F20\u2028Extr volt 4300 V\u2028Mode TEM Defocus (um) -1.2 Magn 38000x\u2028..."
 *
 * 每个字段一行，行与行之间用单个分隔字符隔开，没有转义。
 * 这里只负责切行、按前缀找行、用正则取值；取到的字符串交给 MappingEngine 再做类型转换。
 */
public final class EmbeddedRecordParser {

    /** Tecnai 用的行分隔符（LINE SEPARATOR） */
    public static final String DEFAULT_DELIMITER = "\u2028";

    /** Stage 行："Stage 12.3 um, -4.5 um, 0.1 um, 10.0 deg, 0.0 deg" */
    private static final Pattern STAGE_POSITION = Pattern.compile(
            ".*? (-?\\d*\\.\\d*) um.*? (-?\\d*\\.\\d*) um.*? (-?\\d*\\.\\d*) um"
                    + ".*? (-?\\d*\\.\\d*) deg.*? (-?\\d*\\.\\d*) deg");

    private EmbeddedRecordParser() {}

    public static List<String> split(String blob) {
        return split(blob, DEFAULT_DELIMITER);
    }

    /**
     * 按字面分隔符切行，保留空行（包括末尾的空行）。
     * blob 为 null 时返回空列表。
     */
    public static List<String> split(String blob, String delimiter) {
        List<String> lines = new ArrayList<>();
        if (blob == null) {
            return lines;
        }
        if (delimiter == null || delimiter.isEmpty()) {
            lines.add(blob);
            return lines;
        }
        int from = 0;
        int idx;
        while ((idx = blob.indexOf(delimiter, from)) >= 0) {
            lines.add(blob.substring(from, idx));
            from = idx + delimiter.length();
        }
        lines.add(blob.substring(from));
        return lines;
    }

    /**
     * 找第一条包含 prefix 的行；行确实以 prefix 开头时去掉前缀。
     *
     * @return 去掉前缀后的文本；没有任何一行匹配时返回 null
     */
    public static String findFirst(String prefix, List<String> lines) {
        if (prefix == null || lines == null) {
            return null;
        }
        for (String line : lines) {
            if (line != null && line.contains(prefix)) {
                return line.startsWith(prefix) ? line.substring(prefix.length()) : line;
            }
        }
        return null;
    }

    /**
     * pattern 在 text 上 find() 的第一个匹配的第 1 组；匹配不到返回 null。
     */
    public static String extract(Pattern pattern, String text) {
        if (pattern == null || text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        if (!m.find() || m.groupCount() < 1) {
            return null;
        }
        return m.group(1);
    }

    /**
     * 多个写法依次尝试，第一个取到值的生效。
     */
    public static String extractFirst(String text, List<Pattern> patterns) {
        if (text == null || patterns == null) {
            return null;
        }
        for (Pattern p : patterns) {
            String v = extract(p, text);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    public static String extractFirst(String text, Pattern... patterns) {
        return extractFirst(text, List.of(patterns));
    }

    /**
     * 解析样品台那一行。
     *
     * @return 固定 5 个元素：x, y, z, alpha, beta；格式不对返回 null
     */
    public static List<String> parseStagePosition(String line) {
        if (line == null) {
            return null;
        }
        Matcher m = STAGE_POSITION.matcher(line);
        if (!m.find()) {
            return null;
        }
        return List.of(m.group(1), m.group(2), m.group(3), m.group(4), m.group(5));
    }
}
