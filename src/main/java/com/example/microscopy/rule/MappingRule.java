package com.example.microscopy.rule;

import com.example.microscopy.model.UnitCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * 一条字段映射规则（纯数据，构造后不可变）：
 *  - sourcePath：源树里的 key 路径（相对于阶段给定的源根节点）
 *  - destPath  ：目标树里的 key 路径
 *  - caster    ：类型转换，失败则跳过
 *  - unit      ：可选，写成 {value, unit}
 *  - conversion：可选，转换后对数值再做一次换算（例如 um -> mm）
 *  - override  ：目标已有值时是否覆盖
 *
 * 源树不放在规则里，由各个阶段在 apply 时传入，所以规则表可以做成静态常量。
 */
@Getter
@ToString(of = {"sourcePath", "destPath", "unit", "override"})
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MappingRule {

    private final List<String> sourcePath;
    private final List<String> destPath;
    private final ValueCaster caster;
    private final UnitCode unit;
    @With
    private final DoubleUnaryOperator conversion;
    @With
    private final boolean override;

    public static MappingRule of(List<String> sourcePath,
                                 List<String> destPath,
                                 ValueCaster caster,
                                 UnitCode unit) {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(destPath, "destPath");
        Objects.requireNonNull(caster, "caster");
        if (destPath.isEmpty()) {
            throw new IllegalArgumentException("destPath must not be empty");
        }
        return new MappingRule(List.copyOf(sourcePath), List.copyOf(destPath), caster, unit, null, false);
    }

    public static MappingRule of(List<String> sourcePath, List<String> destPath, ValueCaster caster) {
        return of(sourcePath, destPath, caster, null);
    }

    /** 小工具：把若干 key 拼成路径 */
    public static List<String> path(String... keys) {
        return List.of(keys);
    }

    /** prefix + keys */
    public static List<String> path(List<String> prefix, String... keys) {
        String[] all = Arrays.copyOf(prefix.toArray(new String[0]), prefix.size() + keys.length);
        System.arraycopy(keys, 0, all, prefix.size(), keys.length);
        return List.of(all);
    }
}
