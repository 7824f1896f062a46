package com.example.microscopy.rule;

import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * 规则执行器：按顺序把一组 MappingRule 应用到目标树上。
 *
 * 对每条规则：
 *  1) 从 source 按 sourcePath 取值，取不到 -> 跳过
 *  2) caster 转换，失败 -> 跳过
 *  3) 有 conversion 且结果是数值 -> 换算
 *  4) 写入 destination；override=false 且目标已有值 -> 跳过（先写者优先）
 *
 * 本身无状态，可以多线程共用。
 */
@Component
public class MappingEngine {

    private static final Logger log = LoggerFactory.getLogger(MappingEngine.class);

    /**
     * @param source      源根节点（只读），可以为 null（此时所有规则都跳过）
     * @param destination 目标树，只修改它
     * @param rules       按优先级排好序的规则
     * @return 实际写入的字段数
     */
    public int apply(JsonNode source, ObjectNode destination, List<MappingRule> rules) {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(rules, "rules");
        if (source == null) {
            return 0;
        }

        int written = 0;
        for (MappingRule rule : rules) {
            JsonNode value = TreePaths.get(source, rule.getSourcePath(), rule.getCaster());
            if (value == null) {
                continue;
            }
            if (rule.getConversion() != null && value.isNumber()) {
                value = DoubleNode.valueOf(rule.getConversion().applyAsDouble(value.doubleValue()));
            }
            if (TreePaths.set(destination, rule.getDestPath(), value, rule.getUnit(), rule.isOverride())) {
                written++;
            } else {
                log.trace("Skipped {}: destination already populated", rule);
            }
        }
        return written;
    }
}
