package com.example.microscopy.rule;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 把源树里取到的原始节点转换成目标类型。
 * 转换失败直接抛 RuntimeException（NumberFormatException / IllegalArgumentException），
 * 调用方把它当作“取不到”处理。
 */
@FunctionalInterface
public interface ValueCaster {

    JsonNode cast(JsonNode raw);
}
