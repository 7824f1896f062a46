package com.example.microscopy.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * 解码库输出的一个数据集：
 *  - structuredMetadata：已经规范化过的固定词表树（HyperSpy 的 metadata）
 *  - rawMetadata       ：原始文件的 tag 树（original_metadata），结构随厂商而定，可以为空
 *
 * 两棵树在整个提取过程中只读。
 */
public record DecodedDataset(JsonNode structuredMetadata, JsonNode rawMetadata) {

    public DecodedDataset {
        if (structuredMetadata == null || structuredMetadata.isNull() || structuredMetadata.isMissingNode()) {
            structuredMetadata = JsonNodeFactory.instance.objectNode();
        }
        if (rawMetadata == null || rawMetadata.isNull() || rawMetadata.isMissingNode()) {
            rawMetadata = JsonNodeFactory.instance.objectNode();
        }
    }
}
