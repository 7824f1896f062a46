package com.example.microscopy.parser;

import com.example.microscopy.model.RecordSections;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * 组装最终输出：
 * {
 *   "electron_microscopy": { General, General_EM, TEM, SEM, EDS, EELS, raw_metadata },
 *   "image": { "shape": [...] }
 * }
 */
@Component
public class ResultAssembler {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    /**
     * 深度优先去掉空值（null / 空对象 / 空数组），子节点删完变空的容器也一起去掉。
     * 不修改入参，返回一份新树；整棵树都是空的返回 null。
     *
     * prune(prune(x)) == prune(x)
     */
    public JsonNode prune(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            ObjectNode out = F.objectNode();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode child = prune(e.getValue());
                if (child != null) {
                    out.set(e.getKey(), child);
                }
            }
            return out.isEmpty() ? null : out;
        }
        if (node.isArray()) {
            ArrayNode out = F.arrayNode();
            for (JsonNode item : node) {
                JsonNode child = prune(item);
                if (child != null) {
                    out.add(child);
                }
            }
            return out.isEmpty() ? null : out;
        }
        return node.deepCopy();
    }

    /**
     * @param em          各阶段写好的目标树
     * @param image       图像几何信息
     * @param rawMetadata 原样放进 raw_metadata（不做 prune，空对象也保留）
     */
    public ObjectNode assemble(ObjectNode em, ObjectNode image, JsonNode rawMetadata) {
        ObjectNode record = F.objectNode();

        ObjectNode electronMicroscopy = F.objectNode();
        JsonNode pruned = prune(em);
        if (pruned != null) {
            for (String section : RecordSections.CANONICAL) {
                JsonNode value = pruned.get(section);
                if (!TreePaths.isEmpty(value)) {
                    electronMicroscopy.set(section, value);
                }
            }
        }
        electronMicroscopy.set(RecordSections.RAW_METADATA,
                rawMetadata == null || rawMetadata.isNull() ? F.objectNode() : rawMetadata.deepCopy());
        record.set(RecordSections.ELECTRON_MICROSCOPY, electronMicroscopy);

        JsonNode prunedImage = prune(image);
        if (prunedImage != null) {
            record.set(RecordSections.IMAGE, prunedImage);
        }
        return record;
    }
}
