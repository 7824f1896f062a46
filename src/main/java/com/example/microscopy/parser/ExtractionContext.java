package com.example.microscopy.parser;

import com.example.microscopy.model.InstrumentClass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

/**
 * 一次提取的上下文（每个数据集新建一个，不跨调用共享）：
 *  - structured     : structured metadata 根（只读）
 *  - raw            : raw metadata 根（只读）
 *  - instrumentClass: SEM / TEM / None
 *  - instrumentNode : Acquisition_instrument.{SEM|TEM}，没有就是 null
 *  - tagRoot        : DM tag 根（ImageTags 或图像栈的 "source tags"），只解析一次；没有就是 null
 *  - em             : 目标树，各个阶段只往这里写
 *  - image          : 图像几何信息（shape）
 */
@Getter
public class ExtractionContext {

    private final JsonNode structured;
    private final JsonNode raw;
    private final InstrumentClass instrumentClass;
    private final JsonNode instrumentNode;
    private final JsonNode tagRoot;

    private final ObjectNode em = JsonNodeFactory.instance.objectNode();
    private final ObjectNode image = JsonNodeFactory.instance.objectNode();

    public ExtractionContext(JsonNode structured,
                             JsonNode raw,
                             InstrumentClass instrumentClass,
                             JsonNode instrumentNode,
                             JsonNode tagRoot) {
        this.structured = structured;
        this.raw = raw;
        this.instrumentClass = instrumentClass;
        this.instrumentNode = instrumentNode;
        this.tagRoot = tagRoot;
    }

    public boolean hasInstrument() {
        return instrumentNode != null;
    }

    public boolean hasTagRoot() {
        return tagRoot != null;
    }
}
