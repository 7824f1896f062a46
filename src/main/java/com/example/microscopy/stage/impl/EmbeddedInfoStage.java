package com.example.microscopy.stage.impl;

import com.example.microscopy.parser.EmbeddedRecordParser;
import com.example.microscopy.parser.ExtractionContext;
import com.example.microscopy.rule.EmbeddedInfoRules;
import com.example.microscopy.rule.EmbeddedInfoRules.LineField;
import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 阶段 D：Tecnai 自由文本。
 *
 * 先把文本里的字段拼成临时 record（值都是字符串），再交给 MappingEngine 做类型转换和写入；
 * 这一阶段的规则都是 override=true，会覆盖前面阶段的值。
 */
public class EmbeddedInfoStage implements ExtractionStage {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedInfoStage.class);

    private final MappingEngine engine;

    public EmbeddedInfoStage(MappingEngine engine) {
        this.engine = engine;
    }

    @Override
    public String name() {
        return "embedded-info";
    }

    @Override
    public int apply(ExtractionContext ctx) {
        JsonNode blob = TreePaths.get(ctx.getRaw(), EmbeddedInfoRules.BLOB_PATH);
        if (blob == null || !blob.isTextual()) {
            return 0;
        }
        List<String> lines = EmbeddedRecordParser.split(blob.textValue());
        ObjectNode em = ctx.getEm();

        int written = engine.apply(toRecord(EmbeddedInfoRules.FIELDS, lines), em, EmbeddedInfoRules.RULES);

        String stageLine = EmbeddedRecordParser.findFirst(EmbeddedInfoRules.STAGE_PREFIX, lines);
        List<String> position = EmbeddedRecordParser.parseStagePosition(stageLine);
        if (position != null) {
            ObjectNode stage = JsonNodeFactory.instance.objectNode();
            for (int i = 0; i < EmbeddedInfoRules.STAGE_KEYS.size(); i++) {
                stage.put(EmbeddedInfoRules.STAGE_KEYS.get(i), position.get(i));
            }
            written += engine.apply(stage, em, EmbeddedInfoRules.STAGE_RULES);
        } else if (stageLine != null) {
            log.trace("Unparsable stage line: {}", stageLine);
        }

        if (EmbeddedRecordParser.findFirst(EmbeddedInfoRules.FILTER_BLOCK_MARKER, lines) != null) {
            written += engine.apply(toRecord(EmbeddedInfoRules.FILTER_FIELDS, lines), em, EmbeddedInfoRules.FILTER_RULES);
        }
        return written;
    }

    /**
     * 按前缀找行、按正则取值，拼成 {key: 字符串}；取不到的字段不放进去。
     */
    static ObjectNode toRecord(List<LineField> fields, List<String> lines) {
        ObjectNode record = JsonNodeFactory.instance.objectNode();
        for (LineField f : fields) {
            String text = EmbeddedRecordParser.findFirst(f.prefix(), lines);
            String value = f.patterns().isEmpty() ? text : EmbeddedRecordParser.extractFirst(text, f.patterns());
            if (value != null) {
                record.put(f.key(), value);
            }
        }
        return record;
    }
}
