package com.example.microscopy.stage.impl;

import com.example.microscopy.parser.ExtractionContext;
import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.rule.StructuredMetadataRules;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 阶段 A：structured metadata。
 * 仪器相关的规则只在选中了 SEM/TEM 子树时执行；General / Sample 总是执行。
 */
public class StructuredMetadataStage implements ExtractionStage {

    private final MappingEngine engine;

    public StructuredMetadataStage(MappingEngine engine) {
        this.engine = engine;
    }

    @Override
    public String name() {
        return "structured-metadata";
    }

    @Override
    public int apply(ExtractionContext ctx) {
        int written = 0;
        if (ctx.hasInstrument()) {
            JsonNode instrument = ctx.getInstrumentNode();
            written += engine.apply(instrument, ctx.getEm(), StructuredMetadataRules.INSTRUMENT);

            JsonNode detector = TreePaths.get(instrument, "Detector");
            if (detector != null) {
                written += engine.apply(detector, ctx.getEm(), StructuredMetadataRules.DETECTOR);
            }
        }
        written += engine.apply(ctx.getStructured(), ctx.getEm(), StructuredMetadataRules.GENERAL_INFO);
        return written;
    }
}
