package com.example.microscopy.stage.impl;

import com.example.microscopy.parser.ExtractionContext;
import com.example.microscopy.rule.EelsTagRules;
import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 阶段 C：EELS 谱仪相关的 DM tag。
 */
public class EelsTagStage implements ExtractionStage {

    private final MappingEngine engine;

    public EelsTagStage(MappingEngine engine) {
        this.engine = engine;
    }

    @Override
    public String name() {
        return "eels-tags";
    }

    @Override
    public int apply(ExtractionContext ctx) {
        if (!ctx.hasTagRoot()) {
            return 0;
        }
        JsonNode tags = ctx.getTagRoot();
        int written = engine.apply(tags, ctx.getEm(), EelsTagRules.ACQUISITION);

        // 谱仪块只取第一个存在的位置
        for (List<String> location : EelsTagRules.SPECTROMETER_LOCATIONS) {
            JsonNode spectrometer = TreePaths.get(tags, location);
            if (spectrometer != null && spectrometer.isObject()) {
                written += engine.apply(spectrometer, ctx.getEm(), EelsTagRules.SPECTROMETER);
                break;
            }
        }
        return written;
    }
}
