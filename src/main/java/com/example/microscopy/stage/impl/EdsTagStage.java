package com.example.microscopy.stage.impl;

import com.example.microscopy.parser.ExtractionContext;
import com.example.microscopy.rule.EdsTagRules;
import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.util.TreePaths;

public class EdsTagStage implements ExtractionStage {

    private final MappingEngine engine;

    public EdsTagStage(MappingEngine engine) {
        this.engine = engine;
    }

    @Override
    public String name() {
        return "eds-tags";
    }

    @Override
    public int apply(ExtractionContext ctx) {
        if (!ctx.hasTagRoot()) {
            return 0;
        }
        return engine.apply(TreePaths.get(ctx.getTagRoot(), EdsTagRules.BASE), ctx.getEm(), EdsTagRules.RULES);
    }
}
