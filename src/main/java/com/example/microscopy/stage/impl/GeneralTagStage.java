package com.example.microscopy.stage.impl;

import com.example.microscopy.parser.ExtractionContext;
import com.example.microscopy.rule.Casters;
import com.example.microscopy.rule.GeneralTagRules;
import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * 阶段 B：DM tag 树里的通用字段（Microscope Info / Session Info / Meta Data ...）。
 */
public class GeneralTagStage implements ExtractionStage {

    private final MappingEngine engine;

    public GeneralTagStage(MappingEngine engine) {
        this.engine = engine;
    }

    @Override
    public String name() {
        return "general-tags";
    }

    @Override
    public int apply(ExtractionContext ctx) {
        ObjectNode em = ctx.getEm();
        int written = 0;

        if (ctx.hasTagRoot()) {
            JsonNode tags = ctx.getTagRoot();
            written += engine.apply(tags, em, GeneralTagRules.RULES);

            // 电压的单位要看数值大小才能定
            JsonNode voltage = TreePaths.get(tags, GeneralTagRules.voltagePath(), Casters.FLOAT);
            if (voltage != null) {
                written += engine.apply(tags, em, List.of(GeneralTagRules.acceleratingVoltage(voltage.doubleValue())));
            }
        }

        JsonNode description = TreePaths.get(ctx.getRaw(), GeneralTagRules.EXPERIMENTAL_DESCRIPTION);
        written += engine.apply(description, em, GeneralTagRules.EXPERIMENTAL_DESCRIPTION_RULES);

        if (TreePaths.get(ctx.getRaw(), GeneralTagRules.IMAGE_TAGS) != null) {
            ObjectNode software = JsonNodeFactory.instance.objectNode()
                    .put("acquisition_software_name", GeneralTagRules.SOFTWARE_NAME);
            written += engine.apply(software, em, GeneralTagRules.SOFTWARE);
        }
        return written;
    }
}
