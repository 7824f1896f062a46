package com.example.microscopy.stage.impl;

import com.example.microscopy.parser.ExtractionContext;
import com.example.microscopy.rule.Casters;
import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.rule.MappingRule;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static com.example.microscopy.rule.MappingRule.path;

/**
 * 图像尺寸：DM 的 Dimensions 是 (width, height, ...)，输出成 (height, width, ...)。
 * 任何一维不是整数就整个不输出。
 */
public class ImageShapeStage implements ExtractionStage {

    public static final List<String> DIMENSIONS = path("ImageList", "TagGroup0", "ImageData", "Dimensions");

    private static final List<MappingRule> SHAPE = List.of(
            MappingRule.of(path("shape"), path("shape"), Casters.LIST)
    );

    private final MappingEngine engine;

    public ImageShapeStage(MappingEngine engine) {
        this.engine = engine;
    }

    @Override
    public String name() {
        return "image-shape";
    }

    @Override
    public int apply(ExtractionContext ctx) {
        List<Integer> dims = readDimensions(TreePaths.get(ctx.getRaw(), DIMENSIONS));
        if (dims == null || dims.isEmpty()) {
            return 0;
        }
        if (dims.size() >= 2) {
            Integer first = dims.get(0);
            dims.set(0, dims.get(1));
            dims.set(1, first);
        }

        ObjectNode record = JsonNodeFactory.instance.objectNode();
        ArrayNode shape = record.putArray("shape");
        for (Integer d : dims) {
            shape.add(d.intValue());
        }
        return engine.apply(record, ctx.getImage(), SHAPE);
    }

    /**
     * Dimensions 可能是对象（按插入顺序取值）或数组；有一项转不成整数就返回 null。
     */
    static List<Integer> readDimensions(JsonNode node) {
        if (node == null || !node.isContainerNode()) {
            return null;
        }
        List<Integer> dims = new ArrayList<>();
        Iterator<JsonNode> it = node.elements();
        while (it.hasNext()) {
            JsonNode v = TreePaths.get(it.next(), List.of(), Casters.INT);
            if (v == null) {
                return null;
            }
            dims.add(v.intValue());
        }
        return dims;
    }
}
