package com.example.microscopy.parser;

import com.example.microscopy.decode.DecodedDataset;
import com.example.microscopy.model.InstrumentClass;
import com.example.microscopy.rule.GeneralTagRules;
import com.example.microscopy.stage.ExtractionStage;
import com.example.microscopy.stage.StageRegistry;
import com.example.microscopy.util.TreePaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * 一个数据集 -> 一条规范化记录。
 *
 * 流程：
 *  1) 选仪器类别（先 SEM 再 TEM）
 *  2) 解析 DM tag 根（图像栈时在 plane info 下面）
 *  3) 按 StageRegistry 的顺序跑各个阶段，全部写进同一棵目标树
 *  4) ResultAssembler 去空、组装
 *
 * 每次调用新建 ExtractionContext，本类不持有任何可变状态，可以多线程并发调用。
 */
@Component
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    public static final String ACQUISITION_INSTRUMENT = "Acquisition_instrument";

    private final StageRegistry registry;
    private final ResultAssembler assembler;

    public ExtractionPipeline(StageRegistry registry, ResultAssembler assembler) {
        this.registry = registry;
        this.assembler = assembler;
    }

    public ObjectNode extract(DecodedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        ExtractionContext ctx = newContext(dataset);
        log.debug("Instrument class: {}, tag root present: {}", ctx.getInstrumentClass(), ctx.hasTagRoot());

        for (ExtractionStage stage : registry.stages()) {
            int written = stage.apply(ctx);
            log.debug("Stage {} wrote {} field(s)", stage.name(), written);
        }
        return assembler.assemble(ctx.getEm(), ctx.getImage(), dataset.rawMetadata());
    }

    /**
     * 解码结果有多个数据集（图像栈、多帧等）时只用第一个。
     */
    public ObjectNode extractFirst(List<DecodedDataset> datasets) {
        Objects.requireNonNull(datasets, "datasets");
        if (datasets.isEmpty()) {
            throw new IllegalArgumentException("no dataset to extract from");
        }
        if (datasets.size() > 1) {
            log.debug("Using the first of {} datasets, ignoring the rest", datasets.size());
        }
        return extract(datasets.get(0));
    }

    ExtractionContext newContext(DecodedDataset dataset) {
        JsonNode structured = dataset.structuredMetadata();
        InstrumentClass instrumentClass = selectInstrument(structured);
        JsonNode instrumentNode = instrumentClass == InstrumentClass.NONE
                ? null
                : TreePaths.get(structured, ACQUISITION_INSTRUMENT, instrumentClass.getKey());
        return new ExtractionContext(structured, dataset.rawMetadata(), instrumentClass, instrumentNode,
                resolveTagRoot(dataset.rawMetadata()));
    }

    static InstrumentClass selectInstrument(JsonNode structured) {
        if (TreePaths.hasPath(structured, ACQUISITION_INSTRUMENT, InstrumentClass.SEM.getKey())) {
            return InstrumentClass.SEM;
        }
        if (TreePaths.hasPath(structured, ACQUISITION_INSTRUMENT, InstrumentClass.TEM.getKey())) {
            return InstrumentClass.TEM;
        }
        return InstrumentClass.NONE;
    }

    /**
     * 默认 ImageList.TagGroup0.ImageTags；
     * 有 "plane info" 时（图像栈）换成 ImageTags."plane info".TagGroup0."source tags"。
     */
    static JsonNode resolveTagRoot(JsonNode raw) {
        JsonNode imageTags = TreePaths.get(raw, GeneralTagRules.IMAGE_TAGS);
        if (imageTags == null) {
            return null;
        }
        if (TreePaths.hasPath(imageTags, GeneralTagRules.STACK_SOURCE_TAGS.get(0))) {
            return TreePaths.get(imageTags, GeneralTagRules.STACK_SOURCE_TAGS);
        }
        return imageTags;
    }
}
