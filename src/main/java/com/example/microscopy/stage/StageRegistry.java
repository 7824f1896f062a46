package com.example.microscopy.stage;

import com.example.microscopy.rule.MappingEngine;
import com.example.microscopy.stage.impl.EdsTagStage;
import com.example.microscopy.stage.impl.EelsTagStage;
import com.example.microscopy.stage.impl.EmbeddedInfoStage;
import com.example.microscopy.stage.impl.GeneralTagStage;
import com.example.microscopy.stage.impl.ImageShapeStage;
import com.example.microscopy.stage.impl.StructuredMetadataStage;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StageRegistry {

    private final List<ExtractionStage> stages;

    public StageRegistry(MappingEngine engine) {
        // 顺序就是优先级：前面的阶段先写（override=false 时先写者优先），自由文本最后并覆盖
        this.stages = List.of(
                new StructuredMetadataStage(engine),
                new GeneralTagStage(engine),
                new EelsTagStage(engine),
                new EdsTagStage(engine),
                new EmbeddedInfoStage(engine),
                new ImageShapeStage(engine)
        );
    }

    public List<ExtractionStage> stages() {
        return stages;
    }
}
