package com.example.microscopy.stage;

import com.example.microscopy.rule.MappingEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StageRegistryTest {

    @Test
    void stagesRunInPrecedenceOrder() {
        List<String> names = new StageRegistry(new MappingEngine()).stages().stream()
                .map(ExtractionStage::name)
                .toList();

        assertEquals(List.of("structured-metadata", "general-tags", "eels-tags", "eds-tags",
                "embedded-info", "image-shape"), names);
    }
}
