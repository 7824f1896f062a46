package com.example.microscopy.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 解码器输出的 JSON -> DecodedDataset 列表。
 *
 * 支持两种形状：
 *   {"metadata": {...}, "original_metadata": {...}}
 *   [ {"metadata": ..., "original_metadata": ...}, ... ]
 *
 * 解码脚本有时会先打印几行 banner / warning，这里从第一个 '{' 或 '[' 开始解析。
 */
@Component
public class DatasetJsonReader {

    public static final String STRUCTURED_KEY = "metadata";
    public static final String RAW_KEY = "original_metadata";

    private final ObjectMapper mapper;

    public DatasetJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<DecodedDataset> read(String text, String source) {
        if (text == null || text.isBlank()) {
            throw new DatasetDecodeException("Decoder produced no output for " + source);
        }
        int start = firstJsonStart(text);
        if (start < 0) {
            throw new DatasetDecodeException("No JSON document found in decoder output for " + source);
        }

        JsonNode root;
        try {
            root = mapper.readTree(text.substring(start));
        } catch (JsonProcessingException e) {
            throw new DatasetDecodeException("Malformed decoder JSON for " + source, e);
        }

        List<DecodedDataset> datasets = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode item : root) {
                datasets.add(toDataset(item, source));
            }
        } else {
            datasets.add(toDataset(root, source));
        }
        return datasets;
    }

    private static DecodedDataset toDataset(JsonNode item, String source) {
        if (item == null || !item.isObject()) {
            throw new DatasetDecodeException("Dataset entry is not an object in decoder output for " + source);
        }
        return new DecodedDataset(item.get(STRUCTURED_KEY), item.get(RAW_KEY));
    }

    private static int firstJsonStart(String text) {
        int obj = text.indexOf('{');
        int arr = text.indexOf('[');
        if (obj < 0) return arr;
        if (arr < 0) return obj;
        return Math.min(obj, arr);
    }
}
