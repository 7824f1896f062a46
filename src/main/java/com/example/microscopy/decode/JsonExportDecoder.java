package com.example.microscopy.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取事先导出好的 JSON（和外部解码进程的 stdout 是同一格式）。
 * 离线批处理、测试时不需要装解码库。
 */
@Component
public class JsonExportDecoder implements DatasetDecoder {

    private static final Logger log = LoggerFactory.getLogger(JsonExportDecoder.class);

    private final DatasetJsonReader reader;

    public JsonExportDecoder(DatasetJsonReader reader) {
        this.reader = reader;
    }

    @Override
    public List<DecodedDataset> decode(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new DatasetDecodeException("JSON export not found: " + file);
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DatasetDecodeException("Failed to read JSON export: " + file, e);
        }
        List<DecodedDataset> datasets = reader.read(text, file.toString());
        log.debug("Read {} dataset(s) from {}", datasets.size(), file);
        return datasets;
    }
}
