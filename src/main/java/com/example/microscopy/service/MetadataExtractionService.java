package com.example.microscopy.service;

import com.example.microscopy.decode.DatasetDecodeException;
import com.example.microscopy.decode.DatasetDecoder;
import com.example.microscopy.decode.DecodedDataset;
import com.example.microscopy.decode.ExternalProcessDecoder;
import com.example.microscopy.decode.JsonExportDecoder;
import com.example.microscopy.parser.ExtractionPipeline;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 文件级入口：解码 -> 取第一个数据集 -> 提取。
 *
 * 解码失败（DatasetDecodeException）原样往外抛，不返回部分结果。
 * 无状态，调用方可以自己用线程池并发处理多个文件。
 */
@Service
public class MetadataExtractionService {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractionService.class);

    private final JsonExportDecoder jsonExportDecoder;
    private final ExternalProcessDecoder externalProcessDecoder;
    private final ExtractionPipeline pipeline;

    public MetadataExtractionService(JsonExportDecoder jsonExportDecoder,
                                     ExternalProcessDecoder externalProcessDecoder,
                                     ExtractionPipeline pipeline) {
        this.jsonExportDecoder = jsonExportDecoder;
        this.externalProcessDecoder = externalProcessDecoder;
        this.pipeline = pipeline;
    }

    public ObjectNode extract(Path file) {
        DatasetDecoder decoder = decoderFor(file);
        List<DecodedDataset> datasets = decoder.decode(file);
        if (datasets.isEmpty()) {
            throw new DatasetDecodeException("No dataset decoded from " + file);
        }
        ObjectNode record = pipeline.extractFirst(datasets);
        log.info("Extracted metadata from {} ({} dataset(s) decoded)", file.getFileName(), datasets.size());
        return record;
    }

    /** 已经导出的 .json 直接读，其它格式走外部解码进程 */
    DatasetDecoder decoderFor(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? jsonExportDecoder : externalProcessDecoder;
    }
}
