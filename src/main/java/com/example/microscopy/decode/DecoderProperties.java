package com.example.microscopy.decode;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "decoder")
public class DecoderProperties {

    /** 文件路径在命令里的占位符 */
    public static final String FILE_PLACEHOLDER = "{file}";

    /**
     * 外部解码命令，每个元素一个参数，例如
     * [python, -m, em_dump, "{file}"]
     * 该进程需要把 JSON 写到 stdout。
     */
    private List<String> command = new ArrayList<>();

    /** 额外的环境变量（例如 PYTHONPATH） */
    private Map<String, String> environment = new LinkedHashMap<>();

    /** 工作目录，不设就用当前目录 */
    private String workDir;

    /** 等待外部进程的最长时间（秒），<= 0 表示一直等 */
    private long timeoutSeconds = 300;
}
