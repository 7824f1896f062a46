package com.example.microscopy.stage;

import com.example.microscopy.parser.ExtractionContext;

/**
 * 提取流水线里的一个阶段。实现类必须无状态，所有中间结果都放在 ExtractionContext 里。
 */
public interface ExtractionStage {

    /** 日志里用的名字 */
    String name();

    /**
     * 把本阶段的规则应用到 ctx 的目标树上。
     *
     * @return 实际写入的字段数
     */
    int apply(ExtractionContext ctx);
}
