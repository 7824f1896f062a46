package com.example.microscopy.model;

/**
 * 仪器类别：决定从 Acquisition_instrument 下哪一棵子树取共享字段
 * （beam energy / stage / detector 等）。
 *  - SEM：扫描电镜
 *  - TEM：透射电镜（STEM 也归在 TEM 下）
 *  - NONE：两者都没有
 */
public enum InstrumentClass {
    SEM("SEM"),
    TEM("TEM"),
    NONE("None");

    private final String key;

    InstrumentClass(String key) {
        this.key = key;
    }

    /** 在 structured metadata 里的 key */
    public String getKey() {
        return key;
    }
}
