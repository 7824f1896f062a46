package com.example.microscopy.model;

import java.util.List;

/**
 * 输出记录里固定的 key。
 */
public final class RecordSections {

    private RecordSections() {}

    public static final String ELECTRON_MICROSCOPY = "electron_microscopy";
    public static final String IMAGE = "image";
    public static final String RAW_METADATA = "raw_metadata";

    public static final String GENERAL = "General";
    public static final String GENERAL_EM = "General_EM";
    public static final String TEM = "TEM";
    public static final String SEM = "SEM";
    public static final String EDS = "EDS";
    public static final String EELS = "EELS";

    /** 规范化后的各个 section，按输出顺序排列 */
    public static final List<String> CANONICAL = List.of(GENERAL, GENERAL_EM, TEM, SEM, EDS, EELS);

    public static final String VALUE = "value";
    public static final String UNIT = "unit";
}
