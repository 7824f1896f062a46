package com.example.microscopy.rule;

import com.example.microscopy.model.UnitCode;

import java.util.List;

import static com.example.microscopy.model.RecordSections.*;
import static com.example.microscopy.rule.MappingRule.of;
import static com.example.microscopy.rule.MappingRule.path;

/**
 * 阶段 B：DigitalMicrograph (.dm3/.dm4) 原生 tag 树里的通用字段。
 * 路径都相对于 tag 根（ImageTags，或者图像栈时的 "source tags"）。
 *
 * 同一个目标字段可能有多个来源，排在前面的优先（全部 override=false）。
 */
public final class GeneralTagRules {

    private GeneralTagRules() {}

    /** 图像有 DM tag 时写入的采集软件名 */
    public static final String SOFTWARE_NAME = "DigitalMicrograph";

    /** raw metadata 下默认的 tag 根 */
    public static final List<String> IMAGE_TAGS = path("ImageList", "TagGroup0", "ImageTags");

    /** 图像栈（plane info 存在）时，真正的 tag 在这里，相对于 IMAGE_TAGS */
    public static final List<String> STACK_SOURCE_TAGS = path("plane info", "TagGroup0", "source tags");

    public static final List<String> MICROSCOPE_INFO = path("Microscope Info");
    public static final List<String> SESSION_INFO = path("Session Info");
    public static final List<String> META_DATA = path("Meta Data");

    public static final List<MappingRule> RULES = List.of(
            // "Microscope Info"
            of(path(MICROSCOPE_INFO, "Indicated Magnification"), path(GENERAL_EM, "magnification_indicated"),
                    Casters.FLOAT, UnitCode.UNITLESS),
            of(path(MICROSCOPE_INFO, "Actual Magnification"), path(GENERAL_EM, "magnification_actual"),
                    Casters.FLOAT, UnitCode.UNITLESS),
            of(path(MICROSCOPE_INFO, "Cs(mm)"), path(TEM, "spherical_aberration_coefficient"),
                    Casters.FLOAT, UnitCode.MILLI_M),
            of(path(MICROSCOPE_INFO, "STEM Camera Length"), path(TEM, "camera_length"),
                    Casters.FLOAT, UnitCode.MILLI_M),
            of(path(MICROSCOPE_INFO, "Operation Mode"), path(TEM, "operation_mode"), Casters.STRING),
            of(path(MICROSCOPE_INFO, "Imaging Mode"), path(TEM, "imaging_mode"), Casters.STRING),
            of(path(MICROSCOPE_INFO, "Illumination Mode"), path(TEM, "illumination_mode"), Casters.STRING),
            of(path(MICROSCOPE_INFO, "Microscope"), path(GENERAL_EM, "microscope_name"), Casters.STRING),
            // DM 里 stage X/Y/Z 存的是 um，输出 mm
            of(path(MICROSCOPE_INFO, "Stage Position", "Stage X"), path(GENERAL_EM, "stage_position", "x"),
                    Casters.FLOAT, UnitCode.MILLI_M).withConversion(x -> x / 1000),
            of(path(MICROSCOPE_INFO, "Stage Position", "Stage Y"), path(GENERAL_EM, "stage_position", "y"),
                    Casters.FLOAT, UnitCode.MILLI_M).withConversion(x -> x / 1000),
            of(path(MICROSCOPE_INFO, "Stage Position", "Stage Z"), path(GENERAL_EM, "stage_position", "z"),
                    Casters.FLOAT, UnitCode.MILLI_M).withConversion(x -> x / 1000),
            of(path(MICROSCOPE_INFO, "Stage Position", "Stage Alpha"), path(GENERAL_EM, "stage_position", "tilt_alpha"),
                    Casters.FLOAT, UnitCode.DEG),
            of(path(MICROSCOPE_INFO, "Stage Position", "Stage Beta"), path(GENERAL_EM, "stage_position", "tilt_beta"),
                    Casters.FLOAT, UnitCode.DEG),
            of(path(MICROSCOPE_INFO, "Emission Current (µA)"), path(GENERAL_EM, "emission_current"),
                    Casters.FLOAT, UnitCode.MICRO_A),

            // "Session Info"
            of(path(SESSION_INFO, "Detector"), path(GENERAL_EM, "detector_name"), Casters.STRING),
            of(path(SESSION_INFO, "Microscope"), path(GENERAL_EM, "microscope_name"), Casters.STRING),
            // 老文件只有 Name
            of(path(MICROSCOPE_INFO, "Name"), path(GENERAL_EM, "microscope_name"), Casters.STRING),

            // "Meta Data"
            of(path(META_DATA, "Acquisition Mode"), path(TEM, "acquisition_mode"), Casters.STRING),
            of(path(META_DATA, "Format"), path(TEM, "acquisition_format"), Casters.STRING),
            of(path(META_DATA, "Signal"), path(TEM, "acquisition_signal"), Casters.STRING),
            // EDS 的 signal label 有时在这里
            of(path(META_DATA, "Experiment keywords", "TagGroup1", "Label"), path(TEM, "acquisition_signal"),
                    Casters.STRING),

            // 其它零散的 tag
            of(path("Acquisition", "Device", "Name"), path(TEM, "acquisition_device"), Casters.STRING),
            of(path("DataBar", "Device Name"), path(TEM, "acquisition_device"), Casters.STRING),
            of(path("Acquisition", "Parameters", "High Level", "Exposure (s)"), path(GENERAL_EM, "exposure_time"),
                    Casters.FLOAT, UnitCode.SEC),
            of(path("DataBar", "Exposure Time (s)"), path(GENERAL_EM, "exposure_time"), Casters.FLOAT, UnitCode.SEC),
            of(path("GMS Version", "Created"), path(GENERAL_EM, "acquisition_software_version"), Casters.STRING)
    );

    /** 源根：阶段里临时拼的 {"acquisition_software_name": ...} */
    public static final List<MappingRule> SOFTWARE = List.of(
            of(path("acquisition_software_name"), path(GENERAL_EM, "acquisition_software_name"), Casters.STRING)
    );

    /** 源根：raw metadata 的 ObjectInfo.ExperimentalDescription（部分 FEI 文件才有） */
    public static final List<String> EXPERIMENTAL_DESCRIPTION = path("ObjectInfo", "ExperimentalDescription");

    public static final List<MappingRule> EXPERIMENTAL_DESCRIPTION_RULES = List.of(
            of(path("Emission_uA"), path(GENERAL_EM, "emission_current"), Casters.FLOAT, UnitCode.MICRO_A),
            of(path("Spot size"), path(TEM, "spot_size"), Casters.INT, UnitCode.UNITLESS)
    );

    /**
     * 加速电压的单位取决于数值本身：
     *  - >= 1000：认为是 V，换算成 kV，单位 KiloEV
     *  - <  1000：原样输出，单位 EV
     */
    public static MappingRule acceleratingVoltage(double rawVoltage) {
        MappingRule rule = of(path(MICROSCOPE_INFO, "Voltage"), path(GENERAL_EM, "accelerating_voltage"),
                Casters.FLOAT, rawVoltage >= 1000 ? UnitCode.KILO_EV : UnitCode.EV);
        return rawVoltage >= 1000 ? rule.withConversion(x -> x / 1000) : rule;
    }

    public static List<String> voltagePath() {
        return path(MICROSCOPE_INFO, "Voltage");
    }
}
