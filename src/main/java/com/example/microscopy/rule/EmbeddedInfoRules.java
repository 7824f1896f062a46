package com.example.microscopy.rule;

import com.example.microscopy.model.UnitCode;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import static com.example.microscopy.model.RecordSections.*;
import static com.example.microscopy.rule.MappingRule.of;
import static com.example.microscopy.rule.MappingRule.path;

/**
 * 阶段 D：FEI Tecnai 写进 dm3 的一整串自由文本（U+2028 分隔）。
 *
 * 分两步：
 *  1) LineField 描述“哪一行（前缀）+ 用哪个正则取值”，拼成一个临时的 source record
 *  2) 再用下面的规则把 record 映射到目标树
 *
 * 自由文本比 tag 树更具体，所以这里全部 override=true。
 */
public final class EmbeddedInfoRules {

    private EmbeddedInfoRules() {}

    /** 自由文本在 raw metadata 里的位置（固定在 ImageTags 下，不跟随图像栈） */
    public static final List<String> BLOB_PATH =
            path("ImageList", "TagGroup0", "ImageTags", "Tecnai", "Microscope Info");

    /** 有这一行才解析能量过滤器那一段 */
    public static final String FILTER_BLOCK_MARKER = "Filter related settings";

    /** 样品台那一行的前缀 */
    public static final String STAGE_PREFIX = "Stage";

    /**
     * 一个自由文本字段：key 为临时 record 里的名字；
     * patterns 为空表示整行（去掉前缀后）就是值；多个 pattern 按顺序尝试，第一个匹配的生效。
     */
    public record LineField(String key, String prefix, List<Pattern> patterns) {

        static LineField whole(String key, String prefix) {
            return new LineField(key, prefix, List.of());
        }

        static LineField regex(String key, String prefix, String... regexes) {
            return new LineField(key, prefix, Arrays.stream(regexes).map(Pattern::compile).toList());
        }
    }

    public static final List<LineField> FIELDS = List.of(
            LineField.whole("microscope_name", "Microscope "),
            LineField.regex("extractor_voltage", "Extr volt ", "(\\d+) V"),
            LineField.regex("emission_current", "Emission ", "([\\d.]+)uA"),
            LineField.regex("operation_mode", "Mode ", "(.*) Defocus"),
            // 成像模式 / 衍射模式两种写法
            LineField.regex("defocus", "Mode ", "Defocus \\(um\\) (.*) Magn", "Defocus ([\\d.]+) CL"),
            LineField.regex("magnification", "Mode ", "Magn (\\d+)x"),
            LineField.regex("camera_length", "Mode ", "CL (.*)m"),
            LineField.whole("spot_size", "Spot ")
    );

    public static final List<MappingRule> RULES = List.of(
            of(path("microscope_name"), path(GENERAL_EM, "microscope_name"), Casters.STRING)
                    .withOverride(true),
            of(path("extractor_voltage"), path(TEM, "extractor_voltage"), Casters.INT, UnitCode.V)
                    .withOverride(true),
            of(path("emission_current"), path(GENERAL_EM, "emission_current"), Casters.FLOAT, UnitCode.MICRO_A)
                    .withOverride(true),
            of(path("operation_mode"), path(TEM, "operation_mode"), Casters.STRING)
                    .withOverride(true),
            of(path("defocus"), path(TEM, "defocus"), Casters.FLOAT, UnitCode.MICRO_M)
                    .withOverride(true),
            of(path("magnification"), path(GENERAL_EM, "magnification_indicated"), Casters.INT, UnitCode.UNITLESS)
                    .withOverride(true),
            // 文本里是 m，输出 mm
            of(path("camera_length"), path(TEM, "camera_length"), Casters.FLOAT, UnitCode.MILLI_M)
                    .withConversion(x -> x * 1000).withOverride(true),
            of(path("spot_size"), path(TEM, "spot_size"), Casters.INT, UnitCode.UNITLESS)
                    .withOverride(true)
    );

    /** 样品台 record 的 key，顺序与 EmbeddedRecordParser.parseStagePosition 的返回一致 */
    public static final List<String> STAGE_KEYS = List.of("x", "y", "z", "alpha", "beta");

    public static final List<MappingRule> STAGE_RULES = List.of(
            of(path("x"), path(GENERAL_EM, "stage_position", "x"), Casters.FLOAT, UnitCode.MICRO_M).withOverride(true),
            of(path("y"), path(GENERAL_EM, "stage_position", "y"), Casters.FLOAT, UnitCode.MICRO_M).withOverride(true),
            of(path("z"), path(GENERAL_EM, "stage_position", "z"), Casters.FLOAT, UnitCode.MICRO_M).withOverride(true),
            of(path("alpha"), path(GENERAL_EM, "stage_position", "tilt_alpha"), Casters.FLOAT, UnitCode.DEG)
                    .withOverride(true),
            of(path("beta"), path(GENERAL_EM, "stage_position", "tilt_beta"), Casters.FLOAT, UnitCode.DEG)
                    .withOverride(true)
    );

    public static final List<LineField> FILTER_FIELDS = List.of(
            LineField.whole("mode", "Mode: "),
            LineField.regex("dispersion", "Selected dispersion: ", "(.*)\\[eV/Channel\\]"),
            LineField.regex("aperture", "Selected aperture: ", "(\\d*)mm"),
            LineField.regex("drift", "Drift tube: ", "(.*)\\[eV\\]"),
            LineField.regex("prism", "Prism shift: ", "(.*)\\[eV\\]"),
            LineField.regex("total_loss", "Total energy loss: ", "(.*)\\[eV\\]")
    );

    public static final List<MappingRule> FILTER_RULES = List.of(
            of(path("mode"), path(EELS, "spectrometer_mode"), Casters.STRING).withOverride(true),
            of(path("dispersion"), path(EELS, "dispersion_per_channel"), Casters.FLOAT, UnitCode.EV).withOverride(true),
            of(path("aperture"), path(EELS, "aperture_size"), Casters.FLOAT, UnitCode.MILLI_M).withOverride(true),
            of(path("drift"), path(EELS, "drift_tube_energy"), Casters.FLOAT, UnitCode.EV).withOverride(true),
            of(path("prism"), path(EELS, "prism_shift_energy"), Casters.FLOAT, UnitCode.EV).withOverride(true),
            of(path("total_loss"), path(EELS, "total_energy_loss"), Casters.FLOAT, UnitCode.EV).withOverride(true)
    );
}
