package com.example.microscopy.rule;

import com.example.microscopy.model.UnitCode;

import java.util.List;

import static com.example.microscopy.model.RecordSections.*;
import static com.example.microscopy.rule.MappingRule.of;
import static com.example.microscopy.rule.MappingRule.path;

/**
 * 阶段 C：DM tag 树里的 EELS 字段。
 */
public final class EelsTagRules {

    private EelsTagRules() {}

    /** 源根：tag 根 */
    public static final List<MappingRule> ACQUISITION = List.of(
            of(path("EELS", "Acquisition", "Exposure (s)"), path(GENERAL_EM, "exposure_time"),
                    Casters.FLOAT, UnitCode.SEC),
            of(path("EELS", "Acquisition", "Integration time (s)"), path(EELS, "integration_time"),
                    Casters.FLOAT, UnitCode.SEC),
            of(path("EELS", "Acquisition", "Number of frames"), path(EELS, "number_of_samples"),
                    Casters.INT, UnitCode.NUM),
            of(path("EELS", "Experimental Conditions", "Collection semi-angle (mrad)"), path(EELS, "collection_angle"),
                    Casters.FLOAT, UnitCode.MILLI_RAD),
            of(path("EELS", "Experimental Conditions", "Convergence semi-angle (mrad)"),
                    path(GENERAL_EM, "convergence_angle"), Casters.FLOAT, UnitCode.MILLI_RAD)
    );

    /** 谱仪信息一般在这两个位置之一，按顺序找 */
    public static final List<List<String>> SPECTROMETER_LOCATIONS = List.of(
            path("EELS", "Acquisition", "Spectrometer"),
            path("EELS Spectrometer")
    );

    /** 源根：谱仪 tag 块 */
    public static final List<MappingRule> SPECTROMETER = List.of(
            of(path("Aperture label"), path(EELS, "aperture_size"), Casters.MILLIMETER_LABEL, UnitCode.MILLI_M),
            of(path("Dispersion (eV/ch)"), path(EELS, "dispersion_per_channel"), Casters.FLOAT, UnitCode.EV),
            of(path("Energy loss (eV)"), path(EELS, "energy_loss_offset"), Casters.FLOAT, UnitCode.EV),
            of(path("Instrument name"), path(EELS, "spectrometer_name"), Casters.STRING),
            of(path("Drift tube voltage (V)"), path(EELS, "drift_tube_voltage"), Casters.FLOAT, UnitCode.V),
            of(path("Drift tube enabled"), path(EELS, "drift_tube_enabled"), Casters.BOOL),
            of(path("Prism offset (V)"), path(EELS, "prism_shift_voltage"), Casters.FLOAT, UnitCode.V),
            // DM 写出来的 key 末尾就是带空格的
            of(path("Prism offset enabled "), path(EELS, "prism_shift_enabled"), Casters.BOOL),
            of(path("Slit width (eV)"), path(EELS, "filter_slit_width"), Casters.FLOAT, UnitCode.EV),
            of(path("Slit inserted"), path(EELS, "filter_slit_inserted"), Casters.BOOL)
    );
}
