package com.example.microscopy.rule;

import com.example.microscopy.model.UnitCode;

import java.util.List;

import static com.example.microscopy.model.RecordSections.*;
import static com.example.microscopy.rule.MappingRule.of;
import static com.example.microscopy.rule.MappingRule.path;

/**
 * 阶段 A：解码库已经规范化过的 structured metadata。
 * 词表参考 HyperSpy 的 metadata 结构：
 * http://hyperspy.org/hyperspy-doc/current/user_guide/metadata_structure.html
 *
 * 全部 override=false。
 */
public final class StructuredMetadataRules {

    private StructuredMetadataRules() {}

    /** 源根：Acquisition_instrument.{SEM|TEM} */
    public static final List<MappingRule> INSTRUMENT = List.of(
            of(path("acquisition_mode"), path(GENERAL_EM, "acquisition_mode"), Casters.STRING),
            of(path("beam_current"), path(GENERAL_EM, "beam_current"), Casters.FLOAT, UnitCode.NANO_A),
            of(path("beam_energy"), path(GENERAL_EM, "beam_energy"), Casters.FLOAT, UnitCode.KILO_EV),
            of(path("convergence_angle"), path(GENERAL_EM, "convergence_angle"), Casters.FLOAT, UnitCode.MILLI_RAD),
            of(path("magnification"), path(GENERAL_EM, "magnification_indicated"), Casters.FLOAT, UnitCode.UNITLESS),
            of(path("microscope"), path(GENERAL_EM, "microscope_name"), Casters.STRING),
            of(path("probe_area"), path(GENERAL_EM, "probe_area"), Casters.FLOAT, UnitCode.NANO_M2),

            // stage
            of(path("Stage", "rotation"), path(GENERAL_EM, "stage_position", "rotation"), Casters.FLOAT, UnitCode.DEG),
            of(path("Stage", "tilt_alpha"), path(GENERAL_EM, "stage_position", "tilt_alpha"), Casters.FLOAT, UnitCode.DEG),
            of(path("Stage", "tilt_beta"), path(GENERAL_EM, "stage_position", "tilt_beta"), Casters.FLOAT, UnitCode.DEG),
            of(path("Stage", "x"), path(GENERAL_EM, "stage_position", "x"), Casters.FLOAT, UnitCode.MILLI_M),
            of(path("Stage", "y"), path(GENERAL_EM, "stage_position", "y"), Casters.FLOAT, UnitCode.MILLI_M),
            of(path("Stage", "z"), path(GENERAL_EM, "stage_position", "z"), Casters.FLOAT, UnitCode.MILLI_M),

            // TEM 只有 camera length，SEM 只有 working distance
            of(path("camera_length"), path(TEM, "camera_length"), Casters.FLOAT, UnitCode.MILLI_M),
            of(path("working_distance"), path(SEM, "working_distance"), Casters.FLOAT, UnitCode.MILLI_M),

            of(path("detector_type"), path(GENERAL_EM, "detector_name"), Casters.STRING)
    );

    /** 源根：Acquisition_instrument.{SEM|TEM}.Detector */
    public static final List<MappingRule> DETECTOR = List.of(
            // EDS
            of(path("EDS", "azimuth_angle"), path(EDS, "azimuth_angle"), Casters.FLOAT, UnitCode.DEG),
            of(path("EDS", "elevation_angle"), path(EDS, "elevation_angle"), Casters.FLOAT, UnitCode.DEG),
            of(path("EDS", "energy_resolution_MnKa"), path(EDS, "energy_resolution_MnKa"), Casters.FLOAT, UnitCode.EV),
            of(path("EDS", "live_time"), path(EDS, "live_time"), Casters.FLOAT, UnitCode.SEC),
            of(path("EDS", "real_time"), path(EDS, "real_time"), Casters.FLOAT, UnitCode.SEC),

            // EELS
            of(path("EELS", "aperture_size"), path(EELS, "aperture_size"), Casters.FLOAT, UnitCode.MILLI_M),
            of(path("EELS", "collection_angle"), path(EELS, "collection_angle"), Casters.FLOAT, UnitCode.MILLI_RAD),
            of(path("EELS", "dwell_time"), path(GENERAL_EM, "dwell_time"), Casters.FLOAT, UnitCode.SEC),
            of(path("EELS", "exposure"), path(GENERAL_EM, "exposure_time"), Casters.FLOAT, UnitCode.SEC),
            of(path("EELS", "frame_number"), path(EELS, "number_of_samples"), Casters.INT, UnitCode.NUM),
            of(path("EELS", "spectrometer"), path(EELS, "spectrometer_name"), Casters.STRING)
    );

    /** 源根：structured metadata 根节点 */
    public static final List<MappingRule> GENERAL_INFO = List.of(
            of(path("Sample", "elements"), path(GENERAL_EM, "elements"), Casters.LIST),
            of(path("General", "date"), path(GENERAL, "date"), Casters.STRING),
            of(path("General", "doi"), path(GENERAL, "doi"), Casters.STRING),
            of(path("General", "original_filename"), path(GENERAL, "original_filename"), Casters.STRING),
            of(path("General", "notes"), path(GENERAL, "notes"), Casters.STRING),
            of(path("General", "time"), path(GENERAL, "time"), Casters.STRING),
            of(path("General", "time_zone"), path(GENERAL, "time_zone"), Casters.STRING),
            of(path("General", "title"), path(GENERAL, "title"), Casters.STRING)
    );
}
