package com.example.microscopy.rule;

import com.example.microscopy.model.UnitCode;

import java.util.List;

import static com.example.microscopy.model.RecordSections.EDS;
import static com.example.microscopy.rule.MappingRule.of;
import static com.example.microscopy.rule.MappingRule.path;

/**
 * 阶段 C：DM tag 树里的 EDS 字段，源根为 tag 根下的 "EDS"。
 */
public final class EdsTagRules {

    private EdsTagRules() {}

    public static final List<String> BASE = path("EDS");

    public static final List<MappingRule> RULES = List.of(
            of(path("Detector Info", "Azimuthal angle"), path(EDS, "azimuth_angle"), Casters.FLOAT, UnitCode.DEG),
            of(path("Detector Info", "Detector type"), path(EDS, "detector_type"), Casters.STRING),
            of(path("Acquisition", "Dispersion (eV)"), path(EDS, "dispersion_per_channel"), Casters.FLOAT, UnitCode.EV),
            of(path("Detector Info", "Elevation angle"), path(EDS, "elevation_angle"), Casters.FLOAT, UnitCode.DEG),
            of(path("Detector Info", "Incidence angle"), path(EDS, "incidence_angle"), Casters.FLOAT, UnitCode.DEG),
            of(path("Live time"), path(EDS, "live_time"), Casters.FLOAT, UnitCode.SEC),
            of(path("Real time"), path(EDS, "real_time"), Casters.FLOAT, UnitCode.SEC),
            of(path("Detector Info", "Solid angle"), path(EDS, "solid_angle"), Casters.FLOAT, UnitCode.SR),
            of(path("Detector Info", "Stage tilt"), path(EDS, "stage_tilt"), Casters.FLOAT, UnitCode.DEG)
    );
}
