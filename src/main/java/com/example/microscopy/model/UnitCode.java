package com.example.microscopy.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 输出中使用的单位代码（受控词表，取自 http://qudt.org/vocab/unit/）。
 * 序列化时输出 code，例如 "KiloEV"。
 */
public enum UnitCode {
    NANO_A("NanoA"),
    KILO_EV("KiloEV"),
    EV("EV"),
    MILLI_RAD("MilliRAD"),
    DEG("DEG"),
    MILLI_M("MilliM"),
    MICRO_M("MicroM"),
    NANO_M2("NanoM2"),
    SEC("SEC"),
    V("V"),
    SR("SR"),
    UNITLESS("UNITLESS"),
    NUM("NUM"),
    MICRO_A("MicroA");

    private final String code;

    UnitCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
