package com.example.brsr.model;

/**
 * ESG pillar an indicator contributes to.
 */
public enum Pillar {
    ENVIRONMENTAL("E"),
    SOCIAL("S"),
    GOVERNANCE("G");

    private final String code;

    Pillar(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Pillar fromCode(String code) {
        for (Pillar p : values()) {
            if (p.code.equalsIgnoreCase(code) || p.name().equalsIgnoreCase(code)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown pillar: " + code);
    }
}
