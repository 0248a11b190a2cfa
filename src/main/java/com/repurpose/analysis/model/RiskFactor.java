package com.repurpose.analysis.model;

public record RiskFactor(String factor, String severity, String mitigation) {
    public static final String HIGH = "High";
    public static final String MODERATE = "Moderate";
    public static final String LOW = "Low";
}
