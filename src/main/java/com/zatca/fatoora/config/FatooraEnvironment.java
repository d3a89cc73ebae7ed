package com.zatca.fatoora.config;

/**
 * Fatoora environment types
 */
public enum FatooraEnvironment {
    SANDBOX("sandbox"),
    SIMULATION("simulation"),
    PRODUCTION("production");
    
    private final String value;
    
    FatooraEnvironment(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static FatooraEnvironment fromString(String value) {
        if (value == null) {
            return SANDBOX;
        }
        
        for (FatooraEnvironment env : FatooraEnvironment.values()) {
            if (env.value.equalsIgnoreCase(value)) {
                return env;
            }
        }
        throw new IllegalArgumentException("Unknown environment: " + value);
    }
}
