package ai.sleepy.notation.analyze;

/**
 * Breakpoints for {@link Complexity}. A level applies when the endpoint count or the table
 * count is strictly greater than its threshold; levels are checked from the top down.
 */
public record ComplexityThresholds(int enterpriseEndpoints,
                                   int enterpriseTables,
                                   int complexEndpoints,
                                   int complexTables,
                                   int moderateEndpoints,
                                   int moderateTables) {

    public static final int DEFAULT_ENTERPRISE_ENDPOINTS = 10;
    public static final int DEFAULT_ENTERPRISE_TABLES = 5;
    public static final int DEFAULT_COMPLEX_ENDPOINTS = 5;
    public static final int DEFAULT_COMPLEX_TABLES = 2;
    public static final int DEFAULT_MODERATE_ENDPOINTS = 0;
    public static final int DEFAULT_MODERATE_TABLES = 0;

    public ComplexityThresholds {
        if (enterpriseEndpoints < 0 || enterpriseTables < 0 || complexEndpoints < 0
                || complexTables < 0 || moderateEndpoints < 0 || moderateTables < 0) {
            throw new IllegalArgumentException("Complexity thresholds must not be negative");
        }
        if (enterpriseEndpoints < complexEndpoints || complexEndpoints < moderateEndpoints
                || enterpriseTables < complexTables || complexTables < moderateTables) {
            throw new IllegalArgumentException("Complexity thresholds must not decrease from moderate to enterprise");
        }
    }

    public static ComplexityThresholds defaults() {
        return new ComplexityThresholds(DEFAULT_ENTERPRISE_ENDPOINTS, DEFAULT_ENTERPRISE_TABLES,
                DEFAULT_COMPLEX_ENDPOINTS, DEFAULT_COMPLEX_TABLES,
                DEFAULT_MODERATE_ENDPOINTS, DEFAULT_MODERATE_TABLES);
    }

    public Complexity classify(int endpoints, int tables) {
        if (endpoints > enterpriseEndpoints || tables > enterpriseTables) {
            return Complexity.ENTERPRISE;
        }
        if (endpoints > complexEndpoints || tables > complexTables) {
            return Complexity.COMPLEX;
        }
        if (endpoints > moderateEndpoints || tables > moderateTables) {
            return Complexity.MODERATE;
        }
        return Complexity.SIMPLE;
    }
}
