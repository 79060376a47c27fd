package ai.sleepy.notation.analyze;

public enum Complexity {
    SIMPLE("Simple"),
    MODERATE("Moderate"),
    COMPLEX("Complex"),
    ENTERPRISE("Enterprise");

    private final String displayName;

    Complexity(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
