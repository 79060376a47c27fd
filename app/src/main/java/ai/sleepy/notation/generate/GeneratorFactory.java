package ai.sleepy.notation.generate;

import java.util.Objects;

/**
 * Provides generator instances based on the desired mode.
 */
public class GeneratorFactory {

    private final NotationGenerator productionGenerator;
    private final NotationGenerator templateGenerator;

    public GeneratorFactory(NotationGenerator productionGenerator, NotationGenerator templateGenerator) {
        this.productionGenerator = Objects.requireNonNull(productionGenerator, "productionGenerator");
        this.templateGenerator = Objects.requireNonNull(templateGenerator, "templateGenerator");
    }

    public NotationGenerator select(GenerationMode mode) {
        return switch (mode) {
            case PRODUCTION -> productionGenerator;
            case TEMPLATE -> templateGenerator;
        };
    }

    public NotationGenerator fallback() {
        return templateGenerator;
    }
}
