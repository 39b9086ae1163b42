package org.termkit.model;

import org.termkit.expressions.Declaration;
import org.termkit.expressions.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 以 Map 存储解释的不可变模型。通过 {@link #builder()} 构造。
 */
public final class SimpleModel implements Model {

    private static final Logger logger = LoggerFactory.getLogger(SimpleModel.class);

    private final Map<Declaration, FuncInterpretation> interpretations;

    private SimpleModel(Map<Declaration, FuncInterpretation> interpretations) {
        this.interpretations = Collections.unmodifiableMap(new LinkedHashMap<>(interpretations));
        logger.info("创建 SimpleModel，包含 {} 个解释", this.interpretations.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 空模型：没有任何解释。
     */
    public static SimpleModel empty() {
        return new SimpleModel(Collections.emptyMap());
    }

    @Override
    public FuncInterpretation interpretation(Declaration decl) {
        return interpretations.get(decl);
    }

    @Override
    public Set<Declaration> getDeclarations() {
        return interpretations.keySet();
    }

    @Override
    public String toString() {
        return interpretations.values().stream()
                .map(FuncInterpretation::toString)
                .collect(Collectors.joining("\n  ", "Model(\n  ", "\n)"));
    }

    public static final class Builder {

        private final Map<Declaration, FuncInterpretation> interpretations = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 为常量声明指定取值。
         */
        public Builder constant(Declaration decl, Expr value) {
            return function(FuncInterpretation.constant(decl, value));
        }

        /**
         * 登记一个函数解释，同一声明重复登记时后者覆盖前者。
         */
        public Builder function(FuncInterpretation interpretation) {
            Objects.requireNonNull(interpretation, "Interpretation cannot be null");
            FuncInterpretation previous = interpretations.put(interpretation.getDecl(), interpretation);
            if (previous != null) {
                logger.warn("声明 {} 的解释被覆盖: {} -> {}", interpretation.getDecl().getName(), previous, interpretation);
            }
            return this;
        }

        public SimpleModel build() {
            return new SimpleModel(interpretations);
        }
    }
}
