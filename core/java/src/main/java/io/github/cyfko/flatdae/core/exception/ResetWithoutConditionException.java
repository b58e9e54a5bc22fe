package io.github.cyfko.flatdae.core.exception;

/**
 * Exception thrown when a {@code reinit(x, expr)} statement has no triggering condition.
 * <p>
 * The supported grammar has no {@code when}-equation, so conditions are never inferred:
 * they must be supplied per reset name through
 * {@link io.github.cyfko.flatdae.core.config.FlattenPolicy#resetConditions()}.
 * </p>
 *
 * <pre>{@code
 * FlattenPolicy policy = FlattenPolicy.builder()
 *     .resetCondition("__c0", "h < 0")
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ResetWithoutConditionException extends FlatteningException {

    private final String resetName;
    private final String target;

    /**
     * @param resetName generated reset name
     * @param target    reinitialized state
     */
    public ResetWithoutConditionException(String resetName, String target) {
        super(String.format(
                "Reset without condition: reinit(%s, ...) is registered as '%s' but no condition was supplied for it",
                target, resetName));
        this.resetName = resetName;
        this.target = target;
    }

    public String getResetName() {
        return resetName;
    }

    public String getTarget() {
        return target;
    }
}
