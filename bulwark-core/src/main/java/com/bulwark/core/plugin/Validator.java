package com.bulwark.core.plugin;

/**
 * The plugin interface that all Bulwark security validators implement.
 * Each validator focuses on one kind of check and is registered under a unique name.
 *
 * <p>
 * Validators run concurrently with each other and must treat the context as read-only.
 * Throwing is allowed: the engine logs the failure and counts the validator as
 * contributing nothing, so one broken check never aborts a review.
 * </p>
 *
 * <p>
 * In a Spring application, annotate an implementation with {@code @Component("name")};
 * the bean name becomes the validator name.
 * </p>
 */
@FunctionalInterface
public interface Validator {

    /**
     * Inspect the target described by the context.
     *
     * @param context What to inspect
     * @return Findings and vulnerabilities. Return {@link ValidationResult#empty()} when nothing was found.
     */
    ValidationResult check(ValidationContext context) throws Exception;
}
