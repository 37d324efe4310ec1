/**
 * Declarative rules and tactic/technique patterns.
 *
 * <p>
 * Payload definitions ({@link com.quorum.core.rules.RuleDefinition},
 * {@link com.quorum.core.rules.PatternDefinition}) are compiled by
 * {@link com.quorum.core.rules.ConditionCompiler} into small immutable
 * {@link com.quorum.core.rules.Condition} trees walked recursively at
 * detection time. No scripting engine is involved, so rule updates stay data
 * only.
 * </p>
 *
 * @since 1.0.0
 */
package com.quorum.core.rules;
