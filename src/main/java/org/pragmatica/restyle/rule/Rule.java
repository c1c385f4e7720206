package org.pragmatica.restyle.rule;

import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.zipper.Visit;
import org.pragmatica.restyle.zipper.Zipper;

import java.util.function.UnaryOperator;

/**
 * A rewrite rule. The pipeline zips the whole tree and hands {@link #run} to
 * {@link Zipper#traverseWhile(Object, java.util.function.BiFunction)}, so the rule is called
 * once per visited node in pre-order and steers the walk with the returned command.
 *
 * <p>A rule that creates a node it would itself rewrite must re-dispatch on the replacement
 * before returning; the pipeline never re-runs a rule.
 */
public interface Rule {
    String name();

    Visit<RuleContext> run(Zipper zipper, RuleContext context);

    /**
     * Lift a pure node transform into a rule applied to every focus, always continuing.
     */
    static Rule lift(String name, UnaryOperator<Node> transform) {
        return new Lifted(name, transform);
    }

    record Lifted(String name, UnaryOperator<Node> transform) implements Rule {
        @Override
        public Visit<RuleContext> run(Zipper zipper, RuleContext context) {
            return Visit.cont(zipper.update(transform), context);
        }
    }
}
