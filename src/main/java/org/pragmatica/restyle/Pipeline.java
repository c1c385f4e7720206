package org.pragmatica.restyle;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.restyle.codec.Document;
import org.pragmatica.restyle.comment.Comment;
import org.pragmatica.restyle.error.FailureMode;
import org.pragmatica.restyle.error.RestyleError;
import org.pragmatica.restyle.error.RestyleException;
import org.pragmatica.restyle.rule.Rule;
import org.pragmatica.restyle.rule.RuleContext;
import org.pragmatica.restyle.rule.Rules;
import org.pragmatica.restyle.tree.Node;
import org.pragmatica.restyle.zipper.Zipper;
import org.pragmatica.restyle.zipper.ZipperMisuseException;

import java.util.List;

/**
 * Runs rules in declared order, each over the whole tree, feeding each rule's tree and comments
 * into the next.
 *
 * <p>A rule that throws is abandoned as a whole: with {@link FailureMode#LOG} the failure is
 * logged and the tree and comments as they stood before that rule go on to the next rule; with
 * {@link FailureMode#RAISE} a {@link RestyleException} carrying a
 * {@link RestyleError.RuleFailure} is thrown. Structural misuse of the zipper
 * ({@link ZipperMisuseException}) always propagates.
 */
public final class Pipeline {
    private static final Logger logger = LogManager.getLogger(Pipeline.class);

    private final ImmutableList<Rule> rules;
    private final RestyleConfig config;

    private Pipeline(ImmutableList<Rule> rules, RestyleConfig config) {
        this.rules = rules;
        this.config = config;
    }

    /**
     * Pipeline over the built-in rules selected by the configuration.
     */
    public static Pipeline create(RestyleConfig config) {
        return new Pipeline(Rules.select(config.enabledRules()), config);
    }

    public static Pipeline of(RestyleConfig config, List<? extends Rule> rules) {
        return new Pipeline(ImmutableList.copyOf(rules), config);
    }

    public static Pipeline of(RestyleConfig config, Rule... rules) {
        return of(config, List.of(rules));
    }

    public ImmutableList<Rule> rules() {
        return rules;
    }

    public Document run(Document document, String file) {
        return run(document.tree(), document.comments(), file);
    }

    public Document run(Node tree, List<Comment> comments, String file) {
        var current = Document.of(tree, comments);
        for (var rule : rules) {
            current = apply(rule, current, file);
        }
        return current;
    }

    private Document apply(Rule rule, Document input, String file) {
        logger.debug("Running rule {} on {}", rule.name(), file);
        try {
            var visit = Zipper.zip(input.tree())
                              .traverseWhile(RuleContext.initial(input.comments(), file, config), rule::run);
            var output = Document.of(visit.zipper().root(), visit.acc().comments());
            logger.debug("Finished rule {} on {}", rule.name(), file);
            return output;
        } catch (ZipperMisuseException e) {
            throw e;
        } catch (RuntimeException e) {
            var failure = new RestyleError.RuleFailure(rule.name(), file, e);
            if (config.onError() == FailureMode.RAISE) {
                throw new RestyleException(failure);
            }
            logger.error("{}. Skipping rule and continuing", failure.message(), e);
            return input;
        }
    }
}
