package org.pragmatica.restyle.rule;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.restyle.RestyleConfig;
import org.pragmatica.restyle.comment.Comment;

import java.util.List;
import java.util.Optional;

/**
 * State threaded through one rule's traversal: the comment ledger, the file being rewritten,
 * the run configuration and free-form accumulators a rule may keep between visits.
 */
public record RuleContext(
    ImmutableList<Comment> comments,
    String file,
    RestyleConfig config,
    ImmutableMap<String, Object> accumulators
) {
    public static RuleContext initial(List<Comment> comments, String file, RestyleConfig config) {
        return new RuleContext(ImmutableList.copyOf(comments), file, config, ImmutableMap.of());
    }

    public RuleContext withComments(List<Comment> updated) {
        return new RuleContext(ImmutableList.copyOf(updated), file, config, accumulators);
    }

    public RuleContext put(String key, Object value) {
        var builder = ImmutableMap.<String, Object>builder();
        builder.putAll(accumulators);
        builder.put(key, value);
        return new RuleContext(comments, file, config, builder.buildKeepingLast());
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.ofNullable(accumulators.get(key))
                       .filter(type::isInstance)
                       .map(type::cast);
    }
}
