package org.quarry.formula.api;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves {@code @Name} mentions to external entities. Implementations may perform
 * network-bound lookups; the returned future may complete exceptionally.
 */
@FunctionalInterface
public interface MentionResolver {

    /** A resolver that never finds anything. */
    MentionResolver NONE = name -> CompletableFuture.completedFuture(Optional.empty());

    /**
     * Resolves a mention by name.
     * @param name The mention name without the leading {@code @}.
     * @return A future with the entity, or an empty optional if nothing matches.
     */
    CompletableFuture<Optional<MentionEntity>> resolveMention(String name);
}
