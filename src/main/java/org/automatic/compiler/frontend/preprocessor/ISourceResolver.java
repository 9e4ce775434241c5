package org.automatic.compiler.frontend.preprocessor;

import java.io.IOException;
import java.util.Optional;

/**
 * Finds the text of a unit named by an {@code #INCLUDE} directive.
 */
@FunctionalInterface
public interface ISourceResolver {

    /**
     * A resolved unit.
     *
     * @param logicalName The name used for diagnostics and to splice each unit only once.
     * @param content The full text of the unit.
     */
    record ResolvedSource(String logicalName, String content) {}

    /**
     * Resolves an include target.
     *
     * @param target The path as written in the directive.
     * @param includingUnit The logical name of the unit containing the directive.
     * @return The unit, or empty if it cannot be found.
     * @throws IOException if the unit exists but cannot be read.
     */
    Optional<ResolvedSource> resolve(String target, String includingUnit) throws IOException;
}
