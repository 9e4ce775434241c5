package org.automatic.compiler.frontend.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves include targets against the file system and the classpath.
 * Lookup order: the directory of the including unit, the configured include paths,
 * then classpath resources.
 */
public class FileSystemSourceResolver implements ISourceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemSourceResolver.class);

    private final List<Path> includePaths;

    /**
     * @param includePaths Additional directories searched after the including unit's directory.
     */
    public FileSystemSourceResolver(List<Path> includePaths) {
        this.includePaths = List.copyOf(includePaths);
    }

    @Override
    public Optional<ResolvedSource> resolve(String target, String includingUnit) throws IOException {
        List<Path> candidates = new ArrayList<>();
        try {
            Path relative = Path.of(target);
            if (isFileUnit(includingUnit)) {
                Path including = Path.of(includingUnit).toAbsolutePath().getParent();
                if (including != null) {
                    candidates.add(including.resolve(relative));
                }
            }
            for (Path dir : includePaths) {
                candidates.add(dir.resolve(relative));
            }
        } catch (InvalidPathException e) {
            // A target the file system cannot name is not found anywhere, the classpath included.
            LOG.debug("Include target '{}' is not a valid path: {}", target, e.getReason());
            return Optional.empty();
        }
        for (Path candidate : candidates) {
            Path normalized = candidate.normalize();
            if (Files.isRegularFile(normalized)) {
                // Line endings are normalized to \n like the main unit.
                String content = String.join("\n", Files.readAllLines(normalized, StandardCharsets.UTF_8)) + "\n";
                return Optional.of(new ResolvedSource(normalized.toString().replace('\\', '/'), content));
            }
        }

        String resource = target.replace('\\', '/');
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                return Optional.empty();
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return Optional.of(new ResolvedSource("classpath:" + resource,
                        br.lines().collect(Collectors.joining("\n")) + "\n"));
            }
        }
    }

    private static boolean isFileUnit(String unitName) {
        return unitName != null && !unitName.startsWith("<") && !unitName.startsWith("classpath:");
    }
}
