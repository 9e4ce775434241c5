package org.automatic.compiler.util;

import org.automatic.compiler.api.ProgramArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for dumping debug information during compilation.
 */
public final class DebugDump {

	private static final Logger LOG = LoggerFactory.getLogger(DebugDump.class);
	private static final Path DUMP_ROOT = Path.of("build", "compiler-dumps");

	private DebugDump() {}

	/**
	 * Writes the IR of an artifact to {@code build/compiler-dumps/<program>/module.ll}.
	 * @param artifact The program artifact to dump.
	 * @return The written file, or {@code null} if it could not be written.
	 */
	public static Path dumpProgramArtifact(ProgramArtifact artifact) {
		return dumpProgramArtifact(DUMP_ROOT, artifact);
	}

	/**
	 * Writes the IR of an artifact below the given root directory.
	 * @param root The dump root directory.
	 * @param artifact The program artifact to dump.
	 * @return The written file, or {@code null} if it could not be written.
	 */
	public static Path dumpProgramArtifact(Path root, ProgramArtifact artifact) {
		Path dir = root.resolve(sanitize(artifact.programName()));
		Path file = dir.resolve("module.ll");
		try {
			Files.createDirectories(dir);
			Files.writeString(file, artifact.irText(), StandardCharsets.UTF_8);
			LOG.debug("Dumped IR of '{}' to {}", artifact.programName(), file);
			return file;
		} catch (IOException e) {
			LOG.warn("Could not write debug dump for '{}' to {}: {}", artifact.programName(), file, e.getMessage());
			return null;
		}
	}

	static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
