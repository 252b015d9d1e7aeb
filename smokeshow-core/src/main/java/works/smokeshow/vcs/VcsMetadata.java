package works.smokeshow.vcs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Version-control details of the code under test, where they can be discovered.
 */
@Value
@Accessors(fluent = true)
public class VcsMetadata {
	@Nullable String commitSha;
	@Nullable String branch;

	public static VcsMetadata none() {
		return new VcsMetadata(null, null);
	}

	/**
	 * Asks <code>git</code> about the working directory.
	 * Any detail that can't be determined is left null; this never throws.
	 */
	public static VcsMetadata fromGit() {
		return new VcsMetadata(
			git("rev-parse", "HEAD"),
			git("rev-parse", "--abbrev-ref", "HEAD"));
	}

	private static @Nullable String git(String... args) {
		List<String> command = new ArrayList<>();
		command.add("git");
		command.addAll(List.of(args));
		return run(command, GIT_TIMEOUT_SECONDS);
	}

	/**
	 * Runs <code>command</code> and returns its trimmed standard output,
	 * or null if it fails, prints nothing, or doesn't exit within <code>timeoutSeconds</code>.
	 * The process is not left running.
	 */
	static @Nullable String run(List<String> command, long timeoutSeconds) {
		Process process = null;
		try {
			process = new ProcessBuilder(command)
				.redirectError(ProcessBuilder.Redirect.DISCARD)
				.start();
			process.getOutputStream().close();
			if (!process.waitFor(timeoutSeconds, SECONDS)) {
				LOGGER.debug("Timed out running {}", command);
				return null;
			}
			// Small output only; a command that fills the pipe buffer shows up as a timeout
			String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
			if (process.exitValue() != 0 || output.isEmpty()) {
				LOGGER.debug("{} exited with status {}", command, process.exitValue());
				return null;
			}
			return output;
		} catch (IOException e) {
			LOGGER.debug("Unable to run {}", command, e);
			return null;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			LOGGER.debug("Interrupted running {}", command, e);
			return null;
		} finally {
			if (process != null && process.isAlive()) {
				process.destroyForcibly();
			}
		}
	}

	private static final long GIT_TIMEOUT_SECONDS = 5;
	private static final Logger LOGGER = LoggerFactory.getLogger(VcsMetadata.class);
}
