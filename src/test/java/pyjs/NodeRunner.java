package pyjs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Runs generated JavaScript with NodeJS for the execution tests.
 */
final class NodeRunner {
	private static Boolean available;

	private NodeRunner() {
	}

	/**
	 * Whether a {@code node} executable can be started. Checked once per test run.
	 */
	static synchronized boolean isAvailable() {
		if (available == null) {
			try {
				Process process = new ProcessBuilder("node", "--version").redirectErrorStream(true).start();
				available = process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
			} catch (IOException e) {
				available = false;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				available = false;
			}
		}
		return available;
	}

	/**
	 * Evaluates {@code source} and returns everything it printed, with line separators normalized to '\n'.
	 *
	 * @throws IOException if node cannot be started or exits with a non-zero code
	 */
	static String run(String source) throws IOException, InterruptedException {
		ProcessBuilder processBuilder = new ProcessBuilder("node", "-e", source);
		processBuilder.redirectErrorStream(true);

		Process process = processBuilder.start();

		StringBuilder output = new StringBuilder();
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				output.append(line).append("\n");
			}
		}

		int exitCode = process.waitFor();
		if (exitCode != 0) {
			throw new IOException("NodeJS process exited with code " + exitCode + ":\n" + output);
		}
		return output.toString();
	}
}
