package pyjs;

/**
 * Translation settings.
 *
 * @param indent   one level of indentation in the generated JavaScript
 * @param tabWidth indentation width a tab in the Python source advances to a multiple of
 */
public record CompilerOptions(String indent, int tabWidth) {
	public CompilerOptions {
		if (indent == null || indent.isEmpty() || !indent.isBlank()) {
			throw new IllegalArgumentException("indent must be non-empty whitespace: '" + indent + "'");
		}
		if (tabWidth < 1) {
			throw new IllegalArgumentException("tab width must be positive: " + tabWidth);
		}
	}

	public CompilerOptions() {
		this("  ", 4);
	}
}
