package pyjs.analysis;

/**
 * Coarse static type of an expression. {@link #UNKNOWN} is the answer whenever inference is not certain.
 */
public enum InferredType {
	NUMBER,
	STRING,
	BOOL,
	LIST,
	DICT,
	UNKNOWN;

	public boolean isKnown() {
		return this != UNKNOWN;
	}

	/**
	 * Numbers and booleans mix freely in arithmetic.
	 */
	public boolean isNumeric() {
		return this == NUMBER || this == BOOL;
	}

	public String displayName() {
		return name().toLowerCase();
	}
}
