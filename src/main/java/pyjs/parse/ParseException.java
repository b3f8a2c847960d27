package pyjs.parse;

import pyjs.CompileException;
import pyjs.Diagnostic;

import java.util.List;

/**
 * Thrown by {@link PyParser} on the first unexpected token.
 */
public class ParseException extends CompileException {
	private final List<String> expectedOneOf;
	private final String found;

	public ParseException(List<String> expectedOneOf, PyToken found) {
		this(describeExpected(expectedOneOf) + " but found " + describe(found), expectedOneOf, found);
	}

	public ParseException(String message, PyToken at) {
		this(message, List.of(), at);
	}

	private ParseException(String message, List<String> expectedOneOf, PyToken found) {
		super(message, found.line(), found.column());
		this.expectedOneOf = List.copyOf(expectedOneOf);
		this.found = describe(found);
	}

	public List<String> getExpectedOneOf() {
		return expectedOneOf;
	}

	public String getFound() {
		return found;
	}

	@Override
	public Diagnostic.Stage getStage() {
		return Diagnostic.Stage.PARSE;
	}

	private static String describeExpected(List<String> expected) {
		if (expected.size() == 1) {
			return "expected " + expected.get(0);
		}
		return "expected one of " + String.join(", ", expected);
	}

	static String describe(PyToken t) {
		return switch (t.kind()) {
			case NEWLINE -> "end of line";
			case INDENT -> "indent";
			case DEDENT -> "dedent";
			case END_OF_INPUT -> "end of input";
			case STRING -> "string literal";
			default -> "'" + t.lexeme() + "'";
		};
	}
}
