package pyjs.parse;

public enum PyTokenKind {
	IDENTIFIER,
	KEYWORD,
	INTEGER,
	FLOAT,
	STRING,
	OPERATOR,
	DELIMITER,
	NEWLINE,
	INDENT,
	DEDENT,
	END_OF_INPUT
}
