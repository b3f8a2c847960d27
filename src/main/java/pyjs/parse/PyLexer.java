package pyjs.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the supported Python subset.
 *
 * Notes:
 * - Synthesizes INDENT/DEDENT from the leading whitespace of each logical line.
 * - A tab advances the indentation width to the next multiple of the configured tab width.
 * - Blank lines, comment-only lines and line breaks inside brackets produce no NEWLINE.
 * - Triple-quoted strings are rejected.
 */
public final class PyLexer {
	public static final Set<String> KEYWORDS = Set.of(
			"def", "class", "if", "elif", "else", "for", "in", "while", "return", "and", "or", "not",
			"True", "False", "None", "pass", "break", "continue",
			// reserved, rejected by the parser
			"import", "from", "as", "is", "lambda", "try", "except", "finally", "raise", "with", "yield",
			"global", "nonlocal", "del", "assert", "async", "await");

	private static final List<String> TWO_CHAR_OPERATORS = List.of(
			"**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=");
	private static final String ONE_CHAR_OPERATORS = "+-*/%<>=";
	private static final String DELIMITERS = "()[]{},:.";

	private final int tabWidth;

	public PyLexer() {
		this(4);
	}

	public PyLexer(int tabWidth) {
		if (tabWidth < 1) {
			throw new IllegalArgumentException("tab width must be positive: " + tabWidth);
		}
		this.tabWidth = tabWidth;
	}

	public List<PyToken> lex(String input) {
		String normalized = input.replace("\r\n", "\n").replace('\r', '\n');
		return new Scan(normalized, tabWidth).run();
	}

	private static final class Scan {
		private final String input;
		private final int tabWidth;
		private final List<PyToken> tokens = new ArrayList<>();
		private final Deque<Integer> indents = new ArrayDeque<>();
		private final Deque<PyToken> brackets = new ArrayDeque<>();
		private int pos;
		private int line = 1;
		private int column = 1;
		private boolean atLineStart = true;
		private boolean lineHasTokens;

		Scan(String input, int tabWidth) {
			this.input = input;
			this.tabWidth = tabWidth;
			indents.push(0);
		}

		List<PyToken> run() {
			while (pos < input.length()) {
				if (atLineStart && brackets.isEmpty()) {
					if (!readIndentation()) {
						continue;
					}
				}

				char c = input.charAt(pos);

				if (c == ' ' || c == '\t' || c == '\f') {
					advance();
					continue;
				}

				if (c == '#') {
					skipComment();
					continue;
				}

				if (c == '\\' && peek(1) == '\n') {
					advance();
					advance();
					continue;
				}

				if (c == '\n') {
					if (brackets.isEmpty()) {
						if (lineHasTokens) {
							tokens.add(new PyToken(PyTokenKind.NEWLINE, "", line, column));
						}
						lineHasTokens = false;
						atLineStart = true;
					}
					advance();
					continue;
				}

				if (c == '"' || c == '\'') {
					readString(c);
					continue;
				}

				if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
					readNumber();
					continue;
				}

				if (isIdentifierStart(c)) {
					readIdentifier();
					continue;
				}

				String two = pos + 1 < input.length() ? input.substring(pos, pos + 2) : "";
				if (TWO_CHAR_OPERATORS.contains(two)) {
					emit(PyTokenKind.OPERATOR, two, line, column);
					advance();
					advance();
					continue;
				}

				if (ONE_CHAR_OPERATORS.indexOf(c) >= 0) {
					emit(PyTokenKind.OPERATOR, String.valueOf(c), line, column);
					advance();
					continue;
				}

				if (DELIMITERS.indexOf(c) >= 0) {
					readDelimiter(c);
					continue;
				}

				throw new LexException("unexpected character '" + c + "'", line, column);
			}

			if (!brackets.isEmpty()) {
				PyToken open = brackets.peek();
				throw new LexException("'" + open.lexeme() + "' was never closed", open.line(), open.column());
			}
			if (lineHasTokens) {
				tokens.add(new PyToken(PyTokenKind.NEWLINE, "", line, column));
			}
			while (indents.peek() > 0) {
				indents.pop();
				tokens.add(new PyToken(PyTokenKind.DEDENT, "", line, column));
			}
			tokens.add(new PyToken(PyTokenKind.END_OF_INPUT, "", line, column));
			return tokens;
		}

		/**
		 * Measures the leading whitespace of a line and emits INDENT/DEDENT. Returns false when the line is
		 * blank or holds only a comment; such a line has been consumed entirely.
		 */
		private boolean readIndentation() {
			int width = 0;
			while (pos < input.length()) {
				char c = input.charAt(pos);
				if (c == ' ') {
					width++;
				} else if (c == '\t') {
					width = (width / tabWidth + 1) * tabWidth;
				} else if (c == '\f') {
					width = 0;
				} else {
					break;
				}
				advance();
			}

			if (pos >= input.length()) {
				return false;
			}
			char c = input.charAt(pos);
			if (c == '#') {
				skipComment();
			}
			if (pos < input.length() && input.charAt(pos) == '\n') {
				advance();
				return false;
			}
			if (pos >= input.length()) {
				return false;
			}

			atLineStart = false;
			int current = indents.peek();
			if (width > current) {
				indents.push(width);
				tokens.add(new PyToken(PyTokenKind.INDENT, "", line, column));
			} else if (width < current) {
				while (indents.peek() > width) {
					indents.pop();
					tokens.add(new PyToken(PyTokenKind.DEDENT, "", line, column));
				}
				if (indents.peek() != width) {
					throw new LexException("inconsistent indentation: width " + width
							+ " does not match any enclosing block", line, column);
				}
			}
			return true;
		}

		private void readString(char quote) {
			int startLine = line;
			int startColumn = column;
			if (peek(1) == quote && peek(2) == quote) {
				throw new LexException("triple-quoted strings are not supported", startLine, startColumn);
			}
			advance();

			StringBuilder value = new StringBuilder();
			while (true) {
				if (pos >= input.length() || input.charAt(pos) == '\n') {
					throw new LexException("unterminated string literal", startLine, startColumn);
				}
				char c = input.charAt(pos);
				if (c == quote) {
					advance();
					break;
				}
				if (c == '\\' && pos + 1 < input.length()) {
					char n = input.charAt(pos + 1);
					advance();
					advance();
					switch (n) {
						case 'n' -> value.append('\n');
						case 't' -> value.append('\t');
						case 'r' -> value.append('\r');
						case '0' -> value.append('\0');
						case '\\', '\'', '"' -> value.append(n);
						case '\n' -> {
							// escaped line break continues the literal
						}
						default -> value.append('\\').append(n);
					}
					continue;
				}
				value.append(c);
				advance();
			}
			emit(PyTokenKind.STRING, value.toString(), startLine, startColumn);
		}

		private void readNumber() {
			int start = pos;
			int startColumn = column;
			boolean isFloat = false;

			while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
				advance();
			}
			if (pos < input.length() && input.charAt(pos) == '.' && !isIdentifierStart(peek(1))) {
				isFloat = true;
				advance();
				while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
					advance();
				}
			}
			if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
				char n = peek(1);
				boolean signed = (n == '+' || n == '-') && Character.isDigit(peek(2));
				if (Character.isDigit(n) || signed) {
					isFloat = true;
					advance();
					if (signed) {
						advance();
					}
					while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
						advance();
					}
				}
			}
			if (pos < input.length() && isIdentifierStart(input.charAt(pos))) {
				throw new LexException("invalid numeric literal '" + input.substring(start, pos + 1) + "'",
						line, startColumn);
			}

			emit(isFloat ? PyTokenKind.FLOAT : PyTokenKind.INTEGER, input.substring(start, pos), line, startColumn);
		}

		private void readIdentifier() {
			int start = pos;
			int startColumn = column;
			while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
				advance();
			}
			String word = input.substring(start, pos);
			emit(KEYWORDS.contains(word) ? PyTokenKind.KEYWORD : PyTokenKind.IDENTIFIER, word, line, startColumn);
		}

		private void readDelimiter(char c) {
			PyToken token = new PyToken(PyTokenKind.DELIMITER, String.valueOf(c), line, column);
			if (c == '(' || c == '[' || c == '{') {
				brackets.push(token);
			} else if (c == ')' || c == ']' || c == '}') {
				if (brackets.isEmpty() || closerOf(brackets.peek().lexeme().charAt(0)) != c) {
					throw new LexException("unmatched '" + c + "'", line, column);
				}
				brackets.pop();
			}
			tokens.add(token);
			lineHasTokens = true;
			advance();
		}

		private void skipComment() {
			while (pos < input.length() && input.charAt(pos) != '\n') {
				advance();
			}
		}

		private void emit(PyTokenKind kind, String lexeme, int tokenLine, int tokenColumn) {
			tokens.add(new PyToken(kind, lexeme, tokenLine, tokenColumn));
			lineHasTokens = true;
		}

		private char peek(int offset) {
			int i = pos + offset;
			return i < input.length() ? input.charAt(i) : '\0';
		}

		private void advance() {
			if (input.charAt(pos) == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
			pos++;
		}

		private static char closerOf(char open) {
			return switch (open) {
				case '(' -> ')';
				case '[' -> ']';
				default -> '}';
			};
		}

		private static boolean isIdentifierStart(char c) {
			return c == '_' || Character.isLetter(c);
		}

		private static boolean isIdentifierPart(char c) {
			return c == '_' || Character.isLetterOrDigit(c);
		}
	}
}
