package com.pyformatter.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.pyformatter.api.error.LexException;
import com.pyformatter.util.LoggerUtil;

/**
 * Lossless tokenizer for Python source text.
 * The concatenated text of the returned tokens is always the input text. Each call
 * lexes from scratch, so the same lexer can be reused across files and threads.
 */
public class PythonLexer {
    private static final Logger logger = LoggerUtil.getLogger(PythonLexer.class);

    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield");

    // Longest first so that prefix matching picks the longest operator.
    private static final String[] MULTI_CHAR_OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=",
            "&=", "|=", "^=", "@=", "**", "//", "<<", ">>"
    };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    /**
     * Splits the text into tokens.
     *
     * @throws LexException on unterminated strings, unbalanced brackets or a backslash
     *                      that does not end its line
     */
    public List<Token> tokenize(String text) throws LexException {
        List<Token> tokens = new Scanner(text).run();
        logger.finest(() -> "Tokenized " + tokens.size() + " tokens");
        return tokens;
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    /**
     * Single-use scanning state for one tokenize call.
     */
    private static final class Scanner {
        private final String text;
        private final int length;
        private final List<Token> tokens = new ArrayList<>();
        private final Deque<Token> openBrackets = new ArrayDeque<>();

        private int pos = 0;
        private int line = 1;
        private int column = 1;
        private boolean atLineStart = true;
        private boolean continued = false;

        Scanner(String text) {
            this.text = text;
            this.length = text.length();
        }

        List<Token> run() throws LexException {
            while (pos < length) {
                if (atLineStart) {
                    _lineStart();
                    continue;
                }

                char c = text.charAt(pos);
                if (c == ' ' || c == '\t' || c == '\f') {
                    emit(TokenKind.WHITESPACE, _skipBlanks(pos));
                } else if (c == '\n' || c == '\r') {
                    emit(TokenKind.NEWLINE, _lineBreakEnd(pos));
                    atLineStart = true;
                } else if (c == '#') {
                    emit(TokenKind.COMMENT, _lineContentEnd(pos));
                } else if (c == '\\') {
                    _continuation();
                } else if (c == '"' || c == '\'') {
                    emit(TokenKind.STRING, _scanString(pos, false));
                } else if (_isIdentifierStart(text.codePointAt(pos))) {
                    _nameOrPrefixedString();
                } else if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(text.charAt(pos + 1)))) {
                    emit(TokenKind.NUMBER, _scanNumber(pos));
                } else if (c == '(' || c == '[' || c == '{') {
                    Token open = emit(TokenKind.OPEN_BRACKET, pos + 1);
                    openBrackets.push(open);
                } else if (c == ')' || c == ']' || c == '}') {
                    _closeBracket(c);
                } else {
                    emit(TokenKind.OPERATOR, _operatorEnd(pos));
                }
            }

            if (!openBrackets.isEmpty()) {
                Token open = openBrackets.peek();
                throw new LexException("'" + open.getText() + "' was never closed",
                        open.getLine(), open.getColumn());
            }
            return tokens;
        }

        private void _lineStart() {
            atLineStart = false;
            boolean statementStart = openBrackets.isEmpty() && !continued;
            continued = false;

            int end = _skipBlanks(pos);
            if (pos == 0 && end < length && text.charAt(end) == '\uFEFF') {
                end = _skipBlanks(end + 1);
            }
            if (end > pos) {
                emit(statementStart ? TokenKind.INDENT : TokenKind.WHITESPACE, end);
            }
        }

        private void _continuation() throws LexException {
            int next = pos + 1;
            if (next >= length || (text.charAt(next) != '\n' && text.charAt(next) != '\r')) {
                throw new LexException("unexpected character after line continuation character", line, column);
            }
            emit(TokenKind.CONTINUATION, _lineBreakEnd(next));
            atLineStart = true;
            continued = true;
        }

        private void _nameOrPrefixedString() throws LexException {
            int end = _scanIdentifier(pos);
            String word = text.substring(pos, end);
            if (end < length && _isQuote(text.charAt(end)) && _isStringPrefix(word)) {
                boolean formatted = word.toLowerCase().contains("f");
                emit(TokenKind.STRING, _scanString(end, formatted));
                return;
            }
            emit(isKeyword(word) ? TokenKind.KEYWORD : TokenKind.NAME, end);
        }

        private void _closeBracket(char close) throws LexException {
            if (openBrackets.isEmpty()) {
                throw new LexException("unmatched '" + close + "'", line, column);
            }
            Token open = openBrackets.pop();
            if (_closerFor(open.getText().charAt(0)) != close) {
                throw new LexException("closing parenthesis '" + close + "' does not match opening parenthesis '"
                        + open.getText() + "' on line " + open.getLine(), line, column);
            }
            emit(TokenKind.CLOSE_BRACKET, pos + 1);
        }

        /**
         * Returns the index just past the string literal whose opening quote is at {@code quotePos}.
         */
        private int _scanString(int quotePos, boolean formatted) throws LexException {
            char quote = text.charAt(quotePos);
            String tripleQuote = String.valueOf(quote).repeat(3);
            boolean triple = text.startsWith(tripleQuote, quotePos);
            int i = quotePos + (triple ? 3 : 1);

            while (i < length) {
                char ch = text.charAt(i);
                if (ch == '\\') {
                    i = i + 1 < length ? _escapedEnd(i + 1) : i + 1;
                    continue;
                }
                if (triple) {
                    if (text.startsWith(tripleQuote, i)) {
                        return i + 3;
                    }
                } else if (ch == quote) {
                    return i + 1;
                } else if (ch == '\n' || ch == '\r') {
                    break;
                }
                if (formatted && ch == '{') {
                    if (i + 1 < length && text.charAt(i + 1) == '{') {
                        i += 2;
                        continue;
                    }
                    i = _scanReplacementField(i + 1, quotePos);
                    continue;
                }
                i++;
            }
            throw _unterminated(quotePos, triple);
        }

        /**
         * Skips an f-string replacement field starting just after its '{'.
         * Nested brackets and string literals are honoured; after a top-level ':' the
         * format spec is scanned literally except for nested fields.
         */
        private int _scanReplacementField(int from, int quotePos) throws LexException {
            int depth = 0;
            boolean formatSpec = false;
            int i = from;

            while (i < length) {
                char ch = text.charAt(i);
                if (formatSpec) {
                    if (ch == '{') {
                        i = _scanReplacementField(i + 1, quotePos);
                        continue;
                    }
                    if (ch == '}') {
                        return i + 1;
                    }
                    i++;
                    continue;
                }

                if (_isQuote(ch)) {
                    i = _scanString(i, false);
                    continue;
                }
                if (_isIdentifierStart(text.codePointAt(i))) {
                    int end = _scanIdentifier(i);
                    String word = text.substring(i, end);
                    if (end < length && _isQuote(text.charAt(end)) && _isStringPrefix(word)) {
                        i = _scanString(end, word.toLowerCase().contains("f"));
                    } else {
                        i = end;
                    }
                    continue;
                }
                switch (ch) {
                    case '(', '[', '{' -> depth++;
                    case ')', ']' -> depth--;
                    case '}' -> {
                        if (depth == 0) {
                            return i + 1;
                        }
                        depth--;
                    }
                    case ':' -> {
                        boolean walrus = i + 1 < length && text.charAt(i + 1) == '=';
                        if (depth == 0 && !walrus) {
                            formatSpec = true;
                        }
                    }
                    default -> {
                        // other characters are expression text
                    }
                }
                i++;
            }
            throw _unterminated(quotePos, false);
        }

        private LexException _unterminated(int quotePos, boolean triple) {
            int[] position = _positionOf(quotePos);
            String what = triple ? "unterminated triple-quoted string literal" : "unterminated string literal";
            return new LexException(what, position[0], position[1]);
        }

        private int _scanNumber(int from) {
            int i = from;
            if (text.charAt(i) == '0' && i + 1 < length && "xXoObB".indexOf(text.charAt(i + 1)) >= 0) {
                i += 2;
                while (i < length && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                return i;
            }
            while (i < length) {
                char ch = text.charAt(i);
                if ((ch == 'e' || ch == 'E') && i + 1 < length
                        && (text.charAt(i + 1) == '+' || text.charAt(i + 1) == '-')) {
                    i += 2;
                } else if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '.') {
                    i++;
                } else {
                    break;
                }
            }
            return i;
        }

        private int _operatorEnd(int from) {
            for (String operator : MULTI_CHAR_OPERATORS) {
                if (text.startsWith(operator, from)) {
                    return from + operator.length();
                }
            }
            return from + Character.charCount(text.codePointAt(from));
        }

        private int _scanIdentifier(int from) {
            int i = from;
            while (i < length) {
                int cp = text.codePointAt(i);
                if (!(cp == '_' || Character.isLetterOrDigit(cp) || Character.isUnicodeIdentifierPart(cp))
                        || Character.isIdentifierIgnorable(cp)) {
                    break;
                }
                i += Character.charCount(cp);
            }
            return i;
        }

        private int _skipBlanks(int from) {
            int i = from;
            while (i < length && (text.charAt(i) == ' ' || text.charAt(i) == '\t' || text.charAt(i) == '\f')) {
                i++;
            }
            return i;
        }

        private int _lineContentEnd(int from) {
            int i = from;
            while (i < length && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
                i++;
            }
            return i;
        }

        private int _lineBreakEnd(int at) {
            if (text.charAt(at) == '\r' && at + 1 < length && text.charAt(at + 1) == '\n') {
                return at + 2;
            }
            return at + 1;
        }

        private int _escapedEnd(int at) {
            char ch = text.charAt(at);
            if (ch == '\r' || ch == '\n') {
                return _lineBreakEnd(at);
            }
            return at + 1;
        }

        private Token emit(TokenKind kind, int end) {
            String tokenText = text.substring(pos, end);
            Token token = new Token(kind, tokenText, pos, line, column);
            tokens.add(token);
            _advance(end);
            return token;
        }

        private void _advance(int end) {
            int[] next = _positionAfter(pos, end, line, column);
            line = next[0];
            column = next[1];
            pos = end;
        }

        private int[] _positionOf(int offset) {
            // Offsets handed in here are always at or after the current token start.
            return _positionAfter(pos, offset, line, column);
        }

        private int[] _positionAfter(int from, int to, int startLine, int startColumn) {
            int l = startLine;
            int col = startColumn;
            for (int i = from; i < to; i++) {
                char ch = text.charAt(i);
                if (ch == '\r' && i + 1 < to && text.charAt(i + 1) == '\n') {
                    continue;
                }
                if (ch == '\n' || ch == '\r') {
                    l++;
                    col = 1;
                } else if (!Character.isLowSurrogate(ch)) {
                    col++;
                }
            }
            return new int[] {l, col};
        }

        private static boolean _isQuote(char ch) {
            return ch == '"' || ch == '\'';
        }

        private static boolean _isStringPrefix(String word) {
            return word.length() <= 2 && STRING_PREFIXES.contains(word.toLowerCase());
        }

        private static boolean _isIdentifierStart(int cp) {
            return cp == '_' || Character.isLetter(cp) || Character.isUnicodeIdentifierStart(cp);
        }

        private static char _closerFor(char open) {
            return switch (open) {
                case '(' -> ')';
                case '[' -> ']';
                default -> '}';
            };
        }
    }
}
