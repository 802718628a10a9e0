package com.tomlformatter.toml.parser;

import com.tomlformatter.toml.model.ArrayElement;
import com.tomlformatter.toml.model.ArrayValue;
import com.tomlformatter.toml.model.Entry;
import com.tomlformatter.toml.model.InlineTableValue;
import com.tomlformatter.toml.model.ScalarValue;
import com.tomlformatter.toml.model.TomlKey;
import com.tomlformatter.toml.model.TomlValue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recursive-descent scanner that reads exactly one entry from a buffered fragment
 * of TOML text. The fragment always ends with a line break.
 *
 * <p>Scalar values are kept as source text; arrays and inline tables are scanned
 * into their elements so the layout rules can re-render them.
 */
final class FragmentScanner {

    private static final Pattern SCALAR = Pattern.compile(
            "true|false"
                    + "|[+-]?(inf|nan)"
                    + "|[+-]?(0|[1-9](_?[0-9])*)(\\.[0-9](_?[0-9])*)?([eE][+-]?[0-9](_?[0-9])*)?"
                    + "|0x[0-9A-Fa-f](_?[0-9A-Fa-f])*|0o[0-7](_?[0-7])*|0b[01](_?[01])*"
                    + "|\\d{4}-\\d{2}-\\d{2}([Tt ]\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?([Zz]|[+-]\\d{2}:\\d{2})?)?"
                    + "|\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?");

    private static final Pattern LOCAL_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final String text;
    private final int firstLine;
    private int pos;

    private FragmentScanner(String text, int firstLine) {
        this.text = text;
        this.firstLine = firstLine;
    }

    /**
     * Scans {@code text}, whose first line is line {@code firstLine} of the document.
     */
    static ScanResult scan(String text, int firstLine) {
        FragmentScanner scanner = new FragmentScanner(text, firstLine);
        try {
            return ScanResult.complete(scanner._scanEntry());
        } catch (NeedMoreInput e) {
            return ScanResult.incomplete();
        } catch (SyntaxError e) {
            return ScanResult.error(e.getMessage(), e.line, e.column);
        }
    }

    private Entry _scanEntry() {
        int line = firstLine;
        String indent = _readInlineWhitespace();
        char c = _peek();
        Entry entry;
        if (c == '\n' || c == '\0') {
            pos++;
            entry = Entry.blank(line);
        } else if (c == '#') {
            String comment = _readComment();
            _expectLineEnd();
            entry = Entry.comment(comment, indent, line);
        } else if (c == '[') {
            entry = _scanHeader(indent, line);
        } else {
            entry = _scanKeyValue(indent, line);
        }
        if (pos < text.length()) {
            throw _error("unexpected content after the end of the entry");
        }
        return entry;
    }

    private Entry _scanHeader(String indent, int line) {
        pos++;
        boolean arrayOfTables = _peek() == '[';
        if (arrayOfTables) {
            pos++;
        }
        _skipInlineWhitespace();
        TomlKey key = _readKey();
        _skipInlineWhitespace();
        _expect(']');
        if (arrayOfTables) {
            _expect(']');
        }
        String comment = _readTrailingComment();
        return arrayOfTables
                ? Entry.arrayOfTablesHeader(key, comment, indent, line)
                : Entry.tableHeader(key, comment, indent, line);
    }

    private Entry _scanKeyValue(String indent, int line) {
        TomlKey key = _readKey();
        _skipInlineWhitespace();
        _expect('=');
        _skipInlineWhitespace();
        if (_peek() == '\n' || _peek() == '#') {
            throw _error("missing value for key '" + key.render() + "'");
        }
        TomlValue value = _readValue();
        String comment = _readTrailingComment();
        return Entry.keyValue(key, value, comment, indent, line);
    }

    // Keys

    private TomlKey _readKey() {
        List<TomlKey.Part> parts = new ArrayList<>();
        while (true) {
            _skipInlineWhitespace();
            parts.add(_readKeyPart());
            _skipInlineWhitespace();
            if (_peek() != '.') {
                return new TomlKey(parts);
            }
            pos++;
        }
    }

    private TomlKey.Part _readKeyPart() {
        int start = pos;
        char c = _peek();
        if (c == '"') {
            String decoded = _readBasicString();
            return new TomlKey.Part(text.substring(start, pos), decoded);
        }
        if (c == '\'') {
            String decoded = _readLiteralString();
            return new TomlKey.Part(text.substring(start, pos), decoded);
        }
        while (_isBareKeyChar(_peek())) {
            pos++;
        }
        if (pos == start) {
            throw _error("expected a key but found " + _describe(c));
        }
        String raw = text.substring(start, pos);
        return new TomlKey.Part(raw, raw);
    }

    // Values

    private TomlValue _readValue() {
        int start = pos;
        char c = _peek();
        if (c == '"') {
            if (text.startsWith("\"\"\"", pos)) {
                _readMultilineString('"');
            } else {
                _readBasicString();
            }
            return new ScalarValue(text.substring(start, pos));
        }
        if (c == '\'') {
            if (text.startsWith("'''", pos)) {
                _readMultilineString('\'');
            } else {
                _readLiteralString();
            }
            return new ScalarValue(text.substring(start, pos));
        }
        if (c == '[') {
            return _readArray();
        }
        if (c == '{') {
            return _readInlineTable();
        }
        return _readBareScalar();
    }

    private TomlValue _readBareScalar() {
        int start = pos;
        while (_isScalarChar(_peek())) {
            pos++;
        }
        // 1979-05-27 07:32:00 uses a space as the date/time delimiter
        if (LOCAL_DATE.matcher(text.substring(start, pos)).matches() && _peek() == ' '
                && pos + 3 < text.length()
                && Character.isDigit(text.charAt(pos + 1))
                && Character.isDigit(text.charAt(pos + 2))
                && text.charAt(pos + 3) == ':') {
            pos++;
            while (_isScalarChar(_peek())) {
                pos++;
            }
        }
        if (pos == start) {
            throw _error("unexpected character " + _describe(_peek()));
        }
        String token = text.substring(start, pos);
        if (!SCALAR.matcher(token).matches()) {
            throw _errorAt("invalid value '" + token + "'", start);
        }
        return new ScalarValue(token);
    }

    private ArrayValue _readArray() {
        int line = _lineAt(pos);
        pos++;
        List<ArrayElement> elements = new ArrayList<>();
        List<String> pendingComments = new ArrayList<>();
        String openingComment = null;
        ArrayElement last = null;
        boolean lineBreak = false;
        boolean commaAfterLast = false;
        boolean newlineSinceLast = false;

        while (true) {
            if (pos >= text.length()) {
                throw NeedMoreInput.INSTANCE;
            }
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '\n') {
                pos++;
                lineBreak = true;
                newlineSinceLast = true;
            } else if (c == '#') {
                String comment = _readComment();
                if (newlineSinceLast) {
                    pendingComments.add(comment);
                } else if (last == null && openingComment == null) {
                    openingComment = comment;
                } else if (last != null && last.getTrailingComment() == null) {
                    last.setTrailingComment(comment);
                } else {
                    pendingComments.add(comment);
                }
            } else if (c == ']') {
                pos++;
                return new ArrayValue(elements, openingComment, pendingComments, lineBreak, line);
            } else if (c == ',') {
                if (last == null || commaAfterLast) {
                    throw _error("unexpected ',' in array");
                }
                commaAfterLast = true;
                pos++;
            } else {
                if (last != null && !commaAfterLast) {
                    throw _error("expected ',' or ']' in array but found " + _describe(c));
                }
                last = new ArrayElement(pendingComments, _readValue());
                elements.add(last);
                pendingComments = new ArrayList<>();
                commaAfterLast = false;
                newlineSinceLast = false;
            }
        }
    }

    private InlineTableValue _readInlineTable() {
        pos++;
        List<InlineTableValue.Member> members = new ArrayList<>();
        boolean expectMember = true;
        while (true) {
            _skipInlineWhitespace();
            if (pos >= text.length()) {
                throw NeedMoreInput.INSTANCE;
            }
            char c = text.charAt(pos);
            if (c == '\n') {
                throw _error("line break inside an inline table");
            }
            if (c == '}') {
                if (expectMember && !members.isEmpty()) {
                    throw _error("trailing ',' in inline table");
                }
                pos++;
                return new InlineTableValue(members);
            }
            if (!expectMember) {
                if (c != ',') {
                    throw _error("expected ',' or '}' in inline table but found " + _describe(c));
                }
                pos++;
                expectMember = true;
                continue;
            }
            TomlKey key = _readKey();
            _skipInlineWhitespace();
            _expect('=');
            _skipInlineWhitespace();
            members.add(new InlineTableValue.Member(key, _readValue()));
            expectMember = false;
        }
    }

    // Strings

    private String _readBasicString() {
        pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            char c = _peek();
            if (c == '\n' || c == '\0') {
                throw _error("unterminated string");
            }
            pos++;
            if (c == '"') {
                return value.toString();
            }
            if (c == '\\') {
                value.append(_readEscape());
            } else {
                value.append(c);
            }
        }
    }

    private String _readEscape() {
        char c = _peek();
        pos++;
        switch (c) {
            case 'b': return "\b";
            case 't': return "\t";
            case 'n': return "\n";
            case 'f': return "\f";
            case 'r': return "\r";
            case '"': return "\"";
            case '\\': return "\\";
            case 'u': return _readUnicodeEscape(4);
            case 'U': return _readUnicodeEscape(8);
            default:
                throw _errorAt("invalid escape sequence \\" + c, pos - 2);
        }
    }

    private String _readUnicodeEscape(int digits) {
        if (pos + digits > text.length()) {
            throw _error("truncated unicode escape");
        }
        String hex = text.substring(pos, pos + digits);
        try {
            int codePoint = Integer.parseInt(hex, 16);
            pos += digits;
            return new String(Character.toChars(codePoint));
        } catch (IllegalArgumentException e) {
            throw _error("invalid unicode escape \\u" + hex);
        }
    }

    private String _readLiteralString() {
        pos++;
        int start = pos;
        while (_peek() != '\'') {
            if (_peek() == '\n' || _peek() == '\0') {
                throw _error("unterminated string");
            }
            pos++;
        }
        pos++;
        return text.substring(start, pos - 1);
    }

    /**
     * Skips a multi-line string. The closing delimiter may be preceded by up to two
     * quotes that belong to the content.
     */
    private void _readMultilineString(char quote) {
        pos += 3;
        while (true) {
            if (pos >= text.length()) {
                throw NeedMoreInput.INSTANCE;
            }
            char c = text.charAt(pos);
            if (quote == '"' && c == '\\') {
                pos += 2;
            } else if (c == quote) {
                int run = 0;
                while (pos + run < text.length() && text.charAt(pos + run) == quote) {
                    run++;
                }
                if (run >= 3) {
                    if (run > 5) {
                        throw _error("too many quotes closing a multi-line string");
                    }
                    pos += run;
                    return;
                }
                pos += run;
            } else {
                pos++;
            }
        }
    }

    // Trivia

    private String _readComment() {
        int start = pos;
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
        return text.substring(start, pos).stripTrailing();
    }

    private String _readTrailingComment() {
        _skipInlineWhitespace();
        String comment = null;
        if (_peek() == '#') {
            comment = _readComment();
        }
        _expectLineEnd();
        return comment;
    }

    private void _expectLineEnd() {
        _skipInlineWhitespace();
        if (_peek() != '\n') {
            throw _error("expected end of line but found " + _describe(_peek()));
        }
        pos++;
    }

    private String _readInlineWhitespace() {
        int start = pos;
        _skipInlineWhitespace();
        return text.substring(start, pos);
    }

    private void _skipInlineWhitespace() {
        while (_peek() == ' ' || _peek() == '\t') {
            pos++;
        }
    }

    private void _expect(char expected) {
        if (_peek() != expected) {
            throw _error("expected '" + expected + "' but found " + _describe(_peek()));
        }
        pos++;
    }

    private char _peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private static boolean _isBareKeyChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static boolean _isScalarChar(char c) {
        return _isBareKeyChar(c) || c == '+' || c == '.' || c == ':';
    }

    private static String _describe(char c) {
        if (c == '\0') {
            return "end of input";
        }
        if (c == '\n') {
            return "end of line";
        }
        return "'" + c + "'";
    }

    // Positions

    private int _lineAt(int offset) {
        int line = firstLine;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private SyntaxError _error(String message) {
        return _errorAt(message, pos);
    }

    private SyntaxError _errorAt(String message, int offset) {
        int lineStart = offset == 0 ? 0 : text.lastIndexOf('\n', Math.min(offset, text.length()) - 1) + 1;
        return new SyntaxError(message, _lineAt(offset), offset - lineStart + 1);
    }

    /**
     * The fragment ended inside an open construct.
     */
    private static final class NeedMoreInput extends RuntimeException {
        static final NeedMoreInput INSTANCE = new NeedMoreInput();

        private NeedMoreInput() {
            super(null, null, false, false);
        }
    }

    private static final class SyntaxError extends RuntimeException {
        final int line;
        final int column;

        SyntaxError(String message, int line, int column) {
            super(message, null, false, false);
            this.line = line;
            this.column = column;
        }
    }
}
