package ink.localiser.script;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Line-oriented parser for ink-style narrative scripts.
 *
 * <p>Every physical content line becomes a {@link NodeKind#LINE} node under the innermost knot or
 * stitch. Its children are the text runs, tag markers, inline expressions and diverts of that line
 * in source order, so tag spans can be tracked by scanning siblings. Errors are reported to the
 * {@link ParseErrorListener} and parsing continues with the next line.
 *
 * <p>Block comments and multi-line <code>{ ... }</code> blocks are tracked across lines. Lines
 * inside a block are ordinary content, except that a {@code - condition:} line of a conditional
 * block only contributes the text after its colon.
 */
public class ScriptParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptParser.class);

    private static final Pattern KNOT_HEADER = Pattern.compile("^\\s*={2,}\\s*(.*?)\\s*=*\\s*$");
    private static final Pattern STITCH_HEADER = Pattern.compile("^\\s*=(?!=)\\s*(.*?)\\s*$");
    private static final Pattern INCLUDE = Pattern.compile("^\\s*INCLUDE\\s+(.+?)\\s*$");
    private static final Pattern SCOPE_NAME = Pattern.compile("^(?:function\\s+)?([A-Za-z0-9_]+)\\s*(\\(.*\\))?$");
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "^\\s*(?:~\\s*|VAR\\s+|CONST\\s+|LIST\\s+)(?:temp\\s+)?[A-Za-z_][A-Za-z0-9_.]*\\s*(?:=(?!=)|\\+=|-=)");
    private static final Pattern CODE_LINE = Pattern.compile("^\\s*(?:~|VAR\\s|CONST\\s|LIST\\s|EXTERNAL\\s|TODO\\s*:)");
    private static final Pattern SEQUENCE_HEADER = Pattern.compile(
            "^\\s*(?:stopping|cycle|shuffle|once)(?:\\s+(?:stopping|cycle|once))?\\s*:\\s*$");
    private static final Pattern LABEL = Pattern.compile("^\\(\\s*[A-Za-z0-9_]+\\s*\\)");

    private final SourceFileHandler fileHandler;
    private final ParseErrorListener errorListener;

    public ScriptParser(SourceFileHandler fileHandler, ParseErrorListener errorListener) {
        this.fileHandler = Objects.requireNonNull(fileHandler, "fileHandler");
        this.errorListener = Objects.requireNonNull(errorListener, "errorListener");
    }

    /**
     * Loads and parses a script together with everything it includes.
     *
     * @throws IOException when the top-level file cannot be read
     */
    public ScriptNode parse(String fileName) throws IOException {
        String content = fileHandler.load(fileName);
        return parse(fileName, content);
    }

    /**
     * Parses already loaded content. Included files are still loaded through the file handler.
     */
    public ScriptNode parse(String fileName, String content) {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(content, "content");
        ScriptNode story = ScriptNode.story(SourcePosition.onLine(fileName, 1, 0));
        Set<String> included = new HashSet<>();
        included.add(normalize(fileName));
        parseInto(story, fileName, content, included);
        return story;
    }

    private void parseInto(ScriptNode story, String fileName, String content, Set<String> included) {
        FileState state = new FileState(story, fileName);
        List<String> lines = content.lines().toList();
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            int lineNumber = index + 1;
            state.lineNumber = lineNumber;
            int start = index == 0 && line.startsWith("\uFEFF") ? 1 : 0;
            parseLine(state, maskBlockComments(state, line), lineNumber, start, included);
        }
        if (state.blockCommentLine > 0) {
            report(fileName, state.blockCommentLine, "Unterminated block comment");
        }
        while (!state.blocks.isEmpty()) {
            report(fileName, state.blocks.pop().line(), "Unterminated block starting on this line");
        }
    }

    /**
     * Blanks out block comment text, keeping every other character at its column.
     */
    private static String maskBlockComments(FileState state, String line) {
        if (state.blockCommentLine == 0 && !line.contains("/*")) {
            return line;
        }
        StringBuilder masked = new StringBuilder(line);
        int index = 0;
        while (index < line.length()) {
            if (state.blockCommentLine > 0) {
                int close = line.indexOf("*/", index);
                int stop = close < 0 ? line.length() : close + 2;
                blank(masked, index, stop);
                if (close >= 0) {
                    state.blockCommentLine = 0;
                }
                index = stop;
            } else {
                int open = line.indexOf("/*", index);
                int lineComment = line.indexOf("//", index);
                if (open < 0 || (lineComment >= 0 && lineComment < open)) {
                    break;
                }
                blank(masked, open, open + 2);
                state.blockCommentLine = state.lineNumber;
                index = open + 2;
            }
        }
        return masked.toString();
    }

    private static void blank(StringBuilder line, int from, int to) {
        for (int index = from; index < to; index++) {
            line.setCharAt(index, ' ');
        }
    }

    private void parseLine(FileState state, String line, int lineNumber, int start, Set<String> included) {
        boolean codeLine = CODE_LINE.matcher(line.substring(start)).find();
        int end = commentStart(line, start, codeLine);
        String body = line.substring(start, end);
        if (body.isBlank()) {
            return;
        }

        Matcher include = INCLUDE.matcher(body);
        if (include.matches()) {
            includeFile(state, include.group(1), lineNumber, included);
            return;
        }

        Matcher knot = KNOT_HEADER.matcher(body);
        if (knot.matches()) {
            scopeName(state, knot.group(1), lineNumber).ifPresent(name -> {
                state.knot = state.story.addScope(NodeKind.KNOT, name, SourcePosition.onLine(state.fileName, lineNumber, end));
                state.scope = state.knot;
            });
            return;
        }

        Matcher stitch = STITCH_HEADER.matcher(body);
        if (stitch.matches()) {
            scopeName(state, stitch.group(1), lineNumber).ifPresent(name -> {
                ScriptNode owner = state.knot != null ? state.knot : state.story;
                state.scope = owner.addScope(NodeKind.STITCH, name, SourcePosition.onLine(state.fileName, lineNumber, end));
            });
            return;
        }

        if (codeLine) {
            parseCodeLine(state, line, lineNumber, start, end);
            return;
        }

        int contentStart = branchContentStart(state, line, start, end);
        if (contentStart < 0) {
            contentStart = skipWeavePrefix(line, start, end);
        }
        boolean choice = isChoice(line, start, end);
        parseContent(state, line, lineNumber, contentStart, end, choice);
    }

    /**
     * Start of the content following {@code - condition:} inside a conditional block, or -1.
     */
    private static int branchContentStart(FileState state, String line, int start, int end) {
        if (state.blocks.isEmpty() || state.blocks.peek().sequence()) {
            return -1;
        }
        int index = skipWhitespace(line, start, end);
        if (index >= end || line.charAt(index) != '-' || (index + 1 < end && line.charAt(index + 1) == '>')) {
            return -1;
        }
        boolean inString = false;
        int parens = 0;
        for (int cursor = index + 1; cursor < end; cursor++) {
            char ch = line.charAt(cursor);
            if (ch == '"') {
                inString = !inString;
            } else if (!inString && ch == '(') {
                parens++;
            } else if (!inString && ch == ')') {
                parens--;
            } else if (!inString && parens == 0 && ch == ':') {
                return skipWhitespace(line, cursor + 1, end);
            }
        }
        return -1;
    }

    private static boolean isChoice(String line, int start, int end) {
        int index = skipWhitespace(line, start, end);
        return index < end && (line.charAt(index) == '*' || line.charAt(index) == '+');
    }

    private Optional<String> scopeName(FileState state, String header, int lineNumber) {
        Matcher matcher = SCOPE_NAME.matcher(header);
        if (!matcher.matches()) {
            report(state.fileName, lineNumber, "Invalid knot or stitch name '" + header + "'");
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }

    private void includeFile(FileState state, String target, int lineNumber, Set<String> included) {
        String includedName = resolveInclude(target);
        if (!included.add(normalize(includedName))) {
            LOGGER.debug("Skipping repeated include of {} in {}", includedName, state.fileName);
            return;
        }
        String content;
        try {
            content = fileHandler.load(includedName);
        } catch (IOException ex) {
            report(state.fileName, lineNumber, "Could not read included file '" + target + "': " + ex.getMessage());
            return;
        }
        LOGGER.debug("Including {} from {}:{}", includedName, state.fileName, lineNumber);
        parseInto(state.story, includedName, content, included);
    }

    private void parseCodeLine(FileState state, String line, int lineNumber, int start, int end) {
        Matcher assignment = ASSIGNMENT.matcher(line.substring(start, end));
        if (!assignment.find()) {
            return;
        }
        ScriptNode node = state.scope.addChild(NodeKind.VARIABLE_ASSIGNMENT,
                SourcePosition.onLine(state.fileName, lineNumber, end));
        addStringLiterals(node, state.fileName, line, lineNumber, start + assignment.end(), end);
    }

    private int skipWeavePrefix(String line, int start, int end) {
        int index = skipWhitespace(line, start, end);
        boolean bulletSeen = false;
        while (index < end) {
            char ch = line.charAt(index);
            boolean bullet = ch == '*' || ch == '+' || (ch == '-' && !(index + 1 < end && line.charAt(index + 1) == '>'));
            if (!bullet) {
                break;
            }
            bulletSeen = true;
            index = skipWhitespace(line, index + 1, end);
        }
        if (bulletSeen) {
            Matcher label = LABEL.matcher(line.substring(index, end));
            if (label.find()) {
                index = skipWhitespace(line, index + label.end(), end);
            }
        }
        return index;
    }

    private void parseContent(FileState state, String line, int lineNumber, int start, int end, boolean choice) {
        ScriptNode lineNode = state.scope.addChild(NodeKind.LINE, SourcePosition.onLine(state.fileName, lineNumber, end));
        TextBuffer buffer = new TextBuffer(lineNode, state.fileName, lineNumber, line);
        int index = start;
        while (index < end) {
            char ch = line.charAt(index);
            if (ch == '\\' && index + 1 < end) {
                buffer.append(line.charAt(index + 1), index);
                index += 2;
            } else if (ch == '#') {
                buffer.flush(index);
                index = parseTag(lineNode, state.fileName, line, lineNumber, index, end);
            } else if (ch == '{') {
                buffer.flush(index);
                int next = parseInlineExpression(lineNode, state.fileName, line, lineNumber, index, end);
                if (next < 0) {
                    // rest of the line is the block header
                    boolean sequence = SEQUENCE_HEADER.matcher(line.substring(index + 1, end)).matches();
                    state.blocks.push(new Block(lineNumber, sequence));
                    index = end;
                } else {
                    index = next;
                }
            } else if (ch == '}' && !state.blocks.isEmpty()) {
                buffer.flush(index);
                state.blocks.pop();
                index++;
            } else if ((ch == '-' && index + 1 < end && line.charAt(index + 1) == '>')
                    || (ch == '<' && index + 1 < end && line.charAt(index + 1) == '-')) {
                buffer.flush(index);
                index = parseDivert(lineNode, state.fileName, line, lineNumber, index, end);
            } else if (choice && (ch == '[' || ch == ']')) {
                index++;
            } else {
                buffer.append(ch, index);
                index++;
            }
        }
        buffer.flush(end);
        lineNode.addText("\n", SourcePosition.onLine(state.fileName, lineNumber, end));
    }

    private int parseTag(ScriptNode lineNode, String fileName, String line, int lineNumber, int hashIndex, int end) {
        int index = hashIndex + 1;
        StringBuilder tag = new StringBuilder();
        while (index < end) {
            char ch = line.charAt(index);
            if (ch == '#' || (ch == '-' && index + 1 < end && line.charAt(index + 1) == '>')) {
                break;
            }
            if (ch == '\\' && index + 1 < end) {
                tag.append(line.charAt(index + 1));
                index += 2;
                continue;
            }
            tag.append(ch);
            index++;
        }
        lineNode.addChild(NodeKind.TAG_START, SourcePosition.onLine(fileName, lineNumber, hashIndex + 1));
        lineNode.addText(tag.toString().trim(), SourcePosition.onLine(fileName, lineNumber, index));
        lineNode.addChild(NodeKind.TAG_END, SourcePosition.onLine(fileName, lineNumber, index));
        return index;
    }

    /**
     * Returns the index after the closing brace, or -1 when the brace is not closed on this line.
     */
    private int parseInlineExpression(ScriptNode lineNode, String fileName, String line, int lineNumber, int openIndex, int end) {
        int depth = 0;
        boolean inString = false;
        for (int index = openIndex; index < end; index++) {
            char ch = line.charAt(index);
            if (ch == '\\') {
                index++;
            } else if (ch == '"') {
                inString = !inString;
            } else if (!inString && ch == '{') {
                depth++;
            } else if (!inString && ch == '}' && --depth == 0) {
                ScriptNode expression = lineNode.addChild(NodeKind.INLINE_EXPRESSION,
                        SourcePosition.onLine(fileName, lineNumber, index + 1));
                addStringLiterals(expression, fileName, line, lineNumber, openIndex + 1, index);
                return index + 1;
            }
        }
        return -1;
    }

    private void addStringLiterals(ScriptNode owner, String fileName, String line, int lineNumber, int from, int to) {
        int index = from;
        while (index < to) {
            if (line.charAt(index) != '"') {
                index++;
                continue;
            }
            StringBuilder literal = new StringBuilder();
            int cursor = index + 1;
            while (cursor < to && line.charAt(cursor) != '"') {
                if (line.charAt(cursor) == '\\' && cursor + 1 < to) {
                    cursor++;
                }
                literal.append(line.charAt(cursor));
                cursor++;
            }
            ScriptNode parent = owner.kind() == NodeKind.VARIABLE_ASSIGNMENT
                    ? owner
                    : owner.addChild(NodeKind.STRING_EXPRESSION, SourcePosition.onLine(fileName, lineNumber, Math.min(cursor + 1, to)));
            parent.addText(literal.toString(), SourcePosition.onLine(fileName, lineNumber, cursor));
            index = cursor + 1;
        }
    }

    private int parseDivert(ScriptNode lineNode, String fileName, String line, int lineNumber, int arrowIndex, int end) {
        int index = skipWhitespace(line, arrowIndex + 2, end);
        int targetStart = index;
        while (index < end && !Character.isWhitespace(line.charAt(index)) && line.charAt(index) != '#') {
            index++;
        }
        if (index == targetStart) {
            report(fileName, lineNumber, "Divert is missing a target");
        }
        lineNode.addChild(NodeKind.DIVERT, SourcePosition.onLine(fileName, lineNumber, index));
        return skipWhitespace(line, index, end);
    }

    private static int commentStart(String line, int start, boolean codeLine) {
        boolean inString = false;
        int braceDepth = 0;
        for (int index = start; index < line.length(); index++) {
            char ch = line.charAt(index);
            if (ch == '\\') {
                index++;
            } else if (ch == '"' && (codeLine || braceDepth > 0)) {
                inString = !inString;
            } else if (!inString && ch == '{') {
                braceDepth++;
            } else if (!inString && ch == '}' && braceDepth > 0) {
                braceDepth--;
            } else if (!inString && ch == '/' && index + 1 < line.length() && line.charAt(index + 1) == '/') {
                return index;
            }
        }
        return line.length();
    }

    private static int skipWhitespace(String line, int index, int end) {
        while (index < end && Character.isWhitespace(line.charAt(index))) {
            index++;
        }
        return index;
    }

    private static String resolveInclude(String target) {
        return normalize(target.trim());
    }

    private static String normalize(String fileName) {
        return Path.of(fileName.replace('\\', '/')).normalize().toString().replace('\\', '/');
    }

    private void report(String fileName, int lineNumber, String message) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("line", Integer.toString(lineNumber))) {
            LOGGER.error("Parse error in {}:{}: {}", fileName, lineNumber, message);
        }
        errorListener.onError(fileName, lineNumber, message);
    }

    private record Block(int line, boolean sequence) {
    }

    private static final class FileState {
        private final ScriptNode story;
        private final String fileName;
        private final Deque<Block> blocks = new ArrayDeque<>();
        private ScriptNode knot;
        private ScriptNode scope;
        private int lineNumber;
        private int blockCommentLine;

        private FileState(ScriptNode story, String fileName) {
            this.story = story;
            this.fileName = fileName;
            this.scope = story;
        }
    }

    /**
     * Accumulates one text run and remembers where it started in the raw line.
     */
    private static final class TextBuffer {
        private final ScriptNode lineNode;
        private final String fileName;
        private final int lineNumber;
        private final String line;
        private final StringBuilder text = new StringBuilder();
        private int rawStart = -1;

        private TextBuffer(ScriptNode lineNode, String fileName, int lineNumber, String line) {
            this.lineNode = lineNode;
            this.fileName = fileName;
            this.lineNumber = lineNumber;
            this.line = line;
        }

        void append(char ch, int rawIndex) {
            if (rawStart < 0) {
                rawStart = rawIndex;
            }
            text.append(ch);
        }

        /**
         * Emits the buffered run, if any. Trailing whitespace is not part of a run, so a tag
         * written after it lands directly behind the last visible character.
         */
        void flush(int rawEnd) {
            if (rawStart < 0) {
                return;
            }
            int end = rawEnd;
            while (end > rawStart && Character.isWhitespace(line.charAt(end - 1))) {
                end--;
            }
            String value = text.toString().stripTrailing();
            if (!value.isEmpty()) {
                lineNode.addText(value, SourcePosition.onLine(fileName, lineNumber, end));
            }
            text.setLength(0);
            rawStart = -1;
        }
    }
}
