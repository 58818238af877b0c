package com.pyformatter.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.pyformatter.api.error.IndentationException;
import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;

/**
 * Groups tokens into logical lines.
 * A logical line ends at a line break outside brackets; a backslash continuation or an
 * open bracket carries it on to the next physical line, together with any blank or
 * comment lines found inside the brackets.
 */
public class LogicalLineAssembler {

    public List<LogicalLine> assemble(List<Token> tokens) throws IndentationException {
        List<LogicalLine> lines = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;

        for (Token token : tokens) {
            current.add(token);
            if (token.is(TokenKind.OPEN_BRACKET)) {
                depth++;
            } else if (token.is(TokenKind.CLOSE_BRACKET)) {
                depth--;
            } else if (token.is(TokenKind.NEWLINE) && depth == 0) {
                lines.add(new LogicalLine(lines.size(), current));
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(new LogicalLine(lines.size(), current));
        }

        _checkTabConsistency(lines);
        return lines;
    }

    /**
     * Rejects indentation whose nesting depends on the tab size, comparing every code
     * line against the open indentation levels with tabs counted as 8 and as 1 column.
     */
    private void _checkTabConsistency(List<LogicalLine> lines) throws IndentationException {
        Deque<int[]> levels = new ArrayDeque<>();
        levels.push(new int[] {0, 0});

        for (LogicalLine line : lines) {
            if (!line.isCode()) {
                continue;
            }
            int width = line.getIndentWidth();
            int alternate = line.getAlternateIndentWidth();
            int[] top = levels.peek();

            if (width > top[0]) {
                if (alternate <= top[1]) {
                    throw _inconsistent(line);
                }
                levels.push(new int[] {width, alternate});
                continue;
            }
            while (levels.size() > 1 && width < levels.peek()[0]) {
                levels.pop();
            }
            top = levels.peek();
            if (width == top[0] && alternate != top[1]) {
                throw _inconsistent(line);
            }
        }
    }

    private static IndentationException _inconsistent(LogicalLine line) {
        return new IndentationException("inconsistent use of tabs and spaces in indentation",
                line.getFirstPhysicalLine(), 1);
    }
}
