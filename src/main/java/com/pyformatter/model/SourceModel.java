package com.pyformatter.model;

import java.util.Collections;
import java.util.List;

import com.pyformatter.api.error.FormattingException;
import com.pyformatter.lexer.PythonLexer;
import com.pyformatter.lexer.Token;
import com.pyformatter.lexer.TokenKind;

/**
 * Everything one formatting pass knows about a file: its text, tokens, logical lines
 * and block tree. Built fresh per pass and never shared between files.
 */
public class SourceModel {
    private static final String DEFAULT_LINE_ENDING = "\n";

    private final String text;
    private final List<Token> tokens;
    private final List<LogicalLine> lines;
    private final BlockTree blockTree;

    public SourceModel(String text, List<Token> tokens, List<LogicalLine> lines, BlockTree blockTree) {
        this.text = text;
        this.tokens = Collections.unmodifiableList(tokens);
        this.lines = Collections.unmodifiableList(lines);
        this.blockTree = blockTree;
    }

    /**
     * Runs lexer, line assembler and block builder over the text.
     */
    public static SourceModel parse(String text) throws FormattingException {
        List<Token> tokens = new PythonLexer().tokenize(text);
        List<LogicalLine> lines = new LogicalLineAssembler().assemble(tokens);
        BlockTree tree = new BlockTreeBuilder().build(lines);
        return new SourceModel(text, tokens, lines, tree);
    }

    public String getText() { return text; }
    public List<Token> getTokens() { return tokens; }
    public List<LogicalLine> getLines() { return lines; }
    public BlockTree getBlockTree() { return blockTree; }

    public Block getRootBlock() {
        return blockTree.getRoot();
    }

    public LogicalLine line(int index) {
        return lines.get(index);
    }

    /**
     * The first line break used in the file, or {@code "\n"} when there is none.
     */
    public String getLineEnding() {
        for (Token token : tokens) {
            if (token.is(TokenKind.NEWLINE)) {
                return token.getText();
            }
        }
        return DEFAULT_LINE_ENDING;
    }
}
