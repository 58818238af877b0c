package com.pyformatter.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.pyformatter.api.error.IndentationException;
import com.pyformatter.lexer.Token;

/**
 * Builds the block tree from indentation.
 * A header opens a child block whose body indent is set by the next code line; the
 * block closes at the first later code line indented no deeper than its header.
 */
public class BlockTreeBuilder {

    public BlockTree build(List<LogicalLine> lines) throws IndentationException {
        Block root = Block.root();
        Block[] owners = new Block[lines.size()];
        Deque<Block> open = new ArrayDeque<>();
        open.push(root);

        Block pending = null;
        int lastCode = -1;

        for (LogicalLine line : lines) {
            if (!line.isCode()) {
                owners[line.getIndex()] = pending != null ? pending : open.peek();
                continue;
            }
            int width = line.getIndentWidth();

            if (pending != null) {
                if (width <= pending.getHeaderIndentWidth()) {
                    throw _expectedIndentedBlock(pending);
                }
                pending.setBodyIndentWidth(width);
                open.push(pending);
                pending = null;
            } else {
                if (width > open.peek().getBodyIndentWidth()) {
                    throw new IndentationException("unexpected indent", line.getFirstPhysicalLine(), 1);
                }
                while (width < open.peek().getBodyIndentWidth()) {
                    open.pop().setLastLineIndex(lastCode);
                }
                if (width != open.peek().getBodyIndentWidth()) {
                    throw new IndentationException("unindent does not match any outer indentation level",
                            line.getFirstPhysicalLine(), 1);
                }
            }

            Block owner = open.peek();
            owners[line.getIndex()] = owner;
            if (line.isHeader()) {
                Block child = new Block(BlockKind.ofHeader(line), line, owner, width);
                owner.addChild(child);
                pending = child;
            }
            lastCode = line.getIndex();
        }

        if (pending != null) {
            throw _expectedIndentedBlock(pending);
        }
        while (!open.isEmpty()) {
            open.pop().setLastLineIndex(lastCode);
        }
        return new BlockTree(root, owners);
    }

    private static IndentationException _expectedIndentedBlock(Block block) {
        Token keyword = block.getHeader().firstSignificant();
        return new IndentationException("expected an indented block after '" + keyword.getText() + "' statement",
                keyword.getLine(), keyword.getColumn());
    }
}
