package com.pyformatter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A header statement and its indented body, one node of the module's nesting tree.
 * The parent link is a back-reference; a block owns only its children.
 */
public class Block {
    private final BlockKind kind;
    private final LogicalLine header;
    private final Block parent;
    private final List<Block> children = new ArrayList<>();
    private final int headerIndentWidth;
    private int bodyIndentWidth = -1;
    private int lastLineIndex = -1;

    Block(BlockKind kind, LogicalLine header, Block parent, int headerIndentWidth) {
        this.kind = kind;
        this.header = header;
        this.parent = parent;
        this.headerIndentWidth = headerIndentWidth;
    }

    static Block root() {
        Block root = new Block(BlockKind.MODULE, null, null, -1);
        root.bodyIndentWidth = 0;
        return root;
    }

    void addChild(Block child) {
        children.add(child);
    }

    void setBodyIndentWidth(int bodyIndentWidth) {
        this.bodyIndentWidth = bodyIndentWidth;
    }

    void setLastLineIndex(int lastLineIndex) {
        this.lastLineIndex = lastLineIndex;
    }

    public BlockKind getKind() { return kind; }
    public LogicalLine getHeader() { return header; }
    public Block getParent() { return parent; }
    public List<Block> getChildren() { return Collections.unmodifiableList(children); }
    public int getHeaderIndentWidth() { return headerIndentWidth; }
    public int getBodyIndentWidth() { return bodyIndentWidth; }

    /**
     * Index of the last code line in this block's body, nested blocks included.
     */
    public int getLastLineIndex() { return lastLineIndex; }

    public boolean isRoot() {
        return header == null;
    }

    public String getHeaderIndentText() {
        return header == null ? "" : header.getIndentText();
    }

    /**
     * Nesting depth; the module is 0.
     */
    public int getDepth() {
        int depth = 0;
        for (Block b = parent; b != null; b = b.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "Block[" + kind + (header == null ? "" : ", line " + header.getFirstPhysicalLine())
                + ", children=" + children.size() + "]";
    }
}
