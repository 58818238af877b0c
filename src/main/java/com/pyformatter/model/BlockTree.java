package com.pyformatter.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The block tree of one file plus, for every logical line, the block whose body holds it.
 */
public class BlockTree {
    private final Block root;
    private final Block[] owners;

    BlockTree(Block root, Block[] owners) {
        this.root = root;
        this.owners = owners;
    }

    public Block getRoot() {
        return root;
    }

    /**
     * Innermost block whose body contains the line. Blank and comment lines report the
     * block that was open when they were read.
     */
    public Block ownerOf(int lineIndex) {
        return owners[lineIndex];
    }

    /**
     * All blocks except the module, in pre-order.
     */
    public List<Block> allBlocks() {
        List<Block> result = new ArrayList<>();
        _collect(root, result);
        return result;
    }

    private static void _collect(Block block, List<Block> result) {
        for (Block child : block.getChildren()) {
            result.add(child);
            _collect(child, result);
        }
    }
}
