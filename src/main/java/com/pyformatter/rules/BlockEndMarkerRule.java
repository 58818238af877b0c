package com.pyformatter.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.pyformatter.model.Block;
import com.pyformatter.model.BlockKind;
import com.pyformatter.model.LineKind;
import com.pyformatter.model.LogicalLine;
import com.pyformatter.model.SourceModel;

/**
 * Closes block chains with a standalone {@code #} line at the header's indent.
 * A chain is a lead block with its {@code elif}/{@code else}/{@code except}/{@code finally}
 * clauses; it gets one marker after its last code line, or after the comments indented
 * into its body that follow that line. Chains closing at the same place share one
 * insertion, innermost marker first.
 */
public class BlockEndMarkerRule implements StyleRule {
    static final String MARKER = "#";

    private final Set<BlockKind> markedKinds;

    public BlockEndMarkerRule(Set<BlockKind> markedKinds) {
        this.markedKinds = markedKinds.isEmpty() ? EnumSet.noneOf(BlockKind.class) : EnumSet.copyOf(markedKinds);
    }

    @Override
    public RuleId getId() {
        return RuleId.BLOCK_END_MARKER;
    }

    @Override
    public List<Edit> apply(SourceModel source) {
        Map<Integer, List<Block>> chainsByLastLine = new TreeMap<>();
        _collectChains(source.getRootBlock(), chainsByLastLine);

        List<Edit> edits = new ArrayList<>();
        for (Map.Entry<Integer, List<Block>> entry : chainsByLastLine.entrySet()) {
            edits.addAll(_markersAfter(source, entry.getKey(), entry.getValue()));
        }
        return edits;
    }

    /**
     * Records, for every marked chain, its lead block under the index of the chain's last code line.
     */
    private void _collectChains(Block block, Map<Integer, List<Block>> chainsByLastLine) {
        Block lead = null;
        Block tail = null;
        for (Block child : block.getChildren()) {
            if (lead != null && child.getKind().isContinuation()) {
                tail = child;
            } else {
                _recordChain(lead, tail, chainsByLastLine);
                lead = child;
                tail = child;
            }
            _collectChains(child, chainsByLastLine);
        }
        _recordChain(lead, tail, chainsByLastLine);
    }

    private void _recordChain(Block lead, Block tail, Map<Integer, List<Block>> chainsByLastLine) {
        if (lead == null || !markedKinds.contains(lead.getKind()) || tail.getLastLineIndex() < 0) {
            return;
        }
        chainsByLastLine.computeIfAbsent(tail.getLastLineIndex(), k -> new ArrayList<>()).add(lead);
    }

    private List<Edit> _markersAfter(SourceModel source, int lastLine, List<Block> chains) {
        List<LogicalLine> lines = source.getLines();
        chains.sort(Comparator.comparingInt(Block::getHeaderIndentWidth).reversed());

        // Anchor line index -> indents of the markers to insert after it, innermost first.
        Map<Integer, List<String>> pending = new LinkedHashMap<>();
        for (Block chain : chains) {
            int anchor = _trailingBodyLine(lines, lastLine, chain.getHeaderIndentWidth());
            String indent = chain.getHeaderIndentText();
            boolean present = false;
            for (int i = anchor + 1; i < lines.size() && lines.get(i).isBareMarker(); i++) {
                if (lines.get(i).getIndentText().equals(indent)) {
                    present = true;
                    break;
                }
            }
            if (!present) {
                pending.computeIfAbsent(anchor, k -> new ArrayList<>()).add(indent);
            }
        }

        List<Edit> edits = new ArrayList<>();
        for (Map.Entry<Integer, List<String>> entry : pending.entrySet()) {
            LogicalLine anchor = lines.get(entry.getKey());
            edits.add(_insertion(anchor, entry.getValue(), source.getLineEnding()));
        }
        return edits;
    }

    /**
     * The last line still belonging to a chain body: its last code line, or a later comment
     * indented deeper than the header. Blank lines are passed over; the first comment at or
     * left of the header's indent, or the next code line, ends the body.
     */
    private static int _trailingBodyLine(List<LogicalLine> lines, int lastLine, int headerWidth) {
        int anchor = lastLine;
        for (int i = lastLine + 1; i < lines.size() && !lines.get(i).isCode(); i++) {
            LogicalLine line = lines.get(i);
            if (line.getKind() == LineKind.COMMENT) {
                if (line.getIndentWidth() <= headerWidth) {
                    break;
                }
                anchor = i;
            }
        }
        return anchor;
    }

    private Edit _insertion(LogicalLine anchor, List<String> indents, String lineEnding) {
        StringBuilder text = new StringBuilder();
        boolean atEndOfInput = !anchor.endsWithLineBreak();
        for (String indent : indents) {
            if (atEndOfInput) {
                text.append(lineEnding).append(indent).append(MARKER);
            } else {
                text.append(indent).append(MARKER).append(lineEnding);
            }
        }
        int offset = anchor.getEndOffset();
        int line = anchor.getLastPhysicalLine() + 1;
        String description = indents.size() == 1 ? "Insert block end marker" : "Insert " + indents.size() + " block end markers";
        return new Edit(offset, offset, text.toString(), getId(), line, 1, description);
    }
}
