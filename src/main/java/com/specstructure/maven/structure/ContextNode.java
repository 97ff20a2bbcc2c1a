package com.specstructure.maven.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One level of the generated context hierarchy, for a single (characteristic, value) pair.
 * Only leaf and terminal nodes carry examples.
 */
public class ContextNode {

    private final String word;
    private final String description;
    private final String characteristic;
    private final String value;
    private final String letBlock;
    private final String sourceLine;
    private final boolean terminal;
    private final List<ContextNode> children = new ArrayList<>();
    private final List<ItBlock> itBlocks = new ArrayList<>();
    private String skipReason;

    public ContextNode(String word, String description, String characteristic, String value,
            String letBlock, String sourceLine, boolean terminal) {
        this.word = word;
        this.description = description;
        this.characteristic = characteristic;
        this.value = value;
        this.letBlock = letBlock;
        this.sourceLine = sourceLine;
        this.terminal = terminal;
    }

    public String getWord() {
        return word;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Word and description as they appear in the context line, e.g. {@code "with a valid token"}.
     */
    public String getTitle() {
        return word + " " + description;
    }

    public String getCharacteristic() {
        return characteristic;
    }

    public String getValue() {
        return value;
    }

    public String getLetBlock() {
        return letBlock;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public List<ContextNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<ItBlock> getItBlocks() {
        return Collections.unmodifiableList(itBlocks);
    }

    public String getSkipReason() {
        return skipReason;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    void addChildren(List<ContextNode> nodes) {
        children.addAll(nodes);
    }

    void addItBlock(ItBlock itBlock) {
        itBlocks.add(itBlock);
    }

    void skip(String reason) {
        this.skipReason = reason;
        itBlocks.clear();
    }
}
