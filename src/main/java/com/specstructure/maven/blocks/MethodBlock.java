package com.specstructure.maven.blocks;

import java.util.Objects;

/**
 * Location of one method block inside a line buffer. All indices are 0-based and
 * inclusive. Only valid for the exact buffer it was extracted from.
 * <p>
 * Blocks found through their markers carry begin/end marker indices; hand-written
 * describe blocks found by {@link DescribeBlockFinder} only carry the opener and closer.
 */
public class MethodBlock {

    private final String methodId;
    private final String descriptor;
    private final int beginIdx;
    private final int endIdx;
    private final int openIdx;
    private final int closeIdx;

    public MethodBlock(String methodId, String descriptor, int beginIdx, int endIdx, int openIdx, int closeIdx) {
        this.methodId = methodId;
        this.descriptor = descriptor;
        this.beginIdx = beginIdx;
        this.endIdx = endIdx;
        this.openIdx = openIdx;
        this.closeIdx = closeIdx;
    }

    static MethodBlock unmarked(String methodId, String descriptor, int openIdx, int closeIdx) {
        return new MethodBlock(methodId, descriptor, -1, -1, openIdx, closeIdx);
    }

    public String getMethodId() {
        return methodId;
    }

    /**
     * The {@code method} attribute of the begin marker, e.g. {@code #total}; may be null.
     */
    public String getDescriptor() {
        return descriptor;
    }

    /**
     * False for a describe block without {@code method_begin}/{@code method_end} markers.
     */
    public boolean isMarked() {
        return beginIdx >= 0;
    }

    public int getBeginIdx() {
        return beginIdx;
    }

    public int getEndIdx() {
        return endIdx;
    }

    public int getOpenIdx() {
        return openIdx;
    }

    public int getCloseIdx() {
        return closeIdx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MethodBlock)) {
            return false;
        }
        MethodBlock other = (MethodBlock) o;
        return beginIdx == other.beginIdx && endIdx == other.endIdx && openIdx == other.openIdx
                && closeIdx == other.closeIdx && methodId.equals(other.methodId)
                && Objects.equals(descriptor, other.descriptor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(methodId, descriptor, beginIdx, endIdx, openIdx, closeIdx);
    }

    @Override
    public String toString() {
        return methodId + "[open=" + openIdx + ", begin=" + beginIdx + ", end=" + endIdx + ", close=" + closeIdx + "]";
    }
}
