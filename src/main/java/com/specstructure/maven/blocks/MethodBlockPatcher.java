package com.specstructure.maven.blocks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the method blocks of a generated fragment into an existing spec.
 * <p>
 * Decisions for every selected method id are taken up front, so a conflict under
 * {@link ConflictPolicy#ERROR} aborts before anything changes. Operations then run in
 * fragment order and the target is re-extracted after each one.
 * <p>
 * A target method is found by its markers or, failing that, by a hand-written
 * {@code describe '<descriptor>'} block matching the fragment's {@code method} attribute.
 */
public class MethodBlockPatcher {

    private final PatchMode mode;
    private final ConflictPolicy conflictPolicy;

    public MethodBlockPatcher(PatchMode mode, ConflictPolicy conflictPolicy) {
        this.mode = mode;
        this.conflictPolicy = conflictPolicy;
    }

    private enum Action {
        INSERT,
        REPLACE,
        SKIP
    }

    private static final class Decision {
        private final Action action;
        private final String reason;

        private Decision(Action action, String reason) {
            this.action = action;
            this.reason = reason;
        }
    }

    /**
     * Applies fragment blocks to the target.
     *
     * @param targetLines     the existing spec (not modified)
     * @param fragmentLines   generated blocks, each wrapped in markers
     * @param onlyMethodIds   restrict to these ids; empty means every id in the fragment
     * @return the new buffer and the operation log
     * @throws ConflictException if an insert hits an existing block under {@link ConflictPolicy#ERROR}
     * @throws ApplyException    if a selected id is missing from the fragment, or a replace has no target
     */
    public PatchResult apply(List<String> targetLines, List<String> fragmentLines, List<String> onlyMethodIds)
            throws MarkerParseException, BlockParseException, ApplyException {
        Map<String, MethodBlock> sourceBlocks = MethodBlockExtractor.extract(fragmentLines);
        Map<String, MethodBlock> targetBlocks = targetBlocks(targetLines, sourceBlocks);

        List<String> selected = selectMethodIds(sourceBlocks, onlyMethodIds);

        Map<String, Decision> decisions = new LinkedHashMap<>();
        for (String methodId : selected) {
            decisions.put(methodId, decide(methodId, targetBlocks.containsKey(methodId)));
        }

        List<String> lines = new ArrayList<>(targetLines);
        List<PatchOperation> operations = new ArrayList<>();

        for (Map.Entry<String, Decision> entry : decisions.entrySet()) {
            String methodId = entry.getKey();
            Decision decision = entry.getValue();
            MethodBlock source = sourceBlocks.get(methodId);

            switch (decision.action) {
                case SKIP:
                    operations.add(new PatchOperation(methodId, PatchOperation.Status.SKIPPED, decision.reason));
                    break;
                case INSERT:
                    lines = insertBlock(lines, targetBlocks, fragmentLines, source);
                    operations.add(new PatchOperation(methodId, PatchOperation.Status.INSERTED, decision.reason));
                    break;
                case REPLACE:
                    lines = replaceBlock(lines, targetBlocks.get(methodId), fragmentLines, source);
                    operations.add(new PatchOperation(methodId, PatchOperation.Status.REPLACED, decision.reason));
                    break;
                default:
                    throw new ApplyException("Unknown action: " + decision.action);
            }

            if (decision.action != Action.SKIP) {
                targetBlocks = targetBlocks(lines, sourceBlocks);
            }
        }

        return new PatchResult(lines, mode, conflictPolicy, operations);
    }

    /**
     * Marker blocks of the target, plus hand-written describe blocks for fragment methods
     * that have no markers in the target yet.
     */
    static Map<String, MethodBlock> targetBlocks(List<String> lines, Map<String, MethodBlock> sourceBlocks)
            throws MarkerParseException, BlockParseException {
        Map<String, MethodBlock> markerBlocks = MethodBlockExtractor.extract(lines);

        Map<String, String> descriptors = new LinkedHashMap<>();
        for (MethodBlock source : sourceBlocks.values()) {
            if (!markerBlocks.containsKey(source.getMethodId())) {
                descriptors.put(source.getMethodId(), source.getDescriptor());
            }
        }

        Map<String, MethodBlock> blocks = new LinkedHashMap<>(DescribeBlockFinder.find(lines, descriptors));
        blocks.putAll(markerBlocks);
        return blocks;
    }

    private static List<String> selectMethodIds(Map<String, MethodBlock> sourceBlocks, List<String> onlyMethodIds)
            throws ApplyException {
        if (onlyMethodIds == null || onlyMethodIds.isEmpty()) {
            return new ArrayList<>(sourceBlocks.keySet());
        }

        Set<String> requested = new LinkedHashSet<>(onlyMethodIds);
        List<String> missing = new ArrayList<>();
        for (String methodId : requested) {
            if (!sourceBlocks.containsKey(methodId)) {
                missing.add(methodId);
            }
        }
        if (!missing.isEmpty()) {
            throw new ApplyException("Requested method_id(s) not found in blocks input: " + String.join(", ", missing));
        }

        // fragment order, not request order
        List<String> selected = new ArrayList<>();
        for (String methodId : sourceBlocks.keySet()) {
            if (requested.contains(methodId)) {
                selected.add(methodId);
            }
        }
        return selected;
    }

    private Decision decide(String methodId, boolean hasTarget) throws ApplyException {
        switch (mode) {
            case INSERT:
                if (!hasTarget) {
                    return new Decision(Action.INSERT, null);
                }
                switch (conflictPolicy) {
                    case OVERWRITE:
                        return new Decision(Action.REPLACE, PatchOperation.CONFLICT_OVERWRITE);
                    case SKIP:
                        return new Decision(Action.SKIP, PatchOperation.CONFLICT_SKIP);
                    default:
                        throw new ConflictException(methodId);
                }
            case REPLACE:
                if (!hasTarget) {
                    throw new ApplyException("Missing target block for replace: method_id=" + methodId);
                }
                return new Decision(Action.REPLACE, null);
            case UPSERT:
                return new Decision(hasTarget ? Action.REPLACE : Action.INSERT, null);
            default:
                throw new ApplyException("Unknown mode: " + mode);
        }
    }

    private static List<String> insertBlock(List<String> lines, Map<String, MethodBlock> targetBlocks,
            List<String> fragmentLines, MethodBlock source) throws ApplyException {
        int insertionIndex = insertionPoint(lines, targetBlocks);

        List<String> inserted = new ArrayList<>();
        inserted.add("");
        inserted.addAll(fragmentLines.subList(source.getOpenIdx(), source.getCloseIdx() + 1));

        List<String> result = new ArrayList<>(lines);
        result.addAll(insertionIndex, inserted);
        return result;
    }

    /**
     * After the last existing method block, or before the last bare {@code end} line
     * (the outer describe's closer) when the target has no blocks yet.
     */
    static int insertionPoint(List<String> lines, Map<String, MethodBlock> targetBlocks) throws ApplyException {
        if (!targetBlocks.isEmpty()) {
            int maxClose = -1;
            for (MethodBlock block : targetBlocks.values()) {
                maxClose = Math.max(maxClose, block.getCloseIdx());
            }
            return maxClose + 1;
        }

        for (int i = lines.size() - 1; i >= 0; i--) {
            if (MethodBlockExtractor.isCloser(lines.get(i))) {
                return i;
            }
        }
        throw new ApplyException("Cannot find insertion point: no 'end' found");
    }

    /**
     * Swaps the marker-delimited body; the target's own describe/end lines and anything
     * between them and the markers are left untouched. A target without markers has
     * everything between its describe and end lines replaced.
     */
    private static List<String> replaceBlock(List<String> lines, MethodBlock target, List<String> fragmentLines,
            MethodBlock source) {
        if (!target.isMarked()) {
            List<String> result = new ArrayList<>(lines.subList(0, target.getOpenIdx() + 1));
            result.addAll(fragmentLines.subList(source.getOpenIdx() + 1, source.getCloseIdx()));
            result.addAll(lines.subList(target.getCloseIdx(), lines.size()));
            return result;
        }
        List<String> result = new ArrayList<>(lines.subList(0, target.getBeginIdx()));
        result.addAll(fragmentLines.subList(source.getBeginIdx(), source.getEndIdx() + 1));
        result.addAll(lines.subList(target.getEndIdx() + 1, lines.size()));
        return result;
    }
}
