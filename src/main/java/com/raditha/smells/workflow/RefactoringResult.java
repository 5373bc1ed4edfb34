package com.raditha.smells.workflow;

import com.raditha.smells.model.DuplicateBlockGroup;
import com.raditha.smells.model.DuplicateFunctionPair;
import com.raditha.smells.model.HelperFunction;
import com.raditha.smells.tree.SourceTree;

import java.util.List;

/**
 * Outcome of a refactoring run.
 *
 * @param tree             Final tree
 * @param refactoredText   Final source text
 * @param diff             Unified diff against the original text, empty when nothing changed
 * @param replacedFunctions Duplicate functions turned into delegates
 * @param skippedFunctions Duplicate functions that could not call their primary
 * @param helpers          Helpers extracted from duplicate blocks
 * @param skippedGroups    Block groups left alone because they overlapped earlier edits
 */
public record RefactoringResult(
        SourceTree tree,
        String refactoredText,
        String diff,
        List<DuplicateFunctionPair> replacedFunctions,
        List<DuplicateFunctionPair> skippedFunctions,
        List<HelperFunction> helpers,
        List<DuplicateBlockGroup> skippedGroups) {

    public boolean changed() {
        return !replacedFunctions.isEmpty() || !helpers.isEmpty();
    }

    public List<String> helperNames() {
        return helpers.stream().map(HelperFunction::name).toList();
    }
}
