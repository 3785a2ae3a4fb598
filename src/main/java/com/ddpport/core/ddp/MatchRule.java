package com.ddpport.core.ddp;

/**
 * How many of a category's known files must be present for the category to match.
 */
public enum MatchRule {
    /** At least one known file is present. */
    ANY_OVERLAP {
        @Override
        boolean accepts(int overlap, int knownFiles) {
            return overlap > 0;
        }
    },
    /** More than half of the known files are present. */
    MAJORITY_OVERLAP {
        @Override
        boolean accepts(int overlap, int knownFiles) {
            return overlap > 0 && overlap * 2 > knownFiles;
        }
    };

    abstract boolean accepts(int overlap, int knownFiles);
}
