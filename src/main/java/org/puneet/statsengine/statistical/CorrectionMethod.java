package org.puneet.statsengine.statistical;

/**
 * Multiple comparison correction methods
 */
public enum CorrectionMethod {
    BONFERRONI("Bonferroni"),
    HOLM_BONFERRONI("Holm-Bonferroni"),
    BENJAMINI_HOCHBERG("Benjamini-Hochberg (FDR)"),
    NONE("None");

    private final String displayName;

    CorrectionMethod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
