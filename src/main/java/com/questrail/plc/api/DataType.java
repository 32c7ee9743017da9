package com.questrail.plc.api;

/**
 * Declared type of a Structured Text variable.
 *
 * <p>The keyword is the spelling used in declarations ({@code x : REAL;}).</p>
 */
public enum DataType
{
    BOOL("BOOL"),
    INT("INT"),
    REAL("REAL"),
    TIME("TIME");

    private final String keyword;

    DataType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a type keyword, or returns {@code null} if the word is not a type.
     */
    public static DataType fromKeyword(String word) {
        for (DataType t : values()) {
            if (t.keyword.equals(word)) {
                return t;
            }
        }
        return null;
    }
}
