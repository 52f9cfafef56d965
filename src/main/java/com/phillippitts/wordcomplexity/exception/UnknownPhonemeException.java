package com.phillippitts.wordcomplexity.exception;

/**
 * Thrown when a symbol is not part of the ARPAbet inventory, or carries a stress digit
 * where none is allowed (consonants) or lacks one where it is required (vowels).
 */
public class UnknownPhonemeException extends WordComplexityException {

    private final String symbol;
    private final String reason;

    public UnknownPhonemeException(String symbol, String reason) {
        super("Unknown phoneme '" + symbol + "': " + reason);
        this.symbol = symbol;
        this.reason = reason;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getReason() {
        return reason;
    }
}
