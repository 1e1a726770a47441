package com.jpexs.decompiler.comb;

/**
 * Thrown when the structuring of a function breaks one of its internal
 * invariants.
 *
 * @author JPEXS
 */
public class RestructuringException extends RuntimeException {

    private final String functionName;

    public RestructuringException(String functionName, String message, Throwable cause) {
        super("Cannot restructure " + functionName + ": " + message, cause);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
