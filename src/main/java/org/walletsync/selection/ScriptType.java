package org.walletsync.selection;

/**
 * Input script types, with the virtual size one input of that type adds to a transaction.
 */
public enum ScriptType {
    LEGACY("legacy", 148.0),
    NESTED_SEGWIT("nested_segwit", 91.0),
    NATIVE_SEGWIT("native_segwit", 68.0),
    TAPROOT("taproot", 57.5);

    public final String id;
    public final double inputVBytes;

    ScriptType(String id, double inputVBytes) {
        this.id = id;
        this.inputVBytes = inputVBytes;
    }

    /** Returns script type with given id, defaulting to native segwit for unknown or null ids. */
    public static ScriptType fromId(String id) {
        for (ScriptType scriptType : values())
            if (scriptType.id.equals(id))
                return scriptType;

        return NATIVE_SEGWIT;
    }
}
